/*
 * Copyright 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.raptor;

import com.raptor.util.RequestUtils;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An inbound request as handed over by the transport: a path and a flat, single-valued map of parameters
 * (query string and form body merged).
 * <p>
 * Instances are built via {@link #withPath(String)} when the parameters are already known, or via
 * {@link #withRawUrl(String)} to parse them out of a URL and optional form body.
 */
@ThreadSafe
public final class Request {
	@NonNull
	private final String path;
	@NonNull
	private final Map<String, String> parameters;
	@Nullable
	private final String rawQuery;

	/**
	 * Acquires a builder for a request whose path is known and whose parameters are supplied explicitly.
	 *
	 * @param path the request path, e.g. {@code /blog_post/42}
	 * @return the builder
	 */
	@NonNull
	public static PathBuilder withPath(@NonNull String path) {
		requireNonNull(path);
		return new PathBuilder(path);
	}

	/**
	 * Acquires a builder for a request that parses its parameters from the given URL's query string, e.g.
	 * {@code /blog_post?q=hello}.
	 *
	 * @param rawUrl the request path plus optional query string
	 * @return the builder
	 */
	@NonNull
	public static RawBuilder withRawUrl(@NonNull String rawUrl) {
		requireNonNull(rawUrl);
		return new RawBuilder(rawUrl);
	}

	private Request(@NonNull String path,
									@NonNull Map<String, String> parameters,
									@Nullable String rawQuery) {
		requireNonNull(path);
		requireNonNull(parameters);

		this.path = PathTemplate.normalizePath(path);
		this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
		this.rawQuery = rawQuery;
	}

	@Override
	public String toString() {
		return format("%s{path=%s, parameters=%s}", getClass().getSimpleName(), getPath(), getParameters());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Request request))
			return false;

		return Objects.equals(getPath(), request.getPath())
				&& Objects.equals(getParameters(), request.getParameters());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getPath(), getParameters());
	}

	/**
	 * The normalized request path, without query string.
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	/**
	 * All request parameters, query string and form body merged; body values win over query values.
	 */
	@NonNull
	public Map<String, String> getParameters() {
		return this.parameters;
	}

	@NonNull
	public Optional<String> getParameter(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(getParameters().get(name));
	}

	/**
	 * The undecoded query string, if the request was built from a raw URL that had one.
	 */
	@NonNull
	public Optional<String> getRawQuery() {
		return Optional.ofNullable(this.rawQuery);
	}

	@NotThreadSafe
	public static final class PathBuilder {
		@NonNull
		private final String path;
		@Nullable
		private Map<String, String> parameters;

		private PathBuilder(@NonNull String path) {
			this.path = requireNonNull(path);
		}

		@NonNull
		public PathBuilder parameters(@Nullable Map<String, String> parameters) {
			this.parameters = parameters;
			return this;
		}

		@NonNull
		public Request build() {
			return new Request(this.path, this.parameters == null ? Map.of() : this.parameters, null);
		}
	}

	@NotThreadSafe
	public static final class RawBuilder {
		@NonNull
		private final String rawUrl;
		@Nullable
		private String formBody;

		private RawBuilder(@NonNull String rawUrl) {
			this.rawUrl = requireNonNull(rawUrl);
		}

		/**
		 * Supplies an {@code application/x-www-form-urlencoded} body whose parameters are merged over the query's.
		 */
		@NonNull
		public RawBuilder formBody(@Nullable String formBody) {
			this.formBody = formBody;
			return this;
		}

		@NonNull
		public Request build() {
			int queryIndex = this.rawUrl.indexOf('?');
			String path = queryIndex == -1 ? this.rawUrl : this.rawUrl.substring(0, queryIndex);
			String rawQuery = queryIndex == -1 ? null : this.rawUrl.substring(queryIndex + 1);

			Map<String, String> parameters = new LinkedHashMap<>(RequestUtils.parseParameters(rawQuery));
			parameters.putAll(RequestUtils.parseParameters(this.formBody));

			return new Request(path, parameters, rawQuery);
		}
	}
}
