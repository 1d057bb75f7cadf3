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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.raptor.util.StringUtils.trimToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * What a route renders: its template name and whether its handler's result is presented as one record or many.
 * <p>
 * The conventional kinds are {@link #SHOW}, {@link #NEW} and {@link #INDEX}; each also knows its path template
 * format and default handler name.  Custom kinds are acquired via {@link #withLabel(String)} or
 * {@link #withLabel(String, Boolean)}.
 */
@ThreadSafe
public final class RouteKind {
	/**
	 * {@code /<resource>/:id}, handled by {@code findById}, presented singly.
	 */
	@NonNull
	public static final RouteKind SHOW;
	/**
	 * {@code /<resource>/new}, handled by the record's constructor ({@code new}), presented singly.
	 */
	@NonNull
	public static final RouteKind NEW;
	/**
	 * {@code /<resource>}, handled by {@code all}, presented as a collection.
	 */
	@NonNull
	public static final RouteKind INDEX;
	@NonNull
	private static final List<RouteKind> CONVENTIONAL_ROUTE_KINDS;

	static {
		SHOW = new RouteKind("show", false, "/%s/:id", "findById");
		NEW = new RouteKind("new", false, "/%s/new", "new");
		INDEX = new RouteKind("index", true, "/%s", "all");
		CONVENTIONAL_ROUTE_KINDS = List.of(SHOW, NEW, INDEX);
	}

	@NonNull
	private final String label;
	@NonNull
	private final Boolean plural;
	@Nullable
	private final String pathFormat;
	@Nullable
	private final String defaultHandlerName;

	/**
	 * Vends a custom kind that presents its handler's result singly.
	 *
	 * @param label the kind's label, which is also its template name, e.g. {@code edit}
	 * @return the route kind
	 */
	@NonNull
	public static RouteKind withLabel(@NonNull String label) {
		requireNonNull(label);
		return withLabel(label, false);
	}

	/**
	 * Vends a custom kind.
	 *
	 * @param label  the kind's label, which is also its template name, e.g. {@code recent}
	 * @param plural {@code true} to present the handler's result with the resource's many-presenter
	 * @return the route kind
	 */
	@NonNull
	public static RouteKind withLabel(@NonNull String label,
																		@NonNull Boolean plural) {
		requireNonNull(label);
		requireNonNull(plural);

		String normalizedLabel = trimToNull(label);

		if (normalizedLabel == null)
			throw new IllegalArgumentException("Route kind label must not be blank");

		return new RouteKind(normalizedLabel, plural, null, null);
	}

	/**
	 * Looks up a conventional kind by its label: {@code show}, {@code new} or {@code index}.
	 *
	 * @param label the label to look up
	 * @return the conventional kind, or {@link Optional#empty()} if the label is not a conventional one
	 */
	@NonNull
	public static Optional<RouteKind> conventionalForLabel(@NonNull String label) {
		requireNonNull(label);

		return CONVENTIONAL_ROUTE_KINDS.stream()
				.filter(routeKind -> routeKind.getLabel().equals(label))
				.findFirst();
	}

	@NonNull
	public static List<RouteKind> getConventionalRouteKinds() {
		return CONVENTIONAL_ROUTE_KINDS;
	}

	private RouteKind(@NonNull String label,
										@NonNull Boolean plural,
										@Nullable String pathFormat,
										@Nullable String defaultHandlerName) {
		this.label = requireNonNull(label);
		this.plural = requireNonNull(plural);
		this.pathFormat = pathFormat;
		this.defaultHandlerName = defaultHandlerName;
	}

	/**
	 * The conventional path template for the given resource name, e.g. {@code /blog_post/:id}.
	 *
	 * @throws IllegalStateException if this is a custom kind, which has no conventional path
	 */
	@NonNull
	public String pathTemplateFor(@NonNull String resourceName) {
		requireNonNull(resourceName);

		if (this.pathFormat == null)
			throw new IllegalStateException(format("Route kind '%s' has no conventional path", getLabel()));

		return format(this.pathFormat, resourceName);
	}

	@Override
	public String toString() {
		return format("%s{label=%s, plural=%s}", getClass().getSimpleName(), getLabel(), isPlural());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RouteKind routeKind))
			return false;

		return Objects.equals(getLabel(), routeKind.getLabel()) && Objects.equals(isPlural(), routeKind.isPlural());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getLabel(), isPlural());
	}

	@NonNull
	public String getLabel() {
		return this.label;
	}

	@NonNull
	public Boolean isPlural() {
		return this.plural;
	}

	@NonNull
	public Boolean isConventional() {
		return this.pathFormat != null;
	}

	/**
	 * The handler name a conventional route uses when none is given, e.g. {@code findById}.
	 *
	 * @throws IllegalStateException if this is a custom kind
	 */
	@NonNull
	public String getDefaultHandlerName() {
		if (this.defaultHandlerName == null)
			throw new IllegalStateException(format("Route kind '%s' has no default handler", getLabel()));

		return this.defaultHandlerName;
	}
}
