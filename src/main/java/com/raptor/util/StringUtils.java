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

package com.raptor.util;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Locale;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * String helpers shared by request parsing, configuration and resource naming.
 */
@ThreadSafe
public final class StringUtils {
	@NonNull
	private static final Pattern NAMESPACE_SEPARATOR_PATTERN;
	@NonNull
	private static final Pattern ACRONYM_BOUNDARY_PATTERN;
	@NonNull
	private static final Pattern WORD_BOUNDARY_PATTERN;

	static {
		NAMESPACE_SEPARATOR_PATTERN = Pattern.compile("::|[.$]");
		ACRONYM_BOUNDARY_PATTERN = Pattern.compile("([A-Z]+)([A-Z][a-z])");
		WORD_BOUNDARY_PATTERN = Pattern.compile("([a-z\\d])([A-Z])");
	}

	private StringUtils() {
		// Non-instantiable
	}

	@NonNull
	public static Boolean isBlank(@Nullable String string) {
		return string == null || string.trim().length() == 0;
	}

	@Nullable
	public static String trimToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = string.trim();
		return string.length() == 0 ? null : string;
	}

	/**
	 * Converts a possibly-qualified type name to its lowercase, underscore-separated form.
	 * <p>
	 * Only the last segment after any {@code .}, {@code $} or {@code ::} separator is considered, so
	 * {@code com.example.BlogPost}, {@code Outer$BlogPost} and {@code Blog::BlogPost} all become {@code blog_post}.
	 * Uppercase runs are kept together: {@code HTMLPage} becomes {@code html_page}.
	 *
	 * @param typeName the type name to convert
	 * @return the underscored name
	 */
	@NonNull
	public static String underscore(@NonNull String typeName) {
		requireNonNull(typeName);

		String[] segments = NAMESPACE_SEPARATOR_PATTERN.split(typeName.trim());
		String simpleName = segments.length == 0 ? "" : segments[segments.length - 1];

		simpleName = ACRONYM_BOUNDARY_PATTERN.matcher(simpleName).replaceAll("$1_$2");
		simpleName = WORD_BOUNDARY_PATTERN.matcher(simpleName).replaceAll("$1_$2");

		return simpleName.toLowerCase(Locale.ENGLISH);
	}
}
