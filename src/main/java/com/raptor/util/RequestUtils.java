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
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.raptor.util.StringUtils.trimToNull;
import static java.util.Objects.requireNonNull;

/**
 * Parsing helpers for the flat, single-valued parameter maps carried by {@link com.raptor.Request}.
 */
@ThreadSafe
public final class RequestUtils {
	private RequestUtils() {
		// Non-instantiable
	}

	/**
	 * Parses an {@code application/x-www-form-urlencoded} string, e.g. a URL query or a form body.
	 * <p>
	 * Names without a value map to the empty string.  When a name repeats, the last value wins.
	 *
	 * @param encodedParameters the encoded string, without a leading {@code ?}
	 * @return the decoded parameters in encounter order, or the empty map if there were none
	 */
	@NonNull
	public static Map<String, String> parseParameters(@Nullable String encodedParameters) {
		encodedParameters = trimToNull(encodedParameters);

		if (encodedParameters == null)
			return Collections.emptyMap();

		Map<String, String> parameters = new LinkedHashMap<>();

		for (String group : encodedParameters.split("&")) {
			int separatorIndex = group.indexOf('=');
			String name = trimToNull(urlDecode(separatorIndex == -1 ? group : group.substring(0, separatorIndex)));

			if (name == null)
				continue;

			String value = separatorIndex == -1 ? "" : urlDecode(group.substring(separatorIndex + 1));

			// Re-insert so iteration order reflects the winning occurrence
			parameters.remove(name);
			parameters.put(name, value);
		}

		return parameters;
	}

	@NonNull
	public static String urlDecode(@NonNull String string) {
		requireNonNull(string);
		return URLDecoder.decode(string, StandardCharsets.UTF_8);
	}
}
