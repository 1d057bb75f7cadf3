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

import com.raptor.exception.MissingArgumentException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link ArgumentResolver}.
 * <p>
 * Variadic handlers get no arguments.  Otherwise every declared parameter must be satisfied, either by a path
 * argument of the same name or, for a parameter named {@code params}, by the request parameter map.
 */
@ThreadSafe
class DefaultArgumentResolver implements ArgumentResolver {
	@NonNull
	private static final DefaultArgumentResolver DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new DefaultArgumentResolver();
	}

	@NonNull
	public static DefaultArgumentResolver defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	@NonNull
	@Override
	public List<Object> resolve(@NonNull Handler handler,
															@NonNull Map<String, Long> pathArguments,
															@NonNull Map<String, String> parameters) {
		requireNonNull(handler);
		requireNonNull(pathArguments);
		requireNonNull(parameters);

		if (handler.isVariadic())
			return List.of();

		Map<String, Object> availableArguments = new HashMap<>(pathArguments);
		availableArguments.put(PARAMS_ARGUMENT_NAME, Collections.unmodifiableMap(parameters));

		List<Object> arguments = new ArrayList<>(handler.getParameterNames().size());

		for (String parameterName : handler.getParameterNames()) {
			if (!availableArguments.containsKey(parameterName))
				throw new MissingArgumentException(format("No value is available for parameter '%s' of handler '%s'. Available values are %s",
						parameterName, handler.getName(), availableArguments.keySet()), parameterName, handler.getName());

			arguments.add(availableArguments.get(parameterName));
		}

		return Collections.unmodifiableList(arguments);
	}
}
