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

import java.util.List;
import java.util.Map;

/**
 * Contract for assembling the ordered argument list a {@link Handler} is invoked with.
 * <p>
 * A standard threadsafe implementation is available via {@link #defaultInstance()}.  It binds by name only: each
 * declared parameter name is looked up among the path arguments and a single synthetic {@code params} entry holding
 * the full request parameter map.
 */
@FunctionalInterface
public interface ArgumentResolver {
	/**
	 * The parameter name under which a handler receives the whole request parameter map.
	 */
	@NonNull
	String PARAMS_ARGUMENT_NAME = "params";

	/**
	 * Resolves the arguments for {@code handler}.
	 *
	 * @param handler       the handler about to be invoked
	 * @param pathArguments integer arguments extracted from the request path, keyed by name
	 * @param parameters    the raw request parameters (query string and body)
	 * @return the arguments in the handler's declared parameter order
	 * @throws com.raptor.exception.MissingArgumentException if a declared parameter has no value
	 */
	@NonNull
	List<Object> resolve(@NonNull Handler handler,
											 @NonNull Map<String, Long> pathArguments,
											 @NonNull Map<String, String> parameters);

	/**
	 * Acquires a threadsafe {@link ArgumentResolver} with the standard name-keyed binding rules.
	 * <p>
	 * The returned instance is guaranteed to be a JVM-wide singleton.
	 *
	 * @return the default resolver
	 */
	@NonNull
	static ArgumentResolver defaultInstance() {
		return DefaultArgumentResolver.defaultInstance();
	}
}
