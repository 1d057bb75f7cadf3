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

package com.raptor.exception;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when a handler declares a parameter for which neither the path nor the request parameters
 * supply a value.
 */
@NotThreadSafe
public final class MissingArgumentException extends BadRequestException {
	@NonNull
	private final String argumentName;
	@NonNull
	private final String handlerName;

	public MissingArgumentException(@Nullable String message,
																	@NonNull String argumentName,
																	@NonNull String handlerName) {
		super(message);
		this.argumentName = requireNonNull(argumentName);
		this.handlerName = requireNonNull(handlerName);
	}

	@NonNull
	public String getArgumentName() {
		return this.argumentName;
	}

	@NonNull
	public String getHandlerName() {
		return this.handlerName;
	}
}
