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
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when a named path segment cannot be coerced to an integer identifier, e.g. {@code /posts/abc}
 * matched against {@code /posts/:id}.
 */
@NotThreadSafe
public final class IllegalPathArgumentException extends BadRequestException {
	@NonNull
	private final String pathArgumentName;
	@Nullable
	private final String pathArgumentValue;

	public IllegalPathArgumentException(@Nullable String message,
																			@NonNull String pathArgumentName,
																			@Nullable String pathArgumentValue) {
		super(message);
		this.pathArgumentName = requireNonNull(pathArgumentName);
		this.pathArgumentValue = pathArgumentValue;
	}

	public IllegalPathArgumentException(@Nullable String message,
																			@Nullable Throwable cause,
																			@NonNull String pathArgumentName,
																			@Nullable String pathArgumentValue) {
		super(message, cause);
		this.pathArgumentName = requireNonNull(pathArgumentName);
		this.pathArgumentValue = pathArgumentValue;
	}

	@NonNull
	public String getPathArgumentName() {
		return this.pathArgumentName;
	}

	@NonNull
	public Optional<String> getPathArgumentValue() {
		return Optional.ofNullable(this.pathArgumentValue);
	}
}
