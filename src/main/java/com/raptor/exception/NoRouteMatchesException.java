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
 * Exception thrown when none of a router's routes match a request path.
 * <p>
 * {@link com.raptor.RequestDispatcher} treats this as "try the next router"; only the last router's instance
 * reaches the caller.
 */
@NotThreadSafe
public final class NoRouteMatchesException extends RuntimeException {
	@NonNull
	private final String path;

	public NoRouteMatchesException(@Nullable String message,
																 @NonNull String path) {
		super(message);
		this.path = requireNonNull(path);
	}

	@NonNull
	public String getPath() {
		return this.path;
	}
}
