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
 * Exception thrown at route-table construction time when a resource does not provide something the routing
 * conventions need: its record handlers, one of its presenters, or a handler a route refers to by name.
 */
@NotThreadSafe
public final class MissingResourceConventionException extends RuntimeException {
	@NonNull
	private final String resourceName;
	@NonNull
	private final String conventionName;

	public MissingResourceConventionException(@Nullable String message,
																						@NonNull String resourceName,
																						@NonNull String conventionName) {
		super(message);
		this.resourceName = requireNonNull(resourceName);
		this.conventionName = requireNonNull(conventionName);
	}

	@NonNull
	public String getResourceName() {
		return this.resourceName;
	}

	/**
	 * The missing member, e.g. {@code onePresenter} or a handler name such as {@code findById}.
	 */
	@NonNull
	public String getConventionName() {
		return this.conventionName;
	}
}
