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

/**
 * Wraps a handler's result in a presenter, the single object a template is rendered against.
 * <p>
 * A resource supplies two: one for a single record and one for a collection.  Presenter constructors make natural
 * implementations, e.g. {@code BlogPostPresenter::new}.
 */
@FunctionalInterface
public interface PresenterFactory {
	@NonNull
	Object present(@Nullable Object result);
}
