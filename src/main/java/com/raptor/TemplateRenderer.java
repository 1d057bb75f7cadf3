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

/**
 * Contract for rendering a presenter through the template belonging to a resource and route kind.
 * <p>
 * A standard threadsafe implementation backed by mustache.java is available via {@link #withDefaults()}.
 * Implementations must be safe for concurrent use, since every route shares one renderer.
 */
@FunctionalInterface
public interface TemplateRenderer {
	/**
	 * Renders the template identified by {@code resourceName} and {@code templateName} with {@code presenter} as its
	 * only bound value.
	 *
	 * @param resourceName the resource's underscored name, e.g. {@code blog_post}
	 * @param templateName the route kind's label, e.g. {@code show}
	 * @param presenter    the presenter whose members the template reads by name
	 * @return the rendered output
	 */
	@NonNull
	String render(@NonNull String resourceName,
								@NonNull String templateName,
								@NonNull Object presenter);

	/**
	 * Acquires a mustache.java renderer that reads templates from the classpath at
	 * {@code views/<resourceName>/<templateName>.html.mustache}.
	 * <p>
	 * This method is guaranteed to return a new instance.
	 *
	 * @return a renderer with default template locations
	 */
	@NonNull
	static TemplateRenderer withDefaults() {
		return MustacheTemplateRenderer.withDefaults();
	}
}
