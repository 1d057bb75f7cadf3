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

import com.raptor.exception.IllegalPathArgumentException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;

/**
 * A route's path template, such as {@code /blog_post/:id}.
 * <p>
 * You may obtain instances via the {@link #withTemplate(String)} factory method.
 * <p>
 * A template is a sequence of {@code /}-delimited components, each of which is either literal text or a named
 * parameter marked with a leading {@code :}.  A named parameter spans its entire component and matches any
 * concrete value.  For example, the template {@code /blog_post/:id} matches {@code /blog_post/42} and extracts
 * {@code id=42}.
 * <p>
 * Matching is purely structural: a path matches only if it has exactly as many components as the template and
 * every literal component is equal.  There are no wildcards and no regular expressions.
 * <p>
 * Named parameters are integer identifiers.  {@link #extractArguments(String)} converts each to a {@link Long} and
 * fails with {@link IllegalPathArgumentException} if that is not possible.
 */
@ThreadSafe
public final class PathTemplate {
	@NonNull
	static final String NAMED_COMPONENT_PREFIX = ":";

	@NonNull
	private final String template;
	@NonNull
	private final List<Component> components;

	/**
	 * Vends an instance for the given template, for example {@code /blog_post/:id}.
	 *
	 * @param template a path template that may include {@code :name} components
	 * @return the compiled template
	 * @throws IllegalArgumentException if a named component has no name or a name is used more than once
	 */
	@NonNull
	public static PathTemplate withTemplate(@NonNull String template) {
		requireNonNull(template);
		return new PathTemplate(template);
	}

	private PathTemplate(@NonNull String template) {
		requireNonNull(template);

		this.template = normalizePath(template);

		List<Component> components = extractComponents(this.template).stream()
				.map(value -> value.startsWith(NAMED_COMPONENT_PREFIX)
						? new Component(value.substring(NAMED_COMPONENT_PREFIX.length()), ComponentType.NAMED)
						: new Component(value, ComponentType.LITERAL))
				.collect(toList());

		Set<String> names = new LinkedHashSet<>();

		for (Component component : components) {
			if (component.getType() != ComponentType.NAMED)
				continue;

			if (component.getValue().length() == 0)
				throw new IllegalArgumentException(format("Named component without a name in path template: %s", template));

			if (!names.add(component.getValue()))
				throw new IllegalArgumentException(format("Duplicate name '%s' in path template: %s", component.getValue(), template));
		}

		this.components = unmodifiableList(components);
	}

	/**
	 * Does the given path match this template?
	 * <p>
	 * For example, template {@code /blog_post/:id} would match {@code /blog_post/123} but not {@code /blog_post}
	 * or {@code /blog_post/123/edit}.
	 *
	 * @param path the concrete path to test
	 * @return {@code true} if the component counts are equal and every literal component is equal, {@code false} otherwise
	 */
	@NonNull
	public Boolean matches(@NonNull String path) {
		requireNonNull(path);

		List<String> pathComponents = extractComponents(normalizePath(path));

		if (pathComponents.size() != getComponents().size())
			return false;

		for (int i = 0; i < getComponents().size(); i++) {
			Component component = getComponents().get(i);

			if (component.getType() == ComponentType.LITERAL && !component.getValue().equals(pathComponents.get(i)))
				return false;
		}

		return true;
	}

	/**
	 * What are the integer values of this template's named components for the given path?
	 * <p>
	 * For example, extraction for template {@code /blog_post/:id} and path {@code /blog_post/42} would result in a
	 * value equivalent to {@code Map.of("id", 42L)}.
	 *
	 * @param path a concrete path that matches this template
	 * @return a mapping of names to values in template order, or the empty map if there are no named components
	 * @throws IllegalArgumentException     if the path does not match this template
	 * @throws IllegalPathArgumentException if a named component's value is not an integer
	 */
	@NonNull
	public Map<String, Long> extractArguments(@NonNull String path) {
		requireNonNull(path);

		if (!matches(path))
			throw new IllegalArgumentException(format("%s is not a match for %s so we cannot extract arguments", path, this));

		List<String> pathComponents = extractComponents(normalizePath(path));
		Map<String, Long> arguments = new LinkedHashMap<>();

		for (int i = 0; i < getComponents().size(); i++) {
			Component component = getComponents().get(i);

			if (component.getType() != ComponentType.NAMED)
				continue;

			String value = pathComponents.get(i);

			try {
				arguments.put(component.getValue(), Long.valueOf(value));
			} catch (NumberFormatException e) {
				throw new IllegalPathArgumentException(format("Illegal value '%s' for path argument '%s' of %s. An integer is required.",
						value, component.getValue(), getTemplate()), e, component.getValue(), value);
			}
		}

		return Collections.unmodifiableMap(arguments);
	}

	/**
	 * The names of this template's named components, in template order.
	 *
	 * @return the names, or the empty list if there are none
	 */
	@NonNull
	public List<String> getNames() {
		return getComponents().stream()
				.filter(component -> component.getType() == ComponentType.NAMED)
				.map(Component::getValue)
				.collect(toList());
	}

	@NonNull
	public String getTemplate() {
		return this.template;
	}

	@NonNull
	public List<Component> getComponents() {
		return this.components;
	}

	/**
	 * Trims, collapses duplicate slashes, ensures a leading slash and strips a trailing one.
	 */
	@NonNull
	static String normalizePath(@NonNull String path) {
		requireNonNull(path);

		path = path.trim();

		if (path.length() == 0)
			return "/";

		// Remove any duplicate slashes, e.g. //test///something -> /test/something
		path = path.replaceAll("(/)\\1+", "$1");

		if (!path.startsWith("/"))
			path = format("/%s", path);

		if ("/".equals(path))
			return path;

		if (path.endsWith("/"))
			path = path.substring(0, path.length() - 1);

		return path;
	}

	/**
	 * Assumes {@code path} is already normalized via {@link #normalizePath(String)}.
	 */
	@NonNull
	static List<String> extractComponents(@NonNull String path) {
		requireNonNull(path);

		if ("/".equals(path))
			return emptyList();

		// Strip off leading /
		return Arrays.asList(path.substring(1).split("/"));
	}

	@Override
	public String toString() {
		return format("%s{template=%s, components=%s}", getClass().getSimpleName(), getTemplate(), getComponents());
	}

	@ThreadSafe
	public static final class Component {
		@NonNull
		private final String value;
		@NonNull
		private final ComponentType type;

		private Component(@NonNull String value,
											@NonNull ComponentType type) {
			this.value = requireNonNull(value);
			this.type = requireNonNull(type);
		}

		@Override
		public String toString() {
			return format("%s{value=%s, type=%s}", getClass().getSimpleName(), getValue(), getType());
		}

		@NonNull
		public String getValue() {
			return this.value;
		}

		@NonNull
		public ComponentType getType() {
			return this.type;
		}
	}

	public enum ComponentType {
		LITERAL,
		NAMED
	}
}
