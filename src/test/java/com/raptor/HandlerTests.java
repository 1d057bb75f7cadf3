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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@ThreadSafe
public class HandlerTests {
	@Test
	public void methodHandlersUseDeclaredParameterNames() throws Exception {
		Handler handler = Handler.fromMethod(Examples.class.getMethod("describe", Long.class, Map.class));

		Assertions.assertEquals("describe", handler.getName());
		Assertions.assertEquals(List.of("id", "params"), handler.getParameterNames());
		Assertions.assertFalse(handler.isVariadic());
		Assertions.assertEquals("3:{q=x}", handler.invoke(List.of(3L, Map.of("q", "x"))));
	}

	@Test
	public void integerArgumentsAreNarrowed() throws Exception {
		Handler handler = Handler.fromMethod(Examples.class.getMethod("twice", int.class));

		Assertions.assertEquals(84, handler.invoke(List.of(42L)));

		IllegalPathArgumentException exception = Assertions.assertThrows(IllegalPathArgumentException.class, () ->
				handler.invoke(List.of(Long.MAX_VALUE)));

		Assertions.assertEquals("value", exception.getPathArgumentName());
		Assertions.assertEquals(Optional.of("9223372036854775807"), exception.getPathArgumentValue());
	}

	@Test
	public void unbindableParameterTypesAreRejected() {
		IllegalArgumentException slug = Assertions.assertThrows(IllegalArgumentException.class, () ->
				Handler.fromMethod(Examples.class.getMethod("findBySlug", String.class)));
		Assertions.assertTrue(slug.getMessage().contains("slug"), slug.getMessage());

		Assertions.assertThrows(IllegalArgumentException.class, () ->
				Handler.fromMethod(Examples.class.getMethod("filter", String.class)));
		Assertions.assertThrows(IllegalArgumentException.class, () ->
				Handler.fromMethod(Examples.class.getMethod("findByShortId", short.class)));
	}

	@Test
	public void varargsMethodsAreVariadic() throws Exception {
		Handler handler = Handler.fromMethod(Examples.class.getMethod("count", Object[].class));

		Assertions.assertTrue(handler.isVariadic());
		Assertions.assertEquals(List.of(), handler.getParameterNames());
		Assertions.assertEquals(0, handler.invoke(List.of()));
	}

	@Test
	public void constructorsAreNamedNew() throws Exception {
		Handler handler = Handler.fromConstructor(Examples.class.getConstructor(Map.class));

		Assertions.assertEquals("new", handler.getName());
		Assertions.assertEquals(List.of("params"), handler.getParameterNames());
		Assertions.assertEquals("draft", ((Examples) handler.invoke(List.of(Map.of("name", "draft")))).getName());
	}

	@Test
	public void handlerExceptionsAreUnwrapped() throws Exception {
		Handler handler = Handler.fromMethod(Examples.class.getMethod("fail"));

		IOException exception = Assertions.assertThrows(IOException.class, () -> handler.invoke(List.of()));
		Assertions.assertEquals("disk full", exception.getMessage());
	}

	@Test
	public void instanceMethodsAreRejected() throws Exception {
		Assertions.assertThrows(IllegalArgumentException.class, () ->
				Handler.fromMethod(Examples.class.getMethod("getName")));
	}

	@Test
	public void explicitHandlers() throws Exception {
		Handler handler = Handler.withParameters("sum", List.of("a", "b"), arguments ->
				(Long) arguments.get(0) + (Long) arguments.get(1));

		Assertions.assertEquals(List.of("a", "b"), handler.getParameterNames());
		Assertions.assertEquals(5L, handler.invoke(List.of(2L, 3L)));
	}

	public static class Examples {
		private final String name;

		public Examples(Map<String, String> params) {
			this.name = params.get("name");
		}

		public static String describe(Long id, Map<String, String> params) {
			return id + ":" + params;
		}

		public static int twice(int value) {
			return value * 2;
		}

		public static String findBySlug(String slug) {
			return slug;
		}

		public static String filter(String params) {
			return params;
		}

		public static short findByShortId(short id) {
			return id;
		}

		public static int count(Object... arguments) {
			return arguments.length;
		}

		public static String fail() throws IOException {
			throw new IOException("disk full");
		}

		public String getName() {
			return this.name;
		}
	}
}
