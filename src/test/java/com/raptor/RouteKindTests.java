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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;

@ThreadSafe
public class RouteKindTests {
	@Test
	public void conventionalKinds() {
		Assertions.assertEquals("/widget/:id", RouteKind.SHOW.pathTemplateFor("widget"));
		Assertions.assertEquals("/widget/new", RouteKind.NEW.pathTemplateFor("widget"));
		Assertions.assertEquals("/widget", RouteKind.INDEX.pathTemplateFor("widget"));

		Assertions.assertFalse(RouteKind.SHOW.isPlural());
		Assertions.assertFalse(RouteKind.NEW.isPlural());
		Assertions.assertTrue(RouteKind.INDEX.isPlural());

		Assertions.assertSame(RouteKind.NEW, RouteKind.conventionalForLabel("new").orElse(null));
		Assertions.assertTrue(RouteKind.conventionalForLabel("edit").isEmpty());
	}

	@Test
	public void customKinds() {
		RouteKind routeKind = RouteKind.withLabel(" archive ", true);

		Assertions.assertEquals("archive", routeKind.getLabel());
		Assertions.assertTrue(routeKind.isPlural());
		Assertions.assertFalse(routeKind.isConventional());
		Assertions.assertEquals(routeKind, RouteKind.withLabel("archive", true));
		Assertions.assertThrows(IllegalStateException.class, () -> routeKind.pathTemplateFor("widget"));
		Assertions.assertThrows(IllegalStateException.class, routeKind::getDefaultHandlerName);
		Assertions.assertThrows(IllegalArgumentException.class, () -> RouteKind.withLabel("  "));
	}
}
