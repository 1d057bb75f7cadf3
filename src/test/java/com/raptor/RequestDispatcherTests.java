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

import com.raptor.exception.MissingArgumentException;
import com.raptor.exception.NoRouteMatchesException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

@ThreadSafe
public class RequestDispatcherTests {
	@Test
	public void laterRoutersHandleWhatEarlierRoutersCannot() throws Exception {
		RequestDispatcher requestDispatcher = RequestDispatcher.withRouters(blogPostRouter(), widgetRouter());

		Assertions.assertEquals("<h1>Post 1</h1>", requestDispatcher.call(Request.withPath("/blog_post/1").build()));
		Assertions.assertEquals("Widget 7", requestDispatcher.call(Request.withPath("/widget/7").build()));
	}

	@Test
	public void lastRouterFailureReachesTheCaller() {
		Router widgetRouter = widgetRouter();
		RequestDispatcher requestDispatcher = RequestDispatcher.withRouters(blogPostRouter(), widgetRouter);

		NoRouteMatchesException exception = Assertions.assertThrows(NoRouteMatchesException.class, () ->
				requestDispatcher.call(Request.withPath("/gadget/1").build()));

		Assertions.assertEquals("/gadget/1", exception.getPath());
		Assertions.assertTrue(exception.getMessage().contains("'widget'"), "Failure should come from the last router");
	}

	@Test
	public void firstMatchingRouterShortCircuits() throws Exception {
		AtomicInteger firstCalls = new AtomicInteger();
		AtomicInteger secondCalls = new AtomicInteger();

		RequestDispatcher requestDispatcher = RequestDispatcher.withRouters(List.of(
				countingRouter(firstCalls), countingRouter(secondCalls)));

		Assertions.assertEquals("Widget 5", requestDispatcher.call(Request.withPath("/widget/5").build()));
		Assertions.assertEquals(1, firstCalls.get());
		Assertions.assertEquals(0, secondCalls.get());
	}

	@Test
	public void otherFailuresAreNotRetried() {
		Router strictRouter = Router.forResource(new Widget(), routes ->
				routes.route("/widget/:widgetId", "findById", RouteKind.SHOW));

		RequestDispatcher requestDispatcher = RequestDispatcher.withRouters(strictRouter, widgetRouter());

		Assertions.assertThrows(MissingArgumentException.class, () ->
				requestDispatcher.call(Request.withPath("/widget/5").build()));
	}

	@Test
	public void singleRouterDispatchers() throws Exception {
		RequestDispatcher requestDispatcher = RequestDispatcher.withRouters(widgetRouter());

		Assertions.assertEquals("Widget 3", requestDispatcher.call(Request.withPath("/widget/3").build()));
		Assertions.assertThrows(NoRouteMatchesException.class, () -> requestDispatcher.call(Request.withPath("/blog_post/3").build()));
	}

	@Test
	public void atLeastOneRouterIsRequired() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> RequestDispatcher.withRouters(List.of()));
	}

	private Router blogPostRouter() {
		return Router.forResource(new BlogPost(), routes -> {
			routes.newRecord();
			routes.show();
			routes.index();
		});
	}

	private Router widgetRouter() {
		return Router.forResource(new Widget(), routes -> routes.show());
	}

	private Router countingRouter(AtomicInteger calls) {
		Resource resource = new Widget() {
			@Override
			public RecordHandlers getRecord() {
				return RecordHandlers.builder()
						.handler("findById", arguments -> {
							calls.incrementAndGet();
							return arguments.get(0);
						}, "id")
						.build();
			}

			@Override
			public String getResourceName() {
				return "widget";
			}
		};

		return Router.forResource(resource, routes -> routes.show());
	}
}
