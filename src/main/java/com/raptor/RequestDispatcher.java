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

import com.raptor.exception.NoRouteMatchesException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * Entry point for a host transport: hands each {@link Request} to its routers in registration order.
 * <p>
 * The first router with a matching route handles the request.  A router that has no matching route throws
 * {@link NoRouteMatchesException}, which is caught so the next router can try, except for the last router,
 * whose exception reaches the caller.
 */
@ThreadSafe
public final class RequestDispatcher {
	@NonNull
	private final List<Router> routers;
	@NonNull
	private final Logger logger = Logger.getLogger(RequestDispatcher.class.getName());

	@NonNull
	public static RequestDispatcher withRouters(@NonNull Router... routers) {
		requireNonNull(routers);
		return withRouters(List.of(routers));
	}

	/**
	 * Vends a dispatcher over the given routers, which are tried in list order.
	 *
	 * @throws IllegalArgumentException if {@code routers} is empty
	 */
	@NonNull
	public static RequestDispatcher withRouters(@NonNull List<Router> routers) {
		requireNonNull(routers);

		if (routers.isEmpty())
			throw new IllegalArgumentException("At least one router is required");

		return new RequestDispatcher(List.copyOf(routers));
	}

	private RequestDispatcher(@NonNull List<Router> routers) {
		this.routers = requireNonNull(routers);
	}

	/**
	 * Handles the request with the first router that has a matching route.
	 *
	 * @param request the request to handle
	 * @return the rendered output
	 * @throws NoRouteMatchesException if the last router has no matching route
	 * @throws Exception whatever the matched handler throws, unchanged
	 */
	@NonNull
	public String call(@NonNull Request request) throws Exception {
		requireNonNull(request);

		long time = System.nanoTime();

		try {
			return dispatch(request);
		} finally {
			if (logger.isLoggable(FINE))
				logger.fine(format("Took %.2fms to dispatch %s", (System.nanoTime() - time) / 1_000_000D, request.getPath()));
		}
	}

	@NonNull
	private String dispatch(@NonNull Request request) throws Exception {
		requireNonNull(request);

		List<Router> routers = getRouters();
		int lastIndex = routers.size() - 1;

		for (int i = 0; i < lastIndex; ++i) {
			Router router = routers.get(i);

			try {
				return router.call(request);
			} catch (NoRouteMatchesException e) {
				if (logger.isLoggable(FINE))
					logger.fine(format("Resource '%s' has no route for %s, trying the next resource",
							router.getResourceDescriptor().getResourceName(), request.getPath()));
			}
		}

		Router lastRouter = routers.get(lastIndex);

		try {
			return lastRouter.call(request);
		} catch (NoRouteMatchesException e) {
			if (logger.isLoggable(FINE))
				logger.fine(format("No resource has a route for %s", request.getPath()));

			throw e;
		}
	}

	@Override
	public String toString() {
		return format("%s{routers=%s}", getClass().getSimpleName(), getRouters());
	}

	@NonNull
	public List<Router> getRouters() {
		return this.routers;
	}
}
