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
import java.util.Optional;
import java.util.function.Consumer;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINER;

/**
 * The ordered routes of a single resource.
 * <p>
 * A request is handled by the first registered route whose template matches its path; there is no specificity
 * ranking.  If no route matches, {@link #call(Request)} throws {@link NoRouteMatchesException}.
 */
@ThreadSafe
public final class Router {
	@NonNull
	private final ResourceDescriptor resourceDescriptor;
	@NonNull
	private final List<Route> routes;
	@NonNull
	private final Logger logger = Logger.getLogger(Router.class.getName());

	/**
	 * Builds a router for {@code resource} using the default {@link RaptorConfig}.
	 *
	 * @see #forResource(Resource, RaptorConfig, Consumer)
	 */
	@NonNull
	public static Router forResource(@NonNull Resource resource,
																	 @NonNull Consumer<RouteTable> routeDeclarations) {
		requireNonNull(resource);
		requireNonNull(routeDeclarations);

		return forResource(resource, RaptorConfig.defaultInstance(), routeDeclarations);
	}

	/**
	 * Builds a router for {@code resource} by running {@code routeDeclarations} once against a fresh
	 * {@link RouteTable}.
	 *
	 * @param resource          the resource to route to
	 * @param raptorConfig      the collaborators every route will use
	 * @param routeDeclarations registers the resource's routes, in match order
	 * @return the router
	 * @throws com.raptor.exception.MissingResourceConventionException if the resource is incomplete or a route names
	 *                                                                   a missing handler
	 */
	@NonNull
	public static Router forResource(@NonNull Resource resource,
																	 @NonNull RaptorConfig raptorConfig,
																	 @NonNull Consumer<RouteTable> routeDeclarations) {
		requireNonNull(resource);
		requireNonNull(raptorConfig);
		requireNonNull(routeDeclarations);

		ResourceDescriptor resourceDescriptor = ResourceDescriptor.forResource(resource);
		RouteTable routeTable = new RouteTable(resourceDescriptor, raptorConfig);

		routeDeclarations.accept(routeTable);

		return new Router(resourceDescriptor, routeTable.toRoutes());
	}

	/**
	 * Vends a router over routes that were built elsewhere, e.g. via
	 * {@link Route#withComponents(PathTemplate, String, RouteKind, ResourceDescriptor, RaptorConfig)}.
	 */
	@NonNull
	public static Router withRoutes(@NonNull ResourceDescriptor resourceDescriptor,
																	@NonNull List<Route> routes) {
		requireNonNull(resourceDescriptor);
		requireNonNull(routes);

		return new Router(resourceDescriptor, List.copyOf(routes));
	}

	private Router(@NonNull ResourceDescriptor resourceDescriptor,
								 @NonNull List<Route> routes) {
		this.resourceDescriptor = requireNonNull(resourceDescriptor);
		this.routes = requireNonNull(routes);
	}

	/**
	 * Handles the request with the first matching route.
	 *
	 * @param request the request to handle
	 * @return the matching route's rendered output
	 * @throws NoRouteMatchesException if no route matches the request path
	 * @throws Exception whatever the matched handler throws, unchanged
	 */
	@NonNull
	public String call(@NonNull Request request) throws Exception {
		requireNonNull(request);
		return routeForPath(request.getPath()).call(request);
	}

	@NonNull
	public Boolean matches(@NonNull String path) {
		requireNonNull(path);
		return getRoutes().stream().anyMatch(route -> route.matches(path));
	}

	/**
	 * The first registered route whose template matches {@code path}.
	 *
	 * @throws NoRouteMatchesException if there is none
	 */
	@NonNull
	public Route routeForPath(@NonNull String path) {
		requireNonNull(path);

		Optional<Route> route = getRoutes().stream().filter(candidate -> candidate.matches(path)).findFirst();

		if (route.isEmpty())
			throw new NoRouteMatchesException(format("No route for resource '%s' matches %s",
					getResourceDescriptor().getResourceName(), path), path);

		if (logger.isLoggable(FINER))
			logger.finer(format("Found a matching route for %s: %s", path, route.get()));

		return route.get();
	}

	@Override
	public String toString() {
		return format("%s{resourceName=%s, routes=%s}", getClass().getSimpleName(), getResourceDescriptor().getResourceName(), getRoutes());
	}

	@NonNull
	public ResourceDescriptor getResourceDescriptor() {
		return this.resourceDescriptor;
	}

	@NonNull
	public List<Route> getRoutes() {
		return this.routes;
	}
}
