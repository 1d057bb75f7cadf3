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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The registration surface handed to the block passed to {@link Router#forResource(Resource, RaptorConfig, java.util.function.Consumer)}.
 * <p>
 * Routes are kept in registration order, which is the order the router tries them in.  For example:
 * <pre>{@code
 * Router router = Router.forResource(new BlogPost(), config, routes -> {
 *   routes.newRecord();
 *   routes.show();
 *   routes.index("recent");
 * });
 * }</pre>
 * Handler names are checked against the resource's record as each route is registered.
 */
@NotThreadSafe
public final class RouteTable {
	@NonNull
	private final ResourceDescriptor resourceDescriptor;
	@NonNull
	private final RaptorConfig raptorConfig;
	@NonNull
	private final List<Route> routes;

	RouteTable(@NonNull ResourceDescriptor resourceDescriptor,
						 @NonNull RaptorConfig raptorConfig) {
		this.resourceDescriptor = requireNonNull(resourceDescriptor);
		this.raptorConfig = requireNonNull(raptorConfig);
		this.routes = new ArrayList<>();
	}

	/**
	 * Registers {@code /<resource>/:id}, handled by {@code findById}.
	 */
	@NonNull
	public RouteTable show() {
		return conventional(RouteKind.SHOW, null);
	}

	/**
	 * Registers {@code /<resource>/:id}, handled by the named handler.
	 */
	@NonNull
	public RouteTable show(@NonNull String handlerName) {
		requireNonNull(handlerName);
		return conventional(RouteKind.SHOW, handlerName);
	}

	/**
	 * Registers {@code /<resource>/new}, handled by the record's constructor.
	 */
	@NonNull
	public RouteTable newRecord() {
		return conventional(RouteKind.NEW, null);
	}

	/**
	 * Registers {@code /<resource>/new}, handled by the named handler.
	 */
	@NonNull
	public RouteTable newRecord(@NonNull String handlerName) {
		requireNonNull(handlerName);
		return conventional(RouteKind.NEW, handlerName);
	}

	/**
	 * Registers {@code /<resource>}, handled by {@code all}.
	 */
	@NonNull
	public RouteTable index() {
		return conventional(RouteKind.INDEX, null);
	}

	/**
	 * Registers {@code /<resource>}, handled by the named handler.
	 */
	@NonNull
	public RouteTable index(@NonNull String handlerName) {
		requireNonNull(handlerName);
		return conventional(RouteKind.INDEX, handlerName);
	}

	/**
	 * Registers a conventional route by operation name, for route tables driven by configuration.
	 *
	 * @param operation   {@code show}, {@code new} or {@code index}
	 * @param handlerName the handler to use, or {@code null} for the operation's default
	 * @return this route table
	 * @throws IllegalArgumentException if {@code operation} is not a conventional operation
	 */
	@NonNull
	public RouteTable conventional(@NonNull String operation,
																 @Nullable String handlerName) {
		requireNonNull(operation);

		RouteKind routeKind = RouteKind.conventionalForLabel(operation).orElseThrow(() ->
				new IllegalArgumentException(format("Unrecognized route operation '%s' for resource '%s'. Supported operations are %s",
						operation, getResourceDescriptor().getResourceName(),
						RouteKind.getConventionalRouteKinds().stream().map(RouteKind::getLabel).toList())));

		return conventional(routeKind, handlerName);
	}

	/**
	 * Registers a route with an explicit path, handler and kind, e.g.
	 * {@code route("/blog_post/:id/edit", "findById", RouteKind.withLabel("edit"))}.
	 */
	@NonNull
	public RouteTable route(@NonNull String pathTemplate,
													@NonNull String handlerName,
													@NonNull RouteKind routeKind) {
		requireNonNull(pathTemplate);
		requireNonNull(handlerName);
		requireNonNull(routeKind);

		getRoutes().add(Route.withComponents(PathTemplate.withTemplate(pathTemplate), handlerName, routeKind,
				getResourceDescriptor(), getRaptorConfig()));

		return this;
	}

	@NonNull
	private RouteTable conventional(@NonNull RouteKind routeKind,
																	@Nullable String handlerName) {
		requireNonNull(routeKind);

		String pathTemplate = routeKind.pathTemplateFor(getResourceDescriptor().getResourceName());
		return route(pathTemplate, handlerName == null ? routeKind.getDefaultHandlerName() : handlerName, routeKind);
	}

	@NonNull
	List<Route> toRoutes() {
		return Collections.unmodifiableList(new ArrayList<>(getRoutes()));
	}

	@NonNull
	public ResourceDescriptor getResourceDescriptor() {
		return this.resourceDescriptor;
	}

	@NonNull
	private RaptorConfig getRaptorConfig() {
		return this.raptorConfig;
	}

	@NonNull
	private List<Route> getRoutes() {
		return this.routes;
	}
}
