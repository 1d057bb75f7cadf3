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

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINER;

/**
 * Binds one path template to one handler of a resource and to the template its result is rendered with.
 * <p>
 * Instances are normally created by {@link RouteTable}; {@link #withComponents(PathTemplate, String, RouteKind, ResourceDescriptor, RaptorConfig)}
 * is available for custom wiring.  A route holds no per-request state, so one instance serves concurrent requests.
 */
@ThreadSafe
public final class Route {
	@NonNull
	private final PathTemplate pathTemplate;
	@NonNull
	private final Handler handler;
	@NonNull
	private final RouteKind routeKind;
	@NonNull
	private final ResourceDescriptor resourceDescriptor;
	@NonNull
	private final ArgumentResolver argumentResolver;
	@NonNull
	private final TemplateRenderer templateRenderer;
	@NonNull
	private final Logger logger = Logger.getLogger(Route.class.getName());

	/**
	 * Vends a route given its components.
	 *
	 * @param pathTemplate       the path template, e.g. {@code /blog_post/:id}
	 * @param handlerName        the name of the resource's handler to invoke, e.g. {@code findById}
	 * @param routeKind          selects the presenter and the template
	 * @param resourceDescriptor the resource this route belongs to
	 * @param raptorConfig       supplies the argument resolver and template renderer
	 * @return the route
	 * @throws com.raptor.exception.MissingResourceConventionException if the resource has no handler named {@code handlerName}
	 */
	@NonNull
	public static Route withComponents(@NonNull PathTemplate pathTemplate,
																		 @NonNull String handlerName,
																		 @NonNull RouteKind routeKind,
																		 @NonNull ResourceDescriptor resourceDescriptor,
																		 @NonNull RaptorConfig raptorConfig) {
		requireNonNull(pathTemplate);
		requireNonNull(handlerName);
		requireNonNull(routeKind);
		requireNonNull(resourceDescriptor);
		requireNonNull(raptorConfig);

		return new Route(pathTemplate, resourceDescriptor.handlerNamed(handlerName), routeKind, resourceDescriptor,
				raptorConfig.getArgumentResolver(), raptorConfig.getTemplateRenderer());
	}

	private Route(@NonNull PathTemplate pathTemplate,
								@NonNull Handler handler,
								@NonNull RouteKind routeKind,
								@NonNull ResourceDescriptor resourceDescriptor,
								@NonNull ArgumentResolver argumentResolver,
								@NonNull TemplateRenderer templateRenderer) {
		this.pathTemplate = requireNonNull(pathTemplate);
		this.handler = requireNonNull(handler);
		this.routeKind = requireNonNull(routeKind);
		this.resourceDescriptor = requireNonNull(resourceDescriptor);
		this.argumentResolver = requireNonNull(argumentResolver);
		this.templateRenderer = requireNonNull(templateRenderer);
	}

	@NonNull
	public Boolean matches(@NonNull String path) {
		requireNonNull(path);
		return getPathTemplate().matches(path);
	}

	/**
	 * Handles a request whose path matches this route.
	 * <p>
	 * Resolves the handler's arguments, invokes it, wraps its result in the resource's one- or many-presenter and
	 * renders that presenter with the template named by this route's kind.
	 *
	 * @param request the request to handle
	 * @return the rendered output
	 * @throws IllegalArgumentException                            if the request path does not match this route
	 * @throws com.raptor.exception.IllegalPathArgumentException if a named path segment is not an integer
	 * @throws com.raptor.exception.MissingArgumentException     if a handler parameter cannot be satisfied
	 * @throws Exception                                           whatever the handler throws, unchanged
	 */
	@NonNull
	public String call(@NonNull Request request) throws Exception {
		requireNonNull(request);

		Map<String, Long> pathArguments = getPathTemplate().extractArguments(request.getPath());
		List<Object> arguments = getArgumentResolver().resolve(getHandler(), pathArguments, request.getParameters());

		if (logger.isLoggable(FINER))
			logger.finer(format("Invoking handler '%s' of resource '%s' with arguments %s", getHandler().getName(),
					getResourceDescriptor().getResourceName(), arguments));

		Object result = getHandler().invoke(arguments);
		Object presenter = presenterFactory().present(result);

		return getTemplateRenderer().render(getResourceDescriptor().getResourceName(), getRouteKind().getLabel(), presenter);
	}

	@NonNull
	private PresenterFactory presenterFactory() {
		return getRouteKind().isPlural() ? getResourceDescriptor().getManyPresenter() : getResourceDescriptor().getOnePresenter();
	}

	@Override
	public String toString() {
		return format("%s{pathTemplate=%s, handler=%s, routeKind=%s, resourceName=%s}", getClass().getSimpleName(),
				getPathTemplate().getTemplate(), getHandler().getName(), getRouteKind().getLabel(), getResourceDescriptor().getResourceName());
	}

	@NonNull
	public PathTemplate getPathTemplate() {
		return this.pathTemplate;
	}

	@NonNull
	public Handler getHandler() {
		return this.handler;
	}

	@NonNull
	public RouteKind getRouteKind() {
		return this.routeKind;
	}

	@NonNull
	public ResourceDescriptor getResourceDescriptor() {
		return this.resourceDescriptor;
	}

	@NonNull
	private ArgumentResolver getArgumentResolver() {
		return this.argumentResolver;
	}

	@NonNull
	private TemplateRenderer getTemplateRenderer() {
		return this.templateRenderer;
	}
}
