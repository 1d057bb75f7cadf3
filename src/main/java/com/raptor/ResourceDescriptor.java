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

import com.raptor.exception.MissingResourceConventionException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;

import static com.raptor.util.StringUtils.trimToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A validated, read-only view of a {@link Resource}, shared by every {@link Route} built for it.
 * <p>
 * All conventions are checked when the descriptor is created, so a misdeclared resource fails at startup rather
 * than on its first request.
 */
@ThreadSafe
public final class ResourceDescriptor {
	@NonNull
	private final Resource resource;
	@NonNull
	private final String resourceName;
	@NonNull
	private final RecordHandlers record;
	@NonNull
	private final PresenterFactory onePresenter;
	@NonNull
	private final PresenterFactory manyPresenter;

	/**
	 * Wraps and validates the given resource.
	 *
	 * @param resource the resource to wrap
	 * @return the descriptor
	 * @throws MissingResourceConventionException if the resource's name is blank or its record or either presenter
	 *                                            is missing
	 */
	@NonNull
	public static ResourceDescriptor forResource(@NonNull Resource resource) {
		requireNonNull(resource);
		return new ResourceDescriptor(resource);
	}

	private ResourceDescriptor(@NonNull Resource resource) {
		requireNonNull(resource);

		String resourceName = trimToNull(resource.getResourceName());

		if (resourceName == null)
			throw new MissingResourceConventionException(format("Unable to derive a resource name for %s. "
					+ "Anonymous resources must override getResourceName()", resource.getClass().getName()),
					resource.getClass().getName(), "resourceName");

		this.resource = resource;
		this.resourceName = resourceName;
		this.record = require(resource.getRecord(), "record");
		this.onePresenter = require(resource.getOnePresenter(), "onePresenter");
		this.manyPresenter = require(resource.getManyPresenter(), "manyPresenter");
	}

	@NonNull
	private <T> T require(@Nullable T value,
												@NonNull String conventionName) {
		requireNonNull(conventionName);

		if (value == null)
			throw new MissingResourceConventionException(format("Resource '%s' (%s) does not provide its %s",
					getResourceName(), getResource().getClass().getName(), conventionName), getResourceName(), conventionName);

		return value;
	}

	/**
	 * Finds the named handler on this resource's record.
	 *
	 * @param handlerName the handler name, e.g. {@code findById}
	 * @return the handler
	 * @throws MissingResourceConventionException if the record has no such handler, or has one that cannot be routed to
	 */
	@NonNull
	public Handler handlerNamed(@NonNull String handlerName) {
		requireNonNull(handlerName);

		String unroutableReason = getRecord().getUnroutableReasonsByName().get(handlerName);

		if (unroutableReason != null)
			throw new MissingResourceConventionException(format("Resource '%s' cannot route to handler '%s': %s",
					getResourceName(), handlerName, unroutableReason), getResourceName(), handlerName);

		return getRecord().handlerNamed(handlerName).orElseThrow(() ->
				new MissingResourceConventionException(format("Resource '%s' has no handler named '%s'. Available handlers are %s",
						getResourceName(), handlerName, getRecord().getHandlersByName().keySet()), getResourceName(), handlerName));
	}

	@Override
	public String toString() {
		return format("%s{resourceName=%s, record=%s}", getClass().getSimpleName(), getResourceName(), getRecord());
	}

	@NonNull
	public Resource getResource() {
		return this.resource;
	}

	/**
	 * The lowercase, underscored name used in paths and template locations, e.g. {@code blog_post}.
	 */
	@NonNull
	public String getResourceName() {
		return this.resourceName;
	}

	@NonNull
	public RecordHandlers getRecord() {
		return this.record;
	}

	@NonNull
	public PresenterFactory getOnePresenter() {
		return this.onePresenter;
	}

	@NonNull
	public PresenterFactory getManyPresenter() {
		return this.manyPresenter;
	}
}
