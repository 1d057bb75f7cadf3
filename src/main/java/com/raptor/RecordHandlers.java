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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The handler-bearing side of a {@link Resource}: an immutable table of {@link Handler}s keyed by name.
 * <p>
 * Tables are assembled explicitly via {@link #builder()} or, once at startup, from a class's public static methods
 * and public constructor via {@link #fromClass(Class)}.
 */
@ThreadSafe
public final class RecordHandlers {
	@NonNull
	private final Map<String, Handler> handlersByName;
	@NonNull
	private final Map<String, String> unroutableReasonsByName;

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Registers every public static method of {@code recordClass} under its method name and its public constructor
	 * under the name {@code new}.
	 * <p>
	 * Members that cannot serve as handlers do not prevent the rest of the class from registering.  This covers
	 * overloaded method names, more than one public constructor and parameters whose types cannot receive their
	 * arguments.  They are recorded in {@link #getUnroutableReasonsByName()} instead, and a route that names one
	 * fails at registration.
	 * <p>
	 * Requires the class to be compiled with {@code -parameters}.
	 *
	 * @param recordClass the class to inspect
	 * @return the handler table
	 */
	@NonNull
	public static RecordHandlers fromClass(@NonNull Class<?> recordClass) {
		requireNonNull(recordClass);

		Builder builder = builder();
		Map<String, List<Method>> methodsByName = new TreeMap<>();

		for (Method method : recordClass.getDeclaredMethods())
			if (Modifier.isPublic(method.getModifiers()) && Modifier.isStatic(method.getModifiers()) && !method.isSynthetic())
				methodsByName.computeIfAbsent(method.getName(), name -> new ArrayList<>()).add(method);

		for (Entry<String, List<Method>> entry : methodsByName.entrySet()) {
			String name = entry.getKey();
			List<Method> methods = entry.getValue();

			if (methods.size() > 1)
				builder.unroutable(name, format("%s overloads '%s' %d times, so a route cannot tell which one to invoke",
						recordClass.getName(), name, methods.size()));
			else
				registerIfUsable(builder, name, () -> Handler.fromMethod(methods.get(0)));
		}

		if (Modifier.isAbstract(recordClass.getModifiers()))
			return builder.build();

		Constructor<?>[] constructors = recordClass.getConstructors();
		String constructorHandlerName = RouteKind.NEW.getDefaultHandlerName();

		if (constructors.length > 1)
			builder.unroutable(constructorHandlerName, format("%s declares %d public constructors, but at most one can be registered as the '%s' handler",
					recordClass.getName(), constructors.length, constructorHandlerName));
		else if (constructors.length == 1)
			registerIfUsable(builder, constructorHandlerName, () -> Handler.fromConstructor(constructors[0]));

		return builder.build();
	}

	private static void registerIfUsable(@NonNull Builder builder,
																			 @NonNull String name,
																			 @NonNull Supplier<Handler> handlerSupplier) {
		requireNonNull(builder);
		requireNonNull(name);
		requireNonNull(handlerSupplier);

		Handler handler;

		try {
			handler = handlerSupplier.get();
		} catch (IllegalArgumentException e) {
			builder.unroutable(name, e.getMessage());
			return;
		}

		builder.handler(handler);
	}

	private RecordHandlers(@NonNull Builder builder) {
		requireNonNull(builder);

		this.handlersByName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.handlersByName));
		this.unroutableReasonsByName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.unroutableReasonsByName));
	}

	@NonNull
	public Optional<Handler> handlerNamed(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(getHandlersByName().get(name));
	}

	@NonNull
	public Map<String, Handler> getHandlersByName() {
		return this.handlersByName;
	}

	/**
	 * Names that exist on the record class but cannot be routed to, mapped to the reason.
	 */
	@NonNull
	public Map<String, String> getUnroutableReasonsByName() {
		return this.unroutableReasonsByName;
	}

	@Override
	public String toString() {
		return format("%s{handlerNames=%s, unroutableNames=%s}", getClass().getSimpleName(), getHandlersByName().keySet(),
				getUnroutableReasonsByName().keySet());
	}

	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Map<String, Handler> handlersByName;
		@NonNull
		private final Map<String, String> unroutableReasonsByName;

		private Builder() {
			this.handlersByName = new LinkedHashMap<>();
			this.unroutableReasonsByName = new LinkedHashMap<>();
		}

		/**
		 * Adds a handler under its own name.
		 *
		 * @throws IllegalArgumentException if a handler with the same name was already added
		 */
		@NonNull
		public Builder handler(@NonNull Handler handler) {
			requireNonNull(handler);

			Handler existingHandler = this.handlersByName.putIfAbsent(handler.getName(), handler);

			if (existingHandler != null)
				throw new IllegalArgumentException(format("More than one handler is named '%s'", handler.getName()));

			return this;
		}

		@NonNull
		public Builder handler(@NonNull String name,
													 Handler.@NonNull Invoker invoker,
													 @NonNull String... parameterNames) {
			requireNonNull(name);
			requireNonNull(invoker);
			requireNonNull(parameterNames);

			return handler(Handler.withParameters(name, List.of(parameterNames), invoker));
		}

		@NonNull
		Builder unroutable(@NonNull String name,
											 @NonNull String reason) {
			requireNonNull(name);
			requireNonNull(reason);

			this.unroutableReasonsByName.put(name, reason);
			return this;
		}

		@NonNull
		public RecordHandlers build() {
			return new RecordHandlers(this);
		}
	}
}
