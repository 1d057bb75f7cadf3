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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * A named, invocable unit of a resource's record, together with the parameter names used to infer its arguments.
 * <p>
 * Instances are built once, at registration time, via one of these factory methods:
 * <ul>
 *   <li>{@link #withParameters(String, List, Invoker)} (explicitly declared parameter names)</li>
 *   <li>{@link #withVariadicParameters(String, Invoker)} (accepts arbitrary arguments, always invoked with none)</li>
 *   <li>{@link #fromMethod(Method)} (a public static method, names read from {@code -parameters} metadata)</li>
 *   <li>{@link #fromConstructor(Constructor)} (a public constructor, names read from {@code -parameters} metadata)</li>
 * </ul>
 * <p>
 * Nothing is introspected per call: the parameter names captured here are all {@link ArgumentResolver} sees.
 */
@ThreadSafe
public final class Handler {
	@NonNull
	private final String name;
	@NonNull
	private final List<String> parameterNames;
	@NonNull
	private final Boolean variadic;
	@NonNull
	private final Invoker invoker;

	/**
	 * Vends a handler that requires a value for each of the given parameter names, in order.
	 *
	 * @param name           the handler name routes refer to, e.g. {@code findById}
	 * @param parameterNames the declared parameter names, in declaration order
	 * @param invoker        the function to invoke with the resolved arguments
	 * @return the handler
	 */
	@NonNull
	public static Handler withParameters(@NonNull String name,
																			 @NonNull List<String> parameterNames,
																			 @NonNull Invoker invoker) {
		requireNonNull(name);
		requireNonNull(parameterNames);
		requireNonNull(invoker);

		return new Handler(name, parameterNames, false, invoker);
	}

	/**
	 * Vends a handler that accepts arbitrary arguments.  Such a handler is always invoked with an empty argument list.
	 *
	 * @param name    the handler name routes refer to, e.g. {@code all}
	 * @param invoker the function to invoke
	 * @return the handler
	 */
	@NonNull
	public static Handler withVariadicParameters(@NonNull String name,
																							 @NonNull Invoker invoker) {
		requireNonNull(name);
		requireNonNull(invoker);

		return new Handler(name, List.of(), true, invoker);
	}

	/**
	 * Vends a handler backed by a public static method, named after the method.
	 * <p>
	 * A method whose only parameter is a varargs array is treated as variadic.  Otherwise a parameter named
	 * {@code params} must accept a {@link Map} and every other parameter must accept an integer path argument.
	 * {@link Long} arguments are narrowed to {@code int} where the method declares {@code int} or {@link Integer};
	 * a value out of {@code int} range fails with {@link IllegalPathArgumentException}.
	 *
	 * @param method the method to wrap
	 * @return the handler
	 * @throws IllegalArgumentException if the method is not public and static, parameter names were not compiled in
	 *                                  or a parameter type cannot receive its argument
	 */
	@NonNull
	public static Handler fromMethod(@NonNull Method method) {
		requireNonNull(method);

		if (!Modifier.isStatic(method.getModifiers()) || !Modifier.isPublic(method.getModifiers()))
			throw new IllegalArgumentException(format("Handler method must be public and static: %s", method));

		return fromExecutable(method.getName(), method, arguments -> method.invoke(null, arguments));
	}

	/**
	 * Vends a handler backed by a public constructor, named {@code new}.
	 * <p>
	 * Argument inference for the conventional {@code new} route therefore runs against the constructor's own
	 * declared parameters.
	 *
	 * @param constructor the constructor to wrap
	 * @return the handler
	 * @throws IllegalArgumentException if the constructor is not public, parameter names were not compiled in or a
	 *                                  parameter type cannot receive its argument
	 */
	@NonNull
	public static Handler fromConstructor(@NonNull Constructor<?> constructor) {
		requireNonNull(constructor);

		if (!Modifier.isPublic(constructor.getModifiers()))
			throw new IllegalArgumentException(format("Handler constructor must be public: %s", constructor));

		return fromExecutable(RouteKind.NEW.getDefaultHandlerName(), constructor, constructor::newInstance);
	}

	@NonNull
	private static Handler fromExecutable(@NonNull String name,
																				@NonNull Executable executable,
																				@NonNull ReflectiveCall reflectiveCall) {
		requireNonNull(name);
		requireNonNull(executable);
		requireNonNull(reflectiveCall);

		Parameter[] parameters = executable.getParameters();

		if (parameters.length == 1 && executable.isVarArgs()) {
			Class<?> componentType = parameters[0].getType().getComponentType();
			Object emptyVarargs = Array.newInstance(componentType, 0);

			return new Handler(name, List.of(), true, arguments -> invokeReflectively(executable, reflectiveCall, new Object[]{emptyVarargs}));
		}

		List<String> parameterNames = new ArrayList<>(parameters.length);

		for (Parameter parameter : parameters) {
			if (!parameter.isNamePresent())
				throw new IllegalArgumentException(format("Unable to automatically detect handler parameter names. "
						+ "You must compile with javac flag \"-parameters\" to preserve parameter names for reflection. Offending handler was %s", executable));

			verifyParameterType(parameter, executable);
			parameterNames.add(parameter.getName());
		}

		return new Handler(name, parameterNames, false, arguments -> {
			Object[] coercedArguments = new Object[parameters.length];

			for (int i = 0; i < parameters.length; i++)
				coercedArguments[i] = coerceArgument(arguments.get(i), parameters[i]);

			return invokeReflectively(executable, reflectiveCall, coercedArguments);
		});
	}

	private static void verifyParameterType(@NonNull Parameter parameter,
																					@NonNull Executable executable) {
		requireNonNull(parameter);
		requireNonNull(executable);

		Class<?> type = parameter.getType();

		if (ArgumentResolver.PARAMS_ARGUMENT_NAME.equals(parameter.getName())) {
			if (!type.isAssignableFrom(Map.class))
				throw new IllegalArgumentException(format("Parameter '%s' of handler %s receives the request parameters, so it must accept a %s, but it is declared as %s",
						parameter.getName(), executable, Map.class.getName(), type.getName()));

			return;
		}

		if (!(type == long.class || type == int.class || type == Integer.class || type.isAssignableFrom(Long.class)))
			throw new IllegalArgumentException(format("Parameter '%s' of handler %s receives an integer path argument, so it must be declared as "
					+ "long, %s, int or %s, but it is declared as %s", parameter.getName(), executable, Long.class.getName(), Integer.class.getName(), type.getName()));
	}

	@Nullable
	private static Object invokeReflectively(@NonNull Executable executable,
																					 @NonNull ReflectiveCall reflectiveCall,
																					 @NonNull Object[] arguments) throws Exception {
		try {
			return reflectiveCall.call(arguments);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();

			if (cause instanceof Exception exception)
				throw exception;
			if (cause instanceof Error error)
				throw error;

			throw e;
		} catch (IllegalAccessException | InstantiationException e) {
			throw new IllegalStateException(format("Unable to invoke handler %s", executable), e);
		}
	}

	@Nullable
	private static Object coerceArgument(@Nullable Object argument,
																			 @NonNull Parameter parameter) {
		requireNonNull(parameter);

		if (!(argument instanceof Long longArgument) || !(parameter.getType() == int.class || parameter.getType() == Integer.class))
			return argument;

		if (longArgument < Integer.MIN_VALUE || longArgument > Integer.MAX_VALUE)
			throw new IllegalPathArgumentException(format("Illegal value '%d' for path argument '%s'. The handler declares it as %s, which cannot hold it.",
					longArgument, parameter.getName(), parameter.getType().getSimpleName()), parameter.getName(), String.valueOf(longArgument));

		return longArgument.intValue();
	}

	private Handler(@NonNull String name,
									@NonNull List<String> parameterNames,
									@NonNull Boolean variadic,
									@NonNull Invoker invoker) {
		requireNonNull(name);
		requireNonNull(parameterNames);
		requireNonNull(variadic);
		requireNonNull(invoker);

		this.name = name;
		this.parameterNames = unmodifiableList(new ArrayList<>(parameterNames));
		this.variadic = variadic;
		this.invoker = invoker;
	}

	/**
	 * Invokes this handler with an already-resolved argument list.
	 *
	 * @param arguments the arguments, in {@link #getParameterNames()} order
	 * @return whatever the handler returns
	 * @throws Exception whatever the handler throws
	 */
	@Nullable
	public Object invoke(@NonNull List<Object> arguments) throws Exception {
		requireNonNull(arguments);
		return getInvoker().invoke(arguments);
	}

	@Override
	public String toString() {
		return format("%s{name=%s, parameterNames=%s, variadic=%s}", getClass().getSimpleName(),
				getName(), getParameterNames(), isVariadic());
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public List<String> getParameterNames() {
		return this.parameterNames;
	}

	/**
	 * Does this handler accept arbitrary arguments (and so is always invoked with none)?
	 */
	@NonNull
	public Boolean isVariadic() {
		return this.variadic;
	}

	@NonNull
	Invoker getInvoker() {
		return this.invoker;
	}

	/**
	 * The function a {@link Handler} calls with its resolved arguments.
	 */
	@FunctionalInterface
	public interface Invoker {
		@Nullable
		Object invoke(@NonNull List<Object> arguments) throws Exception;
	}

	@FunctionalInterface
	private interface ReflectiveCall {
		@Nullable
		Object call(@NonNull Object[] arguments) throws InvocationTargetException, IllegalAccessException, InstantiationException;
	}
}
