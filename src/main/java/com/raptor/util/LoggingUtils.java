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

package com.raptor.util;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.ILoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.LogManager.getLogManager;
import static org.slf4j.LoggerFactory.getILoggerFactory;

/**
 * Sends Raptor's {@code java.util.logging} output to SLF4J, configured from the same {@code raptor.properties}
 * file that {@link com.raptor.RaptorConfig#fromPropertiesFile(Path)} reads.
 * <p>
 * Recognized keys, all optional:
 * <ul>
 *   <li>{@value #LOGGING_CONFIGURATION_PROPERTY_NAME}: Logback configuration file, relative to the properties file's directory</li>
 *   <li>{@value #LOGGING_LEVEL_PROPERTY_NAME}: {@code java.util.logging} level name for the {@value #RAPTOR_LOGGER_NAME} logger, e.g. {@code FINE}</li>
 *   <li>{@value #LOGGING_DEBUG_PROPERTY_NAME}: {@code true} to print Logback's status messages if configuration had problems</li>
 * </ul>
 * Logback and {@code jul-to-slf4j} are optional dependencies: applications that call this class must provide them.
 */
@ThreadSafe
public final class LoggingUtils {
	@NonNull
	public static final String LOGGING_CONFIGURATION_PROPERTY_NAME = "raptor.logging.configuration";
	@NonNull
	public static final String LOGGING_LEVEL_PROPERTY_NAME = "raptor.logging.level";
	@NonNull
	public static final String LOGGING_DEBUG_PROPERTY_NAME = "raptor.logging.debug";
	@NonNull
	public static final String RAPTOR_LOGGER_NAME = "com.raptor";

	@NonNull
	private static final Object LOCK;
	// JUL holds loggers weakly, so a configured level would be lost without this reference
	@NonNull
	private static final Logger RAPTOR_LOGGER;

	@Nullable
	@GuardedBy("LOCK")
	private static List<Handler> removedRootHandlers;
	@Nullable
	@GuardedBy("LOCK")
	private static Level previousRaptorLevel;

	static {
		LOCK = new Object();
		RAPTOR_LOGGER = Logger.getLogger(RAPTOR_LOGGER_NAME);
	}

	private LoggingUtils() {
		// Non-instantiable
	}

	/**
	 * Bridges {@code java.util.logging} to SLF4J and applies the logging keys of the given properties file.
	 * Calling this again first undoes the previous call.
	 *
	 * @param propertiesFile the Raptor properties file
	 * @throws IllegalArgumentException if the properties file or the Logback configuration file it names cannot be
	 *                                  read, or the level name is not a {@code java.util.logging} level
	 * @throws IllegalStateException    if SLF4J is not bound to Logback or Logback rejects the configuration
	 */
	public static void initializeLogging(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);

		PropertiesFileReader propertiesFileReader = new PropertiesFileReader(propertiesFile);
		Optional<Path> logbackConfigurationFile = propertiesFileReader.optionalValueFor(LOGGING_CONFIGURATION_PROPERTY_NAME, Path.class)
				.map(path -> resolveAgainst(propertiesFile, path));
		Optional<Level> raptorLevel = propertiesFileReader.optionalValueFor(LOGGING_LEVEL_PROPERTY_NAME, String.class)
				.map(LoggingUtils::parseLevel);
		boolean debug = propertiesFileReader.optionalValueFor(LOGGING_DEBUG_PROPERTY_NAME, Boolean.class).orElse(false);

		logbackConfigurationFile.ifPresent(LoggingUtils::verifyConfigurationFile);

		synchronized (LOCK) {
			resetLogging();

			if (logbackConfigurationFile.isPresent())
				configureLogback(logbackConfigurationFile.get(), debug);

			Logger rootLogger = getLogManager().getLogger("");
			List<Handler> rootHandlers = new ArrayList<>(List.of(rootLogger.getHandlers()));

			for (Handler handler : rootHandlers)
				rootLogger.removeHandler(handler);

			SLF4JBridgeHandler.install();

			removedRootHandlers = rootHandlers;
			previousRaptorLevel = RAPTOR_LOGGER.getLevel();
			raptorLevel.ifPresent(RAPTOR_LOGGER::setLevel);
		}
	}

	/**
	 * Removes the SLF4J bridge and restores the root handlers and Raptor logger level that
	 * {@link #initializeLogging(Path)} replaced.  Does nothing if logging was not initialized.
	 */
	public static void resetLogging() {
		synchronized (LOCK) {
			if (removedRootHandlers == null)
				return;

			if (SLF4JBridgeHandler.isInstalled())
				SLF4JBridgeHandler.uninstall();

			Logger rootLogger = getLogManager().getLogger("");

			for (Handler handler : removedRootHandlers)
				rootLogger.addHandler(handler);

			RAPTOR_LOGGER.setLevel(previousRaptorLevel);

			removedRootHandlers = null;
			previousRaptorLevel = null;
		}
	}

	@NonNull
	public static Boolean isLoggingInitialized() {
		synchronized (LOCK) {
			return removedRootHandlers != null;
		}
	}

	@NonNull
	private static Path resolveAgainst(@NonNull Path propertiesFile,
																		 @NonNull Path path) {
		requireNonNull(propertiesFile);
		requireNonNull(path);

		if (path.isAbsolute())
			return path;

		Path directory = propertiesFile.toAbsolutePath().getParent();
		return directory == null ? path : directory.resolve(path);
	}

	@NonNull
	private static Level parseLevel(@NonNull String levelName) {
		requireNonNull(levelName);

		try {
			return Level.parse(levelName.trim().toUpperCase());
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException(format("Illegal value '%s' for property '%s'. Use a java.util.logging level such as INFO, FINE or FINER",
					levelName, LOGGING_LEVEL_PROPERTY_NAME), e);
		}
	}

	private static void verifyConfigurationFile(@NonNull Path logbackConfigurationFile) {
		requireNonNull(logbackConfigurationFile);

		if (!Files.exists(logbackConfigurationFile))
			throw new IllegalArgumentException(format(
					"Unable to initialize Logback logging. Could not find a configuration file at %s",
					logbackConfigurationFile.toAbsolutePath()));

		if (!Files.isRegularFile(logbackConfigurationFile))
			throw new IllegalArgumentException(format(
					"Unable to initialize Logback logging. The configuration path %s does not appear to be a regular file",
					logbackConfigurationFile.toAbsolutePath()));
	}

	private static void configureLogback(@NonNull Path logbackConfigurationFile,
																			 boolean debug) {
		requireNonNull(logbackConfigurationFile);

		ILoggerFactory loggerFactory = getILoggerFactory();

		if (!(loggerFactory instanceof LoggerContext))
			throw new IllegalStateException(format("Property '%s' requires SLF4J to be bound to Logback, but it is bound to %s",
					LOGGING_CONFIGURATION_PROPERTY_NAME, loggerFactory.getClass().getName()));

		LoggerContext loggerContext = (LoggerContext) loggerFactory;

		try {
			JoranConfigurator configurator = new JoranConfigurator();
			configurator.setContext(loggerContext);
			loggerContext.reset();
			configurator.doConfigure(logbackConfigurationFile.toFile());
		} catch (JoranException e) {
			throw new IllegalStateException(format("Unable to configure Logback logging from %s", logbackConfigurationFile), e);
		}

		if (debug)
			StatusPrinter.printInCaseOfErrorsOrWarnings(loggerContext);
	}
}
