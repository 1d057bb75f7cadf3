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
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.raptor.BlogPost;
import com.raptor.Request;
import com.raptor.RequestDispatcher;
import com.raptor.Router;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.slf4j.LoggerFactory.getILoggerFactory;

@NotThreadSafe
public class LoggingUtilsTests {
	@AfterEach
	public void reset() {
		LoggingUtils.resetLogging();
	}

	@Test
	public void dispatchLoggingReachesLogback(@TempDir Path directory) throws Exception {
		Files.writeString(directory.resolve("logback.xml"), """
				<configuration>
					<logger name="com.raptor" level="DEBUG"/>
					<root level="WARN"/>
				</configuration>
				""");
		Path propertiesFile = writeProperties(directory,
				"raptor.logging.configuration=logback.xml\nraptor.logging.level=FINE\nraptor.logging.debug=true\n");

		LoggingUtils.initializeLogging(propertiesFile);

		Assertions.assertTrue(LoggingUtils.isLoggingInitialized());
		Assertions.assertEquals(Level.FINE, Logger.getLogger(LoggingUtils.RAPTOR_LOGGER_NAME).getLevel());

		LoggerContext loggerContext = (LoggerContext) getILoggerFactory();
		ListAppender<ILoggingEvent> listAppender = new ListAppender<>();
		listAppender.setContext(loggerContext);
		listAppender.start();
		loggerContext.getLogger(LoggingUtils.RAPTOR_LOGGER_NAME).addAppender(listAppender);

		try {
			RequestDispatcher requestDispatcher = RequestDispatcher.withRouters(List.of(
					Router.forResource(new BlogPost(), routes -> routes.show())));

			requestDispatcher.call(Request.withPath("/blog_post/1").build());
		} finally {
			loggerContext.getLogger(LoggingUtils.RAPTOR_LOGGER_NAME).detachAppender(listAppender);
		}

		Assertions.assertTrue(listAppender.list.stream()
						.anyMatch(event -> event.getFormattedMessage().contains("to dispatch /blog_post/1")),
				"Dispatch timing should be bridged to Logback");
	}

	@Test
	public void resetRestoresHandlersAndLevel(@TempDir Path directory) throws IOException {
		Logger rootLogger = Logger.getLogger("");
		int rootHandlerCount = rootLogger.getHandlers().length;
		Level raptorLevel = Logger.getLogger(LoggingUtils.RAPTOR_LOGGER_NAME).getLevel();

		LoggingUtils.initializeLogging(writeProperties(directory, "raptor.logging.level=finer\n"));

		Assertions.assertEquals(Level.FINER, Logger.getLogger(LoggingUtils.RAPTOR_LOGGER_NAME).getLevel());

		LoggingUtils.resetLogging();

		Assertions.assertFalse(LoggingUtils.isLoggingInitialized());
		Assertions.assertEquals(rootHandlerCount, rootLogger.getHandlers().length);
		Assertions.assertEquals(raptorLevel, Logger.getLogger(LoggingUtils.RAPTOR_LOGGER_NAME).getLevel());
	}

	@Test
	public void badLoggingProperties(@TempDir Path directory) throws IOException {
		Assertions.assertThrows(IllegalArgumentException.class, () ->
				LoggingUtils.initializeLogging(writeProperties(directory, "raptor.logging.configuration=missing.xml\n")));
		Assertions.assertThrows(IllegalArgumentException.class, () ->
				LoggingUtils.initializeLogging(writeProperties(directory, "raptor.logging.configuration=.\n")));
		Assertions.assertThrows(IllegalArgumentException.class, () ->
				LoggingUtils.initializeLogging(writeProperties(directory, "raptor.logging.level=LOUD\n")));
		Assertions.assertFalse(LoggingUtils.isLoggingInitialized());
	}

	private Path writeProperties(Path directory, String contents) throws IOException {
		Path propertiesFile = directory.resolve("raptor.properties");
		Files.writeString(propertiesFile, contents);
		return propertiesFile;
	}
}
