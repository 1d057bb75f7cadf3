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

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

import static com.raptor.util.StringUtils.isBlank;
import static com.raptor.util.StringUtils.trimToNull;
import static java.lang.String.format;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Reads a properties file from disk and converts its values to simple Java types.
 * <p>
 * Supported target types are {@link String}, {@link Boolean}, {@link Integer}, {@link Long} and {@link Path}.
 */
@ThreadSafe
public class PropertiesFileReader {
	@NonNull
	private static final Map<Class<?>, Function<String, Object>> CONVERTERS_BY_TYPE;

	static {
		Map<Class<?>, Function<String, Object>> convertersByType = new HashMap<>();
		convertersByType.put(String.class, value -> value);
		convertersByType.put(Boolean.class, Boolean::valueOf);
		convertersByType.put(Integer.class, Integer::valueOf);
		convertersByType.put(Long.class, Long::valueOf);
		convertersByType.put(Path.class, value -> Paths.get(value));

		CONVERTERS_BY_TYPE = unmodifiableMap(convertersByType);
	}

	@NonNull
	private final Map<String, String> properties;

	public PropertiesFileReader(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);
		this.properties = unmodifiableMap(new HashMap<>(loadPropertiesForPath(propertiesFile)));
	}

	@NonNull
	public <T> T valueFor(@NonNull String key,
												@NonNull Class<T> type) {
		requireNonNull(key);
		requireNonNull(type);

		String value = getProperties().get(key);

		if (isBlank(value))
			throw new IllegalStateException(format("No properties file value was found for key '%s'", key));

		return optionalValueFor(key, type).get();
	}

	@NonNull
	public <T> Optional<T> optionalValueFor(@NonNull String key,
																					@NonNull Class<T> type) {
		requireNonNull(key);
		requireNonNull(type);

		String value = trimToNull(getProperties().get(key));

		if (value == null)
			return Optional.empty();

		Function<String, Object> converter = CONVERTERS_BY_TYPE.get(type);

		if (converter == null)
			throw new IllegalArgumentException(format(
					"Not sure how to convert properties file value '%s' for key '%s' to requested type %s", value, key, type));

		try {
			return Optional.of(type.cast(converter.apply(value)));
		} catch (RuntimeException e) {
			throw new IllegalArgumentException(format("Unable to convert properties file value '%s' for key '%s' to requested type %s",
					value, key, type), e);
		}
	}

	@NonNull
	protected Map<String, String> loadPropertiesForPath(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);

		if (!Files.exists(propertiesFile))
			throw new IllegalArgumentException(format("Unable to find properties file at %s", propertiesFile.toAbsolutePath()));

		if (!Files.isRegularFile(propertiesFile))
			throw new IllegalArgumentException(format("Properties file at %s is not a regular file", propertiesFile.toAbsolutePath()));

		Properties properties = new Properties();

		try (InputStream inputStream = Files.newInputStream(propertiesFile);
				 Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
			properties.load(reader);
		} catch (Exception e) {
			throw new IllegalArgumentException(format("Invalid format for properties file at %s", propertiesFile.toAbsolutePath()), e);
		}

		Map<String, String> propertiesMap = new HashMap<>();

		for (String key : properties.stringPropertyNames())
			propertiesMap.put(key, properties.getProperty(key));

		return propertiesMap;
	}

	@NonNull
	public Map<String, String> getProperties() {
		return this.properties;
	}
}
