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

import com.raptor.util.PropertiesFileReader;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Path;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Defines the collaborators shared by every route: how arguments are resolved and how presenters are rendered.
 * <p>
 * Threadsafe instances can be acquired via the {@link #builder()} factory method, via {@link #defaultInstance()},
 * or from a properties file via {@link #fromPropertiesFile(Path)}.
 */
@ThreadSafe
public final class RaptorConfig {
	/**
	 * Properties key for the classpath directory holding per-resource template directories.
	 */
	@NonNull
	public static final String TEMPLATE_ROOT_PROPERTY_NAME = "raptor.templates.root";
	/**
	 * Properties key for the suffix appended to template names.
	 */
	@NonNull
	public static final String TEMPLATE_SUFFIX_PROPERTY_NAME = "raptor.templates.suffix";

	@NonNull
	private final TemplateRenderer templateRenderer;
	@NonNull
	private final ArgumentResolver argumentResolver;

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	@NonNull
	public static RaptorConfig defaultInstance() {
		return builder().build();
	}

	/**
	 * Vends a configuration whose {@link MustacheTemplateRenderer} reads its template location from the given
	 * properties file; absent keys fall back to {@link MustacheTemplateRenderer#DEFAULT_TEMPLATE_ROOT} and
	 * {@link MustacheTemplateRenderer#DEFAULT_TEMPLATE_SUFFIX}.
	 *
	 * @param propertiesFile the properties file to read
	 * @return the configuration
	 * @throws IllegalArgumentException if the file does not exist or cannot be read
	 */
	@NonNull
	public static RaptorConfig fromPropertiesFile(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);

		PropertiesFileReader propertiesFileReader = new PropertiesFileReader(propertiesFile);
		String templateRoot = propertiesFileReader.optionalValueFor(TEMPLATE_ROOT_PROPERTY_NAME, String.class)
				.orElse(MustacheTemplateRenderer.DEFAULT_TEMPLATE_ROOT);
		String templateSuffix = propertiesFileReader.optionalValueFor(TEMPLATE_SUFFIX_PROPERTY_NAME, String.class)
				.orElse(MustacheTemplateRenderer.DEFAULT_TEMPLATE_SUFFIX);

		return builder()
				.templateRenderer(MustacheTemplateRenderer.withTemplateLocation(templateRoot, templateSuffix))
				.build();
	}

	private RaptorConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		this.templateRenderer = builder.templateRenderer != null ? builder.templateRenderer : TemplateRenderer.withDefaults();
		this.argumentResolver = builder.argumentResolver != null ? builder.argumentResolver : ArgumentResolver.defaultInstance();
	}

	/**
	 * Vends a mutable copy of this instance's configuration, suitable for building new instances.
	 *
	 * @return a mutable copy of this instance's configuration
	 */
	@NonNull
	public Builder copy() {
		return builder()
				.templateRenderer(getTemplateRenderer())
				.argumentResolver(getArgumentResolver());
	}

	@Override
	public String toString() {
		return format("%s{templateRenderer=%s, argumentResolver=%s}", getClass().getSimpleName(),
				getTemplateRenderer(), getArgumentResolver());
	}

	@NonNull
	public TemplateRenderer getTemplateRenderer() {
		return this.templateRenderer;
	}

	@NonNull
	public ArgumentResolver getArgumentResolver() {
		return this.argumentResolver;
	}

	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private TemplateRenderer templateRenderer;
		@Nullable
		private ArgumentResolver argumentResolver;

		private Builder() {
			// Use RaptorConfig.builder()
		}

		@NonNull
		public Builder templateRenderer(@Nullable TemplateRenderer templateRenderer) {
			this.templateRenderer = templateRenderer;
			return this;
		}

		@NonNull
		public Builder argumentResolver(@Nullable ArgumentResolver argumentResolver) {
			this.argumentResolver = argumentResolver;
			return this;
		}

		@NonNull
		public RaptorConfig build() {
			return new RaptorConfig(this);
		}
	}
}
