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

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINER;

/**
 * {@link TemplateRenderer} backed by mustache.java.
 * <p>
 * Templates are resolved against the classpath as {@code <templateRoot>/<resourceName>/<templateName><templateSuffix>}.
 * Compiled templates are cached by the underlying {@link MustacheFactory}.
 */
@ThreadSafe
public final class MustacheTemplateRenderer implements TemplateRenderer {
	@NonNull
	public static final String DEFAULT_TEMPLATE_ROOT = "views";
	@NonNull
	public static final String DEFAULT_TEMPLATE_SUFFIX = ".html.mustache";

	@NonNull
	private final String templateRoot;
	@NonNull
	private final String templateSuffix;
	@NonNull
	private final MustacheFactory mustacheFactory;
	@NonNull
	private final Logger logger = Logger.getLogger(MustacheTemplateRenderer.class.getName());

	@NonNull
	public static MustacheTemplateRenderer withDefaults() {
		return withTemplateLocation(DEFAULT_TEMPLATE_ROOT, DEFAULT_TEMPLATE_SUFFIX);
	}

	/**
	 * Vends a renderer for templates under the given classpath root, e.g. {@code views} and {@code .html.mustache}.
	 *
	 * @param templateRoot   classpath directory containing one directory per resource
	 * @param templateSuffix suffix appended to the template name
	 * @return the renderer
	 */
	@NonNull
	public static MustacheTemplateRenderer withTemplateLocation(@NonNull String templateRoot,
																															@NonNull String templateSuffix) {
		requireNonNull(templateRoot);
		requireNonNull(templateSuffix);

		return new MustacheTemplateRenderer(templateRoot, templateSuffix);
	}

	private MustacheTemplateRenderer(@NonNull String templateRoot,
																	 @NonNull String templateSuffix) {
		requireNonNull(templateRoot);
		requireNonNull(templateSuffix);

		this.templateRoot = templateRoot;
		this.templateSuffix = templateSuffix;
		this.mustacheFactory = new DefaultMustacheFactory(templateRoot);
	}

	@NonNull
	@Override
	public String render(@NonNull String resourceName,
											 @NonNull String templateName,
											 @NonNull Object presenter) {
		requireNonNull(resourceName);
		requireNonNull(templateName);
		requireNonNull(presenter);

		String templatePath = templatePathFor(resourceName, templateName);

		if (logger.isLoggable(FINER))
			logger.finer(format("Rendering %s/%s with %s", getTemplateRoot(), templatePath, presenter.getClass().getName()));

		Mustache mustache = getMustacheFactory().compile(templatePath);
		StringWriter writer = new StringWriter();

		try {
			mustache.execute(writer, presenter).flush();
		} catch (IOException e) {
			throw new UncheckedIOException(format("Unable to render template %s", templatePath), e);
		}

		return writer.toString();
	}

	/**
	 * The template's path relative to {@link #getTemplateRoot()}, e.g. {@code blog_post/show.html.mustache}.
	 */
	@NonNull
	public String templatePathFor(@NonNull String resourceName,
																@NonNull String templateName) {
		requireNonNull(resourceName);
		requireNonNull(templateName);

		return format("%s/%s%s", resourceName, templateName, getTemplateSuffix());
	}

	@Override
	public String toString() {
		return format("%s{templateRoot=%s, templateSuffix=%s}", getClass().getSimpleName(), getTemplateRoot(), getTemplateSuffix());
	}

	@NonNull
	public String getTemplateRoot() {
		return this.templateRoot;
	}

	@NonNull
	public String getTemplateSuffix() {
		return this.templateSuffix;
	}

	@NonNull
	private MustacheFactory getMustacheFactory() {
		return this.mustacheFactory;
	}
}
