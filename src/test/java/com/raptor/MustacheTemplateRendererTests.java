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

import com.github.mustachejava.MustacheException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;

@ThreadSafe
public class MustacheTemplateRendererTests {
	@Test
	public void templatePaths() {
		MustacheTemplateRenderer templateRenderer = MustacheTemplateRenderer.withDefaults();

		Assertions.assertEquals("views", templateRenderer.getTemplateRoot());
		Assertions.assertEquals("blog_post/show.html.mustache", templateRenderer.templatePathFor("blog_post", "show"));
		Assertions.assertEquals("blog_post/show.txt", MustacheTemplateRenderer.withTemplateLocation("other", ".txt")
				.templatePathFor("blog_post", "show"));
	}

	@Test
	public void presenterMembersAreVisibleByName() {
		TemplateRenderer templateRenderer = TemplateRenderer.withDefaults();

		Assertions.assertEquals("<h1>Post 1</h1>", templateRenderer.render("blog_post", "show",
				new BlogPost.PresentsOne(BlogPost.Record.findById(1L))));
		Assertions.assertEquals("Widget 12", templateRenderer.render("widget", "show", Map.of("id", 12)));
	}

	@Test
	public void valuesAreHtmlEscaped() {
		Assertions.assertEquals("Widget &lt;b&gt;", TemplateRenderer.withDefaults().render("widget", "show", Map.of("id", "<b>")));
	}

	@Test
	public void missingTemplates() {
		Assertions.assertThrows(MustacheException.class, () ->
				TemplateRenderer.withDefaults().render("widget", "index", Map.of()));
	}
}
