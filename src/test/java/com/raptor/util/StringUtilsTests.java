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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;

@ThreadSafe
public class StringUtilsTests {
	@Test
	public void underscore() {
		Assertions.assertEquals("blog_post", StringUtils.underscore("BlogPost"));
		Assertions.assertEquals("widget", StringUtils.underscore("Widget"));
		Assertions.assertEquals("html_page", StringUtils.underscore("HTMLPage"));
		Assertions.assertEquals("v2_report", StringUtils.underscore("V2Report"));
		Assertions.assertEquals("blog_post", StringUtils.underscore("com.example.BlogPost"));
		Assertions.assertEquals("blog_post", StringUtils.underscore("Admin::BlogPost"));
		Assertions.assertEquals("blog_post", StringUtils.underscore("Outer$BlogPost"));
		Assertions.assertEquals("blog_post", StringUtils.underscore(StringUtils.underscore("BlogPost")));
		Assertions.assertEquals("", StringUtils.underscore(""));
	}

	@Test
	public void blankStrings() {
		Assertions.assertTrue(StringUtils.isBlank(null));
		Assertions.assertTrue(StringUtils.isBlank(" \t"));
		Assertions.assertFalse(StringUtils.isBlank(" x "));

		Assertions.assertNull(StringUtils.trimToNull("   "));
		Assertions.assertEquals("x", StringUtils.trimToNull(" x "));
	}
}
