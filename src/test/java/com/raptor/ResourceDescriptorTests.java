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
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;

@ThreadSafe
public class ResourceDescriptorTests {
	@Test
	public void resourceNameIsDerivedFromTheTypeName() {
		ResourceDescriptor resourceDescriptor = ResourceDescriptor.forResource(new BlogPost());

		Assertions.assertEquals("blog_post", resourceDescriptor.getResourceName());
		Assertions.assertEquals("blog_post", ResourceDescriptor.forResource(new BlogPost()).getResourceName());
		Assertions.assertEquals("widget", ResourceDescriptor.forResource(new Widget()).getResourceName());
	}

	@Test
	public void resourceNameCanBeOverridden() {
		ResourceDescriptor resourceDescriptor = ResourceDescriptor.forResource(new BlogPost() {
			@Override
			public String getResourceName() {
				return "posts";
			}
		});

		Assertions.assertEquals("posts", resourceDescriptor.getResourceName());
	}

	@Test
	public void anonymousResourcesNeedAName() {
		MissingResourceConventionException exception = Assertions.assertThrows(MissingResourceConventionException.class, () ->
				ResourceDescriptor.forResource(new BlogPost() {}));

		Assertions.assertEquals("resourceName", exception.getConventionName());
	}

	@Test
	public void incompleteResourcesFailFast() {
		MissingResourceConventionException exception = Assertions.assertThrows(MissingResourceConventionException.class, () ->
				ResourceDescriptor.forResource(new Widget() {
					@Override
					public String getResourceName() {
						return "widget";
					}

					@Nullable
					@Override
					public PresenterFactory getManyPresenter() {
						return null;
					}
				}));

		Assertions.assertEquals("widget", exception.getResourceName());
		Assertions.assertEquals("manyPresenter", exception.getConventionName());
	}

	@Test
	public void missingRecordFailsFast() {
		MissingResourceConventionException exception = Assertions.assertThrows(MissingResourceConventionException.class, () ->
				ResourceDescriptor.forResource(new Widget() {
					@Override
					public String getResourceName() {
						return "widget";
					}

					@Nullable
					@Override
					public RecordHandlers getRecord() {
						return null;
					}
				}));

		Assertions.assertEquals("record", exception.getConventionName());
	}

	@Test
	public void handlerLookup() {
		ResourceDescriptor resourceDescriptor = ResourceDescriptor.forResource(new BlogPost());

		Assertions.assertEquals("findById", resourceDescriptor.handlerNamed("findById").getName());

		MissingResourceConventionException exception = Assertions.assertThrows(MissingResourceConventionException.class, () ->
				resourceDescriptor.handlerNamed("destroy"));

		Assertions.assertEquals("destroy", exception.getConventionName());
		Assertions.assertEquals("blog_post", exception.getResourceName());
	}
}
