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

import com.raptor.util.StringUtils;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

/**
 * Contract for a domain entity exposed through conventional {@code show}/{@code new}/{@code index} endpoints.
 * <p>
 * A resource supplies its record handlers and its two presenters.  Its name defaults to the underscored simple
 * name of the implementing class, so {@code BlogPost} is routed under {@code /blog_post}.
 * <p>
 * For example:
 * <pre>{@code
 * public class BlogPost implements Resource {
 *   public RecordHandlers getRecord() { return RecordHandlers.fromClass(BlogPostRecord.class); }
 *   public PresenterFactory getOnePresenter() { return BlogPostPresenter::new; }
 *   public PresenterFactory getManyPresenter() { return BlogPostsPresenter::new; }
 * }
 * }</pre>
 * <p>
 * {@link ResourceDescriptor#forResource(Resource)} reads each member once, at route-table construction time.
 */
public interface Resource {
	@Nullable
	RecordHandlers getRecord();

	@Nullable
	PresenterFactory getOnePresenter();

	@Nullable
	PresenterFactory getManyPresenter();

	@NonNull
	default String getResourceName() {
		return StringUtils.underscore(getClass().getSimpleName());
	}
}
