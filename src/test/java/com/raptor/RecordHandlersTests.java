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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Map;
import java.util.Set;

@ThreadSafe
public class RecordHandlersTests {
	@Test
	public void classRegistration() {
		RecordHandlers recordHandlers = RecordHandlers.fromClass(BlogPost.Record.class);

		Assertions.assertEquals(Set.of("findById", "all", "search", "new"), recordHandlers.getHandlersByName().keySet());
		Assertions.assertEquals(List.of("id"), recordHandlers.handlerNamed("findById").get().getParameterNames());
		Assertions.assertEquals(List.of(), recordHandlers.handlerNamed("all").get().getParameterNames());
		Assertions.assertEquals(List.of("params"), recordHandlers.handlerNamed("new").get().getParameterNames());
		Assertions.assertTrue(recordHandlers.handlerNamed("getTitle").isEmpty(), "Instance methods are not handlers");
	}

	@Test
	public void multiplePublicConstructorsLeaveNewUnroutable() {
		RecordHandlers recordHandlers = RecordHandlers.fromClass(TwoConstructors.class);

		Assertions.assertTrue(recordHandlers.handlerNamed("new").isEmpty());
		Assertions.assertTrue(recordHandlers.getUnroutableReasonsByName().containsKey("new"));
		Assertions.assertEquals(Set.of("findById"), recordHandlers.getHandlersByName().keySet());
	}

	@Test
	public void overloadedAndUnbindableMethodsDoNotBreakTheRest() {
		RecordHandlers recordHandlers = RecordHandlers.fromClass(MixedRecord.class);

		Assertions.assertEquals(Set.of("findById", "new"), recordHandlers.getHandlersByName().keySet());
		Assertions.assertEquals(Set.of("search", "main"), recordHandlers.getUnroutableReasonsByName().keySet());
		Assertions.assertTrue(recordHandlers.getUnroutableReasonsByName().get("search").contains("overloads 'search' 2 times"),
				recordHandlers.getUnroutableReasonsByName().get("search"));
	}

	@Test
	public void explicitRegistration() throws Exception {
		RecordHandlers recordHandlers = RecordHandlers.builder()
				.handler("findById", arguments -> "post " + arguments.get(0), "id")
				.handler(Handler.withVariadicParameters("all", arguments -> List.of()))
				.build();

		Assertions.assertEquals("post 5", recordHandlers.handlerNamed("findById").get().invoke(List.of(5L)));
		Assertions.assertTrue(recordHandlers.handlerNamed("all").get().isVariadic());
		Assertions.assertTrue(recordHandlers.handlerNamed("missing").isEmpty());
	}

	@Test
	public void duplicateNamesAreRejected() {
		RecordHandlers.Builder builder = RecordHandlers.builder()
				.handler("all", arguments -> List.of());

		Assertions.assertThrows(IllegalArgumentException.class, () -> builder.handler("all", arguments -> List.of()));
	}

	public static class TwoConstructors {
		public TwoConstructors() {}

		public TwoConstructors(String name) {}

		public static TwoConstructors findById(Long id) {
			return new TwoConstructors();
		}
	}

	public static class MixedRecord {
		public MixedRecord(Map<String, String> params) {}

		public static MixedRecord findById(Long id) {
			return new MixedRecord(Map.of());
		}

		public static List<MixedRecord> search(Map<String, String> params) {
			return List.of();
		}

		public static List<MixedRecord> search(Long limit, Map<String, String> params) {
			return List.of();
		}

		public static void main(String[] args) {}
	}
}
