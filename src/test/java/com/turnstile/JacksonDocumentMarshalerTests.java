/*
 * Copyright 2022-2026 Revetware LLC.
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

package com.turnstile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/*
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class JacksonDocumentMarshalerTests {
	@Test
	public void marshals_fields_in_insertion_order() throws Exception {
		Document document = Document.empty()
				.set("error", true)
				.set("reason", "Not Found")
				.set("metadata", Map.of("field", "email"))
				.set("possibleCauses", List.of("a", "b"));

		byte[] json = DocumentMarshaler.defaultInstance().marshal(document);

		Assertions.assertTrue(new String(json, StandardCharsets.UTF_8).startsWith("{\"error\":true,\"reason\":\"Not Found\""));

		JsonNode node = new ObjectMapper().readTree(json);
		Assertions.assertEquals("email", node.get("metadata").get("field").asText());
		Assertions.assertEquals(2, node.get("possibleCauses").size());
	}

	@Test
	public void replacing_a_field_keeps_its_position() {
		Document document = Document.empty()
				.set("error", true)
				.set("reason", "Forbidden")
				.set("metadata", Map.of())
				.set("reason", "No access to this project");

		Assertions.assertEquals(List.of("error", "reason", "metadata"), List.copyOf(document.asMap().keySet()));
		Assertions.assertEquals("No access to this project", document.get("reason").orElse(null));
	}

	@Test
	public void content_type_is_json() {
		Assertions.assertEquals("application/json; charset=UTF-8", DocumentMarshaler.defaultInstance().getContentType());
	}
}
