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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

/*
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RequestTests {
	@Test
	public void headers_are_case_insensitive() {
		Request request = Request.withPath(HttpMethod.GET, "/")
				.headers(Map.of("X-Request-Id", Set.of("abc")))
				.build();

		Assertions.assertEquals("abc", request.getHeader("x-request-id").orElse(null));
		Assertions.assertEquals("abc", request.getHeader("X-REQUEST-ID").orElse(null));
	}

	@Test
	public void form_parameters_are_parsed_from_urlencoded_body() {
		Request request = Request.withPath(HttpMethod.POST, "/")
				.headers(Map.of("Content-Type", Set.of("application/x-www-form-urlencoded; charset=UTF-8")))
				.body("name=J%C3%B6rg&tag=a&tag=b&bad=%zz".getBytes(StandardCharsets.UTF_8))
				.build();

		Assertions.assertEquals("Jörg", request.getFormParameter("name").orElse(null));
		Assertions.assertEquals(Set.of("a", "b"), request.getFormParameters().get("tag"));
		Assertions.assertFalse(request.getFormParameters().containsKey("bad"));
	}

	@Test
	public void explicit_form_parameters_win_over_body() {
		Request request = Request.withPath(HttpMethod.POST, "/")
				.headers(Map.of("Content-Type", Set.of("application/x-www-form-urlencoded")))
				.body("name=body".getBytes(StandardCharsets.UTF_8))
				.formParameters(Map.of("name", Set.of("explicit")))
				.build();

		Assertions.assertEquals("explicit", request.getFormParameter("name").orElse(null));
	}

	@Test
	public void prefers_media_type_uses_most_preferred_range() {
		Request browser = Request.withPath(HttpMethod.GET, "/")
				.headers(Map.of("Accept", Set.of("text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")))
				.build();

		Request apiClient = Request.withPath(HttpMethod.GET, "/")
				.headers(Map.of("Accept", Set.of("application/json, text/html;q=0.5")))
				.build();

		Assertions.assertTrue(browser.prefersMediaType("html"));
		Assertions.assertFalse(apiClient.prefersMediaType("html"));
		Assertions.assertFalse(Request.withPath(HttpMethod.GET, "/").build().prefersMediaType("html"));

		Request parameterizedHtml = Request.withPath(HttpMethod.GET, "/")
				.headers(Map.of("Accept", Set.of("application/json, text/html;level=1")))
				.build();

		Assertions.assertFalse(parameterizedHtml.prefersMediaType("html"));
	}

	@Test
	public void copy_preserves_id_and_replaces_method() {
		Request request = Request.withPath(HttpMethod.HEAD, "/users").build();
		Request copy = request.copy().httpMethod(HttpMethod.GET).finish();

		Assertions.assertEquals(request.getId(), copy.getId());
		Assertions.assertEquals(HttpMethod.GET, copy.getHttpMethod());
		Assertions.assertEquals(HttpMethod.HEAD, request.getHttpMethod());
	}

	@Test
	public void ids_are_unique_by_default() {
		Assertions.assertNotEquals(Request.withPath(HttpMethod.GET, "/").build().getId(),
				Request.withPath(HttpMethod.GET, "/").build().getId());
	}

	@Test
	public void invalid_paths_are_rejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> Request.withPath(HttpMethod.GET, "users").build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> Request.withPath(HttpMethod.GET, "/users?id=1").build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> Request.withPath(HttpMethod.GET, "*").build());
	}
}
