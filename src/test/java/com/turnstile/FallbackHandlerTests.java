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
import java.util.Set;

/*
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class FallbackHandlerTests {
	@Test
	public void standard_methods_are_not_found() {
		for (HttpMethod httpMethod : HttpMethod.standardMethods()) {
			AbortException abortException = Assertions.assertThrows(AbortException.class,
					() -> FallbackHandler.defaultInstance().handle(Request.withPath(httpMethod, "/missing").build()));

			Assertions.assertEquals(404, abortException.getStatusCode());
			Assertions.assertEquals("AbortException.notFound", abortException.getFullIdentifier());
		}
	}

	@Test
	public void options_allows_options() {
		Response response = FallbackHandler.defaultInstance().handle(Request.withPath(HttpMethod.OPTIONS, "/missing").build());

		Assertions.assertEquals(200, response.getStatusCode());
		Assertions.assertEquals(Set.of("OPTIONS"), response.getHeaders().get("Allow"));
		Assertions.assertEquals(0, response.getBody().orElseThrow().length);
	}

	@Test
	public void other_methods_are_not_implemented() {
		for (HttpMethod httpMethod : Set.of(HttpMethod.TRACE, HttpMethod.CONNECT)) {
			Response response = FallbackHandler.defaultInstance().handle(Request.withPath(httpMethod, "/missing").build());

			Assertions.assertEquals(501, response.getStatusCode());
			Assertions.assertEquals(0, response.getBody().orElseThrow().length);
		}
	}
}
