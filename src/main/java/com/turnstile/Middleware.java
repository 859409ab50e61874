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

import org.jspecify.annotations.NonNull;

/**
 * A cross-cutting request wrapper, e.g. authentication, rate limiting, or response header decoration.
 * <p>
 * Implementations continue dispatch by invoking {@code next.handle(request)} - possibly with a replacement request -
 * and may inspect or replace the resulting response. They may instead short-circuit by returning their own
 * {@link Response} or throwing, without calling through.
 * <pre>{@code Middleware poweredBy = (request, next) -> next.handle(request).copy()
 *   .headers(headers -> headers.put("X-Powered-By", Set.of("Turnstile")))
 *   .finish();}</pre>
 * <p>
 * Exceptions thrown by {@code next} propagate unmodified unless the middleware chooses to catch them and return a response.
 * <p>
 * Middleware instances are shared across concurrent dispatches; any mutable state they hold must be synchronized by the middleware itself.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface Middleware {
	/**
	 * Handles the request, usually by delegating to {@code next}.
	 *
	 * @param request the request that was received
	 * @param next    the remainder of the pipeline
	 * @return the response to send to the client
	 * @throws Exception if the request could not be handled
	 */
	@NonNull
	Response handle(@NonNull Request request,
									@NonNull Handler next) throws Exception;
}
