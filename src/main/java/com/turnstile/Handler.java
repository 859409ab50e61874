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
 * Produces a {@link Response} for a {@link Request}, or fails.
 * <p>
 * Handlers are supplied by a {@link Router} for matched routes, by {@link FallbackHandler} for unmatched ones,
 * and by {@link MiddlewareChain#chain(Handler)} as the composed "rest of the pipeline" passed to each {@link Middleware}.
 * <p>
 * Any exception thrown here is converted into a response by the {@link ErrorNormalizer}. Throw an {@link AbortException}
 * (or any exception implementing {@link Abortable}) to control the status code.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface Handler {
	/**
	 * Handles the request.
	 *
	 * @param request the request to handle
	 * @return the response to send to the client
	 * @throws Exception if the request could not be handled
	 */
	@NonNull
	Response handle(@NonNull Request request) throws Exception;
}
