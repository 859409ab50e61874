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

import java.util.Optional;

/**
 * Determines which {@link Handler}, if any, should handle a request.
 * <p>
 * Routing algorithms are the concern of implementations. The dispatcher only requires that:
 * <ul>
 *   <li>{@link #route(Request)} is safe to call concurrently for distinct requests</li>
 *   <li>no match is signaled by {@link Optional#empty()}, which is not an error - the dispatcher hands the request to its {@link FallbackHandler}</li>
 * </ul>
 * The dispatcher holds a non-owning reference to its router; the router's lifecycle is managed by the caller.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface Router {
	/**
	 * Finds the handler for the request's (already normalized) HTTP method and path.
	 *
	 * @param request the request to route
	 * @return the matching handler, or {@link Optional#empty()} if no route matches
	 */
	@NonNull
	Optional<Handler> route(@NonNull Request request);
}
