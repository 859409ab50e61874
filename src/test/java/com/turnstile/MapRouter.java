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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Exact-match router keyed on method and path, for tests.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class MapRouter implements Router {
	@NonNull
	private final Map<String, Handler> handlersByRoute;

	MapRouter() {
		this.handlersByRoute = new ConcurrentHashMap<>();
	}

	@NonNull
	MapRouter register(@NonNull HttpMethod httpMethod,
										 @NonNull String path,
										 @NonNull Handler handler) {
		requireNonNull(httpMethod);
		requireNonNull(path);
		requireNonNull(handler);

		this.handlersByRoute.put(routeKey(httpMethod, path), handler);
		return this;
	}

	@NonNull
	@Override
	public Optional<Handler> route(@NonNull Request request) {
		requireNonNull(request);
		return Optional.ofNullable(this.handlersByRoute.get(routeKey(request.getHttpMethod(), request.getPath())));
	}

	@NonNull
	private static String routeKey(@NonNull HttpMethod httpMethod,
																 @NonNull String path) {
		return format("%s %s", httpMethod.name(), path);
	}
}
