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
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Handles requests for which the {@link Router} found no match.
 * <ul>
 *   <li>{@code GET}, {@code POST}, {@code PUT}, {@code PATCH} and {@code DELETE} throw {@link AbortException#notFound()}</li>
 *   <li>{@code OPTIONS} answers {@code 200} with header {@code Allow: OPTIONS} and an empty body</li>
 *   <li>anything else answers {@code 501 Not Implemented} with an empty body</li>
 * </ul>
 * A {@code HEAD} request has already been rewritten to {@code GET} by the {@link MethodNormalizer} when it gets here,
 * so it is treated as "not found".
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class FallbackHandler implements Handler {
	@NonNull
	private static final FallbackHandler DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new FallbackHandler();
	}

	@NonNull
	public static FallbackHandler defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private FallbackHandler() {
		// Only one instance
	}

	@NonNull
	@Override
	public Response handle(@NonNull Request request) {
		requireNonNull(request);

		HttpMethod httpMethod = request.getHttpMethod();

		if (HttpMethod.standardMethods().contains(httpMethod) || httpMethod == HttpMethod.HEAD)
			throw AbortException.notFound();

		if (httpMethod == HttpMethod.OPTIONS)
			return Response.withStatusCode(StatusCode.HTTP_200.getStatusCode())
					.headers(Map.of("Allow", Set.of(HttpMethod.OPTIONS.name())))
					.body(Utilities.emptyByteArray())
					.build();

		return Response.withStatusCode(StatusCode.HTTP_501.getStatusCode())
				.body(Utilities.emptyByteArray())
				.build();
	}
}
