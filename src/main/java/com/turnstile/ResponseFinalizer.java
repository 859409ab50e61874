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

import static java.util.Objects.requireNonNull;

/**
 * Enforces {@code HEAD} semantics on the way out: if the client asked for {@code HEAD}, the body is replaced with an
 * empty one while status code and headers (including {@code Content-Type}) are kept.
 * <p>
 * Runs last on both the success and error paths.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ResponseFinalizer {
	@NonNull
	private static final ResponseFinalizer DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new ResponseFinalizer();
	}

	@NonNull
	public static ResponseFinalizer defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private ResponseFinalizer() {
		// Only one instance
	}

	@NonNull
	public Response finalizeResponse(@NonNull HttpMethod originalMethod,
																	 @NonNull Response response) {
		requireNonNull(originalMethod);
		requireNonNull(response);

		if (originalMethod != HttpMethod.HEAD)
			return response;

		byte[] body = response.getBody().orElse(null);

		if (body != null && body.length == 0)
			return response;

		return response.copy().body(Utilities.emptyByteArray()).finish();
	}
}
