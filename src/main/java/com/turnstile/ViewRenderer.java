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
 * Renders a failure as a markup (e.g. HTML) response for clients that prefer it.
 * <p>
 * Invoked by the {@link ErrorNormalizer} only when the request's most-preferred {@code Accept} media range mentions {@code html}.
 * The normalizer always applies {@code statusCode} to the returned response, so implementations need not.
 * <p>
 * A standard threadsafe implementation can be acquired via {@link #defaultInstance()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface ViewRenderer {
	/**
	 * Renders the failure.
	 *
	 * @param request    the request whose processing failed
	 * @param throwable  the failure
	 * @param statusCode the status code the client will receive
	 * @return a response whose body is the rendered document
	 * @throws Exception if rendering fails
	 */
	@NonNull
	Response render(@NonNull Request request,
									@NonNull Throwable throwable,
									@NonNull Integer statusCode) throws Exception;

	/**
	 * Acquires a threadsafe {@link ViewRenderer} that produces a minimal HTML error page.
	 *
	 * @return a {@code ViewRenderer} with default settings
	 */
	@NonNull
	static ViewRenderer defaultInstance() {
		return DefaultViewRenderer.defaultInstance();
	}
}
