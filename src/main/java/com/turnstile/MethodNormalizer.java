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
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Applies method override and {@code HEAD}-to-{@code GET} rewriting to an inbound request.
 * <p>
 * HTML forms can only submit {@code GET} and {@code POST}, so a form may carry the method it really means in a field
 * (by default {@code _method}). If that field names a known {@link HttpMethod}, the request takes on that method.
 * <p>
 * The resulting method is remembered as the "original" method. If it is {@code HEAD}, the request is dispatched as
 * {@code GET} so that routes registered for {@code GET} serve it; the {@link ResponseFinalizer} later strips the body.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class MethodNormalizer {
	@NonNull
	public static final String DEFAULT_METHOD_OVERRIDE_FIELD_NAME;

	static {
		DEFAULT_METHOD_OVERRIDE_FIELD_NAME = "_method";
	}

	@NonNull
	private final String methodOverrideFieldName;

	public MethodNormalizer() {
		this(DEFAULT_METHOD_OVERRIDE_FIELD_NAME);
	}

	public MethodNormalizer(@NonNull String methodOverrideFieldName) {
		requireNonNull(methodOverrideFieldName);

		if (Utilities.trimAggressivelyToNull(methodOverrideFieldName) == null)
			throw new IllegalArgumentException("Method override field name cannot be blank");

		this.methodOverrideFieldName = methodOverrideFieldName;
	}

	@NonNull
	public MethodNormalization normalize(@NonNull Request request) {
		requireNonNull(request);

		Request normalizedRequest = request;
		String ignoredOverrideValue = null;
		Optional<String> overrideValue = request.getFormParameter(getMethodOverrideFieldName());

		if (overrideValue.isPresent()) {
			HttpMethod overrideMethod = HttpMethod.fromName(overrideValue.get()).orElse(null);

			if (overrideMethod == null)
				ignoredOverrideValue = overrideValue.get();
			else if (overrideMethod != request.getHttpMethod() && !request.getPath().equals("*"))
				normalizedRequest = request.copy().httpMethod(overrideMethod).finish();
		}

		HttpMethod originalMethod = normalizedRequest.getHttpMethod();

		if (originalMethod == HttpMethod.HEAD)
			normalizedRequest = normalizedRequest.copy().httpMethod(HttpMethod.GET).finish();

		return new MethodNormalization(normalizedRequest, originalMethod, ignoredOverrideValue);
	}

	@NonNull
	public String getMethodOverrideFieldName() {
		return this.methodOverrideFieldName;
	}

	@Override
	public String toString() {
		return format("%s{methodOverrideFieldName=%s}", getClass().getSimpleName(), getMethodOverrideFieldName());
	}
}
