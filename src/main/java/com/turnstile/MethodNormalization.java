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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The outcome of {@link MethodNormalizer#normalize(Request)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class MethodNormalization {
	@NonNull
	private final Request request;
	@NonNull
	private final HttpMethod originalMethod;
	@Nullable
	private final String ignoredOverrideValue;

	MethodNormalization(@NonNull Request request,
											@NonNull HttpMethod originalMethod,
											@Nullable String ignoredOverrideValue) {
		requireNonNull(request);
		requireNonNull(originalMethod);

		this.request = request;
		this.originalMethod = originalMethod;
		this.ignoredOverrideValue = ignoredOverrideValue;
	}

	/**
	 * The request to dispatch for the remainder of processing. Its method is never {@link HttpMethod#HEAD}.
	 *
	 * @return the normalized request
	 */
	@NonNull
	public Request getRequest() {
		return this.request;
	}

	/**
	 * The method after any override was applied but before {@code HEAD} was rewritten to {@code GET}.
	 *
	 * @return the method the client asked for
	 */
	@NonNull
	public HttpMethod getOriginalMethod() {
		return this.originalMethod;
	}

	/**
	 * The override field's value, if it was present but did not name a known method.
	 *
	 * @return the ignored value, if any
	 */
	@NonNull
	public Optional<String> getIgnoredOverrideValue() {
		return Optional.ofNullable(this.ignoredOverrideValue);
	}

	@Override
	public String toString() {
		return format("%s{request=%s, originalMethod=%s}", getClass().getSimpleName(), getRequest(), getOriginalMethod());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof MethodNormalization methodNormalization))
			return false;

		return Objects.equals(getRequest(), methodNormalization.getRequest())
				&& Objects.equals(getOriginalMethod(), methodNormalization.getOriginalMethod())
				&& Objects.equals(getIgnoredOverrideValue(), methodNormalization.getIgnoredOverrideValue());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getRequest(), getOriginalMethod(), getIgnoredOverrideValue());
	}
}
