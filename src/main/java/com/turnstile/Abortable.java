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

import java.util.Map;

/**
 * Capability for exceptions that carry an explicit HTTP status code, intended to be shown to the client - "not found", "validation failed", and so on.
 * <p>
 * When a handler or middleware throws an exception that implements this interface, the {@link ErrorNormalizer}
 * responds with {@link #getStatusCode()} instead of {@code 500}. Outside of {@link Environment#PRODUCTION},
 * {@link #getMetadata()} is included in the error document.
 * <p>
 * See {@link AbortException} for a ready-made implementation.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Abortable {
	@NonNull
	Integer getStatusCode();

	/**
	 * Arbitrary, serializable details about this failure, e.g. the name of an invalid field.
	 *
	 * @return the metadata, possibly empty
	 */
	@NonNull
	default Map<String, Object> getMetadata() {
		return Map.of();
	}
}
