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
 * Serializes a {@link Document} to bytes for a response body.
 * <p>
 * A standard threadsafe JSON implementation can be acquired via {@link #defaultInstance()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface DocumentMarshaler {
	/**
	 * Serializes the document.
	 *
	 * @param document the document to serialize
	 * @return the serialized bytes
	 * @throws Exception if serialization fails
	 */
	@NonNull
	byte[] marshal(@NonNull Document document) throws Exception;

	/**
	 * The {@code Content-Type} header value for bytes produced by {@link #marshal(Document)}.
	 *
	 * @return the content type, e.g. {@code application/json; charset=UTF-8}
	 */
	@NonNull
	String getContentType();

	/**
	 * Acquires a threadsafe {@link DocumentMarshaler} that writes JSON using Jackson.
	 *
	 * @return a JSON {@code DocumentMarshaler}
	 */
	@NonNull
	static DocumentMarshaler defaultInstance() {
		return JacksonDocumentMarshaler.defaultInstance();
	}
}
