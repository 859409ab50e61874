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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * {@link DocumentMarshaler} that writes UTF-8 JSON via a Jackson {@link ObjectMapper}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class JacksonDocumentMarshaler implements DocumentMarshaler {
	@NonNull
	private static final JacksonDocumentMarshaler DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new JacksonDocumentMarshaler(new ObjectMapper()
				.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS));
	}

	@NonNull
	private final ObjectMapper objectMapper;

	@NonNull
	public static JacksonDocumentMarshaler defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	/**
	 * Acquires a marshaler backed by the given mapper, e.g. one configured with custom modules.
	 * <p>
	 * The mapper must not be reconfigured after it is handed over.
	 *
	 * @param objectMapper the mapper to serialize with
	 * @return a marshaler backed by the mapper
	 */
	@NonNull
	public static JacksonDocumentMarshaler withObjectMapper(@NonNull ObjectMapper objectMapper) {
		requireNonNull(objectMapper);
		return new JacksonDocumentMarshaler(objectMapper);
	}

	private JacksonDocumentMarshaler(@NonNull ObjectMapper objectMapper) {
		requireNonNull(objectMapper);
		this.objectMapper = objectMapper;
	}

	@NonNull
	@Override
	public byte[] marshal(@NonNull Document document) throws Exception {
		requireNonNull(document);
		// Jackson always encodes byte output as UTF-8
		return this.objectMapper.writeValueAsBytes(document.asMap());
	}

	@NonNull
	@Override
	public String getContentType() {
		return "application/json; charset=UTF-8";
	}
}
