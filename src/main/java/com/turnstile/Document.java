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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An ordered mapping of named fields, suitable for serialization to a wire format by a {@link DocumentMarshaler}.
 * <p>
 * Values should be types the marshaler understands: {@link String}, {@link Number}, {@link Boolean}, {@link java.util.List},
 * nested {@link Map}s, or {@code null}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class Document {
	@NonNull
	private final Map<String, Object> fields;

	@NonNull
	public static Document empty() {
		return new Document();
	}

	private Document() {
		this.fields = new LinkedHashMap<>();
	}

	/**
	 * Sets a field, replacing any existing value while preserving the field's original position.
	 *
	 * @param name  the field name
	 * @param value the field value
	 * @return this document
	 */
	@NonNull
	public Document set(@NonNull String name,
											@Nullable Object value) {
		requireNonNull(name);
		this.fields.put(name, value);
		return this;
	}

	@NonNull
	public Optional<Object> get(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(this.fields.get(name));
	}

	@NonNull
	public Boolean contains(@NonNull String name) {
		requireNonNull(name);
		return this.fields.containsKey(name);
	}

	/**
	 * An unmodifiable view of this document's fields, in insertion order.
	 *
	 * @return the fields
	 */
	@NonNull
	public Map<String, Object> asMap() {
		return Collections.unmodifiableMap(this.fields);
	}

	@Override
	public String toString() {
		return format("%s{fields=%s}", getClass().getSimpleName(), this.fields);
	}
}
