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
import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An HTTP response, suitable for sending to clients over the wire: a status code, headers, and an optional body of bytes.
 * <p>
 * A response is produced by exactly one of a middleware short-circuit, a routed {@link Handler}, the {@link FallbackHandler},
 * or the {@link ErrorNormalizer}.
 * <p>
 * Instances can be acquired via the {@link #withStatusCode(Integer)} builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Response {
	@NonNull
	private final Integer statusCode;
	@NonNull
	private final Map<String, Set<String>> headers;
	@Nullable
	private final byte[] body;

	/**
	 * Acquires a builder for {@link Response} instances.
	 *
	 * @param statusCode the HTTP status code for this response
	 * @return the builder
	 */
	@NonNull
	public static Builder withStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	/**
	 * Vends a mutable copier seeded with this instance's data, suitable for building new instances.
	 *
	 * @return a copier for this instance
	 */
	@NonNull
	public Copier copy() {
		return new Copier(this);
	}

	protected Response(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.statusCode < 100 || builder.statusCode > 999)
			throw new IllegalArgumentException(format("Illegal HTTP status code %d", builder.statusCode));

		this.statusCode = builder.statusCode;
		this.headers = Utilities.caseInsensitiveHeaders(builder.headers);
		this.body = builder.body;
	}

	@Override
	public String toString() {
		return format("%s{statusCode=%s, headers=%s, body=%s}", getClass().getSimpleName(),
				getStatusCode(), getHeaders(), format("%d bytes", getBody().isPresent() ? getBody().get().length : 0));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Response response))
			return false;

		return Objects.equals(getStatusCode(), response.getStatusCode())
				&& Objects.equals(getHeaders(), response.getHeaders())
				&& Arrays.equals(this.body, response.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatusCode(), getHeaders(), Arrays.hashCode(this.body));
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	/**
	 * The HTTP headers to write for this response. Names are case-insensitive.
	 *
	 * @return the headers to write
	 */
	@NonNull
	public Map<String, Set<String>> getHeaders() {
		return this.headers;
	}

	/**
	 * Convenience method to access a header value when at most one is expected.
	 *
	 * @param name the header name, matched case-insensitively
	 * @return the first value for the header, or {@link Optional#empty()} if absent
	 */
	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);
		return Utilities.firstHeaderValue(getHeaders(), name);
	}

	/**
	 * The HTTP response body to write, if available - <em>callers should not modify this array</em>.
	 *
	 * @return the response body to write, or {@link Optional#empty()} if no body should be written
	 */
	@NonNull
	public Optional<byte[]> getBody() {
		return Optional.ofNullable(this.body);
	}

	/**
	 * Convenience method that decodes {@link #getBody()} as UTF-8 text.
	 *
	 * @return the body as a string, or {@link Optional#empty()} if there is no body
	 */
	@NonNull
	public Optional<String> getBodyAsString() {
		return getBody().map(body -> new String(body, StandardCharsets.UTF_8));
	}

	/**
	 * Builder used to construct instances of {@link Response} via {@link Response#withStatusCode(Integer)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private Integer statusCode;
		@Nullable
		private Map<String, Set<String>> headers;
		@Nullable
		private byte[] body;

		protected Builder(@NonNull Integer statusCode) {
			requireNonNull(statusCode);
			this.statusCode = statusCode;
		}

		@NonNull
		public Builder statusCode(@NonNull Integer statusCode) {
			requireNonNull(statusCode);
			this.statusCode = statusCode;
			return this;
		}

		@NonNull
		public Builder headers(@Nullable Map<String, Set<String>> headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		/**
		 * Convenience method that writes the string's bytes as the body and, unless one is already set, a matching {@code Content-Type} header.
		 *
		 * @param body        the textual body
		 * @param contentType the media type, e.g. {@code text/plain}
		 * @param charset     the charset used to encode the body
		 * @return this builder
		 */
		@NonNull
		public Builder body(@NonNull String body,
												@NonNull String contentType,
												@NonNull Charset charset) {
			requireNonNull(body);
			requireNonNull(contentType);
			requireNonNull(charset);

			Map<String, Set<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

			if (this.headers != null)
				headers.putAll(this.headers);

			headers.putIfAbsent("Content-Type", Set.of(format("%s; charset=%s", contentType, charset.name())));

			this.headers = headers;
			this.body = body.getBytes(charset);
			return this;
		}

		@NonNull
		public Response build() {
			return new Response(this);
		}
	}

	/**
	 * Builder used to copy instances of {@link Response} via {@link Response#copy()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Copier {
		@NonNull
		private final Builder builder;

		Copier(@NonNull Response response) {
			requireNonNull(response);

			Map<String, Set<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
			headers.putAll(response.getHeaders());

			this.builder = new Builder(response.getStatusCode())
					.headers(headers)
					.body(response.body);
		}

		@NonNull
		public Copier statusCode(@NonNull Integer statusCode) {
			requireNonNull(statusCode);
			this.builder.statusCode(statusCode);
			return this;
		}

		@NonNull
		public Copier headers(@Nullable Map<String, Set<String>> headers) {
			this.builder.headers(headers);
			return this;
		}

		// Convenience method for mutation
		@NonNull
		public Copier headers(@NonNull Consumer<Map<String, Set<String>>> headersConsumer) {
			requireNonNull(headersConsumer);

			if (this.builder.headers == null)
				this.builder.headers(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));

			headersConsumer.accept(this.builder.headers);
			return this;
		}

		@NonNull
		public Copier body(@Nullable byte[] body) {
			this.builder.body(body);
			return this;
		}

		@NonNull
		public Response finish() {
			return this.builder.build();
		}
	}
}
