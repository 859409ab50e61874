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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static com.turnstile.Utilities.trimAggressivelyToEmpty;
import static com.turnstile.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encapsulates information specified in an HTTP request.
 * <p>
 * Instances are immutable and can be acquired via the {@link #withPath(HttpMethod, String)} builder factory method.
 * To "change" a request, for example to rewrite its HTTP method before dispatch, use {@link #copy()} to build a new instance.
 * <p>
 * Form parameters and {@code Accept} preferences are lazily parsed on first access and cached.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Request {
	@NonNull
	private static final Charset DEFAULT_CHARSET;
	@NonNull
	private static final AtomicLong ID_SEQUENCE;

	static {
		DEFAULT_CHARSET = StandardCharsets.UTF_8;
		ID_SEQUENCE = new AtomicLong(0);
	}

	@NonNull
	private final Object id;
	@NonNull
	private final HttpMethod httpMethod;
	@NonNull
	private final String path;
	@NonNull
	private final Map<String, Set<String>> queryParameters;
	@NonNull
	private final Map<String, Set<String>> headers;
	@Nullable
	private final byte[] body;
	@Nullable
	private final Map<String, Set<String>> explicitFormParameters;
	@NonNull
	private final ReentrantLock lock;
	@Nullable
	private volatile Map<String, Set<String>> formParameters = null;
	@Nullable
	private volatile List<MediaRange> acceptedMediaRanges = null;

	/**
	 * Acquires a builder for {@link Request} instances from an already-decoded path.
	 * <p>
	 * The provided {@code path} must start with the {@code /} character and must not include a query string.
	 * For {@code OPTIONS *} requests, the {@code path} must be {@code *}.
	 *
	 * @param httpMethod the HTTP method for this request ({@code GET, POST, etc.})
	 * @param path       the decoded URL path for this request
	 * @return the builder
	 */
	@NonNull
	public static Builder withPath(@NonNull HttpMethod httpMethod,
																 @NonNull String path) {
		requireNonNull(httpMethod);
		requireNonNull(path);

		return new Builder(httpMethod, path);
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

	protected Request(@NonNull Builder builder) {
		requireNonNull(builder);

		String path = trimAggressivelyToEmpty(builder.path);

		if (!path.startsWith("/") && !path.equals("*"))
			throw new IllegalArgumentException(format("Path must start with '/' or be '*' (was '%s')", path));

		if (path.contains("?"))
			throw new IllegalArgumentException(format("Path should not contain a query string. Use %s.withPath(...).queryParameters(...) to specify query parameters as a %s.",
					Request.class.getSimpleName(), Map.class.getSimpleName()));

		if (path.equals("*") && builder.httpMethod != HttpMethod.OPTIONS)
			throw new IllegalArgumentException(format("Path '*' is only legal for HTTP %s", HttpMethod.OPTIONS.name()));

		this.id = builder.id == null ? ID_SEQUENCE.incrementAndGet() : builder.id;
		this.httpMethod = builder.httpMethod;
		this.path = path;
		this.queryParameters = builder.queryParameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(builder.queryParameters));
		this.headers = Utilities.caseInsensitiveHeaders(builder.headers);
		this.body = builder.body;
		this.explicitFormParameters = builder.formParameters == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.formParameters));
		this.lock = new ReentrantLock();
	}

	@Override
	public String toString() {
		return format("%s{id=%s, httpMethod=%s, path=%s, queryParameters=%s, headers=%s, body=%s}",
				getClass().getSimpleName(), getId(), getHttpMethod(), getPath(), getQueryParameters(), getHeaders(),
				format("%d bytes", getBody().isPresent() ? getBody().get().length : 0));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Request request))
			return false;

		return Objects.equals(getId(), request.getId())
				&& Objects.equals(getHttpMethod(), request.getHttpMethod())
				&& Objects.equals(getPath(), request.getPath())
				&& Objects.equals(getQueryParameters(), request.getQueryParameters())
				&& Objects.equals(getHeaders(), request.getHeaders())
				&& Arrays.equals(this.body, request.body)
				&& Objects.equals(this.explicitFormParameters, request.explicitFormParameters);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getId(), getHttpMethod(), getPath(), getQueryParameters(), getHeaders(), Arrays.hashCode(this.body), this.explicitFormParameters);
	}

	/**
	 * An application-specific identifier for this request, useful for correlating log events.
	 * <p>
	 * Unless one is supplied at build time, a process-wide sequence number is used.
	 *
	 * @return the request's identifier
	 */
	@NonNull
	public Object getId() {
		return this.id;
	}

	@NonNull
	public HttpMethod getHttpMethod() {
		return this.httpMethod;
	}

	/**
	 * The percent-decoded path component of this request (no query string).
	 *
	 * @return the path for this request
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	@NonNull
	public Map<String, Set<String>> getQueryParameters() {
		return this.queryParameters;
	}

	/**
	 * The headers provided by the client for this request.
	 * <p>
	 * <em>Note that request headers have case-insensitive names per RFC 9110.</em>
	 *
	 * @return the request's headers
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
	 * The raw bytes of the request body - <em>callers should not modify this array; it is not copied</em>.
	 *
	 * @return the request body bytes, or {@link Optional#empty()} if none was supplied
	 */
	@NonNull
	public Optional<byte[]> getBody() {
		return Optional.ofNullable(this.body);
	}

	/**
	 * The request's form parameters.
	 * <p>
	 * If form parameters were supplied at build time they are returned as-is. Otherwise, a body with
	 * {@code Content-Type: application/x-www-form-urlencoded} is decoded on first access.
	 *
	 * @return the request's form parameters, or the empty map if there are none
	 */
	@NonNull
	public Map<String, Set<String>> getFormParameters() {
		if (this.explicitFormParameters != null)
			return this.explicitFormParameters;

		Map<String, Set<String>> result = this.formParameters;

		if (result == null) {
			getLock().lock();

			try {
				result = this.formParameters;

				if (result == null) {
					String contentType = getHeader("Content-Type").orElse(null);
					String mediaType = Utilities.extractContentTypeFromHeaderValue(contentType).orElse(null);

					if (this.body != null && mediaType != null && mediaType.equalsIgnoreCase("application/x-www-form-urlencoded")) {
						Charset charset = charsetFromContentType(contentType).orElse(DEFAULT_CHARSET);
						result = Collections.unmodifiableMap(Utilities.extractFormParametersFromBody(new String(this.body, charset), charset));
					} else {
						result = Map.of();
					}

					this.formParameters = result;
				}
			} finally {
				getLock().unlock();
			}
		}

		return result;
	}

	/**
	 * Convenience method to access a form parameter value when at most one is expected.
	 *
	 * @param name the form parameter name (case-sensitive)
	 * @return the first value for the form parameter, or {@link Optional#empty()} if absent
	 */
	@NonNull
	public Optional<String> getFormParameter(@NonNull String name) {
		requireNonNull(name);

		Set<String> values = getFormParameters().get(name);

		if (values == null || values.size() == 0)
			return Optional.empty();

		return values.stream().findFirst();
	}

	/**
	 * The media ranges from this request's {@code Accept} header, most-preferred first.
	 *
	 * @return the client's accepted media ranges, or an empty list if none were specified
	 */
	@NonNull
	public List<MediaRange> getAcceptedMediaRanges() {
		List<MediaRange> result = this.acceptedMediaRanges;

		if (result == null) {
			getLock().lock();

			try {
				result = this.acceptedMediaRanges;

				if (result == null) {
					result = MediaRange.parseAcceptHeaderValue(String.join(",", getHeaders().getOrDefault("Accept", Set.of())));
					this.acceptedMediaRanges = result;
				}
			} finally {
				getLock().unlock();
			}
		}

		return result;
	}

	/**
	 * Does the client's most-preferred {@code Accept} media range mention the given token?
	 * <p>
	 * For example, a browser sending {@code Accept: text/html,application/xhtml+xml,*&#47;*;q=0.8} prefers {@code html}.
	 *
	 * @param token a media type fragment such as {@code html} or {@code json}
	 * @return {@code true} if the most-preferred media range mentions the token, {@code false} otherwise or if there is no {@code Accept} header
	 */
	@NonNull
	public Boolean prefersMediaType(@NonNull String token) {
		requireNonNull(token);

		List<MediaRange> mediaRanges = getAcceptedMediaRanges();
		return mediaRanges.size() > 0 && mediaRanges.get(0).mentions(token);
	}

	@NonNull
	private static Optional<Charset> charsetFromContentType(@Nullable String contentType) {
		if (contentType == null)
			return Optional.empty();

		for (String parameter : contentType.split(";")) {
			String trimmedParameter = trimAggressivelyToEmpty(parameter);

			if (!trimmedParameter.toLowerCase(Locale.ENGLISH).startsWith("charset="))
				continue;

			String charsetName = trimAggressivelyToNull(trimmedParameter.substring("charset=".length()).replace("\"", ""));

			if (charsetName == null)
				return Optional.empty();

			try {
				return Optional.of(Charset.forName(charsetName));
			} catch (IllegalArgumentException e) {
				// Unsupported or illegal charset name; fall back to the default
				return Optional.empty();
			}
		}

		return Optional.empty();
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	/**
	 * Builder used to construct instances of {@link Request} via {@link Request#withPath(HttpMethod, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private HttpMethod httpMethod;
		@NonNull
		private String path;
		@Nullable
		private Object id;
		@Nullable
		private Map<String, Set<String>> queryParameters;
		@Nullable
		private Map<String, Set<String>> headers;
		@Nullable
		private byte[] body;
		@Nullable
		private Map<String, Set<String>> formParameters;

		protected Builder(@NonNull HttpMethod httpMethod,
											@NonNull String path) {
			requireNonNull(httpMethod);
			requireNonNull(path);

			this.httpMethod = httpMethod;
			this.path = path;
		}

		@NonNull
		public Builder httpMethod(@NonNull HttpMethod httpMethod) {
			requireNonNull(httpMethod);
			this.httpMethod = httpMethod;
			return this;
		}

		@NonNull
		public Builder path(@NonNull String path) {
			requireNonNull(path);
			this.path = path;
			return this;
		}

		@NonNull
		public Builder id(@Nullable Object id) {
			this.id = id;
			return this;
		}

		@NonNull
		public Builder queryParameters(@Nullable Map<String, Set<String>> queryParameters) {
			this.queryParameters = queryParameters;
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
		 * Supplies already-decoded form parameters, bypassing body parsing.
		 *
		 * @param formParameters the form parameters, or {@code null} to derive them from the body
		 * @return this builder
		 */
		@NonNull
		public Builder formParameters(@Nullable Map<String, Set<String>> formParameters) {
			this.formParameters = formParameters;
			return this;
		}

		@NonNull
		public Request build() {
			return new Request(this);
		}
	}

	/**
	 * Builder used to copy instances of {@link Request} via {@link Request#copy()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Copier {
		@NonNull
		private final Builder builder;

		Copier(@NonNull Request request) {
			requireNonNull(request);

			Map<String, Set<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
			headers.putAll(request.getHeaders());

			this.builder = new Builder(request.getHttpMethod(), request.getPath())
					.id(request.getId())
					.queryParameters(new LinkedHashMap<>(request.getQueryParameters()))
					.headers(headers)
					.body(request.body) // Direct field access to avoid array copy
					.formParameters(request.explicitFormParameters);
		}

		@NonNull
		public Copier httpMethod(@NonNull HttpMethod httpMethod) {
			requireNonNull(httpMethod);
			this.builder.httpMethod(httpMethod);
			return this;
		}

		@NonNull
		public Copier path(@NonNull String path) {
			requireNonNull(path);
			this.builder.path(path);
			return this;
		}

		@NonNull
		public Copier queryParameters(@Nullable Map<String, Set<String>> queryParameters) {
			this.builder.queryParameters(queryParameters);
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
		public Copier formParameters(@Nullable Map<String, Set<String>> formParameters) {
			this.builder.formParameters(formParameters);
			return this;
		}

		@NonNull
		public Request finish() {
			return this.builder.build();
		}
	}
}
