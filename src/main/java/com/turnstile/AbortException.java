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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.turnstile.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * General-purpose exception that aborts request processing with a specific HTTP status code.
 * <p>
 * Instances are both {@link Abortable} and {@link Diagnosable}.
 * <pre>{@code throw AbortException.withStatusCode(422)
 *   .reason("Email address is malformed")
 *   .identifier("malformedEmail")
 *   .metadata(Map.of("field", "email"))
 *   .suggestedFixes(List.of("Provide an address of the form name@example.com"))
 *   .build();}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AbortException extends RuntimeException implements Abortable, Diagnosable {
	@NonNull
	private final Integer statusCode;
	@NonNull
	private final String reason;
	@NonNull
	private final String identifier;
	@NonNull
	private final Map<String, Object> metadata;
	@NonNull
	private final List<String> possibleCauses;
	@NonNull
	private final List<String> suggestedFixes;
	@NonNull
	private final List<String> documentationLinks;

	/**
	 * Acquires a builder for {@link AbortException} instances.
	 *
	 * @param statusCode the HTTP status code the client should receive
	 * @return the builder
	 */
	@NonNull
	public static Builder withStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	@NonNull
	public static AbortException badRequest() {
		return withStatusCode(400).identifier("badRequest").build();
	}

	@NonNull
	public static AbortException unauthorized() {
		return withStatusCode(401).identifier("unauthorized").build();
	}

	@NonNull
	public static AbortException forbidden() {
		return withStatusCode(403).identifier("forbidden").build();
	}

	@NonNull
	public static AbortException notFound() {
		return withStatusCode(404).identifier("notFound").build();
	}

	@NonNull
	public static AbortException serverError() {
		return withStatusCode(500).identifier("serverError").build();
	}

	protected AbortException(@NonNull Builder builder) {
		super(builder.reason == null ? StatusCode.reasonPhraseFor(builder.statusCode) : builder.reason, builder.cause);

		this.statusCode = builder.statusCode;
		this.reason = builder.reason == null ? StatusCode.reasonPhraseFor(builder.statusCode) : builder.reason;
		this.identifier = builder.identifier == null ? String.valueOf(builder.statusCode) : builder.identifier;
		this.metadata = builder.metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
		this.possibleCauses = builder.possibleCauses == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(builder.possibleCauses));
		this.suggestedFixes = builder.suggestedFixes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(builder.suggestedFixes));
		this.documentationLinks = builder.documentationLinks == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(builder.documentationLinks));
	}

	@Override
	public String toString() {
		return format("%s{statusCode=%s, identifier=%s, reason=%s}", getClass().getSimpleName(), getStatusCode(), getIdentifier(), getReason());
	}

	@NonNull
	@Override
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	@Override
	public Map<String, Object> getMetadata() {
		return this.metadata;
	}

	@NonNull
	@Override
	public String getReason() {
		return this.reason;
	}

	@NonNull
	@Override
	public String getIdentifier() {
		return this.identifier;
	}

	@NonNull
	@Override
	public List<String> getPossibleCauses() {
		return this.possibleCauses;
	}

	@NonNull
	@Override
	public List<String> getSuggestedFixes() {
		return this.suggestedFixes;
	}

	@NonNull
	@Override
	public List<String> getDocumentationLinks() {
		return this.documentationLinks;
	}

	/**
	 * Builder used to construct instances of {@link AbortException} via {@link AbortException#withStatusCode(Integer)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Integer statusCode;
		@Nullable
		private String reason;
		@Nullable
		private String identifier;
		@Nullable
		private Map<String, Object> metadata;
		@Nullable
		private List<String> possibleCauses;
		@Nullable
		private List<String> suggestedFixes;
		@Nullable
		private List<String> documentationLinks;
		@Nullable
		private Throwable cause;

		protected Builder(@NonNull Integer statusCode) {
			requireNonNull(statusCode);

			if (statusCode < 400 || statusCode > 599)
				throw new IllegalArgumentException(format("%s status codes must be in the 4xx or 5xx range (was %d)",
						AbortException.class.getSimpleName(), statusCode));

			this.statusCode = statusCode;
		}

		/**
		 * @param reason a human-readable explanation; defaults to the status code's reason phrase
		 * @return this builder
		 */
		@NonNull
		public Builder reason(@Nullable String reason) {
			this.reason = trimAggressivelyToNull(reason);
			return this;
		}

		/**
		 * @param identifier a stable identifier; defaults to the status code, e.g. {@code "404"}
		 * @return this builder
		 */
		@NonNull
		public Builder identifier(@Nullable String identifier) {
			this.identifier = trimAggressivelyToNull(identifier);
			return this;
		}

		@NonNull
		public Builder metadata(@Nullable Map<String, Object> metadata) {
			this.metadata = metadata;
			return this;
		}

		@NonNull
		public Builder possibleCauses(@Nullable List<String> possibleCauses) {
			this.possibleCauses = possibleCauses;
			return this;
		}

		@NonNull
		public Builder suggestedFixes(@Nullable List<String> suggestedFixes) {
			this.suggestedFixes = suggestedFixes;
			return this;
		}

		@NonNull
		public Builder documentationLinks(@Nullable List<String> documentationLinks) {
			this.documentationLinks = documentationLinks;
			return this;
		}

		@NonNull
		public Builder cause(@Nullable Throwable cause) {
			this.cause = cause;
			return this;
		}

		@NonNull
		public AbortException build() {
			return new AbortException(this);
		}
	}
}
