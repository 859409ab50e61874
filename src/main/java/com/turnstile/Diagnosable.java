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

import java.util.List;

import static java.lang.String.format;

/**
 * Capability for exceptions that carry structured, developer-facing diagnostics.
 * <p>
 * Everything exposed here is always logged by the {@link ErrorNormalizer}. Outside of {@link Environment#PRODUCTION} it is also
 * included in error documents returned to clients. This capability is independent of {@link Abortable}: an exception may
 * implement either, both, or neither.
 * <p>
 * Only {@link #getReason()} and {@link #getIdentifier()} are required.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Diagnosable {
	/**
	 * A human-readable explanation of what went wrong.
	 *
	 * @return the reason for this failure
	 */
	@NonNull
	String getReason();

	/**
	 * A stable identifier for this kind of failure, unique within {@link #getReadableName()}, e.g. {@code missingApiKey}.
	 *
	 * @return the identifier
	 */
	@NonNull
	String getIdentifier();

	/**
	 * A short name for this kind of failure, used to prefix log output and {@link #getFullIdentifier()}.
	 *
	 * @return the readable name, by default the simple name of the implementing class
	 */
	@NonNull
	default String getReadableName() {
		return getClass().getSimpleName();
	}

	/**
	 * A globally-unique identifier: {@link #getReadableName()} and {@link #getIdentifier()} joined by a dot,
	 * e.g. {@code AbortException.notFound}.
	 *
	 * @return the full identifier
	 */
	@NonNull
	default String getFullIdentifier() {
		return format("%s.%s", getReadableName(), getIdentifier());
	}

	@NonNull
	default List<String> getPossibleCauses() {
		return List.of();
	}

	@NonNull
	default List<String> getSuggestedFixes() {
		return List.of();
	}

	@NonNull
	default List<String> getDocumentationLinks() {
		return List.of();
	}

	@NonNull
	default List<String> getStackOverflowQuestions() {
		return List.of();
	}

	@NonNull
	default List<String> getGitHubIssues() {
		return List.of();
	}
}
