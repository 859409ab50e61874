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
import java.net.URLDecoder;
import java.nio.charset.Charset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * A non-instantiable collection of utility methods.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Utilities {
	@NonNull
	private static final byte[] EMPTY_BYTE_ARRAY;
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;

	static {
		EMPTY_BYTE_ARRAY = new byte[0];
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+$");
	}

	private Utilities() {
		// Non-instantiable
	}

	/**
	 * Returns a shared zero-length {@code byte[]} instance.
	 *
	 * @return a zero-length byte array (never {@code null})
	 */
	@NonNull
	static byte[] emptyByteArray() {
		return EMPTY_BYTE_ARRAY;
	}

	/**
	 * Copies the given headers into an unmodifiable map whose keys are compared case-insensitively, as HTTP header names are.
	 *
	 * @param headers the headers to copy; may be {@code null}
	 * @return an unmodifiable, case-insensitive copy of the headers
	 */
	@NonNull
	static Map<@NonNull String, @NonNull Set<@NonNull String>> caseInsensitiveHeaders(@Nullable Map<String, Set<String>> headers) {
		if (headers == null || headers.size() == 0)
			return Collections.emptyMap();

		Map<String, Set<String>> caseInsensitiveHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		for (Entry<String, Set<String>> entry : headers.entrySet()) {
			String name = trimAggressivelyToNull(entry.getKey());

			if (name == null)
				throw new IllegalArgumentException("Header names cannot be blank");

			Set<String> values = caseInsensitiveHeaders.computeIfAbsent(name, ignored -> new LinkedHashSet<>());

			if (entry.getValue() != null)
				values.addAll(entry.getValue());
		}

		for (Entry<String, Set<String>> entry : caseInsensitiveHeaders.entrySet())
			entry.setValue(Collections.unmodifiableSet(entry.getValue()));

		return Collections.unmodifiableMap(caseInsensitiveHeaders);
	}

	/**
	 * Returns the first value of the named header, if present.
	 *
	 * @param headers request or response headers
	 * @param name    the header name, matched case-insensitively if the map was built by {@link #caseInsensitiveHeaders(Map)}
	 * @return the first header value, or {@link Optional#empty()} if there is none
	 */
	@NonNull
	static Optional<@NonNull String> firstHeaderValue(@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> headers,
																										@NonNull String name) {
		requireNonNull(headers);
		requireNonNull(name);

		Set<String> values = headers.get(name);

		if (values == null || values.size() == 0)
			return Optional.empty();

		return values.stream().findFirst();
	}

	/**
	 * Extracts the media type (without parameters) from a {@code Content-Type} header value.
	 * <p>
	 * For example, {@code "application/json; charset=UTF-8"} → {@code "application/json"}.
	 *
	 * @param contentTypeHeaderValue the raw header value; may be {@code null} or blank
	 * @return the media type if present; otherwise {@link Optional#empty()}
	 */
	@NonNull
	public static Optional<@NonNull String> extractContentTypeFromHeaderValue(@Nullable String contentTypeHeaderValue) {
		contentTypeHeaderValue = trimAggressivelyToNull(contentTypeHeaderValue);

		if (contentTypeHeaderValue == null)
			return Optional.empty();

		int indexOfSemicolon = contentTypeHeaderValue.indexOf(";");

		if (indexOfSemicolon == -1)
			return Optional.of(contentTypeHeaderValue);

		return Optional.ofNullable(trimAggressivelyToNull(contentTypeHeaderValue.substring(0, indexOfSemicolon)));
	}

	/**
	 * Parses an {@code application/x-www-form-urlencoded} body such as {@code "a=1&b=two%20words"} into a multimap of names to values.
	 * <p>
	 * Pairs missing a name are ignored, as are pairs with malformed percent-encoding.
	 * Multiple occurrences of the same name are collected into a {@link Set} in insertion order.
	 *
	 * @param formBody the form-encoded body
	 * @param charset  the charset used to decode percent-escapes
	 * @return a map of parameter names to their distinct values, preserving first-seen name order; empty if none
	 */
	@NonNull
	public static Map<@NonNull String, @NonNull Set<@NonNull String>> extractFormParametersFromBody(@NonNull String formBody,
																																															 @NonNull Charset charset) {
		requireNonNull(formBody);
		requireNonNull(charset);

		Map<String, Set<String>> formParameters = new LinkedHashMap<>();

		for (String pair : formBody.split("&")) {
			if (pair.length() == 0)
				continue;

			int indexOfEquals = pair.indexOf('=');
			String rawName = indexOfEquals == -1 ? pair : pair.substring(0, indexOfEquals);
			String rawValue = indexOfEquals == -1 ? "" : pair.substring(indexOfEquals + 1);

			String name;
			String value;

			try {
				name = trimAggressivelyToNull(URLDecoder.decode(rawName, charset));
				value = URLDecoder.decode(rawValue, charset);
			} catch (IllegalArgumentException ignored) {
				// Malformed percent-encoding, e.g. "%zz"
				continue;
			}

			if (name == null)
				continue;

			formParameters.computeIfAbsent(name, ignored -> new LinkedHashSet<>()).add(value);
		}

		return formParameters;
	}

	/**
	 * Aggressively trims Unicode whitespace (including non-breaking spaces) from both ends of the given string.
	 *
	 * @param string the string to trim
	 * @return the trimmed string, or {@code null} if the input string is {@code null}
	 */
	@Nullable
	public static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return string;

		return TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");
	}

	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.length() == 0 ? null : string;
	}

	@NonNull
	public static String trimAggressivelyToEmpty(@Nullable String string) {
		if (string == null)
			return "";

		return trimAggressively(string);
	}
}
