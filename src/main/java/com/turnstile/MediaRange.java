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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static com.turnstile.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A single entry of an HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Accept">{@code Accept}</a> header,
 * e.g. {@code text/html;level=1;q=0.8}.
 * <p>
 * Use {@link #parseAcceptHeaderValue(String)} to acquire a client's preference list, most-preferred first.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class MediaRange {
	@NonNull
	private static final Comparator<MediaRange> PREFERENCE_ORDER;

	static {
		// Higher quality first. List.sort() is stable, so ties keep the client's header order.
		PREFERENCE_ORDER = Comparator.comparingDouble(MediaRange::getQuality).reversed();
	}

	@NonNull
	private final String type;
	@NonNull
	private final String subtype;
	@NonNull
	private final Double quality;
	@NonNull
	private final Map<String, String> parameters;

	/**
	 * Parses an {@code Accept} header value into media ranges ordered by client preference.
	 * <p>
	 * Malformed entries are skipped. Entries with {@code q=0} are "not acceptable" and are omitted.
	 *
	 * @param acceptHeaderValue the raw header value; may be {@code null}
	 * @return media ranges in descending preference order; empty if none could be parsed
	 */
	@NonNull
	public static List<@NonNull MediaRange> parseAcceptHeaderValue(@Nullable String acceptHeaderValue) {
		acceptHeaderValue = trimAggressivelyToNull(acceptHeaderValue);

		if (acceptHeaderValue == null)
			return List.of();

		List<MediaRange> mediaRanges = new ArrayList<>();

		for (String component : acceptHeaderValue.split(",")) {
			MediaRange mediaRange = parseComponent(component);

			if (mediaRange != null && mediaRange.getQuality() > 0)
				mediaRanges.add(mediaRange);
		}

		mediaRanges.sort(PREFERENCE_ORDER);

		return Collections.unmodifiableList(mediaRanges);
	}

	@Nullable
	private static MediaRange parseComponent(@NonNull String component) {
		String[] segments = component.split(";");
		String mediaType = trimAggressivelyToNull(segments[0]);

		if (mediaType == null)
			return null;

		int indexOfSlash = mediaType.indexOf('/');

		if (indexOfSlash <= 0 || indexOfSlash == mediaType.length() - 1)
			return null;

		String type = mediaType.substring(0, indexOfSlash).toLowerCase(Locale.ENGLISH);
		String subtype = mediaType.substring(indexOfSlash + 1).toLowerCase(Locale.ENGLISH);
		double quality = 1.0;
		Map<String, String> parameters = new LinkedHashMap<>();

		for (int i = 1; i < segments.length; ++i) {
			String segment = segments[i];
			int indexOfEquals = segment.indexOf('=');

			if (indexOfEquals == -1)
				continue;

			String name = trimAggressivelyToNull(segment.substring(0, indexOfEquals));
			String value = trimAggressivelyToNull(segment.substring(indexOfEquals + 1));

			if (name == null || value == null)
				continue;

			if (name.equalsIgnoreCase("q")) {
				try {
					quality = Math.max(0.0, Math.min(1.0, Double.parseDouble(value)));
				} catch (NumberFormatException e) {
					return null;
				}
			} else {
				parameters.put(name.toLowerCase(Locale.ENGLISH), value);
			}
		}

		return new MediaRange(type, subtype, quality, parameters);
	}

	private MediaRange(@NonNull String type,
										 @NonNull String subtype,
										 @NonNull Double quality,
										 @NonNull Map<String, String> parameters) {
		requireNonNull(type);
		requireNonNull(subtype);
		requireNonNull(quality);
		requireNonNull(parameters);

		this.type = type;
		this.subtype = subtype;
		this.quality = quality;
		this.parameters = Collections.unmodifiableMap(parameters);
	}

	/**
	 * Does this range's media type mention the given token?
	 * <p>
	 * For example, {@code text/html} and {@code application/xhtml+xml} both mention {@code html}.
	 *
	 * @param token the token to look for, e.g. {@code html} or {@code json}
	 * @return {@code true} if the token appears in this range's media type
	 */
	@NonNull
	public Boolean mentions(@NonNull String token) {
		requireNonNull(token);
		return getMediaType().contains(token.toLowerCase(Locale.ENGLISH));
	}

	@Override
	public String toString() {
		return format("%s{mediaType=%s, quality=%s, parameters=%s}", getClass().getSimpleName(), getMediaType(), getQuality(), getParameters());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof MediaRange mediaRange))
			return false;

		return Objects.equals(getType(), mediaRange.getType())
				&& Objects.equals(getSubtype(), mediaRange.getSubtype())
				&& Objects.equals(getQuality(), mediaRange.getQuality())
				&& Objects.equals(getParameters(), mediaRange.getParameters());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), getSubtype(), getQuality(), getParameters());
	}

	@NonNull
	public String getMediaType() {
		return format("%s/%s", getType(), getSubtype());
	}

	@NonNull
	public String getType() {
		return this.type;
	}

	@NonNull
	public String getSubtype() {
		return this.subtype;
	}

	/**
	 * The {@code q} weight of this range, from {@code 0.0} to {@code 1.0} (default {@code 1.0}).
	 *
	 * @return the quality weight
	 */
	@NonNull
	public Double getQuality() {
		return this.quality;
	}

	/**
	 * Media type parameters other than {@code q}, with lowercased names.
	 *
	 * @return the parameters, possibly empty
	 */
	@NonNull
	public Map<String, String> getParameters() {
		return this.parameters;
	}
}
