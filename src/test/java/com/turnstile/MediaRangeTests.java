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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.stream.Collectors;

/*
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MediaRangeTests {
	@Test
	public void ordered_by_quality() {
		List<MediaRange> mediaRanges = MediaRange.parseAcceptHeaderValue("*/*;q=0.1, text/*;q=0.5, application/json;q=0.5, text/html");

		Assertions.assertEquals(List.of("text/html", "text/*", "application/json", "*/*"), mediaTypes(mediaRanges));
	}

	@Test
	public void parameters_do_not_outrank_earlier_entries_of_equal_quality() {
		List<MediaRange> mediaRanges = MediaRange.parseAcceptHeaderValue("application/json, text/html;level=1");

		Assertions.assertEquals(List.of("application/json", "text/html"), mediaTypes(mediaRanges));
	}

	@Test
	public void equal_preference_keeps_header_order() {
		List<MediaRange> mediaRanges = MediaRange.parseAcceptHeaderValue("application/json, text/html");

		Assertions.assertEquals(List.of("application/json", "text/html"), mediaTypes(mediaRanges));
	}

	@Test
	public void zero_quality_and_malformed_entries_are_dropped() {
		List<MediaRange> mediaRanges = MediaRange.parseAcceptHeaderValue("text/html;q=0, garbage, application/json;q=abc, text/plain");

		Assertions.assertEquals(List.of("text/plain"), mediaTypes(mediaRanges));
	}

	@Test
	public void parameters_are_preserved() {
		MediaRange mediaRange = MediaRange.parseAcceptHeaderValue("text/html; level=1; q=0.7").get(0);

		Assertions.assertEquals(0.7, mediaRange.getQuality());
		Assertions.assertEquals("1", mediaRange.getParameters().get("level"));
	}

	@Test
	public void mentions_matches_media_type_fragment() {
		MediaRange mediaRange = MediaRange.parseAcceptHeaderValue("application/xhtml+xml").get(0);

		Assertions.assertTrue(mediaRange.mentions("html"));
		Assertions.assertTrue(mediaRange.mentions("HTML"));
		Assertions.assertFalse(mediaRange.mentions("json"));
	}

	@Test
	public void blank_header_yields_no_ranges() {
		Assertions.assertTrue(MediaRange.parseAcceptHeaderValue(null).isEmpty());
		Assertions.assertTrue(MediaRange.parseAcceptHeaderValue("  ").isEmpty());
	}

	private static List<String> mediaTypes(List<MediaRange> mediaRanges) {
		return mediaRanges.stream().map(MediaRange::getMediaType).collect(Collectors.toList());
	}
}
