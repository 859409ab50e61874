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

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Renders a bare HTML page naming the status code and its reason phrase.
 * <p>
 * Failure details are not rendered; use a custom {@link ViewRenderer} to show them.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultViewRenderer implements ViewRenderer {
	@NonNull
	private static final DefaultViewRenderer DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new DefaultViewRenderer();
	}

	@NonNull
	public static DefaultViewRenderer defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private DefaultViewRenderer() {
		// Only one instance
	}

	@NonNull
	@Override
	public Response render(@NonNull Request request,
												 @NonNull Throwable throwable,
												 @NonNull Integer statusCode) {
		requireNonNull(request);
		requireNonNull(throwable);
		requireNonNull(statusCode);

		String title = escapeHtml(format("%d %s", statusCode, StatusCode.reasonPhraseFor(statusCode)));
		String html = format("<!DOCTYPE html>\n<html>\n<head><meta charset=\"utf-8\"><title>%s</title></head>\n<body><h1>%s</h1></body>\n</html>\n", title, title);

		return Response.withStatusCode(statusCode)
				.body(html, "text/html", StandardCharsets.UTF_8)
				.build();
	}

	@NonNull
	static String escapeHtml(@NonNull String string) {
		requireNonNull(string);

		StringBuilder escaped = new StringBuilder(string.length());

		for (char c : string.toCharArray()) {
			switch (c) {
				case '<':
					escaped.append("&lt;");
					break;
				case '>':
					escaped.append("&gt;");
					break;
				case '&':
					escaped.append("&amp;");
					break;
				case '"':
					escaped.append("&quot;");
					break;
				case '\'':
					escaped.append("&#39;");
					break;
				default:
					escaped.append(c);
					break;
			}
		}

		return escaped.toString();
	}
}
