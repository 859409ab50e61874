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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Formal enumeration of HTTP status codes and their standard reason phrases.
 * <p>
 * See <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status">https://developer.mozilla.org/en-US/docs/Web/HTTP/Status</a> for details.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum StatusCode {
	HTTP_100(100, "Continue"),
	HTTP_101(101, "Switching Protocols"),
	HTTP_102(102, "Processing"),
	HTTP_103(103, "Early Hints"),
	HTTP_200(200, "OK"),
	HTTP_201(201, "Created"),
	HTTP_202(202, "Accepted"),
	HTTP_203(203, "Non-Authoritative Information"),
	HTTP_204(204, "No Content"),
	HTTP_205(205, "Reset Content"),
	HTTP_206(206, "Partial Content"),
	HTTP_207(207, "Multi-Status"),
	HTTP_208(208, "Already Reported"),
	HTTP_226(226, "IM Used"),
	HTTP_300(300, "Multiple Choices"),
	HTTP_301(301, "Moved Permanently"),
	HTTP_302(302, "Found"),
	HTTP_303(303, "See Other"),
	HTTP_304(304, "Not Modified"),
	HTTP_305(305, "Use Proxy"),
	HTTP_306(306, "Unused"),
	HTTP_307(307, "Temporary Redirect"),
	HTTP_308(308, "Permanent Redirect"),
	HTTP_400(400, "Bad Request"),
	HTTP_401(401, "Unauthorized"),
	HTTP_402(402, "Payment Required"),
	HTTP_403(403, "Forbidden"),
	HTTP_404(404, "Not Found"),
	HTTP_405(405, "Method Not Allowed"),
	HTTP_406(406, "Not Acceptable"),
	HTTP_407(407, "Proxy Authentication Required"),
	HTTP_408(408, "Request Timeout"),
	HTTP_409(409, "Conflict"),
	HTTP_410(410, "Gone"),
	HTTP_411(411, "Length Required"),
	HTTP_412(412, "Precondition Failed"),
	HTTP_413(413, "Content Too Large"),
	HTTP_414(414, "URI Too Long"),
	HTTP_415(415, "Unsupported Media Type"),
	HTTP_416(416, "Range Not Satisfiable"),
	HTTP_417(417, "Expectation Failed"),
	HTTP_418(418, "I'm a Teapot"),
	HTTP_421(421, "Misdirected Request"),
	HTTP_422(422, "Unprocessable Content"),
	HTTP_423(423, "Locked"),
	HTTP_424(424, "Failed Dependency"),
	HTTP_425(425, "Too Early"),
	HTTP_426(426, "Upgrade Required"),
	HTTP_428(428, "Precondition Required"),
	HTTP_429(429, "Too Many Requests"),
	HTTP_431(431, "Request Header Fields Too Large"),
	HTTP_451(451, "Unavailable For Legal Reasons"),
	HTTP_500(500, "Internal Server Error"),
	HTTP_501(501, "Not Implemented"),
	HTTP_502(502, "Bad Gateway"),
	HTTP_503(503, "Service Unavailable"),
	HTTP_504(504, "Gateway Timeout"),
	HTTP_505(505, "HTTP Version Not Supported"),
	HTTP_506(506, "Variant Also Negotiates"),
	HTTP_507(507, "Insufficient Storage"),
	HTTP_508(508, "Loop Detected"),
	HTTP_510(510, "Not Extended"),
	HTTP_511(511, "Network Authentication Required");

	@NonNull
	private static final Map<Integer, StatusCode> STATUS_CODES_BY_NUMBER;

	static {
		Map<Integer, StatusCode> statusCodesByNumber = new HashMap<>();

		for (StatusCode statusCode : StatusCode.values())
			statusCodesByNumber.put(statusCode.getStatusCode(), statusCode);

		STATUS_CODES_BY_NUMBER = Collections.unmodifiableMap(statusCodesByNumber);
	}

	@NonNull
	private final Integer statusCode;
	@NonNull
	private final String reasonPhrase;

	StatusCode(@NonNull Integer statusCode,
						 @NonNull String reasonPhrase) {
		requireNonNull(statusCode);
		requireNonNull(reasonPhrase);

		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
	}

	/**
	 * Given an HTTP status code, return the corresponding enum value.
	 *
	 * @param statusCode the HTTP status code
	 * @return the enum value that corresponds to the provided HTTP status code, or {@link Optional#empty()} if none exists
	 */
	@NonNull
	public static Optional<StatusCode> fromStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return Optional.ofNullable(STATUS_CODES_BY_NUMBER.get(statusCode));
	}

	/**
	 * The standard reason phrase for an arbitrary status code.
	 * <p>
	 * Nonstandard codes are described by their class, e.g. {@code 499} is {@code Client Error}.
	 *
	 * @param statusCode the HTTP status code
	 * @return the reason phrase, never {@code null}
	 */
	@NonNull
	public static String reasonPhraseFor(@NonNull Integer statusCode) {
		requireNonNull(statusCode);

		StatusCode knownStatusCode = STATUS_CODES_BY_NUMBER.get(statusCode);

		if (knownStatusCode != null)
			return knownStatusCode.getReasonPhrase();

		if (statusCode >= 400 && statusCode < 500)
			return "Client Error";

		if (statusCode >= 500 && statusCode < 600)
			return "Server Error";

		return "Unknown Status";
	}

	@Override
	public String toString() {
		return format("%s.%s{statusCode=%s, reasonPhrase=%s}", getClass().getSimpleName(), name(), getStatusCode(), getReasonPhrase());
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	/**
	 * An English-language description for this HTTP status code.
	 * <p>
	 * For example, {@link StatusCode#HTTP_404} has reason phrase {@code Not Found}.
	 *
	 * @return English description for this HTTP status code
	 */
	@NonNull
	public String getReasonPhrase() {
		return this.reasonPhrase;
	}
}
