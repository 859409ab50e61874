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

import java.time.Duration;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Kinds of {@link LogEvent} instances that a {@link Dispatcher} can produce.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum LogEventType {
	/**
	 * A request was received; the message is its method and path, e.g. {@code GET /users}.
	 */
	REQUEST_RECEIVED(LogLevel.INFO),
	/**
	 * A method-override form field was present but did not name a known {@link HttpMethod}, so it was ignored.
	 */
	METHOD_OVERRIDE_IGNORED(LogLevel.WARNING),
	/**
	 * A successful response had no {@code Content-Type} header (and was not a {@code 304 Not Modified}).
	 */
	RESPONSE_MISSING_CONTENT_TYPE(LogLevel.WARNING),
	/**
	 * An exception was thrown during dispatch and will be converted into an error response.
	 */
	REQUEST_PROCESSING_FAILED(LogLevel.ERROR),
	/**
	 * Follows {@link #REQUEST_PROCESSING_FAILED} when the exception does not implement {@link Diagnosable}.
	 */
	DIAGNOSABLE_NOT_IMPLEMENTED(LogLevel.INFO),
	/**
	 * The {@link ViewRenderer} or {@link DocumentMarshaler} failed while producing an error response; a failsafe response was sent instead.
	 */
	ERROR_RESPONSE_RENDERING_FAILED(LogLevel.ERROR),
	/**
	 * {@link LifecycleObserver#didStartRequestHandling(Request)} or
	 * {@link LifecycleObserver#didFinishRequestHandling(Request, Response, Duration, List)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_FAILED(LogLevel.ERROR);

	@NonNull
	private final LogLevel logLevel;

	LogEventType(@NonNull LogLevel logLevel) {
		requireNonNull(logLevel);
		this.logLevel = logLevel;
	}

	@NonNull
	public LogLevel getLogLevel() {
		return this.logLevel;
	}
}
