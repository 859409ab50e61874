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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Read-only hooks into request processing, and the sink for the dispatcher's log output.
 * <p>
 * Implementations must be threadsafe: a single instance is invoked from all concurrent dispatches.
 * These methods are not fail-fast; if one throws, the dispatcher reports it via {@link #didReceiveLogEvent(LogEvent)}
 * with type {@link LogEventType#LIFECYCLE_OBSERVER_FAILED} and carries on.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface LifecycleObserver {
	/**
	 * Called as soon as a request has been received and its method normalized.
	 */
	default void didStartRequestHandling(@NonNull Request request) {
		// No-op by default
	}

	/**
	 * Called after a request finishes processing, with the finalized response.
	 *
	 * @param request    the request as it was dispatched, i.e. after method normalization
	 * @param response   the response to be sent to the client
	 * @param duration   how long dispatch took
	 * @param throwables exceptions that occurred during dispatch, in order; empty on the happy path
	 */
	default void didFinishRequestHandling(@NonNull Request request,
																				@NonNull Response response,
																				@NonNull Duration duration,
																				@NonNull List<@NonNull Throwable> throwables) {
		// No-op by default
	}

	/**
	 * Called when a loggable event occurs.
	 * <p>
	 * By default, events are written to the SLF4J logger named {@code com.turnstile.LifecycleObserver} at the event's {@link LogLevel}.
	 *
	 * @param logEvent the event that occurred
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		Logger logger = LoggerFactory.getLogger(LifecycleObserver.class);
		Throwable throwable = logEvent.getThrowable().orElse(null);

		switch (logEvent.getLogLevel()) {
			case INFO:
				logger.info(logEvent.getMessage(), throwable);
				break;
			case WARNING:
				logger.warn(logEvent.getMessage(), throwable);
				break;
			case ERROR:
				logger.error(logEvent.getMessage(), throwable);
				break;
			default:
				throw new IllegalStateException("Unhandled log level " + logEvent.getLogLevel());
		}
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} instance with sensible defaults.
	 *
	 * @return a {@code LifecycleObserver} with default settings
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}
}
