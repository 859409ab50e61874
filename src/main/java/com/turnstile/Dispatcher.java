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

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Turns an inbound {@link Request} into exactly one outbound {@link Response}.
 * <p>
 * Each dispatch proceeds as follows:
 * <ol>
 *   <li>the {@link MethodNormalizer} applies method override and rewrites {@code HEAD} to {@code GET}</li>
 *   <li>the request flows through the {@link MiddlewareChain}, outermost middleware first</li>
 *   <li>the innermost handler asks the {@link Router} for a handler, falling back to the configured fallback handler on no match</li>
 *   <li>any exception thrown along the way is converted into a response by the {@link ErrorNormalizer}</li>
 *   <li>the {@link ResponseFinalizer} strips the body if the client asked for {@code HEAD}</li>
 * </ol>
 * Exceptions never escape {@link #dispatch(Request)}.
 * <p>
 * Instances are threadsafe and hold no mutable state, so a single instance should serve all requests concurrently.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Dispatcher {
	@NonNull
	private static final Logger LOGGER;

	static {
		LOGGER = LoggerFactory.getLogger(Dispatcher.class);
	}

	@NonNull
	private final DispatcherConfig dispatcherConfig;
	@NonNull
	private final MethodNormalizer methodNormalizer;
	@NonNull
	private final ErrorNormalizer errorNormalizer;
	@NonNull
	private final ResponseFinalizer responseFinalizer;
	@NonNull
	private final Handler chainedHandler;

	public Dispatcher(@NonNull DispatcherConfig dispatcherConfig) {
		requireNonNull(dispatcherConfig);

		this.dispatcherConfig = dispatcherConfig;
		this.methodNormalizer = new MethodNormalizer(dispatcherConfig.getMethodOverrideFieldName());
		this.errorNormalizer = new ErrorNormalizer(dispatcherConfig.getEnvironment(), dispatcherConfig.getViewRenderer(),
				dispatcherConfig.getDocumentMarshaler(), dispatcherConfig.getLifecycleObserver());
		this.responseFinalizer = ResponseFinalizer.defaultInstance();

		// Middleware order is fixed for the lifetime of this instance, so compose once
		Router router = dispatcherConfig.getRouter();
		Handler fallbackHandler = dispatcherConfig.getFallbackHandler();

		this.chainedHandler = dispatcherConfig.getMiddlewareChain().chain((request) ->
				router.route(request).orElse(fallbackHandler).handle(request));
	}

	/**
	 * Processes a request.
	 *
	 * @param request the inbound request
	 * @return the response to send to the client, never {@code null}
	 */
	@NonNull
	public Response dispatch(@NonNull Request request) {
		requireNonNull(request);

		Instant processingStarted = Instant.now();
		LifecycleObserver lifecycleObserver = getDispatcherConfig().getLifecycleObserver();
		List<Throwable> throwables = new ArrayList<>(4);

		Consumer<LogEvent> safelyLog = (logEvent -> {
			try {
				lifecycleObserver.didReceiveLogEvent(logEvent);
			} catch (Throwable throwable) {
				LOGGER.error(format("%s::didReceiveLogEvent failed while handling %s", LifecycleObserver.class.getSimpleName(), logEvent), throwable);
				throwables.add(throwable);
			}
		});

		MethodNormalization methodNormalization;
		Throwable normalizationThrowable = null;

		try {
			methodNormalization = getMethodNormalizer().normalize(request);
		} catch (Throwable throwable) {
			// Converted into an error response below, after observers have seen the request
			normalizationThrowable = throwable;
			methodNormalization = new MethodNormalization(request, request.getHttpMethod(), null);
		}

		Request normalizedRequest = methodNormalization.getRequest();
		HttpMethod originalMethod = methodNormalization.getOriginalMethod();

		safelyLog.accept(LogEvent.with(LogEventType.REQUEST_RECEIVED, format("%s %s", originalMethod.name(), normalizedRequest.getPath()))
				.request(normalizedRequest)
				.build());

		methodNormalization.getIgnoredOverrideValue().ifPresent(ignoredOverrideValue ->
				safelyLog.accept(LogEvent.with(LogEventType.METHOD_OVERRIDE_IGNORED,
								format("Ignoring unrecognized value '%s' for method override field '%s'", ignoredOverrideValue, getMethodNormalizer().getMethodOverrideFieldName()))
						.request(normalizedRequest)
						.build()));

		try {
			lifecycleObserver.didStartRequestHandling(normalizedRequest);
		} catch (Throwable throwable) {
			throwables.add(throwable);
			safelyLog.accept(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
							format("An exception occurred while invoking %s::didStartRequestHandling", LifecycleObserver.class.getSimpleName()))
					.throwable(throwable)
					.request(normalizedRequest)
					.build());
		}

		Response response;

		try {
			if (normalizationThrowable != null)
				throw normalizationThrowable;

			response = getChainedHandler().handle(normalizedRequest);

			if (response == null)
				throw new IllegalStateException(format("A %s or %s returned a null %s", Handler.class.getSimpleName(),
						Middleware.class.getSimpleName(), Response.class.getSimpleName()));

			getErrorNormalizer().inspectResponse(normalizedRequest, response);
		} catch (Throwable throwable) {
			throwables.add(throwable);
			response = errorResponseFor(normalizedRequest, throwable);
		}

		response = getResponseFinalizer().finalizeResponse(originalMethod, response);

		try {
			lifecycleObserver.didFinishRequestHandling(normalizedRequest, response,
					Duration.between(processingStarted, Instant.now()), Collections.unmodifiableList(new ArrayList<>(throwables)));
		} catch (Throwable throwable) {
			safelyLog.accept(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
							format("An exception occurred while invoking %s::didFinishRequestHandling", LifecycleObserver.class.getSimpleName()))
					.throwable(throwable)
					.request(normalizedRequest)
					.response(response)
					.build());
		}

		return response;
	}

	@NonNull
	private Response errorResponseFor(@NonNull Request request,
																		@NonNull Throwable throwable) {
		requireNonNull(request);
		requireNonNull(throwable);

		try {
			return getErrorNormalizer().forThrowable(request, throwable);
		} catch (Throwable normalizerThrowable) {
			LOGGER.error(format("%s::forThrowable failed, falling back to failsafe response", ErrorNormalizer.class.getSimpleName()), normalizerThrowable);
			return ErrorNormalizer.failsafeResponse(ErrorNormalizer.statusCodeFor(throwable));
		}
	}

	@NonNull
	public DispatcherConfig getDispatcherConfig() {
		return this.dispatcherConfig;
	}

	@NonNull
	private MethodNormalizer getMethodNormalizer() {
		return this.methodNormalizer;
	}

	@NonNull
	private ErrorNormalizer getErrorNormalizer() {
		return this.errorNormalizer;
	}

	@NonNull
	private ResponseFinalizer getResponseFinalizer() {
		return this.responseFinalizer;
	}

	@NonNull
	private Handler getChainedHandler() {
		return this.chainedHandler;
	}
}
