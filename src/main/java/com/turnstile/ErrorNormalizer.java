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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The single place where failures become responses.
 * <p>
 * What gets logged and what gets sent to the client are decided separately. The log always carries every detail a
 * failure exposes. The client sees those details only outside of {@link Environment#PRODUCTION}; in production an error
 * document carries nothing but {@code error} and the status code's standard reason phrase.
 * <p>
 * Exceptions are never thrown from {@link #forThrowable(Request, Throwable)}: if the {@link ViewRenderer} or
 * {@link DocumentMarshaler} fails, a plain-text failsafe response with the resolved status code is returned instead.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ErrorNormalizer {
	@NonNull
	private static final Logger LOGGER;

	static {
		LOGGER = LoggerFactory.getLogger(ErrorNormalizer.class);
	}

	@NonNull
	private final Environment environment;
	@NonNull
	private final ViewRenderer viewRenderer;
	@NonNull
	private final DocumentMarshaler documentMarshaler;
	@NonNull
	private final LifecycleObserver lifecycleObserver;

	public ErrorNormalizer(@NonNull Environment environment,
												 @NonNull ViewRenderer viewRenderer,
												 @NonNull DocumentMarshaler documentMarshaler,
												 @NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(environment);
		requireNonNull(viewRenderer);
		requireNonNull(documentMarshaler);
		requireNonNull(lifecycleObserver);

		this.environment = environment;
		this.viewRenderer = viewRenderer;
		this.documentMarshaler = documentMarshaler;
		this.lifecycleObserver = lifecycleObserver;
	}

	/**
	 * Emits a {@link LogEventType#RESPONSE_MISSING_CONTENT_TYPE} warning if a response other than {@code 304 Not Modified}
	 * has no {@code Content-Type} header. The response itself is left alone.
	 *
	 * @param request  the request that was handled
	 * @param response the response produced for it
	 */
	public void inspectResponse(@NonNull Request request,
															@NonNull Response response) {
		requireNonNull(request);
		requireNonNull(response);

		if (response.getStatusCode().equals(StatusCode.HTTP_304.getStatusCode()))
			return;

		if (response.getHeader("Content-Type").isPresent())
			return;

		safelyLog(LogEvent.with(LogEventType.RESPONSE_MISSING_CONTENT_TYPE,
						format("No Content-Type header set on %d response to %s %s", response.getStatusCode(), request.getHttpMethod().name(), request.getPath()))
				.request(request)
				.response(response)
				.build());
	}

	/**
	 * Converts a failure into a response, logging it along the way.
	 *
	 * @param request   the request being handled when the failure occurred
	 * @param throwable the failure
	 * @return a response for the client, never {@code null}
	 */
	@NonNull
	public Response forThrowable(@NonNull Request request,
															 @NonNull Throwable throwable) {
		requireNonNull(request);
		requireNonNull(throwable);

		Integer statusCode = statusCodeFor(throwable);

		if (throwable instanceof Diagnosable diagnosable) {
			safelyLog(LogEvent.with(LogEventType.REQUEST_PROCESSING_FAILED, loggableDescription(diagnosable))
					.throwable(throwable)
					.request(request)
					.build());
		} else {
			safelyLog(LogEvent.with(LogEventType.REQUEST_PROCESSING_FAILED, format("[%s: %s]", throwable.getClass().getName(), throwable))
					.throwable(throwable)
					.request(request)
					.build());

			safelyLog(LogEvent.with(LogEventType.DIAGNOSABLE_NOT_IMPLEMENTED,
							format("Implement %s on %s for richer error output", Diagnosable.class.getName(), throwable.getClass().getName()))
					.request(request)
					.build());
		}

		try {
			if (request.prefersMediaType("html")) {
				Response response = getViewRenderer().render(request, throwable, statusCode);

				if (response == null)
					throw new IllegalStateException(format("%s returned a null response", getViewRenderer().getClass().getName()));

				return response.getStatusCode().equals(statusCode) ? response : response.copy().statusCode(statusCode).finish();
			}

			Document document = errorDocumentFor(throwable, statusCode);
			byte[] body = getDocumentMarshaler().marshal(document);

			return Response.withStatusCode(statusCode)
					.headers(Map.of("Content-Type", Set.of(getDocumentMarshaler().getContentType())))
					.body(body)
					.build();
		} catch (Throwable renderingThrowable) {
			safelyLog(LogEvent.with(LogEventType.ERROR_RESPONSE_RENDERING_FAILED,
							format("Unable to render error response for %s %s, falling back to failsafe response", request.getHttpMethod().name(), request.getPath()))
					.throwable(renderingThrowable)
					.request(request)
					.build());

			return failsafeResponse(statusCode);
		}
	}

	/**
	 * Builds the single log line describing a {@link Diagnosable} failure, for example
	 * {@code [AbortException: Not Found] [Identifier: AbortException.notFound] [Possible Causes: a, b]}.
	 * <p>
	 * Empty lists are omitted.
	 *
	 * @param diagnosable the failure to describe
	 * @return the log line
	 */
	@NonNull
	public static String loggableDescription(@NonNull Diagnosable diagnosable) {
		requireNonNull(diagnosable);

		List<String> segments = new ArrayList<>(7);
		segments.add(format("[%s: %s]", diagnosable.getReadableName(), diagnosable.getReason()));
		segments.add(format("[Identifier: %s]", diagnosable.getFullIdentifier()));

		addListSegment(segments, "Possible Causes", diagnosable.getPossibleCauses());
		addListSegment(segments, "Suggested Fixes", diagnosable.getSuggestedFixes());
		addListSegment(segments, "Documentation Links", diagnosable.getDocumentationLinks());
		addListSegment(segments, "Stack Overflow Questions", diagnosable.getStackOverflowQuestions());
		addListSegment(segments, "GitHub Issues", diagnosable.getGitHubIssues());

		return String.join(" ", segments);
	}

	private static void addListSegment(@NonNull List<String> segments,
																		 @NonNull String label,
																		 @Nullable List<String> values) {
		requireNonNull(segments);
		requireNonNull(label);

		if (values == null || values.size() == 0)
			return;

		segments.add(format("[%s: %s]", label, String.join(", ", values)));
	}

	@NonNull
	static Integer statusCodeFor(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		if (throwable instanceof Abortable abortable && abortable.getStatusCode() != null)
			return abortable.getStatusCode();

		return StatusCode.HTTP_500.getStatusCode();
	}

	@NonNull
	Document errorDocumentFor(@NonNull Throwable throwable,
														@NonNull Integer statusCode) {
		requireNonNull(throwable);
		requireNonNull(statusCode);

		Document document = Document.empty().set("error", true);

		if (getEnvironment().isProduction())
			return document.set("reason", StatusCode.reasonPhraseFor(statusCode));

		if (throwable instanceof Abortable abortable) {
			document.set("reason", StatusCode.reasonPhraseFor(statusCode));
			document.set("metadata", abortable.getMetadata());
		}

		if (throwable instanceof Diagnosable diagnosable) {
			document.set("reason", diagnosable.getReason());
			document.set("identifier", diagnosable.getFullIdentifier());

			setIfNotEmpty(document, "possibleCauses", diagnosable.getPossibleCauses());
			setIfNotEmpty(document, "suggestedFixes", diagnosable.getSuggestedFixes());
			setIfNotEmpty(document, "documentationLinks", diagnosable.getDocumentationLinks());
			setIfNotEmpty(document, "stackOverflowQuestions", diagnosable.getStackOverflowQuestions());
			setIfNotEmpty(document, "gitHubIssues", diagnosable.getGitHubIssues());
		}

		return document;
	}

	private static void setIfNotEmpty(@NonNull Document document,
																		@NonNull String name,
																		@Nullable List<String> values) {
		if (values != null && values.size() > 0)
			document.set(name, values);
	}

	@NonNull
	static Response failsafeResponse(@NonNull Integer statusCode) {
		requireNonNull(statusCode);

		return Response.withStatusCode(statusCode)
				.body(format("HTTP %d: %s", statusCode, StatusCode.reasonPhraseFor(statusCode)), "text/plain", StandardCharsets.UTF_8)
				.build();
	}

	private void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			LOGGER.error(format("%s failed while handling %s", LifecycleObserver.class.getSimpleName(), logEvent), throwable);
		}
	}

	@NonNull
	public Environment getEnvironment() {
		return this.environment;
	}

	@NonNull
	public ViewRenderer getViewRenderer() {
		return this.viewRenderer;
	}

	@NonNull
	public DocumentMarshaler getDocumentMarshaler() {
		return this.documentMarshaler;
	}

	@NonNull
	public LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}
}
