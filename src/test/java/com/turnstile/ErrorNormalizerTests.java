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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;

/*
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ErrorNormalizerTests {
	@NonNull
	private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

	@Test
	public void diagnosable_log_line_includes_only_non_empty_lists() {
		AbortException abortException = AbortException.withStatusCode(404)
				.identifier("notFound")
				.possibleCauses(List.of("Typo in URL", "Resource was deleted"))
				.documentationLinks(List.of("https://example.com/errors/not-found"))
				.build();

		Assertions.assertEquals("[AbortException: Not Found] [Identifier: AbortException.notFound] [Possible Causes: Typo in URL, Resource was deleted] "
				+ "[Documentation Links: https://example.com/errors/not-found]", ErrorNormalizer.loggableDescription(abortException));
	}

	@Test
	public void diagnosable_log_line_includes_external_references() {
		Diagnosable diagnosable = new QuotaExceededException();

		Assertions.assertEquals("[QuotaExceededException: Monthly quota exceeded] [Identifier: QuotaExceededException.quotaExceeded] "
						+ "[Suggested Fixes: Upgrade your plan] [Stack Overflow Questions: https://stackoverflow.com/q/1] [GitHub Issues: https://github.com/example/repo/issues/2]",
				ErrorNormalizer.loggableDescription(diagnosable));
	}

	@Test
	public void diagnosable_failure_is_logged_without_hint() {
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		ErrorNormalizer errorNormalizer = errorNormalizer(Environment.DEVELOPMENT, observer);

		errorNormalizer.forThrowable(Request.withPath(HttpMethod.GET, "/missing").build(), AbortException.notFound());

		List<LogEvent> failures = observer.logEventsOfType(LogEventType.REQUEST_PROCESSING_FAILED);
		Assertions.assertEquals(1, failures.size());
		Assertions.assertEquals("[AbortException: Not Found] [Identifier: AbortException.notFound]", failures.get(0).getMessage());
		Assertions.assertTrue(observer.logEventsOfType(LogEventType.DIAGNOSABLE_NOT_IMPLEMENTED).isEmpty());
	}

	@Test
	public void full_identifier_is_used_in_document_and_log() throws Exception {
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		ErrorNormalizer errorNormalizer = errorNormalizer(Environment.DEVELOPMENT, observer);

		Response response = errorNormalizer.forThrowable(Request.withPath(HttpMethod.GET, "/x").build(), AbortException.notFound());

		JsonNode document = OBJECT_MAPPER.readTree(response.getBody().orElseThrow());
		Assertions.assertEquals("AbortException.notFound", document.get("identifier").asText());
		Assertions.assertTrue(observer.logEventsOfType(LogEventType.REQUEST_PROCESSING_FAILED).get(0).getMessage()
				.contains("[Identifier: AbortException.notFound]"));
	}

	@Test
	public void diagnosable_without_abortable_uses_500() throws Exception {
		ErrorNormalizer errorNormalizer = errorNormalizer(Environment.DEVELOPMENT, new RecordingLifecycleObserver());

		Response response = errorNormalizer.forThrowable(Request.withPath(HttpMethod.GET, "/quota").build(), new QuotaExceededException());

		Assertions.assertEquals(500, response.getStatusCode());

		JsonNode document = OBJECT_MAPPER.readTree(response.getBody().orElseThrow());
		Assertions.assertTrue(document.get("error").asBoolean());
		Assertions.assertEquals("Monthly quota exceeded", document.get("reason").asText());
		Assertions.assertEquals("QuotaExceededException.quotaExceeded", document.get("identifier").asText());
		Assertions.assertEquals("Upgrade your plan", document.get("suggestedFixes").get(0).asText());
		Assertions.assertEquals("https://stackoverflow.com/q/1", document.get("stackOverflowQuestions").get(0).asText());
		Assertions.assertEquals("https://github.com/example/repo/issues/2", document.get("gitHubIssues").get(0).asText());
		Assertions.assertFalse(document.has("possibleCauses"));
		Assertions.assertFalse(document.has("documentationLinks"));
		Assertions.assertFalse(document.has("metadata"));
	}

	@Test
	public void opaque_failure_outside_production_has_only_error_field() throws Exception {
		ErrorNormalizer errorNormalizer = errorNormalizer(Environment.DEVELOPMENT, new RecordingLifecycleObserver());

		Response response = errorNormalizer.forThrowable(Request.withPath(HttpMethod.GET, "/").build(), new RuntimeException("secret"));

		JsonNode document = OBJECT_MAPPER.readTree(response.getBody().orElseThrow());
		Assertions.assertEquals(500, response.getStatusCode());
		Assertions.assertEquals(1, document.size());
		Assertions.assertTrue(document.get("error").asBoolean());
	}

	@Test
	public void production_document_contains_only_error_and_reason_phrase() throws Exception {
		ErrorNormalizer errorNormalizer = errorNormalizer(Environment.PRODUCTION, new RecordingLifecycleObserver());

		Response response = errorNormalizer.forThrowable(Request.withPath(HttpMethod.GET, "/").build(), new RuntimeException("secret"));

		JsonNode document = OBJECT_MAPPER.readTree(response.getBody().orElseThrow());
		Assertions.assertEquals(2, document.size());
		Assertions.assertEquals("Internal Server Error", document.get("reason").asText());
		Assertions.assertFalse(response.getBodyAsString().orElseThrow().contains("secret"));
	}

	@Test
	public void production_logs_full_detail() {
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		ErrorNormalizer errorNormalizer = errorNormalizer(Environment.PRODUCTION, observer);

		errorNormalizer.forThrowable(Request.withPath(HttpMethod.GET, "/").build(), AbortException.withStatusCode(409)
				.reason("Row 42 is locked")
				.identifier("rowLocked")
				.build());

		Assertions.assertEquals("[AbortException: Row 42 is locked] [Identifier: AbortException.rowLocked]",
				observer.logEventsOfType(LogEventType.REQUEST_PROCESSING_FAILED).get(0).getMessage());
	}

	@Test
	public void view_renderer_status_is_forced_to_resolved_status() {
		ViewRenderer viewRenderer = (request, throwable, statusCode) ->
				Response.withStatusCode(200).body("<p>oops</p>", "text/html", StandardCharsets.UTF_8).build();

		ErrorNormalizer errorNormalizer = new ErrorNormalizer(Environment.DEVELOPMENT, viewRenderer,
				DocumentMarshaler.defaultInstance(), new RecordingLifecycleObserver());

		Response response = errorNormalizer.forThrowable(htmlRequest(), AbortException.forbidden());

		Assertions.assertEquals(403, response.getStatusCode());
		Assertions.assertEquals("<p>oops</p>", response.getBodyAsString().orElse(null));
	}

	@Test
	public void default_view_renderer_omits_failure_details() {
		ErrorNormalizer errorNormalizer = errorNormalizer(Environment.DEVELOPMENT, new RecordingLifecycleObserver());

		Response response = errorNormalizer.forThrowable(htmlRequest(), new RuntimeException("<script>secret</script>"));

		String body = response.getBodyAsString().orElseThrow();
		Assertions.assertEquals(500, response.getStatusCode());
		Assertions.assertTrue(body.contains("<title>500 Internal Server Error</title>"));
		Assertions.assertFalse(body.contains("secret"));
	}

	@Test
	public void failing_view_renderer_yields_failsafe_response() {
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		ViewRenderer viewRenderer = (request, throwable, statusCode) -> {
			throw new IllegalStateException("Template missing");
		};

		ErrorNormalizer errorNormalizer = new ErrorNormalizer(Environment.DEVELOPMENT, viewRenderer,
				DocumentMarshaler.defaultInstance(), observer);

		Response response = errorNormalizer.forThrowable(htmlRequest(), AbortException.notFound());

		Assertions.assertEquals(404, response.getStatusCode());
		Assertions.assertEquals("text/plain; charset=UTF-8", response.getHeader("Content-Type").orElse(null));
		Assertions.assertEquals("HTTP 404: Not Found", response.getBodyAsString().orElse(null));
		Assertions.assertEquals(1, observer.logEventsOfType(LogEventType.ERROR_RESPONSE_RENDERING_FAILED).size());
	}

	@Test
	public void failing_document_marshaler_yields_failsafe_response() {
		DocumentMarshaler documentMarshaler = new DocumentMarshaler() {
			@NonNull
			@Override
			public byte[] marshal(@NonNull Document document) throws Exception {
				throw new Exception("Serializer offline");
			}

			@NonNull
			@Override
			public String getContentType() {
				return "application/json";
			}
		};

		ErrorNormalizer errorNormalizer = new ErrorNormalizer(Environment.DEVELOPMENT, ViewRenderer.defaultInstance(),
				documentMarshaler, new RecordingLifecycleObserver());

		Response response = errorNormalizer.forThrowable(Request.withPath(HttpMethod.GET, "/").build(), new RuntimeException());

		Assertions.assertEquals(500, response.getStatusCode());
		Assertions.assertEquals("HTTP 500: Internal Server Error", response.getBodyAsString().orElse(null));
	}

	@Test
	public void missing_content_type_is_warned() {
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		ErrorNormalizer errorNormalizer = errorNormalizer(Environment.DEVELOPMENT, observer);

		errorNormalizer.inspectResponse(Request.withPath(HttpMethod.GET, "/").build(),
				Response.withStatusCode(200).body("raw".getBytes(StandardCharsets.UTF_8)).build());

		List<LogEvent> warnings = observer.logEventsOfType(LogEventType.RESPONSE_MISSING_CONTENT_TYPE);
		Assertions.assertEquals(1, warnings.size());
		Assertions.assertEquals(LogLevel.WARNING, warnings.get(0).getLogLevel());
	}

	@Test
	public void not_modified_is_exempt_from_content_type_warning() {
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		ErrorNormalizer errorNormalizer = errorNormalizer(Environment.DEVELOPMENT, observer);

		errorNormalizer.inspectResponse(Request.withPath(HttpMethod.GET, "/").build(), Response.withStatusCode(304).build());
		errorNormalizer.inspectResponse(Request.withPath(HttpMethod.GET, "/").build(),
				Response.withStatusCode(200).headers(Map.of("content-type", Set.of("text/plain"))).build());

		Assertions.assertTrue(observer.getLogEvents().isEmpty());
	}

	@NonNull
	private static ErrorNormalizer errorNormalizer(@NonNull Environment environment,
																								 @NonNull LifecycleObserver lifecycleObserver) {
		return new ErrorNormalizer(environment, ViewRenderer.defaultInstance(), DocumentMarshaler.defaultInstance(), lifecycleObserver);
	}

	@NonNull
	private static Request htmlRequest() {
		return Request.withPath(HttpMethod.GET, "/page")
				.headers(Map.of("Accept", Set.of("text/html")))
				.build();
	}

	private static class QuotaExceededException extends RuntimeException implements Diagnosable {
		@NonNull
		@Override
		public String getReason() {
			return "Monthly quota exceeded";
		}

		@NonNull
		@Override
		public String getIdentifier() {
			return "quotaExceeded";
		}

		@NonNull
		@Override
		public List<String> getSuggestedFixes() {
			return List.of("Upgrade your plan");
		}

		@NonNull
		@Override
		public List<String> getStackOverflowQuestions() {
			return List.of("https://stackoverflow.com/q/1");
		}

		@NonNull
		@Override
		public List<String> getGitHubIssues() {
			return List.of("https://github.com/example/repo/issues/2");
		}
	}
}
