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
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Keeps everything it observes in memory instead of logging it.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
class RecordingLifecycleObserver implements LifecycleObserver {
	@NonNull
	private final List<LogEvent> logEvents = new CopyOnWriteArrayList<>();
	@NonNull
	private final List<Request> startedRequests = new CopyOnWriteArrayList<>();
	@NonNull
	private final List<List<Throwable>> finishedThrowables = new CopyOnWriteArrayList<>();
	@NonNull
	private final List<Response> finishedResponses = new CopyOnWriteArrayList<>();

	@Override
	public void didStartRequestHandling(@NonNull Request request) {
		this.startedRequests.add(request);
	}

	@Override
	public void didFinishRequestHandling(@NonNull Request request,
																			 @NonNull Response response,
																			 @NonNull Duration duration,
																			 @NonNull List<@NonNull Throwable> throwables) {
		this.finishedResponses.add(response);
		this.finishedThrowables.add(throwables);
	}

	@Override
	public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		this.logEvents.add(logEvent);
	}

	@NonNull
	List<LogEvent> getLogEvents() {
		return this.logEvents;
	}

	@NonNull
	List<LogEvent> logEventsOfType(@NonNull LogEventType logEventType) {
		return this.logEvents.stream()
				.filter(logEvent -> logEvent.getLogEventType() == logEventType)
				.collect(Collectors.toList());
	}

	@NonNull
	List<Request> getStartedRequests() {
		return this.startedRequests;
	}

	@NonNull
	List<Response> getFinishedResponses() {
		return this.finishedResponses;
	}

	@NonNull
	List<List<Throwable>> getFinishedThrowables() {
		return this.finishedThrowables;
	}
}
