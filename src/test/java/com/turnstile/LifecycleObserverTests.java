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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;

/*
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class LifecycleObserverTests {
	private Logger logger;
	private ListAppender<ILoggingEvent> listAppender;

	@BeforeEach
	public void attachAppender() {
		this.logger = (Logger) LoggerFactory.getLogger(LifecycleObserver.class);
		this.listAppender = new ListAppender<>();
		this.listAppender.start();
		this.logger.addAppender(this.listAppender);
	}

	@AfterEach
	public void detachAppender() {
		this.logger.detachAppender(this.listAppender);
		this.listAppender.stop();
	}

	@Test
	public void default_observer_logs_at_event_level() {
		LifecycleObserver lifecycleObserver = LifecycleObserver.defaultInstance();

		lifecycleObserver.didReceiveLogEvent(LogEvent.with(LogEventType.REQUEST_RECEIVED, "GET /users").build());
		lifecycleObserver.didReceiveLogEvent(LogEvent.with(LogEventType.RESPONSE_MISSING_CONTENT_TYPE, "No Content-Type").build());
		lifecycleObserver.didReceiveLogEvent(LogEvent.with(LogEventType.REQUEST_PROCESSING_FAILED, "[java.lang.RuntimeException: boom]")
				.throwable(new RuntimeException("boom"))
				.build());

		Assertions.assertEquals(3, this.listAppender.list.size());
		Assertions.assertEquals(Level.INFO, this.listAppender.list.get(0).getLevel());
		Assertions.assertEquals("GET /users", this.listAppender.list.get(0).getFormattedMessage());
		Assertions.assertEquals(Level.WARN, this.listAppender.list.get(1).getLevel());
		Assertions.assertEquals(Level.ERROR, this.listAppender.list.get(2).getLevel());
		Assertions.assertNotNull(this.listAppender.list.get(2).getThrowableProxy());
	}

	@Test
	public void dispatcher_logs_request_line_through_default_observer() {
		Dispatcher dispatcher = new Dispatcher(DispatcherConfig.withRouter(new MapRouter()).build());

		dispatcher.dispatch(Request.withPath(HttpMethod.DELETE, "/users/1").build());

		Assertions.assertTrue(this.listAppender.list.stream()
				.anyMatch(event -> event.getLevel() == Level.INFO && event.getFormattedMessage().equals("DELETE /users/1")));
	}

	@Test
	public void every_event_type_has_a_level() {
		for (LogEventType logEventType : LogEventType.values())
			Assertions.assertNotNull(logEventType.getLogLevel());

		Assertions.assertEquals(LogLevel.ERROR, LogEventType.LIFECYCLE_OBSERVER_FAILED.getLogLevel());
		Assertions.assertEquals(LogLevel.WARNING, LogEventType.METHOD_OVERRIDE_IGNORED.getLogLevel());
	}
}
