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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Defines how a {@link Dispatcher} is configured.
 * <p>
 * Threadsafe instances can be acquired via the {@link #withRouter(Router)} builder factory method.
 * Anything not explicitly specified falls back to a sensible default:
 * <ul>
 *   <li>no middleware</li>
 *   <li>{@link FallbackHandler#defaultInstance()} for unmatched routes</li>
 *   <li>{@link Environment#PRODUCTION}, so that internal details are never sent to clients unless asked for</li>
 *   <li>{@link ViewRenderer#defaultInstance()}, {@link DocumentMarshaler#defaultInstance()} and {@link LifecycleObserver#defaultInstance()}</li>
 *   <li>{@value MethodNormalizer#DEFAULT_METHOD_OVERRIDE_FIELD_NAME} as the method override form field</li>
 * </ul>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class DispatcherConfig {
	@NonNull
	private final Router router;
	@NonNull
	private final MiddlewareChain middlewareChain;
	@NonNull
	private final Handler fallbackHandler;
	@NonNull
	private final Environment environment;
	@NonNull
	private final ViewRenderer viewRenderer;
	@NonNull
	private final DocumentMarshaler documentMarshaler;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final String methodOverrideFieldName;

	/**
	 * Vends a configuration builder, primed with the given {@link Router}.
	 *
	 * @param router the router necessary for construction
	 * @return a builder for {@link DispatcherConfig} instances
	 */
	@NonNull
	public static Builder withRouter(@NonNull Router router) {
		requireNonNull(router);
		return new Builder(router);
	}

	protected DispatcherConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		this.router = builder.router;
		this.middlewareChain = builder.middlewareChain != null ? builder.middlewareChain : MiddlewareChain.empty();
		this.fallbackHandler = builder.fallbackHandler != null ? builder.fallbackHandler : FallbackHandler.defaultInstance();
		this.environment = builder.environment != null ? builder.environment : Environment.PRODUCTION;
		this.viewRenderer = builder.viewRenderer != null ? builder.viewRenderer : ViewRenderer.defaultInstance();
		this.documentMarshaler = builder.documentMarshaler != null ? builder.documentMarshaler : DocumentMarshaler.defaultInstance();
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.methodOverrideFieldName = builder.methodOverrideFieldName != null ? builder.methodOverrideFieldName : MethodNormalizer.DEFAULT_METHOD_OVERRIDE_FIELD_NAME;

		if (Utilities.trimAggressivelyToNull(this.methodOverrideFieldName) == null)
			throw new IllegalArgumentException("Method override field name cannot be blank");
	}

	/**
	 * Vends a mutable copy of this instance's configuration, suitable for building new instances.
	 *
	 * @return a mutable copy of this instance's configuration
	 */
	@NonNull
	public Copier copy() {
		return new Copier(this);
	}

	@Override
	public String toString() {
		return format("%s{router=%s, middlewareChain=%s, environment=%s}", getClass().getSimpleName(),
				getRouter(), getMiddlewareChain(), getEnvironment());
	}

	/**
	 * Looks up handlers for inbound requests. Shared by all concurrent dispatches.
	 *
	 * @return the router
	 */
	@NonNull
	public Router getRouter() {
		return this.router;
	}

	/**
	 * Middleware wrapped around every dispatch; the first-registered middleware is outermost.
	 *
	 * @return the middleware chain
	 */
	@NonNull
	public MiddlewareChain getMiddlewareChain() {
		return this.middlewareChain;
	}

	/**
	 * Handles requests that the router did not match.
	 *
	 * @return the fallback handler
	 */
	@NonNull
	public Handler getFallbackHandler() {
		return this.fallbackHandler;
	}

	/**
	 * Decides how much failure detail reaches clients.
	 *
	 * @return the environment
	 */
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

	@NonNull
	public String getMethodOverrideFieldName() {
		return this.methodOverrideFieldName;
	}

	/**
	 * Builder used to construct instances of {@link DispatcherConfig}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private Router router;
		@Nullable
		private MiddlewareChain middlewareChain;
		@Nullable
		private Handler fallbackHandler;
		@Nullable
		private Environment environment;
		@Nullable
		private ViewRenderer viewRenderer;
		@Nullable
		private DocumentMarshaler documentMarshaler;
		@Nullable
		private LifecycleObserver lifecycleObserver;
		@Nullable
		private String methodOverrideFieldName;

		@NonNull
		Builder(@NonNull Router router) {
			requireNonNull(router);
			this.router = router;
		}

		@NonNull
		public Builder router(@NonNull Router router) {
			requireNonNull(router);
			this.router = router;
			return this;
		}

		@NonNull
		public Builder middlewareChain(@Nullable MiddlewareChain middlewareChain) {
			this.middlewareChain = middlewareChain;
			return this;
		}

		/**
		 * Convenience method equivalent to {@code middlewareChain(MiddlewareChain.of(middleware))}.
		 *
		 * @param middleware the middleware, outermost first
		 * @return this builder
		 */
		@NonNull
		public Builder middleware(@NonNull Middleware... middleware) {
			requireNonNull(middleware);
			this.middlewareChain = MiddlewareChain.of(middleware);
			return this;
		}

		@NonNull
		public Builder fallbackHandler(@Nullable Handler fallbackHandler) {
			this.fallbackHandler = fallbackHandler;
			return this;
		}

		@NonNull
		public Builder environment(@Nullable Environment environment) {
			this.environment = environment;
			return this;
		}

		@NonNull
		public Builder viewRenderer(@Nullable ViewRenderer viewRenderer) {
			this.viewRenderer = viewRenderer;
			return this;
		}

		@NonNull
		public Builder documentMarshaler(@Nullable DocumentMarshaler documentMarshaler) {
			this.documentMarshaler = documentMarshaler;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Builder methodOverrideFieldName(@Nullable String methodOverrideFieldName) {
			this.methodOverrideFieldName = methodOverrideFieldName;
			return this;
		}

		@NonNull
		public DispatcherConfig build() {
			return new DispatcherConfig(this);
		}
	}

	/**
	 * Builder used to copy instances of {@link DispatcherConfig} via {@link DispatcherConfig#copy()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Copier {
		@NonNull
		private final Builder builder;

		Copier(@NonNull DispatcherConfig dispatcherConfig) {
			requireNonNull(dispatcherConfig);

			this.builder = new Builder(dispatcherConfig.getRouter())
					.middlewareChain(dispatcherConfig.getMiddlewareChain())
					.fallbackHandler(dispatcherConfig.getFallbackHandler())
					.environment(dispatcherConfig.getEnvironment())
					.viewRenderer(dispatcherConfig.getViewRenderer())
					.documentMarshaler(dispatcherConfig.getDocumentMarshaler())
					.lifecycleObserver(dispatcherConfig.getLifecycleObserver())
					.methodOverrideFieldName(dispatcherConfig.getMethodOverrideFieldName());
		}

		@NonNull
		public Copier router(@NonNull Router router) {
			requireNonNull(router);
			this.builder.router(router);
			return this;
		}

		@NonNull
		public Copier middlewareChain(@Nullable MiddlewareChain middlewareChain) {
			this.builder.middlewareChain(middlewareChain);
			return this;
		}

		@NonNull
		public Copier fallbackHandler(@Nullable Handler fallbackHandler) {
			this.builder.fallbackHandler(fallbackHandler);
			return this;
		}

		@NonNull
		public Copier environment(@Nullable Environment environment) {
			this.builder.environment(environment);
			return this;
		}

		@NonNull
		public Copier viewRenderer(@Nullable ViewRenderer viewRenderer) {
			this.builder.viewRenderer(viewRenderer);
			return this;
		}

		@NonNull
		public Copier documentMarshaler(@Nullable DocumentMarshaler documentMarshaler) {
			this.builder.documentMarshaler(documentMarshaler);
			return this;
		}

		@NonNull
		public Copier lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.builder.lifecycleObserver(lifecycleObserver);
			return this;
		}

		@NonNull
		public Copier methodOverrideFieldName(@Nullable String methodOverrideFieldName) {
			this.builder.methodOverrideFieldName(methodOverrideFieldName);
			return this;
		}

		@NonNull
		public DispatcherConfig finish() {
			return this.builder.build();
		}
	}
}
