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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An ordered, immutable sequence of {@link Middleware}.
 * <p>
 * Middleware registered first executes outermost: it sees the request first and the response last.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class MiddlewareChain {
	@NonNull
	private static final MiddlewareChain EMPTY_INSTANCE;

	static {
		EMPTY_INSTANCE = new MiddlewareChain(List.of());
	}

	@NonNull
	private final List<Middleware> middleware;

	@NonNull
	public static MiddlewareChain empty() {
		return EMPTY_INSTANCE;
	}

	/**
	 * Acquires a chain of the given middleware, outermost first.
	 *
	 * @param middleware the middleware to chain, outermost first
	 * @return a chain of the middleware
	 */
	@NonNull
	public static MiddlewareChain of(@NonNull Middleware... middleware) {
		requireNonNull(middleware);
		return withMiddleware(List.of(middleware));
	}

	/**
	 * Acquires a chain of the given middleware, outermost first.
	 *
	 * @param middleware the middleware to chain, outermost first
	 * @return a chain of the middleware
	 */
	@NonNull
	public static MiddlewareChain withMiddleware(@NonNull List<Middleware> middleware) {
		requireNonNull(middleware);
		return middleware.size() == 0 ? empty() : new MiddlewareChain(middleware);
	}

	private MiddlewareChain(@NonNull List<Middleware> middleware) {
		requireNonNull(middleware);

		for (Middleware currentMiddleware : middleware)
			if (currentMiddleware == null)
				throw new IllegalArgumentException(format("%s cannot contain null elements", MiddlewareChain.class.getSimpleName()));

		this.middleware = Collections.unmodifiableList(new ArrayList<>(middleware));
	}

	/**
	 * Vends a new chain with the given middleware appended (innermost).
	 *
	 * @param middleware the middleware to append
	 * @return a new chain
	 */
	@NonNull
	public MiddlewareChain with(@NonNull Middleware middleware) {
		requireNonNull(middleware);

		List<Middleware> combinedMiddleware = new ArrayList<>(getMiddleware());
		combinedMiddleware.add(middleware);

		return new MiddlewareChain(combinedMiddleware);
	}

	/**
	 * Composes this chain around {@code innermost}, right-to-left, into a single {@link Handler}.
	 * <p>
	 * The composed handler holds no per-request state, so it can be built once and shared across concurrent dispatches.
	 *
	 * @param innermost the handler to invoke after all middleware has called through
	 * @return the composed handler
	 */
	@NonNull
	public Handler chain(@NonNull Handler innermost) {
		requireNonNull(innermost);

		Handler handler = innermost;

		for (int i = getMiddleware().size() - 1; i >= 0; --i)
			handler = new MiddlewareHandler(getMiddleware().get(i), handler);

		return handler;
	}

	@NonNull
	public List<Middleware> getMiddleware() {
		return this.middleware;
	}

	@Override
	public String toString() {
		return format("%s{middleware=%s}", getClass().getSimpleName(), getMiddleware());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof MiddlewareChain middlewareChain))
			return false;

		return getMiddleware().equals(middlewareChain.getMiddleware());
	}

	@Override
	public int hashCode() {
		return getMiddleware().hashCode();
	}

	@ThreadSafe
	private static final class MiddlewareHandler implements Handler {
		@NonNull
		private final Middleware middleware;
		@NonNull
		private final Handler next;

		MiddlewareHandler(@NonNull Middleware middleware,
											@NonNull Handler next) {
			requireNonNull(middleware);
			requireNonNull(next);

			this.middleware = middleware;
			this.next = next;
		}

		@NonNull
		@Override
		public Response handle(@NonNull Request request) throws Exception {
			requireNonNull(request);

			Response response = this.middleware.handle(request, this.next);

			if (response == null)
				throw new IllegalStateException(format("%s %s returned a null %s", Middleware.class.getSimpleName(),
						this.middleware.getClass().getName(), Response.class.getSimpleName()));

			return response;
		}

		@Override
		public String toString() {
			return format("%s{middleware=%s}", getClass().getSimpleName(), this.middleware);
		}
	}
}
