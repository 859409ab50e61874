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

import java.util.Locale;
import java.util.Optional;

import static com.turnstile.Utilities.trimAggressivelyToNull;

/**
 * The environment a dispatcher runs in, which controls how much failure detail clients may see.
 * <p>
 * The value is supplied once via {@link DispatcherConfig.Builder#environment(Environment)} and is never changed during dispatch.
 * How it is determined (system property, environment variable, configuration file...) is up to the hosting application;
 * {@link #fromName(String)} helps with the common spellings.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum Environment {
	/**
	 * Error documents contain only a generic reason phrase.
	 */
	PRODUCTION,
	/**
	 * Error documents contain all available diagnostics.
	 */
	DEVELOPMENT,
	/**
	 * Behaves like {@link #DEVELOPMENT}; intended for automated tests.
	 */
	TEST;

	@NonNull
	public Boolean isProduction() {
		return this == PRODUCTION;
	}

	/**
	 * Parses common environment names, ignoring case: {@code prod}/{@code production}, {@code dev}/{@code development}, {@code test}.
	 *
	 * @param name the environment name
	 * @return the environment, or {@link Optional#empty()} if the name is not recognized
	 */
	@NonNull
	public static Optional<Environment> fromName(@Nullable String name) {
		name = trimAggressivelyToNull(name);

		if (name == null)
			return Optional.empty();

		switch (name.toLowerCase(Locale.ENGLISH)) {
			case "prod":
			case "production":
				return Optional.of(PRODUCTION);
			case "dev":
			case "development":
				return Optional.of(DEVELOPMENT);
			case "test":
			case "testing":
				return Optional.of(TEST);
			default:
				return Optional.empty();
		}
	}
}
