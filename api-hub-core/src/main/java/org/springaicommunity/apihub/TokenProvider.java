/*
 * Copyright 2024 Spring AI Community
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.springaicommunity.apihub;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Supplies OAuth2 bearer tokens for a set of scopes.
 *
 * <p>
 * The pipeline asks for a token on every attempt and never caches the result; caching
 * and refreshing are the provider's business. An empty result means the request is sent
 * without an {@code Authorization} header.
 * </p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TokenProvider {

	/**
	 * Obtains a token.
	 * @param scopes the scopes the request needs, never empty
	 * @return the token, or empty to send the request unauthenticated
	 * @throws IOException if a token could not be obtained
	 */
	Optional<String> getToken(Set<String> scopes) throws IOException;

	/**
	 * Returns a provider that always hands out the same token.
	 * @param token the bearer token
	 * @return the provider
	 */
	static TokenProvider of(String token) {
		Objects.requireNonNull(token, "token cannot be null");
		return scopes -> Optional.of(token);
	}

	/**
	 * Returns a provider that never supplies a token.
	 * @return the provider
	 */
	static TokenProvider none() {
		return scopes -> Optional.empty();
	}

	/**
	 * Returns a provider that reads the token from an environment variable on each
	 * request.
	 * @param variable the environment variable name
	 * @return the provider, failing with an {@link IOException} while the variable is
	 * unset or blank
	 */
	static TokenProvider fromEnvironment(String variable) {
		return scopes -> {
			String token = System.getenv(variable);
			if (token == null || token.isBlank()) {
				throw new IOException(variable + " environment variable is not set");
			}
			return Optional.of(token);
		};
	}

}
