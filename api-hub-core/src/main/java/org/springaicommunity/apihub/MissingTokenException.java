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

import java.util.Set;

/**
 * Thrown when no bearer token could be obtained for the scopes of a call and the retry
 * policy did not supply a substitute.
 *
 * @since 0.1.0
 */
public class MissingTokenException extends ApiException {

	private final Set<String> scopes;

	public MissingTokenException(Set<String> scopes, Throwable cause) {
		super("Failed to obtain a token for scopes " + scopes, cause);
		this.scopes = Set.copyOf(scopes);
	}

	public Set<String> scopes() {
		return scopes;
	}

}
