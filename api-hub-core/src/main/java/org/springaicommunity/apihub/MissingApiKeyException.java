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

/**
 * Thrown when a call without scopes carries no {@code key} parameter, leaving it with
 * neither a token nor an API key.
 *
 * @since 0.1.0
 */
public class MissingApiKeyException extends ApiException {

	public MissingApiKeyException(String methodId) {
		super("Method " + methodId + " has no scopes and no 'key' parameter was provided");
	}

}
