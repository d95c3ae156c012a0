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

import org.springaicommunity.apihub.transport.TransportResponse;

/**
 * Thrown for a non-2xx response whose body is not a structured server error.
 *
 * @since 0.1.0
 */
public class HttpFailureException extends ApiException {

	private final TransportResponse response;

	public HttpFailureException(TransportResponse response) {
		super("HTTP " + response.statusCode() + " - " + response.body());
		this.response = response;
	}

	/**
	 * Gets the raw response, body included.
	 * @return the failed response
	 */
	public TransportResponse response() {
		return response;
	}

	public int statusCode() {
		return response.statusCode();
	}

}
