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
 * Thrown for a non-2xx response carrying a structured server error.
 *
 * @since 0.1.0
 */
public class BadRequestException extends ApiException {

	private final ServerError error;

	private final TransportResponse response;

	public BadRequestException(ServerError error, TransportResponse response) {
		super(describe(error, response));
		this.error = error;
		this.response = response;
	}

	private static String describe(ServerError error, TransportResponse response) {
		StringBuilder sb = new StringBuilder("HTTP ").append(response.statusCode());
		if (error.status() != null) {
			sb.append(' ').append(error.status());
		}
		if (error.message() != null) {
			sb.append(" - ").append(error.message());
		}
		return sb.toString();
	}

	/**
	 * Gets the server error parsed from the response body.
	 * @return the server error
	 */
	public ServerError error() {
		return error;
	}

	public TransportResponse response() {
		return response;
	}

}
