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
package org.springaicommunity.apihub.transport;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A fully read HTTP response.
 *
 * @param statusCode the HTTP status code
 * @param headers response headers
 * @param body the response body as text, never {@code null}
 * @since 0.1.0
 */
public record TransportResponse(int statusCode, Map<String, List<String>> headers, String body) {

	public TransportResponse {
		headers = headers != null ? Map.copyOf(headers) : Map.of();
		body = Objects.requireNonNullElse(body, "");
	}

	/**
	 * Creates a response without headers.
	 * @param statusCode the HTTP status code
	 * @param body the response body
	 * @return a new response
	 */
	public static TransportResponse of(int statusCode, String body) {
		return new TransportResponse(statusCode, Map.of(), body);
	}

	/**
	 * Indicates whether the status code is in the 2xx range.
	 * @return true for a successful status
	 */
	public boolean isSuccessful() {
		return statusCode >= 200 && statusCode < 300;
	}

	/**
	 * Gets the first value of a header, matching the name case-insensitively.
	 * @param name the header name
	 * @return the first header value, if present
	 */
	public Optional<String> header(String name) {
		return headers.entrySet()
			.stream()
			.filter(e -> e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty())
			.map(e -> e.getValue().get(0))
			.findFirst();
	}

}
