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

import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * An HTTP request ready to be sent.
 *
 * @param method the HTTP method
 * @param uri the full request URI, query string included
 * @param headers request headers
 * @param body the request body, or {@code null} when there is none; copied on the way in
 * and out, and compared by content
 * @param timeout the request timeout, or {@code null} for the transport default
 * @since 0.1.0
 */
public record TransportRequest(String method, URI uri, Map<String, String> headers, byte[] body, Duration timeout) {

	public TransportRequest {
		Objects.requireNonNull(method, "method cannot be null");
		Objects.requireNonNull(uri, "uri cannot be null");
		headers = Map.copyOf(headers);
		body = (body != null) ? body.clone() : null;
	}

	@Override
	public byte[] body() {
		return (body != null) ? body.clone() : null;
	}

	public boolean hasBody() {
		return body != null;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof TransportRequest)) {
			return false;
		}
		TransportRequest other = (TransportRequest) o;
		return method.equals(other.method) && uri.equals(other.uri) && headers.equals(other.headers)
				&& Arrays.equals(body, other.body) && Objects.equals(timeout, other.timeout);
	}

	@Override
	public int hashCode() {
		return Objects.hash(method, uri, headers, Arrays.hashCode(body), timeout);
	}

	/**
	 * Describes the request without its query string, which may carry credentials such
	 * as {@code key} or {@code access_token}.
	 */
	@Override
	public String toString() {
		return method + " " + uri.getScheme() + "://" + uri.getRawAuthority() + uri.getRawPath();
	}

}
