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

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HttpTransport} backed by the JDK {@link HttpClient}.
 *
 * @since 0.1.0
 */
public final class JdkHttpTransport implements HttpTransport {

	private static final Logger logger = LoggerFactory.getLogger(JdkHttpTransport.class);

	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

	private final HttpClient httpClient;

	public JdkHttpTransport() {
		this(HttpClient.newBuilder()
			.connectTimeout(DEFAULT_CONNECT_TIMEOUT)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build());
	}

	public JdkHttpTransport(HttpClient httpClient) {
		this.httpClient = httpClient;
	}

	@Override
	public TransportResponse send(TransportRequest request) throws IOException, InterruptedException {
		HttpRequest.BodyPublisher publisher = request.hasBody() ? HttpRequest.BodyPublishers.ofByteArray(request.body())
				: HttpRequest.BodyPublishers.noBody();

		HttpRequest.Builder builder = HttpRequest.newBuilder().uri(request.uri()).method(request.method(), publisher);
		if (request.timeout() != null) {
			builder.timeout(request.timeout());
		}
		request.headers().forEach(builder::header);

		logger.debug("Sending {}", request);
		HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
		logger.debug("Received {} for {}", response.statusCode(), request);

		return new TransportResponse(response.statusCode(), response.headers().map(), response.body());
	}

}
