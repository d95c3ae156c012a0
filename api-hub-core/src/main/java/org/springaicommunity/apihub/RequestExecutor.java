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
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.springaicommunity.apihub.transport.TransportRequest;
import org.springaicommunity.apihub.transport.TransportResponse;

/**
 * Runs the attempt loop of a call: acquire a token, send, then decode the response or
 * ask the delegate whether to try again.
 *
 * @since 0.1.0
 */
final class RequestExecutor {

	private static final Logger logger = LoggerFactory.getLogger(RequestExecutor.class);

	private final ApiHub hub;

	RequestExecutor(ApiHub hub) {
		this.hub = hub;
	}

	<T> ApiResponse<T> execute(ApiMethod<T> method, ApiRequest request, Delegate delegate) {
		delegate.begin(request.methodInfo());
		boolean successful = false;
		try {
			ApiResponse<T> response = run(method, request, delegate);
			successful = true;
			return response;
		}
		finally {
			delegate.finished(successful);
		}
	}

	private <T> ApiResponse<T> run(ApiMethod<T> method, ApiRequest request, Delegate delegate) {
		MethodInfo info = request.methodInfo();
		if (request.scopes().isEmpty() && !request.hasParam("key")) {
			throw new MissingApiKeyException(info.id());
		}
		URI uri = URI.create(request.url(hub.baseUrl()));
		byte[] body = request.body().orElse(null);

		int attempt = 0;
		while (true) {
			attempt++;
			Optional<String> token = acquireToken(request.scopes(), delegate);
			TransportRequest transportRequest = new TransportRequest(info.httpMethod(), uri, headers(token, body != null),
					body, hub.requestTimeout());

			delegate.preRequest();
			logger.debug("Attempt {} of {}: {}", attempt, info.id(), transportRequest);

			TransportResponse response;
			try {
				response = hub.transport().send(transportRequest);
			}
			catch (IOException e) {
				Retry retry = delegate.onTransportError(e, attempt);
				if (!retry.shouldRetry()) {
					throw new TransportException("Call of " + info.id() + " (" + transportRequest + ") failed: " + e, e);
				}
				logger.warn("Retrying {} after {} (attempt {}): {}", info.id(), retry.delay(), attempt, e.toString());
				sleep(retry.delay(), info);
				continue;
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new CancelledException("Call of " + info.id() + " was interrupted", e);
			}

			if (!response.isSuccessful()) {
				Optional<ServerError> serverError = ServerError.parse(hub.objectMapper(), response.body());
				Retry retry = delegate.onHttpFailure(response, serverError, attempt);
				if (retry.shouldRetry()) {
					logger.warn("Retrying {} after {} (attempt {}): HTTP {}", info.id(), retry.delay(), attempt,
							response.statusCode());
					sleep(retry.delay(), info);
					continue;
				}
				logger.debug("{} failed with HTTP {}", info.id(), response.statusCode());
				if (serverError.isPresent()) {
					throw new BadRequestException(serverError.get(), response);
				}
				throw new HttpFailureException(response);
			}

			return new ApiResponse<>(response, decode(method, response.body(), delegate));
		}
	}

	private Optional<String> acquireToken(Set<String> scopes, Delegate delegate) {
		if (scopes.isEmpty()) {
			return Optional.empty();
		}
		try {
			return hub.tokenProvider().getToken(scopes);
		}
		catch (IOException e) {
			logger.debug("Token provider failed for {}: {}", scopes, e.getMessage());
			return Optional.of(delegate.onTokenError(e).orElseThrow(() -> new MissingTokenException(scopes, e)));
		}
	}

	private Map<String, String> headers(Optional<String> token, boolean hasBody) {
		Map<String, String> headers = new LinkedHashMap<>();
		headers.put("User-Agent", hub.userAgent());
		token.ifPresent(t -> headers.put("Authorization", "Bearer " + t));
		if (hasBody) {
			headers.put("Content-Type", "application/json");
		}
		return headers;
	}

	private <T> T decode(ApiMethod<T> method, String body, Delegate delegate) {
		if (method.responseType().hasRawClass(Void.class)) {
			return null;
		}
		try {
			return hub.objectMapper().readValue(body, method.responseType());
		}
		catch (JsonProcessingException e) {
			delegate.onDecodeError(body, e);
			throw new JsonDecodeException(body, e);
		}
	}

	private void sleep(Duration delay, MethodInfo info) {
		try {
			hub.sleeper().sleep(delay);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CancelledException("Call of " + info.id() + " was interrupted while waiting to retry", e);
		}
	}

}
