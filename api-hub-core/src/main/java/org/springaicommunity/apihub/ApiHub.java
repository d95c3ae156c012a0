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

import java.time.Duration;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.springaicommunity.apihub.transport.HttpTransport;
import org.springaicommunity.apihub.transport.JdkHttpTransport;

/**
 * Entry point shared by all calls of one API: where requests go, how they are sent and
 * authenticated, and how payloads are mapped.
 *
 * <p>
 * A hub is immutable and thread-safe. Calls created from it each run their own attempt
 * loop on the calling thread.
 * </p>
 *
 * @since 0.1.0
 */
public class ApiHub {

	public static final String DEFAULT_USER_AGENT = "api-hub-java/0.1.0";

	private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofMinutes(1);

	private final String baseUrl;

	private final String userAgent;

	private final Duration requestTimeout;

	private final HttpTransport transport;

	private final TokenProvider tokenProvider;

	private final ObjectMapper objectMapper;

	private final Sleeper sleeper;

	private final RequestExecutor executor;

	protected ApiHub(Builder builder) {
		this.baseUrl = withTrailingSlash(Objects.requireNonNull(builder.baseUrl, "baseUrl cannot be null"));
		this.userAgent = builder.userAgent != null ? builder.userAgent : DEFAULT_USER_AGENT;
		this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : DEFAULT_REQUEST_TIMEOUT;
		this.transport = builder.transport != null ? builder.transport : new JdkHttpTransport();
		this.tokenProvider = builder.tokenProvider != null ? builder.tokenProvider : TokenProvider.none();
		this.objectMapper = builder.objectMapper != null ? builder.objectMapper : ApiJson.newObjectMapper();
		this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
		this.executor = new RequestExecutor(this);
	}

	public String baseUrl() {
		return baseUrl;
	}

	public String userAgent() {
		return userAgent;
	}

	public Duration requestTimeout() {
		return requestTimeout;
	}

	public HttpTransport transport() {
		return transport;
	}

	public TokenProvider tokenProvider() {
		return tokenProvider;
	}

	public ObjectMapper objectMapper() {
		return objectMapper;
	}

	public Sleeper sleeper() {
		return sleeper;
	}

	/**
	 * Starts a call of the given method.
	 * @param method the method
	 * @param <T> the response type
	 * @return a new call
	 */
	public <T> ApiCall<T> newCall(ApiMethod<T> method) {
		return new ApiCall<>(this, method);
	}

	<T> ApiResponse<T> execute(ApiMethod<T> method, ApiRequest request, Delegate delegate) {
		return executor.execute(method, request, delegate);
	}

	private static String withTrailingSlash(String url) {
		return url.endsWith("/") ? url : url + "/";
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private String baseUrl;

		private String userAgent;

		private Duration requestTimeout;

		private HttpTransport transport;

		private TokenProvider tokenProvider;

		private ObjectMapper objectMapper;

		private Sleeper sleeper;

		public Builder baseUrl(String baseUrl) {
			this.baseUrl = baseUrl;
			return this;
		}

		public Builder userAgent(String userAgent) {
			this.userAgent = userAgent;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder transport(HttpTransport transport) {
			this.transport = transport;
			return this;
		}

		public Builder tokenProvider(TokenProvider tokenProvider) {
			this.tokenProvider = tokenProvider;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		public ApiHub build() {
			return new ApiHub(this);
		}

	}

}
