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
package org.springaicommunity.apihub.chromemanagement;

import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.springaicommunity.apihub.ApiHub;
import org.springaicommunity.apihub.Sleeper;
import org.springaicommunity.apihub.TokenProvider;
import org.springaicommunity.apihub.transport.HttpTransport;

/**
 * Central instance of the Chrome Management API v1.
 *
 * <p>
 * Operations are grouped by resource; all of them live under {@link #customers()}.
 * </p>
 *
 * <pre>{@code
 * ChromeManagement hub = ChromeManagement.builder()
 *     .tokenProvider(TokenProvider.of(accessToken))
 *     .build();
 * AppDetails app = hub.customers()
 *     .appsAndroidGet("customers/my_customer/apps/android/com.example.app")
 *     .execute()
 *     .body();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class ChromeManagement {

	private static final Logger logger = LoggerFactory.getLogger(ChromeManagement.class);

	public static final String DEFAULT_BASE_URL = "https://chromemanagement.googleapis.com/";

	private final ApiHub hub;

	private ChromeManagement(ApiHub hub) {
		this.hub = hub;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Gets the pipeline shared by every call of this API.
	 * @return the hub
	 */
	public ApiHub hub() {
		return hub;
	}

	public CustomerMethods customers() {
		return new CustomerMethods(hub);
	}

	public static class Builder {

		private final ApiHub.Builder hub = ApiHub.builder().baseUrl(DEFAULT_BASE_URL);

		public Builder baseUrl(String baseUrl) {
			hub.baseUrl(baseUrl);
			return this;
		}

		public Builder userAgent(String userAgent) {
			hub.userAgent(userAgent);
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			hub.requestTimeout(requestTimeout);
			return this;
		}

		public Builder transport(HttpTransport transport) {
			hub.transport(transport);
			return this;
		}

		public Builder tokenProvider(TokenProvider tokenProvider) {
			hub.tokenProvider(tokenProvider);
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			hub.objectMapper(objectMapper);
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			hub.sleeper(sleeper);
			return this;
		}

		public ChromeManagement build() {
			ApiHub built = hub.build();
			logger.debug("Chrome Management hub targets {}", built.baseUrl());
			return new ChromeManagement(built);
		}

	}

}
