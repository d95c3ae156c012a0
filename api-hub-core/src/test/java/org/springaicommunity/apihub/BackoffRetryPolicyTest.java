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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import org.springaicommunity.apihub.transport.TransportResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BackoffRetryPolicy}.
 */
class BackoffRetryPolicyTest {

	private final BackoffRetryPolicy policy = BackoffRetryPolicy.builder()
		.maxRetries(4)
		.initialBackoff(Duration.ofMillis(100))
		.maxBackoff(Duration.ofMillis(500))
		.jitter(false)
		.build();

	@Test
	void backoffShouldDoubleUpToTheCap() {
		List<Duration> delays = new ArrayList<>();
		for (int attempt = 1; attempt <= 4; attempt++) {
			delays.add(policy.onTransportError(new IOException("reset"), attempt).delay());
		}

		assertThat(delays).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400),
				Duration.ofMillis(500));
	}

	@Test
	void attemptsBeyondMaxRetriesShouldAbort() {
		assertThat(policy.onTransportError(new IOException("reset"), 5).shouldRetry()).isFalse();
		assertThat(policy.onHttpFailure(TransportResponse.of(503, ""), Optional.empty(), 5).shouldRetry()).isFalse();
	}

	@Test
	void onlyTransientStatusesShouldBeRetried() {
		for (int status : new int[] { 429, 500, 502, 503, 504 }) {
			assertThat(policy.onHttpFailure(TransportResponse.of(status, ""), Optional.empty(), 1).shouldRetry())
				.as("status %d", status)
				.isTrue();
		}
		for (int status : new int[] { 400, 401, 403, 404, 409, 501 }) {
			assertThat(policy.onHttpFailure(TransportResponse.of(status, ""), Optional.empty(), 1).shouldRetry())
				.as("status %d", status)
				.isFalse();
		}
	}

	@Test
	void numericRetryAfterShouldOverrideBackoffWithinTheCap() {
		BackoffRetryPolicy lenient = BackoffRetryPolicy.builder().maxBackoff(Duration.ofSeconds(30)).build();

		Retry shortWait = lenient.onHttpFailure(response(429, "7"), Optional.empty(), 1);
		Retry longWait = lenient.onHttpFailure(response(429, "3600"), Optional.empty(), 1);

		assertThat(shortWait.delay()).isEqualTo(Duration.ofSeconds(7));
		assertThat(longWait.delay()).isEqualTo(Duration.ofSeconds(30));
	}

	@Test
	void dateRetryAfterShouldFallBackToBackoff() {
		Retry retry = policy.onHttpFailure(response(503, "Wed, 21 Oct 2026 07:28:00 GMT"), Optional.empty(), 2);

		assertThat(retry.delay()).isEqualTo(Duration.ofMillis(200));
	}

	@Test
	void jitterShouldStayBetweenHalfAndFullBackoff() {
		BackoffRetryPolicy jittered = BackoffRetryPolicy.builder()
			.initialBackoff(Duration.ofMillis(1000))
			.maxBackoff(Duration.ofSeconds(10))
			.build();

		for (int i = 0; i < 50; i++) {
			assertThat(jittered.backoff(2)).isBetween(Duration.ofMillis(1000), Duration.ofMillis(2000));
		}
	}

	@Test
	void negativeMaxRetriesShouldBeRejected() {
		assertThatThrownBy(() -> BackoffRetryPolicy.builder().maxRetries(-1).build())
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void callShouldBeRetriedUntilRetriesAreExhausted() {
		FakeTransport transport = new FakeTransport().respond(503, "unavailable");
		List<Duration> sleeps = new ArrayList<>();
		ApiHub hub = ApiHub.builder()
			.baseUrl("https://example.googleapis.com/")
			.transport(transport)
			.tokenProvider(TokenProvider.of("t"))
			.sleeper(sleeps::add)
			.build();
		ApiMethod<JsonNode> method = ApiMethod.builder(JsonNode.class)
			.id("example.ping")
			.path("v1/ping")
			.scopes("https://www.googleapis.com/auth/example")
			.build();
		Delegate delegate = Delegate
			.of(BackoffRetryPolicy.builder().maxRetries(2).initialBackoff(Duration.ofMillis(50)).jitter(false).build());

		assertThatThrownBy(() -> hub.newCall(method).delegate(delegate).execute())
			.isInstanceOf(HttpFailureException.class);
		assertThat(transport.requests()).hasSize(3);
		assertThat(sleeps).containsExactly(Duration.ofMillis(50), Duration.ofMillis(100));
	}

	private static TransportResponse response(int status, String retryAfter) {
		return new TransportResponse(status, Map.of("retry-after", List.of(retryAfter)), "");
	}

}
