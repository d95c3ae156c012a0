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
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import org.springaicommunity.apihub.transport.TransportRequest;
import org.springaicommunity.apihub.transport.TransportResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the attempt loop run by {@link ApiCall#execute()}.
 */
class RequestExecutorTest {

	private static final String SCOPE = "https://www.googleapis.com/auth/example.readonly";

	record Item(String name, int size) {
	}

	private static final ApiMethod<Item> GET = ApiMethod.builder(Item.class)
		.id("example.items.get")
		.path("v1/{+name}")
		.scopes(SCOPE)
		.build();

	private static final RetryPolicy ALWAYS_RETRY = new RetryPolicy() {
		@Override
		public Retry onTransportError(IOException error, int attempt) {
			return Retry.after(Duration.ofMillis(10));
		}

		@Override
		public Retry onHttpFailure(TransportResponse response, Optional<ServerError> serverError, int attempt) {
			return Retry.after(Duration.ofMillis(20));
		}
	};

	private final FakeTransport transport = new FakeTransport();

	private final List<Duration> sleeps = new ArrayList<>();

	private final AtomicInteger tokenRequests = new AtomicInteger();

	private TokenProvider tokenProvider = scopes -> {
		tokenRequests.incrementAndGet();
		return Optional.of("token-" + tokenRequests.get());
	};

	@AfterEach
	void clearInterruptFlag() {
		Thread.interrupted();
	}

	private ApiHub hub() {
		return ApiHub.builder()
			.baseUrl("https://example.googleapis.com/")
			.transport(transport)
			.tokenProvider(tokenProvider)
			.sleeper(sleeps::add)
			.build();
	}

	private ApiCall<Item> get() {
		return hub().newCall(GET).path("name", "items/one");
	}

	@Test
	void successShouldDecodeBodyAndSendHeaders() {
		transport.respond(200, "{\"name\":\"items/one\",\"size\":3,\"extra\":true}");

		ApiResponse<Item> response = get().execute();

		assertThat(response.body()).isEqualTo(new Item("items/one", 3));
		assertThat(response.raw().statusCode()).isEqualTo(200);
		TransportRequest request = transport.lastRequest();
		assertThat(request.method()).isEqualTo("GET");
		assertThat(request.uri()).hasToString("https://example.googleapis.com/v1/items/one?alt=json");
		assertThat(request.headers()).containsEntry("User-Agent", ApiHub.DEFAULT_USER_AGENT)
			.containsEntry("Authorization", "Bearer token-1")
			.doesNotContainKey("Content-Type");
		assertThat(request.hasBody()).isFalse();
	}

	@Test
	void transientFailuresShouldBeRetriedUntilSuccess() {
		transport.fail(new ConnectException("refused"))
			.respond(503, "busy")
			.respond(200, "{\"name\":\"items/one\",\"size\":1}");

		ApiResponse<Item> response = get().delegate(Delegate.of(ALWAYS_RETRY)).execute();

		assertThat(response.body().size()).isEqualTo(1);
		assertThat(transport.requests()).hasSize(3);
		assertThat(sleeps).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
		assertThat(tokenRequests.get()).isEqualTo(3);
		assertThat(transport.lastRequest().headers()).containsEntry("Authorization", "Bearer token-3");
	}

	@Test
	void defaultDelegateShouldNeverRetry() {
		transport.respond(503, "busy");

		assertThatThrownBy(() -> get().execute()).isInstanceOf(HttpFailureException.class)
			.satisfies(ex -> assertThat(((HttpFailureException) ex).statusCode()).isEqualTo(503));
		assertThat(transport.requests()).hasSize(1);
		assertThat(sleeps).isEmpty();
	}

	@Test
	void transportErrorShouldFailWithTransportExceptionWhenAborted() {
		transport.fail(new IOException("connection reset"));

		assertThatThrownBy(() -> get().execute()).isInstanceOf(TransportException.class)
			.hasCauseInstanceOf(IOException.class)
			.hasMessageContaining("connection reset");
		assertThat(transport.requests()).hasSize(1);
	}

	@Test
	void transportErrorMessageShouldNotRevealCredentials() {
		transport.fail(new IOException());

		assertThatThrownBy(() -> get().clearScopes()
			.param("key", "secret-api-key")
			.param("access_token", "secret-token")
			.execute()).isInstanceOf(TransportException.class)
			.hasMessageContaining("example.items.get")
			.hasMessageContaining("https://example.googleapis.com/v1/items/one")
			.hasMessageContaining("java.io.IOException")
			.hasMessageNotContaining("secret-api-key")
			.hasMessageNotContaining("secret-token")
			.hasMessageNotContaining("null");
	}

	@Test
	void errorEnvelopeShouldFailWithBadRequest() {
		transport.respond(404,
				"{\"error\":{\"code\":404,\"message\":\"App not found\",\"status\":\"NOT_FOUND\",\"details\":[{\"reason\":\"x\"}]}}");

		assertThatThrownBy(() -> get().execute()).isInstanceOf(BadRequestException.class)
			.hasMessageContaining("NOT_FOUND")
			.hasMessageContaining("App not found")
			.satisfies(ex -> {
				BadRequestException badRequest = (BadRequestException) ex;
				assertThat(badRequest.error().code()).isEqualTo(404);
				assertThat(badRequest.error().details()).hasSize(1);
				assertThat(badRequest.response().statusCode()).isEqualTo(404);
			});
	}

	@Test
	void bodyWithoutEnvelopeShouldFailWithHttpFailure() {
		transport.respond(500, "<html>oops</html>");

		assertThatThrownBy(() -> get().execute()).isInstanceOf(HttpFailureException.class)
			.satisfies(ex -> assertThat(((HttpFailureException) ex).response().body()).isEqualTo("<html>oops</html>"));
	}

	@Test
	void retriedHttpFailureShouldEndWithLastResponse() {
		AtomicInteger attempts = new AtomicInteger();
		RetryPolicy twice = new RetryPolicy() {
			@Override
			public Retry onHttpFailure(TransportResponse response, Optional<ServerError> serverError, int attempt) {
				attempts.set(attempt);
				return attempt < 3 ? Retry.after(Duration.ZERO) : Retry.abort();
			}
		};
		transport.respond(429, "{\"error\":{\"code\":429,\"status\":\"RESOURCE_EXHAUSTED\"}}");

		assertThatThrownBy(() -> get().delegate(Delegate.of(twice)).execute())
			.isInstanceOf(BadRequestException.class);
		assertThat(attempts.get()).isEqualTo(3);
		assertThat(transport.requests()).hasSize(3);
	}

	@Test
	void decodeErrorShouldNotBeRetried() {
		RecordingObserver observer = new RecordingObserver();
		transport.respond(200, "not json");

		assertThatThrownBy(() -> get().delegate(Delegate.of(ALWAYS_RETRY, observer)).execute())
			.isInstanceOf(JsonDecodeException.class)
			.satisfies(ex -> assertThat(((JsonDecodeException) ex).body()).isEqualTo("not json"));
		assertThat(transport.requests()).hasSize(1);
		assertThat(observer.events()).containsExactly("begin:example.items.get", "preRequest",
				"decodeError:not json", "finished:false");
	}

	@Test
	void emptyBodyShouldBeADecodeError() {
		transport.respond(200, "");

		assertThatThrownBy(() -> get().execute()).isInstanceOf(JsonDecodeException.class);
	}

	@Test
	void voidMethodShouldIgnoreTheBody() {
		ApiMethod<Void> delete = ApiMethod.builder(Void.class)
			.id("example.items.delete")
			.httpMethod("DELETE")
			.path("v1/{+name}")
			.scopes(SCOPE)
			.build();
		transport.respond(204, "");

		ApiResponse<Void> response = hub().newCall(delete).path("name", "items/one").execute();

		assertThat(response.body()).isNull();
		assertThat(transport.lastRequest().method()).isEqualTo("DELETE");
	}

	@Test
	void tokenErrorShouldUseSubstituteFromDelegate() {
		tokenProvider = scopes -> {
			throw new IOException("expired");
		};
		RetryPolicy substitute = new RetryPolicy() {
			@Override
			public Optional<String> onTokenError(IOException error) {
				return Optional.of("fallback");
			}
		};
		transport.respond(200, "{\"name\":\"n\",\"size\":0}");

		get().delegate(Delegate.of(substitute)).execute();

		assertThat(transport.lastRequest().headers()).containsEntry("Authorization", "Bearer fallback");
	}

	@Test
	void tokenErrorWithoutSubstituteShouldFailWithMissingToken() {
		tokenProvider = scopes -> {
			throw new IOException("expired");
		};
		RecordingObserver observer = new RecordingObserver();

		assertThatThrownBy(() -> get().delegate(Delegate.of(RetryPolicy.never(), observer)).execute())
			.isInstanceOf(MissingTokenException.class)
			.hasRootCauseMessage("expired")
			.satisfies(ex -> assertThat(((MissingTokenException) ex).scopes()).containsExactly(SCOPE));
		assertThat(transport.requests()).isEmpty();
		assertThat(observer.events()).containsExactly("begin:example.items.get", "finished:false");
	}

	@Test
	void emptyTokenShouldSendNoAuthorizationHeader() {
		tokenProvider = TokenProvider.none();
		transport.respond(200, "{\"name\":\"n\",\"size\":0}");

		get().execute();

		assertThat(transport.lastRequest().headers()).doesNotContainKey("Authorization");
	}

	@Test
	void clearedScopesWithoutKeyShouldFailWithMissingApiKey() {
		RecordingObserver observer = new RecordingObserver();

		assertThatThrownBy(
				() -> get().clearScopes().delegate(Delegate.of(RetryPolicy.never(), observer)).execute())
			.isInstanceOf(MissingApiKeyException.class)
			.hasMessageContaining("example.items.get");
		assertThat(transport.requests()).isEmpty();
		assertThat(observer.events()).containsExactly("begin:example.items.get", "finished:false");
	}

	@Test
	void clearedScopesWithKeyShouldSkipTokenAcquisition() {
		transport.respond(200, "{\"name\":\"n\",\"size\":0}");

		get().clearScopes().param("key", "api-key").execute();

		assertThat(tokenRequests.get()).isZero();
		assertThat(transport.lastRequest().headers()).doesNotContainKey("Authorization");
		assertThat(transport.lastRequest().uri().getRawQuery()).isEqualTo("key=api-key&alt=json");
	}

	@Test
	void interruptedSendShouldFailWithCancelled() {
		transport.fail(new InterruptedException());

		assertThatThrownBy(() -> get().execute()).isInstanceOf(CancelledException.class);
		assertThat(Thread.currentThread().isInterrupted()).isTrue();
	}

	@Test
	void interruptedSleepShouldFailWithCancelled() {
		transport.respond(503, "busy");
		ApiHub hub = ApiHub.builder()
			.baseUrl("https://example.googleapis.com/")
			.transport(transport)
			.tokenProvider(tokenProvider)
			.sleeper(delay -> {
				throw new InterruptedException();
			})
			.build();

		assertThatThrownBy(() -> hub.newCall(GET).path("name", "items/one").delegate(Delegate.of(ALWAYS_RETRY)).execute())
			.isInstanceOf(CancelledException.class);
		assertThat(Thread.currentThread().isInterrupted()).isTrue();
		assertThat(transport.requests()).hasSize(1);
	}

	@Test
	void observerShouldSeeEveryAttempt() {
		RecordingObserver observer = new RecordingObserver();
		transport.respond(500, "x").respond(200, "{\"name\":\"n\",\"size\":0}");

		get().delegate(Delegate.of(ALWAYS_RETRY, observer)).execute();

		assertThat(observer.events()).containsExactly("begin:example.items.get", "preRequest", "preRequest",
				"finished:true");
	}

	@Test
	void requestBodyShouldBeSentAsJson() {
		ApiMethod<Item> insert = ApiMethod.builder(Item.class)
			.id("example.items.insert")
			.httpMethod("POST")
			.path("v1/items")
			.acceptsBody(true)
			.scopes(SCOPE)
			.build();
		transport.respond(200, "{\"name\":\"items/new\",\"size\":2}");

		hub().newCall(insert).body(Map.of("size", 2)).execute();

		TransportRequest request = transport.lastRequest();
		assertThat(request.method()).isEqualTo("POST");
		assertThat(request.headers()).containsEntry("Content-Type", "application/json");
		assertThat(new String(request.body(), StandardCharsets.UTF_8)).isEqualTo("{\"size\":2}");
	}

	@Test
	void secondExecuteShouldFail() {
		transport.respond(200, "{\"name\":\"n\",\"size\":0}");
		ApiCall<Item> call = get();
		call.execute();

		assertThatThrownBy(call::execute).isInstanceOf(IllegalStateException.class);
		assertThat(transport.requests()).hasSize(1);
	}

	@Test
	void customUserAgentShouldBeSent() {
		transport.respond(200, "{\"name\":\"n\",\"size\":0}");
		ApiHub hub = ApiHub.builder()
			.baseUrl("https://example.googleapis.com/")
			.userAgent("my-tool/1.0")
			.transport(transport)
			.tokenProvider(tokenProvider)
			.build();

		hub.newCall(GET).path("name", "items/one").execute();

		assertThat(transport.lastRequest().headers()).containsEntry("User-Agent", "my-tool/1.0");
	}

}
