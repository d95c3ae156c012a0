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
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

import org.springaicommunity.apihub.transport.TransportResponse;

/**
 * {@link RetryPolicy} with exponential backoff and jitter.
 *
 * <p>
 * Transport errors and the statuses 429, 500, 502, 503 and 504 are retried up to
 * {@code maxRetries} times. A numeric {@code Retry-After} header overrides the computed
 * backoff, capped at {@code maxBackoff}. Without jitter the delay before retry
 * {@code n} is {@code initialBackoff * 2^(n-1)}, capped at {@code maxBackoff}; with
 * jitter it is a random value between half of that and all of it.
 * </p>
 *
 * <pre>{@code
 * Delegate delegate = Delegate.of(BackoffRetryPolicy.builder()
 *     .maxRetries(5)
 *     .initialBackoff(Duration.ofMillis(200))
 *     .build());
 * }</pre>
 *
 * @since 0.1.0
 */
public final class BackoffRetryPolicy implements RetryPolicy {

	private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

	private final int maxRetries;

	private final Duration initialBackoff;

	private final Duration maxBackoff;

	private final boolean jitter;

	private BackoffRetryPolicy(Builder builder) {
		this.maxRetries = builder.maxRetries;
		this.initialBackoff = Objects.requireNonNull(builder.initialBackoff, "initialBackoff cannot be null");
		this.maxBackoff = Objects.requireNonNull(builder.maxBackoff, "maxBackoff cannot be null");
		this.jitter = builder.jitter;
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries cannot be negative: " + maxRetries);
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	public int maxRetries() {
		return maxRetries;
	}

	@Override
	public Retry onTransportError(IOException error, int attempt) {
		if (attempt > maxRetries) {
			return Retry.abort();
		}
		return Retry.after(backoff(attempt));
	}

	@Override
	public Retry onHttpFailure(TransportResponse response, Optional<ServerError> serverError, int attempt) {
		if (attempt > maxRetries || !RETRYABLE_STATUSES.contains(response.statusCode())) {
			return Retry.abort();
		}
		Optional<Duration> retryAfter = retryAfter(response);
		if (retryAfter.isPresent()) {
			return Retry.after(min(retryAfter.get(), maxBackoff));
		}
		return Retry.after(backoff(attempt));
	}

	Duration backoff(int attempt) {
		int shift = Math.min(attempt - 1, 30);
		long baseMs = initialBackoff.toMillis() * (1L << shift);
		long cappedMs = Math.min(baseMs, maxBackoff.toMillis());
		if (!jitter) {
			return Duration.ofMillis(cappedMs);
		}
		return Duration.ofMillis(cappedMs / 2 + ThreadLocalRandom.current().nextLong(cappedMs / 2 + 1));
	}

	private static Optional<Duration> retryAfter(TransportResponse response) {
		return response.header("Retry-After").flatMap(value -> {
			try {
				long seconds = Long.parseLong(value.trim());
				return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
			}
			catch (NumberFormatException e) {
				// HTTP-date form, fall back to the computed backoff
				return Optional.empty();
			}
		});
	}

	private static Duration min(Duration a, Duration b) {
		return a.compareTo(b) <= 0 ? a : b;
	}

	public static final class Builder {

		private int maxRetries = 3;

		private Duration initialBackoff = Duration.ofMillis(500);

		private Duration maxBackoff = Duration.ofSeconds(30);

		private boolean jitter = true;

		/** Maximum number of retries after the first attempt (default: 3). */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/** Delay before the first retry (default: 500ms). */
		public Builder initialBackoff(Duration initialBackoff) {
			this.initialBackoff = initialBackoff;
			return this;
		}

		/** Cap on any single delay (default: 30s). */
		public Builder maxBackoff(Duration maxBackoff) {
			this.maxBackoff = maxBackoff;
			return this;
		}

		public Builder jitter(boolean jitter) {
			this.jitter = jitter;
			return this;
		}

		public BackoffRetryPolicy build() {
			return new BackoffRetryPolicy(this);
		}

	}

}
