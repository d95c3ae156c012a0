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

/**
 * Decision returned by a {@link RetryPolicy}: give up, or try again after a delay.
 *
 * @since 0.1.0
 */
public final class Retry {

	private static final Retry ABORT = new Retry(null);

	private final Duration delay;

	private Retry(Duration delay) {
		this.delay = delay;
	}

	public static Retry abort() {
		return ABORT;
	}

	public static Retry after(Duration delay) {
		Objects.requireNonNull(delay, "delay cannot be null");
		if (delay.isNegative()) {
			throw new IllegalArgumentException("delay cannot be negative: " + delay);
		}
		return new Retry(delay);
	}

	public boolean shouldRetry() {
		return delay != null;
	}

	/**
	 * Gets the delay before the next attempt.
	 * @return the delay
	 * @throws IllegalStateException if this decision is {@link #abort()}
	 */
	public Duration delay() {
		if (delay == null) {
			throw new IllegalStateException("abort has no delay");
		}
		return delay;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof Retry other && Objects.equals(delay, other.delay);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(delay);
	}

	@Override
	public String toString() {
		return delay == null ? "Retry.abort()" : "Retry.after(" + delay + ")";
	}

}
