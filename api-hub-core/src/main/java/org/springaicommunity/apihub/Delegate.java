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
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;

import org.springaicommunity.apihub.transport.TransportResponse;

/**
 * Pairs a {@link RetryPolicy} with a {@link ProgressObserver} for one call.
 *
 * @since 0.1.0
 */
public final class Delegate implements RetryPolicy, ProgressObserver {

	private static final Delegate DEFAULTS = new Delegate(RetryPolicy.never(), ProgressObserver.NOOP);

	private final RetryPolicy retryPolicy;

	private final ProgressObserver observer;

	private Delegate(RetryPolicy retryPolicy, ProgressObserver observer) {
		this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
		this.observer = Objects.requireNonNull(observer, "observer cannot be null");
	}

	/**
	 * Returns the delegate used when none is set: no retries, no notifications.
	 * @return the default delegate
	 */
	public static Delegate defaults() {
		return DEFAULTS;
	}

	public static Delegate of(RetryPolicy retryPolicy) {
		return new Delegate(retryPolicy, ProgressObserver.NOOP);
	}

	public static Delegate of(RetryPolicy retryPolicy, ProgressObserver observer) {
		return new Delegate(retryPolicy, observer);
	}

	public RetryPolicy retryPolicy() {
		return retryPolicy;
	}

	public ProgressObserver observer() {
		return observer;
	}

	@Override
	public Optional<String> onTokenError(IOException error) {
		return retryPolicy.onTokenError(error);
	}

	@Override
	public Retry onTransportError(IOException error, int attempt) {
		return retryPolicy.onTransportError(error, attempt);
	}

	@Override
	public Retry onHttpFailure(TransportResponse response, Optional<ServerError> serverError, int attempt) {
		return retryPolicy.onHttpFailure(response, serverError, attempt);
	}

	@Override
	public void begin(MethodInfo info) {
		observer.begin(info);
	}

	@Override
	public void preRequest() {
		observer.preRequest();
	}

	@Override
	public void onDecodeError(String body, JsonProcessingException error) {
		observer.onDecodeError(body, error);
	}

	@Override
	public void finished(boolean successful) {
		observer.finished(successful);
	}

}
