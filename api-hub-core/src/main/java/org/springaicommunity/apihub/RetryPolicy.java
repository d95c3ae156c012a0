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
import java.util.Optional;

import org.springaicommunity.apihub.transport.TransportResponse;

/**
 * Decides how a call reacts to failures.
 *
 * <p>
 * Every method has a default that gives up, so a policy overrides only the failures it
 * cares about. The executor itself places no bound on the number of attempts; a policy
 * that always retries makes a call loop until it succeeds.
 * </p>
 *
 * @since 0.1.0
 * @see BackoffRetryPolicy
 */
public interface RetryPolicy {

	/**
	 * Called when the token provider failed.
	 * @param error the failure
	 * @return a substitute token, or empty to fail the call
	 */
	default Optional<String> onTokenError(IOException error) {
		return Optional.empty();
	}

	/**
	 * Called when the transport failed before a response was read.
	 * @param error the failure
	 * @param attempt the 1-based number of the attempt that failed
	 * @return the decision
	 */
	default Retry onTransportError(IOException error, int attempt) {
		return Retry.abort();
	}

	/**
	 * Called for a response with a non-2xx status.
	 * @param response the response
	 * @param serverError the parsed error envelope, if the body contained one
	 * @param attempt the 1-based number of the attempt that failed
	 * @return the decision
	 */
	default Retry onHttpFailure(TransportResponse response, Optional<ServerError> serverError, int attempt) {
		return Retry.abort();
	}

	/**
	 * Returns a policy that never retries and never substitutes a token.
	 * @return the policy
	 */
	static RetryPolicy never() {
		return new RetryPolicy() {
		};
	}

}
