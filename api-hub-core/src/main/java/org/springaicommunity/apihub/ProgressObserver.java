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

import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Receives lifecycle notifications for a call.
 *
 * @since 0.1.0
 */
public interface ProgressObserver {

	ProgressObserver NOOP = new ProgressObserver() {
	};

	/** Called once before the first attempt. */
	default void begin(MethodInfo info) {
	}

	/** Called before each request is sent. */
	default void preRequest() {
	}

	/**
	 * Called when a successful response could not be decoded.
	 * @param body the raw response body
	 * @param error the decoding failure
	 */
	default void onDecodeError(String body, JsonProcessingException error) {
	}

	/**
	 * Called exactly once when the call ends.
	 * @param successful whether the call produced a decoded response
	 */
	default void finished(boolean successful) {
	}

}
