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

/**
 * Base exception for all failures of an API call.
 *
 * <p>
 * Subclasses identify the failure kind: validation problems detected before any network
 * I/O ({@link FieldClashException}, {@link MissingApiKeyException},
 * {@link UploadSizeLimitExceededException}), authentication problems
 * ({@link MissingTokenException}), transport problems ({@link TransportException}),
 * server-side failures ({@link BadRequestException}, {@link HttpFailureException}),
 * schema mismatches ({@link JsonDecodeException}) and interruption
 * ({@link CancelledException}).
 * </p>
 *
 * @since 0.1.0
 */
public class ApiException extends RuntimeException {

	public ApiException(String message) {
		super(message);
	}

	public ApiException(String message, Throwable cause) {
		super(message, cause);
	}

}
