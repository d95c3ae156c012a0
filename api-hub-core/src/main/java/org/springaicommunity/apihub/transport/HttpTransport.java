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
package org.springaicommunity.apihub.transport;

import java.io.IOException;

/**
 * Sends a single HTTP request.
 *
 * <p>
 * Implementations are shared between calls and must be safe for concurrent use. They
 * perform no retries; retry decisions belong to the request executor.
 * </p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HttpTransport {

	/**
	 * Sends the request and reads the whole response body.
	 * @param request the request to send
	 * @return the response, whatever its status code
	 * @throws IOException if the exchange failed before a response was read
	 * @throws InterruptedException if the calling thread was interrupted
	 */
	TransportResponse send(TransportRequest request) throws IOException, InterruptedException;

}
