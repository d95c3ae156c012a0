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
 * Thrown when a request body is larger than the maximum the method accepts.
 *
 * @since 0.1.0
 */
public class UploadSizeLimitExceededException extends ApiException {

	private final long size;

	private final long limit;

	public UploadSizeLimitExceededException(long size, long limit) {
		super("Upload of " + size + " bytes exceeds the limit of " + limit + " bytes");
		this.size = size;
		this.limit = limit;
	}

	public long size() {
		return size;
	}

	public long limit() {
		return limit;
	}

}
