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
package org.springaicommunity.apihub.chromemanagement.model;

import com.fasterxml.jackson.annotation.JsonFormat;

/**
 * Count of devices running one Chrome version on one channel.
 *
 * @since 0.1.0
 */
public record BrowserVersion(
		String channel,
		@JsonFormat(shape = JsonFormat.Shape.STRING) Long count,
		String deviceOsVersion,
		String system,
		String version) {
}
