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

/**
 * Waits between attempts of a call.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Sleeper {

	Sleeper SYSTEM = delay -> Thread.sleep(delay.toMillis());

	void sleep(Duration delay) throws InterruptedException;

}
