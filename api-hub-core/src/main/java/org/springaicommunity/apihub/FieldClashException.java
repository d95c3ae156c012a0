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
 * Thrown when an additional parameter uses the name of a parameter the method already
 * knows about. Raised while the request is assembled, so nothing is sent.
 *
 * @since 0.1.0
 */
public class FieldClashException extends ApiException {

	private final String field;

	public FieldClashException(String field) {
		super("Additional parameter '" + field + "' clashes with a parameter of the method; use its own setter");
		this.field = field;
	}

	/**
	 * Gets the offending parameter name.
	 * @return the clashing parameter name
	 */
	public String field() {
		return field;
	}

}
