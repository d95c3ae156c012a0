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

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;

/**
 * A whole or partial calendar date.
 *
 * <p>
 * A component set to {@code 0} is explicitly unspecified (a year and month with day
 * {@code 0} is a month, for example), which is not the same as a component that is
 * absent from the document ({@code null}).
 * </p>
 *
 * @param day day of month, 1 to 31, or 0
 * @param month month of year, 1 to 12, or 0
 * @param year year, 1 to 9999, or 0
 * @since 0.1.0
 */
public record GoogleTypeDate(Integer day, Integer month, Integer year) {

	/**
	 * Converts a fully specified date.
	 * @return the date, or empty if any component is absent or zero, or the components do
	 * not form a valid date
	 */
	public Optional<LocalDate> toLocalDate() {
		if (!isSet(day) || !isSet(month) || !isSet(year)) {
			return Optional.empty();
		}
		try {
			return Optional.of(LocalDate.of(year, month, day));
		}
		catch (DateTimeException e) {
			// out of range, or a day the month does not have
			return Optional.empty();
		}
	}

	private static boolean isSet(Integer value) {
		return value != null && value != 0;
	}

}
