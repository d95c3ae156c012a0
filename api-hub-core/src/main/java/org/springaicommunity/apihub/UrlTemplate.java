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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands RFC 6570 level 2 URL templates.
 *
 * <p>
 * {@code {name}} is a simple expansion: everything but unreserved characters is
 * percent-encoded. {@code {+name}} is a reserved expansion: {@code /} and the
 * characters that are legal inside a path segment are kept as well, while
 * {@code ?}, {@code #}, {@code %}, {@code [}, {@code ]}, space and non-ASCII
 * bytes are always encoded so the expanded path parses back to the original value.
 * </p>
 *
 * @since 0.1.0
 */
public final class UrlTemplate {

	private static final Pattern VARIABLE = Pattern.compile("\\{(\\+?)([A-Za-z0-9_.]+)}");

	private static final String UNRESERVED_MARKS = "-._~";

	private static final String RESERVED_KEPT = "/:@!$&'()*+,;=";

	private static final char[] HEX = "0123456789ABCDEF".toCharArray();

	private UrlTemplate() {
	}

	/**
	 * Lists the variable names of a template in order of appearance.
	 * @param template the template
	 * @return the distinct variable names
	 */
	public static List<String> variableNames(String template) {
		Set<String> names = new LinkedHashSet<>();
		Matcher matcher = VARIABLE.matcher(template);
		while (matcher.find()) {
			names.add(matcher.group(2));
		}
		return new ArrayList<>(names);
	}

	/**
	 * Expands a template against a parameter set. Consumed parameters are removed from
	 * {@code params}.
	 * @param template the template
	 * @param params the parameters, modified in place
	 * @return the expanded string
	 * @throws IllegalArgumentException if a variable has no value
	 */
	public static String expand(String template, Params params) {
		Matcher matcher = VARIABLE.matcher(template);
		StringBuilder result = new StringBuilder();
		Set<String> consumed = new LinkedHashSet<>();
		while (matcher.find()) {
			boolean reserved = !matcher.group(1).isEmpty();
			String name = matcher.group(2);
			String value = params.first(name)
				.orElseThrow(() -> new IllegalArgumentException(
						"Missing value for URL template variable '" + name + "' in " + template));
			matcher.appendReplacement(result, Matcher.quoteReplacement(encode(value, reserved)));
			consumed.add(name);
		}
		matcher.appendTail(result);
		params.remove(consumed);
		return result.toString();
	}

	/**
	 * Percent-encodes a value for use in a URL path.
	 * @param value the raw value
	 * @param reserved true for reserved expansion
	 * @return the encoded value
	 */
	public static String encode(String value, boolean reserved) {
		StringBuilder out = new StringBuilder(value.length());
		for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
			int c = b & 0xFF;
			if (isUnreserved(c) || (reserved && c < 0x80 && RESERVED_KEPT.indexOf(c) >= 0)) {
				out.append((char) c);
			}
			else {
				out.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
			}
		}
		return out.toString();
	}

	private static boolean isUnreserved(int c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
				|| (c < 0x80 && UNRESERVED_MARKS.indexOf(c) >= 0);
	}

}
