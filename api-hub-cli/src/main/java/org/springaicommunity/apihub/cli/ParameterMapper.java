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
package org.springaicommunity.apihub.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springaicommunity.apihub.ApiCall;
import org.springaicommunity.apihub.ApiMethod;

/**
 * Applies {@code -p key=value} arguments to a call.
 *
 * <p>
 * Keys are the kebab-case form of the method's query parameters ({@code page-size} for
 * {@code pageSize}) or one of the global parameters every Google API accepts. A key
 * without {@code =value} sets an empty query parameter, or the global parameter to
 * {@code unset}.
 * </p>
 *
 * @since 0.1.0
 */
final class ParameterMapper {

	/** Command line name to wire name of the parameters every method accepts. */
	static final Map<String, String> GLOBAL_PARAMETERS;

	static {
		Map<String, String> global = new LinkedHashMap<>();
		global.put("$-xgafv", "$.xgafv");
		global.put("access-token", "access_token");
		global.put("alt", "alt");
		global.put("callback", "callback");
		global.put("fields", "fields");
		global.put("key", "key");
		global.put("oauth-token", "oauth_token");
		global.put("pretty-print", "prettyPrint");
		global.put("quota-user", "quotaUser");
		global.put("upload-type", "uploadType");
		global.put("upload-protocol", "upload_protocol");
		GLOBAL_PARAMETERS = Collections.unmodifiableMap(global);
	}

	private ParameterMapper() {
	}

	/**
	 * Applies every argument to the call, or none of them if any key is unknown.
	 * @param method the method being called
	 * @param call the call to configure
	 * @param arguments the raw {@code key=value} arguments
	 * @return the unknown keys, empty on success
	 */
	static List<String> apply(ApiMethod<?> method, ApiCall<?> call, List<String> arguments) {
		Map<String, String> queryNames = new LinkedHashMap<>();
		for (String name : method.queryParameters()) {
			queryNames.put(kebabCase(name), name);
		}

		List<String> unknown = new ArrayList<>();
		List<Runnable> updates = new ArrayList<>();
		for (String argument : arguments) {
			int separator = argument.indexOf('=');
			String key = separator < 0 ? argument : argument.substring(0, separator);
			String value = separator < 0 ? null : argument.substring(separator + 1);
			if (queryNames.containsKey(key)) {
				String name = queryNames.get(key);
				updates.add(() -> call.query(name, value != null ? value : ""));
			}
			else if (GLOBAL_PARAMETERS.containsKey(key)) {
				String name = GLOBAL_PARAMETERS.get(key);
				updates.add(() -> call.param(name, value != null ? value : "unset"));
			}
			else {
				unknown.add(key);
			}
		}
		if (unknown.isEmpty()) {
			updates.forEach(Runnable::run);
		}
		return unknown;
	}

	/**
	 * Lists the keys a method accepts, global parameters first.
	 * @param method the method
	 * @return the valid keys
	 */
	static List<String> validKeys(ApiMethod<?> method) {
		List<String> keys = new ArrayList<>(GLOBAL_PARAMETERS.keySet());
		method.queryParameters().stream().map(ParameterMapper::kebabCase).sorted().forEach(keys::add);
		return keys;
	}

	/**
	 * Converts a camel case name to kebab case, e.g. {@code countChromeVersions} to
	 * {@code count-chrome-versions}.
	 * @param name the camel case name
	 * @return the kebab case name
	 */
	static String kebabCase(String name) {
		StringBuilder sb = new StringBuilder(name.length() + 4);
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			if (Character.isUpperCase(c)) {
				if (i > 0) {
					sb.append('-');
				}
				sb.append(Character.toLowerCase(c));
			}
			else {
				sb.append(c);
			}
		}
		return sb.toString();
	}

}
