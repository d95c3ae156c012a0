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
package org.springaicommunity.apihub.chromemanagement;

/**
 * OAuth2 scopes of the Chrome Management API.
 *
 * @since 0.1.0
 */
public enum Scope {

	/** See detailed information about apps installed on Chrome browsers and devices. */
	APP_DETAILS_READONLY("https://www.googleapis.com/auth/chrome.management.appdetails.readonly"),

	/** See reports about devices and Chrome browsers managed within your organization. */
	REPORTS_READONLY("https://www.googleapis.com/auth/chrome.management.reports.readonly"),

	/** See basic device and telemetry information collected from ChromeOS devices or users. */
	TELEMETRY_READONLY("https://www.googleapis.com/auth/chrome.management.telemetry.readonly");

	private final String url;

	Scope(String url) {
		this.url = url;
	}

	public String url() {
		return url;
	}

	@Override
	public String toString() {
		return url;
	}

}
