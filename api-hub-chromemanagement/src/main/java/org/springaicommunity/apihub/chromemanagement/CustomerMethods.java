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

import org.springaicommunity.apihub.ApiCall;
import org.springaicommunity.apihub.ApiHub;
import org.springaicommunity.apihub.chromemanagement.model.AppDetails;
import org.springaicommunity.apihub.chromemanagement.model.CountChromeAppRequestsResponse;
import org.springaicommunity.apihub.chromemanagement.model.CountChromeDevicesReachingAutoExpirationDateResponse;
import org.springaicommunity.apihub.chromemanagement.model.CountChromeDevicesThatNeedAttentionResponse;
import org.springaicommunity.apihub.chromemanagement.model.CountChromeHardwareFleetDevicesResponse;
import org.springaicommunity.apihub.chromemanagement.model.CountChromeVersionsResponse;
import org.springaicommunity.apihub.chromemanagement.model.CountInstalledAppsResponse;
import org.springaicommunity.apihub.chromemanagement.model.FindInstalledAppDevicesResponse;
import org.springaicommunity.apihub.chromemanagement.model.ListTelemetryDevicesResponse;
import org.springaicommunity.apihub.chromemanagement.model.ListTelemetryEventsResponse;
import org.springaicommunity.apihub.chromemanagement.model.TelemetryDevice;

import static org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods.APPS_ANDROID_GET;
import static org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods.APPS_CHROME_GET;
import static org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods.APPS_COUNT_CHROME_APP_REQUESTS;
import static org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods.APPS_WEB_GET;
import static org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods.REPORTS_COUNT_CHROME_DEVICES_REACHING_AUTO_EXPIRATION_DATE;
import static org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods.REPORTS_COUNT_CHROME_DEVICES_THAT_NEED_ATTENTION;
import static org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods.REPORTS_COUNT_CHROME_HARDWARE_FLEET_DEVICES;
import static org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods.REPORTS_COUNT_CHROME_VERSIONS;
import static org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods.REPORTS_COUNT_INSTALLED_APPS;
import static org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods.REPORTS_FIND_INSTALLED_APP_DEVICES;
import static org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods.TELEMETRY_DEVICES_GET;
import static org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods.TELEMETRY_DEVICES_LIST;
import static org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods.TELEMETRY_EVENTS_LIST;

/**
 * Operations on the {@code customers} resource.
 *
 * <p>
 * Each method returns a call with its path parameters set. Optional query parameters
 * are added with {@link ApiCall#query(String, Object)}, for example
 * {@code .query("pageSize", 50)}.
 * </p>
 *
 * @since 0.1.0
 */
public final class CustomerMethods {

	private final ApiHub hub;

	CustomerMethods(ApiHub hub) {
		this.hub = hub;
	}

	/**
	 * Gets a specific app for a customer by its resource name.
	 * @param name the app, e.g. {@code customers/my_customer/apps/android/com.example}
	 * @return the call
	 */
	public ApiCall<AppDetails> appsAndroidGet(String name) {
		return hub.newCall(APPS_ANDROID_GET).path("name", name);
	}

	/**
	 * Gets a specific Chrome app or extension.
	 * @param name the app, e.g. {@code customers/my_customer/apps/chrome/<extension id>}
	 * @return the call
	 */
	public ApiCall<AppDetails> appsChromeGet(String name) {
		return hub.newCall(APPS_CHROME_GET).path("name", name);
	}

	/**
	 * Gets a specific web app.
	 * @param name the app, e.g. {@code customers/my_customer/apps/web/<app id>}
	 * @return the call
	 */
	public ApiCall<AppDetails> appsWebGet(String name) {
		return hub.newCall(APPS_WEB_GET).path("name", name);
	}

	/**
	 * Generates a summary of app installation requests.
	 * @param customer the customer, e.g. {@code customers/my_customer}
	 * @return the call, accepting {@code pageToken}, {@code pageSize},
	 * {@code orgUnitId} and {@code orderBy}
	 */
	public ApiCall<CountChromeAppRequestsResponse> appsCountChromeAppRequests(String customer) {
		return hub.newCall(APPS_COUNT_CHROME_APP_REQUESTS).path("customer", customer);
	}

	/**
	 * Counts devices whose auto update expiration date falls in a range.
	 * @param customer the customer
	 * @return the call, accepting {@code orgUnitId}, {@code minAueDate} and
	 * {@code maxAueDate}
	 */
	public ApiCall<CountChromeDevicesReachingAutoExpirationDateResponse> reportsCountChromeDevicesReachingAutoExpirationDate(
			String customer) {
		return hub.newCall(REPORTS_COUNT_CHROME_DEVICES_REACHING_AUTO_EXPIRATION_DATE).path("customer", customer);
	}

	public ApiCall<CountChromeDevicesThatNeedAttentionResponse> reportsCountChromeDevicesThatNeedAttention(
			String customer) {
		return hub.newCall(REPORTS_COUNT_CHROME_DEVICES_THAT_NEED_ATTENTION).path("customer", customer);
	}

	public ApiCall<CountChromeHardwareFleetDevicesResponse> reportsCountChromeHardwareFleetDevices(String customer) {
		return hub.newCall(REPORTS_COUNT_CHROME_HARDWARE_FLEET_DEVICES).path("customer", customer);
	}

	public ApiCall<CountChromeVersionsResponse> reportsCountChromeVersions(String customer) {
		return hub.newCall(REPORTS_COUNT_CHROME_VERSIONS).path("customer", customer);
	}

	public ApiCall<CountInstalledAppsResponse> reportsCountInstalledApps(String customer) {
		return hub.newCall(REPORTS_COUNT_INSTALLED_APPS).path("customer", customer);
	}

	/**
	 * Finds the devices that have one app installed. {@code appId} and {@code appType}
	 * select the app.
	 * @param customer the customer
	 * @return the call
	 */
	public ApiCall<FindInstalledAppDevicesResponse> reportsFindInstalledAppDevices(String customer) {
		return hub.newCall(REPORTS_FIND_INSTALLED_APP_DEVICES).path("customer", customer);
	}

	public ApiCall<TelemetryDevice> telemetryDevicesGet(String name) {
		return hub.newCall(TELEMETRY_DEVICES_GET).path("name", name);
	}

	public ApiCall<ListTelemetryDevicesResponse> telemetryDevicesList(String parent) {
		return hub.newCall(TELEMETRY_DEVICES_LIST).path("parent", parent);
	}

	public ApiCall<ListTelemetryEventsResponse> telemetryEventsList(String parent) {
		return hub.newCall(TELEMETRY_EVENTS_LIST).path("parent", parent);
	}

}
