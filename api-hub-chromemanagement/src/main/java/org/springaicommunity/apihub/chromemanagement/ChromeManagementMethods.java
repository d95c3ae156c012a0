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

import java.util.List;

import org.springaicommunity.apihub.ApiMethod;
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

/**
 * Descriptors of the Chrome Management v1 operations.
 *
 * @since 0.1.0
 */
public final class ChromeManagementMethods {

	private static final String APPS_SCOPE = Scope.APP_DETAILS_READONLY.url();

	private static final String REPORTS_SCOPE = Scope.REPORTS_READONLY.url();

	private static final String TELEMETRY_SCOPE = Scope.TELEMETRY_READONLY.url();

	public static final ApiMethod<AppDetails> APPS_ANDROID_GET = appGet("android");

	public static final ApiMethod<AppDetails> APPS_CHROME_GET = appGet("chrome");

	public static final ApiMethod<AppDetails> APPS_WEB_GET = appGet("web");

	public static final ApiMethod<CountChromeAppRequestsResponse> APPS_COUNT_CHROME_APP_REQUESTS = ApiMethod
		.builder(CountChromeAppRequestsResponse.class)
		.id("chromemanagement.customers.apps.countChromeAppRequests")
		.path("v1/{+customer}/apps:countChromeAppRequests")
		.queryParameters("pageToken", "pageSize", "orgUnitId", "orderBy")
		.scopes(APPS_SCOPE)
		.build();

	public static final ApiMethod<CountChromeDevicesReachingAutoExpirationDateResponse> REPORTS_COUNT_CHROME_DEVICES_REACHING_AUTO_EXPIRATION_DATE = ApiMethod
		.builder(CountChromeDevicesReachingAutoExpirationDateResponse.class)
		.id("chromemanagement.customers.reports.countChromeDevicesReachingAutoExpirationDate")
		.path("v1/{+customer}/reports:countChromeDevicesReachingAutoExpirationDate")
		.queryParameters("orgUnitId", "minAueDate", "maxAueDate")
		.scopes(REPORTS_SCOPE)
		.build();

	public static final ApiMethod<CountChromeDevicesThatNeedAttentionResponse> REPORTS_COUNT_CHROME_DEVICES_THAT_NEED_ATTENTION = ApiMethod
		.builder(CountChromeDevicesThatNeedAttentionResponse.class)
		.id("chromemanagement.customers.reports.countChromeDevicesThatNeedAttention")
		.path("v1/{+customer}/reports:countChromeDevicesThatNeedAttention")
		.queryParameters("readMask", "orgUnitId")
		.scopes(REPORTS_SCOPE)
		.build();

	public static final ApiMethod<CountChromeHardwareFleetDevicesResponse> REPORTS_COUNT_CHROME_HARDWARE_FLEET_DEVICES = ApiMethod
		.builder(CountChromeHardwareFleetDevicesResponse.class)
		.id("chromemanagement.customers.reports.countChromeHardwareFleetDevices")
		.path("v1/{+customer}/reports:countChromeHardwareFleetDevices")
		.queryParameters("readMask", "orgUnitId")
		.scopes(REPORTS_SCOPE)
		.build();

	public static final ApiMethod<CountChromeVersionsResponse> REPORTS_COUNT_CHROME_VERSIONS = ApiMethod
		.builder(CountChromeVersionsResponse.class)
		.id("chromemanagement.customers.reports.countChromeVersions")
		.path("v1/{+customer}/reports:countChromeVersions")
		.queryParameters("pageToken", "pageSize", "orgUnitId", "filter")
		.scopes(REPORTS_SCOPE)
		.build();

	public static final ApiMethod<CountInstalledAppsResponse> REPORTS_COUNT_INSTALLED_APPS = ApiMethod
		.builder(CountInstalledAppsResponse.class)
		.id("chromemanagement.customers.reports.countInstalledApps")
		.path("v1/{+customer}/reports:countInstalledApps")
		.queryParameters("pageToken", "pageSize", "orgUnitId", "orderBy", "filter")
		.scopes(REPORTS_SCOPE)
		.build();

	public static final ApiMethod<FindInstalledAppDevicesResponse> REPORTS_FIND_INSTALLED_APP_DEVICES = ApiMethod
		.builder(FindInstalledAppDevicesResponse.class)
		.id("chromemanagement.customers.reports.findInstalledAppDevices")
		.path("v1/{+customer}/reports:findInstalledAppDevices")
		.queryParameters("pageToken", "pageSize", "orgUnitId", "orderBy", "filter", "appType", "appId")
		.scopes(REPORTS_SCOPE)
		.build();

	public static final ApiMethod<TelemetryDevice> TELEMETRY_DEVICES_GET = ApiMethod.builder(TelemetryDevice.class)
		.id("chromemanagement.customers.telemetry.devices.get")
		.path("v1/{+name}")
		.queryParameters("readMask")
		.scopes(TELEMETRY_SCOPE)
		.build();

	public static final ApiMethod<ListTelemetryDevicesResponse> TELEMETRY_DEVICES_LIST = ApiMethod
		.builder(ListTelemetryDevicesResponse.class)
		.id("chromemanagement.customers.telemetry.devices.list")
		.path("v1/{+parent}/telemetry/devices")
		.queryParameters("readMask", "pageToken", "pageSize", "filter")
		.scopes(TELEMETRY_SCOPE)
		.build();

	public static final ApiMethod<ListTelemetryEventsResponse> TELEMETRY_EVENTS_LIST = ApiMethod
		.builder(ListTelemetryEventsResponse.class)
		.id("chromemanagement.customers.telemetry.events.list")
		.path("v1/{+parent}/telemetry/events")
		.queryParameters("readMask", "pageToken", "pageSize", "filter")
		.scopes(TELEMETRY_SCOPE)
		.build();

	private static final List<ApiMethod<?>> ALL = List.of(APPS_ANDROID_GET, APPS_CHROME_GET, APPS_WEB_GET,
			APPS_COUNT_CHROME_APP_REQUESTS, REPORTS_COUNT_CHROME_DEVICES_REACHING_AUTO_EXPIRATION_DATE,
			REPORTS_COUNT_CHROME_DEVICES_THAT_NEED_ATTENTION, REPORTS_COUNT_CHROME_HARDWARE_FLEET_DEVICES,
			REPORTS_COUNT_CHROME_VERSIONS, REPORTS_COUNT_INSTALLED_APPS, REPORTS_FIND_INSTALLED_APP_DEVICES,
			TELEMETRY_DEVICES_GET, TELEMETRY_DEVICES_LIST, TELEMETRY_EVENTS_LIST);

	private ChromeManagementMethods() {
	}

	/**
	 * Lists every operation of the API.
	 * @return the methods in a stable order
	 */
	public static List<ApiMethod<?>> all() {
		return ALL;
	}

	private static ApiMethod<AppDetails> appGet(String platform) {
		return ApiMethod.builder(AppDetails.class)
			.id("chromemanagement.customers.apps." + platform + ".get")
			.path("v1/{+name}")
			.scopes(APPS_SCOPE)
			.build();
	}

}
