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

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Telemetry data collected from a managed device.
 *
 * <p>
 * Hardware and status reports that are not modeled here are kept as raw JSON.
 * </p>
 *
 * @since 0.1.0
 */
public record TelemetryDevice(
		List<JsonNode> audioStatusReport,
		List<BatteryInfo> batteryInfo,
		List<JsonNode> batteryStatusReport,
		List<JsonNode> bootPerformanceReport,
		List<JsonNode> cpuInfo,
		List<JsonNode> cpuStatusReport,
		String customer,
		String deviceId,
		JsonNode graphicsInfo,
		List<JsonNode> graphicsStatusReport,
		MemoryInfo memoryInfo,
		List<JsonNode> memoryStatusReport,
		String name,
		List<JsonNode> networkDiagnosticsReport,
		JsonNode networkInfo,
		List<JsonNode> networkStatusReport,
		String orgUnitId,
		List<OsUpdateStatus> osUpdateStatus,
		String serialNumber,
		StorageInfo storageInfo,
		List<JsonNode> storageStatusReport,
		List<JsonNode> thunderboltInfo) {
}
