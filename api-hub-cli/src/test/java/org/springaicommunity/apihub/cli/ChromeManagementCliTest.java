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

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the {@code chromemanagement1} command line against a local HTTP server.
 */
class ChromeManagementCliTest {

	record Received(String rawPath, String rawQuery, Headers headers) {
	}

	private HttpServer server;

	private final List<Received> received = new CopyOnWriteArrayList<>();

	private volatile int status = 200;

	private volatile String responseBody = "{}";

	private final StringWriter out = new StringWriter();

	private final StringWriter err = new StringWriter();

	@TempDir
	Path tempDir;

	@BeforeEach
	void startServer() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/", exchange -> {
			received.add(new Received(exchange.getRequestURI().getRawPath(), exchange.getRequestURI().getRawQuery(),
					exchange.getRequestHeaders()));
			byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
			exchange.sendResponseHeaders(status, bytes.length);
			try (OutputStream body = exchange.getResponseBody()) {
				body.write(bytes);
			}
		});
		server.start();
	}

	@AfterEach
	void stopServer() {
		server.stop(0);
	}

	private int run(Map<String, String> environment, String... args) {
		List<String> all = new ArrayList<>(
				List.of("--base-url", "http://127.0.0.1:" + server.getAddress().getPort() + "/"));
		all.addAll(Arrays.asList(args));
		CommandLine commandLine = ChromeManagementCli.commandLine(new ChromeManagementCli(environment));
		commandLine.setOut(new PrintWriter(out));
		commandLine.setErr(new PrintWriter(err));
		return commandLine.execute(all.toArray(new String[0]));
	}

	private int run(String... args) {
		return run(Map.of(), args);
	}

	@Test
	void commandNamesShouldBeDerivedFromMethodIds() {
		assertThat(ChromeManagementCli.commandName(ChromeManagementMethods.APPS_ANDROID_GET))
			.isEqualTo("apps-android-get");
		assertThat(ChromeManagementCli.commandName(ChromeManagementMethods.REPORTS_COUNT_CHROME_VERSIONS))
			.isEqualTo("reports-count-chrome-versions");
		assertThat(ChromeManagementCli.resourceName(ChromeManagementMethods.TELEMETRY_EVENTS_LIST))
			.isEqualTo("customers");
	}

	@Test
	void everyMethodShouldHaveASubcommand() {
		CommandLine commandLine = ChromeManagementCli.commandLine(new ChromeManagementCli(Map.of()));

		assertThat(commandLine.getSubcommands()).containsOnlyKeys("customers");
		assertThat(commandLine.getSubcommands().get("customers").getSubcommands()).hasSize(13)
			.containsKeys("apps-web-get", "telemetry-devices-list", "reports-find-installed-app-devices");
	}

	@Test
	void successShouldPrintPrettyJsonWithoutNulls() throws Exception {
		responseBody = "{\"name\":\"customers/my_customer/apps/android/com.example\",\"displayName\":\"Example\","
				+ "\"description\":null,\"reviewNumber\":\"42\"}";

		int exitCode = run("--access-token", "t0k", "customers", "apps-android-get",
				"customers/my_customer/apps/android/com.example", "-p", "quota-user=me");

		assertThat(exitCode).isZero();
		Received request = received.get(0);
		assertThat(request.rawPath()).isEqualTo("/v1/customers/my_customer/apps/android/com.example");
		assertThat(request.rawQuery()).isEqualTo("quotaUser=me&alt=json");
		assertThat(request.headers().getFirst("Authorization")).isEqualTo("Bearer t0k");

		JsonNode printed = new ObjectMapper().readTree(out.toString());
		assertThat(printed.path("displayName").asText()).isEqualTo("Example");
		assertThat(printed.path("reviewNumber").asText()).isEqualTo("42");
		assertThat(printed.has("description")).isFalse();
		assertThat(out.toString()).contains(System.lineSeparator() + "  \"");
	}

	@Test
	void queryParametersShouldUseKebabCaseKeys() {
		responseBody = "{\"browserVersions\":[],\"totalSize\":0}";

		int exitCode = run("--access-token", "t", "customers", "reports-count-chrome-versions", "customers/my_customer",
				"-p", "page-size=5", "-p", "filter=last_active_date>2024-01-01");

		assertThat(exitCode).isZero();
		assertThat(received.get(0).rawPath()).isEqualTo("/v1/customers/my_customer/reports:countChromeVersions");
		assertThat(received.get(0).rawQuery()).isEqualTo("pageSize=5&filter=last_active_date%3E2024-01-01&alt=json");
	}

	@Test
	void outputOptionShouldWriteTheResponseToAFile() throws Exception {
		responseBody = "{\"devices\":[{\"deviceId\":\"d-1\"}],\"nextPageToken\":\"n\"}";
		Path file = tempDir.resolve("devices.json");

		int exitCode = run("--access-token", "t", "customers", "telemetry-devices-list", "customers/C01", "-o",
				file.toString());

		assertThat(exitCode).isZero();
		assertThat(out.toString()).isEmpty();
		JsonNode written = new ObjectMapper().readTree(Files.readString(file));
		assertThat(written.path("devices").get(0).path("deviceId").asText()).isEqualTo("d-1");
		assertThat(written.path("nextPageToken").asText()).isEqualTo("n");
	}

	@Test
	void unknownParameterShouldExitWithUsageErrorWithoutSending() {
		int exitCode = run("--access-token", "t", "customers", "apps-count-chrome-app-requests",
				"customers/my_customer", "-p", "bogus=1", "-p", "page-size=3");

		assertThat(exitCode).isEqualTo(2);
		assertThat(err.toString()).contains("bogus").contains("page-size").contains("quota-user");
		assertThat(received).isEmpty();
	}

	@Test
	void missingPathArgumentShouldExitWithUsageError() {
		int exitCode = run("--access-token", "t", "customers", "apps-web-get");

		assertThat(exitCode).isEqualTo(2);
		assertThat(received).isEmpty();
		assertThat(err.toString()).contains("<name>").doesNotContain("NullPointerException");
	}

	@Test
	void missingSubcommandShouldExitWithUsageError() {
		assertThat(run("customers")).isEqualTo(2);
		assertThat(run()).isEqualTo(2);
	}

	@Test
	void apiErrorShouldExitWithOneAndReportTheStatus() {
		status = 403;
		responseBody = "{\"error\":{\"code\":403,\"message\":\"The caller does not have permission\","
				+ "\"status\":\"PERMISSION_DENIED\"}}";

		int exitCode = run("--access-token", "t", "customers", "telemetry-devices-get",
				"customers/C01/telemetry/devices/d-1");

		assertThat(exitCode).isEqualTo(1);
		assertThat(err.toString()).contains("PERMISSION_DENIED").contains("The caller does not have permission");
		assertThat(out.toString()).isEmpty();
	}

	@Test
	void debugShouldPrintTheStackTrace() {
		status = 500;
		responseBody = "internal";

		int exitCode = run("--debug", "--access-token", "t", "customers", "apps-chrome-get",
				"customers/my_customer/apps/chrome/abc");

		assertThat(exitCode).isEqualTo(1);
		assertThat(err.toString()).contains("HttpFailureException").contains("internal");
	}

	@Test
	void tokenShouldBeReadFromTheEnvironment() {
		int exitCode = run(Map.of(ChromeManagementCli.TOKEN_VARIABLE, "env-token"), "customers",
				"reports-count-chrome-devices-that-need-attention", "customers/my_customer");

		assertThat(exitCode).isZero();
		assertThat(received.get(0).headers().getFirst("Authorization")).isEqualTo("Bearer env-token");
	}

	@Test
	void apiKeyWithoutTokenShouldSendKeyOnly() {
		int exitCode = run("customers", "reports-count-chrome-hardware-fleet-devices", "customers/my_customer", "-p",
				"key=abc", "-p", "read-mask=cpuReports");

		assertThat(exitCode).isZero();
		assertThat(received.get(0).rawQuery()).isEqualTo("readMask=cpuReports&key=abc&alt=json");
		assertThat(received.get(0).headers().containsKey("Authorization")).isFalse();
	}

	@Test
	void missingTokenShouldExitWithOneWithoutSending() {
		int exitCode = run("customers", "telemetry-events-list", "customers/C01");

		assertThat(exitCode).isEqualTo(1);
		assertThat(err.toString()).contains(ChromeManagementCli.TOKEN_VARIABLE);
		assertThat(received).isEmpty();
	}

	@Test
	void altParameterShouldClashWithTheBuiltInOne() {
		int exitCode = run("--access-token", "t", "customers", "apps-web-get", "customers/c/apps/web/x", "-p",
				"alt=media");

		assertThat(exitCode).isEqualTo(1);
		assertThat(err.toString()).contains("'alt'");
		assertThat(received).isEmpty();
	}

}
