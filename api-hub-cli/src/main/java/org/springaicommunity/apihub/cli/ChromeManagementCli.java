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
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import ch.qos.logback.classic.Level;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import org.springaicommunity.apihub.ApiCall;
import org.springaicommunity.apihub.ApiMethod;
import org.springaicommunity.apihub.TokenProvider;
import org.springaicommunity.apihub.chromemanagement.ChromeManagement;
import org.springaicommunity.apihub.chromemanagement.ChromeManagementMethods;

/**
 * {@code chromemanagement1} command line.
 *
 * <p>
 * The command tree is built from the API's method descriptors:
 * {@code chromemanagement1 customers reports-count-chrome-versions customers/my_customer -p page-size=10}.
 * The access token comes from {@code --access-token} or the
 * {@value #TOKEN_VARIABLE} environment variable; without one, a {@code -p key=...}
 * argument switches the call to API key authentication.
 * </p>
 *
 * @since 0.1.0
 */
@Command(name = "chromemanagement1", mixinStandardHelpOptions = true, version = "chromemanagement1 0.1.0",
		description = "Calls the Chrome Management API v1 and prints responses as JSON")
public class ChromeManagementCli implements Runnable {

	static final String TOKEN_VARIABLE = "GOOGLE_OAUTH_ACCESS_TOKEN";

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	private static final String METHOD_ID_PREFIX = "chromemanagement.";

	@Option(names = "--debug", description = "Log each request and print stack traces of errors")
	boolean debug;

	@Option(names = "--base-url", paramLabel = "URL", description = "API base URL (default: ${DEFAULT-VALUE})")
	String baseUrl = ChromeManagement.DEFAULT_BASE_URL;

	@Option(names = "--access-token", paramLabel = "TOKEN",
			description = "OAuth2 access token (default: $" + TOKEN_VARIABLE + ")")
	String accessToken;

	@Option(names = "--scope", paramLabel = "URL",
			description = "Scope to request instead of the method's own; may be repeated")
	List<String> scopes = new ArrayList<>();

	@Spec
	CommandSpec spec;

	private final Map<String, String> environment;

	private ChromeManagement hub;

	public ChromeManagementCli() {
		this(System.getenv());
	}

	ChromeManagementCli(Map<String, String> environment) {
		this.environment = environment;
	}

	public static void main(String[] args) {
		System.exit(commandLine(new ChromeManagementCli()).execute(args));
	}

	/**
	 * Builds the command tree around a root command.
	 * @param cli the root command
	 * @return the command line, ready to execute
	 */
	public static CommandLine commandLine(ChromeManagementCli cli) {
		CommandLine commandLine = new CommandLine(cli);
		Map<String, List<ApiMethod<?>>> byResource = ChromeManagementMethods.all()
			.stream()
			.collect(Collectors.groupingBy(ChromeManagementCli::resourceName, LinkedHashMap::new, Collectors.toList()));
		byResource.forEach((resource, methods) -> {
			CommandLine resourceLine = new CommandLine(ResourceCommand.spec(resource));
			for (ApiMethod<?> method : methods) {
				String name = commandName(method);
				resourceLine.addSubcommand(name, new CommandLine(MethodCommand.spec(cli, method, name)));
			}
			commandLine.addSubcommand(resource, resourceLine);
		});
		return commandLine;
	}

	@Override
	public void run() {
		throw new ParameterException(spec.commandLine(), "Missing required subcommand");
	}

	static String resourceName(ApiMethod<?> method) {
		return segments(method).get(0);
	}

	/**
	 * Derives the subcommand name of a method, for example {@code apps-android-get} for
	 * {@code chromemanagement.customers.apps.android.get}.
	 * @param method the method
	 * @return the kebab case command name
	 */
	static String commandName(ApiMethod<?> method) {
		List<String> segments = segments(method);
		return segments.subList(1, segments.size())
			.stream()
			.map(ParameterMapper::kebabCase)
			.collect(Collectors.joining("-"));
	}

	private static List<String> segments(ApiMethod<?> method) {
		String id = method.id();
		if (!id.startsWith(METHOD_ID_PREFIX)) {
			throw new IllegalArgumentException("Unexpected method id " + id);
		}
		return Arrays.asList(id.substring(METHOD_ID_PREFIX.length()).split("\\."));
	}

	synchronized ChromeManagement hub() {
		if (hub == null) {
			if (debug) {
				enableDebugLogging();
			}
			hub = ChromeManagement.builder().baseUrl(baseUrl).tokenProvider(tokenProvider()).build();
		}
		return hub;
	}

	JsonOutput output() {
		return new JsonOutput(hub().hub().objectMapper());
	}

	Optional<String> accessToken() {
		if (accessToken != null && !accessToken.isBlank()) {
			return Optional.of(accessToken);
		}
		return Optional.ofNullable(environment.get(TOKEN_VARIABLE)).filter(token -> !token.isBlank());
	}

	/**
	 * Applies {@code --scope} and switches to API key mode when there is no token and a
	 * {@code key} parameter was given.
	 */
	void configureAuthentication(ApiCall<?> call, List<String> arguments) {
		if (!scopes.isEmpty()) {
			call.addScopes(scopes);
		}
		boolean hasKey = arguments.stream().anyMatch(argument -> argument.equals("key") || argument.startsWith("key="));
		if (accessToken().isEmpty() && hasKey) {
			call.clearScopes();
		}
	}

	void reportError(PrintWriter err, Exception error) {
		String message = Objects.toString(error.getMessage(), error.getClass().getSimpleName());
		Throwable cause = error.getCause();
		if (cause != null && cause.getMessage() != null && !message.contains(cause.getMessage())) {
			message = message + ": " + cause.getMessage();
		}
		err.println("Error: " + message);
		if (debug) {
			error.printStackTrace(err);
		}
		err.flush();
	}

	private TokenProvider tokenProvider() {
		Optional<String> token = accessToken();
		if (token.isPresent()) {
			return TokenProvider.of(token.get());
		}
		return requested -> {
			throw new IOException("No access token: pass --access-token or set " + TOKEN_VARIABLE);
		};
	}

	private static void enableDebugLogging() {
		if (LoggerFactory.getLogger("org.springaicommunity.apihub") instanceof ch.qos.logback.classic.Logger logger) {
			logger.setLevel(Level.DEBUG);
		}
	}

}
