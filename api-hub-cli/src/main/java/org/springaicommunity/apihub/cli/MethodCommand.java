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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.Model.PositionalParamSpec;
import picocli.CommandLine.ParameterException;

import org.springaicommunity.apihub.ApiCall;
import org.springaicommunity.apihub.ApiException;
import org.springaicommunity.apihub.ApiMethod;
import org.springaicommunity.apihub.ApiResponse;

/**
 * Command executing one API method: positional arguments fill the path parameters in
 * order, {@code -p} sets query and global parameters, {@code -o} redirects the output.
 *
 * @since 0.1.0
 */
final class MethodCommand implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(MethodCommand.class);

	private final ChromeManagementCli root;

	private final ApiMethod<?> method;

	private CommandSpec spec;

	private MethodCommand(ChromeManagementCli root, ApiMethod<?> method) {
		this.root = root;
		this.method = method;
	}

	static CommandSpec spec(ChromeManagementCli root, ApiMethod<?> method, String name) {
		MethodCommand command = new MethodCommand(root, method);
		CommandSpec spec = CommandSpec.wrapWithoutInspection(command).name(name).mixinStandardHelpOptions(true);
		spec.usageMessage().description("Calls " + method.id() + " (" + method.httpMethod() + " " + method.pathTemplate() + ")");

		List<String> pathParameters = method.pathParameters();
		for (int i = 0; i < pathParameters.size(); i++) {
			spec.addPositional(PositionalParamSpec.builder()
				.index(String.valueOf(i))
				.arity("1")
				.required(true)
				.paramLabel("<" + ParameterMapper.kebabCase(pathParameters.get(i)) + ">")
				.type(String.class)
				.description("Value of the '" + pathParameters.get(i) + "' path parameter")
				.build());
		}
		spec.addOption(OptionSpec.builder("-p")
			.paramLabel("key=value")
			.type(List.class)
			.auxiliaryTypes(String.class)
			.description("Set a query or global parameter; valid keys: "
					+ String.join(", ", ParameterMapper.validKeys(method)))
			.build());
		spec.addOption(OptionSpec.builder("-o")
			.paramLabel("FILE")
			.type(Path.class)
			.description("Write the response to FILE instead of standard output")
			.build());
		command.spec = spec;
		return spec;
	}

	@Override
	public Integer call() {
		List<String> arguments = spec.findOption("-p").getValue();
		if (arguments == null) {
			arguments = List.of();
		}

		ApiCall<?> call = root.hub().hub().newCall(method);
		List<String> pathParameters = method.pathParameters();
		for (int i = 0; i < pathParameters.size(); i++) {
			String value = spec.positionalParameters().get(i).getValue();
			if (value == null) {
				throw new ParameterException(spec.commandLine(),
						"Missing path parameter <" + ParameterMapper.kebabCase(pathParameters.get(i)) + ">");
			}
			call.path(pathParameters.get(i), value);
		}

		List<String> unknown = ParameterMapper.apply(method, call, arguments);
		if (!unknown.isEmpty()) {
			throw new ParameterException(spec.commandLine(), "Unknown parameter(s) " + String.join(", ", unknown)
					+ "; valid keys are: " + String.join(", ", ParameterMapper.validKeys(method)));
		}
		root.configureAuthentication(call, arguments);

		PrintWriter err = spec.commandLine().getErr();
		try {
			ApiResponse<?> response = call.execute();
			String json = root.output().render(response.body());
			Path file = spec.findOption("-o").getValue();
			if (file != null) {
				Files.writeString(file, json + System.lineSeparator(), StandardCharsets.UTF_8);
				logger.debug("Wrote response of {} to {}", method.id(), file);
			}
			else {
				PrintWriter out = spec.commandLine().getOut();
				out.println(json);
				out.flush();
			}
			return ChromeManagementCli.EXIT_OK;
		}
		catch (ApiException | IOException e) {
			root.reportError(err, e);
			return ChromeManagementCli.EXIT_FAILURE;
		}
	}

}
