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

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;

/**
 * Resource level command such as {@code customers}; only groups method subcommands.
 *
 * @since 0.1.0
 */
final class ResourceCommand implements Runnable {

	private CommandSpec spec;

	static CommandSpec spec(String resource) {
		ResourceCommand command = new ResourceCommand();
		CommandSpec spec = CommandSpec.wrapWithoutInspection(command).name(resource).mixinStandardHelpOptions(true);
		spec.usageMessage().description("Methods of the '" + resource + "' resource");
		command.spec = spec;
		return spec;
	}

	@Override
	public void run() {
		throw new ParameterException(spec.commandLine(), "Missing required subcommand for '" + spec.name() + "'");
	}

}
