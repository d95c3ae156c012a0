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
import java.util.Iterator;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders decoded responses as indented JSON without {@code null} members.
 *
 * @since 0.1.0
 */
final class JsonOutput {

	private final ObjectMapper objectMapper;

	JsonOutput(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
	}

	String render(Object body) throws JsonProcessingException {
		JsonNode tree = body != null ? objectMapper.valueToTree(body) : objectMapper.createObjectNode();
		removeNulls(tree);
		return objectMapper.writeValueAsString(tree);
	}

	/**
	 * Removes null members of every object in the tree. Null array elements are kept.
	 * @param node the tree to prune in place
	 */
	static void removeNulls(JsonNode node) {
		if (node.isObject()) {
			List<String> nullMembers = new ArrayList<>();
			Iterator<String> names = node.fieldNames();
			while (names.hasNext()) {
				String name = names.next();
				JsonNode value = node.get(name);
				if (value.isNull()) {
					nullMembers.add(name);
				}
				else {
					removeNulls(value);
				}
			}
			((ObjectNode) node).remove(nullMembers);
		}
		else if (node.isArray()) {
			node.forEach(JsonOutput::removeNulls);
		}
	}

}
