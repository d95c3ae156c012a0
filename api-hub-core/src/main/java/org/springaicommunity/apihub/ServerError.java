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
package org.springaicommunity.apihub;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Error reported by a Google API in the body of a non-2xx response.
 *
 * <p>
 * Two shapes are recognized: the standard envelope
 * {@code {"error": {"code": 404, "message": "...", "status": "NOT_FOUND"}}} and the
 * OAuth2 form {@code {"error": "invalid_grant", "error_description": "..."}}. For the
 * latter, {@code status} holds the error string and {@code code} is zero.
 * </p>
 *
 * @param code the HTTP-like error code
 * @param message the human readable message
 * @param status the canonical status name
 * @param details the error details, possibly empty
 * @param raw the full response document
 * @since 0.1.0
 */
public record ServerError(int code, String message, String status, List<JsonNode> details, JsonNode raw) {

	public ServerError {
		details = details != null ? List.copyOf(details) : List.of();
	}

	/**
	 * Parses a response body into a server error.
	 * @param objectMapper the mapper to read with
	 * @param body the response body
	 * @return the error, or empty if the body is not JSON or has no {@code error} member
	 */
	public static Optional<ServerError> parse(ObjectMapper objectMapper, String body) {
		if (body == null || body.isBlank()) {
			return Optional.empty();
		}
		JsonNode root;
		try {
			root = objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			// plain text or HTML error page
			return Optional.empty();
		}
		if (root == null || !root.isObject()) {
			return Optional.empty();
		}
		JsonNode error = root.get("error");
		if (error == null) {
			return Optional.empty();
		}
		if (error.isObject()) {
			List<JsonNode> details = new ArrayList<>();
			error.path("details").forEach(details::add);
			return Optional.of(new ServerError(error.path("code").asInt(0), text(error, "message"),
					text(error, "status"), details, root));
		}
		if (error.isTextual()) {
			return Optional.of(new ServerError(0, text(root, "error_description"), error.asText(), List.of(), root));
		}
		return Optional.empty();
	}

	private static String text(JsonNode node, String field) {
		JsonNode value = node.get(field);
		return value != null && value.isTextual() ? value.asText() : null;
	}

}
