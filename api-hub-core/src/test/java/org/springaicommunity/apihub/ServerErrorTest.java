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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ServerError#parse(ObjectMapper, String)}.
 */
class ServerErrorTest {

	private final ObjectMapper objectMapper = ApiJson.newObjectMapper();

	@Test
	void standardEnvelopeShouldBeParsed() {
		String body = """
				{"error": {"code": 403, "message": "Caller lacks permission", "status": "PERMISSION_DENIED",
				  "details": [{"@type": "type.googleapis.com/google.rpc.ErrorInfo", "reason": "ACCESS_DENIED"}]}}
				""";

		ServerError error = ServerError.parse(objectMapper, body).orElseThrow();

		assertThat(error.code()).isEqualTo(403);
		assertThat(error.status()).isEqualTo("PERMISSION_DENIED");
		assertThat(error.message()).isEqualTo("Caller lacks permission");
		assertThat(error.details()).hasSize(1);
		assertThat(error.details().get(0).path("reason").asText()).isEqualTo("ACCESS_DENIED");
		assertThat(error.raw().has("error")).isTrue();
	}

	@Test
	void oauthErrorShouldBeParsed() {
		ServerError error = ServerError
			.parse(objectMapper, "{\"error\":\"invalid_grant\",\"error_description\":\"Token has been revoked.\"}")
			.orElseThrow();

		assertThat(error.code()).isZero();
		assertThat(error.status()).isEqualTo("invalid_grant");
		assertThat(error.message()).isEqualTo("Token has been revoked.");
		assertThat(error.details()).isEmpty();
	}

	@Test
	void bodiesWithoutErrorMemberShouldNotParse() {
		assertThat(ServerError.parse(objectMapper, "")).isEmpty();
		assertThat(ServerError.parse(objectMapper, "<html>502</html>")).isEmpty();
		assertThat(ServerError.parse(objectMapper, "{\"message\":\"nope\"}")).isEmpty();
		assertThat(ServerError.parse(objectMapper, "[1,2]")).isEmpty();
		assertThat(ServerError.parse(objectMapper, "{\"error\":42}")).isEmpty();
	}

}
