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

import java.io.IOException;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the {@link TokenProvider} factories.
 */
class TokenProviderTest {

	private static final Set<String> SCOPES = Set.of("https://www.googleapis.com/auth/example");

	@Test
	void fixedTokenShouldBeReturnedForAnyScopes() throws IOException {
		assertThat(TokenProvider.of("abc").getToken(SCOPES)).contains("abc");
	}

	@Test
	void noneShouldNeverReturnAToken() throws IOException {
		assertThat(TokenProvider.none().getToken(SCOPES)).isEmpty();
	}

	@Test
	void unsetEnvironmentVariableShouldFail() {
		TokenProvider provider = TokenProvider.fromEnvironment("API_HUB_TEST_TOKEN_THAT_IS_NEVER_SET");

		assertThatThrownBy(() -> provider.getToken(SCOPES)).isInstanceOf(IOException.class)
			.hasMessageContaining("API_HUB_TEST_TOKEN_THAT_IS_NEVER_SET");
	}

}
