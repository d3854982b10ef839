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
package org.springaicommunity.agentrun.auth;

import org.junit.jupiter.api.Test;
import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.ServerException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link AccessTokenCache}.
 */
class AccessTokenCacheTest {

	private final AccessTokenClient tokenClient = mock(AccessTokenClient.class);

	private final AccessTokenCache cache = new AccessTokenCache(tokenClient);

	@Test
	void repeatedLookupsFetchOnce() {
		when(tokenClient.getAccessToken(any())).thenReturn("token-sbx-1");

		String first = cache.ensureToken(ResourceType.SANDBOX, "sbx-1", AgentRunConfig.empty());
		String second = cache.ensureToken(ResourceType.SANDBOX, "sbx-1", AgentRunConfig.empty());

		assertThat(first).isEqualTo("token-sbx-1");
		assertThat(second).isEqualTo("token-sbx-1");
		verify(tokenClient, times(1)).getAccessToken(any());
	}

	@Test
	void staticTokenSkipsFetchAndCache() {
		AgentRunConfig config = AgentRunConfig.builder().token("static-token").build();

		String token = cache.ensureToken(ResourceType.SANDBOX, "sbx-1", config);

		assertThat(token).isEqualTo("static-token");
		verify(tokenClient, never()).getAccessToken(any());
	}

	@Test
	void sandboxesAreRequestedByIdAndTemplatesByName() {
		when(tokenClient.getAccessToken(any())).thenReturn("token");

		cache.ensureToken(ResourceType.SANDBOX, "sbx-1", AgentRunConfig.empty());
		cache.ensureToken(ResourceType.TEMPLATE, "tpl-1", AgentRunConfig.empty());

		verify(tokenClient).getAccessToken(new AccessTokenRequest(ResourceType.SANDBOX, "sbx-1", null));
		verify(tokenClient).getAccessToken(new AccessTokenRequest(ResourceType.TEMPLATE, null, "tpl-1"));
	}

	@Test
	void failedFetchYieldsNoTokenAndIsRetriedNextTime() {
		when(tokenClient.getAccessToken(any())).thenThrow(new ServerException(500, "boom")).thenReturn("token");

		assertThat(cache.ensureToken(ResourceType.SANDBOX, "sbx-1", AgentRunConfig.empty())).isNull();
		assertThat(cache.ensureToken(ResourceType.SANDBOX, "sbx-1", AgentRunConfig.empty())).isEqualTo("token");
		verify(tokenClient, times(2)).getAccessToken(any());
	}

	@Test
	void unavailableClientYieldsNoToken() {
		AccessTokenCache unauthenticated = new AccessTokenCache(AccessTokenClient.unavailable());

		assertThat(unauthenticated.ensureToken(ResourceType.TEMPLATE, "tpl", AgentRunConfig.empty())).isNull();
	}

	@Test
	void maskHidesShortTokensCompletely() {
		assertThat(AccessTokenCache.mask("12345678")).isEqualTo("***");
		assertThat(AccessTokenCache.mask("abcdefghijkl")).isEqualTo("abcd...ijkl");
	}

}
