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
package org.springaicommunity.agentrun;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AgentRunConfig}.
 */
class AgentRunConfigTest {

	@Test
	void mergeCombinesFieldsFromAllLayers() {
		AgentRunConfig first = AgentRunConfig.builder().accountId("123").build();
		AgentRunConfig second = AgentRunConfig.builder().regionId("cn-shanghai").build();

		AgentRunConfig merged = AgentRunConfig.merge(first, second);

		assertThat(merged.accountId()).isEqualTo("123");
		assertThat(merged.regionId()).isEqualTo("cn-shanghai");
	}

	@Test
	void unsetFieldInLaterLayerDoesNotEraseEarlierValue() {
		AgentRunConfig first = AgentRunConfig.builder().accountId("123").timeout(Duration.ofSeconds(5)).build();
		AgentRunConfig second = AgentRunConfig.builder().accountId(null).build();

		AgentRunConfig merged = AgentRunConfig.merge(first, second);

		assertThat(merged.accountId()).isEqualTo("123");
		assertThat(merged.timeout()).isEqualTo(Duration.ofSeconds(5));
	}

	@Test
	void laterLayerWinsOnCollision() {
		AgentRunConfig merged = AgentRunConfig.merge(AgentRunConfig.builder().token("old").build(), null,
				AgentRunConfig.builder().token("new").build());

		assertThat(merged.token()).isEqualTo("new");
	}

	@Test
	void headersAreMergedRatherThanReplaced() {
		AgentRunConfig first = AgentRunConfig.builder().header("X-A", "1").header("X-B", "1").build();
		AgentRunConfig second = AgentRunConfig.builder().header("X-B", "2").build();

		AgentRunConfig merged = AgentRunConfig.merge(first, second);

		assertThat(merged.headers()).containsEntry("X-A", "1").containsEntry("X-B", "2");
	}

	@Test
	void emptyAccountIdIsRejectedOnAccess() {
		AgentRunConfig merged = AgentRunConfig.merge(AgentRunConfig.builder().accountId("123").build(),
				AgentRunConfig.builder().accountId("").build());

		assertThatThrownBy(merged::accountId).isInstanceOf(ConfigurationException.class)
			.hasMessageContaining("AGENTRUN_ACCOUNT_ID");
	}

	@Test
	void missingCredentialsAreRejectedOnAccess() {
		AgentRunConfig config = AgentRunConfig.empty();

		assertThatThrownBy(config::accessKeyId).isInstanceOf(ConfigurationException.class);
		assertThatThrownBy(config::accessKeySecret).isInstanceOf(ConfigurationException.class);
		assertThat(config.securityToken()).isNull();
	}

	@Test
	void defaultsAreDerivedFromRegionAndAccount() {
		AgentRunConfig config = AgentRunConfig.builder().accountId("123").build();

		assertThat(config.regionId()).isEqualTo("cn-hangzhou");
		assertThat(config.timeout()).isEqualTo(Duration.ofMinutes(10));
		assertThat(config.controlEndpoint()).isEqualTo("https://agentrun.cn-hangzhou.aliyuncs.com");
		assertThat(config.dataEndpoint()).isEqualTo("https://123.agentrun-data.cn-hangzhou.aliyuncs.com");
	}

	@Test
	void fromEnvironmentPrefersAgentRunVariables() {
		Map<String, String> env = Map.of("AGENTRUN_ACCESS_KEY_ID", "ak", "ALIBABA_CLOUD_ACCESS_KEY_ID", "other",
				"ALIBABA_CLOUD_ACCESS_KEY_SECRET", "sk", "FC_ACCOUNT_ID", "456", "AGENTRUN_REGION", "cn-beijing",
				"AGENTRUN_DATA_ENDPOINT", "http://localhost:9000");

		AgentRunConfig config = AgentRunConfig.fromEnvironment(env);

		assertThat(config.accessKeyId()).isEqualTo("ak");
		assertThat(config.accessKeySecret()).isEqualTo("sk");
		assertThat(config.accountId()).isEqualTo("456");
		assertThat(config.regionId()).isEqualTo("cn-beijing");
		assertThat(config.dataEndpoint()).isEqualTo("http://localhost:9000");
	}

	@Test
	void blankEnvironmentVariablesCountAsUnset() {
		AgentRunConfig config = AgentRunConfig.fromEnvironment(Map.of("AGENTRUN_ACCOUNT_ID", " ", "FC_ACCOUNT_ID", "789"));

		assertThat(config.accountId()).isEqualTo("789");
	}

}
