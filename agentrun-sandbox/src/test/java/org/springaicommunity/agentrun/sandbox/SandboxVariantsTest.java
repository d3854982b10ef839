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
package org.springaicommunity.agentrun.sandbox;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.auth.AccessTokenCache;
import org.springaicommunity.agentrun.auth.AccessTokenClient;
import org.springaicommunity.agentrun.http.DataApiClient;
import org.springaicommunity.agentrun.sandbox.api.SandboxDataApi;
import org.springaicommunity.agentrun.sandbox.model.SandboxData;
import org.springaicommunity.agentrun.sandbox.model.TemplateType;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for variant dispatch and the browser and custom endpoints.
 */
class SandboxVariantsTest {

	private SandboxDataApi api;

	private SandboxData data;

	@BeforeEach
	void setUp() {
		DataApiClient root = DataApiClient.builder()
			.config(AgentRunConfig.builder().accountId("acct-1").build())
			.tokenCache(new AccessTokenCache(AccessTokenClient.unavailable()))
			.build();
		api = new SandboxDataApi(root);
		data = new SandboxData("sbx-1", null, null, "tpl", "Running", null, null, null, null, null, null, null, null,
				null);
	}

	@Test
	void eachTemplateTypeHasItsWrapper() {
		assertThat(SandboxVariants.wrap(TemplateType.CODE_INTERPRETER, data, api, null))
			.isExactlyInstanceOf(CodeInterpreterSandbox.class);
		assertThat(SandboxVariants.wrap(TemplateType.BROWSER, data, api, null))
			.isExactlyInstanceOf(BrowserSandbox.class);
		assertThat(SandboxVariants.wrap(TemplateType.AIO, data, api, null)).isExactlyInstanceOf(AioSandbox.class)
			.isInstanceOf(CodeInterpreterSandbox.class);
		assertThat(SandboxVariants.wrap(TemplateType.CUSTOM, data, api, null))
			.isExactlyInstanceOf(CustomSandbox.class);
		assertThat(SandboxVariants.wrap(null, data, api, null)).isExactlyInstanceOf(Sandbox.class);
	}

	@Test
	void wrapperReportsItsTemplateType() {
		for (TemplateType type : TemplateType.values()) {
			assertThat(SandboxVariants.wrap(type, data, api, null).templateType()).isEqualTo(type);
		}
	}

	@Test
	void browserUrlsUseWebSocketScheme() {
		BrowserSandbox browser = new BrowserSandbox(data, api, null);

		assertThat(browser.cdpUrl())
			.isEqualTo("wss://acct-1.agentrun-data.cn-hangzhou.aliyuncs.com/sandboxes/sbx-1/ws/automation?tenantId=acct-1");
		assertThat(browser.vncUrl(true)).isEqualTo(
				"wss://acct-1.agentrun-data.cn-hangzhou.aliyuncs.com/sandboxes/sbx-1/ws/liveview?tenantId=acct-1&recording=true");
	}

	@Test
	void plainHttpEndpointBecomesWs() {
		AgentRunConfig local = AgentRunConfig.builder().dataEndpoint("http://localhost:8080").build();
		AioSandbox aio = new AioSandbox(data, api, local);

		assertThat(aio.cdpUrl(true))
			.isEqualTo("ws://localhost:8080/sandboxes/sbx-1/ws/automation?tenantId=acct-1&recording=true");
	}

	@Test
	void customSandboxExposesBaseUrl() {
		CustomSandbox custom = new CustomSandbox(data, api, null);

		assertThat(custom.baseUrl()).isEqualTo("https://acct-1.agentrun-data.cn-hangzhou.aliyuncs.com/sandboxes/sbx-1");
	}

}
