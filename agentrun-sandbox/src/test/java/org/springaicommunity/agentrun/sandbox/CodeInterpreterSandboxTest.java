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

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.ServerException;
import org.springaicommunity.agentrun.auth.AccessTokenCache;
import org.springaicommunity.agentrun.http.DataApiClient;
import org.springaicommunity.agentrun.http.FileDownloadResult;
import org.springaicommunity.agentrun.sandbox.api.SandboxDataApi;
import org.springaicommunity.agentrun.sandbox.model.CodeLanguage;
import org.springaicommunity.agentrun.sandbox.model.SandboxData;

import static com.github.tomakehurst.wiremock.client.WireMock.aMultipart;
import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.configureFor;
import static com.github.tomakehurst.wiremock.client.WireMock.delete;
import static com.github.tomakehurst.wiremock.client.WireMock.deleteRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.givenThat;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the operation groups of {@link CodeInterpreterSandbox}.
 */
class CodeInterpreterSandboxTest {

	private static final String CONTEXT = "{\"id\":\"ctx-1\",\"cwd\":\"/home/user\",\"language\":\"python\"}";

	private WireMockServer server;

	private CodeInterpreterSandbox sandbox;

	@BeforeEach
	void setUp() {
		server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
		server.start();
		configureFor("localhost", server.port());

		DataApiClient root = DataApiClient.builder()
			.config(AgentRunConfig.builder().dataEndpoint(server.baseUrl()).accountId("acct-1").build())
			.tokenCache(new AccessTokenCache(request -> "token-" + request.resourceId()))
			.build();
		SandboxData data = new SandboxData("sbx-1", null, null, "ci-template", "Running", null, null, null, null,
				null, null, null, null, null);
		sandbox = new CodeInterpreterSandbox(data, new SandboxDataApi(root), null);
	}

	@AfterEach
	void tearDown() {
		if (server != null && server.isRunning()) {
			server.stop();
		}
	}

	@Test
	void createContextRemembersIt() {
		givenThat(post(urlEqualTo("/sandboxes/sbx-1/contexts")).willReturn(okJson(CONTEXT)));

		CodeInterpreterContexts contexts = sandbox.contexts().create();

		assertThat(contexts.contextId()).isEqualTo("ctx-1");
		assertThat(contexts.language()).isEqualTo(CodeLanguage.PYTHON);
		assertThat(contexts.cwd()).isEqualTo("/home/user");
		assertThat(contexts.and()).isSameAs(sandbox);
		verify(postRequestedFor(urlEqualTo("/sandboxes/sbx-1/contexts"))
			.withHeader("Agentrun-Access-Token", equalTo("token-sbx-1"))
			.withRequestBody(equalToJson("{\"cwd\":\"/home/user\",\"language\":\"python\"}")));
	}

	@Test
	void incompleteContextResponseIsServerError() {
		givenThat(post(urlEqualTo("/sandboxes/sbx-1/contexts")).willReturn(okJson("{\"cwd\":\"/home/user\"}")));

		assertThatThrownBy(() -> sandbox.contexts().create(CodeLanguage.JAVASCRIPT, "/srv"))
			.isInstanceOfSatisfying(ServerException.class, e -> {
				assertThat(e.statusCode()).isEqualTo(500);
				assertThat(e.getMessage()).isEqualTo("Failed to create context");
			});
		assertThat(sandbox.contexts().contextId()).isNull();
	}

	@Test
	void executeUsesCurrentContext() {
		givenThat(post(urlEqualTo("/sandboxes/sbx-1/contexts")).willReturn(okJson(CONTEXT)));
		givenThat(post(urlEqualTo("/sandboxes/sbx-1/contexts/execute"))
			.willReturn(okJson("{\"results\":[{\"text\":\"2\"}]}")));

		JsonNode result = sandbox.contexts().create().execute("print(1 + 1)");

		assertThat(result.path("results").get(0).path("text").asText()).isEqualTo("2");
		verify(postRequestedFor(urlEqualTo("/sandboxes/sbx-1/contexts/execute"))
			.withRequestBody(equalToJson("{\"code\":\"print(1 + 1)\",\"timeout\":30,\"contextId\":\"ctx-1\"}")));
	}

	@Test
	void executeWithoutContextRunsPython() {
		givenThat(post(urlEqualTo("/sandboxes/sbx-1/contexts/execute")).willReturn(okJson("{}")));

		sandbox.contexts().execute("x = 1");

		verify(postRequestedFor(urlEqualTo("/sandboxes/sbx-1/contexts/execute"))
			.withRequestBody(equalToJson("{\"code\":\"x = 1\",\"timeout\":30,\"language\":\"python\"}")));
	}

	@Test
	void deleteForgetsCurrentContext() {
		givenThat(post(urlEqualTo("/sandboxes/sbx-1/contexts")).willReturn(okJson(CONTEXT)));
		givenThat(delete(urlEqualTo("/sandboxes/sbx-1/contexts/ctx-1")).willReturn(okJson("{}")));

		CodeInterpreterContexts contexts = sandbox.contexts().create();
		contexts.delete();

		assertThat(contexts.contextId()).isNull();
		verify(deleteRequestedFor(urlEqualTo("/sandboxes/sbx-1/contexts/ctx-1")));
		assertThatThrownBy(contexts::delete).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void getWithoutContextIsRejected() {
		assertThatThrownBy(() -> sandbox.contexts().get()).isInstanceOf(IllegalStateException.class)
			.hasMessage("context id is not set");
		verify(0, getRequestedFor(anyUrl()));
	}

	@Test
	void getSwitchesCurrentContext() {
		givenThat(get(urlEqualTo("/sandboxes/sbx-1/contexts/ctx-2"))
			.willReturn(okJson("{\"id\":\"ctx-2\",\"cwd\":\"/srv\",\"language\":\"javascript\"}")));

		CodeInterpreterContexts contexts = sandbox.contexts().get("ctx-2");

		assertThat(contexts.contextId()).isEqualTo("ctx-2");
		assertThat(contexts.language()).isEqualTo(CodeLanguage.JAVASCRIPT);
	}

	@Test
	void writeFileAppliesDefaults() {
		givenThat(post(urlEqualTo("/sandboxes/sbx-1/files")).willReturn(okJson("{}")));

		sandbox.files().write("/tmp/a.txt", "hi");

		verify(postRequestedFor(urlEqualTo("/sandboxes/sbx-1/files")).withRequestBody(equalToJson(
				"{\"path\":\"/tmp/a.txt\",\"content\":\"hi\",\"mode\":\"644\",\"encoding\":\"utf-8\",\"createDir\":true}")));
	}

	@Test
	void readFileSendsPathAsQuery() {
		givenThat(get(urlPathEqualTo("/sandboxes/sbx-1/files")).withQueryParam("path", equalTo("/tmp/a b.txt"))
			.willReturn(okJson("{\"content\":\"hi\"}")));

		JsonNode file = sandbox.files().read("/tmp/a b.txt");

		assertThat(file.path("content").asText()).isEqualTo("hi");
	}

	@Test
	void fileSystemOperationsHitTheirEndpoints() {
		givenThat(get(urlEqualTo("/sandboxes/sbx-1/filesystem")).willReturn(okJson("{\"entries\":[]}")));
		givenThat(post(urlEqualTo("/sandboxes/sbx-1/filesystem/mkdir")).willReturn(okJson("{}")));
		givenThat(post(urlEqualTo("/sandboxes/sbx-1/filesystem/move")).willReturn(okJson("{}")));

		sandbox.fileSystem().list();
		sandbox.fileSystem().mkdir("/data");
		sandbox.fileSystem().move("/data/a", "/data/b");

		verify(getRequestedFor(urlEqualTo("/sandboxes/sbx-1/filesystem")));
		verify(postRequestedFor(urlEqualTo("/sandboxes/sbx-1/filesystem/mkdir"))
			.withRequestBody(equalToJson("{\"path\":\"/data\",\"parents\":true,\"mode\":\"0755\"}")));
		verify(postRequestedFor(urlEqualTo("/sandboxes/sbx-1/filesystem/move"))
			.withRequestBody(equalToJson("{\"source\":\"/data/a\",\"destination\":\"/data/b\"}")));
	}

	@Test
	void uploadAndDownloadTransferFiles(@TempDir Path tempDir) throws Exception {
		Path local = tempDir.resolve("in.txt");
		Files.writeString(local, "payload");
		givenThat(post(urlEqualTo("/sandboxes/sbx-1/filesystem/upload")).willReturn(okJson("{\"ok\":true}")));
		givenThat(get(urlPathEqualTo("/sandboxes/sbx-1/filesystem/download"))
			.withQueryParam("path", equalTo("/data/out.bin"))
			.willReturn(aResponse().withStatus(200).withBody("binary-content".getBytes(StandardCharsets.UTF_8))));

		sandbox.fileSystem().upload(local, "/data/in.txt");
		FileDownloadResult result = sandbox.fileSystem().download("/data/out.bin", tempDir.resolve("out.bin"));

		verify(postRequestedFor(urlEqualTo("/sandboxes/sbx-1/filesystem/upload"))
			.withRequestBodyPart(aMultipart().withName("path").withBody(equalTo("/data/in.txt")).build()));
		assertThat(result.size()).isEqualTo("binary-content".length());
		assertThat(Files.readString(tempDir.resolve("out.bin"))).isEqualTo("binary-content");
	}

	@Test
	void processOperationsHitTheirEndpoints() {
		givenThat(post(urlEqualTo("/sandboxes/sbx-1/processes/cmd")).willReturn(okJson("{\"exitCode\":0}")));
		givenThat(delete(urlEqualTo("/sandboxes/sbx-1/processes/42")).willReturn(okJson("{}")));

		JsonNode result = sandbox.processes().cmd("ls", "/");
		sandbox.processes().kill("42");

		assertThat(result.path("exitCode").asInt()).isZero();
		verify(postRequestedFor(urlEqualTo("/sandboxes/sbx-1/processes/cmd"))
			.withRequestBody(equalToJson("{\"command\":\"ls\",\"cwd\":\"/\"}")));
		verify(deleteRequestedFor(urlEqualTo("/sandboxes/sbx-1/processes/42")));
	}

}
