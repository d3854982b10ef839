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
package org.springaicommunity.agentrun.http;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.ClientException;
import org.springaicommunity.agentrun.auth.AccessTokenCache;
import org.springaicommunity.agentrun.auth.AccessTokenClient;
import org.springaicommunity.agentrun.auth.ResourceType;

import static com.github.tomakehurst.wiremock.client.WireMock.aMultipart;
import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.binaryEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.configureFor;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.givenThat;
import static com.github.tomakehurst.wiremock.client.WireMock.okForContentType;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for multipart upload and file download through {@link DataApiClient}.
 */
class FileTransferTest {

	@TempDir
	Path tempDir;

	private WireMockServer server;

	private DataApiClient client;

	@BeforeEach
	void setUp() {
		server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
		server.start();
		configureFor("localhost", server.port());

		client = DataApiClient.builder()
			.config(AgentRunConfig.builder().dataEndpoint("http://localhost:" + server.port()).token("tok").build())
			.namespace("sandboxes/sbx-1")
			.resource(ResourceType.SANDBOX, "sbx-1")
			.tokenCache(new AccessTokenCache(AccessTokenClient.unavailable()))
			.build();
	}

	@AfterEach
	void tearDown() {
		server.stop();
	}

	@Test
	void uploadSendsMultipartFormWithGeneratedBoundary() throws Exception {
		Path local = Files.writeString(tempDir.resolve("hello.txt"), "hello sandbox");
		givenThat(post(urlPathEqualTo("/sandboxes/sbx-1/filesystem/upload"))
			.willReturn(okForContentType("application/json", "{\"path\":\"/home/user/hello.txt\"}")));

		JsonNode result = client.uploadFile(DataRequest.of("/filesystem/upload"), local, "/home/user/hello.txt",
				Map.of("mode", "644"));

		assertThat(result.path("path").asText()).isEqualTo("/home/user/hello.txt");
		verify(postRequestedFor(urlEqualTo("/sandboxes/sbx-1/filesystem/upload"))
			.withHeader("Content-Type", containing("multipart/form-data; boundary=----AgentRunBoundary"))
			.withHeader(DataApiClient.ACCESS_TOKEN_HEADER, equalTo("tok"))
			.withRequestBodyPart(aMultipart().withName("file")
				.withBody(binaryEqualTo("hello sandbox".getBytes(StandardCharsets.UTF_8)))
				.build())
			.withRequestBodyPart(aMultipart().withName("path").withBody(equalTo("/home/user/hello.txt")).build())
			.withRequestBodyPart(aMultipart().withName("mode").withBody(equalTo("644")).build()));
	}

	@Test
	void uploadFailureCarriesStatusAndBody() throws Exception {
		Path local = Files.writeString(tempDir.resolve("a.txt"), "a");
		givenThat(post(urlPathEqualTo("/sandboxes/sbx-1/filesystem/upload"))
			.willReturn(aResponse().withStatus(500).withBody("disk full")));

		assertThatThrownBy(() -> client.uploadFile(DataRequest.of("filesystem/upload"), local, "/tmp/a.txt", Map.of()))
			.isInstanceOfSatisfying(ClientException.class, e -> {
				assertThat(e.statusCode()).isEqualTo(500);
				assertThat(e.getMessage()).isEqualTo("disk full");
			});
	}

	@Test
	void uploadOfMissingFileIsClientError() {
		Path missing = tempDir.resolve("missing.bin");

		assertThatThrownBy(() -> client.uploadFile(DataRequest.of("filesystem/upload"), missing, "/tmp/x", Map.of()))
			.isInstanceOfSatisfying(ClientException.class, e -> assertThat(e.statusCode()).isZero());
	}

	@Test
	void uploadWithoutTargetPathIsRejectedBeforeSending() throws Exception {
		Path local = Files.writeString(tempDir.resolve("a.txt"), "a");

		assertThatThrownBy(() -> client.uploadFile(DataRequest.of("filesystem/upload"), local, null, Map.of()))
			.isInstanceOf(NullPointerException.class)
			.hasMessageContaining("'path'");
		verify(0, postRequestedFor(urlPathEqualTo("/sandboxes/sbx-1/filesystem/upload")));
	}

	@Test
	void downloadWritesBodyToTargetFile() throws Exception {
		byte[] payload = { 0, 1, 2, 3, (byte) 0xff };
		givenThat(get(urlPathEqualTo("/sandboxes/sbx-1/filesystem/download"))
			.willReturn(aResponse().withStatus(200).withBody(payload)));
		Path target = tempDir.resolve("nested/out.bin");

		FileDownloadResult result = client
			.downloadFile(DataRequest.builder("filesystem/download").query("path", "/data/out.bin").build(), target);

		assertThat(result.savedPath()).isEqualTo(target.toString());
		assertThat(result.size()).isEqualTo(payload.length);
		assertThat(Files.readAllBytes(target)).isEqualTo(payload);
		try (var entries = Files.list(target.getParent())) {
			assertThat(entries).containsExactly(target);
		}
	}

	@Test
	void failedDownloadWritesNothing() {
		givenThat(get(urlPathEqualTo("/sandboxes/sbx-1/filesystem/download"))
			.willReturn(aResponse().withStatus(404).withBody("no such file")));
		Path target = tempDir.resolve("out.txt");

		assertThatThrownBy(() -> client
			.downloadFile(DataRequest.builder("filesystem/download").query("path", "/nope").build(), target))
			.isInstanceOfSatisfying(ClientException.class, e -> {
				assertThat(e.statusCode()).isEqualTo(404);
				assertThat(e.getMessage()).isEqualTo("no such file");
			});
		assertThat(target).doesNotExist();
	}

}
