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
package org.springaicommunity.agentrun.sandbox.api;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.http.DataApiClient;
import org.springaicommunity.agentrun.http.DataRequest;
import org.springaicommunity.agentrun.http.FileDownloadResult;

/**
 * Browser session endpoints for one sandbox: automation and live-view WebSocket URLs and
 * session recordings.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class BrowserDataApi {

	private final DataApiClient client;

	private final AgentRunConfig config;

	public BrowserDataApi(SandboxDataApi sandboxes, String sandboxId, AgentRunConfig config) {
		this.client = sandboxes.sandboxScope(sandboxId);
		this.config = config;
	}

	/**
	 * Gets the Chrome DevTools Protocol endpoint for browser automation.
	 * @param record whether the session should be recorded
	 * @return a {@code ws://} or {@code wss://} URL
	 */
	public String cdpUrl(boolean record) {
		return webSocketUrl("/ws/automation", record);
	}

	/**
	 * Gets the VNC live-view endpoint.
	 * @param record whether the session should be recorded
	 * @return a {@code ws://} or {@code wss://} URL
	 */
	public String vncUrl(boolean record) {
		return webSocketUrl("/ws/liveview", record);
	}

	private String webSocketUrl(String path, boolean record) {
		AgentRunConfig effective = AgentRunConfig.merge(client.config(), config);
		Map<String, Object> query = new LinkedHashMap<>();
		query.put("tenantId", effective.accountId());
		if (record) {
			query.put("recording", "true");
		}
		return client.withPath(path, query, config).replaceFirst("^http", "ws");
	}

	public JsonNode listRecordings() {
		return client.get(DataRequest.builder("recordings").config(config).build());
	}

	public JsonNode deleteRecording(String filename) {
		return client.delete(DataRequest.builder("recordings/" + filename).config(config).build());
	}

	public FileDownloadResult downloadRecording(String filename, Path savePath) {
		return client.downloadFile(DataRequest.builder("recordings/" + filename).config(config).build(), savePath);
	}

}
