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

import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.http.FileDownloadResult;
import org.springaicommunity.agentrun.sandbox.api.BrowserDataApi;
import org.springaicommunity.agentrun.sandbox.api.SandboxDataApi;
import org.springaicommunity.agentrun.sandbox.model.SandboxData;
import org.springaicommunity.agentrun.sandbox.model.TemplateType;

/**
 * Sandbox running a headless browser, driven over the Chrome DevTools Protocol and
 * observable over VNC.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class BrowserSandbox extends Sandbox {

	private final BrowserDataApi browserApi;

	public BrowserSandbox(SandboxData data, SandboxDataApi api, AgentRunConfig config) {
		super(data, api, config);
		this.browserApi = new BrowserDataApi(api, data.sandboxId(), config);
	}

	@Override
	public TemplateType templateType() {
		return TemplateType.BROWSER;
	}

	public String cdpUrl() {
		return cdpUrl(false);
	}

	public String cdpUrl(boolean record) {
		return browserApi.cdpUrl(record);
	}

	public String vncUrl() {
		return vncUrl(false);
	}

	public String vncUrl(boolean record) {
		return browserApi.vncUrl(record);
	}

	public JsonNode listRecordings() {
		return browserApi.listRecordings();
	}

	public JsonNode deleteRecording(String filename) {
		return browserApi.deleteRecording(filename);
	}

	public FileDownloadResult downloadRecording(String filename, Path savePath) {
		return browserApi.downloadRecording(filename, savePath);
	}

}
