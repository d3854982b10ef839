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
import org.springaicommunity.agentrun.sandbox.model.CodeLanguage;

/**
 * Code interpreter calls for one sandbox: files, filesystem, execution contexts and
 * processes. Results are runtime-defined and returned as JSON trees.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class CodeInterpreterDataApi {

	public static final String DEFAULT_CWD = "/home/user";

	static final int DEFAULT_EXECUTE_TIMEOUT_SECONDS = 30;

	private final DataApiClient client;

	private final AgentRunConfig config;

	public CodeInterpreterDataApi(SandboxDataApi sandboxes, String sandboxId, AgentRunConfig config) {
		this.client = sandboxes.sandboxScope(sandboxId);
		this.config = config;
	}

	// Filesystem

	public JsonNode listDirectory(String path, Integer depth) {
		return client.get(request("filesystem").query("path", path).query("depth", depth).build());
	}

	public JsonNode stat(String path) {
		return client.get(request("filesystem/stat").query("path", path).build());
	}

	public JsonNode mkdir(String path, boolean parents, String mode) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("path", path);
		body.put("parents", parents);
		body.put("mode", mode);
		return client.post(request("filesystem/mkdir").json(body).build());
	}

	public JsonNode moveFile(String source, String destination) {
		return client.post(request("filesystem/move").json(Map.of("source", source, "destination", destination))
			.build());
	}

	public JsonNode removeFile(String path) {
		return client.post(request("filesystem/remove").json(Map.of("path", path)).build());
	}

	public JsonNode uploadFile(Path localFile, String targetPath) {
		return client.uploadFile(request("filesystem/upload").build(), localFile, targetPath, Map.of());
	}

	public FileDownloadResult downloadFile(String path, Path savePath) {
		return client.downloadFile(request("filesystem/download").query("path", path).build(), savePath);
	}

	// Files

	public JsonNode readFile(String path) {
		return client.get(request("files").query("path", path).build());
	}

	public JsonNode writeFile(String path, String content, String mode, String encoding, boolean createDir) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("path", path);
		body.put("content", content);
		body.put("mode", mode);
		body.put("encoding", encoding);
		body.put("createDir", createDir);
		return client.post(request("files").json(body).build());
	}

	// Contexts

	public JsonNode listContexts() {
		return client.get(request("contexts").build());
	}

	public JsonNode createContext(CodeLanguage language, String cwd) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("cwd", cwd != null ? cwd : DEFAULT_CWD);
		body.put("language", (language != null ? language : CodeLanguage.PYTHON).value());
		return client.post(request("contexts").json(body).build());
	}

	public JsonNode getContext(String contextId) {
		return client.get(request("contexts/" + contextId).build());
	}

	/**
	 * Runs code, either in an existing context or in a fresh one for {@code language}.
	 * @param code the source to run
	 * @param language the language, may be null when a context is given
	 * @param contextId the context, may be null
	 * @param timeoutSeconds execution timeout, 30 when null
	 * @return the execution result
	 */
	public JsonNode executeCode(String code, CodeLanguage language, String contextId, Integer timeoutSeconds) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("code", code);
		body.put("timeout", timeoutSeconds != null ? timeoutSeconds : DEFAULT_EXECUTE_TIMEOUT_SECONDS);
		if (language != null) {
			body.put("language", language.value());
		}
		if (contextId != null) {
			body.put("contextId", contextId);
		}
		return client.post(request("contexts/execute").json(body).build());
	}

	public JsonNode deleteContext(String contextId) {
		return client.delete(request("contexts/" + contextId).build());
	}

	// Processes

	public JsonNode cmd(String command, String cwd, Integer timeoutSeconds) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("command", command);
		body.put("cwd", cwd);
		if (timeoutSeconds != null) {
			body.put("timeout", timeoutSeconds);
		}
		return client.post(request("processes/cmd").json(body).build());
	}

	public JsonNode listProcesses() {
		return client.get(request("processes").build());
	}

	public JsonNode getProcess(String pid) {
		return client.get(request("processes/" + pid).build());
	}

	public JsonNode killProcess(String pid) {
		return client.delete(request("processes/" + pid).build());
	}

	private DataRequest.Builder request(String path) {
		return DataRequest.builder(path).config(config);
	}

}
