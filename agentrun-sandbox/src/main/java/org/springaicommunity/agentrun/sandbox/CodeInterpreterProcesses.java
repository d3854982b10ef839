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

import com.fasterxml.jackson.databind.JsonNode;
import org.springaicommunity.agentrun.sandbox.api.CodeInterpreterDataApi;

/**
 * Shell commands and process management inside a code interpreter sandbox.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class CodeInterpreterProcesses {

	private final CodeInterpreterSandbox sandbox;

	private final CodeInterpreterDataApi api;

	CodeInterpreterProcesses(CodeInterpreterSandbox sandbox, CodeInterpreterDataApi api) {
		this.sandbox = sandbox;
		this.api = api;
	}

	public JsonNode cmd(String command, String cwd) {
		return cmd(command, cwd, null);
	}

	public JsonNode cmd(String command, String cwd, Integer timeoutSeconds) {
		return api.cmd(command, cwd, timeoutSeconds);
	}

	public JsonNode list() {
		return api.listProcesses();
	}

	public JsonNode get(String pid) {
		return api.getProcess(pid);
	}

	public JsonNode kill(String pid) {
		return api.killProcess(pid);
	}

	public CodeInterpreterSandbox and() {
		return sandbox;
	}

}
