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

import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.sandbox.api.CodeInterpreterDataApi;
import org.springaicommunity.agentrun.sandbox.api.SandboxDataApi;
import org.springaicommunity.agentrun.sandbox.model.SandboxData;
import org.springaicommunity.agentrun.sandbox.model.TemplateType;

/**
 * Sandbox running a code interpreter.
 *
 * <p>
 * Operations are grouped by concern, each group returning to the sandbox via
 * {@code and()}:
 * </p>
 * <pre>{@code
 * JsonNode result = sandbox.contexts().create()
 *     .and()
 *     .contexts().execute("print(1 + 1)");
 * }</pre>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class CodeInterpreterSandbox extends Sandbox {

	private final CodeInterpreterDataApi codeApi;

	private final CodeInterpreterFiles files;

	private final CodeInterpreterFileSystem fileSystem;

	private final CodeInterpreterContexts contexts;

	private final CodeInterpreterProcesses processes;

	public CodeInterpreterSandbox(SandboxData data, SandboxDataApi api, AgentRunConfig config) {
		super(data, api, config);
		this.codeApi = new CodeInterpreterDataApi(api, data.sandboxId(), config);
		this.files = new CodeInterpreterFiles(this, codeApi);
		this.fileSystem = new CodeInterpreterFileSystem(this, codeApi);
		this.contexts = new CodeInterpreterContexts(this, codeApi);
		this.processes = new CodeInterpreterProcesses(this, codeApi);
	}

	@Override
	public TemplateType templateType() {
		return TemplateType.CODE_INTERPRETER;
	}

	public CodeInterpreterFiles files() {
		return files;
	}

	public CodeInterpreterFileSystem fileSystem() {
		return fileSystem;
	}

	/**
	 * Gets the execution contexts of this sandbox. The group remembers the context most
	 * recently created or fetched.
	 * @return the context operations
	 */
	public CodeInterpreterContexts contexts() {
		return contexts;
	}

	public CodeInterpreterProcesses processes() {
		return processes;
	}

}
