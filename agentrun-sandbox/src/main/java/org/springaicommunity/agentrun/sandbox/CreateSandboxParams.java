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

import java.util.Objects;

import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.sandbox.model.SandboxCreateInput;
import org.springaicommunity.agentrun.sandbox.model.TemplateType;

/**
 * Arguments of {@link SandboxClient#createSandbox(CreateSandboxParams)}.
 *
 * @param input the template and sandbox settings
 * @param templateType the wrapper to return, a plain {@link Sandbox} when null
 * @param config per-call configuration, may be null
 * @author Mark Pollack
 * @since 0.1.0
 */
public record CreateSandboxParams(SandboxCreateInput input, TemplateType templateType, AgentRunConfig config) {

	public CreateSandboxParams {
		Objects.requireNonNull(input, "input cannot be null");
	}

	public static CreateSandboxParams of(String templateName) {
		return new CreateSandboxParams(SandboxCreateInput.of(templateName), null, null);
	}

	public static CreateSandboxParams of(SandboxCreateInput input, TemplateType templateType) {
		return new CreateSandboxParams(input, templateType, null);
	}

	public CreateSandboxParams withConfig(AgentRunConfig config) {
		return new CreateSandboxParams(input, templateType, config);
	}

}
