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
import org.springaicommunity.agentrun.sandbox.api.SandboxDataApi;
import org.springaicommunity.agentrun.sandbox.model.SandboxData;
import org.springaicommunity.agentrun.sandbox.model.TemplateType;

/**
 * Sandbox running a custom image. The image defines its own HTTP surface below
 * {@link #baseUrl()}.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class CustomSandbox extends Sandbox {

	public CustomSandbox(SandboxData data, SandboxDataApi api, AgentRunConfig config) {
		super(data, api, config);
	}

	@Override
	public TemplateType templateType() {
		return TemplateType.CUSTOM;
	}

	public String baseUrl() {
		AgentRunConfig effective = AgentRunConfig.merge(api.client().config(), config);
		return effective.dataEndpoint() + "/" + SandboxDataApi.NAMESPACE + "/" + requireId();
	}

}
