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

import java.util.List;

import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.auth.AccessTokenClient;
import org.springaicommunity.agentrun.sandbox.model.SandboxListInput;
import org.springaicommunity.agentrun.sandbox.model.SandboxListResult;
import org.springaicommunity.agentrun.sandbox.model.TemplateCreateInput;
import org.springaicommunity.agentrun.sandbox.model.TemplateData;
import org.springaicommunity.agentrun.sandbox.model.TemplateListInput;
import org.springaicommunity.agentrun.sandbox.model.TemplateUpdateInput;

/**
 * Control-plane operations used by {@link SandboxClient}.
 *
 * <p>
 * Implementations own request signing against the cloud control API. Each method
 * receives the effective configuration of the call and reports transport failures as
 * {@link org.springaicommunity.agentrun.HttpException}, typically created with
 * {@link org.springaicommunity.agentrun.HttpException#fromStatus(int, String, String)}.
 * </p>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public interface SandboxControlClient extends AccessTokenClient {

	TemplateData createTemplate(TemplateCreateInput input, AgentRunConfig config);

	TemplateData getTemplate(String templateName, AgentRunConfig config);

	TemplateData updateTemplate(String templateName, TemplateUpdateInput input, AgentRunConfig config);

	TemplateData deleteTemplate(String templateName, AgentRunConfig config);

	List<TemplateData> listTemplates(TemplateListInput input, AgentRunConfig config);

	SandboxListResult listSandboxes(SandboxListInput input, AgentRunConfig config);

}
