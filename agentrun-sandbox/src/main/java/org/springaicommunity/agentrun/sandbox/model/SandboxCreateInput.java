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
package org.springaicommunity.agentrun.sandbox.model;

import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Input for creating a sandbox from a template. Mount configurations are passed through
 * to the service as-is.
 *
 * @param templateName the template to instantiate
 * @param sandboxIdleTimeoutSeconds idle timeout, 600 when null
 * @param sandboxId requested sandbox id, may be null
 * @param nasConfig NAS mount configuration, may be null
 * @param ossMountConfig OSS mount configuration, may be null
 * @param polarFsConfig PolarFS mount configuration, may be null
 * @author Mark Pollack
 * @since 0.1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SandboxCreateInput(String templateName, Integer sandboxIdleTimeoutSeconds, String sandboxId,
		Map<String, Object> nasConfig, Map<String, Object> ossMountConfig, Map<String, Object> polarFsConfig) {

	public SandboxCreateInput {
		Objects.requireNonNull(templateName, "templateName cannot be null");
	}

	public static SandboxCreateInput of(String templateName) {
		return new SandboxCreateInput(templateName, null, null, null, null, null);
	}

	public SandboxCreateInput withIdleTimeoutSeconds(int seconds) {
		return new SandboxCreateInput(templateName, seconds, sandboxId, nasConfig, ossMountConfig, polarFsConfig);
	}

}
