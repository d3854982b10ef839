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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sandbox snapshot as returned by the service. The lifecycle state arrives as
 * {@code status} from the data plane and as {@code state} from the control plane.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public record SandboxData(String sandboxId, String sandboxName, String templateId, String templateName, String status,
		String state, String stateReason, String createdAt, String lastUpdatedAt, String endedAt,
		Integer sandboxIdleTimeoutSeconds, @JsonProperty("sandboxIdleTTLInSeconds") Integer sandboxIdleTtlInSeconds,
		String sandboxArn, Map<String, Object> metadata) {

	public static SandboxData empty() {
		return new SandboxData(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
	}

	/**
	 * Gets a copy carrying the given id, for responses that omit it.
	 * @param id the sandbox id
	 * @return this snapshot if it already has an id, otherwise a copy with {@code id}
	 */
	public SandboxData withSandboxId(String id) {
		if (sandboxId != null && !sandboxId.isEmpty()) {
			return this;
		}
		return new SandboxData(id, sandboxName, templateId, templateName, status, state, stateReason, createdAt,
				lastUpdatedAt, endedAt, sandboxIdleTimeoutSeconds, sandboxIdleTtlInSeconds, sandboxArn, metadata);
	}

	/**
	 * Resolves the lifecycle state, preferring {@code status} over {@code state}.
	 * @return the state, or null if absent or unknown
	 */
	public SandboxState lifecycleState() {
		String value = status != null ? status : state;
		return SandboxState.fromValue(value);
	}

}
