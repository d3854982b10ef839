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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.ClientException;
import org.springaicommunity.agentrun.auth.ResourceType;
import org.springaicommunity.agentrun.http.DataApiClient;
import org.springaicommunity.agentrun.http.DataRequest;
import org.springaicommunity.agentrun.sandbox.HealthStatus;
import org.springaicommunity.agentrun.sandbox.model.SandboxCreateInput;
import org.springaicommunity.agentrun.sandbox.model.SandboxData;

/**
 * Sandbox lifecycle calls on the data plane, below the {@code sandboxes} namespace.
 *
 * <p>
 * Creation authenticates with a token scoped to the template, every other call with a
 * token scoped to the sandbox. Responses use the envelope
 * {@code {"code": "SUCCESS", "message": ..., "data": {...}}}.
 * </p>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class SandboxDataApi {

	private static final Logger logger = LoggerFactory.getLogger(SandboxDataApi.class);

	public static final String NAMESPACE = "sandboxes";

	static final int DEFAULT_IDLE_TIMEOUT_SECONDS = 600;

	private static final String SUCCESS = "SUCCESS";

	private final DataApiClient client;

	public SandboxDataApi(DataApiClient client) {
		this.client = Objects.requireNonNull(client, "client cannot be null");
	}

	/**
	 * Gets the root client, from which sandbox-scoped clients are derived.
	 * @return the root data-plane client
	 */
	public DataApiClient client() {
		return client;
	}

	/**
	 * Gets a client for one sandbox's namespace, authenticated as that sandbox.
	 * @param sandboxId the sandbox id
	 * @return the scoped client
	 */
	public DataApiClient sandboxScope(String sandboxId) {
		return client.forResource(NAMESPACE + "/" + sandboxId, ResourceType.SANDBOX, sandboxId);
	}

	public HealthStatus checkHealth(String sandboxId, AgentRunConfig config) {
		JsonNode response = sandboxScope(sandboxId).get(DataRequest.builder("health").config(config).build());
		return convert(response, HealthStatus.class);
	}

	/**
	 * Creates a sandbox from a template.
	 * @param input the template and sandbox settings
	 * @param config per-call configuration, may be null
	 * @return the new sandbox
	 */
	public SandboxData createSandbox(SandboxCreateInput input, AgentRunConfig config) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("templateName", input.templateName());
		body.put("sandboxIdleTimeoutSeconds", input.sandboxIdleTimeoutSeconds() != null
				? input.sandboxIdleTimeoutSeconds() : DEFAULT_IDLE_TIMEOUT_SECONDS);
		putIfPresent(body, "sandboxId", input.sandboxId());
		putIfPresent(body, "nasConfig", input.nasConfig());
		putIfPresent(body, "ossMountConfig", input.ossMountConfig());
		putIfPresent(body, "polarFsConfig", input.polarFsConfig());

		DataApiClient templateScope = client.forResource(NAMESPACE, ResourceType.TEMPLATE, input.templateName());
		logger.debug("Creating sandbox from template: {}", input.templateName());
		JsonNode response = templateScope.post(DataRequest.builder("/").json(body).config(config).build());
		SandboxData data = unwrap(response, "create");
		logger.debug("Created sandbox: {}", data.sandboxId());
		return data;
	}

	public SandboxData getSandbox(String sandboxId, AgentRunConfig config) {
		JsonNode response = sandboxScope(sandboxId).get(DataRequest.builder("/").config(config).build());
		return unwrap(response, "get");
	}

	public SandboxData stopSandbox(String sandboxId, AgentRunConfig config) {
		logger.debug("Stopping sandbox: {}", sandboxId);
		JsonNode response = sandboxScope(sandboxId).post(DataRequest.builder("stop").config(config).build());
		return unwrap(response, "stop");
	}

	public SandboxData deleteSandbox(String sandboxId, AgentRunConfig config) {
		logger.debug("Deleting sandbox: {}", sandboxId);
		JsonNode response = sandboxScope(sandboxId).delete(DataRequest.builder("/").config(config).build());
		return unwrap(response, "delete");
	}

	private SandboxData unwrap(JsonNode response, String operation) {
		String code = response.path("code").asText(null);
		if (!SUCCESS.equals(code)) {
			String message = response.path("message").asText(null);
			throw new ClientException(0,
					"Failed to " + operation + " sandbox: " + (message != null && !message.isEmpty() ? message
							: "Unknown error"),
					response.path("requestId").asText(null));
		}
		JsonNode data = response.path("data");
		if (!data.isObject()) {
			return SandboxData.empty();
		}
		return convert(data, SandboxData.class);
	}

	protected <T> T convert(JsonNode node, Class<T> type) {
		try {
			return client.objectMapper().treeToValue(node, type);
		}
		catch (JsonProcessingException e) {
			throw new ClientException(0, "Failed to read " + type.getSimpleName() + " from response", e);
		}
	}

	private static void putIfPresent(Map<String, Object> body, String key, Object value) {
		if (value != null) {
			body.put(key, value);
		}
	}

}
