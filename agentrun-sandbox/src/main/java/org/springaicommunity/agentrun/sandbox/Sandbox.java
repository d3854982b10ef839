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

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.HttpException;
import org.springaicommunity.agentrun.poll.PollableResource;
import org.springaicommunity.agentrun.poll.ResourceWaiter;
import org.springaicommunity.agentrun.poll.WaitOptions;
import org.springaicommunity.agentrun.sandbox.api.SandboxDataApi;
import org.springaicommunity.agentrun.sandbox.model.SandboxData;
import org.springaicommunity.agentrun.sandbox.model.SandboxState;
import org.springaicommunity.agentrun.sandbox.model.TemplateType;

/**
 * Snapshot of a remote sandbox with its lifecycle operations.
 *
 * <p>
 * The snapshot is updated in place only by {@link #refresh()} and the {@code waitUntil*}
 * methods. {@link #stop()} and {@link #delete()} return a new snapshot built from the
 * service response.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 * <pre>{@code
 * Sandbox sandbox = client.createSandbox(CreateSandboxParams.of("my-template"));
 * sandbox.waitUntilRunning();
 * // ...
 * sandbox.delete();
 * }</pre>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class Sandbox implements PollableResource<SandboxState> {

	private static final Logger logger = LoggerFactory.getLogger(Sandbox.class);

	public static final Set<SandboxState> RUNNING_STATES = Collections
		.unmodifiableSet(EnumSet.of(SandboxState.RUNNING, SandboxState.READY));

	public static final Set<SandboxState> FAILED_STATES = Collections.unmodifiableSet(EnumSet.of(SandboxState.FAILED));

	static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(60);

	static final Duration HEALTH_INTERVAL = Duration.ofSeconds(1);

	private volatile SandboxData data;

	protected final SandboxDataApi api;

	protected final AgentRunConfig config;

	public Sandbox(SandboxData data, SandboxDataApi api, AgentRunConfig config) {
		this.data = Objects.requireNonNull(data, "data cannot be null");
		this.api = Objects.requireNonNull(api, "api cannot be null");
		this.config = config;
	}

	/**
	 * Gets the template type this wrapper was created for.
	 * @return the template type, or null for a plain sandbox
	 */
	public TemplateType templateType() {
		return null;
	}

	public SandboxData data() {
		return data;
	}

	public String sandboxId() {
		return data.sandboxId();
	}

	public String sandboxName() {
		return data.sandboxName();
	}

	public String templateId() {
		return data.templateId();
	}

	public String templateName() {
		return data.templateName();
	}

	@Override
	public SandboxState state() {
		return data.lifecycleState();
	}

	@Override
	public String stateReason() {
		return data.stateReason();
	}

	public String createdAt() {
		return data.createdAt();
	}

	public String lastUpdatedAt() {
		return data.lastUpdatedAt();
	}

	public String endedAt() {
		return data.endedAt();
	}

	public Integer sandboxIdleTimeoutSeconds() {
		return data.sandboxIdleTimeoutSeconds();
	}

	public Map<String, Object> metadata() {
		return data.metadata();
	}

	@Override
	public String resourceKind() {
		return ResourceErrors.SANDBOX;
	}

	@Override
	public void refresh() {
		String id = requireId();
		this.data = ResourceErrors.call(ResourceErrors.SANDBOX, id, () -> api.getSandbox(id, config)).withSandboxId(id);
	}

	/**
	 * Stops the sandbox.
	 * @return a new snapshot reflecting the service response
	 */
	public Sandbox stop() {
		String id = requireId();
		SandboxData stopped = ResourceErrors.call(ResourceErrors.SANDBOX, id, () -> api.stopSandbox(id, config));
		return SandboxVariants.wrap(templateType(), stopped, api, config);
	}

	/**
	 * Deletes the sandbox.
	 * @return a new snapshot reflecting the service response
	 */
	public Sandbox delete() {
		String id = requireId();
		SandboxData deleted = ResourceErrors.call(ResourceErrors.SANDBOX, id, () -> api.deleteSandbox(id, config));
		return SandboxVariants.wrap(templateType(), deleted, api, config);
	}

	public HealthStatus checkHealth() {
		return api.checkHealth(requireId(), config);
	}

	public Sandbox waitUntilRunning() {
		return waitUntilRunning(WaitOptions.defaults());
	}

	/**
	 * Polls until the sandbox is {@code Running} or {@code READY}.
	 * @param options timeout, interval and pre-check hook
	 * @return this sandbox, refreshed
	 * @throws org.springaicommunity.agentrun.ResourceStateException if the sandbox fails
	 * @throws org.springaicommunity.agentrun.WaitTimeoutException if the timeout elapses
	 */
	public Sandbox waitUntilRunning(WaitOptions<? super Sandbox> options) {
		return ResourceWaiter.waitUntil(this, RUNNING_STATES, FAILED_STATES, options);
	}

	public void waitUntilHealthy() {
		waitUntilHealthy(WaitOptions.<Sandbox>builder().timeout(HEALTH_TIMEOUT).interval(HEALTH_INTERVAL).build());
	}

	/**
	 * Polls the health endpoint until it reports {@code ok}. Failed probes are logged and
	 * retried.
	 * @param options timeout, interval and pre-check hook
	 * @throws org.springaicommunity.agentrun.WaitTimeoutException if the timeout elapses
	 */
	public void waitUntilHealthy(WaitOptions<? super Sandbox> options) {
		String id = requireId();
		logger.debug("Waiting for sandbox {} to become healthy", id);
		ResourceWaiter.awaitCondition("Sandbox " + id + " to become healthy", options.timeout(), options.interval(),
				() -> {
					if (options.preCheck() != null) {
						options.preCheck().accept(this);
					}
					return isHealthy(id);
				});
	}

	private boolean isHealthy(String id) {
		try {
			HealthStatus health = api.checkHealth(id, config);
			if (!health.isOk()) {
				logger.debug("Sandbox {} health: {} {} {}", id, health.status(), health.code(), health.message());
			}
			return health.isOk();
		}
		catch (HttpException e) {
			logger.debug("Health check failed for sandbox {}: {}", id, e.getMessage());
			return false;
		}
	}

	protected String requireId() {
		String id = data.sandboxId();
		if (id == null || id.isEmpty()) {
			throw new IllegalStateException("Sandbox id is not set");
		}
		return id;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{sandboxId='" + sandboxId() + "', state=" + state() + "}";
	}

}
