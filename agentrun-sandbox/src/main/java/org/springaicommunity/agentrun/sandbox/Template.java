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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.ResourceNotExistException;
import org.springaicommunity.agentrun.ResourceStateException;
import org.springaicommunity.agentrun.poll.PollableResource;
import org.springaicommunity.agentrun.poll.ResourceWaiter;
import org.springaicommunity.agentrun.poll.WaitOptions;
import org.springaicommunity.agentrun.sandbox.model.TemplateData;
import org.springaicommunity.agentrun.sandbox.model.TemplateStatus;
import org.springaicommunity.agentrun.sandbox.model.TemplateType;
import org.springaicommunity.agentrun.sandbox.model.TemplateUpdateInput;

/**
 * Snapshot of a sandbox template, managed through the control plane.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class Template implements PollableResource<TemplateStatus> {

	private static final Logger logger = LoggerFactory.getLogger(Template.class);

	public static final Set<TemplateStatus> READY_STATES = Collections.unmodifiableSet(EnumSet.of(TemplateStatus.READY));

	private volatile TemplateData data;

	private final SandboxControlClient controlClient;

	private final AgentRunConfig config;

	public Template(TemplateData data, SandboxControlClient controlClient, AgentRunConfig config) {
		this.data = Objects.requireNonNull(data, "data cannot be null");
		this.controlClient = Objects.requireNonNull(controlClient, "controlClient cannot be null");
		this.config = config;
	}

	public TemplateData data() {
		return data;
	}

	public String templateId() {
		return data.templateId();
	}

	public String templateName() {
		return data.templateName();
	}

	public TemplateType templateType() {
		return data.templateType();
	}

	@Override
	public TemplateStatus state() {
		return data.status();
	}

	@Override
	public String stateReason() {
		return data.statusReason();
	}

	@Override
	public String resourceKind() {
		return ResourceErrors.TEMPLATE;
	}

	@Override
	public void refresh() {
		String name = requireName();
		this.data = ResourceErrors.call(ResourceErrors.TEMPLATE, name, () -> controlClient.getTemplate(name, config));
	}

	/**
	 * Updates the template.
	 * @param input the fields to change
	 * @return a new snapshot reflecting the service response
	 */
	public Template update(TemplateUpdateInput input) {
		String name = requireName();
		TemplateData updated = ResourceErrors.call(ResourceErrors.TEMPLATE, name,
				() -> controlClient.updateTemplate(name, input, config));
		return new Template(updated, controlClient, config);
	}

	public Template delete() {
		String name = requireName();
		TemplateData deleted = ResourceErrors.call(ResourceErrors.TEMPLATE, name,
				() -> controlClient.deleteTemplate(name, config));
		return new Template(deleted, controlClient, config);
	}

	public Template waitUntilReady() {
		return waitUntilReady(WaitOptions.defaults());
	}

	/**
	 * Polls until the template is {@code READY}.
	 * @param options timeout, interval and pre-check hook
	 * @return this template, refreshed
	 * @throws ResourceStateException if the template reaches a failed status
	 * @throws org.springaicommunity.agentrun.WaitTimeoutException if the timeout elapses
	 */
	public Template waitUntilReady(WaitOptions<? super Template> options) {
		return ResourceWaiter.waitUntil(this, READY_STATES, TemplateStatus.FAILURES, options);
	}

	public void deleteAndWait() {
		deleteAndWait(WaitOptions.defaults());
	}

	/**
	 * Deletes the template and polls until the service no longer knows it.
	 * @param options timeout, interval and pre-check hook
	 * @throws ResourceStateException if deletion fails
	 * @throws org.springaicommunity.agentrun.WaitTimeoutException if the timeout elapses
	 */
	public void deleteAndWait(WaitOptions<? super Template> options) {
		Template deleting = delete();
		String name = requireName();
		ResourceWaiter.awaitCondition("Template " + name + " to be deleted", options.timeout(), options.interval(),
				() -> {
					try {
						deleting.refresh();
					}
					catch (ResourceNotExistException e) {
						logger.debug("Template {} deleted", name);
						return true;
					}
					if (options.preCheck() != null) {
						options.preCheck().accept(deleting);
					}
					if (TemplateStatus.DELETE_FAILED == deleting.state()) {
						throw new ResourceStateException(ResourceErrors.TEMPLATE, deleting.state().name(),
								deleting.stateReason());
					}
					return false;
				});
	}

	private String requireName() {
		String name = data.templateName();
		if (name == null || name.isEmpty()) {
			throw new IllegalStateException("Template name is not set");
		}
		return name;
	}

	@Override
	public String toString() {
		return "Template{templateName='" + templateName() + "', status=" + state() + "}";
	}

}
