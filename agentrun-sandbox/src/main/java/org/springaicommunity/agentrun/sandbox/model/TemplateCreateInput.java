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
 * Input for creating a template. Sizing fields left null are filled with per-type
 * defaults by {@link #withDefaults()}.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TemplateCreateInput(String templateName, TemplateType templateType, Double cpu, Integer memory,
		Integer diskSize, String description, String executionRoleArn, Integer sandboxIdleTimeoutInSeconds,
		Integer sandboxTtlInSeconds, Integer shareConcurrencyLimitPerSandbox, Map<String, String> environmentVariables,
		TemplateNetworkConfiguration networkConfiguration, Map<String, Object> containerConfiguration,
		Map<String, Object> templateConfiguration, Boolean allowAnonymousManage) {

	public static final int BROWSER_DISK_SIZE = 10240;

	public TemplateCreateInput {
		Objects.requireNonNull(templateType, "templateType cannot be null");
	}

	public static Builder builder(String templateName, TemplateType templateType) {
		return new Builder(templateName, templateType);
	}

	/**
	 * Fills unset sizing, timeout and network fields. Browser-capable types default to
	 * 4 CPU, 8192 MB memory and a 10240 MB disk; other types to 2 CPU, 4096 MB and 512 MB.
	 * @return a copy with defaults applied
	 */
	public TemplateCreateInput withDefaults() {
		boolean browser = templateType == TemplateType.BROWSER || templateType == TemplateType.AIO;
		return new TemplateCreateInput(templateName, templateType, cpu != null ? cpu : (browser ? 4.0 : 2.0),
				memory != null ? memory : (browser ? 8192 : 4096),
				diskSize != null ? diskSize : (browser ? BROWSER_DISK_SIZE : 512), description, executionRoleArn,
				sandboxIdleTimeoutInSeconds != null ? sandboxIdleTimeoutInSeconds : 1800,
				sandboxTtlInSeconds != null ? sandboxTtlInSeconds : 21600,
				shareConcurrencyLimitPerSandbox != null ? shareConcurrencyLimitPerSandbox : 200, environmentVariables,
				networkConfiguration != null && networkConfiguration.networkMode() != null ? networkConfiguration
						: TemplateNetworkConfiguration.of(TemplateNetworkMode.PUBLIC),
				containerConfiguration, templateConfiguration, allowAnonymousManage);
	}

	/**
	 * Rejects combinations the service does not support.
	 * @throws IllegalArgumentException for a browser-capable template with a disk other
	 * than 10240 MB, or a code interpreter template with private-only networking
	 */
	public void validate() {
		boolean browser = templateType == TemplateType.BROWSER || templateType == TemplateType.AIO;
		if (browser && diskSize != null && diskSize != BROWSER_DISK_SIZE) {
			throw new IllegalArgumentException("When templateType is BROWSER or AIO, diskSize must be "
					+ BROWSER_DISK_SIZE + ", got " + diskSize);
		}
		boolean interpreter = templateType == TemplateType.CODE_INTERPRETER || templateType == TemplateType.AIO;
		if (interpreter && networkConfiguration != null
				&& networkConfiguration.networkMode() == TemplateNetworkMode.PRIVATE) {
			throw new IllegalArgumentException(
					"When templateType is CODE_INTERPRETER or AIO, networkMode cannot be PRIVATE");
		}
	}

	public static class Builder {

		private final String templateName;

		private final TemplateType templateType;

		private Double cpu;

		private Integer memory;

		private Integer diskSize;

		private String description;

		private String executionRoleArn;

		private Integer sandboxIdleTimeoutInSeconds;

		private Integer sandboxTtlInSeconds;

		private Integer shareConcurrencyLimitPerSandbox;

		private Map<String, String> environmentVariables;

		private TemplateNetworkConfiguration networkConfiguration;

		private Map<String, Object> containerConfiguration;

		private Map<String, Object> templateConfiguration;

		private Boolean allowAnonymousManage;

		Builder(String templateName, TemplateType templateType) {
			this.templateName = templateName;
			this.templateType = templateType;
		}

		public Builder cpu(double cpu) {
			this.cpu = cpu;
			return this;
		}

		public Builder memory(int memory) {
			this.memory = memory;
			return this;
		}

		public Builder diskSize(int diskSize) {
			this.diskSize = diskSize;
			return this;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		public Builder executionRoleArn(String executionRoleArn) {
			this.executionRoleArn = executionRoleArn;
			return this;
		}

		public Builder sandboxIdleTimeoutInSeconds(int seconds) {
			this.sandboxIdleTimeoutInSeconds = seconds;
			return this;
		}

		public Builder sandboxTtlInSeconds(int seconds) {
			this.sandboxTtlInSeconds = seconds;
			return this;
		}

		public Builder shareConcurrencyLimitPerSandbox(int limit) {
			this.shareConcurrencyLimitPerSandbox = limit;
			return this;
		}

		public Builder environmentVariables(Map<String, String> environmentVariables) {
			this.environmentVariables = environmentVariables;
			return this;
		}

		public Builder networkMode(TemplateNetworkMode networkMode) {
			this.networkConfiguration = TemplateNetworkConfiguration.of(networkMode);
			return this;
		}

		public Builder networkConfiguration(TemplateNetworkConfiguration networkConfiguration) {
			this.networkConfiguration = networkConfiguration;
			return this;
		}

		public Builder containerConfiguration(Map<String, Object> containerConfiguration) {
			this.containerConfiguration = containerConfiguration;
			return this;
		}

		public Builder templateConfiguration(Map<String, Object> templateConfiguration) {
			this.templateConfiguration = templateConfiguration;
			return this;
		}

		public Builder allowAnonymousManage(boolean allowAnonymousManage) {
			this.allowAnonymousManage = allowAnonymousManage;
			return this;
		}

		public TemplateCreateInput build() {
			return new TemplateCreateInput(templateName, templateType, cpu, memory, diskSize, description,
					executionRoleArn, sandboxIdleTimeoutInSeconds, sandboxTtlInSeconds,
					shareConcurrencyLimitPerSandbox, environmentVariables, networkConfiguration,
					containerConfiguration, templateConfiguration, allowAnonymousManage);
		}

	}

}
