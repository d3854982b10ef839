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

/**
 * Template snapshot as returned by the control plane.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public record TemplateData(String templateArn, String templateId, String templateName, TemplateType templateType,
		Double cpu, Integer memory, Integer diskSize, String description, String executionRoleArn,
		Integer sandboxIdleTimeoutInSeconds, Integer sandboxTtlInSeconds, Integer shareConcurrencyLimitPerSandbox,
		TemplateStatus status, String statusReason, String resourceName, Boolean allowAnonymousManage,
		String createdAt, String lastUpdatedAt) {
}
