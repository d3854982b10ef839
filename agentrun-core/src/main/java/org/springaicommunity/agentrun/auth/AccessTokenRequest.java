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
package org.springaicommunity.agentrun.auth;

import java.util.Objects;

/**
 * Input for the control plane's access-token endpoint. Sandboxes are addressed by id,
 * every other resource type by name.
 *
 * @param resourceType the resource kind
 * @param resourceId the resource id, set for sandboxes
 * @param resourceName the resource name, set for all other kinds
 * @author Mark Pollack
 * @since 0.1.0
 */
public record AccessTokenRequest(ResourceType resourceType, String resourceId, String resourceName) {

	public AccessTokenRequest {
		Objects.requireNonNull(resourceType, "resourceType cannot be null");
	}

	public static AccessTokenRequest of(ResourceType resourceType, String resourceKey) {
		if (resourceType == ResourceType.SANDBOX) {
			return new AccessTokenRequest(resourceType, resourceKey, null);
		}
		return new AccessTokenRequest(resourceType, null, resourceKey);
	}

}
