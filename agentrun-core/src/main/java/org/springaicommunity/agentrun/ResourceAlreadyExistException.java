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
package org.springaicommunity.agentrun;

/**
 * A resource with the requested name or id already exists.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class ResourceAlreadyExistException extends ClientException {

	private final String resourceType;

	private final String resourceId;

	public ResourceAlreadyExistException(String resourceType, String resourceId) {
		this(resourceType, resourceId, null);
	}

	ResourceAlreadyExistException(String resourceType, String resourceId, HttpException cause) {
		super(409, describe(resourceType, resourceId), cause != null ? cause.requestId() : null,
				cause != null ? cause.errorCode() : null, cause);
		this.resourceType = resourceType;
		this.resourceId = resourceId;
	}

	private static String describe(String resourceType, String resourceId) {
		if (resourceId == null || resourceId.isEmpty()) {
			return resourceType + " already exists";
		}
		return resourceType + " '" + resourceId + "' already exists";
	}

	public String resourceType() {
		return resourceType;
	}

	public String resourceId() {
		return resourceId;
	}

}
