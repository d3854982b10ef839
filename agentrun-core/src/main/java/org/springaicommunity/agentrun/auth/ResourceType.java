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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Resource kinds an access token can be scoped to.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public enum ResourceType {

	RUNTIME("runtime"), LITELLM("litellm"), TOOL("tool"), TEMPLATE("template"), SANDBOX("sandbox");

	private final String value;

	ResourceType(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

}
