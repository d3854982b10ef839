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
 * Thrown when a polled resource lands in a failure state.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class ResourceStateException extends AgentRunException {

	private final String state;

	private final String stateReason;

	public ResourceStateException(String resourceType, String state, String stateReason) {
		super(resourceType + " failed: " + stateReason);
		this.state = state;
		this.stateReason = stateReason;
	}

	public String state() {
		return state;
	}

	public String stateReason() {
		return stateReason;
	}

}
