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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states reported for a sandbox.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public enum SandboxState {

	CREATING("Creating"), RUNNING("Running"), READY("READY"), STOPPED("Stopped"), FAILED("Failed"),
	DELETING("Deleting");

	private final String value;

	SandboxState(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	@JsonCreator
	public static SandboxState fromValue(String value) {
		for (SandboxState state : values()) {
			if (state.value.equals(value)) {
				return state;
			}
		}
		return null;
	}

}
