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
 * Kinds of sandbox template. The type decides which sandbox wrapper a caller receives.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public enum TemplateType {

	CODE_INTERPRETER("CodeInterpreter"), BROWSER("Browser"), AIO("AllInOne"), CUSTOM("CustomImage");

	private final String value;

	TemplateType(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	/**
	 * Looks up a type by its wire value.
	 * @param value the wire value
	 * @return the type, or null if unknown
	 */
	@JsonCreator
	public static TemplateType fromValue(String value) {
		for (TemplateType type : values()) {
			if (type.value.equals(value)) {
				return type;
			}
		}
		return null;
	}

}
