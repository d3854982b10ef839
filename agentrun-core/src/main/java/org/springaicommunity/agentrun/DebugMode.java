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

import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verbose request logging switch, read once from {@code AGENTRUN_SDK_DEBUG} and handed to
 * the clients that honour it.
 *
 * <p>
 * Only unset, {@code ""}, {@code "0"}, {@code "false"}, {@code "FALSE"} and
 * {@code "False"} disable it. Any other value turns it on.
 * </p>
 *
 * @param enabled whether verbose logging is on
 * @author Mark Pollack
 * @since 0.1.0
 */
public record DebugMode(boolean enabled) {

	private static final Logger logger = LoggerFactory.getLogger(DebugMode.class);

	public static final String ENV_VARIABLE = "AGENTRUN_SDK_DEBUG";

	private static final Set<String> DISABLED_VALUES = Set.of("", "0", "false", "FALSE", "False");

	public static DebugMode disabled() {
		return new DebugMode(false);
	}

	public static DebugMode fromEnvironment() {
		return fromEnvironment(System.getenv());
	}

	public static DebugMode fromEnvironment(Map<String, String> env) {
		DebugMode mode = new DebugMode(isEnabledValue(env.get(ENV_VARIABLE)));
		if (mode.enabled()) {
			logger.warn("AgentRun SDK debug logging is enabled ({}={}); request details will be logged",
					ENV_VARIABLE, env.get(ENV_VARIABLE));
		}
		return mode;
	}

	static boolean isEnabledValue(String value) {
		return value != null && !DISABLED_VALUES.contains(value);
	}

	/**
	 * Logs a request-level detail: at INFO when enabled, otherwise at DEBUG.
	 * @param target the logger to write to
	 * @param format SLF4J message format
	 * @param args message arguments
	 */
	public void log(Logger target, String format, Object... args) {
		if (enabled) {
			target.info(format, args);
		}
		else {
			target.debug(format, args);
		}
	}

}
