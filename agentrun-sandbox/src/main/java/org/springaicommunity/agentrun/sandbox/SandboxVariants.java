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
import java.util.EnumMap;
import java.util.Map;

import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.sandbox.api.SandboxDataApi;
import org.springaicommunity.agentrun.sandbox.model.SandboxData;
import org.springaicommunity.agentrun.sandbox.model.TemplateType;

/**
 * Maps a template type to the sandbox wrapper that exposes its operations.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public final class SandboxVariants {

	@FunctionalInterface
	interface Factory {

		Sandbox create(SandboxData data, SandboxDataApi api, AgentRunConfig config);

	}

	private static final Map<TemplateType, Factory> FACTORIES;

	static {
		Map<TemplateType, Factory> factories = new EnumMap<>(TemplateType.class);
		factories.put(TemplateType.CODE_INTERPRETER, CodeInterpreterSandbox::new);
		factories.put(TemplateType.BROWSER, BrowserSandbox::new);
		factories.put(TemplateType.AIO, AioSandbox::new);
		factories.put(TemplateType.CUSTOM, CustomSandbox::new);
		FACTORIES = Collections.unmodifiableMap(factories);
	}

	private SandboxVariants() {
	}

	/**
	 * Wraps a snapshot in the variant for {@code templateType}.
	 * @param templateType the template type, may be null
	 * @param data the snapshot
	 * @param api the data-plane API
	 * @param config per-call configuration, may be null
	 * @return the variant, or a plain {@link Sandbox} when the type is null or unmapped
	 */
	public static Sandbox wrap(TemplateType templateType, SandboxData data, SandboxDataApi api,
			AgentRunConfig config) {
		Factory factory = templateType != null ? FACTORIES.get(templateType) : null;
		return factory != null ? factory.create(data, api, config) : new Sandbox(data, api, config);
	}

}
