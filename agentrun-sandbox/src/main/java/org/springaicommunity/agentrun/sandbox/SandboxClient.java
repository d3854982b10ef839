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

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.DebugMode;
import org.springaicommunity.agentrun.auth.AccessTokenCache;
import org.springaicommunity.agentrun.http.DataApiClient;
import org.springaicommunity.agentrun.sandbox.api.SandboxDataApi;
import org.springaicommunity.agentrun.sandbox.model.SandboxCreateInput;
import org.springaicommunity.agentrun.sandbox.model.SandboxData;
import org.springaicommunity.agentrun.sandbox.model.SandboxListInput;
import org.springaicommunity.agentrun.sandbox.model.SandboxListResult;
import org.springaicommunity.agentrun.sandbox.model.TemplateCreateInput;
import org.springaicommunity.agentrun.sandbox.model.TemplateData;
import org.springaicommunity.agentrun.sandbox.model.TemplateListInput;
import org.springaicommunity.agentrun.sandbox.model.TemplateType;
import org.springaicommunity.agentrun.sandbox.model.TemplateUpdateInput;

/**
 * Entry point for managing templates and sandboxes.
 *
 * <p>
 * Templates and sandbox listing go through the control plane. Sandbox lifecycle calls go
 * through the data plane with resource-scoped access tokens, cached for the lifetime of
 * this client. Every call accepts an optional {@link AgentRunConfig} that overrides this
 * client's configuration field by field.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 * <pre>{@code
 * SandboxClient client = SandboxClient.builder()
 *     .controlClient(controlClient)
 *     .build();
 *
 * CodeInterpreterSandbox sandbox = client.createCodeInterpreterSandbox("my-template");
 * sandbox.waitUntilRunning();
 * sandbox.contexts().create().and().contexts().execute("print('hello')");
 * sandbox.delete();
 * }</pre>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class SandboxClient {

	private static final Logger logger = LoggerFactory.getLogger(SandboxClient.class);

	static final int TEMPLATE_PAGE_SIZE = 50;

	private final AgentRunConfig config;

	private final SandboxControlClient controlClient;

	private final SandboxDataApi dataApi;

	private final DebugMode debugMode;

	private SandboxClient(Builder builder) {
		this.controlClient = Objects.requireNonNull(builder.controlClient, "controlClient cannot be null");
		Map<String, String> environment = builder.environment != null ? builder.environment : System.getenv();
		this.config = AgentRunConfig.merge(AgentRunConfig.fromEnvironment(environment), builder.config);
		this.debugMode = builder.debugMode != null ? builder.debugMode : DebugMode.fromEnvironment(environment);

		DataApiClient root = DataApiClient.builder()
			.config(this.config)
			.namespace(SandboxDataApi.NAMESPACE)
			.tokenCache(new AccessTokenCache(controlClient))
			.debugMode(this.debugMode)
			.httpClient(builder.httpClient != null ? builder.httpClient : DataApiClient.defaultHttpClient())
			.build();
		this.dataApi = new SandboxDataApi(root);
	}

	public static Builder builder() {
		return new Builder();
	}

	public AgentRunConfig config() {
		return config;
	}

	public DebugMode debugMode() {
		return debugMode;
	}

	// Templates

	public Template createTemplate(TemplateCreateInput input) {
		return createTemplate(input, null);
	}

	/**
	 * Creates a template. Unset sizing, timeouts and network mode are filled with the
	 * defaults for the template type before validation.
	 * @param input the template settings
	 * @param config per-call configuration, may be null
	 * @return the created template, typically still {@code CREATING}
	 * @throws IllegalArgumentException if the settings are invalid for the template type
	 * @throws org.springaicommunity.agentrun.ResourceAlreadyExistException if the name is
	 * taken
	 */
	public Template createTemplate(TemplateCreateInput input, AgentRunConfig config) {
		TemplateCreateInput prepared = input.withDefaults();
		prepared.validate();
		AgentRunConfig cfg = effective(config);
		logger.debug("Creating template: {} ({})", prepared.templateName(), prepared.templateType());
		TemplateData data = ResourceErrors.call(ResourceErrors.TEMPLATE, prepared.templateName(),
				() -> controlClient.createTemplate(prepared, cfg));
		return new Template(data, controlClient, cfg);
	}

	public Template getTemplate(String templateName) {
		return getTemplate(templateName, null);
	}

	public Template getTemplate(String templateName, AgentRunConfig config) {
		AgentRunConfig cfg = effective(config);
		TemplateData data = ResourceErrors.call(ResourceErrors.TEMPLATE, templateName,
				() -> controlClient.getTemplate(templateName, cfg));
		return new Template(data, controlClient, cfg);
	}

	public Template updateTemplate(String templateName, TemplateUpdateInput input) {
		return updateTemplate(templateName, input, null);
	}

	public Template updateTemplate(String templateName, TemplateUpdateInput input, AgentRunConfig config) {
		AgentRunConfig cfg = effective(config);
		TemplateData data = ResourceErrors.call(ResourceErrors.TEMPLATE, templateName,
				() -> controlClient.updateTemplate(templateName, input, cfg));
		return new Template(data, controlClient, cfg);
	}

	public Template deleteTemplate(String templateName) {
		return deleteTemplate(templateName, null);
	}

	public Template deleteTemplate(String templateName, AgentRunConfig config) {
		AgentRunConfig cfg = effective(config);
		logger.debug("Deleting template: {}", templateName);
		TemplateData data = ResourceErrors.call(ResourceErrors.TEMPLATE, templateName,
				() -> controlClient.deleteTemplate(templateName, cfg));
		return new Template(data, controlClient, cfg);
	}

	public List<Template> listTemplates(TemplateListInput input) {
		return listTemplates(input, null);
	}

	public List<Template> listTemplates(TemplateListInput input, AgentRunConfig config) {
		AgentRunConfig cfg = effective(config);
		List<TemplateData> page = ResourceErrors.call(ResourceErrors.TEMPLATE, null,
				() -> controlClient.listTemplates(input, cfg));
		List<Template> templates = new ArrayList<>(page.size());
		for (TemplateData data : page) {
			templates.add(new Template(data, controlClient, cfg));
		}
		return templates;
	}

	/**
	 * Lists every template, reading pages of 50 until a short page. Templates are
	 * de-duplicated by id; entries without an id are skipped.
	 * @param templateType restricts the listing to one type, may be null
	 * @return the templates in listing order
	 */
	public List<Template> listAllTemplates(TemplateType templateType) {
		return listAllTemplates(templateType, null);
	}

	public List<Template> listAllTemplates(TemplateType templateType, AgentRunConfig config) {
		List<Template> all = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		int pageNumber = 1;
		while (true) {
			List<Template> page = listTemplates(TemplateListInput.page(pageNumber, TEMPLATE_PAGE_SIZE, templateType),
					config);
			for (Template template : page) {
				String id = template.templateId();
				if (id != null && seen.add(id)) {
					all.add(template);
				}
			}
			if (page.size() < TEMPLATE_PAGE_SIZE) {
				break;
			}
			pageNumber++;
		}
		return all;
	}

	// Sandboxes

	/**
	 * Creates a sandbox from a template.
	 * @param params the input, the wrapper type to return and per-call configuration
	 * @return the new sandbox, typically still {@code Creating}
	 */
	public Sandbox createSandbox(CreateSandboxParams params) {
		SandboxCreateInput input = params.input();
		SandboxData data = ResourceErrors.call(ResourceErrors.SANDBOX, input.templateName(),
				() -> dataApi.createSandbox(input, params.config()));
		return SandboxVariants.wrap(params.templateType(), data, dataApi, params.config());
	}

	public CodeInterpreterSandbox createCodeInterpreterSandbox(String templateName) {
		return createCodeInterpreterSandbox(SandboxCreateInput.of(templateName));
	}

	public CodeInterpreterSandbox createCodeInterpreterSandbox(SandboxCreateInput input) {
		return (CodeInterpreterSandbox) createSandbox(CreateSandboxParams.of(input, TemplateType.CODE_INTERPRETER));
	}

	public BrowserSandbox createBrowserSandbox(String templateName) {
		return createBrowserSandbox(SandboxCreateInput.of(templateName));
	}

	public BrowserSandbox createBrowserSandbox(SandboxCreateInput input) {
		return (BrowserSandbox) createSandbox(CreateSandboxParams.of(input, TemplateType.BROWSER));
	}

	public AioSandbox createAioSandbox(String templateName) {
		return createAioSandbox(SandboxCreateInput.of(templateName));
	}

	public AioSandbox createAioSandbox(SandboxCreateInput input) {
		return (AioSandbox) createSandbox(CreateSandboxParams.of(input, TemplateType.AIO));
	}

	public Sandbox getSandbox(SandboxParams params) {
		SandboxData data = ResourceErrors.call(ResourceErrors.SANDBOX, params.id(),
				() -> dataApi.getSandbox(params.id(), params.config()));
		return SandboxVariants.wrap(params.templateType(), data, dataApi, params.config());
	}

	public Sandbox stopSandbox(SandboxParams params) {
		SandboxData data = ResourceErrors.call(ResourceErrors.SANDBOX, params.id(),
				() -> dataApi.stopSandbox(params.id(), params.config()));
		return SandboxVariants.wrap(params.templateType(), data, dataApi, params.config());
	}

	public Sandbox deleteSandbox(SandboxParams params) {
		SandboxData data = ResourceErrors.call(ResourceErrors.SANDBOX, params.id(),
				() -> dataApi.deleteSandbox(params.id(), params.config()));
		return SandboxVariants.wrap(params.templateType(), data, dataApi, params.config());
	}

	public List<Sandbox> listSandboxes(SandboxListInput input) {
		return listSandboxes(input, null);
	}

	public List<Sandbox> listSandboxes(SandboxListInput input, AgentRunConfig config) {
		AgentRunConfig cfg = effective(config);
		SandboxListResult result = ResourceErrors.call(ResourceErrors.SANDBOX, null,
				() -> controlClient.listSandboxes(input != null ? input : SandboxListInput.all(), cfg));
		List<Sandbox> sandboxes = new ArrayList<>(result.sandboxes().size());
		for (SandboxData data : result.sandboxes()) {
			sandboxes.add(new Sandbox(data, dataApi, config));
		}
		return sandboxes;
	}

	// Positional forms

	/**
	 * Creates a sandbox.
	 * @param input the template and sandbox settings
	 * @param config per-call configuration, may be null
	 * @return the new sandbox
	 * @deprecated use {@link #createSandbox(CreateSandboxParams)}
	 */
	@Deprecated(since = "0.1.0")
	public Sandbox createSandbox(SandboxCreateInput input, AgentRunConfig config) {
		logDeprecated("createSandbox(SandboxCreateInput, AgentRunConfig)", "createSandbox(CreateSandboxParams)");
		return createSandbox(new CreateSandboxParams(input, null, config));
	}

	/**
	 * Gets a sandbox.
	 * @param id the sandbox id
	 * @param templateType the wrapper to return, may be null
	 * @param config per-call configuration, may be null
	 * @return the sandbox
	 * @deprecated use {@link #getSandbox(SandboxParams)}
	 */
	@Deprecated(since = "0.1.0")
	public Sandbox getSandbox(String id, TemplateType templateType, AgentRunConfig config) {
		logDeprecated("getSandbox(String, TemplateType, AgentRunConfig)", "getSandbox(SandboxParams)");
		return getSandbox(new SandboxParams(id, templateType, config));
	}

	/**
	 * Stops a sandbox.
	 * @param id the sandbox id
	 * @param config per-call configuration, may be null
	 * @return the stopped sandbox
	 * @deprecated use {@link #stopSandbox(SandboxParams)}
	 */
	@Deprecated(since = "0.1.0")
	public Sandbox stopSandbox(String id, AgentRunConfig config) {
		logDeprecated("stopSandbox(String, AgentRunConfig)", "stopSandbox(SandboxParams)");
		return stopSandbox(new SandboxParams(id, null, config));
	}

	/**
	 * Deletes a sandbox.
	 * @param id the sandbox id
	 * @param config per-call configuration, may be null
	 * @return the deleted sandbox
	 * @deprecated use {@link #deleteSandbox(SandboxParams)}
	 */
	@Deprecated(since = "0.1.0")
	public Sandbox deleteSandbox(String id, AgentRunConfig config) {
		logDeprecated("deleteSandbox(String, AgentRunConfig)", "deleteSandbox(SandboxParams)");
		return deleteSandbox(new SandboxParams(id, null, config));
	}

	private void logDeprecated(String method, String replacement) {
		logger.atWarn()
			.addKeyValue("event", "deprecated-call")
			.addKeyValue("method", method)
			.addKeyValue("replacement", replacement)
			.log("{} is deprecated, use {} instead", method, replacement);
	}

	private AgentRunConfig effective(AgentRunConfig override) {
		return AgentRunConfig.merge(config, override);
	}

	public static class Builder {

		private AgentRunConfig config;

		private SandboxControlClient controlClient;

		private DebugMode debugMode;

		private HttpClient httpClient;

		private Map<String, String> environment;

		public Builder config(AgentRunConfig config) {
			this.config = config;
			return this;
		}

		/**
		 * Set the control-plane client. It also issues the data-plane access tokens.
		 * @param controlClient the control client
		 * @return this builder
		 */
		public Builder controlClient(SandboxControlClient controlClient) {
			this.controlClient = controlClient;
			return this;
		}

		public Builder debugMode(DebugMode debugMode) {
			this.debugMode = debugMode;
			return this;
		}

		public Builder httpClient(HttpClient httpClient) {
			this.httpClient = httpClient;
			return this;
		}

		/**
		 * Set the environment to read {@code AGENTRUN_*} variables from. Defaults to the
		 * process environment.
		 * @param environment the environment variables
		 * @return this builder
		 */
		public Builder environment(Map<String, String> environment) {
			this.environment = environment;
			return this;
		}

		public SandboxClient build() {
			return new SandboxClient(this);
		}

	}

}
