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

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.agentrun.ServerException;
import org.springaicommunity.agentrun.sandbox.api.CodeInterpreterDataApi;
import org.springaicommunity.agentrun.sandbox.model.CodeLanguage;

/**
 * Execution contexts of a code interpreter sandbox.
 *
 * <p>
 * A context is an interpreter session that keeps variables between executions. This
 * group remembers the context most recently created or fetched and uses it as the default
 * target of {@link #execute(String)} and {@link #delete()}.
 * </p>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class CodeInterpreterContexts {

	private static final Logger logger = LoggerFactory.getLogger(CodeInterpreterContexts.class);

	private final CodeInterpreterSandbox sandbox;

	private final CodeInterpreterDataApi api;

	private volatile String contextId;

	private volatile CodeLanguage language;

	private volatile String cwd;

	CodeInterpreterContexts(CodeInterpreterSandbox sandbox, CodeInterpreterDataApi api) {
		this.sandbox = sandbox;
		this.api = api;
	}

	public String contextId() {
		return contextId;
	}

	public CodeLanguage language() {
		return language;
	}

	public String cwd() {
		return cwd;
	}

	public JsonNode list() {
		return api.listContexts();
	}

	public CodeInterpreterContexts create() {
		return create(CodeLanguage.PYTHON, CodeInterpreterDataApi.DEFAULT_CWD);
	}

	/**
	 * Creates a context and makes it the current one.
	 * @param language the interpreter language, python when null
	 * @param cwd the working directory, {@code /home/user} when null
	 * @return this group
	 * @throws ServerException if the response does not describe a context
	 */
	public CodeInterpreterContexts create(CodeLanguage language, String cwd) {
		remember(api.createContext(language, cwd), "Failed to create context");
		return this;
	}

	public CodeInterpreterContexts get() {
		return get(null);
	}

	/**
	 * Fetches a context and makes it the current one.
	 * @param contextId the context, the current one when null
	 * @return this group
	 * @throws IllegalStateException if no id is given and there is no current context
	 * @throws ServerException if the response does not describe a context
	 */
	public CodeInterpreterContexts get(String contextId) {
		String id = contextId != null ? contextId : this.contextId;
		if (id == null) {
			throw new IllegalStateException("context id is not set");
		}
		remember(api.getContext(id), "Failed to get context");
		return this;
	}

	public JsonNode execute(String code) {
		return execute(code, null, null, null);
	}

	/**
	 * Runs code. Without an explicit context the current one is used; with neither a
	 * context nor a language the code runs as python.
	 * @param code the source to run
	 * @param language the language, may be null
	 * @param contextId the context, may be null
	 * @param timeoutSeconds execution timeout, 30 when null
	 * @return the execution result
	 */
	public JsonNode execute(String code, CodeLanguage language, String contextId, Integer timeoutSeconds) {
		String id = contextId != null ? contextId : this.contextId;
		CodeLanguage lang = language;
		if (id == null && lang == null) {
			logger.debug("context id is not set, using default language: python");
			lang = CodeLanguage.PYTHON;
		}
		return api.executeCode(code, lang, id, timeoutSeconds);
	}

	public JsonNode delete() {
		return delete(null);
	}

	/**
	 * Deletes a context and forgets the current one.
	 * @param contextId the context, the current one when null
	 * @return the service response
	 * @throws IllegalStateException if no id is given and there is no current context
	 */
	public JsonNode delete(String contextId) {
		String id = contextId != null ? contextId : this.contextId;
		if (id == null) {
			throw new IllegalStateException(
					"context id is required. Either pass it as parameter or create a context first.");
		}
		JsonNode result = api.deleteContext(id);
		this.contextId = null;
		return result;
	}

	public CodeInterpreterSandbox and() {
		return sandbox;
	}

	private void remember(JsonNode context, String failure) {
		String id = text(context, "id");
		String dir = text(context, "cwd");
		String lang = text(context, "language");
		if (id == null || dir == null || lang == null) {
			throw new ServerException(500, failure);
		}
		this.contextId = id;
		this.cwd = dir;
		this.language = CodeLanguage.fromValue(lang);
	}

	private static String text(JsonNode node, String field) {
		JsonNode value = node.get(field);
		return value != null && !value.isNull() && !value.asText().isEmpty() ? value.asText() : null;
	}

}
