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
import org.springaicommunity.agentrun.sandbox.api.CodeInterpreterDataApi;

/**
 * Text file access inside a code interpreter sandbox.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class CodeInterpreterFiles {

	public static final String DEFAULT_MODE = "644";

	public static final String DEFAULT_ENCODING = "utf-8";

	private final CodeInterpreterSandbox sandbox;

	private final CodeInterpreterDataApi api;

	CodeInterpreterFiles(CodeInterpreterSandbox sandbox, CodeInterpreterDataApi api) {
		this.sandbox = sandbox;
		this.api = api;
	}

	public JsonNode read(String path) {
		return api.readFile(path);
	}

	/**
	 * Writes a UTF-8 file with mode {@code 644}, creating parent directories.
	 * @param path the file path
	 * @param content the file content
	 * @return the service response
	 */
	public JsonNode write(String path, String content) {
		return write(path, content, DEFAULT_MODE, DEFAULT_ENCODING, true);
	}

	public JsonNode write(String path, String content, String mode, String encoding, boolean createDir) {
		return api.writeFile(path, content, mode, encoding, createDir);
	}

	public CodeInterpreterSandbox and() {
		return sandbox;
	}

}
