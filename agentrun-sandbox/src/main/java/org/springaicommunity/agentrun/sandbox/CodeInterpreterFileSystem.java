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

import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import org.springaicommunity.agentrun.http.FileDownloadResult;
import org.springaicommunity.agentrun.sandbox.api.CodeInterpreterDataApi;

/**
 * Directory listing, metadata, moves and binary transfer inside a code interpreter
 * sandbox.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class CodeInterpreterFileSystem {

	public static final String DEFAULT_DIRECTORY_MODE = "0755";

	private final CodeInterpreterSandbox sandbox;

	private final CodeInterpreterDataApi api;

	CodeInterpreterFileSystem(CodeInterpreterSandbox sandbox, CodeInterpreterDataApi api) {
		this.sandbox = sandbox;
		this.api = api;
	}

	public JsonNode list() {
		return api.listDirectory(null, null);
	}

	/**
	 * Lists a directory.
	 * @param path the directory, the working directory when null
	 * @param depth how deep to recurse, service default when null
	 * @return the entries
	 */
	public JsonNode list(String path, Integer depth) {
		return api.listDirectory(path, depth);
	}

	public JsonNode stat(String path) {
		return api.stat(path);
	}

	public JsonNode mkdir(String path) {
		return mkdir(path, true, DEFAULT_DIRECTORY_MODE);
	}

	public JsonNode mkdir(String path, boolean parents, String mode) {
		return api.mkdir(path, parents, mode);
	}

	public JsonNode move(String source, String destination) {
		return api.moveFile(source, destination);
	}

	public JsonNode remove(String path) {
		return api.removeFile(path);
	}

	/**
	 * Uploads a local file.
	 * @param localFile the file to send
	 * @param targetPath the destination inside the sandbox
	 * @return the service response
	 * @throws org.springaicommunity.agentrun.ClientException on a non-2xx response or a
	 * local read failure
	 */
	public JsonNode upload(Path localFile, String targetPath) {
		return api.uploadFile(localFile, targetPath);
	}

	/**
	 * Downloads a file from the sandbox. Nothing is written locally when the service
	 * rejects the request.
	 * @param path the file inside the sandbox
	 * @param savePath the local destination
	 * @return the saved path and size
	 */
	public FileDownloadResult download(String path, Path savePath) {
		return api.downloadFile(path, savePath);
	}

	public CodeInterpreterSandbox and() {
		return sandbox;
	}

}
