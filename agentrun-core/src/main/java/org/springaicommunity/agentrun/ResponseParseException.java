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
 * A response body that could not be read as JSON. The status code is 0; the HTTP status
 * the server actually answered with is kept in {@link #httpStatus()}.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class ResponseParseException extends ClientException {

	private final int httpStatus;

	public ResponseParseException(int httpStatus, String message, Throwable cause) {
		super(0, message, null, null, cause);
		this.httpStatus = httpStatus;
	}

	public int httpStatus() {
		return httpStatus;
	}

}
