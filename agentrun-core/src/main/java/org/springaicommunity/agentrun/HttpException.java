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

import java.util.Locale;

/**
 * An HTTP-shaped failure raised at the data-plane or control-plane boundary.
 *
 * <p>
 * Callers usually see one of the concrete subtypes: {@link ClientException} for 4xx and
 * local failures, {@link ServerException} for 5xx. Resource-aware callers reclassify
 * errors with {@link #toResourceError(String, String)}.
 * </p>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public abstract class HttpException extends AgentRunException {

	private static final String ALREADY_EXISTS = "already exists";

	private final int statusCode;

	private final String requestId;

	private final String errorCode;

	protected HttpException(int statusCode, String message, String requestId, String errorCode, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.requestId = requestId;
		this.errorCode = errorCode;
	}

	/**
	 * Creates the exception matching a raw status code: 5xx becomes a
	 * {@link ServerException}, everything else a {@link ClientException}.
	 * @param statusCode the HTTP status, or 0 for local failures
	 * @param message the error message
	 * @param requestId the request id reported by the service, may be null
	 * @return the classified exception
	 */
	public static HttpException fromStatus(int statusCode, String message, String requestId) {
		if (statusCode >= 500) {
			return new ServerException(statusCode, message, requestId);
		}
		return new ClientException(statusCode, message, requestId);
	}

	public int statusCode() {
		return statusCode;
	}

	public String requestId() {
		return requestId;
	}

	public String errorCode() {
		return errorCode;
	}

	/**
	 * Reclassifies this error for a named resource. Status 404 maps to
	 * {@link ResourceNotExistException}, 409 to {@link ResourceAlreadyExistException}; any
	 * other status whose message mentions "already exists" also maps to
	 * {@link ResourceAlreadyExistException}. Otherwise this error is returned unchanged.
	 * @param resourceType the resource kind, e.g. {@code Sandbox}
	 * @param resourceId the resource id or name, may be null
	 * @return the reclassified error
	 */
	public HttpException toResourceError(String resourceType, String resourceId) {
		if (statusCode == 404) {
			return new ResourceNotExistException(resourceType, resourceId, this);
		}
		if (statusCode == 409) {
			return new ResourceAlreadyExistException(resourceType, resourceId, this);
		}
		String message = getMessage();
		if (message != null && message.toLowerCase(Locale.ROOT).contains(ALREADY_EXISTS)) {
			return new ResourceAlreadyExistException(resourceType, resourceId, this);
		}
		return this;
	}

	public HttpException toResourceError(String resourceType) {
		return toResourceError(resourceType, null);
	}

	@Override
	public String toString() {
		return String.format("%s{statusCode=%d, message=%s, requestId=%s}", getClass().getSimpleName(), statusCode,
				getMessage(), requestId);
	}

}
