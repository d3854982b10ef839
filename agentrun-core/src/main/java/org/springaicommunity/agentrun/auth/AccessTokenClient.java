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
package org.springaicommunity.agentrun.auth;

import org.springaicommunity.agentrun.ConfigurationException;

/**
 * Issues resource-scoped bearer tokens. Implemented by the control-plane client.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
@FunctionalInterface
public interface AccessTokenClient {

	/**
	 * Requests a bearer token for one resource.
	 * @param request the resource to scope the token to
	 * @return the token
	 * @throws org.springaicommunity.agentrun.HttpException if the control plane rejects
	 * the call
	 */
	String getAccessToken(AccessTokenRequest request);

	/**
	 * A client for setups without a control plane, where every call relies on a static
	 * token. Each request fails, which the token cache logs and tolerates.
	 * @return a client that never issues tokens
	 */
	static AccessTokenClient unavailable() {
		return request -> {
			throw new ConfigurationException("No control client configured to issue access tokens for "
					+ request.resourceType().value());
		};
	}

}
