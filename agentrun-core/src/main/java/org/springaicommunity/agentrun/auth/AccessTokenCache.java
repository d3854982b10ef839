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

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.agentrun.AgentRunConfig;

/**
 * Per-client cache of resource-scoped access tokens, keyed by sandbox id or template
 * name.
 *
 * <p>
 * Entries never expire. Concurrent misses for the same key may each fetch a token; the
 * last one stored wins. A failed fetch is logged and yields no token, leaving the
 * service to reject the unauthenticated call.
 * </p>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public final class AccessTokenCache {

	private static final Logger logger = LoggerFactory.getLogger(AccessTokenCache.class);

	private final AccessTokenClient tokenClient;

	private final Map<String, String> tokens = new ConcurrentHashMap<>();

	public AccessTokenCache(AccessTokenClient tokenClient) {
		this.tokenClient = Objects.requireNonNull(tokenClient, "tokenClient cannot be null");
	}

	/**
	 * Returns the token to send for a resource. A static token in {@code config} always
	 * wins and is never cached.
	 * @param resourceType the resource kind
	 * @param resourceKey the sandbox id or template name
	 * @param config the effective configuration of the call
	 * @return the token, or null if none could be obtained
	 */
	public String ensureToken(ResourceType resourceType, String resourceKey, AgentRunConfig config) {
		if (config != null && config.hasToken()) {
			return config.token();
		}
		if (resourceKey == null || resourceKey.isEmpty()) {
			logger.debug("No resource key for {} token, sending request without one", resourceType.value());
			return null;
		}

		String cached = tokens.get(resourceKey);
		if (cached != null) {
			return cached;
		}

		try {
			String token = tokenClient.getAccessToken(AccessTokenRequest.of(resourceType, resourceKey));
			if (token == null || token.isEmpty()) {
				logger.warn("Control plane returned no access token for {} '{}'", resourceType.value(), resourceKey);
				return null;
			}
			tokens.put(resourceKey, token);
			logger.debug("Cached access token for {} '{}': {}", resourceType.value(), resourceKey, mask(token));
			return token;
		}
		catch (RuntimeException e) {
			logger.warn("Failed to get access token for {} '{}': {}", resourceType.value(), resourceKey,
					e.getMessage());
			return null;
		}
	}

	/**
	 * Masks a token for logging.
	 * @param token the token
	 * @return {@code ***} for short tokens, otherwise the first and last four characters
	 */
	public static String mask(String token) {
		if (token == null || token.length() <= 8) {
			return "***";
		}
		return token.substring(0, 4) + "..." + token.substring(token.length() - 4);
	}

}
