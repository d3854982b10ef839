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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection settings for the AgentRun control and data planes.
 *
 * <p>
 * Every field is optional on its own. Configurations are layered with
 * {@link #merge(AgentRunConfig...)}, where a later layer only overrides the fields it
 * actually sets. The usual stack is environment defaults, then the client's
 * configuration, then a per-call override:
 * </p>
 *
 * <pre>{@code
 * AgentRunConfig effective = AgentRunConfig.merge(AgentRunConfig.fromEnvironment(), clientConfig,
 * 		AgentRunConfig.builder().timeout(Duration.ofSeconds(30)).build());
 * }</pre>
 *
 * <p>
 * Credential and account accessors reject null or empty values at the point of use.
 * </p>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public final class AgentRunConfig {

	private static final String DEFAULT_REGION = "cn-hangzhou";

	private static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(600_000);

	private static final AgentRunConfig EMPTY = new Builder().build();

	private final String accessKeyId;

	private final String accessKeySecret;

	private final String securityToken;

	private final String accountId;

	private final String token;

	private final String regionId;

	private final Duration timeout;

	private final String controlEndpoint;

	private final String dataEndpoint;

	private final Map<String, String> headers;

	private AgentRunConfig(Builder builder) {
		this.accessKeyId = builder.accessKeyId;
		this.accessKeySecret = builder.accessKeySecret;
		this.securityToken = builder.securityToken;
		this.accountId = builder.accountId;
		this.token = builder.token;
		this.regionId = builder.regionId;
		this.timeout = builder.timeout;
		this.controlEndpoint = builder.controlEndpoint;
		this.dataEndpoint = builder.dataEndpoint;
		this.headers = builder.headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers))
				: null;
	}

	/**
	 * Gets the access key id.
	 * @return the access key id
	 * @throws ConfigurationException if the access key id is not set
	 */
	public String accessKeyId() {
		return required(accessKeyId, "Access key ID", "AGENTRUN_ACCESS_KEY_ID");
	}

	/**
	 * Gets the access key secret.
	 * @return the access key secret
	 * @throws ConfigurationException if the access key secret is not set
	 */
	public String accessKeySecret() {
		return required(accessKeySecret, "Access key secret", "AGENTRUN_ACCESS_KEY_SECRET");
	}

	/**
	 * Gets the STS security token, if any.
	 * @return the security token or null
	 */
	public String securityToken() {
		return securityToken;
	}

	/**
	 * Gets the account id used to address the data plane.
	 * @return the account id
	 * @throws ConfigurationException if the account id is not set
	 */
	public String accountId() {
		return required(accountId, "Account ID", "AGENTRUN_ACCOUNT_ID");
	}

	/**
	 * Gets the static bearer token. When set it bypasses the access-token lookup.
	 * @return the static token or null
	 */
	public String token() {
		return token;
	}

	public boolean hasToken() {
		return token != null && !token.isEmpty();
	}

	public String regionId() {
		return regionId != null && !regionId.isEmpty() ? regionId : DEFAULT_REGION;
	}

	public Duration timeout() {
		return timeout != null ? timeout : DEFAULT_TIMEOUT;
	}

	public String controlEndpoint() {
		if (controlEndpoint != null && !controlEndpoint.isEmpty()) {
			return controlEndpoint;
		}
		return "https://agentrun." + regionId() + ".aliyuncs.com";
	}

	public String dataEndpoint() {
		if (dataEndpoint != null && !dataEndpoint.isEmpty()) {
			return dataEndpoint;
		}
		return "https://" + accountId() + ".agentrun-data." + regionId() + ".aliyuncs.com";
	}

	public Map<String, String> headers() {
		return headers != null ? headers : Map.of();
	}

	private static String required(String value, String label, String variable) {
		if (value == null || value.isEmpty()) {
			throw new ConfigurationException(
					label + " is not set. Please add " + variable + " environment variable or set it in code.");
		}
		return value;
	}

	/**
	 * Merges configuration layers. Later layers win field by field, but a field a later
	 * layer leaves unset never erases an earlier value. Header maps are combined with later
	 * keys overriding earlier ones. Null layers are skipped.
	 * @param layers the layers, lowest precedence first
	 * @return the merged configuration
	 */
	public static AgentRunConfig merge(AgentRunConfig... layers) {
		Builder merged = new Builder();
		for (AgentRunConfig layer : layers) {
			if (layer == null) {
				continue;
			}
			if (layer.accessKeyId != null) {
				merged.accessKeyId = layer.accessKeyId;
			}
			if (layer.accessKeySecret != null) {
				merged.accessKeySecret = layer.accessKeySecret;
			}
			if (layer.securityToken != null) {
				merged.securityToken = layer.securityToken;
			}
			if (layer.accountId != null) {
				merged.accountId = layer.accountId;
			}
			if (layer.token != null) {
				merged.token = layer.token;
			}
			if (layer.regionId != null) {
				merged.regionId = layer.regionId;
			}
			if (layer.timeout != null) {
				merged.timeout = layer.timeout;
			}
			if (layer.controlEndpoint != null) {
				merged.controlEndpoint = layer.controlEndpoint;
			}
			if (layer.dataEndpoint != null) {
				merged.dataEndpoint = layer.dataEndpoint;
			}
			if (layer.headers != null) {
				merged.headers(layer.headers);
			}
		}
		return merged.build();
	}

	/**
	 * Creates the default layer from the process environment.
	 * @return a configuration holding the values found in the environment
	 */
	public static AgentRunConfig fromEnvironment() {
		return fromEnvironment(System.getenv());
	}

	/**
	 * Creates the default layer from the given environment variables. Blank variables
	 * count as unset.
	 * @param env the environment variables
	 * @return a configuration holding the values found in {@code env}
	 */
	public static AgentRunConfig fromEnvironment(Map<String, String> env) {
		return new Builder().accessKeyId(firstSet(env, "AGENTRUN_ACCESS_KEY_ID", "ALIBABA_CLOUD_ACCESS_KEY_ID"))
			.accessKeySecret(firstSet(env, "AGENTRUN_ACCESS_KEY_SECRET", "ALIBABA_CLOUD_ACCESS_KEY_SECRET"))
			.securityToken(firstSet(env, "AGENTRUN_SECURITY_TOKEN", "ALIBABA_CLOUD_SECURITY_TOKEN"))
			.accountId(firstSet(env, "AGENTRUN_ACCOUNT_ID", "FC_ACCOUNT_ID"))
			.regionId(firstSet(env, "AGENTRUN_REGION", "FC_REGION"))
			.controlEndpoint(firstSet(env, "AGENTRUN_CONTROL_ENDPOINT"))
			.dataEndpoint(firstSet(env, "AGENTRUN_DATA_ENDPOINT"))
			.build();
	}

	private static String firstSet(Map<String, String> env, String... names) {
		for (String name : names) {
			String value = env.get(name);
			if (value != null && !value.isBlank()) {
				return value;
			}
		}
		return null;
	}

	/**
	 * Gets a configuration with no fields set.
	 * @return the empty configuration
	 */
	public static AgentRunConfig empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String toString() {
		return String.format("AgentRunConfig{regionId=%s, accountId=%s, controlEndpoint=%s, dataEndpoint=%s, timeout=%s}",
				regionId, accountId, controlEndpoint, dataEndpoint, timeout);
	}

	public static class Builder {

		private String accessKeyId;

		private String accessKeySecret;

		private String securityToken;

		private String accountId;

		private String token;

		private String regionId;

		private Duration timeout;

		private String controlEndpoint;

		private String dataEndpoint;

		private Map<String, String> headers;

		public Builder accessKeyId(String accessKeyId) {
			this.accessKeyId = accessKeyId;
			return this;
		}

		public Builder accessKeySecret(String accessKeySecret) {
			this.accessKeySecret = accessKeySecret;
			return this;
		}

		public Builder securityToken(String securityToken) {
			this.securityToken = securityToken;
			return this;
		}

		public Builder accountId(String accountId) {
			this.accountId = accountId;
			return this;
		}

		/**
		 * Set a static bearer token for data-plane calls.
		 * @param token the token
		 * @return this builder
		 */
		public Builder token(String token) {
			this.token = token;
			return this;
		}

		public Builder regionId(String regionId) {
			this.regionId = regionId;
			return this;
		}

		public Builder timeout(Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		public Builder controlEndpoint(String controlEndpoint) {
			this.controlEndpoint = controlEndpoint;
			return this;
		}

		public Builder dataEndpoint(String dataEndpoint) {
			this.dataEndpoint = dataEndpoint;
			return this;
		}

		/**
		 * Add an extra header sent with every data-plane call.
		 * @param name header name
		 * @param value header value
		 * @return this builder
		 */
		public Builder header(String name, String value) {
			if (this.headers == null) {
				this.headers = new LinkedHashMap<>();
			}
			this.headers.put(name, value);
			return this;
		}

		public Builder headers(Map<String, String> headers) {
			if (this.headers == null) {
				this.headers = new LinkedHashMap<>();
			}
			this.headers.putAll(headers);
			return this;
		}

		public AgentRunConfig build() {
			return new AgentRunConfig(this);
		}

	}

}
