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
package org.springaicommunity.agentrun.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springaicommunity.agentrun.AgentRunConfig;

/**
 * One data-plane call: a path relative to the client's namespace plus optional query,
 * body, header overrides and a per-call configuration layer.
 *
 * <p>
 * A request carries at most one body, either a JSON value or raw bytes.
 * </p>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public final class DataRequest {

	private final String path;

	private final Map<String, Object> query;

	private final Object json;

	private final byte[] binary;

	private final Map<String, String> headers;

	private final AgentRunConfig config;

	private DataRequest(Builder builder) {
		if (builder.json != null && builder.binary != null) {
			throw new IllegalArgumentException("A request can carry a JSON body or a binary body, not both");
		}
		this.path = builder.path != null ? builder.path : "";
		this.query = Collections.unmodifiableMap(new LinkedHashMap<>(builder.query));
		this.json = builder.json;
		this.binary = builder.binary != null ? builder.binary.clone() : null;
		this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
		this.config = builder.config;
	}

	public static DataRequest of(String path) {
		return builder(path).build();
	}

	public static Builder builder(String path) {
		return new Builder().path(path);
	}

	public String path() {
		return path;
	}

	public Map<String, Object> query() {
		return query;
	}

	public Object json() {
		return json;
	}

	public byte[] binary() {
		return binary != null ? binary.clone() : null;
	}

	public Map<String, String> headers() {
		return headers;
	}

	public AgentRunConfig config() {
		return config;
	}

	public static class Builder {

		private String path;

		private final Map<String, Object> query = new LinkedHashMap<>();

		private Object json;

		private byte[] binary;

		private final Map<String, String> headers = new LinkedHashMap<>();

		private AgentRunConfig config;

		public Builder path(String path) {
			this.path = path;
			return this;
		}

		/**
		 * Add a query parameter. Null values are skipped; collections and arrays are sent
		 * as repeated keys.
		 * @param name parameter name
		 * @param value parameter value
		 * @return this builder
		 */
		public Builder query(String name, Object value) {
			if (value != null) {
				this.query.put(name, value);
			}
			return this;
		}

		public Builder query(Map<String, ?> query) {
			if (query != null) {
				query.forEach(this::query);
			}
			return this;
		}

		public Builder json(Object json) {
			this.json = json;
			return this;
		}

		public Builder binary(byte[] binary) {
			this.binary = binary;
			return this;
		}

		public Builder header(String name, String value) {
			this.headers.put(name, value);
			return this;
		}

		public Builder headers(Map<String, String> headers) {
			if (headers != null) {
				this.headers.putAll(headers);
			}
			return this;
		}

		public Builder config(AgentRunConfig config) {
			this.config = config;
			return this;
		}

		public DataRequest build() {
			return new DataRequest(this);
		}

	}

}
