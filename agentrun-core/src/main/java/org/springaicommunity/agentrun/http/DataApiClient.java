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

import java.io.IOException;
import java.lang.reflect.Array;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.agentrun.AgentRunConfig;
import org.springaicommunity.agentrun.ClientException;
import org.springaicommunity.agentrun.DebugMode;
import org.springaicommunity.agentrun.HttpException;
import org.springaicommunity.agentrun.ResponseParseException;
import org.springaicommunity.agentrun.auth.AccessTokenCache;
import org.springaicommunity.agentrun.auth.ResourceType;

/**
 * HTTP client for the AgentRun data plane.
 *
 * <p>
 * Each instance addresses one namespace below the data endpoint (for example
 * {@code sandboxes/sbx-1}) and authenticates as one resource. Instances derived with
 * {@link #forResource(String, ResourceType, String)} share the token cache, the
 * underlying {@link HttpClient} and the JSON mapper.
 * </p>
 *
 * <p>
 * Calls are never retried. Every failure surfaces as an {@link HttpException}:
 * </p>
 * <ul>
 * <li>a 4xx or 5xx response with a readable body becomes a {@code ClientException} or
 * {@code ServerException} with the service's message and request id;</li>
 * <li>an unreadable body is a {@code ResponseParseException} with status 0 and the
 * answered HTTP status attached, except a 502 whose body reads {@code 502 Bad Gateway},
 * which keeps its status;</li>
 * <li>connection failures and timeouts are a {@code ClientException} with status 0.</li>
 * </ul>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public class DataApiClient {

	private static final Logger logger = LoggerFactory.getLogger(DataApiClient.class);

	public static final String ACCESS_TOKEN_HEADER = "Agentrun-Access-Token";

	public static final String USER_AGENT = "AgentRunDataClient-Java/1.0";

	private static final String CONTENT_TYPE_HEADER = "Content-Type";

	private static final String CONTENT_TYPE_JSON = "application/json";

	private static final String BAD_GATEWAY = "502 Bad Gateway";

	private final AgentRunConfig config;

	private final String namespace;

	private final ResourceType resourceType;

	private final String resourceKey;

	private final AccessTokenCache tokenCache;

	private final DebugMode debugMode;

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private DataApiClient(Builder builder) {
		this(builder.config != null ? builder.config : AgentRunConfig.empty(), builder.namespace,
				builder.resourceType, builder.resourceKey,
				Objects.requireNonNull(builder.tokenCache, "tokenCache cannot be null"),
				builder.debugMode != null ? builder.debugMode : DebugMode.disabled(),
				builder.httpClient != null ? builder.httpClient : defaultHttpClient(),
				builder.objectMapper != null ? builder.objectMapper : defaultObjectMapper());
	}

	private DataApiClient(AgentRunConfig config, String namespace, ResourceType resourceType, String resourceKey,
			AccessTokenCache tokenCache, DebugMode debugMode, HttpClient httpClient, ObjectMapper objectMapper) {
		this.config = config;
		this.namespace = namespace != null ? namespace : "";
		this.resourceType = resourceType;
		this.resourceKey = resourceKey;
		this.tokenCache = tokenCache;
		this.debugMode = debugMode;
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Creates the JDK client used when none is supplied.
	 * @return a new HTTP client
	 */
	public static HttpClient defaultHttpClient() {
		return HttpClient.newBuilder()
			.version(HttpClient.Version.HTTP_1_1)
			.connectTimeout(Duration.ofSeconds(30))
			.build();
	}

	/**
	 * Creates the JSON mapper used when none is supplied. Trailing content after a JSON
	 * value is rejected so that text bodies such as {@code 502 Bad Gateway} are not read as
	 * a number.
	 * @return a new object mapper
	 */
	public static ObjectMapper defaultObjectMapper() {
		return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
			.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
	}

	/**
	 * Derives a client for another namespace and token scope, sharing this client's
	 * configuration, token cache and transport.
	 * @param namespace path below the data endpoint
	 * @param resourceType the kind of resource the token is scoped to
	 * @param resourceKey the sandbox id or template name
	 * @return the derived client
	 */
	public DataApiClient forResource(String namespace, ResourceType resourceType, String resourceKey) {
		return new DataApiClient(config, namespace, resourceType, resourceKey, tokenCache, debugMode, httpClient,
				objectMapper);
	}

	public AgentRunConfig config() {
		return config;
	}

	public String namespace() {
		return namespace;
	}

	public ObjectMapper objectMapper() {
		return objectMapper;
	}

	/**
	 * Builds the absolute URL for a path in this client's namespace.
	 * @param path path relative to the namespace
	 * @return the URL
	 */
	public String withPath(String path) {
		return withPath(path, Map.of());
	}

	/**
	 * Builds the absolute URL for a path in this client's namespace with a query string.
	 * @param path path relative to the namespace
	 * @param query query parameters; collections and arrays become repeated keys
	 * @return the URL
	 */
	public String withPath(String path, Map<String, ?> query) {
		return buildUrl(config, path, query);
	}

	/**
	 * Builds the absolute URL for a path, with {@code override} merged over this client's
	 * configuration.
	 * @param path path relative to the namespace
	 * @param query query parameters
	 * @param override per-call configuration, may be null
	 * @return the URL
	 */
	public String withPath(String path, Map<String, ?> query, AgentRunConfig override) {
		return buildUrl(AgentRunConfig.merge(config, override), path, query);
	}

	public JsonNode get(String path) {
		return get(DataRequest.of(path));
	}

	public JsonNode get(DataRequest request) {
		return send("GET", request);
	}

	public JsonNode post(String path, Object json) {
		return post(DataRequest.builder(path).json(json).build());
	}

	public JsonNode post(DataRequest request) {
		return send("POST", request);
	}

	public JsonNode put(DataRequest request) {
		return send("PUT", request);
	}

	public JsonNode patch(DataRequest request) {
		return send("PATCH", request);
	}

	public JsonNode delete(String path) {
		return delete(DataRequest.of(path));
	}

	public JsonNode delete(DataRequest request) {
		return send("DELETE", request);
	}

	private JsonNode send(String method, DataRequest request) {
		AgentRunConfig effective = AgentRunConfig.merge(config, request.config());
		String url = buildUrl(effective, request.path(), request.query());
		Map<String, String> headers = prepareHeaders(effective, request.headers());

		try {
			BodyPublisher body;
			if (request.json() != null) {
				body = BodyPublishers.ofString(objectMapper.writeValueAsString(request.json()));
			}
			else if (request.binary() != null) {
				body = BodyPublishers.ofByteArray(request.binary());
			}
			else {
				body = BodyPublishers.noBody();
			}

			HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
				.uri(URI.create(url))
				.method(method, body)
				.timeout(effective.timeout());
			headers.forEach(requestBuilder::header);

			debugMode.log(logger, "{} {} headers={}", method, url, maskHeaders(headers));
			HttpResponse<String> response = httpClient.send(requestBuilder.build(),
					HttpResponse.BodyHandlers.ofString());
			debugMode.log(logger, "{} {} -> {} {}", method, url, response.statusCode(), response.body());

			return parseResponse(response.statusCode(), response.body());
		}
		catch (JsonProcessingException e) {
			throw new ClientException(0, "Failed to serialize request body for " + method + " " + url, e);
		}
		catch (HttpTimeoutException e) {
			throw new ClientException(0,
					"Request timed out after " + effective.timeout().toMillis() + " ms: " + method + " " + url, e);
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw new ClientException(0, "Request error: " + method + " " + url + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Uploads a local file as {@code multipart/form-data} with fields {@code file} and
	 * {@code path}.
	 * @param request the target path in this namespace plus any query or headers
	 * @param localFile the file to send
	 * @param targetPath the destination path inside the sandbox
	 * @param extraFields further string fields, may be empty
	 * @return the parsed response
	 */
	public JsonNode uploadFile(DataRequest request, Path localFile, String targetPath,
			Map<String, String> extraFields) {
		AgentRunConfig effective = AgentRunConfig.merge(config, request.config());
		String url = buildUrl(effective, request.path(), request.query());
		Map<String, String> headers = prepareHeaders(effective, request.headers());
		headers.keySet().removeIf(CONTENT_TYPE_HEADER::equalsIgnoreCase);

		MultipartBody.Builder form = MultipartBody.builder().file("file", localFile).field("path", targetPath);
		if (extraFields != null) {
			extraFields.forEach(form::field);
		}
		MultipartBody multipart = form.build();
		headers.put(CONTENT_TYPE_HEADER, multipart.contentType());

		try {
			HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
				.uri(URI.create(url))
				.POST(multipart.bodyPublisher())
				.timeout(effective.timeout());
			headers.forEach(requestBuilder::header);

			debugMode.log(logger, "Uploading {} to {} via {}", localFile, targetPath, url);
			HttpResponse<String> response = httpClient.send(requestBuilder.build(),
					HttpResponse.BodyHandlers.ofString());

			if (!isSuccess(response.statusCode())) {
				throw new ClientException(response.statusCode(), response.body());
			}
			return parseResponse(response.statusCode(), response.body());
		}
		catch (HttpTimeoutException e) {
			throw new ClientException(0, "Upload timed out after " + effective.timeout().toMillis() + " ms: " + url,
					e);
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw new ClientException(0, "Upload file error: " + localFile + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Downloads a response body to a local file. The body is read fully, then written to a
	 * temporary file next to {@code savePath} and moved into place.
	 * @param request the source path in this namespace plus any query or headers
	 * @param savePath the local destination
	 * @return where the file was saved and its size
	 */
	public FileDownloadResult downloadFile(DataRequest request, Path savePath) {
		AgentRunConfig effective = AgentRunConfig.merge(config, request.config());
		String url = buildUrl(effective, request.path(), request.query());
		Map<String, String> headers = prepareHeaders(effective, request.headers());

		byte[] content;
		try {
			HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
				.uri(URI.create(url))
				.GET()
				.timeout(effective.timeout());
			headers.forEach(requestBuilder::header);

			debugMode.log(logger, "Downloading {} to {}", url, savePath);
			HttpResponse<byte[]> response = httpClient.send(requestBuilder.build(),
					HttpResponse.BodyHandlers.ofByteArray());

			if (!isSuccess(response.statusCode())) {
				throw new ClientException(response.statusCode(),
						new String(response.body(), StandardCharsets.UTF_8));
			}
			content = response.body();
		}
		catch (HttpTimeoutException e) {
			throw new ClientException(0,
					"Download timed out after " + effective.timeout().toMillis() + " ms: " + url, e);
		}
		catch (IOException | InterruptedException e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			throw new ClientException(0, "Download error: " + url + ": " + e.getMessage(), e);
		}

		writeAtomically(savePath, content);
		logger.debug("Downloaded {} bytes to {}", content.length, savePath);
		return new FileDownloadResult(savePath.toString(), content.length);
	}

	private void writeAtomically(Path savePath, byte[] content) {
		Path target = savePath.toAbsolutePath();
		Path directory = target.getParent();
		Path temp = null;
		try {
			Files.createDirectories(directory);
			temp = Files.createTempFile(directory, ".agentrun-", ".part");
			Files.write(temp, content);
			try {
				Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			}
			catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
			}
		}
		catch (IOException e) {
			deleteQuietly(temp);
			throw new ClientException(0, "Failed to write downloaded file: " + savePath, e);
		}
	}

	private void deleteQuietly(Path temp) {
		if (temp == null) {
			return;
		}
		try {
			Files.deleteIfExists(temp);
		}
		catch (IOException e) {
			logger.warn("Failed to delete temporary download file: {}", temp, e);
		}
	}

	JsonNode parseResponse(int statusCode, String text) {
		JsonNode body;
		if (text == null || text.isBlank()) {
			body = objectMapper.createObjectNode();
		}
		else {
			try {
				body = objectMapper.readTree(text);
			}
			catch (JsonProcessingException e) {
				if (statusCode == 502 && text.contains(BAD_GATEWAY)) {
					throw new ClientException(502, BAD_GATEWAY);
				}
				throw new ResponseParseException(statusCode,
						"Failed to parse JSON response (HTTP " + statusCode + "): " + e.getOriginalMessage(), e);
			}
		}

		if (statusCode >= 400) {
			String message = body.path("message").asText(null);
			if (message == null || message.isEmpty()) {
				message = text != null && !text.isBlank() ? text : "HTTP " + statusCode;
			}
			throw HttpException.fromStatus(statusCode, message, body.path("requestId").asText(null));
		}
		return body;
	}

	private Map<String, String> prepareHeaders(AgentRunConfig effective, Map<String, String> callHeaders) {
		Map<String, String> headers = new LinkedHashMap<>();
		headers.put(CONTENT_TYPE_HEADER, CONTENT_TYPE_JSON);
		headers.put("User-Agent", USER_AGENT);
		headers.putAll(effective.headers());
		headers.putAll(callHeaders);

		String token = resourceType != null ? tokenCache.ensureToken(resourceType, resourceKey, effective)
				: effective.token();
		if (token != null && !token.isEmpty()) {
			headers.put(ACCESS_TOKEN_HEADER, token);
		}
		return headers;
	}

	private String buildUrl(AgentRunConfig effective, String path, Map<String, ?> query) {
		List<String> parts = new ArrayList<>();
		parts.add(effective.dataEndpoint());
		parts.add(namespace);
		parts.add(path != null ? path.replaceFirst("^/+", "") : "");

		StringBuilder joined = new StringBuilder();
		for (String part : parts) {
			if (part == null || part.isEmpty()) {
				continue;
			}
			if (joined.length() > 0) {
				joined.append('/');
			}
			joined.append(part);
		}
		String url = joined.toString().replaceAll("/+", "/").replaceFirst(":/", "://");
		if (url.endsWith("/") && !url.endsWith("://")) {
			url = url.substring(0, url.length() - 1);
		}

		String queryString = encodeQuery(query);
		if (queryString.isEmpty()) {
			return url;
		}
		return url + (url.contains("?") ? "&" : "?") + queryString;
	}

	private static String encodeQuery(Map<String, ?> query) {
		if (query == null || query.isEmpty()) {
			return "";
		}
		StringBuilder encoded = new StringBuilder();
		for (Map.Entry<String, ?> entry : query.entrySet()) {
			for (Object value : values(entry.getValue())) {
				if (encoded.length() > 0) {
					encoded.append('&');
				}
				encoded.append(encode(entry.getKey())).append('=').append(encode(String.valueOf(value)));
			}
		}
		return encoded.toString();
	}

	private static List<Object> values(Object value) {
		List<Object> values = new ArrayList<>();
		if (value == null) {
			return values;
		}
		if (value instanceof Collection<?> collection) {
			collection.stream().filter(Objects::nonNull).forEach(values::add);
		}
		else if (value.getClass().isArray()) {
			for (int i = 0; i < Array.getLength(value); i++) {
				Object element = Array.get(value, i);
				if (element != null) {
					values.add(element);
				}
			}
		}
		else {
			values.add(value);
		}
		return values;
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
	}

	private static boolean isSuccess(int statusCode) {
		return statusCode >= 200 && statusCode < 300;
	}

	private static Map<String, String> maskHeaders(Map<String, String> headers) {
		Map<String, String> masked = new LinkedHashMap<>(headers);
		masked.computeIfPresent(ACCESS_TOKEN_HEADER, (name, value) -> AccessTokenCache.mask(value));
		return masked;
	}

	public static class Builder {

		private AgentRunConfig config;

		private String namespace;

		private ResourceType resourceType;

		private String resourceKey;

		private AccessTokenCache tokenCache;

		private DebugMode debugMode;

		private HttpClient httpClient;

		private ObjectMapper objectMapper;

		public Builder config(AgentRunConfig config) {
			this.config = config;
			return this;
		}

		/**
		 * Set the namespace below the data endpoint, e.g. {@code sandboxes}.
		 * @param namespace the namespace
		 * @return this builder
		 */
		public Builder namespace(String namespace) {
			this.namespace = namespace;
			return this;
		}

		/**
		 * Set the resource the access token is scoped to. Without one, only a static
		 * configured token is sent.
		 * @param resourceType the resource kind
		 * @param resourceKey the sandbox id or template name
		 * @return this builder
		 */
		public Builder resource(ResourceType resourceType, String resourceKey) {
			this.resourceType = resourceType;
			this.resourceKey = resourceKey;
			return this;
		}

		public Builder tokenCache(AccessTokenCache tokenCache) {
			this.tokenCache = tokenCache;
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

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		public DataApiClient build() {
			return new DataApiClient(this);
		}

	}

}
