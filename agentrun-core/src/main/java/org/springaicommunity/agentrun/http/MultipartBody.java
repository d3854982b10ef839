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

import java.io.FileNotFoundException;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A {@code multipart/form-data} body that owns its boundary. File parts are streamed from
 * disk rather than buffered.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public final class MultipartBody {

	private static final String CRLF = "\r\n";

	private final String boundary;

	private final List<Part> parts;

	private MultipartBody(Builder builder) {
		this.boundary = "----AgentRunBoundary" + UUID.randomUUID().toString().replace("-", "");
		this.parts = List.copyOf(builder.parts);
	}

	public static Builder builder() {
		return new Builder();
	}

	public String boundary() {
		return boundary;
	}

	/**
	 * Gets the content type to send, including the generated boundary.
	 * @return the {@code Content-Type} header value
	 */
	public String contentType() {
		return "multipart/form-data; boundary=" + boundary;
	}

	/**
	 * Creates a publisher streaming all parts in order.
	 * @return the body publisher
	 * @throws FileNotFoundException if a file part does not exist
	 */
	public BodyPublisher bodyPublisher() throws FileNotFoundException {
		List<BodyPublisher> segments = new ArrayList<>();
		for (Part part : parts) {
			segments.add(BodyPublishers.ofByteArray(partHeader(part).getBytes(StandardCharsets.UTF_8)));
			if (part.file() != null) {
				segments.add(BodyPublishers.ofFile(part.file()));
			}
			else {
				segments.add(BodyPublishers.ofByteArray(part.value().getBytes(StandardCharsets.UTF_8)));
			}
			segments.add(BodyPublishers.ofByteArray(CRLF.getBytes(StandardCharsets.UTF_8)));
		}
		segments.add(BodyPublishers.ofByteArray(("--" + boundary + "--" + CRLF).getBytes(StandardCharsets.UTF_8)));
		return BodyPublishers.concat(segments.toArray(new BodyPublisher[0]));
	}

	private String partHeader(Part part) {
		StringBuilder header = new StringBuilder();
		header.append("--").append(boundary).append(CRLF);
		header.append("Content-Disposition: form-data; name=\"").append(escape(part.name())).append('"');
		if (part.file() != null) {
			header.append("; filename=\"").append(escape(part.filename())).append('"').append(CRLF);
			header.append("Content-Type: application/octet-stream");
		}
		header.append(CRLF).append(CRLF);
		return header.toString();
	}

	private static String escape(String value) {
		return value.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
	}

	private record Part(String name, String value, Path file, String filename) {
	}

	public static class Builder {

		private final List<Part> parts = new ArrayList<>();

		/**
		 * Add a file part named after the file's base name.
		 * @param name form field name
		 * @param file local file to stream
		 * @return this builder
		 */
		public Builder file(String name, Path file) {
			Objects.requireNonNull(name, "field name must not be null");
			Objects.requireNonNull(file, "file must not be null");
			Path fileName = file.getFileName();
			this.parts.add(new Part(name, null, file, fileName != null ? fileName.toString() : "file"));
			return this;
		}

		public Builder field(String name, String value) {
			Objects.requireNonNull(name, "field name must not be null");
			Objects.requireNonNull(value, () -> "value of form field '" + name + "' must not be null");
			this.parts.add(new Part(name, value, null, null));
			return this;
		}

		public MultipartBody build() {
			return new MultipartBody(this);
		}

	}

}
