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

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DataRequest}.
 */
class DataRequestTest {

	@Test
	void binaryBodyIsCopiedOnTheWayInAndOut() {
		byte[] payload = "hello".getBytes(StandardCharsets.UTF_8);
		DataRequest request = DataRequest.builder("files").binary(payload).build();

		payload[0] = 'j';
		assertThat(request.binary()).asString(StandardCharsets.UTF_8).isEqualTo("hello");

		request.binary()[0] = 'y';
		assertThat(request.binary()).asString(StandardCharsets.UTF_8).isEqualTo("hello");
	}

	@Test
	void jsonAndBinaryBodiesAreExclusive() {
		assertThatThrownBy(() -> DataRequest.builder("files").json("{}").binary(new byte[] { 1 }).build())
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void multipartFieldValueMustNotBeNull() {
		assertThatThrownBy(() -> MultipartBody.builder().field("path", null))
			.isInstanceOf(NullPointerException.class)
			.hasMessageContaining("'path'");
	}

}
