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
package org.springaicommunity.agentrun.poll;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.springaicommunity.agentrun.ClientException;
import org.springaicommunity.agentrun.ResourceStateException;
import org.springaicommunity.agentrun.WaitTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ResourceWaiter}.
 */
class ResourceWaiterTest {

	private static final Set<String> SUCCESS = Set.of("Running", "READY");

	private static final Set<String> FAILURE = Set.of("Failed");

	@Test
	void alreadySatisfiedResourceReturnsWithoutSleeping() {
		ScriptedResource resource = new ScriptedResource("READY");
		WaitOptions<ScriptedResource> options = WaitOptions.<ScriptedResource>builder()
			.interval(Duration.ofSeconds(9999))
			.build();

		long start = System.nanoTime();
		ScriptedResource result = ResourceWaiter.waitUntil(resource, SUCCESS, FAILURE, options);

		assertThat(result.state()).isEqualTo("READY");
		assertThat(resource.refreshes).isEqualTo(1);
		assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
	}

	@Test
	void stuckResourceTimesOutAfterBudget() {
		ScriptedResource resource = new ScriptedResource("Creating");
		WaitOptions<ScriptedResource> options = WaitOptions.<ScriptedResource>builder()
			.timeout(Duration.ofMillis(100))
			.interval(Duration.ofMillis(50))
			.build();

		long start = System.nanoTime();
		assertThatThrownBy(() -> ResourceWaiter.waitUntil(resource, SUCCESS, FAILURE, options))
			.isInstanceOfSatisfying(WaitTimeoutException.class, e -> {
				assertThat(e.getMessage()).startsWith("Timeout waiting for").endsWith("after 0.1 seconds");
				assertThat(e.timeout()).isEqualTo(Duration.ofMillis(100));
			});
		Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

		assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(90)).isLessThan(Duration.ofSeconds(2));
		assertThat(resource.refreshes).isGreaterThanOrEqualTo(2);
	}

	@Test
	void scriptedSequenceResolvesOnSuccessState() {
		ScriptedResource resource = new ScriptedResource("Creating", "Creating", "READY");
		List<String> observed = new ArrayList<>();
		WaitOptions<ScriptedResource> options = WaitOptions.<ScriptedResource>builder()
			.interval(Duration.ofMillis(10))
			.preCheck(r -> observed.add(r.state()))
			.build();

		ResourceWaiter.waitUntil(resource, SUCCESS, FAILURE, options);

		assertThat(resource.state()).isEqualTo("READY");
		assertThat(observed).containsExactly("Creating", "Creating", "READY");
	}

	@Test
	void unknownStateKeepsPollingUntilTimeout() {
		ScriptedResource resource = new ScriptedResource((String) null);
		WaitOptions<ScriptedResource> options = WaitOptions.<ScriptedResource>builder()
			.timeout(Duration.ofMillis(100))
			.interval(Duration.ofMillis(20))
			.build();

		assertThatThrownBy(() -> ResourceWaiter.waitUntil(resource, SUCCESS, FAILURE, options))
			.isInstanceOf(WaitTimeoutException.class);
		assertThat(resource.refreshes).isGreaterThanOrEqualTo(2);
	}

	@Test
	void unknownStateThenSuccessResolves() {
		ScriptedResource resource = new ScriptedResource(null, null, "READY");
		WaitOptions<ScriptedResource> options = WaitOptions.<ScriptedResource>builder()
			.interval(Duration.ofMillis(10))
			.build();

		ResourceWaiter.waitUntil(resource, SUCCESS, FAILURE, options);

		assertThat(resource.refreshes).isEqualTo(3);
	}

	@Test
	void failureStateRaisesWithReason() {
		ScriptedResource resource = new ScriptedResource("Creating", "Failed");
		resource.reason = "image pull failed";
		WaitOptions<ScriptedResource> options = WaitOptions.<ScriptedResource>builder()
			.interval(Duration.ofMillis(10))
			.build();

		assertThatThrownBy(() -> ResourceWaiter.waitUntil(resource, SUCCESS, FAILURE, options))
			.isInstanceOfSatisfying(ResourceStateException.class, e -> {
				assertThat(e.getMessage()).isEqualTo("Scripted failed: image pull failed");
				assertThat(e.state()).isEqualTo("Failed");
			});
	}

	@Test
	void refreshErrorsPropagateWithoutRetry() {
		ScriptedResource resource = new ScriptedResource("Creating") {
			@Override
			public void refresh() {
				refreshes++;
				throw new ClientException(403, "denied");
			}
		};

		assertThatThrownBy(() -> ResourceWaiter.waitUntil(resource, SUCCESS, FAILURE, WaitOptions.defaults()))
			.isInstanceOf(ClientException.class)
			.hasMessage("denied");
		assertThat(resource.refreshes).isEqualTo(1);
	}

	@Test
	void awaitConditionPollsUntilTrue() {
		int[] calls = { 0 };

		ResourceWaiter.awaitCondition("health", Duration.ofSeconds(5), Duration.ofMillis(10), () -> ++calls[0] >= 3);

		assertThat(calls[0]).isEqualTo(3);
	}

	@Test
	void awaitConditionPropagatesConditionErrors() {
		assertThatThrownBy(() -> ResourceWaiter.awaitCondition("deletion", Duration.ofSeconds(5),
				Duration.ofMillis(10), () -> {
					throw new ClientException(400, "bad state");
				}))
			.isInstanceOf(ClientException.class)
			.hasMessage("bad state");
	}

	@Test
	void nonPositiveTimingsAreRejected() {
		assertThatThrownBy(() -> WaitOptions.builder().timeout(Duration.ZERO).build())
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> WaitOptions.builder().interval(Duration.ofSeconds(-1)).build())
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void secondsAreFormattedWithoutTrailingZeros() {
		assertThat(ResourceWaiter.formatSeconds(Duration.ofSeconds(300))).isEqualTo("300");
		assertThat(ResourceWaiter.formatSeconds(Duration.ofMillis(1500))).isEqualTo("1.5");
	}

	static class ScriptedResource implements PollableResource<String> {

		private final List<String> script;

		private int position;

		private String state = "Pending";

		String reason;

		int refreshes;

		ScriptedResource(String... states) {
			this.script = Arrays.asList(states);
		}

		@Override
		public void refresh() {
			refreshes++;
			state = script.get(Math.min(position++, script.size() - 1));
		}

		@Override
		public String state() {
			return state;
		}

		@Override
		public String stateReason() {
			return reason;
		}

		@Override
		public String resourceKind() {
			return "Scripted";
		}

	}

}
