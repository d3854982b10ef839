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
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Timing for a wait on a resource state.
 *
 * @param <T> the resource type passed to the pre-check hook
 * @author Mark Pollack
 * @since 0.1.0
 */
public final class WaitOptions<T> {

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);

	public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);

	private final Duration timeout;

	private final Duration interval;

	private final Consumer<? super T> preCheck;

	private WaitOptions(Builder<T> builder) {
		this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
		this.interval = builder.interval != null ? builder.interval : DEFAULT_INTERVAL;
		this.preCheck = builder.preCheck;
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("Wait timeout must be positive: " + timeout);
		}
		if (interval.isNegative() || interval.isZero()) {
			throw new IllegalArgumentException("Poll interval must be positive: " + interval);
		}
	}

	public static <T> WaitOptions<T> defaults() {
		return new Builder<T>().build();
	}

	public static <T> Builder<T> builder() {
		return new Builder<>();
	}

	public Duration timeout() {
		return timeout;
	}

	public Duration interval() {
		return interval;
	}

	/**
	 * Gets the hook invoked with the refreshed resource before it is classified.
	 * @return the hook, or null
	 */
	public Consumer<? super T> preCheck() {
		return preCheck;
	}

	public static class Builder<T> {

		private Duration timeout;

		private Duration interval;

		private Consumer<? super T> preCheck;

		public Builder<T> timeout(Duration timeout) {
			this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
			return this;
		}

		public Builder<T> interval(Duration interval) {
			this.interval = Objects.requireNonNull(interval, "interval cannot be null");
			return this;
		}

		public Builder<T> preCheck(Consumer<? super T> preCheck) {
			this.preCheck = preCheck;
			return this;
		}

		public WaitOptions<T> build() {
			return new WaitOptions<>(this);
		}

	}

}
