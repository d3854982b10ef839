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

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import org.awaitility.Awaitility;
import org.awaitility.core.ConditionTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.agentrun.ResourceStateException;
import org.springaicommunity.agentrun.WaitTimeoutException;

/**
 * Waits for resources to reach a terminal state by polling with Awaitility.
 *
 * <p>
 * The first check runs immediately, so a resource that is already done returns without
 * sleeping. Polling happens on the calling thread. Exceptions raised while refreshing
 * propagate unchanged; there is no retry of a failed refresh.
 * </p>
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
public final class ResourceWaiter {

	private static final Logger logger = LoggerFactory.getLogger(ResourceWaiter.class);

	private ResourceWaiter() {
	}

	/**
	 * Refreshes {@code resource} until its state is in {@code successStates}.
	 * @param resource the resource to poll
	 * @param successStates states that end the wait successfully
	 * @param failureStates states that end the wait with a {@link ResourceStateException}
	 * @param options timeout, interval and pre-check hook
	 * @param <S> the state type
	 * @param <R> the resource type
	 * @return the refreshed resource
	 * @throws ResourceStateException if a failure state is reached
	 * @throws WaitTimeoutException if no terminal state is reached within the timeout
	 */
	public static <S, R extends PollableResource<S>> R waitUntil(R resource, Set<S> successStates,
			Set<S> failureStates, WaitOptions<? super R> options) {
		String description = resource.resourceKind() + " to reach " + successStates;
		AtomicReference<RuntimeException> failure = new AtomicReference<>();
		await(description, options.timeout(), options.interval(), () -> {
			try {
				resource.refresh();
				if (options.preCheck() != null) {
					options.preCheck().accept(resource);
				}
			}
			catch (RuntimeException e) {
				failure.set(e);
				return true;
			}
			S state = resource.state();
			logger.debug("{} state: {}", resource.resourceKind(), state);
			// absent or unrecognised state is still pending
			if (state == null) {
				return false;
			}
			if (successStates.contains(state)) {
				return true;
			}
			if (failureStates.contains(state)) {
				failure.set(new ResourceStateException(resource.resourceKind(), String.valueOf(state),
						resource.stateReason()));
				return true;
			}
			return false;
		});
		if (failure.get() != null) {
			throw failure.get();
		}
		return resource;
	}

	/**
	 * Polls a condition until it holds. An exception thrown by the condition ends the wait
	 * and propagates to the caller.
	 * @param description what is being waited for, used in the timeout message
	 * @param timeout the wait budget
	 * @param interval the poll interval
	 * @param condition the condition
	 * @throws WaitTimeoutException if the condition does not hold within the timeout
	 */
	public static void awaitCondition(String description, Duration timeout, Duration interval,
			BooleanSupplier condition) {
		AtomicReference<RuntimeException> failure = new AtomicReference<>();
		await(description, timeout, interval, () -> {
			try {
				return condition.getAsBoolean();
			}
			catch (RuntimeException e) {
				failure.set(e);
				return true;
			}
		});
		if (failure.get() != null) {
			throw failure.get();
		}
	}

	private static void await(String description, Duration timeout, Duration interval, BooleanSupplier condition) {
		try {
			Awaitility.await(description)
				.atMost(timeout)
				.pollDelay(Duration.ZERO)
				.pollInterval(interval)
				.pollInSameThread()
				.until(condition::getAsBoolean);
		}
		catch (ConditionTimeoutException e) {
			throw new WaitTimeoutException(
					"Timeout waiting for " + description + " after " + formatSeconds(timeout) + " seconds", timeout, e);
		}
	}

	static String formatSeconds(Duration duration) {
		return BigDecimal.valueOf(duration.toMillis()).movePointLeft(3).stripTrailingZeros().toPlainString();
	}

}
