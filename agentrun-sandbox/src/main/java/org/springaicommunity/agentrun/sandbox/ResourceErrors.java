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
package org.springaicommunity.agentrun.sandbox;

import java.util.function.Supplier;

import org.springaicommunity.agentrun.HttpException;

/**
 * Reclassifies HTTP failures of resource operations into resource errors.
 *
 * @author Mark Pollack
 * @since 0.1.0
 */
final class ResourceErrors {

	static final String SANDBOX = "Sandbox";

	static final String TEMPLATE = "Template";

	private ResourceErrors() {
	}

	static <T> T call(String resourceType, String resourceId, Supplier<T> operation) {
		try {
			return operation.get();
		}
		catch (HttpException e) {
			throw e.toResourceError(resourceType, resourceId);
		}
	}

}
