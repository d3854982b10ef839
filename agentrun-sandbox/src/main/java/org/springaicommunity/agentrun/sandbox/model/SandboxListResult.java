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
package org.springaicommunity.agentrun.sandbox.model;

import java.util.List;

/**
 * One page of sandboxes.
 *
 * @param sandboxes the sandboxes on this page
 * @param nextToken token for the next page, null on the last page
 * @author Mark Pollack
 * @since 0.1.0
 */
public record SandboxListResult(List<SandboxData> sandboxes, String nextToken) {

	public SandboxListResult {
		sandboxes = sandboxes != null ? List.copyOf(sandboxes) : List.of();
	}

}
