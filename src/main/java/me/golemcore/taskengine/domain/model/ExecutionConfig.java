/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.taskengine.domain.model;

import java.time.Duration;

/**
 * Execution limits published by the environment.
 *
 * @param executionTimeout
 *            budget for a single action
 * @param totalExecutionTimeout
 *            budget for the whole run
 * @param maxConsecutiveTimeouts
 *            consecutive execution failures that abort the run
 */
public record ExecutionConfig(Duration executionTimeout, Duration totalExecutionTimeout, int maxConsecutiveTimeouts) {

    public static ExecutionConfig defaults() {
        return new ExecutionConfig(Duration.ofSeconds(30), Duration.ofMinutes(30), 3);
    }
}
