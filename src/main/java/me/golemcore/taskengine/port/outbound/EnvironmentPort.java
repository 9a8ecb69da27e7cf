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

package me.golemcore.taskengine.port.outbound;

import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.taskengine.domain.model.ExecutionConfig;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port to the sandbox that executes actions. One instance is the
 * handle of one environment.
 *
 * <p>
 * Execution is at-least-once: when the engine cancels a pending future,
 * side effects that already started are not rolled back. Implementations own
 * the processes they start and must honor cancellation promptly.
 */
public interface EnvironmentPort {

    /**
     * Executes an action. The future completes with the observation text or
     * exceptionally when the action failed.
     */
    CompletableFuture<String> execute(String action, Instant deadline);

    /**
     * Returns a snapshot of the environment state. May throw; callers treat
     * failures as an empty snapshot.
     */
    ObjectNode getState();

    /**
     * Returns the command names available in this environment, in order.
     */
    List<String> listCommands();

    ExecutionConfig getConfig();
}
