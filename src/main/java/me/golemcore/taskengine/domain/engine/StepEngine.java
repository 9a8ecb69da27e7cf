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

package me.golemcore.taskengine.domain.engine;

import me.golemcore.taskengine.domain.exception.RunFailedException;
import me.golemcore.taskengine.domain.model.EngineState;
import me.golemcore.taskengine.domain.model.StepOutput;
import me.golemcore.taskengine.domain.model.Task;

import java.time.Instant;

/**
 * One observe, decide, act, record iteration of a run.
 */
public interface StepEngine {

    /**
     * Runs a single step for the given task.
     *
     * @param task
     *            the active task
     * @param runDeadline
     *            total deadline of the run; no call outlives it
     * @return the recorded step
     * @throws RunFailedException
     *             when the run must be aborted
     */
    StepOutput step(Task task, Instant runDeadline);

    EngineState getState();

    int getConsecutiveFailures();

    int getStepsTaken();

    /**
     * Model queries issued so far, re-queries included.
     */
    int getModelCalls();
}
