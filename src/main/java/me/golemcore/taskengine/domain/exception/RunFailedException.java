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

package me.golemcore.taskengine.domain.exception;

import lombok.Getter;
import me.golemcore.taskengine.domain.model.FailureReason;
import me.golemcore.taskengine.domain.model.StepOutput;

import java.time.Duration;

/**
 * Fatal run failure. Carries what is needed to diagnose the run: the last
 * recorded step (may be null), the consecutive failure count, the number of
 * steps taken and the accumulated execution time.
 */
@Getter
public class RunFailedException extends TaskEngineException {

    private final FailureReason reason;
    private final transient StepOutput lastStep;
    private final int consecutiveFailures;
    private final int stepsTaken;
    private final Duration totalExecutionTime;

    public RunFailedException(FailureReason reason, String message, StepOutput lastStep, int consecutiveFailures,
            int stepsTaken, Duration totalExecutionTime) {
        this(reason, message, lastStep, consecutiveFailures, stepsTaken, totalExecutionTime, null);
    }

    public RunFailedException(FailureReason reason, String message, StepOutput lastStep, int consecutiveFailures,
            int stepsTaken, Duration totalExecutionTime, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.lastStep = lastStep;
        this.consecutiveFailures = consecutiveFailures;
        this.stepsTaken = stepsTaken;
        this.totalExecutionTime = totalExecutionTime;
    }
}
