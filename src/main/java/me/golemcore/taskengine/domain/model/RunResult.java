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

import java.util.List;

/**
 * Outcome of a run that did not fail.
 *
 * @param info
 *            run metadata, including submission and exit status
 * @param trajectory
 *            recorded steps in order
 * @param done
 *            whether the agent submitted
 * @param steps
 *            number of steps taken
 */
public record RunResult(RunInfo info, List<TrajectoryStep> trajectory, boolean done, int steps) {

    public String submission() {
        return info.getSubmission();
    }

    public String exitStatus() {
        return info.getExitStatus();
    }
}
