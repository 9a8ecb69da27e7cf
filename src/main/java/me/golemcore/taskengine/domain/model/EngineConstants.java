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

/**
 * Engine-wide constants shared by the step engine and the run driver.
 */
public final class EngineConstants {

    public static final String EXIT_SUBMITTED = "submitted";
    public static final String EXIT_INCOMPLETE = "incomplete";
    public static final String EXIT_STEP_LIMIT = "exit_step_limit";
    public static final String EXIT_NO_TASKS = "exit_no_tasks";
    public static final String EXIT_FAILED_PREFIX = "failed_";

    public static final int ROOT_TASK_PRIORITY = 100;

    public static final String TRAJECTORY_DIR = "trajectories";
    public static final String TRAJECTORY_EXTENSION = ".traj";

    public static final String ENGINE_VERSION = "1.0.0";

    private EngineConstants() {
    }
}
