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

package me.golemcore.taskengine.infrastructure.logging;

import org.slf4j.MDC;

/**
 * MDC keys identifying the run and task a log line belongs to.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String TASK_ID = "taskId";
    public static final String STEP = "step";

    private MdcContext() {
    }

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setTask(String taskId, int step) {
        MDC.put(TASK_ID, taskId);
        MDC.put(STEP, String.valueOf(step));
    }

    public static void clearTask() {
        MDC.remove(TASK_ID);
        MDC.remove(STEP);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        clearTask();
    }
}
