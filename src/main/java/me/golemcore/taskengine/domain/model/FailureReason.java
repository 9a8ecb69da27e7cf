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
 * Why a run was aborted.
 */
public enum FailureReason {

    /** The consecutive execution failure counter reached its maximum. */
    CONSECUTIVE_FAILURES,

    /** The total execution deadline of the run expired. */
    TOTAL_TIMEOUT,

    /** The model kept failing after all re-queries. */
    MODEL_FAILURE,

    /** The run thread was interrupted while waiting on a collaborator. */
    INTERRUPTED
}
