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

import java.util.EnumSet;
import java.util.Set;

/**
 * Phases of the step engine. A step walks IDLE through RECORDING and either
 * returns to IDLE, or ends the run in DONE or FAILED.
 */
public enum EngineState {

    IDLE, AWAITING_MODEL, PARSING, EXECUTING, RECORDING, DONE, FAILED;

    public boolean canTransitionTo(EngineState next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    private Set<EngineState> allowedNext() {
        return switch (this) {
        case IDLE -> EnumSet.of(AWAITING_MODEL, FAILED);
        case AWAITING_MODEL -> EnumSet.of(PARSING, FAILED);
        case PARSING -> EnumSet.of(EXECUTING, FAILED);
        case EXECUTING -> EnumSet.of(RECORDING, FAILED);
        case RECORDING -> EnumSet.of(IDLE, DONE, FAILED);
        case DONE, FAILED -> EnumSet.noneOf(EngineState.class);
        };
    }
}
