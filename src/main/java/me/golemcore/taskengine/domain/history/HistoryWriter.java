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

package me.golemcore.taskengine.domain.history;

import me.golemcore.taskengine.domain.model.StepOutput;

/**
 * Single point of mutation for a run's {@link HistoryLog}.
 *
 * <p>
 * The step engine never builds history messages itself.
 */
public interface HistoryWriter {

    void appendSystemPrompt(HistoryLog history, String agentName, String content);

    void appendInstancePrompt(HistoryLog history, String agentName, String content);

    /**
     * Appends exactly two messages: the assistant turn carrying thought and action,
     * then the observation returned for it.
     */
    void appendStep(HistoryLog history, String agentName, StepOutput step);
}
