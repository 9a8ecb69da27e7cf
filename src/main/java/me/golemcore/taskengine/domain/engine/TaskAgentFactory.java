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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.taskengine.domain.history.HistoryWriter;
import me.golemcore.taskengine.infrastructure.config.EngineProperties;
import me.golemcore.taskengine.port.outbound.ActionParser;
import me.golemcore.taskengine.port.outbound.ModelPort;
import me.golemcore.taskengine.port.outbound.StoragePort;
import me.golemcore.taskengine.security.ActionFilter;
import me.golemcore.taskengine.security.CommandRegistry;

import java.time.Clock;

/**
 * Builds {@link TaskAgent} instances sharing the configured safety layer,
 * storage and serialization. Each agent gets its own backlog, history and
 * journal.
 */
@RequiredArgsConstructor
public class TaskAgentFactory {

    private final ActionParser defaultParser;
    private final CommandRegistry commandRegistry;
    private final ActionFilter actionFilter;
    private final HistoryWriter historyWriter;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final EngineProperties properties;
    private final Clock clock;

    public TaskAgent create(ModelPort modelPort) {
        return create(modelPort, defaultParser);
    }

    public TaskAgent create(ModelPort modelPort, ActionParser parser) {
        if (modelPort == null) {
            throw new IllegalArgumentException("Model port must not be null");
        }
        return new TaskAgent(modelPort, parser != null ? parser : defaultParser, commandRegistry, actionFilter,
                historyWriter, storagePort, objectMapper, properties, clock);
    }
}
