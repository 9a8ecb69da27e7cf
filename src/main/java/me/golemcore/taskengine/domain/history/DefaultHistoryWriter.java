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

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.taskengine.domain.model.Message;
import me.golemcore.taskengine.domain.model.StepOutput;

import java.time.Clock;
import java.time.Instant;

/**
 * Default writer. The assistant message renders the action as a fenced
 * {@code tool} block below the thought; the observation is sent back in the
 * user role.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    static final String OBSERVATION_PREFIX = "Observation:\n";

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendSystemPrompt(HistoryLog history, String agentName, String content) {
        history.append(Message.builder()
                .role(Message.ROLE_SYSTEM)
                .content(content)
                .agent(agentName)
                .messageType(Message.TYPE_SYSTEM_PROMPT)
                .extraInfo(timestamped())
                .build());
    }

    @Override
    public void appendInstancePrompt(HistoryLog history, String agentName, String content) {
        history.append(Message.builder()
                .role(Message.ROLE_USER)
                .content(content)
                .agent(agentName)
                .messageType(Message.TYPE_INSTANCE_PROMPT)
                .extraInfo(timestamped())
                .build());
    }

    @Override
    public void appendStep(HistoryLog history, String agentName, StepOutput step) {
        String thought = step.getThought() != null ? step.getThought() : "";
        String action = step.getAction() != null ? step.getAction() : "";

        ObjectNode assistantInfo = timestamped();
        if (step.getToolCallIds() != null && !step.getToolCallIds().isEmpty()) {
            ArrayNode ids = assistantInfo.putArray("toolCallIds");
            for (String id : step.getToolCallIds()) {
                ids.add(id);
            }
        }

        history.append(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(thought + "\n```tool\n" + action + "\n```")
                .agent(agentName)
                .messageType(Message.TYPE_ASSISTANT_RESPONSE)
                .thought(thought)
                .action(action)
                .rawOutput(step.getOutput())
                .extraInfo(assistantInfo)
                .build());

        history.append(Message.builder()
                .role(Message.ROLE_USER)
                .content(OBSERVATION_PREFIX + (step.getObservation() != null ? step.getObservation() : ""))
                .agent(agentName)
                .messageType(Message.TYPE_OBSERVATION)
                .extraInfo(timestamped())
                .build());
    }

    private ObjectNode timestamped() {
        ObjectNode info = JsonNodeFactory.instance.objectNode();
        info.put("timestamp", now().toString());
        return info;
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
