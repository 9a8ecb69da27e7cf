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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Immutable record of one completed step, including the history as it was when
 * the step was recorded.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrajectoryStep {

    String action;
    String observation;
    String response;
    String thought;
    long executionTimeMs;

    @Builder.Default
    ObjectNode state = JsonNodeFactory.instance.objectNode();

    @Builder.Default
    List<Message> messages = List.of();

    @Builder.Default
    ObjectNode extraInfo = JsonNodeFactory.instance.objectNode();

    /**
     * Builds a trajectory step from a step output and a history snapshot. The
     * snapshot must already be a private copy; state and extra info are copied
     * here.
     */
    public static TrajectoryStep from(StepOutput output, List<Message> historySnapshot) {
        return TrajectoryStep.builder()
                .action(output.getAction())
                .observation(output.getObservation())
                .response(output.getOutput())
                .thought(output.getThought())
                .executionTimeMs(output.getExecutionTimeMs())
                .state(output.getState() != null ? output.getState().deepCopy()
                        : JsonNodeFactory.instance.objectNode())
                .messages(List.copyOf(historySnapshot))
                .extraInfo(output.getExtraInfo() != null ? output.getExtraInfo().deepCopy()
                        : JsonNodeFactory.instance.objectNode())
                .build();
    }
}
