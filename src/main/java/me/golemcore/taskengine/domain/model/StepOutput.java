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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything produced by one engine step. Short-lived: it is folded into a
 * {@link TrajectoryStep} once the step is recorded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepOutput {

    private String thought;
    private String action;
    private String observation;

    /** Raw model output the thought and action were parsed from. */
    private String output;

    @Builder.Default
    private ObjectNode state = JsonNodeFactory.instance.objectNode();

    private String submission;
    private String exitStatus;
    private boolean done;
    private long executionTimeMs;

    @Builder.Default
    private ObjectNode extraInfo = JsonNodeFactory.instance.objectNode();

    @Builder.Default
    private List<ObjectNode> toolCalls = new ArrayList<>();

    @Builder.Default
    private List<String> toolCallIds = new ArrayList<>();
}
