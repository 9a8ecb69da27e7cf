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

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Raw answer of the model: the message text plus optional structured fields
 * for providers that already split thought and action.
 */
@Value
@Builder
public class ModelOutput {

    String message;
    String thought;
    String action;

    /** Provider-specific tool call records, each expected to carry an "id". */
    @Builder.Default
    List<ObjectNode> toolCalls = List.of();

    public boolean hasStructuredAction() {
        return action != null && !action.isBlank();
    }

    public static ModelOutput ofMessage(String message) {
        return ModelOutput.builder().message(message).build();
    }
}
