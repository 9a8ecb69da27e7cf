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

import java.time.Instant;

/**
 * A sub-goal waiting in the task backlog. Higher priority values are served
 * first.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    private String id;
    private String description;
    private int priority;
    private Instant createdAt;

    @Builder.Default
    private ObjectNode state = JsonNodeFactory.instance.objectNode();

    private String parentId; // null for root tasks
    private boolean completed;
    private String result;

    /**
     * Copy that shares no mutable state with this task.
     */
    public Task copy() {
        return toBuilder()
                .state(state != null ? state.deepCopy() : JsonNodeFactory.instance.objectNode())
                .build();
    }
}
