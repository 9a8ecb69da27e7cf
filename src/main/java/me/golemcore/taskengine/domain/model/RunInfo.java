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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Run metadata stored in the {@code info} block of the trajectory journal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunInfo {

    private String runId;
    private String submission;
    private String exitStatus;

    @Builder.Default
    private ObjectNode modelStats = JsonNodeFactory.instance.objectNode();

    @Builder.Default
    private Map<String, String> editedFiles = new LinkedHashMap<>();

    private String engineVersion;
}
