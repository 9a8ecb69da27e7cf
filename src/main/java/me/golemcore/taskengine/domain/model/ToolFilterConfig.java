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

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Rules used to reject actions before they reach the environment.
 *
 * <p>
 * {@code blocklistErrorTemplate} may contain {@code {{action}}}, replaced with
 * the rejected action.
 */
@Value
@Builder
public class ToolFilterConfig {

    @Builder.Default
    List<String> blocklist = List.of();

    @Builder.Default
    List<String> blocklistStandalone = List.of();

    @Builder.Default
    Map<String, String> blockUnlessRegex = Map.of();

    @Builder.Default
    String blocklistErrorTemplate = "Operation '{{action}}' is not supported by this environment.";
}
