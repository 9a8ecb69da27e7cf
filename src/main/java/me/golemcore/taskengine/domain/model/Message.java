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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single entry of the run history (the model's context window). Supports the
 * roles system, user and assistant. Assistant entries carry the parsed thought
 * and action together with the raw model output they came from.
 *
 * <p>
 * Messages are immutable. The only mutable part is the {@code extraInfo}
 * document, which is why {@link #copy()} deep-copies it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public static final String TYPE_SYSTEM_PROMPT = "system_prompt";
    public static final String TYPE_INSTANCE_PROMPT = "instance_prompt";
    public static final String TYPE_ASSISTANT_RESPONSE = "assistant_response";
    public static final String TYPE_OBSERVATION = "observation";

    String role;
    String content;
    String agent;
    String messageType;
    String thought;
    String action;
    String rawOutput;

    @Builder.Default
    ObjectNode extraInfo = JsonNodeFactory.instance.objectNode();

    @JsonIgnore
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    @JsonIgnore
    public boolean isObservation() {
        return TYPE_OBSERVATION.equals(messageType);
    }

    /**
     * Returns an independent copy of this message.
     */
    public Message copy() {
        return toBuilder()
                .extraInfo(extraInfo != null ? extraInfo.deepCopy() : JsonNodeFactory.instance.objectNode())
                .build();
    }
}
