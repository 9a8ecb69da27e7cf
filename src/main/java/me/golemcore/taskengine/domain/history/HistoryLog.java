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

import me.golemcore.taskengine.domain.model.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only conversation history of one run.
 *
 * <p>
 * Messages are copied on the way in and on the way out, so neither the caller
 * of {@link #append(Message)} nor a holder of a {@link #snapshot()} can change
 * what was recorded. Nothing is ever removed or rewritten.
 *
 * <p>
 * A log belongs to a single run and is only touched by that run's thread.
 */
public class HistoryLog {

    private final List<Message> messages = new ArrayList<>();

    public void append(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message must not be null");
        }
        messages.add(message.copy());
    }

    /**
     * Deep copy of the history at this point.
     */
    public List<Message> snapshot() {
        List<Message> copy = new ArrayList<>(messages.size());
        for (Message message : messages) {
            copy.add(message.copy());
        }
        return Collections.unmodifiableList(copy);
    }

    public int size() {
        return messages.size();
    }
}
