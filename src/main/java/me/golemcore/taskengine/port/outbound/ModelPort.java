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

package me.golemcore.taskengine.port.outbound;

import me.golemcore.taskengine.domain.model.Message;
import me.golemcore.taskengine.domain.model.ModelOutput;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port to the language model.
 *
 * <p>
 * The engine never calls the model without a deadline. When the deadline
 * passes the engine cancels the returned future; implementations should stop
 * the underlying request when that happens.
 */
public interface ModelPort {

    /**
     * Queries the model with the full run history as context.
     *
     * @param history
     *            read-only view of the history log
     * @param deadline
     *            instant after which the answer is no longer awaited
     */
    CompletableFuture<ModelOutput> query(List<Message> history, Instant deadline);
}
