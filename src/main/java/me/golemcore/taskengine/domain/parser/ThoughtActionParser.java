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

package me.golemcore.taskengine.domain.parser;

import me.golemcore.taskengine.domain.exception.ActionParseException;
import me.golemcore.taskengine.domain.model.ModelOutput;
import me.golemcore.taskengine.domain.model.ParsedAction;
import me.golemcore.taskengine.port.outbound.ActionParser;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses free-text model output of the form "reasoning, then one fenced code
 * block holding the action".
 *
 * <p>
 * Resolution order:
 * <ol>
 * <li>structured {@code action} (and {@code thought}) fields of the output</li>
 * <li>the last fenced block of the message; text before it is the thought</li>
 * <li>a message whose first word is a known command is taken as the action
 * itself</li>
 * </ol>
 */
public class ThoughtActionParser implements ActionParser {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```[^\\n`]*\\n(.*?)\\n?```", Pattern.DOTALL);

    @Override
    public ParsedAction parse(ModelOutput output, List<String> knownCommands) {
        if (output == null) {
            throw new ActionParseException("Model returned no output");
        }
        if (output.hasStructuredAction()) {
            return new ParsedAction(output.getThought() != null ? output.getThought() : "", output.getAction());
        }

        String message = output.getMessage();
        if (message == null || message.isBlank()) {
            throw new ActionParseException("Model output is empty");
        }

        Matcher matcher = FENCED_BLOCK.matcher(message);
        int start = -1;
        String action = null;
        while (matcher.find()) {
            start = matcher.start();
            action = matcher.group(1);
        }
        if (action != null) {
            if (action.isBlank()) {
                throw new ActionParseException("Fenced action block is empty");
            }
            return new ParsedAction(message.substring(0, start).strip(), action.strip());
        }

        String trimmed = message.strip();
        String firstToken = trimmed.split("\\s+", 2)[0];
        if (knownCommands != null && knownCommands.contains(firstToken)) {
            return new ParsedAction("", trimmed);
        }

        throw new ActionParseException("No action found in model output");
    }
}
