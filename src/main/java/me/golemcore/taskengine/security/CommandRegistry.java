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

package me.golemcore.taskengine.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskengine.domain.model.Command;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Commands known to a run and the matchers compiled for them.
 *
 * <p>
 * Multi-line commands match {@code name ... end-marker} with a non-greedy body
 * that ends on a line holding only the end marker. Single-line commands match
 * {@code name <rest-of-line>}. The submit command is always compiled in the
 * multi-line form: it ends at its end marker or, when none is configured, at
 * the end of the action.
 *
 * <p>
 * Instances are immutable and built once from configuration; nothing here is
 * shared between registries.
 */
@Slf4j
public class CommandRegistry {

    public static final Command BASH_COMMAND = Command.builder()
            .name("bash")
            .description("Execute a bash command")
            .schema(stringParameterSchema(Map.of("command", "The bash command to execute")))
            .build();

    private final List<Command> commands;
    private final String submitCommand;
    private final String submitEndName;
    private final Map<String, Pattern> patterns;

    public CommandRegistry(List<Command> registered, boolean enableBashTool, String submitCommand,
            String submitEndName) {
        if (submitCommand == null || submitCommand.isBlank()) {
            throw new IllegalArgumentException("Submit command must not be blank");
        }
        this.submitCommand = submitCommand;
        this.submitEndName = submitEndName != null ? submitEndName : "";

        Map<String, Command> byName = new LinkedHashMap<>();
        if (enableBashTool) {
            byName.put(BASH_COMMAND.getName(), BASH_COMMAND);
        }
        for (Command command : registered) {
            if (byName.containsKey(command.getName())) {
                throw new IllegalArgumentException("Command '" + command.getName() + "' is defined multiple times");
            }
            byName.put(command.getName(), command);
        }
        this.commands = List.copyOf(byName.values());
        this.patterns = Collections.unmodifiableMap(compilePatterns());
        log.debug("[Security] Registered commands: {}", byName.keySet());
    }

    public List<Command> getCommands() {
        return commands;
    }

    public List<String> getCommandNames() {
        return commands.stream().map(Command::getName).toList();
    }

    public String getSubmitCommand() {
        return submitCommand;
    }

    public String getSubmitEndName() {
        return submitEndName;
    }

    public Optional<Pattern> getPattern(String commandName) {
        return Optional.ofNullable(patterns.get(commandName));
    }

    /**
     * Returns the first multi-line command (in registration order, submit last)
     * whose matcher accepts the action.
     */
    public Optional<String> findMultilineCommand(String action) {
        if (action == null) {
            return Optional.empty();
        }
        for (Command command : commands) {
            if (command.isMultiline() && patterns.get(command.getName()).matcher(action).find()) {
                return Optional.of(command.getName());
            }
        }
        if (patterns.get(submitCommand).matcher(action).find()) {
            return Optional.of(submitCommand);
        }
        return Optional.empty();
    }

    /**
     * Extracts the submission payload if the action starts with the submit
     * command. The end marker, when configured and present, is not part of the
     * payload.
     */
    public Optional<String> extractSubmission(String action) {
        if (action == null) {
            return Optional.empty();
        }
        String trimmed = action.strip();
        if (!trimmed.startsWith(submitCommand)) {
            return Optional.empty();
        }
        String payload = trimmed.substring(submitCommand.length()).strip();
        if (!submitEndName.isEmpty() && payload.endsWith(submitEndName)) {
            payload = payload.substring(0, payload.length() - submitEndName.length()).strip();
        }
        return Optional.of(payload);
    }

    /**
     * Renders the Markdown command reference used in the instance prompt.
     */
    public String generateCommandDocs() {
        StringBuilder docs = new StringBuilder("# Available Commands\n\n");
        for (Command command : commands) {
            docs.append("## ").append(command.getName()).append("\n\n");
            docs.append(command.getDescription() != null ? command.getDescription() : "").append("\n\n");
            if (command.isMultiline()) {
                docs.append("End the command with a line holding only `").append(command.getEndName())
                        .append("`.\n\n");
            }
            JsonNode properties = command.getSchema() != null ? command.getSchema().get("properties") : null;
            if (properties != null && properties.isObject() && !properties.isEmpty()) {
                docs.append("### Parameters\n\n");
                Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    docs.append("- `").append(field.getKey()).append("`: ")
                            .append(field.getValue().path("description").asText(""));
                    String type = field.getValue().path("type").asText("");
                    if (!type.isEmpty()) {
                        docs.append(" (type: ").append(type).append(")");
                    }
                    docs.append("\n");
                }
                docs.append("\n");
            }
        }
        return docs.toString();
    }

    /**
     * Builds a JSON schema for a command whose parameters are all required
     * strings.
     */
    public static ObjectNode stringParameterSchema(Map<String, String> parameters) {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        ObjectNode schema = factory.objectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        List<String> required = new ArrayList<>();
        parameters.forEach((name, description) -> {
            ObjectNode property = properties.putObject(name);
            property.put("type", "string");
            property.put("description", description);
            required.add(name);
        });
        ArrayNode requiredNode = schema.putArray("required");
        for (String name : required) {
            requiredNode.add(name);
        }
        return schema;
    }

    private Map<String, Pattern> compilePatterns() {
        Map<String, Pattern> compiled = new LinkedHashMap<>();
        for (Command command : commands) {
            if (command.isMultiline()) {
                compiled.put(command.getName(), multilinePattern(command.getName(), command.getEndName()));
            } else {
                compiled.put(command.getName(),
                        Pattern.compile("^\\s*(" + Pattern.quote(command.getName()) + ")\\s*(.*?)$"));
            }
        }
        if (submitEndName.isEmpty()) {
            compiled.put(submitCommand,
                    Pattern.compile("^\\s*(" + Pattern.quote(submitCommand) + ")\\s*(.*?)\\s*\\z", Pattern.DOTALL));
        } else {
            compiled.put(submitCommand, multilinePattern(submitCommand, submitEndName));
        }
        return compiled;
    }

    private static Pattern multilinePattern(String name, String endName) {
        return Pattern.compile("\\A\\s*(" + Pattern.quote(name) + ")\\s*(.*?)^(" + Pattern.quote(endName) + ")\\s*$",
                Pattern.MULTILINE | Pattern.DOTALL);
    }
}
