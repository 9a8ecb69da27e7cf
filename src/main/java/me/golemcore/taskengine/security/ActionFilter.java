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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskengine.domain.model.ToolFilterConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validates candidate actions before they reach the environment.
 *
 * <p>
 * Rules are evaluated in order, the first match wins and the default is to
 * allow:
 * <ol>
 * <li>Prefix blocklist - interactive programs (editors, pagers, debuggers) are
 * blocked whenever the action starts with them</li>
 * <li>Standalone blocklist - blocked only when the whole action is the bare
 * command, so {@code bash} is blocked but {@code bash -c ls} is not</li>
 * <li>Allow-unless-regex - for the listed command names the action is blocked
 * unless it matches the required pattern</li>
 * </ol>
 *
 * <p>
 * The component is stateless after construction and thread-safe.
 *
 * @see CommandRegistry
 */
@Slf4j
public class ActionFilter {

    private static final String ACTION_PLACEHOLDER = "{{action}}";

    private final ToolFilterConfig config;
    private final CommandRegistry commandRegistry;
    private final Map<String, Pattern> blockUnlessPatterns;

    public ActionFilter(ToolFilterConfig config, CommandRegistry commandRegistry) {
        this.config = config;
        this.commandRegistry = commandRegistry;
        Map<String, Pattern> compiled = new LinkedHashMap<>();
        config.getBlockUnlessRegex().forEach((name, regex) -> compiled.put(name, Pattern.compile(regex)));
        this.blockUnlessPatterns = Collections.unmodifiableMap(compiled);
    }

    /**
     * Check if an action must not be executed.
     */
    public boolean shouldBlockAction(String action) {
        if (action == null) {
            return false;
        }
        String trimmed = action.strip();
        if (trimmed.isEmpty()) {
            return false;
        }

        for (String blockedPrefix : config.getBlocklist()) {
            if (trimmed.startsWith(blockedPrefix)) {
                log.warn("[Security] Blocked action by prefix '{}': {}", blockedPrefix, trimmed);
                return true;
            }
        }

        for (String blockedCommand : config.getBlocklistStandalone()) {
            if (trimmed.equals(blockedCommand)) {
                log.warn("[Security] Blocked standalone command: {}", trimmed);
                return true;
            }
        }

        String name = trimmed.split("\\s+", 2)[0];
        Pattern required = blockUnlessPatterns.get(name);
        if (required != null && !required.matcher(trimmed).find()) {
            log.warn("[Security] Blocked '{}' invocation without required form: {}", name, trimmed);
            return true;
        }

        return false;
    }

    /**
     * Renders the observation reported to the model for a blocked action.
     */
    public String blockedMessage(String action) {
        return config.getBlocklistErrorTemplate().replace(ACTION_PLACEHOLDER, action != null ? action.strip() : "");
    }

    /**
     * Hook for actions that open a registered multi-line form. It reports which
     * form applies and returns the action unchanged; rewriting multi-line input
     * belongs here once an environment needs it.
     */
    public String guardMultilineInput(String action) {
        Optional<String> command = commandRegistry.findMultilineCommand(action);
        command.ifPresent(name -> log.debug("[Security] Action opens multi-line command '{}'", name));
        return action;
    }
}
