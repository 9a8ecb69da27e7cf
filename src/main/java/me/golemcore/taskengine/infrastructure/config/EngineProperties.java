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

package me.golemcore.taskengine.infrastructure.config;

import lombok.Data;
import me.golemcore.taskengine.domain.backlog.TieBreak;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the task engine, bound from the host's
 * application properties.
 *
 * <p>
 * All settings live under the {@code engine.*} prefix:
 * <ul>
 * <li>{@link AgentProperties} - agent identity, prompts and step budget</li>
 * <li>{@link ToolsProperties} - registered commands and the submit command</li>
 * <li>{@link FilterProperties} - action blocklists</li>
 * <li>{@link BacklogProperties} - task ordering</li>
 * <li>{@link StorageProperties} - where trajectories are written</li>
 * </ul>
 *
 * <p>
 * Execution timeouts are not configured here: they come from the environment
 * of each run.
 */
@ConfigurationProperties(prefix = "engine")
@Data
public class EngineProperties {

    private AgentProperties agent = new AgentProperties();
    private ToolsProperties tools = new ToolsProperties();
    private FilterProperties filter = new FilterProperties();
    private BacklogProperties backlog = new BacklogProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class AgentProperties {
        private String name = "golem";

        /** Upper bound of steps in one run. */
        private int maxSteps = 50;

        /** Additional model queries allowed after a failed one, per step. */
        private int maxRequeries = 3;

        private String systemPrompt = "You are an autonomous software engineer working in a sandboxed"
                + " environment. Think step by step, issue exactly one command per turn and submit"
                + " your result with the submit command when the task is solved.";

        /**
         * Instance prompt template. Supports {{problem_statement}},
         * {{command_docs}} and {{initial_state}}.
         */
        private String instanceTemplate = "Solve the following task:\n{{problem_statement}}\n\n"
                + "{{command_docs}}\nInitial state:\n{{initial_state}}";
    }

    @Data
    public static class ToolsProperties {
        private boolean enableBashTool = true;
        private String submitCommand = "submit";

        /** End marker of the multi-line submit form; empty means end of action. */
        private String submitEndName = "";

        private List<CommandProperties> commands = new ArrayList<>();
    }

    @Data
    public static class CommandProperties {
        private String name;
        private String description = "";
        private String endName;

        /** Parameter name to description; all parameters are strings. */
        private Map<String, String> parameters = new LinkedHashMap<>();
    }

    @Data
    public static class FilterProperties {
        private String blocklistErrorTemplate = "Operation '{{action}}' is not supported by this environment.";

        /** Interactive programs blocked whenever an action starts with them. */
        private List<String> blocklist = new ArrayList<>(List.of(
                "vim", "vi", "emacs", "nano", "nohup", "gdb", "less", "tail -f", "python -m venv", "make"));

        /** Programs blocked only when invoked bare, without arguments. */
        private List<String> blocklistStandalone = new ArrayList<>(List.of(
                "python", "python3", "ipython", "bash", "sh", "/bin/bash", "/bin/sh", "nohup", "vi", "vim",
                "emacs", "nano", "su"));

        /** Command name to the pattern its invocation must match. */
        private Map<String, String> blockUnlessRegex = new LinkedHashMap<>(Map.of(
                "radare2", "\\b(?:radare2)\\b.*\\s+-c\\s+.*",
                "r2", "\\b(?:radare2)\\b.*\\s+-c\\s+.*"));
    }

    @Data
    public static class BacklogProperties {
        /** Order among tasks of equal priority. */
        private TieBreak tieBreak = TieBreak.LIFO;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/taskengine";

        /** Keep the previous trajectory as a {@code .bak} file on every save. */
        private boolean keepBackup = false;
    }
}
