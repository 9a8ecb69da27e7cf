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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskengine.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.taskengine.domain.engine.TaskAgentFactory;
import me.golemcore.taskengine.domain.history.DefaultHistoryWriter;
import me.golemcore.taskengine.domain.history.HistoryWriter;
import me.golemcore.taskengine.domain.model.Command;
import me.golemcore.taskengine.domain.model.ToolFilterConfig;
import me.golemcore.taskengine.domain.parser.ThoughtActionParser;
import me.golemcore.taskengine.port.outbound.ActionParser;
import me.golemcore.taskengine.port.outbound.StoragePort;
import me.golemcore.taskengine.security.ActionFilter;
import me.golemcore.taskengine.security.CommandRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Spring Boot auto-configuration of the task engine.
 *
 * <p>
 * A host application only supplies a
 * {@link me.golemcore.taskengine.port.outbound.ModelPort} per run and an
 * environment, and builds agents through the {@link TaskAgentFactory} bean.
 * Clock, object mapper, storage and parser beans back off when the host
 * defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(EngineProperties.class)
@Slf4j
public class EngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return defaultObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean(StoragePort.class)
    public LocalStorageAdapter localStorageAdapter(EngineProperties properties) {
        return new LocalStorageAdapter(properties);
    }

    @Bean
    public CommandRegistry commandRegistry(EngineProperties properties) {
        EngineProperties.ToolsProperties tools = properties.getTools();
        List<Command> commands = new ArrayList<>();
        for (EngineProperties.CommandProperties command : tools.getCommands()) {
            commands.add(Command.builder()
                    .name(command.getName())
                    .description(command.getDescription())
                    .endName(command.getEndName())
                    .schema(CommandRegistry.stringParameterSchema(command.getParameters()))
                    .build());
        }
        CommandRegistry registry = new CommandRegistry(commands, tools.isEnableBashTool(), tools.getSubmitCommand(),
                tools.getSubmitEndName());
        log.info("[Engine] Commands: {}", registry.getCommandNames());
        return registry;
    }

    @Bean
    public ActionFilter actionFilter(EngineProperties properties, CommandRegistry commandRegistry) {
        EngineProperties.FilterProperties filter = properties.getFilter();
        ToolFilterConfig config = ToolFilterConfig.builder()
                .blocklistErrorTemplate(filter.getBlocklistErrorTemplate())
                .blocklist(List.copyOf(filter.getBlocklist()))
                .blocklistStandalone(List.copyOf(filter.getBlocklistStandalone()))
                .blockUnlessRegex(filter.getBlockUnlessRegex())
                .build();
        return new ActionFilter(config, commandRegistry);
    }

    @Bean
    public HistoryWriter historyWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionParser actionParser() {
        return new ThoughtActionParser();
    }

    @Bean
    public TaskAgentFactory taskAgentFactory(ActionParser actionParser, CommandRegistry commandRegistry,
            ActionFilter actionFilter, HistoryWriter historyWriter, StoragePort storagePort,
            ObjectMapper objectMapper, EngineProperties properties, Clock clock) {
        return new TaskAgentFactory(actionParser, commandRegistry, actionFilter, historyWriter, storagePort,
                objectMapper, properties, clock);
    }

    /**
     * Mapper used for trajectories: ISO-8601 instants, indented output.
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }
}
