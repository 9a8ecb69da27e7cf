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

package me.golemcore.taskengine.domain.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskengine.domain.backlog.TaskBacklog;
import me.golemcore.taskengine.domain.exception.AgentSetupException;
import me.golemcore.taskengine.domain.exception.RunFailedException;
import me.golemcore.taskengine.domain.exception.TrajectoryPersistenceException;
import me.golemcore.taskengine.domain.history.HistoryLog;
import me.golemcore.taskengine.domain.history.HistoryWriter;
import me.golemcore.taskengine.domain.model.EngineConstants;
import me.golemcore.taskengine.domain.model.ExecutionConfig;
import me.golemcore.taskengine.domain.model.FailureReason;
import me.golemcore.taskengine.domain.model.ProblemStatement;
import me.golemcore.taskengine.domain.model.RunInfo;
import me.golemcore.taskengine.domain.model.RunResult;
import me.golemcore.taskengine.domain.model.StepOutput;
import me.golemcore.taskengine.domain.model.Task;
import me.golemcore.taskengine.domain.trajectory.TrajectoryJournal;
import me.golemcore.taskengine.infrastructure.config.EngineProperties;
import me.golemcore.taskengine.infrastructure.logging.MdcContext;
import me.golemcore.taskengine.port.outbound.ActionParser;
import me.golemcore.taskengine.port.outbound.EnvironmentPort;
import me.golemcore.taskengine.port.outbound.ModelPort;
import me.golemcore.taskengine.port.outbound.StoragePort;
import me.golemcore.taskengine.security.ActionFilter;
import me.golemcore.taskengine.security.CommandRegistry;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one run from setup to submission or failure.
 *
 * <p>
 * Setup writes the system prompt and the instance prompt (problem statement,
 * command reference and initial environment state) to a fresh history and
 * seeds the backlog with the problem statement as the root task. The driver
 * then steps while tasks remain and the step budget lasts: the highest
 * priority task is handed to the step engine, a submitted task is completed,
 * any other task goes back to the backlog. The journal is saved after every
 * step and once more when the run ends, also when it fails.
 *
 * <p>
 * Obtain instances from {@link TaskAgentFactory}. An agent runs once; the host
 * may add tasks to {@link #getBacklog()} from another thread while it runs.
 */
@Slf4j
public class TaskAgent {

    private final ModelPort modelPort;
    private final ActionParser actionParser;
    private final CommandRegistry commandRegistry;
    private final ActionFilter actionFilter;
    private final HistoryWriter historyWriter;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final EngineProperties properties;
    private final Clock clock;
    private final TaskBacklog backlog;
    private final AtomicBoolean started = new AtomicBoolean();

    TaskAgent(ModelPort modelPort, ActionParser actionParser, CommandRegistry commandRegistry,
            ActionFilter actionFilter, HistoryWriter historyWriter, StoragePort storagePort,
            ObjectMapper objectMapper, EngineProperties properties, Clock clock) {
        this.modelPort = modelPort;
        this.actionParser = actionParser;
        this.commandRegistry = commandRegistry;
        this.actionFilter = actionFilter;
        this.historyWriter = historyWriter;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.backlog = new TaskBacklog(clock, properties.getBacklog().getTieBreak());
    }

    public TaskBacklog getBacklog() {
        return backlog;
    }

    /**
     * Runs the agent against an environment until it submits, runs out of tasks
     * or steps, or fails.
     *
     * @throws AgentSetupException
     *             if the environment or the problem statement is missing
     * @throws RunFailedException
     *             if the run is aborted
     */
    public RunResult run(EnvironmentPort environment, ProblemStatement problem) {
        if (environment == null) {
            throw new AgentSetupException("Environment must not be null");
        }
        if (problem == null || problem.text() == null) {
            throw new AgentSetupException("Problem statement must not be null");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Agent has already been run");
        }

        String runId = problem.id() != null && !problem.id().isBlank() ? problem.id()
                : "run-" + UUID.randomUUID();
        MdcContext.setRun(runId);
        try {
            return execute(environment, problem, runId);
        } finally {
            MdcContext.clear();
        }
    }

    private RunResult execute(EnvironmentPort environment, ProblemStatement problem, String runId) {
        EngineProperties.AgentProperties agent = properties.getAgent();
        RunInfo info = RunInfo.builder()
                .runId(runId)
                .engineVersion(EngineConstants.ENGINE_VERSION)
                .build();
        TrajectoryJournal journal = new TrajectoryJournal(storagePort, objectMapper, clock, runId, info,
                properties.getStorage().isKeepBackup());
        HistoryLog history = new HistoryLog();

        historyWriter.appendSystemPrompt(history, agent.getName(), agent.getSystemPrompt());
        historyWriter.appendInstancePrompt(history, agent.getName(), renderInstancePrompt(environment, problem));

        DefaultStepEngine engine = new DefaultStepEngine(modelPort, environment, actionParser, actionFilter,
                commandRegistry, history, historyWriter, journal, agent, clock);
        ExecutionConfig config = environment.getConfig() != null ? environment.getConfig()
                : ExecutionConfig.defaults();
        Instant deadline = clock.instant().plus(config.totalExecutionTimeout());

        String rootTaskId = backlog.addTask(problem.text(), EngineConstants.ROOT_TASK_PRIORITY, null, null);
        log.info("[Agent] Run {} started (root task {}, max {} steps)", runId, rootTaskId, agent.getMaxSteps());

        int steps = 0;
        boolean done = false;
        try {
            while (steps < agent.getMaxSteps()) {
                if (!clock.instant().isBefore(deadline)) {
                    throw engine.abort(FailureReason.TOTAL_TIMEOUT,
                            "Run deadline expired before step " + (steps + 1));
                }
                Optional<Task> next = backlog.getNextTask();
                if (next.isEmpty()) {
                    info.setExitStatus(EngineConstants.EXIT_NO_TASKS);
                    break;
                }
                Task task = next.get();
                MdcContext.setTask(task.getId(), steps + 1);

                StepOutput output = engine.step(task, deadline);
                steps++;
                if (output.isDone()) {
                    backlog.completeTask(task.getId(), output.getSubmission());
                    info.setSubmission(output.getSubmission());
                    info.setExitStatus(EngineConstants.EXIT_SUBMITTED);
                    done = true;
                    break;
                }
                backlog.requeue(task);
            }
            if (info.getExitStatus() == null) {
                info.setExitStatus(EngineConstants.EXIT_STEP_LIMIT);
            }
        } catch (RunFailedException e) {
            info.setExitStatus(EngineConstants.EXIT_FAILED_PREFIX + e.getReason().name().toLowerCase(Locale.ROOT));
            finish(journal, engine);
            throw e;
        } finally {
            MdcContext.clearTask();
        }

        finish(journal, engine);
        log.info("[Agent] Run {} finished after {} steps: {}", runId, steps, info.getExitStatus());
        return new RunResult(info, journal.getSteps(), done, steps);
    }

    private void finish(TrajectoryJournal journal, StepEngine engine) {
        ObjectNode stats = journal.getInfo().getModelStats();
        stats.put("apiCalls", engine.getModelCalls());
        stats.put("steps", engine.getStepsTaken());
        try {
            journal.save();
        } catch (TrajectoryPersistenceException e) {
            log.warn("[Agent] Failed to save final trajectory: {}", e.getMessage());
        }
    }

    private String renderInstancePrompt(EnvironmentPort environment, ProblemStatement problem) {
        return properties.getAgent().getInstanceTemplate()
                .replace("{{problem_statement}}", problem.text())
                .replace("{{command_docs}}", commandRegistry.generateCommandDocs())
                .replace("{{initial_state}}", initialState(environment));
    }

    private String initialState(EnvironmentPort environment) {
        try {
            ObjectNode state = environment.getState();
            return state != null ? objectMapper.writeValueAsString(state) : "{}";
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR
            log.warn("[Agent] Failed to read initial environment state: {}", e.getMessage());
            return "{}";
        }
    }
}
