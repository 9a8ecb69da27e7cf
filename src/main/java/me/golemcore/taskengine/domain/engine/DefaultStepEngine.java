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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.taskengine.domain.exception.ActionParseException;
import me.golemcore.taskengine.domain.exception.RunFailedException;
import me.golemcore.taskengine.domain.exception.TrajectoryPersistenceException;
import me.golemcore.taskengine.domain.history.HistoryLog;
import me.golemcore.taskengine.domain.history.HistoryWriter;
import me.golemcore.taskengine.domain.model.EngineConstants;
import me.golemcore.taskengine.domain.model.EngineState;
import me.golemcore.taskengine.domain.model.ExecutionConfig;
import me.golemcore.taskengine.domain.model.FailureReason;
import me.golemcore.taskengine.domain.model.ModelOutput;
import me.golemcore.taskengine.domain.model.ParsedAction;
import me.golemcore.taskengine.domain.model.StepOutput;
import me.golemcore.taskengine.domain.model.Task;
import me.golemcore.taskengine.domain.model.TrajectoryStep;
import me.golemcore.taskengine.domain.trajectory.TrajectoryJournal;
import me.golemcore.taskengine.infrastructure.config.EngineProperties;
import me.golemcore.taskengine.port.outbound.ActionParser;
import me.golemcore.taskengine.port.outbound.EnvironmentPort;
import me.golemcore.taskengine.port.outbound.ModelPort;
import me.golemcore.taskengine.security.ActionFilter;
import me.golemcore.taskengine.security.CommandRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Step engine of a single run.
 *
 * <p>
 * A step queries the model with the whole history, parses the reply into a
 * thought and an action, screens the action, executes it under the per-step
 * timeout and records the outcome in the history and the journal. Parse
 * failures, blocked actions, snapshot failures and journal write failures are
 * absorbed into the step. Execution errors and per-step timeouts are counted;
 * reaching the environment's limit of consecutive failures, an expired run
 * deadline, or a model that keeps failing abort the run with
 * {@link RunFailedException}.
 *
 * <p>
 * Instances hold per-run counters and are not shared between runs.
 */
public class DefaultStepEngine implements StepEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultStepEngine.class);

    static final String PARSE_FALLBACK_THOUGHT = "Could not parse the model output; "
            + "using the raw output as the action.";

    private final ModelPort modelPort;
    private final EnvironmentPort environment;
    private final ActionParser actionParser;
    private final ActionFilter actionFilter;
    private final CommandRegistry commandRegistry;
    private final HistoryLog history;
    private final HistoryWriter historyWriter;
    private final TrajectoryJournal journal;
    private final EngineProperties.AgentProperties settings;
    private final ExecutionConfig executionConfig;
    private final Clock clock;
    private final Instant startedAt;
    private final List<String> knownCommands;

    private EngineState state = EngineState.IDLE;
    private int consecutiveFailures;
    private int stepsTaken;
    private int modelCalls;

    public DefaultStepEngine(ModelPort modelPort, EnvironmentPort environment, ActionParser actionParser,
            ActionFilter actionFilter, CommandRegistry commandRegistry, HistoryLog history,
            HistoryWriter historyWriter, TrajectoryJournal journal, EngineProperties.AgentProperties settings) {
        this(modelPort, environment, actionParser, actionFilter, commandRegistry, history, historyWriter, journal,
                settings, Clock.systemUTC());
    }

    // Visible for testing
    public DefaultStepEngine(ModelPort modelPort, EnvironmentPort environment, ActionParser actionParser,
            ActionFilter actionFilter, CommandRegistry commandRegistry, HistoryLog history,
            HistoryWriter historyWriter, TrajectoryJournal journal, EngineProperties.AgentProperties settings,
            Clock clock) {
        this.modelPort = modelPort;
        this.environment = environment;
        this.actionParser = actionParser;
        this.actionFilter = actionFilter;
        this.commandRegistry = commandRegistry;
        this.history = history;
        this.historyWriter = historyWriter;
        this.journal = journal;
        this.settings = settings;
        ExecutionConfig config = environment.getConfig();
        this.executionConfig = config != null ? config : ExecutionConfig.defaults();
        this.clock = clock;
        this.startedAt = clock.instant();
        this.knownCommands = knownCommands(commandRegistry, environment);
    }

    @Override
    public StepOutput step(Task task, Instant runDeadline) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run already finished in state " + state);
        }
        Instant stepStarted = clock.instant();
        int stepIndex = stepsTaken + 1;

        // 1) Model query
        transition(EngineState.AWAITING_MODEL);
        ModelOutput modelOutput = queryModel(runDeadline);

        // 2) Parse
        transition(EngineState.PARSING);
        List<ObjectNode> toolCalls = modelOutput.getToolCalls() != null ? modelOutput.getToolCalls() : List.of();
        StepOutput output = StepOutput.builder()
                .output(modelOutput.getMessage())
                .toolCalls(new ArrayList<>(toolCalls))
                .toolCallIds(toolCallIds(toolCalls))
                .build();
        ObjectNode extraInfo = output.getExtraInfo();
        extraInfo.put("taskId", task.getId());
        extraInfo.put("stepIndex", stepIndex);

        ParsedAction parsed = parse(modelOutput);
        if (parsed != null) {
            output.setThought(parsed.thought() != null ? parsed.thought() : "");
            output.setAction(parsed.action());
        } else {
            output.setThought(PARSE_FALLBACK_THOUGHT);
            output.setAction(modelOutput.getMessage() != null ? modelOutput.getMessage() : "");
            extraInfo.put("parseFailed", true);
        }

        // 3) Screen and execute
        transition(EngineState.EXECUTING);
        String action = actionFilter.guardMultilineInput(output.getAction());
        boolean blocked = actionFilter.shouldBlockAction(action);
        extraInfo.put("blocked", blocked);
        boolean executionFailed = false;
        if (blocked) {
            output.setObservation(actionFilter.blockedMessage(action));
        } else {
            executionFailed = !execute(action, runDeadline, output);
        }

        // 4) Record
        transition(EngineState.RECORDING);
        Optional<String> submission = commandRegistry.extractSubmission(action);
        output.setDone(submission.isPresent());
        output.setSubmission(submission.orElse(null));
        output.setExitStatus(submission.isPresent() ? EngineConstants.EXIT_SUBMITTED
                : EngineConstants.EXIT_INCOMPLETE);
        output.setState(snapshotState());
        output.setExecutionTimeMs(Duration.between(stepStarted, clock.instant()).toMillis());

        historyWriter.appendStep(history, settings.getName(), output);
        journal.append(TrajectoryStep.from(output, history.snapshot()));
        try {
            journal.save();
        } catch (TrajectoryPersistenceException e) {
            log.warn("[StepEngine] Failed to save trajectory: {}", e.getMessage());
        }
        stepsTaken++;

        if (executionFailed && consecutiveFailures >= executionConfig.maxConsecutiveTimeouts()) {
            throw abort(FailureReason.CONSECUTIVE_FAILURES,
                    "Aborting after " + consecutiveFailures + " consecutive execution failures", output, null);
        }

        transition(output.isDone() ? EngineState.DONE : EngineState.IDLE);
        log.debug("[StepEngine] Step {} finished (blocked={}, done={})", stepIndex, blocked, output.isDone());
        return output;
    }

    @Override
    public EngineState getState() {
        return state;
    }

    @Override
    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    @Override
    public int getStepsTaken() {
        return stepsTaken;
    }

    @Override
    public int getModelCalls() {
        return modelCalls;
    }

    /**
     * Aborts the run from outside a step, e.g. when the run deadline passes
     * between steps.
     */
    public RunFailedException abort(FailureReason reason, String message) {
        return abort(reason, message, null, null);
    }

    private ModelOutput queryModel(Instant runDeadline) {
        int maxAttempts = 1 + Math.max(0, settings.getMaxRequeries());
        Throwable lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            CompletableFuture<ModelOutput> future = null;
            modelCalls++;
            try {
                future = modelPort.query(history.snapshot(), runDeadline);
                ModelOutput result = future.get(remainingMillis(runDeadline), TimeUnit.MILLISECONDS);
                return result != null ? result : ModelOutput.ofMessage("");
            } catch (ExecutionException | CancellationException e) {
                lastError = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                log.warn("[StepEngine] Model query failed (attempt {}/{}): {}", attempt, maxAttempts,
                        lastError.getMessage());
            } catch (TimeoutException e) {
                future.cancel(true);
                throw abort(FailureReason.TOTAL_TIMEOUT, "Run deadline expired while waiting for the model", null,
                        e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                throw abort(FailureReason.INTERRUPTED, "Interrupted while waiting for the model", null, e);
            } catch (RuntimeException e) { // NOSONAR
                lastError = e;
                log.warn("[StepEngine] Model query failed (attempt {}/{}): {}", attempt, maxAttempts,
                        e.getMessage());
            }
        }
        throw abort(FailureReason.MODEL_FAILURE, "Model failed after " + maxAttempts + " attempts", null, lastError);
    }

    private boolean execute(String action, Instant runDeadline, StepOutput output) {
        Duration stepTimeout = executionConfig.executionTimeout();
        Instant stepDeadline = clock.instant().plus(stepTimeout);
        boolean boundByRun = !stepDeadline.isBefore(runDeadline);
        if (boundByRun) {
            stepDeadline = runDeadline;
        }

        CompletableFuture<String> future = null;
        try {
            future = environment.execute(action, stepDeadline);
            String observation = future.get(remainingMillis(stepDeadline), TimeUnit.MILLISECONDS);
            output.setObservation(observation != null ? observation : "");
            consecutiveFailures = 0;
            return true;
        } catch (TimeoutException e) {
            future.cancel(true);
            if (boundByRun) {
                throw abort(FailureReason.TOTAL_TIMEOUT, "Run deadline expired while executing an action", output,
                        e);
            }
            consecutiveFailures++;
            log.warn("[StepEngine] Action timed out after {} ms ({} consecutive failures)", stepTimeout.toMillis(),
                    consecutiveFailures);
            output.setObservation("Action timed out after " + stepTimeout.toSeconds() + " seconds.");
            return false;
        } catch (ExecutionException | CancellationException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            return executionFailed(output, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw abort(FailureReason.INTERRUPTED, "Interrupted while executing an action", output, e);
        } catch (RuntimeException e) { // NOSONAR
            return executionFailed(output, e);
        }
    }

    private boolean executionFailed(StepOutput output, Throwable cause) {
        consecutiveFailures++;
        log.warn("[StepEngine] Action failed ({} consecutive failures): {}", consecutiveFailures,
                cause.getMessage());
        output.setObservation("Error executing action: " + cause.getMessage());
        return false;
    }

    /**
     * Returns the parsed action, or null when the parser rejected the output
     * or produced no action.
     */
    private ParsedAction parse(ModelOutput modelOutput) {
        try {
            ParsedAction parsed = actionParser.parse(modelOutput, knownCommands);
            if (parsed == null || parsed.action() == null) {
                log.warn("[StepEngine] Parser returned no action");
                return null;
            }
            return parsed;
        } catch (ActionParseException e) {
            log.warn("[StepEngine] Failed to parse model output: {}", e.getMessage());
            return null;
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[StepEngine] Parser failed: {}", e.getMessage());
            return null;
        }
    }

    private ObjectNode snapshotState() {
        try {
            ObjectNode snapshot = environment.getState();
            return snapshot != null ? snapshot.deepCopy() : JsonNodeFactory.instance.objectNode();
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[StepEngine] Failed to snapshot environment state: {}", e.getMessage());
            return JsonNodeFactory.instance.objectNode();
        }
    }

    private static List<String> knownCommands(CommandRegistry registry, EnvironmentPort environment) {
        Set<String> names = new LinkedHashSet<>(registry.getCommandNames());
        names.add(registry.getSubmitCommand());
        try {
            List<String> provided = environment.listCommands();
            if (provided != null) {
                names.addAll(provided);
            }
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[StepEngine] Failed to list environment commands: {}", e.getMessage());
        }
        return List.copyOf(names);
    }

    private static List<String> toolCallIds(List<ObjectNode> toolCalls) {
        List<String> ids = new ArrayList<>();
        for (ObjectNode call : toolCalls) {
            if (call.hasNonNull("id")) {
                ids.add(call.get("id").asText());
            }
        }
        return ids;
    }

    private long remainingMillis(Instant deadline) {
        return Math.max(0L, Duration.between(clock.instant(), deadline).toMillis());
    }

    private void transition(EngineState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal engine transition " + state + " -> " + next);
        }
        state = next;
    }

    private RunFailedException abort(FailureReason reason, String message, StepOutput lastStep, Throwable cause) {
        if (!state.isTerminal()) {
            state = EngineState.FAILED;
        }
        log.error("[StepEngine] Run aborted ({}): {}", reason, message);
        return new RunFailedException(reason, message, lastStep, consecutiveFailures, stepsTaken,
                Duration.between(startedAt, clock.instant()), cause);
    }
}
