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

package me.golemcore.taskengine.domain.trajectory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskengine.domain.exception.TrajectoryFormatException;
import me.golemcore.taskengine.domain.exception.TrajectoryPersistenceException;
import me.golemcore.taskengine.domain.model.EngineConstants;
import me.golemcore.taskengine.domain.model.RunInfo;
import me.golemcore.taskengine.domain.model.TrajectoryDocument;
import me.golemcore.taskengine.domain.model.TrajectoryStep;
import me.golemcore.taskengine.port.outbound.StoragePort;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Ordered record of every step of one run, persisted as a single JSON document
 * under {@code trajectories/<runId>.traj}.
 *
 * <p>
 * Each {@link #save()} rewrites the whole document through an atomic replace,
 * so a reader sees either the previous complete document or the new one. Steps
 * are only ever appended. A journal belongs to a single run and is only touched
 * by that run's thread.
 */
@Slf4j
public class TrajectoryJournal {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String runId;
    private final RunInfo info;
    private final boolean keepBackup;
    private final List<TrajectoryStep> steps = new ArrayList<>();

    public TrajectoryJournal(StoragePort storagePort, ObjectMapper objectMapper, Clock clock, String runId,
            RunInfo info) {
        this(storagePort, objectMapper, clock, runId, info, false);
    }

    /**
     * @param keepBackup
     *            keep the previous version as {@code <runId>.traj.bak} on every
     *            save
     */
    public TrajectoryJournal(StoragePort storagePort, ObjectMapper objectMapper, Clock clock, String runId,
            RunInfo info, boolean keepBackup) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.runId = runId;
        this.info = info;
        this.keepBackup = keepBackup;
    }

    public void append(TrajectoryStep step) {
        steps.add(step);
    }

    public List<TrajectoryStep> getSteps() {
        return Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public RunInfo getInfo() {
        return info;
    }

    public String getRunId() {
        return runId;
    }

    /**
     * Writes the full document, replacing any previous version.
     *
     * @throws TrajectoryPersistenceException
     *             if the document cannot be serialized or written
     */
    public void save() {
        TrajectoryDocument document = TrajectoryDocument.builder()
                .info(info)
                .trajectory(List.copyOf(steps))
                .timestamp(clock.instant())
                .build();
        String fileName = fileName(runId);
        try {
            String json = objectMapper.writeValueAsString(document);
            storagePort.putTextAtomic(EngineConstants.TRAJECTORY_DIR, fileName, json, keepBackup).join();
            log.debug("[Journal] Saved {} steps to {}", steps.size(), fileName);
        } catch (JsonProcessingException e) {
            throw new TrajectoryPersistenceException("Failed to serialize trajectory " + runId, e);
        } catch (CompletionException e) {
            throw new TrajectoryPersistenceException("Failed to write trajectory " + runId,
                    e.getCause() != null ? e.getCause() : e);
        }
    }

    /**
     * Reads a stored trajectory by run id.
     *
     * @throws TrajectoryFormatException
     *             if the document is missing or malformed
     */
    public static TrajectoryDocument load(StoragePort storagePort, ObjectMapper objectMapper, String runId) {
        String fileName = fileName(runId);
        String content;
        try {
            content = storagePort.getText(EngineConstants.TRAJECTORY_DIR, fileName).join();
        } catch (CompletionException e) {
            throw new TrajectoryPersistenceException("Failed to read trajectory " + runId,
                    e.getCause() != null ? e.getCause() : e);
        }
        if (content == null) {
            throw new TrajectoryFormatException("Trajectory not found: " + fileName);
        }
        return parse(objectMapper, content, fileName);
    }

    /**
     * Reads a trajectory file from an arbitrary location.
     */
    public static TrajectoryDocument load(ObjectMapper objectMapper, Path file) {
        try {
            return parse(objectMapper, Files.readString(file, StandardCharsets.UTF_8), file.toString());
        } catch (IOException e) {
            throw new TrajectoryPersistenceException("Failed to read trajectory file " + file, e);
        }
    }

    /**
     * Lists the run ids that have a stored trajectory.
     */
    public static List<String> list(StoragePort storagePort) {
        try {
            return storagePort.listObjects(EngineConstants.TRAJECTORY_DIR, "").join().stream()
                    .filter(name -> name.endsWith(EngineConstants.TRAJECTORY_EXTENSION))
                    .map(name -> name.substring(0, name.length() - EngineConstants.TRAJECTORY_EXTENSION.length()))
                    .toList();
        } catch (CompletionException e) {
            throw new TrajectoryPersistenceException("Failed to list trajectories",
                    e.getCause() != null ? e.getCause() : e);
        }
    }

    static TrajectoryDocument parse(ObjectMapper objectMapper, String content, String source) {
        TrajectoryDocument document;
        try {
            document = objectMapper.readerFor(TrajectoryDocument.class)
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readValue(content);
        } catch (JsonProcessingException e) {
            throw new TrajectoryFormatException("Malformed trajectory " + source + ": " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new TrajectoryFormatException("Empty trajectory " + source);
        }
        if (document.getInfo() == null) {
            throw new TrajectoryFormatException("Trajectory " + source + " has no info section");
        }
        if (document.getTrajectory() == null) {
            throw new TrajectoryFormatException("Trajectory " + source + " has no step list");
        }
        if (document.getTimestamp() == null) {
            throw new TrajectoryFormatException("Trajectory " + source + " has no timestamp");
        }
        return document;
    }

    private static String fileName(String runId) {
        return runId + EngineConstants.TRAJECTORY_EXTENSION;
    }
}
