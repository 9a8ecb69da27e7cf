package me.golemcore.taskengine.domain.trajectory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.taskengine.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.taskengine.domain.exception.TrajectoryFormatException;
import me.golemcore.taskengine.domain.exception.TrajectoryPersistenceException;
import me.golemcore.taskengine.domain.model.Message;
import me.golemcore.taskengine.domain.model.RunInfo;
import me.golemcore.taskengine.domain.model.TrajectoryDocument;
import me.golemcore.taskengine.domain.model.TrajectoryStep;
import me.golemcore.taskengine.infrastructure.config.EngineConfiguration;
import me.golemcore.taskengine.infrastructure.config.EngineProperties;
import me.golemcore.taskengine.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TrajectoryJournalTest {

    private static final String RUN_ID = "run-1";
    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private Clock clock;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = EngineConfiguration.defaultObjectMapper();
        clock = Clock.fixed(NOW, ZoneId.of("UTC"));
    }

    private TrajectoryJournal newJournal(Clock journalClock) {
        RunInfo info = RunInfo.builder().runId(RUN_ID).engineVersion("1.0.0").build();
        return new TrajectoryJournal(storage, objectMapper, journalClock, RUN_ID, info);
    }

    private TrajectoryStep step(String action, String observation) {
        ObjectNode state = objectMapper.createObjectNode();
        state.put("cwd", "/repo");
        state.putArray("open_files").add("main.py");
        Message assistant = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content("thinking\n```tool\n" + action + "\n```")
                .agent("golem")
                .messageType(Message.TYPE_ASSISTANT_RESPONSE)
                .thought("thinking")
                .action(action)
                .build();
        Message obs = Message.builder()
                .role(Message.ROLE_USER)
                .content("Observation:\n" + observation)
                .agent("golem")
                .messageType(Message.TYPE_OBSERVATION)
                .build();
        ObjectNode extra = objectMapper.createObjectNode();
        extra.put("blocked", false);
        extra.put("stepIndex", 1);
        return TrajectoryStep.builder()
                .action(action)
                .observation(observation)
                .response("thinking\n```\n" + action + "\n```")
                .thought("thinking")
                .executionTimeMs(12)
                .state(state)
                .messages(List.of(assistant, obs))
                .extraInfo(extra)
                .build();
    }

    // ==================== Round trip ====================

    @Test
    void shouldLoadWhatWasSaved() {
        TrajectoryJournal journal = newJournal(clock);
        journal.append(step("ls", "a.txt"));
        journal.append(step("submit done", ""));
        journal.getInfo().setSubmission("done");
        journal.getInfo().setExitStatus("submitted");

        journal.save();
        TrajectoryDocument loaded = TrajectoryJournal.load(storage, objectMapper, RUN_ID);

        assertEquals(journal.getSteps(), loaded.getTrajectory());
        assertEquals(journal.getInfo(), loaded.getInfo());
        assertEquals(NOW, loaded.getTimestamp());
    }

    @Test
    void shouldWriteSameDocumentOnRepeatedSaveExceptTimestamp() throws IOException {
        Clock ticking = mock(Clock.class);
        when(ticking.instant()).thenReturn(NOW, NOW.plusSeconds(5));
        TrajectoryJournal journal = newJournal(ticking);
        journal.append(step("ls", "a.txt"));
        Path file = tempDir.resolve("trajectories").resolve(RUN_ID + ".traj");

        journal.save();
        String first = Files.readString(file, StandardCharsets.UTF_8);
        journal.save();
        String second = Files.readString(file, StandardCharsets.UTF_8);

        assertNotEquals(first, second);
        TrajectoryDocument firstDoc = TrajectoryJournal.parse(objectMapper, first, "first");
        TrajectoryDocument secondDoc = TrajectoryJournal.parse(objectMapper, second, "second");
        assertEquals(firstDoc.getInfo(), secondDoc.getInfo());
        assertEquals(firstDoc.getTrajectory(), secondDoc.getTrajectory());
        assertEquals(NOW.plusSeconds(5), secondDoc.getTimestamp());
    }

    @Test
    void shouldLoadFromExplicitPath() {
        TrajectoryJournal journal = newJournal(clock);
        journal.append(step("pwd", "/repo"));
        journal.save();

        TrajectoryDocument loaded = TrajectoryJournal.load(objectMapper,
                tempDir.resolve("trajectories").resolve(RUN_ID + ".traj"));

        assertEquals(1, loaded.getTrajectory().size());
        assertEquals("pwd", loaded.getTrajectory().get(0).getAction());
    }

    @Test
    void shouldWriteDocumentLayout() throws IOException {
        TrajectoryJournal journal = newJournal(clock);
        journal.append(step("ls", "a.txt"));
        journal.save();

        ObjectNode root = (ObjectNode) objectMapper.readTree(
                tempDir.resolve("trajectories").resolve(RUN_ID + ".traj").toFile());

        assertTrue(root.has("info"));
        assertTrue(root.get("trajectory").isArray());
        assertEquals("2026-02-14T00:00:00Z", root.get("timestamp").asText());
        assertEquals("/repo", root.get("trajectory").get(0).get("state").get("cwd").asText());
    }

    @Test
    void shouldKeepPreviousVersionWhenBackupEnabled() throws IOException {
        TrajectoryJournal journal = new TrajectoryJournal(storage, objectMapper, clock, RUN_ID,
                RunInfo.builder().runId(RUN_ID).build(), true);
        journal.append(step("ls", "a.txt"));
        journal.save();
        journal.append(step("pwd", "/repo"));
        journal.save();

        Path backup = tempDir.resolve("trajectories").resolve(RUN_ID + ".traj.bak");
        TrajectoryDocument previous = TrajectoryJournal.parse(objectMapper,
                Files.readString(backup, StandardCharsets.UTF_8), "backup");
        assertEquals(1, previous.getTrajectory().size());
        assertEquals(2, TrajectoryJournal.load(storage, objectMapper, RUN_ID).getTrajectory().size());
    }

    @Test
    void shouldNotWriteBackupByDefault() {
        TrajectoryJournal journal = newJournal(clock);
        journal.save();
        journal.save();

        assertFalse(Files.exists(tempDir.resolve("trajectories").resolve(RUN_ID + ".traj.bak")));
    }

    // ==================== Malformed input ====================

    @Test
    void shouldRejectTruncatedDocument() throws IOException {
        TrajectoryJournal journal = newJournal(clock);
        journal.append(step("ls", "a.txt"));
        journal.save();
        Path file = tempDir.resolve("trajectories").resolve(RUN_ID + ".traj");
        String content = Files.readString(file, StandardCharsets.UTF_8);
        Files.writeString(file, content.substring(0, content.length() / 2), StandardCharsets.UTF_8);

        TrajectoryFormatException error = assertThrows(TrajectoryFormatException.class,
                () -> TrajectoryJournal.load(storage, objectMapper, RUN_ID));
        assertTrue(error.getMessage().contains(RUN_ID + ".traj"));
    }

    @Test
    void shouldRejectDocumentFollowedByTrailingContent() throws IOException {
        TrajectoryJournal journal = newJournal(clock);
        journal.append(step("ls", "a.txt"));
        journal.save();
        Path file = tempDir.resolve("trajectories").resolve(RUN_ID + ".traj");
        String content = Files.readString(file, StandardCharsets.UTF_8);
        Files.writeString(file, content + "\n{\"info\": {\"runId\": \"half", StandardCharsets.UTF_8);

        TrajectoryFormatException error = assertThrows(TrajectoryFormatException.class,
                () -> TrajectoryJournal.load(objectMapper, file));
        assertTrue(error.getMessage().contains(RUN_ID + ".traj"));
        assertThrows(TrajectoryFormatException.class,
                () -> TrajectoryJournal.parse(objectMapper, content + " garbage", "garbage"));
    }

    @Test
    void shouldRejectDocumentWithoutRequiredSections() {
        String noInfo = "{\"trajectory\": [], \"timestamp\": \"2026-02-14T00:00:00Z\"}";
        String noSteps = "{\"info\": {}, \"timestamp\": \"2026-02-14T00:00:00Z\"}";

        assertThrows(TrajectoryFormatException.class, () -> TrajectoryJournal.parse(objectMapper, noInfo, "no-info"));
        assertThrows(TrajectoryFormatException.class,
                () -> TrajectoryJournal.parse(objectMapper, noSteps, "no-steps"));
        assertThrows(TrajectoryFormatException.class,
                () -> TrajectoryJournal.parse(objectMapper, "{\"info\": {}, \"trajectory\": []}", "no-time"));
        assertThrows(TrajectoryFormatException.class,
                () -> TrajectoryJournal.parse(objectMapper, "", "empty"));
        assertThrows(TrajectoryFormatException.class,
                () -> TrajectoryJournal.parse(objectMapper, "[1, 2]", "array"));
    }

    @Test
    void shouldReportMissingTrajectory() {
        assertThrows(TrajectoryFormatException.class, () -> TrajectoryJournal.load(storage, objectMapper, "nope"));
    }

    @Test
    void shouldNotTouchInMemoryStateWhenLoadFails() throws IOException {
        TrajectoryJournal journal = newJournal(clock);
        journal.append(step("ls", "a.txt"));
        journal.save();
        Files.writeString(tempDir.resolve("trajectories").resolve(RUN_ID + ".traj"), "{broken",
                StandardCharsets.UTF_8);

        assertThrows(TrajectoryFormatException.class, () -> TrajectoryJournal.load(storage, objectMapper, RUN_ID));
        assertEquals(1, journal.getSteps().size());
    }

    // ==================== Listing and failures ====================

    @Test
    void shouldListStoredRuns() {
        newJournal(clock).save();
        RunInfo other = RunInfo.builder().runId("run-2").build();
        new TrajectoryJournal(storage, objectMapper, clock, "run-2", other).save();

        assertEquals(List.of("run-1", "run-2"), TrajectoryJournal.list(storage));
    }

    @Test
    void shouldExposeUnmodifiableSteps() {
        TrajectoryJournal journal = newJournal(clock);
        journal.append(step("ls", "a.txt"));

        assertThrows(UnsupportedOperationException.class, () -> journal.getSteps().add(step("x", "y")));
    }

    @Test
    void shouldWrapStorageFailure() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new UncheckedIOException(new IOException("disk full"))));
        TrajectoryJournal journal = new TrajectoryJournal(failing, objectMapper, clock, RUN_ID,
                RunInfo.builder().runId(RUN_ID).build());

        TrajectoryPersistenceException error = assertThrows(TrajectoryPersistenceException.class, journal::save);
        assertTrue(error.getCause() instanceof UncheckedIOException);
    }
}
