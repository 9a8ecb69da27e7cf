package me.golemcore.taskengine.domain.backlog;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.taskengine.domain.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskBacklogTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");

    private Clock clock;
    private TaskBacklog backlog;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneId.of("UTC"));
        backlog = new TaskBacklog(clock, TieBreak.LIFO);
    }

    // ==================== Ordering ====================

    @Test
    void shouldReturnHighestPriorityRegardlessOfInsertionOrder() {
        backlog.addTask("low", 1, null, null);
        String high = backlog.addTask("high", 100, null, null);
        backlog.addTask("mid", 50, null, null);

        Task next = backlog.getNextTask().orElseThrow();

        assertEquals(high, next.getId());
        assertEquals("high", next.getDescription());
    }

    @Test
    void shouldDrainInDescendingPriority() {
        backlog.addTask("b", 5, null, null);
        backlog.addTask("a", 10, null, null);
        backlog.addTask("c", 1, null, null);

        List<String> order = new ArrayList<>();
        Optional<Task> next;
        while ((next = backlog.getNextTask()).isPresent()) {
            order.add(next.get().getDescription());
        }

        assertEquals(List.of("a", "b", "c"), order);
    }

    @Test
    void shouldServeMostRecentFirstOnTiesWithLifo() {
        backlog.addTask("first", 7, null, null);
        backlog.addTask("second", 7, null, null);
        backlog.addTask("third", 7, null, null);

        assertEquals("third", backlog.getNextTask().orElseThrow().getDescription());
        assertEquals("second", backlog.getNextTask().orElseThrow().getDescription());
        assertEquals("first", backlog.getNextTask().orElseThrow().getDescription());
    }

    @Test
    void shouldServeInsertionOrderOnTiesWithFifo() {
        TaskBacklog fifo = new TaskBacklog(clock, TieBreak.FIFO);
        fifo.addTask("first", 7, null, null);
        fifo.addTask("second", 7, null, null);

        assertEquals("first", fifo.getNextTask().orElseThrow().getDescription());
        assertEquals("second", fifo.getNextTask().orElseThrow().getDescription());
    }

    @Test
    void shouldListSnapshotInServingOrder() {
        backlog.addTask("low", 1, null, null);
        backlog.addTask("high", 9, null, null);

        List<Task> snapshot = backlog.snapshot();

        assertEquals(2, snapshot.size());
        assertEquals("high", snapshot.get(0).getDescription());
        assertEquals("low", snapshot.get(1).getDescription());
        assertEquals(2, backlog.size());
    }

    @Test
    void shouldKeepServingOrderWhenSnapshotTasksAreChanged() {
        String low = backlog.addTask("low", 1, null, null);
        String high = backlog.addTask("high", 10, null, null);
        String mid = backlog.addTask("mid", 5, null, null);

        for (Task task : backlog.snapshot()) {
            if (task.getId().equals(low)) {
                task.setPriority(50);
            } else if (task.getId().equals(high)) {
                task.setPriority(-100);
            }
            task.getState().put("touched", true);
        }

        Task first = backlog.getNextTask().orElseThrow();
        assertEquals(high, first.getId());
        assertEquals(10, first.getPriority());
        assertFalse(first.getState().has("touched"));
        assertEquals(mid, backlog.getNextTask().orElseThrow().getId());
        assertEquals(low, backlog.getNextTask().orElseThrow().getId());
    }

    // ==================== Empty backlog ====================

    @Test
    void shouldReturnEmptyWithoutBlockingWhenNoTasks() {
        assertTrue(backlog.isEmpty());
        assertTrue(backlog.getNextTask().isEmpty());
        assertTrue(backlog.getCurrentTaskId().isEmpty());
    }

    // ==================== Task fields ====================

    @Test
    void shouldAssignUniqueIdsAndCopyState() {
        ObjectNode state = JsonNodeFactory.instance.objectNode();
        state.put("file", "main.py");

        String first = backlog.addTask("one", 1, state, null);
        String second = backlog.addTask("two", 1, null, first);
        state.put("file", "changed.py");

        assertNotEquals(first, second);
        assertTrue(first.startsWith("task-"));

        Task child = backlog.getNextTask().orElseThrow();
        assertEquals(first, child.getParentId());
        assertTrue(child.getState().isEmpty());

        Task parent = backlog.getNextTask().orElseThrow();
        assertEquals("main.py", parent.getState().get("file").asText());
        assertEquals(NOW, parent.getCreatedAt());
        assertFalse(parent.isCompleted());
    }

    // ==================== Completion ====================

    @Test
    void shouldRemoveQueuedTaskOnComplete() {
        String id = backlog.addTask("queued", 1, null, null);

        backlog.completeTask(id, "ok");

        assertTrue(backlog.isEmpty());
        assertTrue(backlog.getNextTask().isEmpty());
    }

    @Test
    void shouldCompleteInFlightTaskAndClearCurrent() {
        String id = backlog.addTask("work", 1, null, null);
        Task task = backlog.getNextTask().orElseThrow();
        assertEquals(Optional.of(id), backlog.getCurrentTaskId());

        backlog.completeTask(id, "done");

        assertTrue(task.isCompleted());
        assertEquals("done", task.getResult());
        assertTrue(backlog.getCurrentTaskId().isEmpty());
    }

    @Test
    void shouldIgnoreUnknownIdOnComplete() {
        backlog.addTask("keep", 1, null, null);

        backlog.completeTask("task-missing", "x");

        assertEquals(1, backlog.size());
    }

    // ==================== Requeue ====================

    @Test
    void shouldRequeueTaskKeepingItsId() {
        String id = backlog.addTask("retry", 3, null, null);
        Task task = backlog.getNextTask().orElseThrow();

        backlog.requeue(task);

        assertTrue(backlog.getCurrentTaskId().isEmpty());
        assertEquals(id, backlog.getNextTask().orElseThrow().getId());
    }

    @Test
    void shouldRejectRequeueOfTaskStillQueued() {
        backlog.addTask("dup", 3, null, null);
        Task queued = backlog.snapshot().get(0);

        assertThrows(IllegalStateException.class, () -> backlog.requeue(queued));
    }

    // ==================== Concurrency ====================

    @Test
    void shouldHandOutEachTaskOnceUnderConcurrentAccess() throws Exception {
        int producers = 4;
        int perProducer = 250;
        ExecutorService executor = Executors.newFixedThreadPool(producers * 2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> adds = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                int producer = p;
                adds.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        backlog.addTask("p" + producer + "-" + i, i % 10, null, null);
                    }
                    return null;
                }));
            }
            List<Future<Set<String>>> takes = new ArrayList<>();
            for (int c = 0; c < producers; c++) {
                takes.add(executor.submit(() -> {
                    start.await();
                    Set<String> seen = new HashSet<>();
                    for (int i = 0; i < perProducer; i++) {
                        backlog.getNextTask().ifPresent(task -> seen.add(task.getId()));
                    }
                    return seen;
                }));
            }
            start.countDown();
            for (Future<?> add : adds) {
                add.get(10, TimeUnit.SECONDS);
            }

            Set<String> taken = new HashSet<>();
            int takenCount = 0;
            for (Future<Set<String>> take : takes) {
                Set<String> seen = take.get(10, TimeUnit.SECONDS);
                takenCount += seen.size();
                taken.addAll(seen);
            }

            assertEquals(takenCount, taken.size());
            assertEquals(producers * perProducer, taken.size() + backlog.size());
        } finally {
            executor.shutdownNow();
        }
    }
}
