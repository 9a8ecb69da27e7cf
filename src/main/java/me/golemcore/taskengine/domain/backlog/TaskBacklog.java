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

package me.golemcore.taskengine.domain.backlog;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskengine.domain.model.Task;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.UUID;

/**
 * Priority-ordered queue of tasks feeding one run.
 *
 * <p>
 * Higher priority values are served first. Tasks of equal priority are ordered
 * by a monotonic sequence number according to the configured {@link TieBreak}.
 * Every operation holds the backlog's single lock, so the host may add tasks
 * from another thread while a run is consuming them. No method blocks waiting
 * for work: an empty backlog simply yields no task.
 */
@Slf4j
public class TaskBacklog {

    private final Object lock = new Object();
    private final Clock clock;
    private final PriorityQueue<Entry> queue;

    private long sequence;
    private Task currentTask;

    public TaskBacklog(Clock clock, TieBreak tieBreak) {
        this.clock = clock;
        Comparator<Entry> byPriority = Comparator.comparingInt((Entry e) -> e.task().getPriority()).reversed();
        Comparator<Entry> bySequence = Comparator.comparingLong(Entry::sequence);
        this.queue = new PriorityQueue<>(byPriority.thenComparing(
                tieBreak == TieBreak.FIFO ? bySequence : bySequence.reversed()));
    }

    /**
     * Adds a task and returns its generated id.
     *
     * @param state
     *            task-specific state, may be null
     * @param parentId
     *            id of the parent task for subtasks, null for root tasks
     */
    public String addTask(String description, int priority, ObjectNode state, String parentId) {
        Task task = Task.builder()
                .id("task-" + UUID.randomUUID())
                .description(description)
                .priority(priority)
                .createdAt(clock.instant())
                .state(state != null ? state.deepCopy() : JsonNodeFactory.instance.objectNode())
                .parentId(parentId)
                .build();

        synchronized (lock) {
            queue.add(new Entry(task, sequence++));
        }
        log.debug("[Backlog] Added task {} (priority={}, parent={})", task.getId(), priority, parentId);
        return task.getId();
    }

    /**
     * Puts a copy of an unfinished task back, keeping its id. It is ordered as
     * if it had just been added.
     *
     * @throws IllegalStateException
     *             if a task with the same id is already queued
     */
    public void requeue(Task task) {
        synchronized (lock) {
            if (findEntry(task.getId()).isPresent()) {
                throw new IllegalStateException("Task already queued: " + task.getId());
            }
            queue.add(new Entry(task.copy(), sequence++));
            if (currentTask != null && currentTask.getId().equals(task.getId())) {
                currentTask = null;
            }
        }
    }

    /**
     * Removes and returns the highest priority task, or empty if there is none.
     */
    public Optional<Task> getNextTask() {
        synchronized (lock) {
            Entry head = queue.poll();
            if (head == null) {
                return Optional.empty();
            }
            currentTask = head.task();
            return Optional.of(head.task());
        }
    }

    /**
     * Marks a task complete and removes it. Applies to queued tasks and to the
     * task last handed out by {@link #getNextTask()}; unknown ids are ignored.
     */
    public void completeTask(String taskId, String result) {
        synchronized (lock) {
            Optional<Entry> queued = findEntry(taskId);
            if (queued.isPresent()) {
                markCompleted(queued.get().task(), result);
                queue.remove(queued.get());
            }
            if (currentTask != null && currentTask.getId().equals(taskId)) {
                markCompleted(currentTask, result);
                currentTask = null;
            }
        }
    }

    public Optional<String> getCurrentTaskId() {
        synchronized (lock) {
            return Optional.ofNullable(currentTask).map(Task::getId);
        }
    }

    public int size() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns copies of the queued tasks in the order they would be served.
     * Changing a returned task does not affect the backlog.
     */
    public List<Task> snapshot() {
        synchronized (lock) {
            List<Entry> entries = new ArrayList<>(queue);
            entries.sort(queue.comparator());
            return entries.stream().map(entry -> entry.task().copy()).toList();
        }
    }

    private Optional<Entry> findEntry(String taskId) {
        Iterator<Entry> iterator = queue.iterator();
        while (iterator.hasNext()) {
            Entry entry = iterator.next();
            if (entry.task().getId().equals(taskId)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    private void markCompleted(Task task, String result) {
        task.setCompleted(true);
        task.setResult(result);
        log.debug("[Backlog] Completed task {}", task.getId());
    }

    private record Entry(Task task, long sequence) {
    }
}
