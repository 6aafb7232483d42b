package me.questcore.domain.service;

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

import me.questcore.domain.model.CompletionMode;
import me.questcore.domain.model.QuestTask;
import me.questcore.domain.model.VerificationType;
import me.questcore.infrastructure.config.QuestProperties;
import me.questcore.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Task store. All tasks live in one JSON document, cached in memory after the
 * first read.
 * <p>
 * Storage layout:
 * <ul>
 * <li>tasks/tasks.json - list of all tasks</li>
 * </ul>
 * Write failures propagate to the caller so a completion commit can roll
 * back.
 */
@Service
@Slf4j
public class QuestTaskService {

    private static final String TASKS_DIR = "tasks";
    private static final String TASKS_FILE = "tasks.json";
    private static final TypeReference<List<QuestTask>> TASK_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final QuestProperties properties;
    private final Clock clock;

    private volatile List<QuestTask> tasksCache;

    public QuestTaskService(StoragePort storagePort, ObjectMapper objectMapper, QuestProperties properties,
            Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Stores a new task. Fills in identity, timestamps and default rewards, and
     * fixes the completion mode once.
     */
    public synchronized QuestTask createTask(QuestTask task) {
        if (task.getTitle() == null || task.getTitle().isBlank()) {
            throw new IllegalArgumentException("Task title is required");
        }
        if (task.getId() == null) {
            task.setId(UUID.randomUUID().toString());
        }
        if (task.getSeriesId() == null && task.isRepeating()) {
            task.setSeriesId(task.getId());
        }
        if (task.getCreatedAt() == null) {
            task.setCreatedAt(clock.instant());
        }
        if (task.isRecurring() && task.getSeriesAnchor() == null) {
            task.setSeriesAnchor(LocalDate.ofInstant(task.getCreatedAt(), clock.getZone()));
        }
        if (task.getVerificationType() == null) {
            task.setVerificationType(VerificationType.NONE);
        }
        if (task.getStatus() == null) {
            task.setStatus(QuestTask.TaskStatus.PENDING);
        }
        QuestProperties.RewardProperties rewards = properties.getRewards();
        if (task.getBaseExp() <= 0) {
            task.setBaseExp(rewards.getDefaultBaseExp());
        }
        if (task.getBaseGold() <= 0) {
            task.setBaseGold(rewards.getDefaultBaseGold());
        }
        task.setCompletionMode(resolveCompletionMode(task));

        List<QuestTask> tasks = new ArrayList<>(cachedTasks());
        tasks.add(task);
        saveTasks(tasks);
        log.info("[Tasks] Created task '{}' ({})", task.getTitle(), task.getId());
        return task;
    }

    /**
     * Current snapshot of all tasks. Writers publish a new list instead of
     * changing the published one, so callers may iterate it while other threads
     * create or delete tasks.
     */
    public List<QuestTask> getTasks() {
        return Collections.unmodifiableList(cachedTasks());
    }

    private List<QuestTask> cachedTasks() {
        List<QuestTask> tasks = tasksCache;
        if (tasks != null) {
            return tasks;
        }
        synchronized (this) {
            if (tasksCache == null) {
                tasksCache = loadTasks();
            }
            return tasksCache;
        }
    }

    public Optional<QuestTask> getTask(String taskId) {
        return getTasks().stream()
                .filter(t -> t.getId().equals(taskId))
                .findFirst();
    }

    public List<QuestTask> getTasksForOwner(String ownerId) {
        return getTasks().stream()
                .filter(t -> Objects.equals(ownerId, t.getOwnerId()) || Objects.equals(ownerId, t.getAssignedTo()))
                .toList();
    }

    /**
     * Completions credited to a character at or after {@code since}.
     */
    public List<QuestTask> getCompletedSince(String characterId, Instant since) {
        return getTasksForOwner(characterId).stream()
                .filter(t -> t.getStatus() == QuestTask.TaskStatus.COMPLETED)
                .filter(t -> t.getCompletedAt() != null && !t.getCompletedAt().isBefore(since))
                .toList();
    }

    /**
     * Persists the current state of a task that is already in the store, or adds
     * it when it is not.
     */
    public synchronized void save(QuestTask task) {
        List<QuestTask> tasks = new ArrayList<>(cachedTasks());
        boolean known = tasks.stream().anyMatch(t -> t == task || t.getId().equals(task.getId()));
        if (!known) {
            tasks.add(task);
        }
        saveTasks(tasks);
    }

    public synchronized void saveAll() {
        saveTasks(new ArrayList<>(cachedTasks()));
    }

    public synchronized boolean deleteTask(String taskId) {
        List<QuestTask> tasks = new ArrayList<>(cachedTasks());
        boolean removed = tasks.removeIf(t -> t.getId().equals(taskId));
        if (removed) {
            saveTasks(tasks);
            log.info("[Tasks] Deleted task {}", taskId);
        }
        return removed;
    }

    public synchronized int deleteTasks(List<QuestTask> toDelete) {
        if (toDelete.isEmpty()) {
            return 0;
        }
        List<QuestTask> tasks = new ArrayList<>(cachedTasks());
        int before = tasks.size();
        tasks.removeIf(toDelete::contains);
        saveTasks(tasks);
        return before - tasks.size();
    }

    private CompletionMode resolveCompletionMode(QuestTask task) {
        if (task.isHabit()) {
            return CompletionMode.HABIT;
        }
        if (task.getMiniGameKind() != null) {
            return CompletionMode.MINI_GAME;
        }
        return CompletionMode.STANDARD;
    }

    private void saveTasks(List<QuestTask> tasks) {
        String json;
        try {
            json = objectMapper.writeValueAsString(tasks);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tasks", e);
        }
        storagePort.putTextAtomic(TASKS_DIR, TASKS_FILE, json, true).join();
        tasksCache = tasks;
    }

    private List<QuestTask> loadTasks() {
        try {
            String json = storagePort.getText(TASKS_DIR, TASKS_FILE).join();
            if (json != null && !json.isBlank()) {
                return new ArrayList<>(objectMapper.readValue(json, TASK_LIST_TYPE_REF));
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - missing or unreadable store starts empty
            log.debug("[Tasks] No tasks found or failed to parse: {}", e.getMessage());
        }
        return new ArrayList<>();
    }
}
