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

import me.questcore.domain.model.CompletionCheck;
import me.questcore.domain.model.QuestTask;
import me.questcore.domain.model.QuestTask.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Task state machine.
 *
 * <pre>
 * PENDING -> IN_PROGRESS -> COMPLETED
 * PENDING | IN_PROGRESS -> EXPIRED   (deadline passed)
 * PENDING | IN_PROGRESS -> FAILED    (habits only, due time passed)
 * </pre>
 *
 * Terminal states are never left; a repeating task continues as a new
 * instance instead.
 */
@Service
@Slf4j
public class TaskLifecycleService {

    private final QuestTaskService taskService;
    private final VerificationEngine verificationEngine;
    private final Clock clock;

    public TaskLifecycleService(QuestTaskService taskService, VerificationEngine verificationEngine, Clock clock) {
        this.taskService = taskService;
        this.verificationEngine = verificationEngine;
        this.clock = clock;
    }

    /**
     * Starts a pending task. Starting a task that is already in progress keeps
     * the original start time.
     */
    public QuestTask startTask(String taskId) {
        QuestTask task = taskService.getTask(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Task not found: " + taskId));
        if (task.isTerminal()) {
            throw new IllegalStateException("Task " + taskId + " is already " + task.getStatus());
        }
        if (task.getStatus() == TaskStatus.IN_PROGRESS && task.getStartedAt() != null) {
            return task;
        }
        task.setStatus(TaskStatus.IN_PROGRESS);
        if (task.getStartedAt() == null) {
            task.setStartedAt(clock.instant());
        }
        taskService.save(task);
        log.info("[Lifecycle] Started '{}'", task.getTitle());
        return task;
    }

    /**
     * Evaluates whether the task may move to COMPLETED now. The minimum-duration
     * gate, then proof, then the deadline; the first failing check gives the
     * reason.
     */
    public CompletionCheck checkCompletion(QuestTask task) {
        if (task.isTerminal()) {
            return CompletionCheck.rejected("This task is already " + task.getStatus().name().toLowerCase() + ".");
        }
        CompletionCheck duration = verificationEngine.checkMinimumDuration(task);
        if (!duration.isAllowed()) {
            return duration;
        }
        CompletionCheck proof = verificationEngine.checkProof(task);
        if (!proof.isAllowed()) {
            return proof;
        }
        return verificationEngine.checkDeadline(task);
    }

    /**
     * Moves the task to COMPLETED. A pending task passes through IN_PROGRESS in
     * the same step. Does not persist.
     */
    void markCompleted(QuestTask task) {
        requireOpen(task);
        Instant now = clock.instant();
        if (task.getStartedAt() == null) {
            task.setStartedAt(now);
        }
        task.setStatus(TaskStatus.COMPLETED);
        task.setCompletedAt(now);
    }

    /**
     * Moves a habit to FAILED and resets its streak. Does not persist.
     */
    void markFailed(QuestTask task) {
        if (!task.isHabit()) {
            throw new IllegalStateException("Only habits can fail: " + task.getId());
        }
        requireOpen(task);
        task.setStatus(TaskStatus.FAILED);
        task.setFailedAt(clock.instant());
        task.setHabitStreak(0);
    }

    /**
     * Expires every open task whose deadline has passed and drops unclaimed duty
     * items from earlier days.
     *
     * @return number of tasks expired
     */
    public int expireOverdueTasks() {
        Instant now = clock.instant();
        LocalDate today = LocalDate.now(clock);
        List<QuestTask> overdue = taskService.getTasks().stream()
                .filter(t -> !t.isTerminal())
                .filter(t -> t.getDueDate() != null && now.isAfter(t.getDueDate()))
                .toList();
        for (QuestTask task : overdue) {
            task.setStatus(TaskStatus.EXPIRED);
            task.setExpiredAt(now);
            log.info("[Lifecycle] Expired '{}'", task.getTitle());
        }
        if (!overdue.isEmpty()) {
            taskService.saveAll();
        }

        List<QuestTask> staleDuties = taskService.getTasks().stream()
                .filter(QuestTask::isDutyBoardItem)
                .filter(t -> t.getDutyDay() != null && t.getDutyDay().isBefore(today))
                .toList();
        int purged = taskService.deleteTasks(staleDuties);
        if (purged > 0) {
            log.info("[Lifecycle] Removed {} unclaimed duties from earlier days", purged);
        }
        return overdue.size();
    }

    private void requireOpen(QuestTask task) {
        if (task.isTerminal()) {
            throw new IllegalStateException("Task " + task.getId() + " is already " + task.getStatus());
        }
    }
}
