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

import me.questcore.domain.model.HabitPenalty;
import me.questcore.domain.model.QuestTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Daily bookkeeping for habits and recurring tasks: failing habits whose due
 * time passed, and starting a fresh instance of each series after midnight.
 */
@Service
@Slf4j
public class HabitService {

    private final QuestTaskService taskService;
    private final GameEngine gameEngine;
    private final Clock clock;

    public HabitService(QuestTaskService taskService, GameEngine gameEngine, Clock clock) {
        this.taskService = taskService;
        this.gameEngine = gameEngine;
        this.clock = clock;
    }

    /**
     * Fails every open habit instance whose due time has passed. A habit whose
     * failure cannot be committed is logged and the rest are still processed.
     */
    public List<HabitPenalty> processMissedHabits() {
        Instant now = clock.instant();
        List<QuestTask> missed = taskService.getTasks().stream()
                .filter(QuestTask::isHabit)
                .filter(t -> !t.isTerminal())
                .filter(t -> t.getHabitDueTime() != null && t.getCreatedAt() != null)
                .filter(t -> now.isAfter(deadlineOf(t)))
                .toList();
        List<HabitPenalty> penalties = new ArrayList<>();
        for (QuestTask habit : missed) {
            try {
                gameEngine.failHabit(habit).ifPresent(penalties::add);
            } catch (RewardCommitException e) {
                log.error("[Habits] Failed to record missed habit '{}'", habit.getTitle(), e);
            }
        }
        return penalties;
    }

    /**
     * Due instant of a habit instance: the due time on the day it was created,
     * or on the next day when it was created after that time.
     */
    Instant deadlineOf(QuestTask habit) {
        ZoneId zone = clock.getZone();
        LocalDate createdDay = LocalDate.ofInstant(habit.getCreatedAt(), zone);
        Instant deadline = createdDay.atTime(habit.getHabitDueTime()).atZone(zone).toInstant();
        if (!habit.getCreatedAt().isBefore(deadline)) {
            deadline = createdDay.plusDays(1).atTime(habit.getHabitDueTime()).atZone(zone).toInstant();
        }
        return deadline;
    }

    /**
     * Starts today's instance of every habit or recurring series whose latest
     * instance ended on an earlier day. Streaks carry over to the new instance.
     */
    public List<QuestTask> rolloverRepeatingTasks() {
        LocalDate today = LocalDate.now(clock);
        Map<String, List<QuestTask>> bySeries = taskService.getTasks().stream()
                .filter(QuestTask::isRepeating)
                .filter(t -> t.getSeriesId() != null)
                .collect(Collectors.groupingBy(QuestTask::getSeriesId));

        List<QuestTask> created = new ArrayList<>();
        for (List<QuestTask> series : bySeries.values()) {
            Optional<QuestTask> latest = series.stream()
                    .filter(t -> t.getCreatedAt() != null)
                    .max(Comparator.comparing(QuestTask::getCreatedAt));
            if (latest.isEmpty() || !isDueForRenewal(latest.get(), today)) {
                continue;
            }
            created.add(taskService.createTask(nextInstance(latest.get())));
        }
        if (!created.isEmpty()) {
            log.info("[Habits] Started {} new instance(s) for {}", created.size(), today);
        }
        return created;
    }

    private boolean isDueForRenewal(QuestTask latest, LocalDate today) {
        if (!latest.isTerminal()) {
            return false;
        }
        Instant endedAt = firstNonNull(latest.getCompletedAt(), latest.getFailedAt(), latest.getExpiredAt());
        if (endedAt == null || !LocalDate.ofInstant(endedAt, clock.getZone()).isBefore(today)) {
            return false;
        }
        if (latest.isHabit()) {
            return true;
        }
        LocalDate anchor = latest.getSeriesAnchor() != null
                ? latest.getSeriesAnchor()
                : LocalDate.ofInstant(latest.getCreatedAt(), clock.getZone());
        return latest.getRecurrencePattern() != null && latest.getRecurrencePattern().isDueOn(today, anchor);
    }

    private QuestTask nextInstance(QuestTask previous) {
        return QuestTask.builder()
                .ownerId(previous.getOwnerId())
                .assignedTo(previous.getAssignedTo())
                .seriesId(previous.getSeriesId())
                .title(previous.getTitle())
                .description(previous.getDescription())
                .category(previous.getCategory())
                .verificationType(previous.getVerificationType())
                .miniGameKind(previous.getMiniGameKind())
                .baseExp(previous.getBaseExp())
                .baseGold(previous.getBaseGold())
                .minimumDurationSeconds(previous.getMinimumDurationSeconds())
                .geofence(previous.getGeofence())
                .habit(previous.isHabit())
                .habitDueTime(previous.getHabitDueTime())
                .habitStreak(previous.getHabitStreak())
                .habitLongestStreak(previous.getHabitLongestStreak())
                .habitLastCompletedDay(previous.getHabitLastCompletedDay())
                .recurring(previous.isRecurring())
                .recurrencePattern(previous.getRecurrencePattern())
                .seriesAnchor(previous.getSeriesAnchor())
                .sharedWithPartner(previous.isSharedWithPartner())
                .coop(previous.isCoop())
                .bondId(previous.getBondId())
                .build();
    }

    private static Instant firstNonNull(Instant... candidates) {
        for (Instant candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
