package me.questcore.scheduler;

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
import me.questcore.domain.service.ConfirmationService;
import me.questcore.domain.service.HabitService;
import me.questcore.domain.service.TaskLifecycleService;
import me.questcore.infrastructure.config.QuestProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background sweep that keeps time-driven state current.
 *
 * <p>
 * Each tick, in order:
 * <ul>
 * <li>expires open tasks whose deadline passed</li>
 * <li>fails habits whose due time passed, applying the penalty</li>
 * <li>starts today's instance of finished habit and recurring series</li>
 * <li>discards confirmation tokens past their lifetime</li>
 * </ul>
 *
 * <p>
 * A step that throws is logged and the remaining steps still run. If a tick is
 * still running when the next one fires, the new one is skipped.
 */
@Component
@Slf4j
public class MaintenanceScheduler {

    private final TaskLifecycleService lifecycleService;
    private final HabitService habitService;
    private final ConfirmationService confirmationService;
    private final QuestProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public MaintenanceScheduler(TaskLifecycleService lifecycleService, HabitService habitService,
            ConfirmationService confirmationService, QuestProperties properties) {
        this.lifecycleService = lifecycleService;
        this.habitService = habitService;
        this.confirmationService = confirmationService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        QuestProperties.SchedulerProperties config = properties.getScheduler();
        if (!config.isEnabled()) {
            log.info("[Scheduler] Maintenance sweep disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "quest-maintenance");
            t.setDaemon(true);
            return t;
        });
        int interval = Math.max(1, config.getTickIntervalSeconds());
        tickTask = scheduler.scheduleAtFixedRate(this::tick, interval, interval, TimeUnit.SECONDS);
        log.info("[Scheduler] Started with tick interval: {}s", interval);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Scheduler] Shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Scheduler] Tick skipped: previous execution still in progress");
            return;
        }
        try {
            runStep("expiry sweep", () -> {
                int expired = lifecycleService.expireOverdueTasks();
                if (expired > 0) {
                    log.info("[Scheduler] Expired {} task(s)", expired);
                }
            });
            runStep("habit deadlines", () -> {
                List<HabitPenalty> penalties = habitService.processMissedHabits();
                if (!penalties.isEmpty()) {
                    log.info("[Scheduler] Applied {} habit penalt(ies)", penalties.size());
                }
            });
            runStep("rollover", () -> {
                List<QuestTask> renewed = habitService.rolloverRepeatingTasks();
                log.debug("[Scheduler] Renewed {} series", renewed.size());
            });
            runStep("confirmation purge", confirmationService::purgeExpired);
        } finally {
            executing.set(false);
        }
    }

    private void runStep(String name, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            log.error("[Scheduler] {} failed", name, e);
        }
    }
}
