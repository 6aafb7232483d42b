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

import me.questcore.domain.model.QuestTask;
import me.questcore.domain.model.RoutineBundle;
import me.questcore.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Routine bundles: groups of habits that pay a bonus once all of them are done
 * on the same day.
 * <p>
 * Storage layout:
 * <ul>
 * <li>routines/bundles.json - list of all bundles</li>
 * </ul>
 */
@Service
@Slf4j
public class RoutineBundleService {

    private static final String ROUTINES_DIR = "routines";
    private static final String BUNDLES_FILE = "bundles.json";
    private static final TypeReference<List<RoutineBundle>> BUNDLE_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final QuestTaskService taskService;
    private final Clock clock;

    private volatile List<RoutineBundle> bundlesCache;

    public RoutineBundleService(StoragePort storagePort, ObjectMapper objectMapper, QuestTaskService taskService,
            Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.taskService = taskService;
        this.clock = clock;
    }

    public synchronized RoutineBundle createBundle(String ownerId, String name, List<String> habitSeriesIds) {
        Set<String> distinct = new LinkedHashSet<>(habitSeriesIds);
        if (distinct.size() < RoutineBundle.MIN_HABITS || distinct.size() > RoutineBundle.MAX_HABITS) {
            throw new IllegalArgumentException("A routine bundle needs " + RoutineBundle.MIN_HABITS + " to "
                    + RoutineBundle.MAX_HABITS + " distinct habits");
        }
        RoutineBundle bundle = RoutineBundle.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .name(name)
                .habitSeriesIds(new ArrayList<>(distinct))
                .createdAt(clock.instant())
                .build();
        List<RoutineBundle> bundles = getBundles();
        bundles.add(bundle);
        saveBundles(bundles);
        log.info("[Routines] Created bundle '{}' with {} habits", name, distinct.size());
        return bundle;
    }

    public synchronized List<RoutineBundle> getBundles() {
        if (bundlesCache == null) {
            bundlesCache = loadBundles();
        }
        return bundlesCache;
    }

    public synchronized void deactivateBundle(String bundleId) {
        RoutineBundle bundle = getBundles().stream()
                .filter(b -> b.getId().equals(bundleId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Bundle not found: " + bundleId));
        bundle.setActive(false);
        saveBundles(getBundles());
    }

    /**
     * Finds the active bundle that {@code completing} finishes today: the task's
     * series belongs to the bundle and every other habit of the bundle already
     * has an instance completed today.
     */
    public Optional<RoutineBundle> findBundleCompletedBy(QuestTask completing, String characterId) {
        if (!completing.isHabit() || completing.getSeriesId() == null) {
            return Optional.empty();
        }
        LocalDate today = LocalDate.now(clock);
        List<QuestTask> ownerTasks = taskService.getTasksForOwner(characterId);
        return getBundles().stream()
                .filter(RoutineBundle::isActive)
                .filter(b -> Objects.equals(b.getOwnerId(), characterId))
                .filter(b -> b.getHabitSeriesIds().contains(completing.getSeriesId()))
                .filter(b -> b.getHabitSeriesIds().stream()
                        .filter(series -> !series.equals(completing.getSeriesId()))
                        .allMatch(series -> completedToday(ownerTasks, series, today)))
                .findFirst();
    }

    private boolean completedToday(List<QuestTask> tasks, String seriesId, LocalDate today) {
        return tasks.stream()
                .filter(t -> seriesId.equals(t.getSeriesId()))
                .filter(t -> t.getStatus() == QuestTask.TaskStatus.COMPLETED)
                .anyMatch(t -> t.getCompletedAt() != null
                        && LocalDate.ofInstant(t.getCompletedAt(), clock.getZone()).equals(today));
    }

    private void saveBundles(List<RoutineBundle> bundles) {
        String json;
        try {
            json = objectMapper.writeValueAsString(bundles);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize routine bundles", e);
        }
        storagePort.putTextAtomic(ROUTINES_DIR, BUNDLES_FILE, json, true).join();
        bundlesCache = bundles;
    }

    private List<RoutineBundle> loadBundles() {
        try {
            String json = storagePort.getText(ROUTINES_DIR, BUNDLES_FILE).join();
            if (json != null && !json.isBlank()) {
                return new ArrayList<>(objectMapper.readValue(json, BUNDLE_LIST_TYPE_REF));
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - missing store starts empty
            log.debug("[Routines] No bundles found or failed to parse: {}", e.getMessage());
        }
        return new ArrayList<>();
    }
}
