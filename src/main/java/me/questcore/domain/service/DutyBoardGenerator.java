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

import me.questcore.domain.model.Bond;
import me.questcore.domain.model.DutyBoard;
import me.questcore.domain.model.DutyClaimResult;
import me.questcore.domain.model.DutyRefreshResult;
import me.questcore.domain.model.DutyTemplate;
import me.questcore.domain.model.PlayerCharacter;
import me.questcore.domain.model.QuestTask;
import me.questcore.domain.model.TaskCategory;
import me.questcore.domain.model.VerificationType;
import me.questcore.infrastructure.config.QuestProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Daily duty board. The set of duties for a character is a pure function of
 * (character id, calendar day, shuffles used that day), so regenerating within
 * the same day gives the same ordered set.
 *
 * <p>
 * Boards and claim counters are day-stamped; nothing resets at midnight
 * eagerly. The first access on a new day drops yesterday's unclaimed items and
 * draws a fresh board.
 */
@Service
@Slf4j
public class DutyBoardGenerator {

    static final long SHUFFLE_PRIME = 7919L;

    private final DutyPoolService poolService;
    private final QuestTaskService taskService;
    private final CharacterService characterService;
    private final BondService bondService;
    private final QuestProperties properties;
    private final Clock clock;

    public DutyBoardGenerator(DutyPoolService poolService, QuestTaskService taskService,
            CharacterService characterService, BondService bondService, QuestProperties properties, Clock clock) {
        this.poolService = poolService;
        this.taskService = taskService;
        this.characterService = characterService;
        this.bondService = bondService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Deterministic template selection: shuffle the categories with a seeded
     * generator, take {@code count} distinct ones and pick one template from
     * each.
     */
    public List<DutyTemplate> todaysTemplates(String characterId, LocalDate day, int shuffleOffset, int count) {
        Random rng = new Random(seed(characterId, day, shuffleOffset));
        Map<TaskCategory, List<DutyTemplate>> grouped = poolService.getTemplates().stream()
                .collect(Collectors.groupingBy(DutyTemplate::getCategory,
                        () -> new EnumMap<>(TaskCategory.class), Collectors.toList()));

        List<TaskCategory> categories = new ArrayList<>(grouped.keySet());
        Collections.shuffle(categories, rng);

        List<DutyTemplate> selected = new ArrayList<>();
        for (TaskCategory category : categories.subList(0, Math.min(count, categories.size()))) {
            List<DutyTemplate> candidates = grouped.get(category);
            selected.add(candidates.get(rng.nextInt(candidates.size())));
        }
        if (selected.size() < count) {
            List<DutyTemplate> remaining = new ArrayList<>(poolService.getTemplates());
            remaining.removeAll(selected);
            Collections.shuffle(remaining, rng);
            selected.addAll(remaining.subList(0, Math.min(count - selected.size(), remaining.size())));
        }
        return selected;
    }

    static long seed(String characterId, LocalDate day, int shuffleOffset) {
        return Objects.hashCode(characterId) * 31L + day.toEpochDay() + shuffleOffset * SHUFFLE_PRIME;
    }

    /**
     * Returns today's unclaimed duties, generating the board on the first access
     * of the day.
     */
    public List<QuestTask> ensureTodaysDuties(String characterId) {
        synchronized (characterService.progressionLock()) {
            PlayerCharacter character = characterService.require(characterId);
            LocalDate today = LocalDate.now(clock);

            List<QuestTask> stale = taskService.getTasksForOwner(characterId).stream()
                    .filter(QuestTask::isDutyBoardItem)
                    .filter(t -> !today.equals(t.getDutyDay()))
                    .toList();
            if (!stale.isEmpty()) {
                taskService.deleteTasks(stale);
                log.info("[DutyBoard] Cleared {} stale duties for {}", stale.size(), characterId);
            }

            boolean generatedToday = taskService.getTasksForOwner(characterId).stream()
                    .anyMatch(t -> t.isDailyDuty() && !t.isBonusDuty() && today.equals(t.getDutyDay()));
            if (!generatedToday) {
                int offset = character.shufflesOn(today);
                int count = properties.getDutyBoard().getDutiesPerDay();
                for (DutyTemplate template : todaysTemplates(characterId, today, offset, count)) {
                    createDuty(characterId, template, today, false);
                }
                log.info("[DutyBoard] Generated {} duties for {} on {}", count, characterId, today);
            }
            return boardItems(characterId, today);
        }
    }

    public DutyBoard getBoard(String characterId) {
        synchronized (characterService.progressionLock()) {
            List<QuestTask> duties = ensureTodaysDuties(characterId);
            PlayerCharacter character = characterService.require(characterId);
            LocalDate today = LocalDate.now(clock);
            QuestProperties.DutyBoardProperties config = properties.getDutyBoard();
            int remaining = Math.max(0, config.getMaxClaimsPerDay() - character.dutyClaimsOn(today));
            return DutyBoard.builder()
                    .characterId(characterId)
                    .day(today)
                    .duties(duties)
                    .locked(remaining == 0)
                    .claimsRemaining(remaining)
                    .maxClaimsPerDay(config.getMaxClaimsPerDay())
                    .freeRefreshAvailable(character.shufflesOn(today) < config.getFreeRefreshesPerDay())
                    .paidRefreshCost(config.getPaidRefreshCost())
                    .bonusDutyUnlocked(today.equals(character.getBonusDutyDay()))
                    .build();
        }
    }

    /**
     * Reseeds today's board. Claimed duties stay; only unclaimed items are
     * replaced. The first refresh of the day is free, later ones cost gold.
     */
    public DutyRefreshResult refreshDutyBoard(String characterId) {
        synchronized (characterService.progressionLock()) {
            ensureTodaysDuties(characterId);
            PlayerCharacter character = characterService.require(characterId);
            LocalDate today = LocalDate.now(clock);
            QuestProperties.DutyBoardProperties config = properties.getDutyBoard();

            List<QuestTask> pending = boardItems(characterId, today).stream()
                    .filter(t -> !t.isBonusDuty())
                    .toList();
            if (pending.isEmpty()) {
                return DutyRefreshResult.denied("No unclaimed duties to shuffle.");
            }

            boolean free = character.shufflesOn(today) < config.getFreeRefreshesPerDay();
            long cost = free ? 0 : config.getPaidRefreshCost();
            if (character.getGold() < cost) {
                return DutyRefreshResult.denied("Not enough gold. A shuffle costs " + cost + " gold.");
            }

            Set<String> claimedTitles = taskService.getTasksForOwner(characterId).stream()
                    .filter(QuestTask::isDailyDuty)
                    .filter(t -> today.equals(t.getDutyDay()) && !t.isDutyBoardItem())
                    .map(QuestTask::getTitle)
                    .collect(Collectors.toSet());

            character.recordShuffle(today);
            character.setGold(character.getGold() - cost);
            characterService.save(character);
            taskService.deleteTasks(pending);

            List<DutyTemplate> fresh = todaysTemplates(characterId, today, character.shufflesOn(today),
                    config.getDutiesPerDay()).stream()
                    .filter(t -> !claimedTitles.contains(t.getTitle()))
                    .limit(pending.size())
                    .toList();
            for (DutyTemplate template : fresh) {
                createDuty(characterId, template, today, false);
            }
            log.info("[DutyBoard] {} shuffled the board ({} gold)", characterId, cost);
            return DutyRefreshResult.refreshed(boardItems(characterId, today), cost);
        }
    }

    /**
     * Moves a duty from the board into the character's active tasks. Rejected
     * without any mutation once the day's claim limit is reached.
     */
    public DutyClaimResult claimDuty(String characterId, String taskId, String bondId, boolean coop) {
        synchronized (characterService.progressionLock()) {
            PlayerCharacter character = characterService.require(characterId);
            LocalDate today = LocalDate.now(clock);
            int maxClaims = properties.getDutyBoard().getMaxClaimsPerDay();

            Optional<QuestTask> found = taskService.getTask(taskId)
                    .filter(t -> characterId.equals(t.getOwnerId()))
                    .filter(QuestTask::isDutyBoardItem)
                    .filter(t -> today.equals(t.getDutyDay()))
                    .filter(t -> t.getStatus() == QuestTask.TaskStatus.PENDING);
            if (found.isEmpty()) {
                return DutyClaimResult.denied("This duty is no longer available.");
            }
            QuestTask task = found.get();
            // the bonus duty sits outside the daily claim allowance
            if (!task.isBonusDuty() && character.dutyClaimsOn(today) >= maxClaims) {
                return DutyClaimResult.denied("Daily duty limit reached. Come back tomorrow!");
            }

            Optional<Bond> bond = bondService.getBond(bondId).filter(b -> b.hasMember(characterId));
            task.setDutyBoardItem(false);
            task.setAssignedTo(characterId);
            task.setStatus(QuestTask.TaskStatus.IN_PROGRESS);
            task.setStartedAt(clock.instant());
            if (coop && bond.isPresent()) {
                task.setCoop(true);
                task.setBondId(bond.get().getId());
            }
            if (!task.isBonusDuty()) {
                character.recordDutyClaim(today);
            }

            taskService.save(task);
            characterService.save(character);
            bond.ifPresent(b -> {
                bondService.gainExp(b, properties.getDutyBoard().getClaimBondExp());
                bondService.save(b);
            });
            log.info("[DutyBoard] {} claimed '{}'{}", characterId, task.getTitle(), task.isCoop() ? " as co-op" : "");
            return DutyClaimResult.claimed(task, Math.max(0, maxClaims - character.dutyClaimsOn(today)));
        }
    }

    /**
     * Adds the bonus duty once the character has completed every duty they were
     * allowed to claim today. Unlocks at most once per day and does not count
     * against the claim limit.
     */
    public Optional<QuestTask> unlockBonusDuty(String characterId) {
        synchronized (characterService.progressionLock()) {
            QuestProperties.DutyBoardProperties config = properties.getDutyBoard();
            if (!config.isBonusDutyEnabled()) {
                return Optional.empty();
            }
            PlayerCharacter character = characterService.require(characterId);
            LocalDate today = LocalDate.now(clock);
            int required = Math.min(config.getDutiesPerDay(), config.getMaxClaimsPerDay());
            if (character.dutiesCompletedOn(today) < required || today.equals(character.getBonusDutyDay())) {
                return Optional.empty();
            }

            Set<TaskCategory> used = taskService.getTasksForOwner(characterId).stream()
                    .filter(t -> t.isDailyDuty() && today.equals(t.getDutyDay()))
                    .filter(t -> t.getStatus() == QuestTask.TaskStatus.COMPLETED)
                    .map(QuestTask::getCategory)
                    .collect(Collectors.toSet());
            List<DutyTemplate> candidates = poolService.getTemplates().stream()
                    .filter(t -> !used.contains(t.getCategory()))
                    .toList();
            if (candidates.isEmpty()) {
                candidates = poolService.getTemplates();
            }
            Random rng = new Random(seed(characterId, today, -1));
            DutyTemplate template = candidates.get(rng.nextInt(candidates.size()));

            character.setBonusDutyDay(today);
            characterService.save(character);
            QuestTask bonus = createDuty(characterId, template, today, true);
            log.info("[DutyBoard] Bonus duty '{}' unlocked for {}", bonus.getTitle(), characterId);
            return Optional.of(bonus);
        }
    }

    private List<QuestTask> boardItems(String characterId, LocalDate day) {
        return taskService.getTasksForOwner(characterId).stream()
                .filter(QuestTask::isDutyBoardItem)
                .filter(t -> day.equals(t.getDutyDay()))
                .toList();
    }

    private QuestTask createDuty(String characterId, DutyTemplate template, LocalDate day, boolean bonus) {
        int exp = bonus ? template.getBaseExp() * 3 / 2 : template.getBaseExp();
        int gold = bonus ? template.getBaseGold() * 3 / 2 : template.getBaseGold();
        return taskService.createTask(QuestTask.builder()
                .ownerId(characterId)
                .title(bonus ? "Bonus: " + template.getTitle() : template.getTitle())
                .description(template.getDescription())
                .category(template.getCategory())
                .verificationType(template.getVerification() != null ? template.getVerification()
                        : VerificationType.NONE)
                .miniGameKind(template.getMiniGame())
                .baseExp(exp)
                .baseGold(gold)
                .dutyBoardItem(true)
                .dailyDuty(true)
                .bonusDuty(bonus)
                .dutyDay(day)
                .build());
    }
}
