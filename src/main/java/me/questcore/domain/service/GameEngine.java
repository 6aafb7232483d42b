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

import me.questcore.domain.model.AnomalyAssessment;
import me.questcore.domain.model.Bond;
import me.questcore.domain.model.CompletionCheck;
import me.questcore.domain.model.CompletionOutcome;
import me.questcore.domain.model.HabitPenalty;
import me.questcore.domain.model.LevelUpResult;
import me.questcore.domain.model.LootDrop;
import me.questcore.domain.model.MiniGameOutcome;
import me.questcore.domain.model.PartnerCompletionEvent;
import me.questcore.domain.model.PendingConfirmation;
import me.questcore.domain.model.PlayerCharacter;
import me.questcore.domain.model.QuestNotification;
import me.questcore.domain.model.QuestTask;
import me.questcore.domain.model.RewardBreakdown;
import me.questcore.domain.model.RewardDelta;
import me.questcore.domain.model.RoutineBundle;
import me.questcore.domain.model.StatGain;
import me.questcore.domain.model.TaskCategory;
import me.questcore.domain.model.TaskCompletionResult;
import me.questcore.domain.model.VerificationResult;
import me.questcore.domain.service.RewardCompositionEngine.RewardContext;
import me.questcore.infrastructure.config.QuestProperties;
import me.questcore.port.outbound.ActivityConfirmationPort;
import me.questcore.port.outbound.NotificationPort;
import me.questcore.port.outbound.PartnerNotificationPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies rewards and penalties to characters. Every mutating entry point runs
 * under this engine's monitor, including confirmation deltas that arrive on
 * background threads.
 *
 * <p>
 * A completion is committed as a unit: the task, character and bond are
 * snapshotted before mutation and restored if any write fails, so a call
 * either applies all of its changes or none.
 */
@Service
@Slf4j
public class GameEngine {

    private final QuestTaskService taskService;
    private final CharacterService characterService;
    private final BondService bondService;
    private final TaskLifecycleService lifecycleService;
    private final VerificationEngine verificationEngine;
    private final RewardCompositionEngine compositionEngine;
    private final RoutineBundleService routineBundleService;
    private final AnomalyDetector anomalyDetector;
    private final LootService lootService;
    private final InventoryService inventoryService;
    private final ConfirmationService confirmationService;
    private final DutyBoardGenerator dutyBoardGenerator;
    private final NotificationPort notificationPort;
    private final PartnerNotificationPort partnerNotificationPort;
    private final ActivityConfirmationPort activityConfirmationPort;
    private final ObjectMapper objectMapper;
    private final QuestProperties properties;
    private final Clock clock;

    @SuppressWarnings("java:S107") // orchestrator over every engine collaborator
    public GameEngine(QuestTaskService taskService, CharacterService characterService, BondService bondService,
            TaskLifecycleService lifecycleService, VerificationEngine verificationEngine,
            RewardCompositionEngine compositionEngine, RoutineBundleService routineBundleService,
            AnomalyDetector anomalyDetector, LootService lootService, InventoryService inventoryService,
            ConfirmationService confirmationService, DutyBoardGenerator dutyBoardGenerator,
            NotificationPort notificationPort, PartnerNotificationPort partnerNotificationPort,
            ActivityConfirmationPort activityConfirmationPort, ObjectMapper objectMapper,
            QuestProperties properties, Clock clock) {
        this.taskService = taskService;
        this.characterService = characterService;
        this.bondService = bondService;
        this.lifecycleService = lifecycleService;
        this.verificationEngine = verificationEngine;
        this.compositionEngine = compositionEngine;
        this.routineBundleService = routineBundleService;
        this.anomalyDetector = anomalyDetector;
        this.lootService = lootService;
        this.inventoryService = inventoryService;
        this.confirmationService = confirmationService;
        this.dutyBoardGenerator = dutyBoardGenerator;
        this.notificationPort = notificationPort;
        this.partnerNotificationPort = partnerNotificationPort;
        this.activityConfirmationPort = activityConfirmationPort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== Completion ====================

    /**
     * Looks up the task, character and bond by id and completes the task.
     *
     * @throws IllegalArgumentException
     *             if the task does not exist
     */
    public CompletionOutcome completeTask(String taskId, String characterId, String bondId,
            MiniGameOutcome miniGameOutcome) {
        QuestTask task = taskService.getTask(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Task not found: " + taskId));
        PlayerCharacter character = characterService.getCharacter(characterId).orElse(null);
        String effectiveBondId = bondId != null ? bondId : task.getBondId();
        Bond bond = bondService.getBond(effectiveBondId).orElse(null);
        return completeTask(task, character, bond, miniGameOutcome);
    }

    /**
     * Completes a task for a character and applies the full reward.
     *
     * <p>
     * Rejections (duration gate, missing or stale proof, passed deadline, task
     * already terminal) leave every record untouched. A missing character, a
     * character that neither owns nor is assigned the task, a bond the character
     * is not a member of, or a co-op task without a bond, is a no-op reported as
     * skipped.
     *
     * @throws RewardCommitException
     *             if persisting the result failed; nothing was applied
     */
    public CompletionOutcome completeTask(QuestTask task, PlayerCharacter character, Bond bond,
            MiniGameOutcome miniGameOutcome) {
        synchronized (characterService.progressionLock()) {
            if (character == null) {
                log.debug("[GameEngine] No character for '{}', skipping", task.getTitle());
                return CompletionOutcome.skipped("No character");
            }
            if (!isCreditedTo(task, character.getId())) {
                log.warn("[GameEngine] {} tried to complete '{}' owned by {}", character.getId(), task.getTitle(),
                        task.getAssignedTo() != null ? task.getAssignedTo() : task.getOwnerId());
                return CompletionOutcome.skipped("Task belongs to another character");
            }
            if (bond != null && !bond.hasMember(character.getId())) {
                log.warn("[GameEngine] {} is not a member of bond {}", character.getId(), bond.getId());
                return CompletionOutcome.skipped("Character is not a member of the bond");
            }
            if (task.isCoop() && bond == null) {
                log.debug("[GameEngine] Co-op task '{}' has no bond, skipping", task.getTitle());
                return CompletionOutcome.skipped("Co-op task without a bond");
            }
            CompletionCheck check = lifecycleService.checkCompletion(task);
            if (!check.isAllowed()) {
                log.info("[GameEngine] Completion of '{}' rejected: {}", task.getTitle(), check.getReason());
                return CompletionOutcome.rejected(check.getReason());
            }

            VerificationResult geofence = task.getVerificationType() != null
                    && task.getVerificationType().requiresLocation()
                            ? verificationEngine.verifyGeofence(task)
                            : null;
            AnomalyAssessment anomaly = anomalyDetector.assess(character.getId());
            Optional<RoutineBundle> bundle = routineBundleService.findBundleCompletedBy(task, character.getId());
            boolean coopClosing = task.isCoop() && task.isPartnerCompleted() && !task.isCoopBonusAwarded();

            RewardBreakdown reward = compositionEngine.compose(new RewardContext(task, character, geofence, anomaly,
                    bundle.map(b -> b.getHabitSeriesIds().size()).orElse(0), coopClosing, miniGameOutcome));
            Optional<LootDrop> loot = lootService.roll(reward.getVerificationTier(), task.getId());

            boolean levelUpBefore = RewardCurve.isLevelUpAvailable(character.getCurrentExp(), character.getLevel());
            double progressBefore = RewardCurve.progress(character.getCurrentExp(), character.getLevel());

            Snapshot snapshot = snapshot(task, character, bond);
            try {
                applyReward(task, character, bond, reward, coopClosing);
                taskService.save(task);
                characterService.save(character);
                if (coopClosing) {
                    bondService.save(bond);
                }
                loot.ifPresent(drop -> inventoryService.addLoot(character.getId(), drop));
            } catch (RuntimeException e) {
                rollback(snapshot, task, character, bond);
                throw new RewardCommitException("Failed to commit completion of task " + task.getId(), e);
            }

            boolean levelUpAvailable = RewardCurve.isLevelUpAvailable(character.getCurrentExp(), character.getLevel());
            log.info("[GameEngine] '{}' completed by {}: +{} EXP, +{} gold{}", task.getTitle(), character.getId(),
                    reward.totalExp(), reward.totalGold(), levelUpAvailable ? " (level up available)" : "");

            List<String> tokens = issueConfirmations(task, character, reward);
            afterCompletion(task, character, bundle, levelUpAvailable && !levelUpBefore, reward);

            return CompletionOutcome.completed(TaskCompletionResult.builder()
                    .taskId(task.getId())
                    .characterId(character.getId())
                    .expGained(reward.totalExp())
                    .goldGained(reward.totalGold())
                    .expProgressBefore(progressBefore)
                    .expProgressAfter(RewardCurve.progress(character.getCurrentExp(), character.getLevel()))
                    .levelUpAvailable(levelUpAvailable)
                    .bonusStatGains(reward.getStatGains())
                    .verificationTier(reward.getVerificationTier())
                    .verificationMultiplier(reward.getVerificationMultiplier())
                    .geofenceInRange(reward.isGeofenceInRange())
                    .motionDetected(task.isMotionDetected())
                    .classAffinityBonusExp(reward.getClassAffinityBonusExp())
                    .routineBundleCompleted(bundle.isPresent())
                    .routineBundleName(bundle.map(RoutineBundle::getName).orElse(null))
                    .routineBonusExp(reward.getRoutineBonusExp())
                    .miniGameBonusExp(reward.getMiniGameBonusExp())
                    .loot(loot.orElse(null))
                    .coopTask(task.isCoop())
                    .coopPartnerCompleted(task.isPartnerCompleted())
                    .coopBonusExp(reward.getCoopBonusExp())
                    .coopBonusGold(reward.getCoopBonusGold())
                    .coopBondExp(reward.getCoopBondExp())
                    .anomalyFlags(reward.getAnomalyFlags())
                    .pendingConfirmations(tokens)
                    .build());
        }
    }

    private static boolean isCreditedTo(QuestTask task, String characterId) {
        if (task.getOwnerId() == null && task.getAssignedTo() == null) {
            return true;
        }
        return characterId.equals(task.getOwnerId()) || characterId.equals(task.getAssignedTo());
    }

    private void applyReward(QuestTask task, PlayerCharacter character, Bond bond, RewardBreakdown reward,
            boolean coopClosing) {
        LocalDate today = LocalDate.now(clock);
        character.setCurrentExp(character.getCurrentExp() + reward.totalExp());
        character.setGold(character.getGold() + reward.totalGold());
        for (StatGain gain : reward.getStatGains()) {
            character.addStat(gain.stat(), gain.amount());
        }
        character.recordCompletion(today);
        character.setCurrentStreak(Streaks.advance(character.getLastActiveDay(), character.getCurrentStreak(), today));
        character.setLongestStreak(Math.max(character.getLongestStreak(), character.getCurrentStreak()));
        character.setLastActiveDay(today);
        if (task.isDailyDuty()) {
            character.recordDutyCompletion(today);
        }

        lifecycleService.markCompleted(task);
        if (task.isHabit()) {
            task.setHabitStreak(Streaks.advance(task.getHabitLastCompletedDay(), task.getHabitStreak(), today));
            task.setHabitLongestStreak(Math.max(task.getHabitLongestStreak(), task.getHabitStreak()));
            task.setHabitLastCompletedDay(today);
        }

        if (coopClosing) {
            task.setCoopBonusAwarded(true);
            bondService.gainExp(bond, reward.getCoopBondExp());
            bond.setCoopCompletions(bond.getCoopCompletions() + 1);
        }
    }

    private List<String> issueConfirmations(QuestTask task, PlayerCharacter character, RewardBreakdown reward) {
        List<String> tokens = new ArrayList<>();
        try {
            if (task.getCategory() == TaskCategory.PHYSICAL && activityConfirmationPort.isAvailable()) {
                PendingConfirmation pending = confirmationService.register(task, character.getId(),
                        PendingConfirmation.Kind.ACTIVITY, reward.getBaseExp(), reward.getBaseGold());
                tokens.add(pending.getToken());
                requestActivityConfirmation(task, pending.getToken());
            }
            if (task.isFromPartner()) {
                PendingConfirmation pending = confirmationService.register(task, character.getId(),
                        PendingConfirmation.Kind.PARTNER, reward.getBaseExp(), reward.getBaseGold());
                tokens.add(pending.getToken());
            }
        } catch (RuntimeException e) {
            log.error("[GameEngine] Failed to issue confirmation for '{}'", task.getTitle(), e);
        }
        return tokens;
    }

    private void requestActivityConfirmation(QuestTask task, String token) {
        activityConfirmationPort.confirmActivity(task)
                .thenAccept(answer -> applyConfirmation(token, answer.verified()))
                .exceptionally(e -> {
                    log.warn("[GameEngine] Activity confirmation for '{}' failed: {}", task.getTitle(),
                            e.getMessage());
                    return null;
                });
    }

    private void afterCompletion(QuestTask task, PlayerCharacter character, Optional<RoutineBundle> bundle,
            boolean levelUpNewlyAvailable, RewardBreakdown reward) {
        notifySafely(new QuestNotification(QuestNotification.Type.TASK_COMPLETED, character.getId(),
                task.getTitle(), "+" + reward.totalExp() + " EXP, +" + reward.totalGold() + " Gold"));
        bundle.ifPresent(b -> notifySafely(new QuestNotification(QuestNotification.Type.ROUTINE_COMPLETED,
                character.getId(), b.getName(), "+" + reward.getRoutineBonusExp() + " bonus EXP")));
        if (levelUpNewlyAvailable) {
            notifySafely(new QuestNotification(QuestNotification.Type.LEVEL_UP_AVAILABLE, character.getId(),
                    "Level up!", "Level " + (character.getLevel() + 1) + " is ready"));
        }
        if (task.isSharedWithPartner() || task.isFromPartner() || task.isCoop()) {
            dispatchToPartner(new PartnerCompletionEvent(task.getId(), character.getId(), task.getBondId(),
                    task.getTitle(), task.isCoop()));
        }
        if (task.isDailyDuty()) {
            try {
                dutyBoardGenerator.unlockBonusDuty(character.getId());
            } catch (RuntimeException e) {
                log.warn("[GameEngine] Bonus duty check failed for {}: {}", character.getId(), e.getMessage());
            }
        }
    }

    // ==================== Co-op ====================

    /**
     * Records that the partner finished their mirrored instance of a co-op task.
     * If this side is already completed and the pair has not paid out yet, the
     * co-op EXP and gold bonus is granted now, once. Bond EXP was or will be
     * granted by whichever local completion closes the pair.
     */
    public RewardDelta recordPartnerCompletion(String taskId) {
        synchronized (characterService.progressionLock()) {
            QuestTask task = taskService.getTask(taskId)
                    .orElseThrow(() -> new IllegalArgumentException("Task not found: " + taskId));
            if (!task.isCoop()) {
                return RewardDelta.ignored(taskId, "Not a co-op task");
            }
            if (task.getStatus() != QuestTask.TaskStatus.COMPLETED || task.isCoopBonusAwarded()) {
                if (!task.isPartnerCompleted()) {
                    task.setPartnerCompleted(true);
                    taskService.save(task);
                }
                return RewardDelta.ignored(taskId, task.isCoopBonusAwarded()
                        ? "Co-op bonus already granted"
                        : "Waiting for this side to complete");
            }

            String characterId = task.getAssignedTo() != null ? task.getAssignedTo() : task.getOwnerId();
            PlayerCharacter character = characterService.getCharacter(characterId).orElse(null);
            if (character == null) {
                return RewardDelta.ignored(taskId, "No character");
            }
            QuestProperties.RewardProperties config = properties.getRewards();
            int exp = RewardCurve.applyRate(RewardCurve.scaledExp(task.getBaseExp(), character.getLevel()),
                    config.getCoopRate());
            int gold = RewardCurve.applyRate(RewardCurve.scaledGold(task.getBaseGold(), character.getLevel()),
                    config.getCoopRate());

            Snapshot snapshot = snapshot(task, character, null);
            try {
                task.setPartnerCompleted(true);
                task.setCoopBonusAwarded(true);
                character.setCurrentExp(character.getCurrentExp() + exp);
                character.setGold(character.getGold() + gold);
                taskService.save(task);
                characterService.save(character);
            } catch (RuntimeException e) {
                rollback(snapshot, task, character, null);
                throw new RewardCommitException("Failed to commit co-op bonus for task " + taskId, e);
            }
            log.info("[GameEngine] Co-op pair closed for '{}': +{} EXP, +{} gold", task.getTitle(), exp, gold);
            return RewardDelta.applied(taskId, exp, gold);
        }
    }

    // ==================== Confirmations ====================

    /**
     * Second phase of a two-phase completion. Applies the additive bonus of a
     * confirmed token exactly once; unknown, resolved, expired or disputed tokens
     * change nothing, and a token whose task is no longer completed is
     * discarded.
     */
    public RewardDelta applyConfirmation(String token, boolean confirmed) {
        synchronized (characterService.progressionLock()) {
            Optional<PendingConfirmation> found = confirmationService.getConfirmation(token);
            if (found.isEmpty()) {
                return RewardDelta.ignored(token, "Unknown confirmation");
            }
            PendingConfirmation pending = found.get();
            if (pending.getState() != PendingConfirmation.State.PENDING) {
                return RewardDelta.ignored(token, "Confirmation already resolved");
            }
            Optional<QuestTask> task = taskService.getTask(pending.getTaskId());
            String discardReason = null;
            if (confirmationService.isExpired(pending)) {
                discardReason = "Confirmation expired";
            } else if (task.isEmpty() || task.get().getStatus() != QuestTask.TaskStatus.COMPLETED) {
                discardReason = "Task is no longer completed";
            } else if (!confirmed) {
                discardReason = "Not confirmed";
            }
            Optional<PlayerCharacter> character = characterService.getCharacter(pending.getCharacterId());
            if (discardReason == null && character.isEmpty()) {
                discardReason = "No character";
            }
            if (discardReason != null) {
                confirmationService.markResolved(pending, PendingConfirmation.State.DISCARDED);
                log.warn("[Confirmations] Discarded {}: {}", token, discardReason);
                return RewardDelta.ignored(token, discardReason);
            }

            QuestProperties.RewardProperties config = properties.getRewards();
            double rate = pending.getKind() == PendingConfirmation.Kind.ACTIVITY
                    ? config.getActivityConfirmationRate()
                    : config.getPartnerConfirmationRate();
            int exp = RewardCurve.applyRate(pending.getBaseExp(), rate);
            int gold = pending.getKind() == PendingConfirmation.Kind.PARTNER
                    ? RewardCurve.applyRate(pending.getBaseGold(), rate)
                    : 0;

            PlayerCharacter target = character.get();
            Snapshot snapshot = snapshot(null, target, null);
            try {
                confirmationService.markResolved(pending, PendingConfirmation.State.APPLIED);
                target.setCurrentExp(target.getCurrentExp() + exp);
                target.setGold(target.getGold() + gold);
                characterService.save(target);
            } catch (RuntimeException e) {
                rollback(snapshot, null, target, null);
                try {
                    confirmationService.reopen(pending);
                } catch (RuntimeException reopenFailure) {
                    e.addSuppressed(reopenFailure);
                }
                throw new RewardCommitException("Failed to apply confirmation " + token, e);
            }
            log.info("[Confirmations] Applied {} bonus for '{}': +{} EXP, +{} gold", pending.getKind(),
                    task.get().getTitle(), exp, gold);
            notifySafely(new QuestNotification(QuestNotification.Type.CONFIRMATION_APPLIED, target.getId(),
                    task.get().getTitle(), "+" + exp + " EXP confirmed"));
            return RewardDelta.applied(token, exp, gold);
        }
    }

    // ==================== Habits ====================

    /**
     * Fails a habit whose due time passed and takes back the reward it would have
     * earned, floored at zero. No bonus terms apply. Pending confirmations for the
     * instance are discarded. An instance that already ended, for example one
     * completed after the caller picked it up, is left alone.
     */
    public Optional<HabitPenalty> failHabit(QuestTask task) {
        synchronized (characterService.progressionLock()) {
            if (task.isTerminal()) {
                log.debug("[Habits] '{}' already {}, nothing to fail", task.getTitle(), task.getStatus());
                return Optional.empty();
            }
            String characterId = task.getAssignedTo() != null ? task.getAssignedTo() : task.getOwnerId();
            PlayerCharacter character = characterService.getCharacter(characterId).orElse(null);

            long expLost = 0;
            long goldLost = 0;
            Snapshot snapshot = snapshot(task, character, null);
            try {
                lifecycleService.markFailed(task);
                if (character != null) {
                    expLost = Math.min(character.getCurrentExp(),
                            RewardCurve.scaledExp(task.getBaseExp(), character.getLevel()));
                    goldLost = Math.min(character.getGold(),
                            RewardCurve.scaledGold(task.getBaseGold(), character.getLevel()));
                    character.setCurrentExp(character.getCurrentExp() - expLost);
                    character.setGold(character.getGold() - goldLost);
                }
                taskService.save(task);
                if (character != null) {
                    characterService.save(character);
                }
            } catch (RuntimeException e) {
                rollback(snapshot, task, character, null);
                throw new RewardCommitException("Failed to commit habit failure for task " + task.getId(), e);
            }
            confirmationService.discardForTask(task.getId());
            log.info("[Habits] '{}' missed: -{} EXP, -{} gold", task.getTitle(), expLost, goldLost);
            notifySafely(new QuestNotification(QuestNotification.Type.HABIT_MISSED, characterId,
                    "Habit Missed", task.getTitle() + ": -" + expLost + " EXP, -" + goldLost + " Gold"));
            return Optional.of(new HabitPenalty(task.getId(), characterId, expLost, goldLost));
        }
    }

    // ==================== Level up ====================

    /**
     * Applies one queued level-up: +1 level, +1 stat point and a gold bonus of
     * ten per new level.
     */
    public LevelUpResult levelUp(String characterId) {
        synchronized (characterService.progressionLock()) {
            PlayerCharacter character = characterService.require(characterId);
            if (!RewardCurve.isLevelUpAvailable(character.getCurrentExp(), character.getLevel())) {
                return LevelUpResult.notAvailable(character.getLevel(), character.getUnspentStatPoints());
            }
            int newLevel = character.getLevel() + 1;
            int goldBonus = newLevel * properties.getRewards().getLevelUpGoldPerLevel();

            Snapshot snapshot = snapshot(null, character, null);
            try {
                character.setLevel(newLevel);
                character.setUnspentStatPoints(character.getUnspentStatPoints() + 1);
                character.setGold(character.getGold() + goldBonus);
                characterService.save(character);
            } catch (RuntimeException e) {
                rollback(snapshot, null, character, null);
                throw new RewardCommitException("Failed to commit level up for " + characterId, e);
            }
            log.info("[GameEngine] {} reached level {}", characterId, newLevel);
            return new LevelUpResult(true, newLevel, goldBonus, character.getUnspentStatPoints(),
                    RewardCurve.isLevelUpAvailable(character.getCurrentExp(), newLevel));
        }
    }

    // ==================== Side effects ====================

    private void notifySafely(QuestNotification notification) {
        try {
            notificationPort.notify(notification);
        } catch (RuntimeException e) {
            log.warn("[Notify] Failed to deliver {}: {}", notification.type(), e.getMessage());
        }
    }

    private void dispatchToPartner(PartnerCompletionEvent event) {
        try {
            partnerNotificationPort.notifyPartner(event)
                    .exceptionally(e -> {
                        log.warn("[Notify] Partner dispatch for {} failed: {}", event.taskId(), e.getMessage());
                        return null;
                    });
        } catch (RuntimeException e) {
            log.warn("[Notify] Partner dispatch for {} failed: {}", event.taskId(), e.getMessage());
        }
    }

    // ==================== Snapshots ====================

    private Snapshot snapshot(QuestTask task, PlayerCharacter character, Bond bond) {
        try {
            return new Snapshot(
                    task != null ? objectMapper.writeValueAsString(task) : null,
                    character != null ? objectMapper.writeValueAsString(character) : null,
                    bond != null ? objectMapper.writeValueAsString(bond) : null);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to snapshot state before commit", e);
        }
    }

    /**
     * Restores the in-memory records from their snapshots, then tries to write the
     * restored state back so storage matches memory again.
     */
    private void rollback(Snapshot snapshot, QuestTask task, PlayerCharacter character, Bond bond) {
        try {
            if (task != null && snapshot.task() != null) {
                objectMapper.readerForUpdating(task).readValue(snapshot.task());
            }
            if (character != null && snapshot.character() != null) {
                objectMapper.readerForUpdating(character).readValue(snapshot.character());
            }
            if (bond != null && snapshot.bond() != null) {
                objectMapper.readerForUpdating(bond).readValue(snapshot.bond());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to restore state after a failed commit", e);
        }
        log.error("[GameEngine] Commit failed, in-memory state rolled back");
        try {
            if (task != null) {
                taskService.save(task);
            }
            if (character != null) {
                characterService.save(character);
            }
            if (bond != null) {
                bondService.save(bond);
            }
        } catch (RuntimeException e) {
            log.warn("[GameEngine] Could not re-persist restored state: {}", e.getMessage());
        }
    }

    private record Snapshot(String task, String character, String bond) {
    }
}
