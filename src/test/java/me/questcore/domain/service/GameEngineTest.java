package me.questcore.domain.service;

import me.questcore.domain.model.ActivityConfirmation;
import me.questcore.domain.model.Bond;
import me.questcore.domain.model.CharacterClass;
import me.questcore.domain.model.CompletionOutcome;
import me.questcore.domain.model.DutyClaimResult;
import me.questcore.domain.model.GeofenceTarget;
import me.questcore.domain.model.HabitPenalty;
import me.questcore.domain.model.LevelUpResult;
import me.questcore.domain.model.LootDrop;
import me.questcore.domain.model.LootRarity;
import me.questcore.domain.model.PendingConfirmation;
import me.questcore.domain.model.PlayerCharacter;
import me.questcore.domain.model.QuestNotification;
import me.questcore.domain.model.QuestTask;
import me.questcore.domain.model.RewardDelta;
import me.questcore.domain.model.StatType;
import me.questcore.domain.model.TaskCategory;
import me.questcore.domain.model.TaskCompletionResult;
import me.questcore.domain.model.VerificationType;
import me.questcore.infrastructure.config.EngineConfiguration;
import me.questcore.infrastructure.config.QuestProperties;
import me.questcore.port.outbound.ActivityConfirmationPort;
import me.questcore.port.outbound.NotificationPort;
import me.questcore.port.outbound.PartnerNotificationPort;
import me.questcore.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GameEngineTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final double TARGET_LAT = 48.8566;
    private static final double TARGET_LON = 2.3522;

    private StoragePort storagePort;
    private NotificationPort notificationPort;
    private PartnerNotificationPort partnerNotificationPort;
    private ActivityConfirmationPort activityConfirmationPort;
    private Random lootRandom;

    private QuestTaskService taskService;
    private CharacterService characterService;
    private BondService bondService;
    private RoutineBundleService routineBundleService;
    private InventoryService inventoryService;
    private ConfirmationService confirmationService;
    private DutyBoardGenerator dutyBoardGenerator;
    private GameEngine gameEngine;
    private PlayerCharacter hero;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        when(storagePort.getText(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
        notificationPort = mock(NotificationPort.class);
        partnerNotificationPort = mock(PartnerNotificationPort.class);
        when(partnerNotificationPort.notifyPartner(any())).thenReturn(CompletableFuture.completedFuture(null));
        activityConfirmationPort = mock(ActivityConfirmationPort.class);
        lootRandom = mock(Random.class);
        when(lootRandom.nextDouble()).thenReturn(0.99);

        ObjectMapper objectMapper = EngineConfiguration.objectMapper();
        QuestProperties properties = new QuestProperties();
        Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);

        taskService = new QuestTaskService(storagePort, objectMapper, properties, clock);
        characterService = new CharacterService(storagePort, objectMapper, clock);
        bondService = new BondService(storagePort, objectMapper, clock);
        routineBundleService = new RoutineBundleService(storagePort, objectMapper, taskService, clock);
        inventoryService = new InventoryService(storagePort, objectMapper);
        confirmationService = new ConfirmationService(storagePort, objectMapper, properties, clock);
        VerificationEngine verificationEngine = new VerificationEngine(properties, clock);
        dutyBoardGenerator = new DutyBoardGenerator(new DutyPoolService(objectMapper, properties),
                taskService, characterService, bondService, properties, clock);

        gameEngine = new GameEngine(taskService, characterService, bondService,
                new TaskLifecycleService(taskService, verificationEngine, clock), verificationEngine,
                new RewardCompositionEngine(properties), routineBundleService,
                new AnomalyDetector(taskService, properties, clock),
                new LootService(properties, lootRandom, clock), inventoryService, confirmationService,
                dutyBoardGenerator, notificationPort, partnerNotificationPort, activityConfirmationPort,
                objectMapper, properties, clock);

        hero = characterService.createCharacter("Aria", CharacterClass.MAGE);
    }

    @Test
    void shouldGrantBaseRewardWithoutLevelUp() {
        QuestTask task = create(QuestTask.builder().title("Fold laundry").category(TaskCategory.HOUSEHOLD));

        CompletionOutcome outcome = gameEngine.completeTask(task.getId(), hero.getId(), null, null);

        assertTrue(outcome.isCompleted());
        TaskCompletionResult result = outcome.getResult();
        assertEquals(10, result.getExpGained());
        assertEquals(5, result.getGoldGained());
        assertFalse(result.isLevelUpAvailable());
        assertEquals(1, hero.getLevel());
        assertEquals(10, hero.getCurrentExp());
        assertEquals(5, hero.getGold());
        assertEquals(6, hero.getStat(StatType.DEFENSE));
        assertEquals(1, hero.getCurrentStreak());
        assertEquals(1, hero.getTasksCompleted());
        assertEquals(QuestTask.TaskStatus.COMPLETED, task.getStatus());
        assertEquals(FIXED_NOW, task.getCompletedAt());
        assertTrue(result.getPendingConfirmations().isEmpty());
    }

    @Test
    void shouldApplyPhotoTierMultiplier() {
        QuestTask task = create(QuestTask.builder()
                .title("Clean the Kitchen")
                .category(TaskCategory.HOUSEHOLD)
                .verificationType(VerificationType.PHOTO));
        task.setStartedAt(FIXED_NOW.minusSeconds(120));
        task.setPhotoData(new byte[] { 1, 2, 3 });
        task.setPhotoCapturedAt(FIXED_NOW.minusSeconds(30));

        TaskCompletionResult result = gameEngine.completeTask(task.getId(), hero.getId(), null, null).getResult();

        assertEquals(15, result.getExpGained());
        assertEquals(VerificationType.PHOTO, result.getVerificationTier());
        assertEquals(1.5, result.getVerificationMultiplier());
    }

    @Test
    void shouldGrantFullLocationCreditInsideGeofence() {
        QuestTask task = locationTask(50);

        TaskCompletionResult result = gameEngine.completeTask(task.getId(), hero.getId(), null, null).getResult();

        assertTrue(result.isGeofenceInRange());
        assertEquals(17, result.getExpGained());
    }

    @Test
    void shouldGrantReducedLocationCreditOutsideGeofence() {
        QuestTask task = locationTask(400);

        TaskCompletionResult result = gameEngine.completeTask(task.getId(), hero.getId(), null, null).getResult();

        assertFalse(result.isGeofenceInRange());
        assertEquals(12, result.getExpGained());
    }

    @Test
    void shouldRejectBeforeMinimumDurationWithoutMutation() {
        QuestTask task = create(QuestTask.builder()
                .title("Take a Photo")
                .category(TaskCategory.CREATIVE)
                .verificationType(VerificationType.PHOTO));
        task.setStatus(QuestTask.TaskStatus.IN_PROGRESS);
        task.setStartedAt(FIXED_NOW.minusSeconds(10));
        clearInvocations(storagePort);

        CompletionOutcome outcome = gameEngine.completeTask(task.getId(), hero.getId(), null, null);

        assertEquals(CompletionOutcome.Status.REJECTED, outcome.getStatus());
        assertEquals("Please wait 50s before completing this task.", outcome.getReason());
        assertEquals(QuestTask.TaskStatus.IN_PROGRESS, task.getStatus());
        assertEquals(0, hero.getCurrentExp());
        assertEquals(0, hero.getTasksCompleted());
        verify(storagePort, never()).putTextAtomic(anyString(), anyString(), anyString(), anyBoolean());
    }

    @Test
    void shouldRejectSecondCompletion() {
        QuestTask task = create(QuestTask.builder().title("Read").category(TaskCategory.MENTAL));
        gameEngine.completeTask(task.getId(), hero.getId(), null, null);

        CompletionOutcome second = gameEngine.completeTask(task.getId(), hero.getId(), null, null);

        assertEquals(CompletionOutcome.Status.REJECTED, second.getStatus());
        assertEquals("This task is already completed.", second.getReason());
        assertEquals(1, hero.getTasksCompleted());
    }

    @Test
    void shouldSkipWithoutCharacter() {
        QuestTask task = create(QuestTask.builder().title("Orphan").category(TaskCategory.MENTAL));

        CompletionOutcome outcome = gameEngine.completeTask(task.getId(), "nobody", null, null);

        assertEquals(CompletionOutcome.Status.SKIPPED, outcome.getStatus());
        assertEquals(QuestTask.TaskStatus.PENDING, task.getStatus());
    }

    @Test
    void shouldSkipTaskOwnedByAnotherCharacter() {
        PlayerCharacter rival = characterService.createCharacter("Bram", CharacterClass.WARRIOR);
        QuestTask task = create(QuestTask.builder().title("Not yours").category(TaskCategory.MENTAL));

        CompletionOutcome outcome = gameEngine.completeTask(task.getId(), rival.getId(), null, null);

        assertEquals(CompletionOutcome.Status.SKIPPED, outcome.getStatus());
        assertEquals("Task belongs to another character", outcome.getReason());
        assertEquals(QuestTask.TaskStatus.PENDING, task.getStatus());
        assertEquals(0, rival.getCurrentExp());
        assertEquals(0, hero.getCurrentExp());
    }

    @Test
    void shouldCreditAssigneeOfSharedTask() {
        PlayerCharacter partner = characterService.createCharacter("Bram", CharacterClass.WARRIOR);
        QuestTask task = create(QuestTask.builder()
                .title("Water the plants")
                .category(TaskCategory.HOUSEHOLD)
                .assignedTo(partner.getId()));

        CompletionOutcome outcome = gameEngine.completeTask(task.getId(), partner.getId(), null, null);

        assertTrue(outcome.isCompleted());
        assertEquals(partner.getId(), outcome.getResult().getCharacterId());
    }

    @Test
    void shouldSkipBondCharacterDoesNotBelongTo() {
        Bond strangers = bondService.createBond("partner-1", "partner-2");
        QuestTask task = create(QuestTask.builder().title("Borrowed bond").category(TaskCategory.SOCIAL));

        CompletionOutcome outcome = gameEngine.completeTask(task.getId(), hero.getId(), strangers.getId(), null);

        assertEquals(CompletionOutcome.Status.SKIPPED, outcome.getStatus());
        assertEquals("Character is not a member of the bond", outcome.getReason());
        assertEquals(QuestTask.TaskStatus.PENDING, task.getStatus());
        assertEquals(0, strangers.getTotalExp());
    }

    @Test
    void shouldSkipCoopTaskWithoutBond() {
        QuestTask task = create(QuestTask.builder().title("Duet").category(TaskCategory.SOCIAL).coop(true));

        CompletionOutcome outcome = gameEngine.completeTask(task.getId(), hero.getId(), null, null);

        assertEquals(CompletionOutcome.Status.SKIPPED, outcome.getStatus());
        assertEquals(0, hero.getCurrentExp());
    }

    @Test
    void shouldGrantCoopBonusOnceWhenClosingPair() {
        Bond bond = bondService.createBond(hero.getId(), "partner-1");
        QuestTask task = create(QuestTask.builder()
                .title("Cook together")
                .category(TaskCategory.SOCIAL)
                .coop(true)
                .bondId(bond.getId())
                .partnerCompleted(true));

        TaskCompletionResult result = gameEngine.completeTask(task.getId(), hero.getId(), null, null).getResult();

        assertEquals(5, result.getCoopBonusExp());
        assertEquals(2, result.getCoopBonusGold());
        assertEquals(25, result.getCoopBondExp());
        assertEquals(15, hero.getCurrentExp());
        assertEquals(7, hero.getGold());
        assertEquals(25, bond.getTotalExp());
        assertEquals(1, bond.getCoopCompletions());
        assertTrue(task.isCoopBonusAwarded());

        RewardDelta late = gameEngine.recordPartnerCompletion(task.getId());

        assertFalse(late.isApplied());
        assertEquals(15, hero.getCurrentExp());
        assertEquals(25, bond.getTotalExp());
    }

    @Test
    void shouldGrantCoopBonusWhenPartnerFinishesLater() {
        Bond bond = bondService.createBond(hero.getId(), "partner-1");
        QuestTask task = create(QuestTask.builder()
                .title("Run together")
                .category(TaskCategory.SOCIAL)
                .coop(true)
                .bondId(bond.getId()));

        TaskCompletionResult result = gameEngine.completeTask(task.getId(), hero.getId(), null, null).getResult();
        assertEquals(0, result.getCoopBonusExp());
        assertFalse(result.isCoopPartnerCompleted());

        RewardDelta first = gameEngine.recordPartnerCompletion(task.getId());
        RewardDelta second = gameEngine.recordPartnerCompletion(task.getId());

        assertTrue(first.isApplied());
        assertEquals(5, first.getExpGained());
        assertEquals(2, first.getGoldGained());
        assertFalse(second.isApplied());
        assertEquals(15, hero.getCurrentExp());
        assertEquals(7, hero.getGold());
    }

    @Test
    void shouldRollBackEverythingWhenCharacterWriteFails() {
        QuestTask task = create(QuestTask.builder().title("Vacuum").category(TaskCategory.HOUSEHOLD));
        when(storagePort.putTextAtomic(eq("characters"), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        assertThrows(RewardCommitException.class,
                () -> gameEngine.completeTask(task.getId(), hero.getId(), null, null));

        assertEquals(QuestTask.TaskStatus.PENDING, task.getStatus());
        assertNull(task.getCompletedAt());
        assertNull(task.getStartedAt());
        assertEquals(0, hero.getCurrentExp());
        assertEquals(0, hero.getGold());
        assertEquals(0, hero.getTasksCompleted());
        assertEquals(5, hero.getStat(StatType.DEFENSE));
        assertNull(hero.getLastActiveDay());
        verify(notificationPort, never()).notify(any());
    }

    @Test
    void shouldFloorHabitPenaltyAtZero() {
        hero.setCurrentExp(3);
        QuestTask habit = create(QuestTask.builder()
                .title("Drink water")
                .category(TaskCategory.WELLNESS)
                .habit(true)
                .habitStreak(6));

        HabitPenalty penalty = gameEngine.failHabit(habit).orElseThrow();

        assertEquals(3, penalty.expLost());
        assertEquals(0, penalty.goldLost());
        assertEquals(0, hero.getCurrentExp());
        assertEquals(0, hero.getGold());
        assertEquals(QuestTask.TaskStatus.FAILED, habit.getStatus());
        assertEquals(0, habit.getHabitStreak());
        ArgumentCaptor<QuestNotification> captor = ArgumentCaptor.forClass(QuestNotification.class);
        verify(notificationPort).notify(captor.capture());
        assertEquals(QuestNotification.Type.HABIT_MISSED, captor.getValue().type());
    }

    @Test
    void shouldApplyPartnerConfirmationOnce() {
        QuestTask task = create(QuestTask.builder()
                .title("Partner's errand")
                .category(TaskCategory.SOCIAL)
                .fromPartner(true)
                .baseExp(40)
                .baseGold(20));

        TaskCompletionResult result = gameEngine.completeTask(task.getId(), hero.getId(), null, null).getResult();
        assertEquals(1, result.getPendingConfirmations().size());
        String token = result.getPendingConfirmations().get(0);

        RewardDelta first = gameEngine.applyConfirmation(token, true);
        RewardDelta second = gameEngine.applyConfirmation(token, true);

        assertTrue(first.isApplied());
        assertEquals(6, first.getExpGained());
        assertEquals(3, first.getGoldGained());
        assertFalse(second.isApplied());
        assertEquals("Confirmation already resolved", second.getReason());
        assertEquals(46, hero.getCurrentExp());
        assertEquals(23, hero.getGold());
        verify(partnerNotificationPort).notifyPartner(any());
    }

    @Test
    void shouldDiscardDisputedConfirmation() {
        QuestTask task = create(QuestTask.builder()
                .title("Partner's errand")
                .category(TaskCategory.SOCIAL)
                .fromPartner(true)
                .baseExp(40)
                .baseGold(20));
        String token = gameEngine.completeTask(task.getId(), hero.getId(), null, null).getResult()
                .getPendingConfirmations().get(0);

        RewardDelta delta = gameEngine.applyConfirmation(token, false);

        assertFalse(delta.isApplied());
        assertEquals(PendingConfirmation.State.DISCARDED, confirmationService.getConfirmation(token).get().getState());
        assertEquals(40, hero.getCurrentExp());
    }

    @Test
    void shouldApplyActivityConfirmationFromTracker() {
        when(activityConfirmationPort.isAvailable()).thenReturn(true);
        when(activityConfirmationPort.confirmActivity(any()))
                .thenReturn(CompletableFuture.completedFuture(new ActivityConfirmation(true, "steps")));
        QuestTask task = create(QuestTask.builder().title("Go for a Walk").category(TaskCategory.PHYSICAL));

        TaskCompletionResult result = gameEngine.completeTask(task.getId(), hero.getId(), null, null).getResult();

        assertEquals(10, result.getExpGained());
        String token = result.getPendingConfirmations().get(0);
        assertEquals(PendingConfirmation.State.APPLIED, confirmationService.getConfirmation(token).get().getState());
        assertEquals(12, hero.getCurrentExp());
    }

    @Test
    void shouldQueueLevelUpWithoutApplyingIt() {
        QuestTask task = create(QuestTask.builder().title("Big quest").category(TaskCategory.MENTAL).baseExp(100));

        TaskCompletionResult result = gameEngine.completeTask(task.getId(), hero.getId(), null, null).getResult();

        assertTrue(result.isLevelUpAvailable());
        assertEquals(1, hero.getLevel());
        ArgumentCaptor<QuestNotification> captor = ArgumentCaptor.forClass(QuestNotification.class);
        verify(notificationPort, atLeastOnce()).notify(captor.capture());
        assertTrue(captor.getAllValues().stream()
                .anyMatch(n -> n.type() == QuestNotification.Type.LEVEL_UP_AVAILABLE));

        LevelUpResult levelUp = gameEngine.levelUp(hero.getId());

        assertTrue(levelUp.applied());
        assertEquals(2, levelUp.newLevel());
        assertEquals(20, levelUp.goldBonus());
        assertEquals(1, levelUp.unspentStatPoints());
        assertFalse(levelUp.anotherAvailable());
        assertFalse(gameEngine.levelUp(hero.getId()).applied());
    }

    @Test
    void shouldGrantRoutineBonusWhenLastHabitCompletes() {
        QuestTask first = habit("Stretch");
        QuestTask second = habit("Journal");
        QuestTask third = habit("Meditate");
        routineBundleService.createBundle(hero.getId(), "Morning",
                List.of(first.getSeriesId(), second.getSeriesId(), third.getSeriesId()));

        assertFalse(gameEngine.completeTask(first.getId(), hero.getId(), null, null).getResult()
                .isRoutineBundleCompleted());
        gameEngine.completeTask(second.getId(), hero.getId(), null, null);
        TaskCompletionResult last = gameEngine.completeTask(third.getId(), hero.getId(), null, null).getResult();

        assertTrue(last.isRoutineBundleCompleted());
        assertEquals("Morning", last.getRoutineBundleName());
        assertEquals(15, last.getRoutineBonusExp());
        assertEquals(1, third.getHabitStreak());
    }

    @Test
    void shouldLeaveHabitCompletedBeforeFailureAlone() {
        QuestTask habit = habit("Stretch");
        assertTrue(gameEngine.completeTask(habit.getId(), hero.getId(), null, null).isCompleted());
        long expBefore = hero.getCurrentExp();
        long goldBefore = hero.getGold();
        clearInvocations(notificationPort);

        Optional<HabitPenalty> penalty = gameEngine.failHabit(habit);

        assertTrue(penalty.isEmpty());
        assertEquals(QuestTask.TaskStatus.COMPLETED, habit.getStatus());
        assertEquals(expBefore, hero.getCurrentExp());
        assertEquals(goldBefore, hero.getGold());
        verify(notificationPort, never()).notify(any());
    }

    @Test
    void shouldUnlockAndCompleteBonusDutyAfterClaimedDuty() {
        LocalDate today = LocalDate.ofInstant(FIXED_NOW, ZoneOffset.UTC);
        QuestTask duty = dutyBoardGenerator.ensureTodaysDuties(hero.getId()).get(0);
        assertTrue(dutyBoardGenerator.claimDuty(hero.getId(), duty.getId(), null, false).isClaimed());
        duty.setVerificationType(VerificationType.NONE);

        assertTrue(gameEngine.completeTask(duty.getId(), hero.getId(), null, null).isCompleted());

        QuestTask bonus = taskService.getTasksForOwner(hero.getId()).stream()
                .filter(QuestTask::isBonusDuty)
                .findFirst()
                .orElseThrow();
        DutyClaimResult claim = dutyBoardGenerator.claimDuty(hero.getId(), bonus.getId(), null, false);
        assertTrue(claim.isClaimed());
        bonus.setVerificationType(VerificationType.NONE);

        assertTrue(gameEngine.completeTask(bonus.getId(), hero.getId(), null, null).isCompleted());
        assertEquals(2, hero.dutiesCompletedOn(today));
        assertEquals(1, hero.dutyClaimsOn(today));
        assertEquals(QuestTask.TaskStatus.COMPLETED, bonus.getStatus());
    }

    @Test
    void shouldStoreLootInInventory() {
        when(lootRandom.nextDouble()).thenReturn(0.01, 0.7);
        when(lootRandom.nextInt(anyInt())).thenReturn(0);
        QuestTask task = create(QuestTask.builder().title("Lucky").category(TaskCategory.MENTAL));

        TaskCompletionResult result = gameEngine.completeTask(task.getId(), hero.getId(), null, null).getResult();

        LootDrop loot = result.getLoot();
        assertEquals("Iron Sword", loot.getName());
        assertEquals(LootRarity.UNCOMMON, loot.getRarity());
        assertEquals(List.of(loot), inventoryService.getInventory(hero.getId()));
    }

    private QuestTask create(QuestTask.QuestTaskBuilder builder) {
        QuestTask draft = builder.ownerId(hero.getId()).build();
        if (draft.getBaseExp() == 0) {
            draft.setBaseExp(10);
        }
        if (draft.getBaseGold() == 0) {
            draft.setBaseGold(5);
        }
        return taskService.createTask(draft);
    }

    private QuestTask habit(String title) {
        return create(QuestTask.builder().title(title).category(TaskCategory.WELLNESS).habit(true));
    }

    private QuestTask locationTask(double metersNorth) {
        QuestTask task = create(QuestTask.builder()
                .title("Visit the library")
                .category(TaskCategory.HOUSEHOLD)
                .verificationType(VerificationType.LOCATION)
                .geofence(GeofenceTarget.builder()
                        .name("Library")
                        .latitude(TARGET_LAT)
                        .longitude(TARGET_LON)
                        .radiusMeters(200)
                        .build()));
        task.setStartedAt(FIXED_NOW.minusSeconds(120));
        task.setVerificationLatitude(TARGET_LAT + Math.toDegrees(metersNorth / VerificationEngine.EARTH_RADIUS_METERS));
        task.setVerificationLongitude(TARGET_LON);
        return task;
    }
}
