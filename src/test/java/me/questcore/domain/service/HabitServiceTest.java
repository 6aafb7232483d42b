package me.questcore.domain.service;

import me.questcore.domain.model.HabitPenalty;
import me.questcore.domain.model.QuestTask;
import me.questcore.domain.model.RecurrencePattern;
import me.questcore.domain.model.TaskCategory;
import me.questcore.infrastructure.config.QuestProperties;
import me.questcore.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HabitServiceTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final String OWNER = "hero-1";

    private QuestTaskService taskService;
    private GameEngine gameEngine;
    private HabitService habitService;

    @BeforeEach
    void setUp() {
        StoragePort storagePort = mock(StoragePort.class);
        when(storagePort.getText(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);

        taskService = new QuestTaskService(storagePort, objectMapper, new QuestProperties(), clock);
        gameEngine = mock(GameEngine.class);
        when(gameEngine.failHabit(any())).thenAnswer(invocation -> {
            QuestTask task = invocation.getArgument(0);
            return Optional.of(new HabitPenalty(task.getId(), OWNER, 10, 5));
        });
        habitService = new HabitService(taskService, gameEngine, clock);
    }

    @Test
    void shouldFailHabitPastItsDueTime() {
        QuestTask missed = habit("Morning run", Instant.parse("2026-02-11T06:00:00Z"), LocalTime.of(8, 0));

        List<HabitPenalty> penalties = habitService.processMissedHabits();

        assertEquals(1, penalties.size());
        verify(gameEngine).failHabit(missed);
    }

    @Test
    void shouldKeepGoingWhenOneHabitFailsToCommit() {
        QuestTask broken = habit("Cold shower", Instant.parse("2026-02-11T05:00:00Z"), LocalTime.of(7, 0));
        QuestTask missed = habit("Morning run", Instant.parse("2026-02-11T06:00:00Z"), LocalTime.of(8, 0));
        when(gameEngine.failHabit(broken))
                .thenThrow(new RewardCommitException("Failed to commit", new IllegalStateException("disk full")));

        List<HabitPenalty> penalties = habitService.processMissedHabits();

        assertEquals(1, penalties.size());
        assertEquals(missed.getId(), penalties.get(0).taskId());
        verify(gameEngine).failHabit(missed);
    }

    @Test
    void shouldLeaveOutHabitThatEndedMeanwhile() {
        QuestTask missed = habit("Morning run", Instant.parse("2026-02-11T06:00:00Z"), LocalTime.of(8, 0));
        when(gameEngine.failHabit(missed)).thenReturn(Optional.empty());

        assertTrue(habitService.processMissedHabits().isEmpty());
    }

    @Test
    void shouldGiveLateCreatedHabitUntilNextDay() {
        QuestTask late = habit("Evening read", Instant.parse("2026-02-11T09:00:00Z"), LocalTime.of(8, 0));

        assertEquals(Instant.parse("2026-02-12T08:00:00Z"), habitService.deadlineOf(late));
        assertTrue(habitService.processMissedHabits().isEmpty());
        verify(gameEngine, never()).failHabit(any());
    }

    @Test
    void shouldIgnoreCompletedAndUntimedHabits() {
        QuestTask done = habit("Floss", Instant.parse("2026-02-11T06:00:00Z"), LocalTime.of(8, 0));
        done.setStatus(QuestTask.TaskStatus.COMPLETED);
        habit("Whenever", Instant.parse("2026-02-11T06:00:00Z"), null);

        assertTrue(habitService.processMissedHabits().isEmpty());
    }

    @Test
    void shouldRenewHabitFinishedYesterdayKeepingStreak() {
        QuestTask yesterday = habit("Meditate", Instant.parse("2026-02-10T06:00:00Z"), LocalTime.of(20, 0));
        yesterday.setStatus(QuestTask.TaskStatus.COMPLETED);
        yesterday.setCompletedAt(Instant.parse("2026-02-10T07:00:00Z"));
        yesterday.setHabitStreak(3);
        yesterday.setHabitLastCompletedDay(LocalDate.of(2026, 2, 10));

        List<QuestTask> renewed = habitService.rolloverRepeatingTasks();

        assertEquals(1, renewed.size());
        QuestTask next = renewed.get(0);
        assertNotEquals(yesterday.getId(), next.getId());
        assertEquals(yesterday.getSeriesId(), next.getSeriesId());
        assertEquals(QuestTask.TaskStatus.PENDING, next.getStatus());
        assertEquals(3, next.getHabitStreak());
        assertEquals(LocalTime.of(20, 0), next.getHabitDueTime());
        assertEquals(FIXED_NOW, next.getCreatedAt());
    }

    @Test
    void shouldRenewFailedHabit() {
        QuestTask failed = habit("Stretch", Instant.parse("2026-02-10T06:00:00Z"), LocalTime.of(8, 0));
        failed.setStatus(QuestTask.TaskStatus.FAILED);
        failed.setFailedAt(Instant.parse("2026-02-10T08:01:00Z"));

        assertEquals(1, habitService.rolloverRepeatingTasks().size());
    }

    @Test
    void shouldNotRenewSeriesTwiceOrWhileOpen() {
        QuestTask today = habit("Journal", Instant.parse("2026-02-11T06:00:00Z"), LocalTime.of(20, 0));
        today.setStatus(QuestTask.TaskStatus.COMPLETED);
        today.setCompletedAt(Instant.parse("2026-02-11T07:00:00Z"));
        habit("Open", Instant.parse("2026-02-10T06:00:00Z"), LocalTime.of(20, 0));

        assertTrue(habitService.rolloverRepeatingTasks().isEmpty());

        QuestTask old = habit("Walk", Instant.parse("2026-02-10T06:00:00Z"), LocalTime.of(20, 0));
        old.setStatus(QuestTask.TaskStatus.COMPLETED);
        old.setCompletedAt(Instant.parse("2026-02-10T07:00:00Z"));
        assertEquals(1, habitService.rolloverRepeatingTasks().size());
        assertTrue(habitService.rolloverRepeatingTasks().isEmpty());
    }

    @Test
    void shouldRenewRecurringTaskOnlyWhenPatternIsDue() {
        QuestTask weekly = recurring("Weekly review", RecurrencePattern.WEEKLY, LocalDate.of(2026, 2, 4));
        QuestTask weekend = recurring("Weekend hike", RecurrencePattern.WEEKENDS, LocalDate.of(2026, 2, 7));

        List<QuestTask> renewed = habitService.rolloverRepeatingTasks();

        assertEquals(1, renewed.size());
        assertEquals(weekly.getSeriesId(), renewed.get(0).getSeriesId());
        assertEquals(LocalDate.of(2026, 2, 4), renewed.get(0).getSeriesAnchor());
        assertEquals(1, taskService.getTasks().stream()
                .filter(t -> weekend.getSeriesId().equals(t.getSeriesId()))
                .count());
    }

    private QuestTask habit(String title, Instant createdAt, LocalTime dueTime) {
        return taskService.createTask(QuestTask.builder()
                .ownerId(OWNER)
                .title(title)
                .category(TaskCategory.WELLNESS)
                .habit(true)
                .habitDueTime(dueTime)
                .createdAt(createdAt)
                .build());
    }

    private QuestTask recurring(String title, RecurrencePattern pattern, LocalDate anchor) {
        QuestTask task = taskService.createTask(QuestTask.builder()
                .ownerId(OWNER)
                .title(title)
                .category(TaskCategory.MENTAL)
                .recurring(true)
                .recurrencePattern(pattern)
                .seriesAnchor(anchor)
                .createdAt(anchor.atStartOfDay().toInstant(ZoneOffset.UTC))
                .build());
        task.setStatus(QuestTask.TaskStatus.COMPLETED);
        task.setCompletedAt(anchor.atTime(12, 0).toInstant(ZoneOffset.UTC));
        return task;
    }
}
