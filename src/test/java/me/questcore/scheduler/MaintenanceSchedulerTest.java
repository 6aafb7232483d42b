package me.questcore.scheduler;

import me.questcore.domain.service.ConfirmationService;
import me.questcore.domain.service.HabitService;
import me.questcore.domain.service.TaskLifecycleService;
import me.questcore.infrastructure.config.QuestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MaintenanceSchedulerTest {

    private TaskLifecycleService lifecycleService;
    private HabitService habitService;
    private ConfirmationService confirmationService;
    private QuestProperties properties;
    private MaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        lifecycleService = mock(TaskLifecycleService.class);
        habitService = mock(HabitService.class);
        confirmationService = mock(ConfirmationService.class);
        properties = new QuestProperties();
        when(habitService.processMissedHabits()).thenReturn(List.of());
        when(habitService.rolloverRepeatingTasks()).thenReturn(List.of());
        scheduler = new MaintenanceScheduler(lifecycleService, habitService, confirmationService, properties);
    }

    @Test
    void shouldRunAllStepsInOrder() {
        scheduler.tick();

        InOrder order = inOrder(lifecycleService, habitService, confirmationService);
        order.verify(lifecycleService).expireOverdueTasks();
        order.verify(habitService).processMissedHabits();
        order.verify(habitService).rolloverRepeatingTasks();
        order.verify(confirmationService).purgeExpired();
    }

    @Test
    void shouldContinueAfterFailingStep() {
        when(lifecycleService.expireOverdueTasks()).thenThrow(new IllegalStateException("storage down"));

        scheduler.tick();

        verify(habitService).processMissedHabits();
        verify(confirmationService).purgeExpired();
    }

    @Test
    void shouldNotStartExecutorWhenDisabled() {
        properties.getScheduler().setEnabled(false);

        scheduler.init();
        scheduler.shutdown();

        verify(habitService, org.mockito.Mockito.never()).processMissedHabits();
    }
}
