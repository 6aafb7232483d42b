package me.questcore.domain.service;

import me.questcore.domain.model.AnomalyAssessment;
import me.questcore.domain.model.AnomalyFlag;
import me.questcore.domain.model.QuestTask;
import me.questcore.infrastructure.config.QuestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnomalyDetectorTest {

    private static final String CHARACTER_ID = "hero-1";
    private static final Instant MORNING = Instant.parse("2026-02-11T10:00:00Z");
    private static final Instant LATE_NIGHT = Instant.parse("2026-02-11T03:00:00Z");

    private QuestTaskService taskService;
    private QuestProperties properties;

    @BeforeEach
    void setUp() {
        taskService = mock(QuestTaskService.class);
        properties = new QuestProperties();
        when(taskService.getCompletedSince(eq(CHARACTER_ID), any())).thenReturn(List.of());
    }

    @Test
    void shouldReturnCleanAssessmentForNormalPattern() {
        AnomalyAssessment assessment = detector(MORNING).assess(CHARACTER_ID);

        assertTrue(assessment.isClean());
        assertEquals(1.0, assessment.multiplier());
    }

    @Test
    void shouldFlagRapidCompletions() {
        when(taskService.getCompletedSince(CHARACTER_ID, MORNING.minusSeconds(600))).thenReturn(completions(6));

        AnomalyAssessment assessment = detector(MORNING).assess(CHARACTER_ID);

        assertEquals(List.of(AnomalyFlag.RAPID_COMPLETION), assessment.flags());
        assertEquals(0.5, assessment.multiplier(), 1e-9);
    }

    @Test
    void shouldFlagLateNightCompletion() {
        AnomalyAssessment assessment = detector(LATE_NIGHT).assess(CHARACTER_ID);

        assertEquals(List.of(AnomalyFlag.LATE_NIGHT), assessment.flags());
        assertEquals(0.85, assessment.multiplier(), 1e-9);
    }

    @Test
    void shouldFloorCombinedMultiplier() {
        Instant dayStart = Instant.parse("2026-02-11T00:00:00Z");
        when(taskService.getCompletedSince(CHARACTER_ID, LATE_NIGHT.minusSeconds(600))).thenReturn(completions(6));
        when(taskService.getCompletedSince(CHARACTER_ID, dayStart)).thenReturn(completions(21));

        AnomalyAssessment assessment = detector(LATE_NIGHT).assess(CHARACTER_ID);

        assertEquals(3, assessment.flags().size());
        // 0.5 * 0.85 * 0.6 = 0.255 stays above the floor
        assertEquals(0.255, assessment.multiplier(), 1e-9);

        properties.getAnomaly().setFloor(0.3);
        assertEquals(0.3, detector(LATE_NIGHT).assess(CHARACTER_ID).multiplier(), 1e-9);
    }

    private AnomalyDetector detector(Instant now) {
        return new AnomalyDetector(taskService, properties, Clock.fixed(now, ZoneOffset.UTC));
    }

    private static List<QuestTask> completions(int count) {
        return Collections.nCopies(count, QuestTask.builder().title("done").build());
    }
}
