package me.questcore.domain.service;

import me.questcore.domain.model.QuestTask;
import me.questcore.domain.model.RoutineBundle;
import me.questcore.infrastructure.config.EngineConfiguration;
import me.questcore.infrastructure.config.QuestProperties;
import me.questcore.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RoutineBundleServiceTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-02-11T10:00:00Z");

    private QuestTaskService taskService;
    private RoutineBundleService service;

    @BeforeEach
    void setUp() {
        StoragePort storagePort = mock(StoragePort.class);
        when(storagePort.getText(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
        ObjectMapper objectMapper = EngineConfiguration.objectMapper();
        Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
        taskService = new QuestTaskService(storagePort, objectMapper, new QuestProperties(), clock);
        service = new RoutineBundleService(storagePort, objectMapper, taskService, clock);
    }

    @Test
    void shouldRejectTooFewDistinctHabits() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> service.createBundle("hero-1", "Morning", List.of("a", "b", "a")));

        assertEquals("A routine bundle needs 3 to 6 distinct habits", e.getMessage());
    }

    @Test
    void shouldRejectTooManyHabits() {
        assertThrows(IllegalArgumentException.class,
                () -> service.createBundle("hero-1", "Everything", List.of("a", "b", "c", "d", "e", "f", "g")));
    }

    @Test
    void shouldCreateActiveBundle() {
        RoutineBundle bundle = service.createBundle("hero-1", "Morning", List.of("a", "b", "c"));

        assertTrue(bundle.isActive());
        assertEquals(List.of("a", "b", "c"), bundle.getHabitSeriesIds());
        assertEquals(1, service.getBundles().size());
    }

    @Test
    void shouldDeactivateBundle() {
        RoutineBundle bundle = service.createBundle("hero-1", "Morning", List.of("a", "b", "c"));

        service.deactivateBundle(bundle.getId());

        assertFalse(bundle.isActive());
        assertThrows(IllegalArgumentException.class, () -> service.deactivateBundle("missing"));
    }

    @Test
    void shouldDetectLastHabitOfBundle() {
        QuestTask first = habit("Stretch");
        QuestTask second = habit("Journal");
        QuestTask third = habit("Meditate");
        RoutineBundle bundle = service.createBundle("hero-1", "Morning",
                List.of(first.getSeriesId(), second.getSeriesId(), third.getSeriesId()));
        complete(first);

        assertTrue(service.findBundleCompletedBy(third, "hero-1").isEmpty());

        complete(second);
        Optional<RoutineBundle> found = service.findBundleCompletedBy(third, "hero-1");
        assertTrue(found.isPresent());
        assertEquals(bundle.getId(), found.get().getId());
    }

    @Test
    void shouldIgnoreInactiveBundleAndNonHabits() {
        QuestTask first = habit("Stretch");
        QuestTask second = habit("Journal");
        QuestTask third = habit("Meditate");
        RoutineBundle bundle = service.createBundle("hero-1", "Morning",
                List.of(first.getSeriesId(), second.getSeriesId(), third.getSeriesId()));
        complete(first);
        complete(second);
        service.deactivateBundle(bundle.getId());

        assertTrue(service.findBundleCompletedBy(third, "hero-1").isEmpty());
        QuestTask plain = taskService.createTask(QuestTask.builder().ownerId("hero-1").title("Errand").build());
        assertTrue(service.findBundleCompletedBy(plain, "hero-1").isEmpty());
    }

    private QuestTask habit(String title) {
        return taskService.createTask(QuestTask.builder().ownerId("hero-1").title(title).habit(true).build());
    }

    private void complete(QuestTask task) {
        task.setStatus(QuestTask.TaskStatus.COMPLETED);
        task.setCompletedAt(FIXED_NOW.minusSeconds(600));
    }
}
