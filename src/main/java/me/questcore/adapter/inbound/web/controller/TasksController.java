package me.questcore.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.questcore.domain.model.CompletionCheck;
import me.questcore.domain.model.CompletionOutcome;
import me.questcore.domain.model.GeofenceTarget;
import me.questcore.domain.model.MiniGameKind;
import me.questcore.domain.model.MiniGameOutcome;
import me.questcore.domain.model.QuestTask;
import me.questcore.domain.model.RecurrencePattern;
import me.questcore.domain.model.RewardDelta;
import me.questcore.domain.model.TaskCategory;
import me.questcore.domain.model.VerificationResult;
import me.questcore.domain.model.VerificationType;
import me.questcore.domain.service.GameEngine;
import me.questcore.domain.service.ProofCaptureService;
import me.questcore.domain.service.QuestTaskService;
import me.questcore.domain.service.TaskLifecycleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * Task endpoints: creation, start, proof capture and completion.
 */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TasksController {

    private final QuestTaskService taskService;
    private final TaskLifecycleService lifecycleService;
    private final ProofCaptureService proofCaptureService;
    private final GameEngine gameEngine;

    @PostMapping
    public Mono<ResponseEntity<TaskDto>> createTask(@RequestBody CreateTaskRequest request) {
        if (request == null || request.title() == null || request.title().isBlank()) {
            throw badRequest("title is required");
        }
        if (request.ownerId() == null || request.ownerId().isBlank()) {
            throw badRequest("ownerId is required");
        }
        QuestTask task = QuestTask.builder()
                .ownerId(request.ownerId())
                .title(request.title())
                .description(request.description())
                .category(parseEnum(TaskCategory.class, request.category(), "category", TaskCategory.MENTAL))
                .verificationType(parseEnum(VerificationType.class, request.verificationType(),
                        "verificationType", VerificationType.NONE))
                .miniGameKind(parseEnum(MiniGameKind.class, request.miniGameKind(), "miniGameKind", null))
                .baseExp(request.baseExp() != null ? request.baseExp() : 0)
                .baseGold(request.baseGold() != null ? request.baseGold() : 0)
                .dueDate(request.dueDate())
                .minimumDurationSeconds(request.minimumDurationSeconds())
                .geofence(request.geofence())
                .habit(Boolean.TRUE.equals(request.habit()))
                .habitDueTime(parseTime(request.habitDueTime()))
                .recurring(request.recurrencePattern() != null)
                .recurrencePattern(parseEnum(RecurrencePattern.class, request.recurrencePattern(),
                        "recurrencePattern", null))
                .fromPartner(Boolean.TRUE.equals(request.fromPartner()))
                .sharedWithPartner(Boolean.TRUE.equals(request.sharedWithPartner()))
                .coop(Boolean.TRUE.equals(request.coop()))
                .bondId(request.bondId())
                .assignedTo(request.assignedTo())
                .build();
        try {
            QuestTask created = taskService.createTask(task);
            return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(TaskDto.from(created)));
        } catch (IllegalArgumentException e) {
            throw badRequest(e.getMessage());
        }
    }

    @GetMapping
    public Mono<ResponseEntity<List<TaskDto>>> listTasks(@RequestParam String ownerId) {
        List<TaskDto> tasks = taskService.getTasksForOwner(ownerId).stream()
                .map(TaskDto::from)
                .toList();
        return Mono.just(ResponseEntity.ok(tasks));
    }

    @PostMapping("/{taskId}/start")
    public Mono<ResponseEntity<TaskDto>> startTask(@PathVariable String taskId) {
        requireTask(taskId);
        try {
            return Mono.just(ResponseEntity.ok(TaskDto.from(lifecycleService.startTask(taskId))));
        } catch (IllegalStateException e) {
            throw conflict(e.getMessage());
        }
    }

    @GetMapping("/{taskId}/completion-check")
    public Mono<ResponseEntity<CompletionCheck>> canComplete(@PathVariable String taskId) {
        QuestTask task = requireTask(taskId);
        return Mono.just(ResponseEntity.ok(lifecycleService.checkCompletion(task)));
    }

    @PostMapping("/{taskId}/photo")
    public Mono<ResponseEntity<TaskDto>> capturePhoto(@PathVariable String taskId,
            @RequestBody PhotoCaptureRequest request) {
        requireTask(taskId);
        if (request == null || request.photoBase64() == null) {
            throw badRequest("photoBase64 is required");
        }
        try {
            byte[] photo = Base64.getDecoder().decode(request.photoBase64());
            QuestTask task = proofCaptureService.capturePhoto(taskId, photo, request.capturedAt(),
                    request.motionSamples());
            return Mono.just(ResponseEntity.ok(TaskDto.from(task)));
        } catch (IllegalArgumentException e) {
            throw badRequest(e.getMessage());
        } catch (IllegalStateException e) {
            throw conflict(e.getMessage());
        }
    }

    @PostMapping("/{taskId}/location")
    public Mono<ResponseEntity<VerificationResult>> captureLocation(@PathVariable String taskId,
            @RequestBody LocationCaptureRequest request) {
        requireTask(taskId);
        if (request == null || request.latitude() == null || request.longitude() == null) {
            throw badRequest("latitude and longitude are required");
        }
        try {
            return Mono.just(ResponseEntity.ok(
                    proofCaptureService.captureLocation(taskId, request.latitude(), request.longitude())));
        } catch (IllegalArgumentException e) {
            throw badRequest(e.getMessage());
        } catch (IllegalStateException e) {
            throw conflict(e.getMessage());
        }
    }

    @PostMapping("/{taskId}/complete")
    public Mono<ResponseEntity<CompletionOutcome>> completeTask(@PathVariable String taskId,
            @RequestBody CompleteTaskRequest request) {
        requireTask(taskId);
        if (request == null || request.characterId() == null || request.characterId().isBlank()) {
            throw badRequest("characterId is required");
        }
        MiniGameOutcome outcome = request.miniGameElapsedMillis() != null && request.miniGameParMillis() != null
                ? new MiniGameOutcome(Duration.ofMillis(request.miniGameElapsedMillis()),
                        Duration.ofMillis(request.miniGameParMillis()))
                : null;
        return Mono.just(ResponseEntity.ok(
                gameEngine.completeTask(taskId, request.characterId(), request.bondId(), outcome)));
    }

    @PostMapping("/{taskId}/partner-completed")
    public Mono<ResponseEntity<RewardDelta>> partnerCompleted(@PathVariable String taskId) {
        requireTask(taskId);
        return Mono.just(ResponseEntity.ok(gameEngine.recordPartnerCompletion(taskId)));
    }

    @DeleteMapping("/{taskId}")
    public Mono<ResponseEntity<Void>> deleteTask(@PathVariable String taskId) {
        if (!taskService.deleteTask(taskId)) {
            throw notFound("Task not found: " + taskId);
        }
        return Mono.just(ResponseEntity.noContent().build());
    }

    private QuestTask requireTask(String taskId) {
        return taskService.getTask(taskId)
                .orElseThrow(() -> notFound("Task not found: " + taskId));
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field, E fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw badRequest("Invalid " + field + ": " + value);
        }
    }

    private static LocalTime parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (java.time.format.DateTimeParseException e) {
            throw badRequest("habitDueTime must be HH:mm");
        }
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    private static ResponseStatusException notFound(String reason) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, reason);
    }

    private static ResponseStatusException conflict(String reason) {
        return new ResponseStatusException(HttpStatus.CONFLICT, reason);
    }

    public record CreateTaskRequest(
            String ownerId,
            String assignedTo,
            String title,
            String description,
            String category,
            String verificationType,
            String miniGameKind,
            Integer baseExp,
            Integer baseGold,
            Instant dueDate,
            Integer minimumDurationSeconds,
            GeofenceTarget geofence,
            Boolean habit,
            String habitDueTime,
            String recurrencePattern,
            Boolean fromPartner,
            Boolean sharedWithPartner,
            Boolean coop,
            String bondId) {
    }

    public record PhotoCaptureRequest(String photoBase64, Instant capturedAt, List<Double> motionSamples) {
    }

    public record LocationCaptureRequest(Double latitude, Double longitude) {
    }

    public record CompleteTaskRequest(String characterId, String bondId, Long miniGameElapsedMillis,
            Long miniGameParMillis) {
    }
}
