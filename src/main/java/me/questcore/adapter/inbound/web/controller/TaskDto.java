package me.questcore.adapter.inbound.web.controller;

import me.questcore.domain.model.GeofenceTarget;
import me.questcore.domain.model.QuestTask;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Task as exposed over HTTP. Photo bytes are never echoed back.
 */
public record TaskDto(
        String id,
        String ownerId,
        String assignedTo,
        String seriesId,
        String title,
        String description,
        String category,
        String verificationType,
        String status,
        String completionMode,
        String miniGameKind,
        int baseExp,
        int baseGold,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant dueDate,
        Integer minimumDurationSeconds,
        GeofenceTarget geofence,
        boolean hasPhoto,
        Instant photoCapturedAt,
        boolean motionDetected,
        boolean hasLocation,
        boolean dutyBoardItem,
        boolean dailyDuty,
        boolean bonusDuty,
        LocalDate dutyDay,
        boolean habit,
        int habitStreak,
        boolean recurring,
        boolean fromPartner,
        boolean sharedWithPartner,
        boolean coop,
        boolean partnerCompleted,
        boolean coopBonusAwarded) {

    static TaskDto from(QuestTask task) {
        return new TaskDto(
                task.getId(),
                task.getOwnerId(),
                task.getAssignedTo(),
                task.getSeriesId(),
                task.getTitle(),
                task.getDescription(),
                task.getCategory() != null ? task.getCategory().name() : null,
                task.getVerificationType() != null ? task.getVerificationType().name() : null,
                task.getStatus().name(),
                task.getCompletionMode() != null ? task.getCompletionMode().name() : null,
                task.getMiniGameKind() != null ? task.getMiniGameKind().name() : null,
                task.getBaseExp(),
                task.getBaseGold(),
                task.getCreatedAt(),
                task.getStartedAt(),
                task.getCompletedAt(),
                task.getDueDate(),
                task.getMinimumDurationSeconds(),
                task.getGeofence(),
                task.getPhotoData() != null && task.getPhotoData().length > 0,
                task.getPhotoCapturedAt(),
                task.isMotionDetected(),
                task.getVerificationLatitude() != null && task.getVerificationLongitude() != null,
                task.isDutyBoardItem(),
                task.isDailyDuty(),
                task.isBonusDuty(),
                task.getDutyDay(),
                task.isHabit(),
                task.getHabitStreak(),
                task.isRecurring(),
                task.isFromPartner(),
                task.isSharedWithPartner(),
                task.isCoop(),
                task.isPartnerCompleted(),
                task.isCoopBonusAwarded());
    }
}
