package me.questcore.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A unit of real-world work. Created by the player, by the partner or by the
 * duty board; moves through {@link TaskStatus} and carries whatever proof was
 * captured for it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuestTask {

    private String id;
    private String ownerId;
    private String assignedTo;

    /**
     * Stable identity of a habit or recurring series. Every daily instance of
     * the same habit shares it.
     */
    private String seriesId;

    private String title;
    private String description;
    private TaskCategory category;

    @Builder.Default
    private VerificationType verificationType = VerificationType.NONE;

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    @Builder.Default
    private CompletionMode completionMode = CompletionMode.STANDARD;
    private MiniGameKind miniGameKind;

    private int baseExp;
    private int baseGold;

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant failedAt;
    private Instant expiredAt;
    private Instant dueDate;
    private Integer minimumDurationSeconds;

    private GeofenceTarget geofence;

    // captured proof
    private byte[] photoData;
    private Instant photoCapturedAt;
    private boolean motionDetected;
    private Double verificationLatitude;
    private Double verificationLongitude;
    private Instant locationCapturedAt;

    // duty board
    private boolean dutyBoardItem;
    private boolean dailyDuty;
    private boolean bonusDuty;
    private LocalDate dutyDay;

    // habits and recurrence
    private boolean habit;
    private LocalTime habitDueTime;
    private int habitStreak;
    private int habitLongestStreak;
    private LocalDate habitLastCompletedDay;
    private boolean recurring;
    private RecurrencePattern recurrencePattern;
    private LocalDate seriesAnchor;

    // partner and co-op
    private boolean fromPartner;
    private boolean sharedWithPartner;
    private boolean coop;
    private String bondId;
    private boolean partnerCompleted;
    private boolean coopBonusAwarded;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    @JsonIgnore
    public boolean isRepeating() {
        return habit || recurring;
    }

    public enum TaskStatus {
        PENDING, IN_PROGRESS, COMPLETED, FAILED, EXPIRED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == EXPIRED;
        }
    }
}
