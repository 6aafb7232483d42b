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

import me.questcore.domain.model.CompletionCheck;
import me.questcore.domain.model.GeofenceTarget;
import me.questcore.domain.model.QuestTask;
import me.questcore.domain.model.TaskCategory;
import me.questcore.domain.model.VerificationResult;
import me.questcore.domain.model.VerificationType;
import me.questcore.infrastructure.config.QuestProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Stateless validators for completion proof: photo freshness, motion
 * plausibility, geofence inclusion and the minimum-duration gate.
 *
 * <p>
 * Nothing here throws for a failed check. Callers get a boolean or a result
 * object and decide whether to block completion or lower the reward tier.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VerificationEngine {

    static final double EARTH_RADIUS_METERS = 6_371_008.8;

    private final QuestProperties properties;
    private final Clock clock;

    /**
     * A photo is fresh while {@code now - capturedAt} lies in
     * {@code [-skew, validity]}. Both ends are inclusive, so a photo taken
     * exactly five minutes ago still counts.
     */
    public boolean isPhotoTimestampValid(Instant capturedAt) {
        if (capturedAt == null) {
            return false;
        }
        QuestProperties.VerificationProperties config = properties.getVerification();
        long ageMillis = Duration.between(capturedAt, clock.instant()).toMillis();
        if (ageMillis < -config.getClockSkewToleranceSeconds() * 1000L) {
            log.debug("[Verification] Photo timestamp {} is in the future", capturedAt);
            return false;
        }
        return ageMillis <= config.getPhotoValiditySeconds() * 1000L;
    }

    public VerificationResult verifyGeofence(double targetLat, double targetLon, double targetRadius,
            double userLat, double userLon) {
        double distance = distanceMeters(targetLat, targetLon, userLat, userLon);
        boolean inRange = distance <= targetRadius;
        log.debug("[Verification] Geofence distance {}m, radius {}m, inRange={}",
                Math.round(distance), targetRadius, inRange);
        return VerificationResult.builder()
                .inRange(inRange)
                .distanceMeters(distance)
                .radiusMeters(targetRadius)
                .distanceText(formatDistance(distance))
                .build();
    }

    /**
     * Checks the task's captured coordinates against its geofence. A task
     * without a geofence target counts as in range; a task without captured
     * coordinates does not.
     */
    public VerificationResult verifyGeofence(QuestTask task) {
        GeofenceTarget target = task.getGeofence();
        Double lat = task.getVerificationLatitude();
        Double lon = task.getVerificationLongitude();
        if (lat == null || lon == null) {
            double radius = target != null ? target.getRadiusMeters() : 0;
            return VerificationResult.builder()
                    .inRange(false)
                    .distanceMeters(Double.NaN)
                    .radiusMeters(radius)
                    .distanceText("unknown")
                    .build();
        }
        if (target == null) {
            return VerificationResult.builder()
                    .inRange(true)
                    .distanceMeters(0)
                    .radiusMeters(0)
                    .distanceText(formatDistance(0))
                    .build();
        }
        double radius = target.getRadiusMeters() > 0
                ? target.getRadiusMeters()
                : properties.getVerification().getDefaultGeofenceRadiusMeters();
        return verifyGeofence(target.getLatitude(), target.getLongitude(), radius, lat, lon);
    }

    /**
     * Motion heuristic over the most recent acceleration magnitudes. Fewer
     * samples than the configured minimum means "no motion", never an error.
     */
    public boolean detectMotion(List<Double> magnitudes) {
        QuestProperties.VerificationProperties config = properties.getVerification();
        if (magnitudes == null || magnitudes.size() < config.getMotionMinSamples()) {
            return false;
        }
        List<Double> window = magnitudes.subList(
                Math.max(0, magnitudes.size() - config.getMotionWindowSize()), magnitudes.size());
        double mean = window.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = window.stream()
                .mapToDouble(m -> (m - mean) * (m - mean))
                .sum() / window.size();
        return variance > config.getMotionVarianceThreshold();
    }

    /**
     * Required seconds between start and completion. An explicit value on the
     * task wins; otherwise the default depends on the proof required and, for
     * location-only proof, on the category.
     */
    public int minimumDurationSeconds(QuestTask task) {
        if (task.getMinimumDurationSeconds() != null) {
            return Math.max(0, task.getMinimumDurationSeconds());
        }
        QuestProperties.VerificationProperties config = properties.getVerification();
        VerificationType type = task.getVerificationType();
        if (type == null || type == VerificationType.NONE) {
            return 0;
        }
        if (type.requiresPhoto()) {
            return config.getPhotoMinimumDurationSeconds();
        }
        TaskCategory category = task.getCategory();
        if (category == TaskCategory.PHYSICAL) {
            return config.getPhysicalLocationMinimumDurationSeconds();
        }
        if (category == TaskCategory.MENTAL || category == TaskCategory.CREATIVE) {
            return config.getFocusedLocationMinimumDurationSeconds();
        }
        return config.getDefaultLocationMinimumDurationSeconds();
    }

    /**
     * Duration gate followed by the deadline check.
     */
    public CompletionCheck canComplete(QuestTask task) {
        CompletionCheck duration = checkMinimumDuration(task);
        if (!duration.isAllowed()) {
            return duration;
        }
        return checkDeadline(task);
    }

    public CompletionCheck checkMinimumDuration(QuestTask task) {
        int required = minimumDurationSeconds(task);
        if (required <= 0) {
            return CompletionCheck.allowed();
        }
        Instant startedAt = task.getStartedAt();
        if (startedAt == null) {
            return CompletionCheck.rejected("Start this task before completing it.");
        }
        long elapsed = Duration.between(startedAt, clock.instant()).getSeconds();
        long remaining = required - elapsed;
        if (remaining > 0) {
            return CompletionCheck.waiting(remaining,
                    "Please wait " + formatRemaining(remaining) + " before completing this task.");
        }
        return CompletionCheck.allowed();
    }

    /**
     * Checks that every proof the task requires has been captured and, for
     * photos, is still fresh.
     */
    public CompletionCheck checkProof(QuestTask task) {
        VerificationType type = task.getVerificationType();
        if (type == null || type == VerificationType.NONE) {
            return CompletionCheck.allowed();
        }
        if (type.requiresPhoto()) {
            if (task.getPhotoData() == null || task.getPhotoData().length == 0) {
                return CompletionCheck.rejected("Take a photo to verify this task.");
            }
            if (!isPhotoTimestampValid(task.getPhotoCapturedAt())) {
                return CompletionCheck.rejected("Photo has expired. Please take a new one.");
            }
        }
        if (type.requiresLocation()
                && (task.getVerificationLatitude() == null || task.getVerificationLongitude() == null)) {
            return CompletionCheck.rejected("Check in at the location to verify this task.");
        }
        return CompletionCheck.allowed();
    }

    public CompletionCheck checkDeadline(QuestTask task) {
        Instant due = task.getDueDate();
        if (due != null && clock.instant().isAfter(due)) {
            return CompletionCheck.rejected("The deadline for this task has passed.");
        }
        return CompletionCheck.allowed();
    }

    public static double distanceMeters(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(Math.max(0.0, 1 - a)));
        return EARTH_RADIUS_METERS * c;
    }

    public static String formatDistance(double meters) {
        if (meters < 1000) {
            return (int) meters + "m";
        }
        return String.format(Locale.ROOT, "%.1f km", meters / 1000);
    }

    private static String formatRemaining(long seconds) {
        long minutes = seconds / 60;
        long secs = seconds % 60;
        if (minutes == 0) {
            return secs + "s";
        }
        return minutes + "m " + secs + "s";
    }
}
