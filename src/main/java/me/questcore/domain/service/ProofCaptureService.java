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

import me.questcore.domain.model.QuestTask;
import me.questcore.domain.model.VerificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Stores proof captured on the device onto the task. The device supplies the
 * photo with its capture time and the acceleration samples recorded around
 * it, or the current coordinate.
 */
@Service
@Slf4j
public class ProofCaptureService {

    private final QuestTaskService taskService;
    private final VerificationEngine verificationEngine;
    private final Clock clock;

    public ProofCaptureService(QuestTaskService taskService, VerificationEngine verificationEngine, Clock clock) {
        this.taskService = taskService;
        this.verificationEngine = verificationEngine;
        this.clock = clock;
    }

    public QuestTask capturePhoto(String taskId, byte[] photo, Instant capturedAt, List<Double> motionSamples) {
        if (photo == null || photo.length == 0) {
            throw new IllegalArgumentException("Photo is empty");
        }
        QuestTask task = requireOpenTask(taskId);
        task.setPhotoData(photo);
        task.setPhotoCapturedAt(capturedAt != null ? capturedAt : clock.instant());
        task.setMotionDetected(verificationEngine.detectMotion(motionSamples));
        taskService.save(task);
        log.info("[Verification] Photo captured for '{}' (motion={})", task.getTitle(), task.isMotionDetected());
        return task;
    }

    public VerificationResult captureLocation(String taskId, double latitude, double longitude) {
        if (latitude < -90 || latitude > 90 || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Coordinate out of range: " + latitude + ", " + longitude);
        }
        QuestTask task = requireOpenTask(taskId);
        task.setVerificationLatitude(latitude);
        task.setVerificationLongitude(longitude);
        task.setLocationCapturedAt(clock.instant());
        taskService.save(task);
        VerificationResult result = verificationEngine.verifyGeofence(task);
        log.info("[Verification] Location captured for '{}': {} (inRange={})", task.getTitle(),
                result.getDistanceText(), result.isInRange());
        return result;
    }

    private QuestTask requireOpenTask(String taskId) {
        QuestTask task = taskService.getTask(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Task not found: " + taskId));
        if (task.isTerminal()) {
            throw new IllegalStateException("Task " + taskId + " is already " + task.getStatus());
        }
        return task;
    }
}
