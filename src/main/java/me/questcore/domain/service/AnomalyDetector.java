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

import me.questcore.domain.model.AnomalyAssessment;
import me.questcore.domain.model.AnomalyFlag;
import me.questcore.infrastructure.config.QuestProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Advisory check of a character's recent completion pattern. The resulting
 * multiplier only shrinks the verification premium; it never blocks a
 * completion.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyDetector {

    private final QuestTaskService taskService;
    private final QuestProperties properties;
    private final Clock clock;

    public AnomalyAssessment assess(String characterId) {
        QuestProperties.AnomalyProperties config = properties.getAnomaly();
        Instant now = clock.instant();
        List<AnomalyFlag> flags = new ArrayList<>();
        double multiplier = 1.0;

        Instant windowStart = now.minus(Duration.ofMinutes(config.getRapidWindowMinutes()));
        if (taskService.getCompletedSince(characterId, windowStart).size() > config.getRapidCompletionThreshold()) {
            flags.add(AnomalyFlag.RAPID_COMPLETION);
            multiplier *= config.getRapidFactor();
        }

        int hour = ZonedDateTime.ofInstant(now, clock.getZone()).getHour();
        if (hour >= config.getLateNightStartHour() && hour < config.getLateNightEndHour()) {
            flags.add(AnomalyFlag.LATE_NIGHT);
            multiplier *= config.getLateNightFactor();
        }

        Instant dayStart = LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
        if (taskService.getCompletedSince(characterId, dayStart).size() > config.getExcessiveDailyThreshold()) {
            flags.add(AnomalyFlag.EXCESSIVE_VOLUME);
            multiplier *= config.getExcessiveFactor();
        }

        if (flags.isEmpty()) {
            return AnomalyAssessment.clean();
        }
        double floored = Math.max(config.getFloor(), multiplier);
        log.info("[Verification] Anomalies for {}: {} (x{})", characterId, flags, floored);
        return new AnomalyAssessment(List.copyOf(flags), floored);
    }
}
