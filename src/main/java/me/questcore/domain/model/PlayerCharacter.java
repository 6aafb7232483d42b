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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Player progression state. Day-scoped counters are stamped with the day they
 * belong to and read as zero on any other day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerCharacter {

    private String id;
    private String name;
    private CharacterClass characterClass;

    @Builder.Default
    private int level = 1;
    private long currentExp;
    private long gold;
    private int unspentStatPoints;

    @Builder.Default
    private Map<StatType, Integer> stats = new EnumMap<>(StatType.class);

    private int currentStreak;
    private int longestStreak;
    private LocalDate lastActiveDay;
    private LocalDate lastLoginDay;
    private boolean onboardingCompleted;

    private long tasksCompleted;
    private LocalDate completionDay;
    private int completionsOnDay;

    private LocalDate dutyClaimDay;
    private int dutyClaimsOnDay;
    private LocalDate shuffleDay;
    private int shufflesOnDay;
    private LocalDate dutyCompletionDay;
    private int dutiesCompletedOnDay;
    private LocalDate bonusDutyDay;

    private Instant createdAt;

    public int getStat(StatType stat) {
        return stats.getOrDefault(stat, 0);
    }

    public void addStat(StatType stat, int amount) {
        stats.merge(stat, amount, Integer::sum);
    }

    public int dutyClaimsOn(LocalDate day) {
        return day.equals(dutyClaimDay) ? dutyClaimsOnDay : 0;
    }

    public void recordDutyClaim(LocalDate day) {
        dutyClaimsOnDay = dutyClaimsOn(day) + 1;
        dutyClaimDay = day;
    }

    public int shufflesOn(LocalDate day) {
        return day.equals(shuffleDay) ? shufflesOnDay : 0;
    }

    public void recordShuffle(LocalDate day) {
        shufflesOnDay = shufflesOn(day) + 1;
        shuffleDay = day;
    }

    public int dutiesCompletedOn(LocalDate day) {
        return day.equals(dutyCompletionDay) ? dutiesCompletedOnDay : 0;
    }

    public void recordDutyCompletion(LocalDate day) {
        dutiesCompletedOnDay = dutiesCompletedOn(day) + 1;
        dutyCompletionDay = day;
    }

    public int completionsOn(LocalDate day) {
        return day.equals(completionDay) ? completionsOnDay : 0;
    }

    public void recordCompletion(LocalDate day) {
        completionsOnDay = completionsOn(day) + 1;
        completionDay = day;
        tasksCompleted++;
    }
}
