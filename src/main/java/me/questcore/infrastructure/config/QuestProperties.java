package me.questcore.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the quest engine, bound from
 * application.properties.
 *
 * <p>
 * All engine configuration is organized under the {@code quest.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - persistence location</li>
 * <li>{@link VerificationProperties} - photo freshness, motion and duration
 * gates</li>
 * <li>{@link RewardProperties} - bonus rates of the reward pipeline</li>
 * <li>{@link AnomalyProperties} - advisory completion-pattern checks</li>
 * <li>{@link DutyBoardProperties} - daily board size, claims and refresh</li>
 * <li>{@link LootProperties} - drop chances</li>
 * <li>{@link ConfirmationProperties} - two-phase confirmation lifetime</li>
 * <li>{@link SchedulerProperties} - maintenance sweep</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "quest")
@Data
public class QuestProperties {

    private StorageProperties storage = new StorageProperties();
    private VerificationProperties verification = new VerificationProperties();
    private RewardProperties rewards = new RewardProperties();
    private AnomalyProperties anomaly = new AnomalyProperties();
    private DutyBoardProperties dutyBoard = new DutyBoardProperties();
    private LootProperties loot = new LootProperties();
    private ConfirmationProperties confirmation = new ConfirmationProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.questcore/data";
    }

    @Data
    public static class VerificationProperties {
        private int photoValiditySeconds = 300;
        private int clockSkewToleranceSeconds = 10;
        private int motionWindowSize = 5;
        private int motionMinSamples = 3;
        private double motionVarianceThreshold = 0.001;
        private double defaultGeofenceRadiusMeters = 200;
        private int photoMinimumDurationSeconds = 60;
        private int physicalLocationMinimumDurationSeconds = 300;
        private int focusedLocationMinimumDurationSeconds = 120;
        private int defaultLocationMinimumDurationSeconds = 60;
    }

    @Data
    public static class RewardProperties {
        private int defaultBaseExp = 20;
        private int defaultBaseGold = 10;
        private double classAffinityRate = 0.15;
        private double routineBundleRate = 0.5;
        private double coopRate = 0.5;
        private int coopBondExp = 25;
        private int statGainConstant = 10;
        private double statGainRate = 0.1;
        private double motionBonusRate = 0.1;
        private double miniGameMaxRate = 0.5;
        private double activityConfirmationRate = 0.2;
        private double partnerConfirmationRate = 0.15;
        private int levelUpGoldPerLevel = 10;
    }

    @Data
    public static class AnomalyProperties {
        private int rapidCompletionThreshold = 5;
        private int rapidWindowMinutes = 10;
        private int excessiveDailyThreshold = 20;
        private int lateNightStartHour = 2;
        private int lateNightEndHour = 5;
        private double rapidFactor = 0.5;
        private double excessiveFactor = 0.6;
        private double lateNightFactor = 0.85;
        private double floor = 0.25;
    }

    @Data
    public static class DutyBoardProperties {
        private String poolLocation = "duties/pool.json";
        private int dutiesPerDay = 4;
        private int maxClaimsPerDay = 1;
        private int freeRefreshesPerDay = 1;
        private int paidRefreshCost = 50;
        private int claimBondExp = 8;
        private boolean bonusDutyEnabled = true;
    }

    @Data
    public static class LootProperties {
        private double equipmentChance = 0.065;
        private double materialChance = 0.35;
        private double consumableChance = 0.175;
        private double photoBonus = 0.02;
        private double locationBonus = 0.05;
        private double photoAndLocationBonus = 0.08;
    }

    @Data
    public static class ConfirmationProperties {
        private int ttlHours = 24;
    }

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;
        private int tickIntervalSeconds = 60;
    }
}
