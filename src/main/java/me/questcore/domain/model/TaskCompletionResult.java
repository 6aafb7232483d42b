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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable summary of one completion, handed back to the presentation layer.
 */
@Value
@Builder
public class TaskCompletionResult {

    String taskId;
    String characterId;
    int expGained;
    int goldGained;
    double expProgressBefore;
    double expProgressAfter;
    boolean levelUpAvailable;
    List<StatGain> bonusStatGains;
    VerificationType verificationTier;
    double verificationMultiplier;
    boolean geofenceInRange;
    boolean motionDetected;
    int classAffinityBonusExp;
    boolean routineBundleCompleted;
    String routineBundleName;
    int routineBonusExp;
    int miniGameBonusExp;
    LootDrop loot;
    boolean coopTask;
    boolean coopPartnerCompleted;
    int coopBonusExp;
    int coopBonusGold;
    int coopBondExp;
    List<AnomalyFlag> anomalyFlags;
    List<String> pendingConfirmations;
}
