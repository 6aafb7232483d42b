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
 * Every term of a completion reward, each computed against the level-scaled
 * base.
 */
@Value
@Builder
public class RewardBreakdown {

    int baseExp;
    int baseGold;
    VerificationType verificationTier;
    boolean geofenceInRange;
    double verificationMultiplier;
    int verificationBonusExp;
    int motionBonusExp;
    int classAffinityBonusExp;
    int routineBonusExp;
    int miniGameBonusExp;
    int coopBonusExp;
    int coopBonusGold;
    int coopBondExp;
    List<StatGain> statGains;
    List<AnomalyFlag> anomalyFlags;

    public int totalExp() {
        return baseExp + verificationBonusExp + motionBonusExp + classAffinityBonusExp
                + routineBonusExp + miniGameBonusExp + coopBonusExp;
    }

    public int totalGold() {
        return baseGold + coopBonusGold;
    }
}
