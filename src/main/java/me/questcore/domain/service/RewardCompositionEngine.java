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
import me.questcore.domain.model.CharacterClass;
import me.questcore.domain.model.CompletionMode;
import me.questcore.domain.model.MiniGameOutcome;
import me.questcore.domain.model.PlayerCharacter;
import me.questcore.domain.model.QuestTask;
import me.questcore.domain.model.RewardBreakdown;
import me.questcore.domain.model.StatGain;
import me.questcore.domain.model.VerificationResult;
import me.questcore.domain.model.VerificationType;
import me.questcore.infrastructure.config.QuestProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Computes the reward for one completion without touching any state.
 *
 * <p>
 * Terms, in order:
 * <ol>
 * <li>base EXP and gold scaled by level</li>
 * <li>verification tier multiplier on EXP, plus the motion bonus</li>
 * <li>class affinity bonus</li>
 * <li>routine bundle bonus</li>
 * <li>mini-game performance bonus</li>
 * <li>co-op bonus on EXP and gold, plus bond EXP</li>
 * <li>flat stat gain for the category's bonus stat</li>
 * </ol>
 * Every bonus is derived from the step-1 base; no term feeds into another.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RewardCompositionEngine {

    private final QuestProperties properties;

    public RewardBreakdown compose(RewardContext context) {
        QuestProperties.RewardProperties config = properties.getRewards();
        QuestTask task = context.task();
        PlayerCharacter character = context.character();

        int baseExp = RewardCurve.scaledExp(task.getBaseExp(), character.getLevel());
        int baseGold = RewardCurve.scaledGold(task.getBaseGold(), character.getLevel());

        VerificationType tier = task.getVerificationType() != null ? task.getVerificationType()
                : VerificationType.NONE;
        boolean inRange = !tier.requiresLocation()
                || (context.geofence() != null && context.geofence().isInRange());
        AnomalyAssessment anomaly = context.anomaly() != null ? context.anomaly() : AnomalyAssessment.clean();
        double multiplier = Math.max(1.0, tier.multiplier(inRange) * anomaly.multiplier());
        int verificationBonus = RewardCurve.applyRate(baseExp, multiplier) - baseExp;

        int motionBonus = tier.requiresPhoto() && task.isMotionDetected()
                ? RewardCurve.applyRate(baseExp, config.getMotionBonusRate())
                : 0;

        CharacterClass characterClass = character.getCharacterClass();
        int affinityBonus = characterClass != null && characterClass.hasAffinityFor(task.getCategory())
                ? RewardCurve.applyRate(baseExp, config.getClassAffinityRate())
                : 0;

        int routineBonus = context.bundleHabitCount() > 0
                ? RewardCurve.applyRate(baseExp, config.getRoutineBundleRate()) * context.bundleHabitCount()
                : 0;

        int miniGameBonus = 0;
        MiniGameOutcome outcome = context.miniGameOutcome();
        if (task.getCompletionMode() == CompletionMode.MINI_GAME && outcome != null) {
            miniGameBonus = RewardCurve.applyRate(baseExp, config.getMiniGameMaxRate() * outcome.performance());
        }

        int coopExp = 0;
        int coopGold = 0;
        int coopBond = 0;
        if (context.coopClosing()) {
            coopExp = RewardCurve.applyRate(baseExp, config.getCoopRate());
            coopGold = RewardCurve.applyRate(baseGold, config.getCoopRate());
            coopBond = config.getCoopBondExp();
        }

        List<StatGain> statGains = task.getCategory() == null ? List.of()
                : List.of(new StatGain(task.getCategory().getBonusStat(),
                        Math.max(1, RewardCurve.applyRate(config.getStatGainConstant(), config.getStatGainRate()))));

        RewardBreakdown breakdown = RewardBreakdown.builder()
                .baseExp(baseExp)
                .baseGold(baseGold)
                .verificationTier(tier)
                .geofenceInRange(inRange)
                .verificationMultiplier(multiplier)
                .verificationBonusExp(verificationBonus)
                .motionBonusExp(motionBonus)
                .classAffinityBonusExp(affinityBonus)
                .routineBonusExp(routineBonus)
                .miniGameBonusExp(miniGameBonus)
                .coopBonusExp(coopExp)
                .coopBonusGold(coopGold)
                .coopBondExp(coopBond)
                .statGains(statGains)
                .anomalyFlags(anomaly.flags())
                .build();
        log.debug("[GameEngine] Reward for '{}': {}", task.getTitle(), breakdown);
        return breakdown;
    }

    /**
     * Inputs of a reward computation gathered by the caller.
     *
     * @param geofence
     *            geofence check for location-verified tasks, otherwise null
     * @param bundleHabitCount
     *            habit count of the routine bundle this completion finishes, or 0
     * @param coopClosing
     *            whether this completion closes a co-op pair
     */
    public record RewardContext(QuestTask task, PlayerCharacter character, VerificationResult geofence,
            AnomalyAssessment anomaly, int bundleHabitCount, boolean coopClosing, MiniGameOutcome miniGameOutcome) {
    }
}
