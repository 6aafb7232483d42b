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

/**
 * Level progression math. Pure functions with no configuration, so that the
 * same inputs always give the same thresholds and rewards.
 *
 * <p>
 * EXP is cumulative: a character at level {@code L} with {@code exp} total
 * experience can level up once {@code exp >= expThreshold(L + 1)}.
 */
public final class RewardCurve {

    /** Each level above the first adds this percentage to base rewards. */
    static final int SCALE_PERCENT_PER_LEVEL = 10;

    private RewardCurve() {
    }

    /**
     * Total EXP needed to reach {@code level}: {@code round(100 * (level-1)^1.5)}.
     */
    public static long expThreshold(int level) {
        if (level <= 1) {
            return 0;
        }
        return Math.round(100 * Math.pow(level - 1, 1.5));
    }

    /**
     * Base EXP scaled by level, {@code floor(base * (1 + 0.1 * (level-1)))}.
     * Integer arithmetic keeps the result exact.
     */
    public static int scaledExp(int baseExp, int level) {
        return scale(baseExp, level);
    }

    public static int scaledGold(int baseGold, int level) {
        return scale(baseGold, level);
    }

    /**
     * Fraction of the way from the current level threshold to the next,
     * clamped to {@code [0, 1]}.
     */
    public static double progress(long exp, int level) {
        long floor = expThreshold(level);
        long ceiling = expThreshold(level + 1);
        if (ceiling <= floor) {
            return 1.0;
        }
        double fraction = (double) (exp - floor) / (ceiling - floor);
        return Math.max(0.0, Math.min(1.0, fraction));
    }

    public static boolean isLevelUpAvailable(long exp, int level) {
        return exp >= expThreshold(level + 1);
    }

    /**
     * Bond experience needed to reach {@code level}:
     * {@code round(50 * (level-1)^1.3)}.
     */
    public static long bondExpThreshold(int level) {
        if (level <= 1) {
            return 0;
        }
        return Math.round(50 * Math.pow(level - 1, 1.3));
    }

    /**
     * Applies a fractional rate to an amount and rounds down. The epsilon absorbs
     * binary representation error such as {@code 10 * 1.5 = 14.999...}.
     */
    public static int applyRate(int amount, double rate) {
        return (int) Math.floor(amount * rate + 1e-9);
    }

    private static int scale(int base, int level) {
        if (base <= 0) {
            return 0;
        }
        int safeLevel = Math.max(1, level);
        long percent = 100L + (long) (safeLevel - 1) * SCALE_PERCENT_PER_LEVEL;
        return (int) (base * percent / 100);
    }
}
