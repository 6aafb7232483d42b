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

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Day-streak arithmetic shared by characters and habit series.
 */
final class Streaks {

    private Streaks() {
    }

    /**
     * Streak after activity on {@code today}: unchanged (at least 1) on the same
     * day, +1 on the next day, otherwise back to 1.
     */
    static int advance(LocalDate lastActiveDay, int current, LocalDate today) {
        if (lastActiveDay == null) {
            return 1;
        }
        long gap = ChronoUnit.DAYS.between(lastActiveDay, today);
        if (gap <= 0) {
            return Math.max(1, current);
        }
        if (gap == 1) {
            return current + 1;
        }
        return 1;
    }
}
