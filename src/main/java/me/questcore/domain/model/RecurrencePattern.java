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

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Repeat schedule of a recurring task, anchored on the day the series started.
 */
public enum RecurrencePattern {
    DAILY, WEEKDAYS, WEEKENDS, WEEKLY, BIWEEKLY, MONTHLY;

    /**
     * Whether a new instance is due on {@code day} for a series anchored at
     * {@code anchor}.
     */
    public boolean isDueOn(LocalDate day, LocalDate anchor) {
        DayOfWeek dow = day.getDayOfWeek();
        boolean weekend = dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
        return switch (this) {
        case DAILY -> true;
        case WEEKDAYS -> !weekend;
        case WEEKENDS -> weekend;
        case WEEKLY -> dow == anchor.getDayOfWeek();
        case BIWEEKLY -> dow == anchor.getDayOfWeek()
                && Math.floorMod(ChronoUnit.WEEKS.between(anchor, day), 2) == 0;
        case MONTHLY -> day.getDayOfMonth() == Math.min(anchor.getDayOfMonth(), day.lengthOfMonth());
        };
    }
}
