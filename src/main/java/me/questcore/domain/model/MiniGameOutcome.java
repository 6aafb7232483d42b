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

import java.time.Duration;

/**
 * Time a mini-game took against its par time. Finishing faster than par earns
 * a larger share of the mini-game bonus.
 */
public record MiniGameOutcome(Duration elapsed, Duration parTime) {

    public double performance() {
        if (elapsed == null || parTime == null || parTime.isZero() || parTime.isNegative()) {
            return 0.0;
        }
        double ratio = (double) (parTime.toMillis() - elapsed.toMillis()) / parTime.toMillis();
        return Math.max(0.0, Math.min(1.0, ratio));
    }
}
