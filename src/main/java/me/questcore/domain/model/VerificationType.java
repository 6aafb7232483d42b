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

/**
 * Proof level required by (or achieved for) a task. Each tier carries a fixed
 * EXP multiplier; location tiers earn less when the capture was outside the
 * geofence.
 */
public enum VerificationType {
    NONE(1.0, 1.0),
    PHOTO(1.5, 1.5),
    LOCATION(1.0 + 0.5 * (Math.log(3) / Math.log(2)), 1.25),
    PHOTO_AND_LOCATION(2.0, 1.5);

    private final double inRangeMultiplier;
    private final double outOfRangeMultiplier;

    VerificationType(double inRangeMultiplier, double outOfRangeMultiplier) {
        this.inRangeMultiplier = inRangeMultiplier;
        this.outOfRangeMultiplier = outOfRangeMultiplier;
    }

    public boolean requiresPhoto() {
        return this == PHOTO || this == PHOTO_AND_LOCATION;
    }

    public boolean requiresLocation() {
        return this == LOCATION || this == PHOTO_AND_LOCATION;
    }

    public double multiplier(boolean locationInRange) {
        return locationInRange ? inRangeMultiplier : outOfRangeMultiplier;
    }
}
