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
import lombok.Data;

/**
 * Additive reward granted after the original completion was committed: a
 * resolved confirmation or a late co-op pairing. {@code reference} is the
 * confirmation token or the task id.
 */
@Data
@Builder
public class RewardDelta {

    private String reference;
    private boolean applied;
    private int expGained;
    private int goldGained;
    private String reason;

    public static RewardDelta applied(String reference, int expGained, int goldGained) {
        return RewardDelta.builder()
                .reference(reference)
                .applied(true)
                .expGained(expGained)
                .goldGained(goldGained)
                .build();
    }

    public static RewardDelta ignored(String reference, String reason) {
        return RewardDelta.builder()
                .reference(reference)
                .applied(false)
                .reason(reason)
                .build();
    }
}
