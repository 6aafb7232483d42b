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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Second phase of a completion. The token is handed out when the guaranteed
 * reward is committed; resolving it applies an additive delta at most once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingConfirmation {

    private String token;
    private String taskId;
    private String characterId;
    private Kind kind;
    private int baseExp;
    private int baseGold;
    private Instant createdAt;

    @Builder.Default
    private State state = State.PENDING;
    private Instant resolvedAt;

    public enum Kind {
        ACTIVITY, PARTNER
    }

    public enum State {
        PENDING, APPLIED, DISCARDED
    }
}
