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
 * Relationship shared by two paired players. Accrues its own experience.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Bond {

    private String id;
    private String memberA;
    private String memberB;

    @Builder.Default
    private int level = 1;
    private long totalExp;
    private int coopCompletions;
    private Instant createdAt;

    public boolean hasMember(String characterId) {
        return characterId != null && (characterId.equals(memberA) || characterId.equals(memberB));
    }
}
