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

@Data
@Builder
public class DutyClaimResult {

    private boolean claimed;
    private QuestTask task;
    private int claimsRemaining;
    private String reason;

    public static DutyClaimResult claimed(QuestTask task, int claimsRemaining) {
        return DutyClaimResult.builder()
                .claimed(true)
                .task(task)
                .claimsRemaining(claimsRemaining)
                .build();
    }

    public static DutyClaimResult denied(String reason) {
        return DutyClaimResult.builder()
                .claimed(false)
                .reason(reason)
                .build();
    }
}
