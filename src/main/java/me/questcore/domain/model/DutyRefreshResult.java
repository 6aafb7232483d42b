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

import java.util.List;

@Data
@Builder
public class DutyRefreshResult {

    private boolean refreshed;
    private List<QuestTask> duties;
    private long goldSpent;
    private String reason;

    public static DutyRefreshResult refreshed(List<QuestTask> duties, long goldSpent) {
        return DutyRefreshResult.builder()
                .refreshed(true)
                .duties(duties)
                .goldSpent(goldSpent)
                .build();
    }

    public static DutyRefreshResult denied(String reason) {
        return DutyRefreshResult.builder()
                .refreshed(false)
                .reason(reason)
                .build();
    }
}
