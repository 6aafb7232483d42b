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
 * Whether a task may be completed right now. A rejection carries the short
 * message shown to the user and, for the duration gate, the seconds left.
 */
@Data
@Builder
public class CompletionCheck {

    private boolean allowed;
    private String reason;
    private long remainingSeconds;

    public static CompletionCheck allowed() {
        return CompletionCheck.builder()
                .allowed(true)
                .build();
    }

    public static CompletionCheck rejected(String reason) {
        return CompletionCheck.builder()
                .allowed(false)
                .reason(reason)
                .build();
    }

    public static CompletionCheck waiting(long remainingSeconds, String reason) {
        return CompletionCheck.builder()
                .allowed(false)
                .remainingSeconds(remainingSeconds)
                .reason(reason)
                .build();
    }
}
