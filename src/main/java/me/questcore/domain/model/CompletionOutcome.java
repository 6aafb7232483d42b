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
 * What a completion call did. Rejections are user-correctable and leave all
 * state untouched; skips are missing-precondition no-ops.
 */
@Data
@Builder
public class CompletionOutcome {

    private Status status;
    private String reason;
    private TaskCompletionResult result;

    public static CompletionOutcome completed(TaskCompletionResult result) {
        return CompletionOutcome.builder()
                .status(Status.COMPLETED)
                .result(result)
                .build();
    }

    public static CompletionOutcome rejected(String reason) {
        return CompletionOutcome.builder()
                .status(Status.REJECTED)
                .reason(reason)
                .build();
    }

    public static CompletionOutcome skipped(String reason) {
        return CompletionOutcome.builder()
                .status(Status.SKIPPED)
                .reason(reason)
                .build();
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public enum Status {
        COMPLETED, REJECTED, SKIPPED
    }
}
