package me.questcore.adapter.outbound.activity;

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

import me.questcore.domain.model.ActivityConfirmation;
import me.questcore.domain.model.QuestTask;
import me.questcore.port.outbound.ActivityConfirmationPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Default activity port for deployments without a connected tracker. Reports
 * itself unavailable, so no activity confirmations are issued.
 */
@Component
public class NoActivityTrackerAdapter implements ActivityConfirmationPort {

    private static final String SOURCE = "none";

    @Override
    public CompletableFuture<ActivityConfirmation> confirmActivity(QuestTask task) {
        return CompletableFuture.completedFuture(ActivityConfirmation.unverified(SOURCE));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
