package me.questcore.infrastructure.event;

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

import me.questcore.domain.model.PartnerCompletionEvent;
import me.questcore.domain.model.QuestNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes published notifications to the log. Stands in for the device toast
 * and push transports, which live outside this service.
 */
@Component
@Slf4j
public class NotificationLogListener {

    @EventListener
    public void onNotification(QuestNotification notification) {
        log.info("[Notify] {} for {}: {} - {}", notification.type(), notification.characterId(),
                notification.title(), notification.message());
    }

    @EventListener
    public void onPartnerCompletion(PartnerCompletionEvent event) {
        log.info("[Notify] Partner update: {} completed '{}'{}", event.characterId(), event.title(),
                event.coop() ? " (co-op)" : "");
    }
}
