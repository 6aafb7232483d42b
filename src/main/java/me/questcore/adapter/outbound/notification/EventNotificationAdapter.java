package me.questcore.adapter.outbound.notification;

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

import me.questcore.domain.model.QuestNotification;
import me.questcore.infrastructure.event.SpringEventBus;
import me.questcore.port.outbound.NotificationPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Publishes player notifications as application events.
 */
@Component
@RequiredArgsConstructor
public class EventNotificationAdapter implements NotificationPort {

    private final SpringEventBus eventBus;

    @Override
    public void notify(QuestNotification notification) {
        eventBus.publish(notification);
    }
}
