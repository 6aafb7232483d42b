package me.questcore;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Quest verification and reward engine.
 *
 * <p>
 * Turns real-world tasks into quests: proof of completion (photo, geofence,
 * motion, minimum duration) is verified, then experience, gold, stat points,
 * loot and bond progress are composed and committed atomically.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers, MaintenanceScheduler
 * Domain Layer       → GameEngine, VerificationEngine, DutyBoardGenerator
 * Infrastructure     → Local storage, Spring events
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code quest.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class QuestCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuestCoreApplication.class, args);
    }

}
