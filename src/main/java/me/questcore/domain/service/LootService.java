package me.questcore.domain.service;

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

import me.questcore.domain.model.LootDrop;
import me.questcore.domain.model.LootRarity;
import me.questcore.domain.model.LootType;
import me.questcore.domain.model.VerificationType;
import me.questcore.infrastructure.config.QuestProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Independent loot roll made on every completion. The only input from the
 * reward pipeline is the verification tier, which adds a few percentage points
 * to the equipment chance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LootService {

    static final List<String> EQUIPMENT = List.of("Iron Sword", "Leather Vest", "Oak Staff", "Hunter's Bow",
            "Silver Ring");
    static final List<String> MATERIALS = List.of("Ore", "Crystal", "Hide", "Herb", "Essence");
    static final List<String> CONSUMABLES = List.of("Herbal Tea", "Energy Bar", "Lucky Coin", "Trail Mix");

    private final QuestProperties properties;
    private final Random lootRandom;
    private final Clock clock;

    public Optional<LootDrop> roll(VerificationType tier, String taskId) {
        QuestProperties.LootProperties config = properties.getLoot();
        double roll = lootRandom.nextDouble();

        double equipmentCeiling = config.getEquipmentChance() + tierBonus(tier);
        double materialCeiling = equipmentCeiling + config.getMaterialChance();
        double consumableCeiling = materialCeiling + config.getConsumableChance();

        LootDrop drop;
        if (roll < equipmentCeiling) {
            drop = build(LootType.EQUIPMENT, pick(EQUIPMENT), rollRarity(), taskId);
        } else if (roll < materialCeiling) {
            drop = build(LootType.MATERIAL, pick(MATERIALS), rollRarity(), taskId);
        } else if (roll < consumableCeiling) {
            drop = build(LootType.CONSUMABLE, pick(CONSUMABLES), LootRarity.COMMON, taskId);
        } else {
            return Optional.empty();
        }
        log.debug("[Loot] Dropped {} {} ({})", drop.getRarity(), drop.getName(), drop.getType());
        return Optional.of(drop);
    }

    double tierBonus(VerificationType tier) {
        QuestProperties.LootProperties config = properties.getLoot();
        if (tier == null) {
            return 0;
        }
        return switch (tier) {
        case NONE -> 0;
        case PHOTO -> config.getPhotoBonus();
        case LOCATION -> config.getLocationBonus();
        case PHOTO_AND_LOCATION -> config.getPhotoAndLocationBonus();
        };
    }

    private LootRarity rollRarity() {
        double r = lootRandom.nextDouble();
        if (r < 0.6) {
            return LootRarity.COMMON;
        }
        if (r < 0.85) {
            return LootRarity.UNCOMMON;
        }
        if (r < 0.97) {
            return LootRarity.RARE;
        }
        return LootRarity.EPIC;
    }

    private String pick(List<String> names) {
        return names.get(lootRandom.nextInt(names.size()));
    }

    private LootDrop build(LootType type, String name, LootRarity rarity, String taskId) {
        return LootDrop.builder()
                .type(type)
                .name(name)
                .rarity(rarity)
                .sourceTaskId(taskId)
                .droppedAt(clock.instant())
                .build();
    }
}
