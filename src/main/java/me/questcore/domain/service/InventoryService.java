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
import me.questcore.domain.model.LootType;
import me.questcore.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loot owned by each character. Stackable drops (materials and consumables of
 * the same name and rarity) merge into one entry.
 * <p>
 * Storage layout:
 * <ul>
 * <li>inventory/{characterId}.json - list of drops</li>
 * </ul>
 */
@Service
@Slf4j
public class InventoryService {

    private static final String INVENTORY_DIR = "inventory";
    private static final TypeReference<List<LootDrop>> LOOT_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private final Map<String, List<LootDrop>> cache = new ConcurrentHashMap<>();

    public InventoryService(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    public synchronized List<LootDrop> getInventory(String characterId) {
        return cache.computeIfAbsent(characterId, this::loadInventory);
    }

    public synchronized void addLoot(String characterId, LootDrop drop) {
        List<LootDrop> items = new ArrayList<>(getInventory(characterId));
        LootDrop stack = drop.getType() == LootType.EQUIPMENT ? null
                : items.stream()
                        .filter(i -> i.getType() == drop.getType()
                                && Objects.equals(i.getName(), drop.getName())
                                && i.getRarity() == drop.getRarity())
                        .findFirst()
                        .orElse(null);
        if (stack != null) {
            items.set(items.indexOf(stack), LootDrop.builder()
                    .type(stack.getType())
                    .name(stack.getName())
                    .rarity(stack.getRarity())
                    .quantity(stack.getQuantity() + drop.getQuantity())
                    .sourceTaskId(drop.getSourceTaskId())
                    .droppedAt(drop.getDroppedAt())
                    .build());
        } else {
            items.add(drop);
        }
        saveInventory(characterId, items);
    }

    private void saveInventory(String characterId, List<LootDrop> items) {
        String json;
        try {
            json = objectMapper.writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize inventory of " + characterId, e);
        }
        storagePort.putTextAtomic(INVENTORY_DIR, characterId + ".json", json, false).join();
        cache.put(characterId, items);
    }

    private List<LootDrop> loadInventory(String characterId) {
        try {
            String json = storagePort.getText(INVENTORY_DIR, characterId + ".json").join();
            if (json != null && !json.isBlank()) {
                return new ArrayList<>(objectMapper.readValue(json, LOOT_LIST_TYPE_REF));
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - missing inventory starts empty
            log.debug("[Inventory] No inventory for {}: {}", characterId, e.getMessage());
        }
        return new ArrayList<>();
    }
}
