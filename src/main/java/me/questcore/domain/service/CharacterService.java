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

import me.questcore.domain.model.CharacterClass;
import me.questcore.domain.model.PlayerCharacter;
import me.questcore.domain.model.StatType;
import me.questcore.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Character store plus the small adjustments that happen outside a task
 * completion: daily login, onboarding and stat point allocation.
 * <p>
 * Storage layout:
 * <ul>
 * <li>characters/{id}.json - one document per character</li>
 * </ul>
 */
@Service
@Slf4j
public class CharacterService {

    private static final String CHARACTERS_DIR = "characters";
    private static final int STARTING_STAT = 5;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, PlayerCharacter> cache = new ConcurrentHashMap<>();
    private final Object progressionLock = new Object();

    public CharacterService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public PlayerCharacter createCharacter(String name, CharacterClass characterClass) {
        synchronized (progressionLock) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Character name is required");
            }
            if (characterClass == null || !characterClass.isStarter()) {
                throw new IllegalArgumentException("A new character must start as a warrior, mage or archer");
            }
            PlayerCharacter character = PlayerCharacter.builder()
                    .id(UUID.randomUUID().toString())
                    .name(name)
                    .characterClass(characterClass)
                    .createdAt(clock.instant())
                    .build();
            for (StatType stat : StatType.values()) {
                character.getStats().put(stat, STARTING_STAT);
            }
            save(character);
            log.info("[Characters] Created {} '{}' ({})", characterClass, name, character.getId());
            return character;
        }
    }

    public Optional<PlayerCharacter> getCharacter(String characterId) {
        synchronized (progressionLock) {
            if (characterId == null) {
                return Optional.empty();
            }
            PlayerCharacter cached = cache.get(characterId);
            if (cached != null) {
                return Optional.of(cached);
            }
            Optional<PlayerCharacter> loaded = loadCharacter(characterId);
            loaded.ifPresent(c -> cache.put(characterId, c));
            return loaded;
        }
    }

    public void save(PlayerCharacter character) {
        synchronized (progressionLock) {
            String json;
            try {
                json = objectMapper.writeValueAsString(character);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize character " + character.getId(), e);
            }
            storagePort.putTextAtomic(CHARACTERS_DIR, character.getId() + ".json", json, true).join();
            cache.put(character.getId(), character);
        }
    }

    /**
     * Records today's login.
     *
     * @return true when this is the first login of the local day
     */
    public boolean recordDailyLogin(String characterId) {
        synchronized (progressionLock) {
            PlayerCharacter character = require(characterId);
            LocalDate today = LocalDate.now(clock);
            if (today.equals(character.getLastLoginDay())) {
                return false;
            }
            character.setLastLoginDay(today);
            save(character);
            return true;
        }
    }

    public void completeOnboarding(String characterId) {
        synchronized (progressionLock) {
            PlayerCharacter character = require(characterId);
            if (!character.isOnboardingCompleted()) {
                character.setOnboardingCompleted(true);
                save(character);
            }
        }
    }

    /**
     * Spends one unspent stat point on {@code stat}.
     */
    public PlayerCharacter allocateStatPoint(String characterId, StatType stat) {
        synchronized (progressionLock) {
            PlayerCharacter character = require(characterId);
            if (character.getUnspentStatPoints() <= 0) {
                throw new IllegalStateException("No unspent stat points");
            }
            character.setUnspentStatPoints(character.getUnspentStatPoints() - 1);
            character.addStat(stat, 1);
            save(character);
            log.info("[Characters] {} allocated a point to {}", characterId, stat);
            return character;
        }
    }

    /**
     * Monitor guarding every mutation of a cached character. Services that change
     * gold, EXP or daily counters hold it for the whole read-modify-write, so a
     * rollback in one cannot erase a concurrent change made by another.
     */
    public Object progressionLock() {
        return progressionLock;
    }

    public PlayerCharacter require(String characterId) {
        return getCharacter(characterId)
                .orElseThrow(() -> new IllegalArgumentException("Character not found: " + characterId));
    }

    private Optional<PlayerCharacter> loadCharacter(String characterId) {
        try {
            String json = storagePort.getText(CHARACTERS_DIR, characterId + ".json").join();
            if (json != null && !json.isBlank()) {
                return Optional.of(objectMapper.readValue(json, PlayerCharacter.class));
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - unreadable record treated as missing
            log.debug("[Characters] Failed to load {}: {}", characterId, e.getMessage());
        }
        return Optional.empty();
    }
}
