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

import me.questcore.domain.model.Bond;
import me.questcore.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Store for partner bonds and their experience curve.
 * <p>
 * Storage layout:
 * <ul>
 * <li>bonds/{id}.json - one document per bond</li>
 * </ul>
 */
@Service
@Slf4j
public class BondService {

    private static final String BONDS_DIR = "bonds";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Bond> cache = new ConcurrentHashMap<>();

    public BondService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public synchronized Bond createBond(String memberA, String memberB) {
        if (memberA == null || memberA.equals(memberB)) {
            throw new IllegalArgumentException("A bond needs two different members");
        }
        Bond bond = Bond.builder()
                .id(UUID.randomUUID().toString())
                .memberA(memberA)
                .memberB(memberB)
                .createdAt(clock.instant())
                .build();
        save(bond);
        log.info("[Bonds] Created bond {} for {} and {}", bond.getId(), memberA, memberB);
        return bond;
    }

    public synchronized Optional<Bond> getBond(String bondId) {
        if (bondId == null) {
            return Optional.empty();
        }
        Bond cached = cache.get(bondId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Bond> loaded = loadBond(bondId);
        loaded.ifPresent(b -> cache.put(bondId, b));
        return loaded;
    }

    /**
     * Adds bond experience and raises the level while thresholds are met. Does
     * not persist; callers save as part of their own commit.
     *
     * @return number of levels gained
     */
    public int gainExp(Bond bond, int amount) {
        if (amount <= 0) {
            return 0;
        }
        bond.setTotalExp(bond.getTotalExp() + amount);
        int gained = 0;
        while (bond.getTotalExp() >= RewardCurve.bondExpThreshold(bond.getLevel() + 1)) {
            bond.setLevel(bond.getLevel() + 1);
            gained++;
        }
        if (gained > 0) {
            log.info("[Bonds] Bond {} reached level {}", bond.getId(), bond.getLevel());
        }
        return gained;
    }

    public synchronized void save(Bond bond) {
        String json;
        try {
            json = objectMapper.writeValueAsString(bond);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize bond " + bond.getId(), e);
        }
        storagePort.putTextAtomic(BONDS_DIR, bond.getId() + ".json", json, true).join();
        cache.put(bond.getId(), bond);
    }

    private Optional<Bond> loadBond(String bondId) {
        try {
            String json = storagePort.getText(BONDS_DIR, bondId + ".json").join();
            if (json != null && !json.isBlank()) {
                return Optional.of(objectMapper.readValue(json, Bond.class));
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - unreadable record treated as missing
            log.debug("[Bonds] Failed to load {}: {}", bondId, e.getMessage());
        }
        return Optional.empty();
    }
}
