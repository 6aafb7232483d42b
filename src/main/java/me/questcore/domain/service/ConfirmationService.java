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

import me.questcore.domain.model.PendingConfirmation;
import me.questcore.domain.model.QuestTask;
import me.questcore.infrastructure.config.QuestProperties;
import me.questcore.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger of two-phase completion tokens. Each token resolves at most once:
 * applied, or discarded when it expires, is disputed, or its task failed.
 * <p>
 * Storage layout:
 * <ul>
 * <li>confirmations/pending.json - all tokens not yet purged</li>
 * </ul>
 */
@Service
@Slf4j
public class ConfirmationService {

    private static final String CONFIRMATIONS_DIR = "confirmations";
    private static final String CONFIRMATIONS_FILE = "pending.json";
    private static final TypeReference<List<PendingConfirmation>> CONFIRMATION_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final QuestProperties properties;
    private final Clock clock;

    private volatile List<PendingConfirmation> cache;

    public ConfirmationService(StoragePort storagePort, ObjectMapper objectMapper, QuestProperties properties,
            Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public synchronized PendingConfirmation register(QuestTask task, String characterId,
            PendingConfirmation.Kind kind, int baseExp, int baseGold) {
        PendingConfirmation confirmation = PendingConfirmation.builder()
                .token(UUID.randomUUID().toString())
                .taskId(task.getId())
                .characterId(characterId)
                .kind(kind)
                .baseExp(baseExp)
                .baseGold(baseGold)
                .createdAt(clock.instant())
                .build();
        List<PendingConfirmation> all = getConfirmations();
        all.add(confirmation);
        saveConfirmations(all);
        log.info("[Confirmations] Issued {} token for '{}'", kind, task.getTitle());
        return confirmation;
    }

    public synchronized List<PendingConfirmation> getConfirmations() {
        if (cache == null) {
            cache = loadConfirmations();
        }
        return cache;
    }

    public Optional<PendingConfirmation> getConfirmation(String token) {
        return getConfirmations().stream()
                .filter(c -> c.getToken().equals(token))
                .findFirst();
    }

    public boolean isExpired(PendingConfirmation confirmation) {
        Instant deadline = confirmation.getCreatedAt().plus(Duration.ofHours(properties.getConfirmation().getTtlHours()));
        return clock.instant().isAfter(deadline);
    }

    public synchronized void markResolved(PendingConfirmation confirmation, PendingConfirmation.State state) {
        confirmation.setState(state);
        confirmation.setResolvedAt(clock.instant());
        saveConfirmations(getConfirmations());
    }

    /**
     * Puts a token back to PENDING. Used to undo a resolution whose reward could
     * not be committed.
     */
    public synchronized void reopen(PendingConfirmation confirmation) {
        confirmation.setState(PendingConfirmation.State.PENDING);
        confirmation.setResolvedAt(null);
        saveConfirmations(getConfirmations());
    }

    /**
     * Discards every pending token of a task.
     *
     * @return number of tokens discarded
     */
    public synchronized int discardForTask(String taskId) {
        List<PendingConfirmation> pending = getConfirmations().stream()
                .filter(c -> c.getTaskId().equals(taskId))
                .filter(c -> c.getState() == PendingConfirmation.State.PENDING)
                .toList();
        for (PendingConfirmation confirmation : pending) {
            confirmation.setState(PendingConfirmation.State.DISCARDED);
            confirmation.setResolvedAt(clock.instant());
        }
        if (!pending.isEmpty()) {
            saveConfirmations(getConfirmations());
            log.info("[Confirmations] Discarded {} token(s) for task {}", pending.size(), taskId);
        }
        return pending.size();
    }

    /**
     * Discards expired pending tokens and drops resolved ones older than the
     * time-to-live.
     */
    public synchronized int purgeExpired() {
        List<PendingConfirmation> all = getConfirmations();
        int discarded = 0;
        for (PendingConfirmation confirmation : all) {
            if (confirmation.getState() == PendingConfirmation.State.PENDING && isExpired(confirmation)) {
                confirmation.setState(PendingConfirmation.State.DISCARDED);
                confirmation.setResolvedAt(clock.instant());
                discarded++;
            }
        }
        int before = all.size();
        all.removeIf(c -> c.getState() != PendingConfirmation.State.PENDING && isExpired(c));
        if (discarded > 0 || all.size() != before) {
            saveConfirmations(all);
        }
        return discarded;
    }

    private void saveConfirmations(List<PendingConfirmation> confirmations) {
        String json;
        try {
            json = objectMapper.writeValueAsString(confirmations);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize confirmations", e);
        }
        storagePort.putTextAtomic(CONFIRMATIONS_DIR, CONFIRMATIONS_FILE, json, false).join();
        cache = confirmations;
    }

    private List<PendingConfirmation> loadConfirmations() {
        try {
            String json = storagePort.getText(CONFIRMATIONS_DIR, CONFIRMATIONS_FILE).join();
            if (json != null && !json.isBlank()) {
                return new ArrayList<>(objectMapper.readValue(json, CONFIRMATION_LIST_TYPE_REF));
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - missing ledger starts empty
            log.debug("[Confirmations] No confirmations found or failed to parse: {}", e.getMessage());
        }
        return new ArrayList<>();
    }
}
