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

import me.questcore.domain.model.DutyTemplate;
import me.questcore.infrastructure.config.QuestProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Template pool for the duty board, read once from a classpath JSON resource.
 */
@Service
@Slf4j
public class DutyPoolService {

    private static final TypeReference<List<DutyTemplate>> TEMPLATE_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final QuestProperties properties;

    private volatile List<DutyTemplate> templates;

    public DutyPoolService(ObjectMapper objectMapper, QuestProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public synchronized List<DutyTemplate> getTemplates() {
        if (templates == null) {
            templates = loadTemplates(properties.getDutyBoard().getPoolLocation());
        }
        return templates;
    }

    private List<DutyTemplate> loadTemplates(String location) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            List<DutyTemplate> loaded = List.copyOf(objectMapper.readValue(in, TEMPLATE_LIST_TYPE_REF));
            if (loaded.isEmpty()) {
                throw new IllegalStateException("Duty pool is empty: " + location);
            }
            log.info("[DutyBoard] Loaded {} duty templates from {}", loaded.size(), location);
            return loaded;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load duty pool: " + location, e);
        }
    }
}
