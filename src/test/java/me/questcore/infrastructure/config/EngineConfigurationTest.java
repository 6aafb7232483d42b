package me.questcore.infrastructure.config;

import me.questcore.domain.model.PlayerCharacter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngineConfigurationTest {

    @Test
    void objectMapperShouldWriteIsoInstants() throws Exception {
        ObjectMapper mapper = EngineConfiguration.objectMapper();
        PlayerCharacter hero = PlayerCharacter.builder()
                .id("hero-1")
                .createdAt(Instant.parse("2026-02-11T10:00:00Z"))
                .build();

        String json = mapper.writeValueAsString(hero);

        assertTrue(json.contains("\"createdAt\":\"2026-02-11T10:00:00Z\""), json);
    }

    @Test
    void objectMapperShouldIgnoreUnknownFields() throws Exception {
        PlayerCharacter hero = EngineConfiguration.objectMapper()
                .readValue("{\"id\":\"hero-1\",\"legacyField\":42}", PlayerCharacter.class);

        assertEquals("hero-1", hero.getId());
    }

    @Test
    void initShouldLogWithDefaults() {
        EngineConfiguration configuration = new EngineConfiguration(new QuestProperties());

        assertDoesNotThrow(configuration::init);
    }
}
