package me.questcore.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.questcore.domain.model.CharacterClass;
import me.questcore.domain.model.LevelUpResult;
import me.questcore.domain.model.LootDrop;
import me.questcore.domain.model.PlayerCharacter;
import me.questcore.domain.model.StatType;
import me.questcore.domain.service.CharacterService;
import me.questcore.domain.service.GameEngine;
import me.questcore.domain.service.InventoryService;
import me.questcore.domain.service.RewardCurve;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/characters")
@RequiredArgsConstructor
public class CharactersController {

    private final CharacterService characterService;
    private final InventoryService inventoryService;
    private final GameEngine gameEngine;

    @PostMapping
    public Mono<ResponseEntity<CharacterDto>> createCharacter(@RequestBody CreateCharacterRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw badRequest("name is required");
        }
        CharacterClass characterClass = parseEnum(CharacterClass.class, request.characterClass(), "characterClass");
        try {
            PlayerCharacter character = characterService.createCharacter(request.name().trim(), characterClass);
            return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(CharacterDto.from(character)));
        } catch (IllegalArgumentException e) {
            throw badRequest(e.getMessage());
        }
    }

    @GetMapping("/{characterId}")
    public Mono<ResponseEntity<CharacterDto>> getCharacter(@PathVariable String characterId) {
        return Mono.just(ResponseEntity.ok(CharacterDto.from(requireCharacter(characterId))));
    }

    @PostMapping("/{characterId}/login")
    public Mono<ResponseEntity<LoginResponse>> recordLogin(@PathVariable String characterId) {
        requireCharacter(characterId);
        boolean firstToday = characterService.recordDailyLogin(characterId);
        return Mono.just(ResponseEntity.ok(new LoginResponse(firstToday)));
    }

    @PostMapping("/{characterId}/onboarding")
    public Mono<ResponseEntity<CharacterDto>> completeOnboarding(@PathVariable String characterId) {
        requireCharacter(characterId);
        characterService.completeOnboarding(characterId);
        return Mono.just(ResponseEntity.ok(CharacterDto.from(requireCharacter(characterId))));
    }

    @PostMapping("/{characterId}/level-up")
    public Mono<ResponseEntity<LevelUpResult>> levelUp(@PathVariable String characterId) {
        requireCharacter(characterId);
        return Mono.just(ResponseEntity.ok(gameEngine.levelUp(characterId)));
    }

    @PostMapping("/{characterId}/stats/{stat}")
    public Mono<ResponseEntity<CharacterDto>> allocateStatPoint(@PathVariable String characterId,
            @PathVariable String stat) {
        requireCharacter(characterId);
        StatType statType = parseEnum(StatType.class, stat, "stat");
        try {
            return Mono.just(ResponseEntity.ok(
                    CharacterDto.from(characterService.allocateStatPoint(characterId, statType))));
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @GetMapping("/{characterId}/inventory")
    public Mono<ResponseEntity<List<LootDrop>>> getInventory(@PathVariable String characterId) {
        requireCharacter(characterId);
        return Mono.just(ResponseEntity.ok(inventoryService.getInventory(characterId)));
    }

    private PlayerCharacter requireCharacter(String characterId) {
        return characterService.getCharacter(characterId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Character not found: " + characterId));
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field) {
        if (value == null || value.isBlank()) {
            throw badRequest(field + " is required");
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw badRequest("Invalid " + field + ": " + value);
        }
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record CreateCharacterRequest(String name, String characterClass) {
    }

    public record LoginResponse(boolean firstLoginToday) {
    }

    public record CharacterDto(
            String id,
            String name,
            String characterClass,
            int level,
            long currentExp,
            long nextLevelExp,
            double levelProgress,
            boolean levelUpAvailable,
            long gold,
            int unspentStatPoints,
            Map<StatType, Integer> stats,
            int currentStreak,
            int longestStreak,
            LocalDate lastActiveDay,
            boolean onboardingCompleted,
            long tasksCompleted) {

        static CharacterDto from(PlayerCharacter character) {
            return new CharacterDto(
                    character.getId(),
                    character.getName(),
                    character.getCharacterClass() != null ? character.getCharacterClass().name() : null,
                    character.getLevel(),
                    character.getCurrentExp(),
                    RewardCurve.expThreshold(character.getLevel() + 1),
                    RewardCurve.progress(character.getCurrentExp(), character.getLevel()),
                    RewardCurve.isLevelUpAvailable(character.getCurrentExp(), character.getLevel()),
                    character.getGold(),
                    character.getUnspentStatPoints(),
                    character.getStats(),
                    character.getCurrentStreak(),
                    character.getLongestStreak(),
                    character.getLastActiveDay(),
                    character.isOnboardingCompleted(),
                    character.getTasksCompleted());
        }
    }
}
