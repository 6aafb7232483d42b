package me.questcore.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.questcore.domain.model.DutyBoard;
import me.questcore.domain.model.DutyClaimResult;
import me.questcore.domain.model.DutyRefreshResult;
import me.questcore.domain.service.CharacterService;
import me.questcore.domain.service.DutyBoardGenerator;
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

/**
 * Daily duty board of a character.
 */
@RestController
@RequestMapping("/api/duty-board/{characterId}")
@RequiredArgsConstructor
public class DutyBoardController {

    private final DutyBoardGenerator dutyBoardGenerator;
    private final CharacterService characterService;

    @GetMapping
    public Mono<ResponseEntity<DutyBoard>> getBoard(@PathVariable String characterId) {
        requireCharacter(characterId);
        return Mono.just(ResponseEntity.ok(dutyBoardGenerator.getBoard(characterId)));
    }

    @PostMapping("/refresh")
    public Mono<ResponseEntity<DutyRefreshResult>> refresh(@PathVariable String characterId) {
        requireCharacter(characterId);
        return Mono.just(ResponseEntity.ok(dutyBoardGenerator.refreshDutyBoard(characterId)));
    }

    @PostMapping("/claim/{taskId}")
    public Mono<ResponseEntity<DutyClaimResult>> claim(@PathVariable String characterId,
            @PathVariable String taskId, @RequestBody(required = false) ClaimRequest request) {
        requireCharacter(characterId);
        String bondId = request != null ? request.bondId() : null;
        boolean coop = request != null && Boolean.TRUE.equals(request.coop());
        if (coop && bondId == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "bondId is required for a co-op claim");
        }
        return Mono.just(ResponseEntity.ok(dutyBoardGenerator.claimDuty(characterId, taskId, bondId, coop)));
    }

    private void requireCharacter(String characterId) {
        if (characterService.getCharacter(characterId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Character not found: " + characterId);
        }
    }

    public record ClaimRequest(String bondId, Boolean coop) {
    }
}
