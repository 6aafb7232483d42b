package me.questcore.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.questcore.domain.model.Bond;
import me.questcore.domain.service.BondService;
import me.questcore.domain.service.CharacterService;
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

@RestController
@RequestMapping("/api/bonds")
@RequiredArgsConstructor
public class BondsController {

    private final BondService bondService;
    private final CharacterService characterService;

    @PostMapping
    public Mono<ResponseEntity<Bond>> createBond(@RequestBody CreateBondRequest request) {
        if (request == null || request.memberA() == null || request.memberB() == null) {
            throw badRequest("memberA and memberB are required");
        }
        if (characterService.getCharacter(request.memberA()).isEmpty()) {
            throw badRequest("Unknown character: " + request.memberA());
        }
        try {
            return Mono.just(ResponseEntity.status(HttpStatus.CREATED)
                    .body(bondService.createBond(request.memberA(), request.memberB())));
        } catch (IllegalArgumentException e) {
            throw badRequest(e.getMessage());
        }
    }

    @GetMapping("/{bondId}")
    public Mono<ResponseEntity<Bond>> getBond(@PathVariable String bondId) {
        Bond bond = bondService.getBond(bondId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Bond not found: " + bondId));
        return Mono.just(ResponseEntity.ok(bond));
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record CreateBondRequest(String memberA, String memberB) {
    }
}
