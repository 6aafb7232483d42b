package me.questcore.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.questcore.domain.model.RewardDelta;
import me.questcore.domain.service.ConfirmationService;
import me.questcore.domain.service.GameEngine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/confirmations")
@RequiredArgsConstructor
public class ConfirmationsController {

    private final ConfirmationService confirmationService;
    private final GameEngine gameEngine;

    @PostMapping("/{token}")
    public Mono<ResponseEntity<RewardDelta>> resolve(@PathVariable String token,
            @RequestBody ConfirmationRequest request) {
        if (confirmationService.getConfirmation(token).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Confirmation not found: " + token);
        }
        boolean confirmed = request != null && Boolean.TRUE.equals(request.confirmed());
        return Mono.just(ResponseEntity.ok(gameEngine.applyConfirmation(token, confirmed)));
    }

    public record ConfirmationRequest(Boolean confirmed) {
    }
}
