package me.questcore.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.questcore.domain.model.RoutineBundle;
import me.questcore.domain.service.RoutineBundleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Routine bundles: groups of habits rewarded together when all are done on
 * the same day.
 */
@RestController
@RequestMapping("/api/routines")
@RequiredArgsConstructor
public class RoutinesController {

    private final RoutineBundleService routineBundleService;

    @GetMapping
    public Mono<ResponseEntity<List<RoutineBundle>>> listBundles(@RequestParam String ownerId) {
        List<RoutineBundle> bundles = routineBundleService.getBundles().stream()
                .filter(b -> ownerId.equals(b.getOwnerId()))
                .toList();
        return Mono.just(ResponseEntity.ok(bundles));
    }

    @PostMapping
    public Mono<ResponseEntity<RoutineBundle>> createBundle(@RequestBody CreateBundleRequest request) {
        if (request == null || request.ownerId() == null || request.name() == null || request.name().isBlank()) {
            throw badRequest("ownerId and name are required");
        }
        if (request.habitSeriesIds() == null) {
            throw badRequest("habitSeriesIds is required");
        }
        try {
            RoutineBundle bundle = routineBundleService.createBundle(request.ownerId(), request.name().trim(),
                    request.habitSeriesIds());
            return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(bundle));
        } catch (IllegalArgumentException e) {
            throw badRequest(e.getMessage());
        }
    }

    @DeleteMapping("/{bundleId}")
    public Mono<ResponseEntity<Void>> deactivateBundle(@PathVariable String bundleId) {
        try {
            routineBundleService.deactivateBundle(bundleId);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
        return Mono.just(ResponseEntity.noContent().build());
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record CreateBundleRequest(String ownerId, String name, List<String> habitSeriesIds) {
    }
}
