package me.questcore.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.questcore.domain.model.VerificationResult;
import me.questcore.domain.service.VerificationEngine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Stateless verification checks.
 */
@RestController
@RequestMapping("/api/verification")
@RequiredArgsConstructor
public class VerificationController {

    private final VerificationEngine verificationEngine;

    @PostMapping("/geofence")
    public Mono<ResponseEntity<VerificationResult>> verifyGeofence(@RequestBody GeofenceRequest request) {
        if (request == null || request.targetLatitude() == null || request.targetLongitude() == null
                || request.latitude() == null || request.longitude() == null) {
            throw badRequest("target and user coordinates are required");
        }
        double radius = request.radiusMeters() != null ? request.radiusMeters() : 0;
        if (radius <= 0) {
            throw badRequest("radiusMeters must be positive");
        }
        return Mono.just(ResponseEntity.ok(verificationEngine.verifyGeofence(
                request.targetLatitude(), request.targetLongitude(), radius,
                request.latitude(), request.longitude())));
    }

    @PostMapping("/photo-freshness")
    public Mono<ResponseEntity<PhotoFreshnessResponse>> photoFreshness(@RequestBody PhotoFreshnessRequest request) {
        Instant capturedAt = request != null ? request.capturedAt() : null;
        return Mono.just(ResponseEntity.ok(
                new PhotoFreshnessResponse(verificationEngine.isPhotoTimestampValid(capturedAt))));
    }

    @PostMapping("/motion")
    public Mono<ResponseEntity<MotionResponse>> detectMotion(@RequestBody MotionRequest request) {
        List<Double> samples = request != null && request.samples() != null ? request.samples() : List.of();
        return Mono.just(ResponseEntity.ok(new MotionResponse(verificationEngine.detectMotion(samples))));
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record GeofenceRequest(Double targetLatitude, Double targetLongitude, Double radiusMeters,
            Double latitude, Double longitude) {
    }

    public record PhotoFreshnessRequest(Instant capturedAt) {
    }

    public record PhotoFreshnessResponse(boolean valid) {
    }

    public record MotionRequest(List<Double> samples) {
    }

    public record MotionResponse(boolean motionDetected) {
    }
}
