package com.schoolhub.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness ({@code /healthz}) and readiness ({@code /readyz}) probes.
 */
@RestController
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", Instant.now(clock).toString());
    }

    /**
     * UP only after the store has been seeded.
     */
    @GetMapping("/readyz")
    public HealthResponse readyz() {
        HealthComponent store = healthEndpoint.healthForPath("store");
        String status = store != null ? store.getStatus().getCode() : "DOWN";
        return new HealthResponse(status, Instant.now(clock).toString());
    }

    public record HealthResponse(
        String status,   // "UP" | "DOWN"
        String timestamp // ISO-8601 instant
    ) {}
}
