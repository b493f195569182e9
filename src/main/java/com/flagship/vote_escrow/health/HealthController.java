package com.flagship.vote_escrow.health;

import com.flagship.vote_escrow.lock.LockQueryService;
import com.flagship.vote_escrow.outbox.OutboxService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness and readiness checks.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final LockQueryService queryService;
    private final OutboxService outboxService;

    public HealthController(LockQueryService queryService, OutboxService outboxService) {
        this.queryService = queryService;
        this.outboxService = outboxService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("globalEpoch", queryService.epoch());
        response.put("positions", queryService.positionCount());
        response.put("outboxBacklog", outboxService.countUnpublished());
        return ResponseEntity.ok(response);
    }
}
