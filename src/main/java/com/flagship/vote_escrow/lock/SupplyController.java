package com.flagship.vote_escrow.lock;

import com.flagship.vote_escrow.lock.dto.PointResponse;
import com.flagship.vote_escrow.lock.dto.SupplyResponse;
import com.flagship.vote_escrow.time.LedgerClock;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.Map;

/**
 * Aggregate queries and the global checkpoint trigger.
 */
@RestController
@RequiredArgsConstructor
public class SupplyController {

    private final LockQueryService queryService;
    private final LockService lockService;
    private final LedgerClock clock;

    @GetMapping("/api/supply")
    public ResponseEntity<SupplyResponse> totalSupply(
            @RequestParam(value = "timestamp", required = false) Long timestamp) {
        long at = timestamp != null ? timestamp : clock.currentTimestamp();
        return ResponseEntity.ok(new SupplyResponse(at, queryService.totalSupplyAt(at),
            queryService.permanentLockBalance(), queryService.epoch()));
    }

    @GetMapping("/api/points/{epoch}")
    public ResponseEntity<PointResponse> globalPoint(@PathVariable("epoch") int epoch) {
        return ResponseEntity.ok(PointResponse.from(epoch, queryService.pointHistory(epoch)));
    }

    @GetMapping("/api/slope-changes/{timestamp}")
    public ResponseEntity<Map<String, BigInteger>> slopeChange(@PathVariable("timestamp") long timestamp) {
        return ResponseEntity.ok(Map.of("slope_change", queryService.slopeChange(timestamp)));
    }

    @PostMapping("/api/checkpoint")
    public ResponseEntity<SupplyResponse> checkpoint() {
        lockService.checkpoint();
        long now = clock.currentTimestamp();
        return ResponseEntity.ok(new SupplyResponse(now, queryService.totalSupplyAt(now),
            queryService.permanentLockBalance(), queryService.epoch()));
    }
}
