package com.flagship.vote_escrow.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes gauges whose values are costly to compute on scrape.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final LedgerMetrics ledgerMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshMetrics() {
        outboxMetrics.refreshMetrics();
        ledgerMetrics.refreshMetrics();
    }
}
