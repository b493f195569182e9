package com.flagship.vote_escrow.config;

import com.flagship.vote_escrow.lock.CheckpointWriter;
import com.flagship.vote_escrow.lock.EscrowGovernance;
import com.flagship.vote_escrow.lock.LockPolicy;
import com.flagship.vote_escrow.time.LedgerClock;
import com.flagship.vote_escrow.time.SystemLedgerClock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.time.Clock;
import java.util.UUID;

/**
 * Escrow parameters from the {@code escrow.*} properties.
 *
 * Lock duration bounds are fixed for the lifetime of the ledger; team,
 * treasury, penalty, minimum amount and split permissions are only initial
 * values and can be changed through the admin API.
 */
@Configuration
@Slf4j
public class EscrowConfig {

    @Bean
    public LockPolicy lockPolicy(
            @Value("${escrow.lock.max-duration-seconds:31536000}") long maxDuration,
            @Value("${escrow.lock.min-duration-seconds:2419200}") long minDuration) {
        log.info("Lock policy: minDuration={}s, maxDuration={}s", minDuration, maxDuration);
        return new LockPolicy(maxDuration, minDuration);
    }

    @Bean
    public CheckpointWriter checkpointWriter(LockPolicy lockPolicy) {
        return new CheckpointWriter(lockPolicy);
    }

    @Bean
    public EscrowGovernance escrowGovernance(
            @Value("${escrow.team:}") String team,
            @Value("${escrow.early-withdraw.treasury:}") String treasury,
            @Value("${escrow.early-withdraw.max-penalty-bps:5000}") int penaltyBps,
            @Value("${escrow.lock.min-amount:1}") BigInteger minLockAmount,
            @Value("${escrow.split.global-enabled:false}") boolean globalSplitEnabled) {
        UUID teamId = parseHolder(team);
        if (teamId == null) {
            log.warn("No escrow.team configured; admin operations are disabled");
        }
        return new EscrowGovernance(teamId, parseHolder(treasury), penaltyBps, minLockAmount, globalSplitEnabled);
    }

    @Bean
    public LedgerClock ledgerClock(@Value("${escrow.clock.block-time-seconds:2}") long blockTimeSeconds) {
        return new SystemLedgerClock(Clock.systemUTC(), blockTimeSeconds);
    }

    private static UUID parseHolder(String value) {
        return value == null || value.isBlank() ? null : UUID.fromString(value.trim());
    }
}
