package com.flagship.vote_escrow.lock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.vote_escrow.balance.Wad;
import com.flagship.vote_escrow.config.JacksonConfig;
import com.flagship.vote_escrow.observability.EscrowMetrics;
import com.flagship.vote_escrow.outbox.OutboxService;
import com.flagship.vote_escrow.time.EpochTime;
import com.flagship.vote_escrow.time.ManualLedgerClock;
import com.flagship.vote_escrow.token.InMemoryTokenVault;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigInteger;
import java.util.UUID;

/**
 * Wires the escrow engine without Spring, on a manual clock that starts at a
 * week boundary.
 */
class EscrowFixture {

    static final long WEEK = EpochTime.WEEK;
    static final long DAY = 86_400L;
    static final long MAX_TIME = 365 * DAY;
    static final long MIN_TIME = 28 * DAY;
    static final long START = 2810 * WEEK;
    static final int PENALTY_BPS = 5_000;

    static final BigInteger UNIT = BigInteger.TEN.pow(18);

    static final UUID TEAM = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    static final UUID TREASURY = UUID.fromString("00000000-0000-0000-0000-00000000000b");
    static final UUID ALICE = UUID.fromString("00000000-0000-0000-0000-0000000a11ce");
    static final UUID BOB = UUID.fromString("00000000-0000-0000-0000-000000000b0b");
    static final UUID CAROL = UUID.fromString("00000000-0000-0000-0000-0000000ca201");

    final ManualLedgerClock clock = new ManualLedgerClock(START);
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    final InMemoryTokenVault vault = new InMemoryTokenVault();
    final LockPolicy policy = new LockPolicy(MAX_TIME, MIN_TIME);
    final EscrowMetrics metrics = new EscrowMetrics(meterRegistry);
    final OutboxService outboxService;
    final EscrowStore store;
    final EscrowGovernance governance;
    final LockService lockService;
    final LockQueryService queryService;
    final OwnershipService ownershipService;
    final EscrowAdminService adminService;

    EscrowFixture() {
        this(TREASURY);
    }

    EscrowFixture(UUID treasury) {
        this(treasury, new JacksonConfig().objectMapper());
    }

    EscrowFixture(UUID treasury, ObjectMapper eventMapper) {
        outboxService = new OutboxService(eventMapper);
        store = new EscrowStore(clock, outboxService, vault);
        governance = new EscrowGovernance(TEAM, treasury, PENALTY_BPS, BigInteger.ONE, false);
        lockService = new LockService(store, new CheckpointWriter(policy), policy, governance, metrics);
        queryService = new LockQueryService(store, clock);
        ownershipService = new OwnershipService(store, metrics);
        adminService = new EscrowAdminService(store, governance);

        vault.credit(ALICE, units(10_000));
        vault.credit(BOB, units(10_000));
    }

    static BigInteger units(long value) {
        return UNIT.multiply(BigInteger.valueOf(value));
    }

    /**
     * Balance of a lock checkpointed at or before {@code timestamp}: {@code amount * (end - t) / MAXTIME}
     * in WAD precision, rounded down.
     */
    static BigInteger expectedBalance(BigInteger amount, long end, long timestamp) {
        if (timestamp >= end) {
            return BigInteger.ZERO;
        }
        BigInteger slope = amount.multiply(Wad.WAD).divide(BigInteger.valueOf(MAX_TIME));
        return slope.multiply(BigInteger.valueOf(end - timestamp)).divide(Wad.WAD);
    }

    BigInteger sumOfBalancesAt(long timestamp) {
        BigInteger sum = BigInteger.ZERO;
        for (PositionRecord record : store.allPositions()) {
            sum = sum.add(queryService.balanceAt(record.getId(), timestamp));
        }
        return sum;
    }
}
