package com.flagship.vote_escrow.lock;

import lombok.Value;

import java.math.BigInteger;
import java.util.UUID;

/**
 * Outcome of an early withdrawal: {@code payout + penalty == amount}.
 */
@Value
public class EarlyWithdrawal {
    long positionId;
    BigInteger amount;
    BigInteger penalty;
    BigInteger payout;
    UUID treasury;
}
