package com.flagship.vote_escrow.lock;

import lombok.Value;

import java.math.BigInteger;

/**
 * Positions minted by a split; the first keeps the remainder, the second the split-off amount.
 */
@Value
public class SplitResult {
    long firstId;
    long secondId;
    BigInteger firstAmount;
    BigInteger secondAmount;
}
