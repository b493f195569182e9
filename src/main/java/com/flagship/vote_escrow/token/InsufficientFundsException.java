package com.flagship.vote_escrow.token;

import java.math.BigInteger;
import java.util.UUID;

/**
 * Raised when a holder cannot fund a deposit.
 */
public class InsufficientFundsException extends IllegalStateException {

    public InsufficientFundsException(UUID holder, BigInteger requested, BigInteger available) {
        super(String.format("Insufficient funds for %s: requested=%s, available=%s", holder, requested, available));
    }
}
