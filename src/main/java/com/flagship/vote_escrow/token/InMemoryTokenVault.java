package com.flagship.vote_escrow.token;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token vault keeping holder balances in memory.
 *
 * Stands in for the external custody collaborator; holders are funded with
 * {@link #credit(UUID, BigInteger)}.
 */
@Component
@Slf4j
public class InMemoryTokenVault implements TokenVault {

    private final Map<UUID, BigInteger> balances = new ConcurrentHashMap<>();
    private BigInteger custody = BigInteger.ZERO;

    /**
     * Credits a holder with tokens from outside the ledger.
     */
    public synchronized void credit(UUID holder, BigInteger amount) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Credit amount must be positive");
        }
        balances.merge(holder, amount, BigInteger::add);
    }

    public BigInteger balanceOf(UUID holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    @Override
    public synchronized void pull(UUID from, BigInteger amount) {
        BigInteger available = balanceOf(from);
        if (available.compareTo(amount) < 0) {
            throw new InsufficientFundsException(from, amount, available);
        }
        balances.put(from, available.subtract(amount));
        custody = custody.add(amount);
        log.debug("Pulled {} from {} into custody", amount, from);
    }

    @Override
    public synchronized void push(UUID to, BigInteger amount) {
        if (custody.compareTo(amount) < 0) {
            throw new IllegalStateException("Custody cannot cover release of " + amount);
        }
        custody = custody.subtract(amount);
        balances.merge(to, amount, BigInteger::add);
        log.debug("Released {} from custody to {}", amount, to);
    }

    @Override
    public synchronized BigInteger custodyBalance() {
        return custody;
    }
}
