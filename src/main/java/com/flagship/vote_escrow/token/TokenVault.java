package com.flagship.vote_escrow.token;

import java.math.BigInteger;
import java.util.UUID;

/**
 * Custody of the locked token, owned by an external collaborator.
 *
 * The ledger calls the vault while committing an operation, after its events
 * are serialized and before the new state is published. {@link #pull} may
 * reject (for example on insufficient funds), which aborts the operation and
 * reverts the movements already made for it; {@link #push} releases tokens
 * already in custody and must not fail for amounts the ledger holds.
 */
public interface TokenVault {

    /**
     * Moves tokens from a holder into custody.
     *
     * @throws InsufficientFundsException if the holder cannot cover the amount
     */
    void pull(UUID from, BigInteger amount);

    /**
     * Releases tokens from custody to a holder.
     */
    void push(UUID to, BigInteger amount);

    /**
     * Tokens currently in custody.
     */
    BigInteger custodyBalance();
}
