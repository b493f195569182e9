package com.flagship.vote_escrow.lock;

import com.flagship.vote_escrow.token.TokenVault;
import lombok.Value;

import java.math.BigInteger;
import java.util.UUID;

/**
 * A token movement staged by a lock operation and carried out on commit.
 */
@Value
class CustodyMove {

    enum Direction {
        PULL,
        PUSH
    }

    Direction direction;
    UUID holder;
    BigInteger amount;

    static CustodyMove pull(UUID from, BigInteger amount) {
        return new CustodyMove(Direction.PULL, from, amount);
    }

    static CustodyMove push(UUID to, BigInteger amount) {
        return new CustodyMove(Direction.PUSH, to, amount);
    }

    void applyTo(TokenVault vault) {
        if (direction == Direction.PULL) {
            vault.pull(holder, amount);
        } else {
            vault.push(holder, amount);
        }
    }

    void revertOn(TokenVault vault) {
        if (direction == Direction.PULL) {
            vault.push(holder, amount);
        } else {
            vault.pull(holder, amount);
        }
    }
}
