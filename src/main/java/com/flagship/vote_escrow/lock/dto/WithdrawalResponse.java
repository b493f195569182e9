package com.flagship.vote_escrow.lock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vote_escrow.lock.EarlyWithdrawal;
import lombok.Value;

import java.math.BigInteger;

/**
 * Tokens released by a withdrawal; penalty is zero at expiry.
 */
@Value
public class WithdrawalResponse {

    @JsonProperty("position_id")
    long positionId;

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("penalty")
    BigInteger penalty;

    @JsonProperty("payout")
    BigInteger payout;

    public static WithdrawalResponse atExpiry(long positionId, BigInteger amount) {
        return new WithdrawalResponse(positionId, amount, BigInteger.ZERO, amount);
    }

    public static WithdrawalResponse from(EarlyWithdrawal withdrawal) {
        return new WithdrawalResponse(withdrawal.getPositionId(), withdrawal.getAmount(),
            withdrawal.getPenalty(), withdrawal.getPayout());
    }
}
