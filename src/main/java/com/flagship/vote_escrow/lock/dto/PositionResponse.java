package com.flagship.vote_escrow.lock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vote_escrow.lock.LockStatus;
import com.flagship.vote_escrow.lock.PositionRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.UUID;

/**
 * Position state together with its current balance.
 *
 * {@code unlock_time} is 0 while the position is permanent.
 */
@Value
@Builder
public class PositionResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("owner")
    UUID owner;

    @JsonProperty("approved")
    UUID approved;

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("unlock_time")
    long unlockTime;

    @JsonProperty("permanent")
    boolean permanent;

    @JsonProperty("status")
    LockStatus status;

    @JsonProperty("effective_start")
    long effectiveStart;

    @JsonProperty("balance")
    BigInteger balance;

    @JsonProperty("user_epoch")
    int userEpoch;

    public static PositionResponse from(PositionRecord record, BigInteger balance) {
        return PositionResponse.builder()
            .id(record.getId())
            .owner(record.getOwner())
            .approved(record.getApproved())
            .amount(record.getLocked().getAmount())
            .unlockTime(record.getLocked().getVisibleEnd())
            .permanent(record.getLocked().isPermanent())
            .status(record.getStatus())
            .effectiveStart(record.getEffectiveStart())
            .balance(balance)
            .userEpoch(record.getHistory().epoch())
            .build();
    }
}
