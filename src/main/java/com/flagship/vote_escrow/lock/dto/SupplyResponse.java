package com.flagship.vote_escrow.lock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

/**
 * Total supply at a timestamp plus the current aggregate bookkeeping.
 */
@Value
public class SupplyResponse {

    @JsonProperty("timestamp")
    long timestamp;

    @JsonProperty("total_supply")
    BigInteger totalSupply;

    @JsonProperty("permanent_lock_balance")
    BigInteger permanentLockBalance;

    @JsonProperty("epoch")
    int epoch;
}
