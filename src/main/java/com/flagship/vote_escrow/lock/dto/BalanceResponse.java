package com.flagship.vote_escrow.lock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

@Value
public class BalanceResponse {

    @JsonProperty("position_id")
    long positionId;

    @JsonProperty("timestamp")
    long timestamp;

    @JsonProperty("balance")
    BigInteger balance;
}
