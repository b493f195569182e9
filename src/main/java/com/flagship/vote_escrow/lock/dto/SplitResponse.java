package com.flagship.vote_escrow.lock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vote_escrow.lock.SplitResult;
import lombok.Value;

import java.math.BigInteger;

@Value
public class SplitResponse {

    @JsonProperty("source_id")
    long sourceId;

    @JsonProperty("first_id")
    long firstId;

    @JsonProperty("first_amount")
    BigInteger firstAmount;

    @JsonProperty("second_id")
    long secondId;

    @JsonProperty("second_amount")
    BigInteger secondAmount;

    public static SplitResponse from(long sourceId, SplitResult result) {
        return new SplitResponse(sourceId, result.getFirstId(), result.getFirstAmount(),
            result.getSecondId(), result.getSecondAmount());
    }
}
