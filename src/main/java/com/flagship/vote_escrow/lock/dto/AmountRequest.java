package com.flagship.vote_escrow.lock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.math.BigInteger;

/**
 * Amount for deposits, amount increases and splits.
 */
@Value
public class AmountRequest {

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigInteger amount;
}
