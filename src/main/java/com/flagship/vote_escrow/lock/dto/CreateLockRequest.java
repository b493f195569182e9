package com.flagship.vote_escrow.lock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.math.BigInteger;
import java.util.UUID;

/**
 * Request to lock tokens of the caller in a new position.
 *
 * The recipient defaults to the caller.
 */
@Value
public class CreateLockRequest {

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigInteger amount;

    @NotNull(message = "Duration is required")
    @Positive(message = "Duration must be greater than 0")
    @JsonProperty("duration_seconds")
    Long durationSeconds;

    @JsonProperty("recipient")
    UUID recipient;
}
