package com.flagship.vote_escrow.lock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

/**
 * New lock duration, counted from now.
 */
@Value
public class ExtendLockRequest {

    @NotNull(message = "Duration is required")
    @Positive(message = "Duration must be greater than 0")
    @JsonProperty("duration_seconds")
    Long durationSeconds;
}
