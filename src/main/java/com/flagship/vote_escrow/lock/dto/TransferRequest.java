package com.flagship.vote_escrow.lock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class TransferRequest {

    @NotNull(message = "Current owner is required")
    @JsonProperty("from")
    UUID from;

    @NotNull(message = "Recipient is required")
    @JsonProperty("to")
    UUID to;
}
