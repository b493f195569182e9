package com.flagship.vote_escrow.lock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class OperatorRequest {

    @NotNull(message = "Operator is required")
    @JsonProperty("operator")
    UUID operator;

    @NotNull(message = "Approved flag is required")
    @JsonProperty("approved")
    Boolean approved;
}
