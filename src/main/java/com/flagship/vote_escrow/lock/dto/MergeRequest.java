package com.flagship.vote_escrow.lock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class MergeRequest {

    @NotNull(message = "Source position is required")
    @JsonProperty("from_id")
    Long fromId;
}
