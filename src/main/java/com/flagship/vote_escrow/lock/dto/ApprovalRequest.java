package com.flagship.vote_escrow.lock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

/**
 * Delegate for one position; null clears the approval.
 */
@Value
public class ApprovalRequest {

    @JsonProperty("approved")
    UUID approved;
}
