package com.flagship.vote_escrow.lock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.math.BigInteger;
import java.util.UUID;

/**
 * Request bodies of the team-only admin API.
 */
public final class AdminRequests {

    private AdminRequests() {
    }

    @Value
    public static class TeamRequest {
        @NotNull(message = "Team is required")
        @JsonProperty("team")
        UUID team;
    }

    /**
     * A null account toggles splitting for everyone.
     */
    @Value
    public static class SplitPermissionRequest {
        @JsonProperty("account")
        UUID account;

        @NotNull(message = "Enabled flag is required")
        @JsonProperty("enabled")
        Boolean enabled;
    }

    @Value
    public static class TreasuryRequest {
        @NotNull(message = "Treasury is required")
        @JsonProperty("treasury")
        UUID treasury;
    }

    @Value
    public static class PenaltyRequest {
        @NotNull(message = "Penalty is required")
        @JsonProperty("penalty_bps")
        Integer penaltyBps;
    }

    @Value
    public static class MinLockAmountRequest {
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be greater than 0")
        @JsonProperty("amount")
        BigInteger amount;
    }
}
