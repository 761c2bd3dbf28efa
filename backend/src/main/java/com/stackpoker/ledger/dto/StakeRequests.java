package com.stackpoker.ledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.UUID;

public final class StakeRequests {

    private StakeRequests() {
    }

    /**
     * Exactly one of {@code stakerUserId} and {@code manualStakerId} identifies the staker.
     * Domain validation reports a missing or doubled identity with its own error code.
     */
    public record AddStakeRequest(
            @NotNull(message = "stakePercentage is required")
            BigDecimal stakePercentage,

            @NotNull(message = "markup is required")
            BigDecimal markup,

            @Size(max = 128, message = "stakerUserId must be at most 128 characters")
            String stakerUserId,

            UUID manualStakerId
    ) {
    }

    public record UpdateStakeRequest(
            @NotNull(message = "stakePercentage is required")
            BigDecimal stakePercentage,

            @NotNull(message = "markup is required")
            BigDecimal markup
    ) {
    }

    public record StakeTransitionRequest(
            @Size(max = 1000, message = "reason must be at most 1000 characters")
            String reason
    ) {
    }

    /**
     * The user acting on a two-party settlement; must be the staked player or the staker.
     */
    public record SettlementPartyRequest(
            @NotBlank(message = "actingUserId is required")
            @Size(max = 128, message = "actingUserId must be at most 128 characters")
            String actingUserId,

            @Size(max = 1000, message = "reason must be at most 1000 characters")
            String reason
    ) {
    }

    public record ReopenStakeRequest(
            @NotBlank(message = "reason is required")
            @Size(max = 1000, message = "reason must be at most 1000 characters")
            String reason
    ) {
    }
}
