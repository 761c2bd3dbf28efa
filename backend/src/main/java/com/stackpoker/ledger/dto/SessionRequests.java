package com.stackpoker.ledger.dto;

import com.stackpoker.ledger.model.GameClassification;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

public final class SessionRequests {

    private SessionRequests() {
    }

    public record CreateSessionRequest(
            @NotBlank(message = "playerId is required")
            @Size(max = 128, message = "playerId must be at most 128 characters")
            String playerId,

            @NotNull(message = "gameClassification is required")
            GameClassification gameClassification,

            @Size(max = 255, message = "gameName must be at most 255 characters")
            String gameName,

            @Size(max = 64, message = "stakes must be at most 64 characters")
            String stakes,

            @Size(max = 255, message = "location must be at most 255 characters")
            String location,

            @Size(max = 64, message = "tournamentType must be at most 64 characters")
            String tournamentType,

            BigDecimal buyIn
    ) {
    }

    /**
     * A session that already happened, recorded directly as completed.
     */
    public record LogCompletedSessionRequest(
            @NotBlank(message = "playerId is required")
            @Size(max = 128, message = "playerId must be at most 128 characters")
            String playerId,

            @NotNull(message = "gameClassification is required")
            GameClassification gameClassification,

            @NotBlank(message = "gameName is required")
            @Size(max = 255, message = "gameName must be at most 255 characters")
            String gameName,

            @Size(max = 64, message = "stakes must be at most 64 characters")
            String stakes,

            @Size(max = 255, message = "location must be at most 255 characters")
            String location,

            @Size(max = 64, message = "tournamentType must be at most 64 characters")
            String tournamentType,

            @NotNull(message = "startedAt is required")
            @PastOrPresent(message = "startedAt must not be in the future")
            OffsetDateTime startedAt,

            @NotNull(message = "hoursPlayed is required")
            @DecimalMin(value = "0.0", inclusive = true, message = "hoursPlayed must be non-negative")
            BigDecimal hoursPlayed,

            @NotNull(message = "buyIn is required")
            BigDecimal buyIn,

            @NotNull(message = "cashout is required")
            BigDecimal cashout
    ) {
    }

    public record StartSessionRequest(
            BigDecimal buyIn
    ) {
    }

    public record ChipUpdateRequest(
            @NotNull(message = "amount is required")
            BigDecimal amount,

            String note,

            OffsetDateTime recordedAt
    ) {
    }

    public record StackAdjustmentRequest(
            @NotNull(message = "delta is required")
            BigDecimal delta,

            String note
    ) {
    }

    public record RebuyRequest(
            @NotNull(message = "amount is required")
            BigDecimal amount
    ) {
    }

    public record FinalizeSessionRequest(
            @NotNull(message = "cashout is required")
            BigDecimal cashout
    ) {
    }

    public record EditFinancialsRequest(
            BigDecimal buyIn,
            BigDecimal cashout
    ) {
        @AssertTrue(message = "buyIn or cashout is required")
        public boolean isAnyFieldPresent() {
            return buyIn != null || cashout != null;
        }
    }
}
