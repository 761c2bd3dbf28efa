package com.stackpoker.ledger.dto;

import com.stackpoker.ledger.model.ChipStackUpdateSource;
import com.stackpoker.ledger.model.GameClassification;
import com.stackpoker.ledger.model.PokerSessionStatus;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class SessionResponses {

    private SessionResponses() {
    }

    public record SessionSummary(
            UUID sessionId,
            String playerId,
            GameClassification gameClassification,
            String gameName,
            String stakes,
            PokerSessionStatus status,
            BigDecimal totalBuyIn,
            BigDecimal currentStack,
            BigDecimal currentProfit,
            BigDecimal cashout,
            long elapsedActiveSeconds,
            boolean abandoned,
            OffsetDateTime startedAt,
            OffsetDateTime endedAt,
            OffsetDateTime createdAt
    ) {
    }

    public record SessionDetail(
            UUID sessionId,
            String playerId,
            GameClassification gameClassification,
            String gameName,
            String stakes,
            String location,
            String tournamentType,
            PokerSessionStatus status,
            BigDecimal baseBuyIn,
            BigDecimal totalBuyIn,
            Integer rebuyCount,
            BigDecimal currentStack,
            BigDecimal currentProfit,
            BigDecimal cashout,
            long elapsedActiveSeconds,
            boolean abandoned,
            OffsetDateTime startedAt,
            OffsetDateTime lastActiveAt,
            OffsetDateTime lastPausedAt,
            OffsetDateTime endedAt,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt,
            List<ChipUpdate> chipUpdates
    ) {
    }

    public record ChipUpdate(
            UUID updateId,
            Integer sequenceNumber,
            BigDecimal amount,
            String note,
            ChipStackUpdateSource source,
            OffsetDateTime recordedAt
    ) {
    }

    /**
     * Result of editing buy-in or cashout. Settled stakes are never recomputed; they are
     * listed so the players can agree on a reopen.
     */
    public record FinancialEditResult(
            SessionDetail session,
            List<UUID> recomputedStakeIds,
            List<UUID> settledStakeIdsOutOfSync
    ) {
    }
}
