package com.stackpoker.ledger.dto;

import com.stackpoker.ledger.model.SettlementDirection;
import com.stackpoker.ledger.model.SettlementSnapshotJsonCodec;
import com.stackpoker.ledger.model.StakeAction;
import com.stackpoker.ledger.model.StakeStatus;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class StakeResponses {

    private StakeResponses() {
    }

    public record StakeDetail(
            UUID stakeId,
            UUID sessionId,
            String sessionGameName,
            String sessionStakes,
            OffsetDateTime sessionDate,
            String stakerUserId,
            UUID manualStakerId,
            String stakerDisplayName,
            boolean offAppStaker,
            String stakedPlayerId,
            BigDecimal stakePercentage,
            BigDecimal markup,
            BigDecimal sessionBuyIn,
            BigDecimal sessionCashout,
            BigDecimal settlementAmount,
            SettlementDirection settlementDirection,
            StakeStatus status,
            boolean tournamentSession,
            boolean requiresResettlement,
            Integer reopenCount,
            OffsetDateTime proposedAt,
            OffsetDateTime acceptedAt,
            OffsetDateTime settledAt,
            OffsetDateTime reopenedAt,
            String settlementInitiatorUserId,
            String settlementConfirmerUserId,
            OffsetDateTime settlementInitiatedAt,
            OffsetDateTime lastUpdatedAt
    ) {
    }

    /**
     * Stakes on one session. Totals cover stakes that are unresolved or settled; declined
     * and cancelled stakes are listed but not counted.
     */
    public record SessionStakes(
            UUID sessionId,
            List<StakeDetail> stakes,
            BigDecimal totalPercentageSold,
            BigDecimal outstandingSettlementTotal,
            BigDecimal settledTotal
    ) {
    }

    public record StatusEvent(
            UUID eventId,
            UUID stakeId,
            StakeStatus fromStatus,
            StakeStatus toStatus,
            StakeAction action,
            String reason,
            SettlementSnapshotJsonCodec.SettlementSnapshot snapshot,
            OffsetDateTime occurredAt
    ) {
    }
}
