package com.stackpoker.ledger.mapper;

import com.stackpoker.ledger.dto.ManualStakerResponses;
import com.stackpoker.ledger.dto.SessionResponses;
import com.stackpoker.ledger.dto.StakeResponses;
import com.stackpoker.ledger.model.ChipStackUpdate;
import com.stackpoker.ledger.model.ManualStakerProfile;
import com.stackpoker.ledger.model.PokerSession;
import com.stackpoker.ledger.model.SettlementDirection;
import com.stackpoker.ledger.model.SettlementSnapshotJsonCodec;
import com.stackpoker.ledger.model.StakeContract;
import com.stackpoker.ledger.model.StakeStatus;
import com.stackpoker.ledger.model.StakeStatusEvent;
import com.stackpoker.ledger.service.LiveSessionAccumulator;
import com.stackpoker.ledger.service.SettlementCalculator;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Component
public class LedgerResponseMapper {

    private final LiveSessionAccumulator liveSessionAccumulator;
    private final SettlementCalculator settlementCalculator;

    public LedgerResponseMapper(
            LiveSessionAccumulator liveSessionAccumulator,
            SettlementCalculator settlementCalculator
    ) {
        this.liveSessionAccumulator = liveSessionAccumulator;
        this.settlementCalculator = settlementCalculator;
    }

    public SessionResponses.SessionDetail toSessionDetail(
            PokerSession session,
            List<ChipStackUpdate> updates,
            OffsetDateTime now
    ) {
        boolean initialized = liveSessionAccumulator.isInitialized(session);
        return new SessionResponses.SessionDetail(
                session.getSessionId(),
                session.getPlayerId(),
                session.getGameClassification(),
                session.getGameName(),
                session.getStakes(),
                session.getLocation(),
                session.getTournamentType(),
                session.getStatus(),
                session.getBaseBuyIn(),
                session.getTotalBuyIn(),
                session.getRebuyCount(),
                initialized ? liveSessionAccumulator.currentStack(session, updates) : null,
                initialized ? liveSessionAccumulator.currentProfit(session, updates) : null,
                session.getCashout(),
                liveSessionAccumulator.elapsedActiveSeconds(session, now),
                liveSessionAccumulator.isAbandoned(session, now),
                session.getStartedAt(),
                session.getLastActiveAt(),
                session.getLastPausedAt(),
                session.getEndedAt(),
                session.getCreatedAt(),
                session.getUpdatedAt(),
                toChipUpdateResponses(updates)
        );
    }

    public SessionResponses.SessionSummary toSessionSummary(
            PokerSession session,
            List<ChipStackUpdate> updates,
            OffsetDateTime now
    ) {
        boolean initialized = liveSessionAccumulator.isInitialized(session);
        return new SessionResponses.SessionSummary(
                session.getSessionId(),
                session.getPlayerId(),
                session.getGameClassification(),
                session.getGameName(),
                session.getStakes(),
                session.getStatus(),
                session.getTotalBuyIn(),
                initialized ? liveSessionAccumulator.currentStack(session, updates) : null,
                initialized ? liveSessionAccumulator.currentProfit(session, updates) : null,
                session.getCashout(),
                liveSessionAccumulator.elapsedActiveSeconds(session, now),
                liveSessionAccumulator.isAbandoned(session, now),
                session.getStartedAt(),
                session.getEndedAt(),
                session.getCreatedAt()
        );
    }

    public List<SessionResponses.ChipUpdate> toChipUpdateResponses(Collection<ChipStackUpdate> updates) {
        if (updates == null) {
            return List.of();
        }
        return updates.stream()
                .map(update -> new SessionResponses.ChipUpdate(
                        update.getUpdateId(),
                        update.getSequenceNumber(),
                        update.getAmount(),
                        update.getNote(),
                        update.getSource(),
                        update.getRecordedAt()
                ))
                .toList();
    }

    /**
     * @param currentFacts the session's facts right now, or null when they cannot be derived;
     *                     used to flag settled stakes whose agreed numbers no longer match
     */
    public StakeResponses.StakeDetail toStakeDetail(
            StakeContract stake,
            String stakerDisplayName,
            SettlementCalculator.SessionFacts currentFacts
    ) {
        boolean requiresResettlement = stake.getStatus() == StakeStatus.SETTLED
                && settlementCalculator.isOutOfSync(stake, currentFacts);
        return new StakeResponses.StakeDetail(
                stake.getStakeId(),
                stake.getSessionId(),
                stake.getSessionGameName(),
                stake.getSessionStakes(),
                stake.getSessionDate(),
                stake.getStakerUserId(),
                stake.getManualStakerId(),
                stakerDisplayName,
                stake.isOffAppStaker(),
                stake.getStakedPlayerId(),
                stake.getStakePercentage(),
                stake.getMarkup(),
                stake.getSessionBuyIn(),
                stake.getSessionCashout(),
                stake.getSettlementAmount(),
                SettlementDirection.of(stake.getSettlementAmount()),
                stake.getStatus(),
                stake.isTournamentSession(),
                requiresResettlement,
                stake.getReopenCount(),
                stake.getProposedAt(),
                stake.getAcceptedAt(),
                stake.getSettledAt(),
                stake.getReopenedAt(),
                stake.getSettlementInitiatorUserId(),
                stake.getSettlementConfirmerUserId(),
                stake.getSettlementInitiatedAt(),
                stake.getLastUpdatedAt()
        );
    }

    public StakeResponses.SessionStakes toSessionStakes(UUID sessionId, List<StakeResponses.StakeDetail> stakes) {
        BigDecimal totalPercentageSold = BigDecimal.ZERO;
        BigDecimal outstanding = BigDecimal.ZERO;
        BigDecimal settled = BigDecimal.ZERO;
        for (StakeResponses.StakeDetail stake : stakes) {
            if (stake.status().isUnresolved()) {
                totalPercentageSold = totalPercentageSold.add(stake.stakePercentage());
                outstanding = outstanding.add(stake.settlementAmount());
            } else if (stake.status() == StakeStatus.SETTLED) {
                totalPercentageSold = totalPercentageSold.add(stake.stakePercentage());
                settled = settled.add(stake.settlementAmount());
            }
        }
        return new StakeResponses.SessionStakes(sessionId, stakes, totalPercentageSold, outstanding, settled);
    }

    public StakeResponses.StatusEvent toStatusEvent(StakeStatusEvent event) {
        SettlementSnapshotJsonCodec.SettlementSnapshot snapshot = StringUtils.hasText(event.getSettlementSnapshotJson())
                ? SettlementSnapshotJsonCodec.fromJson(event.getSettlementSnapshotJson())
                : null;
        return new StakeResponses.StatusEvent(
                event.getEventId(),
                event.getStakeId(),
                event.getFromStatus(),
                event.getToStatus(),
                event.getAction(),
                event.getReason(),
                snapshot,
                event.getOccurredAt()
        );
    }

    public ManualStakerResponses.ManualStaker toManualStaker(ManualStakerProfile profile) {
        return new ManualStakerResponses.ManualStaker(
                profile.getProfileId(),
                profile.getCreatedByUserId(),
                profile.getDisplayName(),
                profile.getContactInfo(),
                profile.getNotes(),
                profile.getCreatedAt(),
                profile.getUpdatedAt()
        );
    }
}
