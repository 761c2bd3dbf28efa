package com.stackpoker.ledger.service;

import com.stackpoker.ledger.model.ChipStackUpdate;
import com.stackpoker.ledger.model.PokerSession;
import com.stackpoker.ledger.model.StakeContract;
import com.stackpoker.ledger.model.StakeStatus;
import com.stackpoker.ledger.repository.ChipStackUpdateRepository;
import com.stackpoker.ledger.repository.PokerSessionRepository;
import com.stackpoker.ledger.repository.StakeContractRepository;
import com.stackpoker.ledger.web.LedgerOperationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Keeps unresolved stakes in line with their session's buy-in and cashout. Runs inside the
 * caller's transaction so a session edit and the recomputation commit or roll back together.
 * A stake whose amount moves while a settlement awaits confirmation goes back to
 * AWAITING_SETTLEMENT, since the pending confirmation was for the old amount.
 */
@Service
@RequiredArgsConstructor
public class SettlementRecomputationService {

    private static final Logger log = LoggerFactory.getLogger(SettlementRecomputationService.class);

    private final StakeContractRepository stakeContractRepository;
    private final PokerSessionRepository pokerSessionRepository;
    private final ChipStackUpdateRepository chipStackUpdateRepository;
    private final LiveSessionAccumulator liveSessionAccumulator;
    private final SettlementCalculator settlementCalculator;
    private final StakeStatusMachine stakeStatusMachine;

    @Transactional(propagation = Propagation.MANDATORY)
    public RecomputationSummary recomputeForSession(
            PokerSession session,
            List<ChipStackUpdate> updates,
            OffsetDateTime now
    ) {
        List<StakeContract> stakes = stakeContractRepository.findBySessionIdOrderByProposedAtAsc(session.getSessionId());
        if (stakes.isEmpty() || !liveSessionAccumulator.isInitialized(session)) {
            return RecomputationSummary.empty();
        }

        SettlementCalculator.SessionFacts facts = liveSessionAccumulator.settlementFacts(session, updates);
        List<UUID> recomputed = new ArrayList<>();
        List<UUID> settledOutOfSync = new ArrayList<>();
        for (StakeContract stake : stakes) {
            if (stake.getStatus().isUnresolved()) {
                if (settlementCalculator.applyTo(stake, facts, now)) {
                    stakeStatusMachine.resetPendingConfirmation(stake, "Session financials changed", now);
                    stakeContractRepository.save(stake);
                    recomputed.add(stake.getStakeId());
                }
            } else if (stake.getStatus() == StakeStatus.SETTLED && settlementCalculator.isOutOfSync(stake, facts)) {
                settledOutOfSync.add(stake.getStakeId());
            }
        }

        if (recomputed.isEmpty()) {
            log.debug("No stake on session {} changed after recomputation", session.getSessionId());
        } else {
            log.info("Recomputed {} stake(s) on session {} against buyIn={} cashout={}",
                    recomputed.size(), session.getSessionId(), facts.buyIn(), facts.cashout());
        }
        if (!settledOutOfSync.isEmpty()) {
            log.info("{} settled stake(s) on session {} no longer match the session financials",
                    settledOutOfSync.size(), session.getSessionId());
        }
        return new RecomputationSummary(List.copyOf(recomputed), List.copyOf(settledOutOfSync));
    }

    @EventListener
    @Transactional(propagation = Propagation.MANDATORY)
    public void onSessionCompleted(SessionCompletedEvent event) {
        PokerSession session = pokerSessionRepository.findById(event.sessionId())
                .orElseThrow(() -> LedgerOperationException.sessionNotFound(
                        "Session not found: " + event.sessionId()));
        List<ChipStackUpdate> updates = chipStackUpdateRepository.findBySessionIdOrderBySequenceNumberAsc(
                event.sessionId());
        recomputeForSession(session, updates, event.completedAt());
    }

    public record RecomputationSummary(List<UUID> recomputedStakeIds, List<UUID> settledStakeIdsOutOfSync) {
        public static RecomputationSummary empty() {
            return new RecomputationSummary(List.of(), List.of());
        }
    }
}
