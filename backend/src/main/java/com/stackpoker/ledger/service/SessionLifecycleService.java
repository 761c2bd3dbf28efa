package com.stackpoker.ledger.service;

import com.stackpoker.ledger.config.LedgerRuntimeProperties;
import com.stackpoker.ledger.dto.SessionRequests;
import com.stackpoker.ledger.dto.SessionResponses;
import com.stackpoker.ledger.mapper.LedgerResponseMapper;
import com.stackpoker.ledger.model.ChipStackUpdate;
import com.stackpoker.ledger.model.PokerSession;
import com.stackpoker.ledger.model.PokerSessionStatus;
import com.stackpoker.ledger.repository.PokerSessionRepository;
import com.stackpoker.ledger.web.LedgerOperationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Session lifecycle: setup, start, pause/resume, ending, completion and post-completion
 * edits. Every mutation locks the session row for the length of its transaction.
 */
@Service
@RequiredArgsConstructor
public class SessionLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleService.class);
    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

    private final PokerSessionRepository pokerSessionRepository;
    private final SessionEventLog sessionEventLog;
    private final LiveSessionAccumulator liveSessionAccumulator;
    private final SettlementRecomputationService settlementRecomputationService;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final LedgerResponseMapper ledgerResponseMapper;
    private final LedgerRuntimeProperties ledgerRuntimeProperties;

    @Transactional
    public SessionResponses.SessionDetail createSession(
            SessionRequests.CreateSessionRequest request,
            OffsetDateTime now
    ) {
        PokerSession session = new PokerSession();
        session.setSessionId(UUID.randomUUID());
        session.setPlayerId(request.playerId().trim());
        session.setGameClassification(request.gameClassification());
        session.setGameName(trimToNull(request.gameName()));
        session.setStakes(trimToNull(request.stakes()));
        session.setLocation(trimToNull(request.location()));
        session.setTournamentType(trimToNull(request.tournamentType()));
        session.setStatus(PokerSessionStatus.SETUP);
        if (request.buyIn() != null) {
            BigDecimal buyIn = requireNonNegative(request.buyIn(), "Buy-in");
            session.setBaseBuyIn(buyIn);
            session.setTotalBuyIn(buyIn);
        }
        session.setCreatedAt(now);
        session.setUpdatedAt(now);

        PokerSession saved = pokerSessionRepository.save(session);
        log.info("Created session {} for player {}", saved.getSessionId(), saved.getPlayerId());
        return ledgerResponseMapper.toSessionDetail(saved, List.of(), now);
    }

    /**
     * Records a session that was played without live tracking. It starts out COMPLETED and
     * never passes through the live states.
     */
    @Transactional
    public SessionResponses.SessionDetail logCompletedSession(
            SessionRequests.LogCompletedSessionRequest request,
            OffsetDateTime now
    ) {
        BigDecimal buyIn = requireNonNegative(request.buyIn(), "Buy-in");
        BigDecimal cashout = requireNonNegative(request.cashout(), "Cashout");
        if (request.hoursPlayed() == null || request.hoursPlayed().signum() < 0) {
            throw LedgerOperationException.invalidAmount("Hours played must be zero or greater");
        }
        long elapsedSeconds = request.hoursPlayed()
                .multiply(SECONDS_PER_HOUR)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();

        PokerSession session = new PokerSession();
        session.setSessionId(UUID.randomUUID());
        session.setPlayerId(request.playerId().trim());
        session.setGameClassification(request.gameClassification());
        session.setGameName(request.gameName().trim());
        session.setStakes(trimToNull(request.stakes()));
        session.setLocation(trimToNull(request.location()));
        session.setTournamentType(trimToNull(request.tournamentType()));
        session.setStatus(PokerSessionStatus.COMPLETED);
        session.setBaseBuyIn(buyIn);
        session.setTotalBuyIn(buyIn);
        session.setCashout(cashout);
        session.setElapsedActiveSeconds(elapsedSeconds);
        session.setStartedAt(request.startedAt());
        session.setEndedAt(request.startedAt().plusSeconds(elapsedSeconds));
        session.setCreatedAt(now);
        session.setUpdatedAt(now);

        PokerSession saved = pokerSessionRepository.save(session);
        log.info("Logged completed session {} for player {} (buyIn={}, cashout={})",
                saved.getSessionId(), saved.getPlayerId(), buyIn, cashout);
        return ledgerResponseMapper.toSessionDetail(saved, List.of(), now);
    }

    @Transactional
    public SessionResponses.SessionDetail startSession(UUID sessionId, BigDecimal buyIn, OffsetDateTime now) {
        PokerSession session = lockSession(sessionId);
        liveSessionAccumulator.requireTransition(session, PokerSessionStatus.ACTIVE);
        if (!StringUtils.hasText(session.getGameName())) {
            throw LedgerOperationException.invalidTransition("A game must be selected before starting the session");
        }
        BigDecimal startingBuyIn = buyIn != null ? scaleMoney(buyIn) : session.getTotalBuyIn();
        if (startingBuyIn == null || startingBuyIn.signum() <= 0) {
            throw LedgerOperationException.invalidAmount("A positive buy-in is required to start the session");
        }

        session.setBaseBuyIn(startingBuyIn);
        session.setTotalBuyIn(startingBuyIn);
        session.setStatus(PokerSessionStatus.ACTIVE);
        session.setStartedAt(now);
        session.setLastActiveAt(now);
        session.setElapsedActiveSeconds(0L);
        session.setUpdatedAt(now);
        pokerSessionRepository.save(session);

        log.info("Session {} started with buy-in {}", sessionId, startingBuyIn);
        return detail(session, now);
    }

    @Transactional
    public SessionResponses.SessionDetail pauseSession(UUID sessionId, OffsetDateTime now) {
        PokerSession session = lockSession(sessionId);
        requireStatus(session, PokerSessionStatus.ACTIVE, "pause");
        foldActiveTime(session, now);
        session.setStatus(PokerSessionStatus.PAUSED);
        session.setLastPausedAt(now);
        session.setUpdatedAt(now);
        pokerSessionRepository.save(session);

        log.info("Session {} paused after {}s of play", sessionId, session.getElapsedActiveSeconds());
        return detail(session, now);
    }

    @Transactional
    public SessionResponses.SessionDetail resumeSession(UUID sessionId, OffsetDateTime now) {
        PokerSession session = lockSession(sessionId);
        requireStatus(session, PokerSessionStatus.PAUSED, "resume");
        session.setStatus(PokerSessionStatus.ACTIVE);
        session.setLastActiveAt(now);
        session.setUpdatedAt(now);
        pokerSessionRepository.save(session);

        log.info("Session {} resumed", sessionId);
        return detail(session, now);
    }

    /**
     * Moves a live session to ENDING. The clock stops here; the session still needs a
     * cashout to complete.
     */
    @Transactional
    public SessionResponses.SessionDetail requestEnd(UUID sessionId, OffsetDateTime now) {
        PokerSession session = lockSession(sessionId);
        if (session.getStatus() != PokerSessionStatus.ACTIVE && session.getStatus() != PokerSessionStatus.PAUSED) {
            throw LedgerOperationException.invalidTransition(
                    "Only an ACTIVE or PAUSED session can be ended, current: " + session.getStatus());
        }
        foldActiveTime(session, now);
        session.setStatus(PokerSessionStatus.ENDING);
        session.setUpdatedAt(now);
        pokerSessionRepository.save(session);

        log.info("Session {} is ending", sessionId);
        return detail(session, now);
    }

    @Transactional
    public SessionResponses.SessionDetail cancelEnding(UUID sessionId, OffsetDateTime now) {
        PokerSession session = lockSession(sessionId);
        requireStatus(session, PokerSessionStatus.ENDING, "cancel ending of");
        session.setStatus(PokerSessionStatus.PAUSED);
        session.setLastPausedAt(now);
        session.setUpdatedAt(now);
        pokerSessionRepository.save(session);

        log.info("Ending cancelled for session {}, session is paused", sessionId);
        return detail(session, now);
    }

    /**
     * Completes the session with its final cashout and publishes a
     * {@link SessionCompletedEvent}; attached stakes are recomputed before this returns.
     */
    @Transactional
    public SessionResponses.SessionDetail finalizeSession(UUID sessionId, BigDecimal cashout, OffsetDateTime now) {
        PokerSession session = lockSession(sessionId);
        liveSessionAccumulator.requireTransition(session, PokerSessionStatus.COMPLETED);
        BigDecimal finalCashout = requireNonNegative(cashout, "Cashout");
        liveSessionAccumulator.totalBuyIn(session);

        foldActiveTime(session, now);
        session.setCashout(finalCashout);
        session.setStatus(PokerSessionStatus.COMPLETED);
        session.setEndedAt(now);
        session.setUpdatedAt(now);
        pokerSessionRepository.save(session);

        log.info("Session {} completed: buyIn={}, cashout={}",
                sessionId, session.getTotalBuyIn(), finalCashout);
        applicationEventPublisher.publishEvent(new SessionCompletedEvent(
                session.getSessionId(),
                session.getPlayerId(),
                session.getTotalBuyIn(),
                finalCashout,
                now
        ));
        return detail(session, now);
    }

    @Transactional
    public SessionResponses.SessionDetail appendChipUpdate(
            UUID sessionId,
            SessionRequests.ChipUpdateRequest request,
            OffsetDateTime now
    ) {
        PokerSession session = lockSession(sessionId);
        OffsetDateTime recordedAt = request.recordedAt() != null ? request.recordedAt() : now;
        sessionEventLog.appendChipUpdate(session, request.amount(), request.note(), recordedAt);
        return saveAndRecompute(session, now);
    }

    @Transactional
    public SessionResponses.SessionDetail adjustStack(
            UUID sessionId,
            SessionRequests.StackAdjustmentRequest request,
            OffsetDateTime now
    ) {
        PokerSession session = lockSession(sessionId);
        sessionEventLog.appendAdjustment(session, request.delta(), request.note(), now);
        return saveAndRecompute(session, now);
    }

    @Transactional
    public SessionResponses.SessionDetail appendRebuy(
            UUID sessionId,
            SessionRequests.RebuyRequest request,
            OffsetDateTime now
    ) {
        PokerSession session = lockSession(sessionId);
        sessionEventLog.appendRebuy(session, request.amount(), now);
        return saveAndRecompute(session, now);
    }

    /**
     * Edits total buy-in and/or cashout. Cashout can only be edited once the session is
     * completed. Unresolved stakes are recomputed in the same transaction; settled stakes
     * are reported but left as agreed.
     */
    @Transactional
    public SessionResponses.FinancialEditResult editFinancials(
            UUID sessionId,
            SessionRequests.EditFinancialsRequest request,
            OffsetDateTime now
    ) {
        if (request.buyIn() == null && request.cashout() == null) {
            throw LedgerOperationException.invalidAmount("buyIn or cashout is required");
        }
        BigDecimal buyIn = request.buyIn() != null ? requireNonNegative(request.buyIn(), "Buy-in") : null;
        BigDecimal cashout = request.cashout() != null ? requireNonNegative(request.cashout(), "Cashout") : null;

        PokerSession session = lockSession(sessionId);
        if (cashout != null && session.getStatus() != PokerSessionStatus.COMPLETED) {
            throw LedgerOperationException.invalidTransition(
                    "Cashout can only be edited on a completed session, current: " + session.getStatus());
        }

        if (buyIn != null) {
            if (session.getStatus() == PokerSessionStatus.SETUP || session.getBaseBuyIn() == null) {
                session.setBaseBuyIn(buyIn);
            }
            session.setTotalBuyIn(buyIn);
        }
        if (cashout != null) {
            session.setCashout(cashout);
        }
        session.setUpdatedAt(now);
        pokerSessionRepository.save(session);

        List<ChipStackUpdate> updates = sessionEventLog.readUpdates(sessionId);
        SettlementRecomputationService.RecomputationSummary summary =
                settlementRecomputationService.recomputeForSession(session, updates, now);
        log.info("Edited financials of session {}: buyIn={}, cashout={}",
                sessionId, session.getTotalBuyIn(), session.getCashout());
        return new SessionResponses.FinancialEditResult(
                ledgerResponseMapper.toSessionDetail(session, updates, now),
                summary.recomputedStakeIds(),
                summary.settledStakeIdsOutOfSync()
        );
    }

    @Transactional(readOnly = true)
    public SessionResponses.SessionDetail getSession(UUID sessionId, OffsetDateTime now) {
        PokerSession session = pokerSessionRepository.findById(sessionId)
                .orElseThrow(() -> LedgerOperationException.sessionNotFound("Session not found: " + sessionId));
        return detail(session, now);
    }

    @Transactional(readOnly = true)
    public List<SessionResponses.SessionSummary> listSessionsForPlayer(String playerId, OffsetDateTime now) {
        return pokerSessionRepository.findByPlayerIdOrderByCreatedAtDesc(playerId).stream()
                .map(session -> ledgerResponseMapper.toSessionSummary(
                        session,
                        sessionEventLog.readUpdates(session.getSessionId()),
                        now))
                .toList();
    }

    private SessionResponses.SessionDetail saveAndRecompute(PokerSession session, OffsetDateTime now) {
        pokerSessionRepository.save(session);
        List<ChipStackUpdate> updates = sessionEventLog.readUpdates(session.getSessionId());
        settlementRecomputationService.recomputeForSession(session, updates, now);
        return ledgerResponseMapper.toSessionDetail(session, updates, now);
    }

    private SessionResponses.SessionDetail detail(PokerSession session, OffsetDateTime now) {
        return ledgerResponseMapper.toSessionDetail(session, sessionEventLog.readUpdates(session.getSessionId()), now);
    }

    private void foldActiveTime(PokerSession session, OffsetDateTime now) {
        if (session.getStatus() != PokerSessionStatus.ACTIVE) {
            return;
        }
        session.setElapsedActiveSeconds(liveSessionAccumulator.elapsedActiveSeconds(session, now));
        session.setLastActiveAt(null);
    }

    private PokerSession lockSession(UUID sessionId) {
        return pokerSessionRepository.findBySessionIdForUpdate(sessionId)
                .orElseThrow(() -> LedgerOperationException.sessionNotFound("Session not found: " + sessionId));
    }

    private static void requireStatus(PokerSession session, PokerSessionStatus expected, String action) {
        if (session.getStatus() != expected) {
            throw LedgerOperationException.invalidTransition(
                    "Cannot " + action + " session " + session.getSessionId() + " in status " + session.getStatus());
        }
    }

    private BigDecimal requireNonNegative(BigDecimal amount, String label) {
        if (amount == null || amount.signum() < 0) {
            throw LedgerOperationException.invalidAmount(label + " must be zero or greater");
        }
        return scaleMoney(amount);
    }

    private BigDecimal scaleMoney(BigDecimal amount) {
        return amount.setScale(ledgerRuntimeProperties.getMoney().getScale(), RoundingMode.HALF_UP);
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
