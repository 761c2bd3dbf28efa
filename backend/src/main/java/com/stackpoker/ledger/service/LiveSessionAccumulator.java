package com.stackpoker.ledger.service;

import com.stackpoker.ledger.config.LedgerRuntimeProperties;
import com.stackpoker.ledger.model.ChipStackUpdate;
import com.stackpoker.ledger.model.PokerSession;
import com.stackpoker.ledger.model.PokerSessionStatus;
import com.stackpoker.ledger.web.LedgerOperationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives live session values from the session row and its ordered chip stack updates.
 * Nothing here writes; callers persist whatever they change.
 */
@Component
public class LiveSessionAccumulator {

    private static final Map<PokerSessionStatus, Set<PokerSessionStatus>> ALLOWED_TRANSITIONS =
            new EnumMap<>(PokerSessionStatus.class);

    static {
        ALLOWED_TRANSITIONS.put(PokerSessionStatus.SETUP, EnumSet.of(PokerSessionStatus.ACTIVE));
        ALLOWED_TRANSITIONS.put(PokerSessionStatus.ACTIVE, EnumSet.of(
                PokerSessionStatus.PAUSED,
                PokerSessionStatus.ENDING,
                PokerSessionStatus.COMPLETED));
        ALLOWED_TRANSITIONS.put(PokerSessionStatus.PAUSED, EnumSet.of(
                PokerSessionStatus.ACTIVE,
                PokerSessionStatus.ENDING,
                PokerSessionStatus.COMPLETED));
        ALLOWED_TRANSITIONS.put(PokerSessionStatus.ENDING, EnumSet.of(
                PokerSessionStatus.PAUSED,
                PokerSessionStatus.COMPLETED));
        ALLOWED_TRANSITIONS.put(PokerSessionStatus.COMPLETED, EnumSet.noneOf(PokerSessionStatus.class));
    }

    private final LedgerRuntimeProperties ledgerRuntimeProperties;

    public LiveSessionAccumulator(LedgerRuntimeProperties ledgerRuntimeProperties) {
        this.ledgerRuntimeProperties = ledgerRuntimeProperties;
    }

    public static boolean canTransition(PokerSessionStatus from, PokerSessionStatus to) {
        return ALLOWED_TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    public void requireTransition(PokerSession session, PokerSessionStatus target) {
        if (!canTransition(session.getStatus(), target)) {
            throw LedgerOperationException.invalidTransition(
                    "Session " + session.getSessionId() + " cannot move from "
                            + session.getStatus() + " to " + target);
        }
    }

    public boolean isInitialized(PokerSession session) {
        return session.getTotalBuyIn() != null;
    }

    public BigDecimal totalBuyIn(PokerSession session) {
        requireInitialized(session);
        return session.getTotalBuyIn();
    }

    /**
     * Latest chip stack, or the total buy-in while no update has been recorded.
     */
    public BigDecimal currentStack(PokerSession session, List<ChipStackUpdate> updates) {
        requireInitialized(session);
        if (updates == null || updates.isEmpty()) {
            return session.getTotalBuyIn();
        }
        return updates.get(updates.size() - 1).getAmount();
    }

    public BigDecimal currentProfit(PokerSession session, List<ChipStackUpdate> updates) {
        requireInitialized(session);
        if (session.getStatus() == PokerSessionStatus.COMPLETED && session.getCashout() != null) {
            return session.getCashout().subtract(session.getTotalBuyIn());
        }
        return currentStack(session, updates).subtract(session.getTotalBuyIn());
    }

    /**
     * Buy-in and cashout used for settlement. A session that has not been finalized
     * settles provisionally against its current stack.
     */
    public SettlementCalculator.SessionFacts settlementFacts(PokerSession session, List<ChipStackUpdate> updates) {
        requireInitialized(session);
        BigDecimal cashout = session.getStatus() == PokerSessionStatus.COMPLETED && session.getCashout() != null
                ? session.getCashout()
                : currentStack(session, updates);
        return new SettlementCalculator.SessionFacts(session.getTotalBuyIn(), cashout);
    }

    /**
     * Accumulated active time, including the span still running while ACTIVE.
     */
    public long elapsedActiveSeconds(PokerSession session, OffsetDateTime now) {
        long accumulated = session.getElapsedActiveSeconds() == null ? 0L : session.getElapsedActiveSeconds();
        if (session.getStatus() != PokerSessionStatus.ACTIVE || session.getLastActiveAt() == null || now == null) {
            return accumulated;
        }
        long running = Duration.between(session.getLastActiveAt(), now).getSeconds();
        return accumulated + Math.max(0L, running);
    }

    public boolean isAbandoned(PokerSession session, OffsetDateTime now) {
        if (!session.getStatus().isLive() || now == null) {
            return false;
        }
        OffsetDateTime lastActivity = lastActivity(session);
        if (lastActivity == null) {
            return false;
        }
        Duration threshold = Duration.ofHours(ledgerRuntimeProperties.getSession().getAbandonedAfterHours());
        return lastActivity.plus(threshold).isBefore(now);
    }

    private static OffsetDateTime lastActivity(PokerSession session) {
        OffsetDateTime latest = null;
        for (OffsetDateTime candidate : new OffsetDateTime[]{
                session.getStartedAt(),
                session.getLastActiveAt(),
                session.getLastPausedAt(),
                session.getUpdatedAt()}) {
            if (candidate != null && (latest == null || candidate.isAfter(latest))) {
                latest = candidate;
            }
        }
        return latest;
    }

    private void requireInitialized(PokerSession session) {
        if (!isInitialized(session)) {
            throw LedgerOperationException.uninitializedSession(
                    "Session " + session.getSessionId() + " has no buy-in recorded");
        }
    }
}
