package com.stackpoker.ledger.service;

import com.stackpoker.ledger.config.LedgerRuntimeProperties;
import com.stackpoker.ledger.model.ChipStackUpdate;
import com.stackpoker.ledger.model.ChipStackUpdateSource;
import com.stackpoker.ledger.model.PokerSession;
import com.stackpoker.ledger.model.PokerSessionStatus;
import com.stackpoker.ledger.repository.ChipStackUpdateRepository;
import com.stackpoker.ledger.web.LedgerOperationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Append-only chip stack history of a live session. Updates are never edited or removed;
 * corrections are recorded as new updates. Callers hold the session row lock.
 */
@Service
@RequiredArgsConstructor
public class SessionEventLog {

    private static final Logger log = LoggerFactory.getLogger(SessionEventLog.class);

    private final ChipStackUpdateRepository chipStackUpdateRepository;
    private final LiveSessionAccumulator liveSessionAccumulator;
    private final LedgerRuntimeProperties ledgerRuntimeProperties;

    public List<ChipStackUpdate> readUpdates(UUID sessionId) {
        return chipStackUpdateRepository.findBySessionIdOrderBySequenceNumberAsc(sessionId);
    }

    public ChipStackUpdate appendChipUpdate(
            PokerSession session,
            BigDecimal amount,
            String note,
            OffsetDateTime recordedAt
    ) {
        requireAppendable(session);
        if (amount == null || amount.signum() < 0) {
            throw LedgerOperationException.invalidAmount("Chip stack amount must be zero or greater");
        }
        return append(session, scaleMoney(amount), note, ChipStackUpdateSource.MANUAL, recordedAt);
    }

    /**
     * Records the current stack moved by {@code delta}. The stored update is still an
     * absolute amount.
     */
    public ChipStackUpdate appendAdjustment(
            PokerSession session,
            BigDecimal delta,
            String note,
            OffsetDateTime recordedAt
    ) {
        requireAppendable(session);
        if (delta == null || delta.signum() == 0) {
            throw LedgerOperationException.invalidAmount("Stack adjustment must be non-zero");
        }
        List<ChipStackUpdate> updates = readUpdates(session.getSessionId());
        BigDecimal adjusted = liveSessionAccumulator.currentStack(session, updates).add(delta);
        if (adjusted.signum() < 0) {
            throw LedgerOperationException.invalidAmount("Stack adjustment would leave a negative stack");
        }
        return append(session, updates, scaleMoney(adjusted), note, ChipStackUpdateSource.QUICK_ADJUST, recordedAt);
    }

    /**
     * Adds {@code amount} to the session's total buy-in and records the resulting stack.
     */
    public ChipStackUpdate appendRebuy(PokerSession session, BigDecimal amount, OffsetDateTime recordedAt) {
        if (amount == null || amount.signum() <= 0) {
            throw LedgerOperationException.invalidAmount("Rebuy amount must be greater than zero");
        }
        requireAppendable(session);
        List<ChipStackUpdate> updates = readUpdates(session.getSessionId());
        requireChronological(session, updates, recordedAt);

        BigDecimal rebuy = scaleMoney(amount);
        BigDecimal stackAfterRebuy = liveSessionAccumulator.currentStack(session, updates).add(rebuy);

        session.setTotalBuyIn(session.getTotalBuyIn().add(rebuy));
        session.setRebuyCount(session.getRebuyCount() + 1);

        log.info("Rebuy of {} recorded for session {} (rebuy #{})",
                rebuy, session.getSessionId(), session.getRebuyCount());
        return append(session, updates, stackAfterRebuy, "Rebuy", ChipStackUpdateSource.REBUY, recordedAt);
    }

    private ChipStackUpdate append(
            PokerSession session,
            BigDecimal amount,
            String note,
            ChipStackUpdateSource source,
            OffsetDateTime recordedAt
    ) {
        return append(session, readUpdates(session.getSessionId()), amount, note, source, recordedAt);
    }

    private ChipStackUpdate append(
            PokerSession session,
            List<ChipStackUpdate> existing,
            BigDecimal amount,
            String note,
            ChipStackUpdateSource source,
            OffsetDateTime recordedAt
    ) {
        requireChronological(session, existing, recordedAt);
        String normalizedNote = normalizeNote(note);

        ChipStackUpdate update = new ChipStackUpdate();
        update.setUpdateId(UUID.randomUUID());
        update.setSessionId(session.getSessionId());
        update.setSequenceNumber(existing.size() + 1);
        update.setAmount(amount);
        update.setNote(normalizedNote);
        update.setSource(source);
        update.setRecordedAt(recordedAt);
        update.setCreatedAt(recordedAt);

        session.setUpdatedAt(recordedAt);
        ChipStackUpdate saved = chipStackUpdateRepository.save(update);
        log.debug("Chip update #{} for session {}: {} ({})",
                saved.getSequenceNumber(), session.getSessionId(), amount, source);
        return saved;
    }

    private void requireAppendable(PokerSession session) {
        PokerSessionStatus status = session.getStatus();
        if (status != PokerSessionStatus.ACTIVE && status != PokerSessionStatus.PAUSED) {
            throw LedgerOperationException.invalidTransition(
                    "Chip updates require an ACTIVE or PAUSED session, current: " + status);
        }
        if (!liveSessionAccumulator.isInitialized(session)) {
            throw LedgerOperationException.uninitializedSession(
                    "Session " + session.getSessionId() + " has no buy-in recorded");
        }
    }

    private static void requireChronological(
            PokerSession session,
            List<ChipStackUpdate> existing,
            OffsetDateTime recordedAt
    ) {
        if (recordedAt == null) {
            throw LedgerOperationException.invalidTimestamp("Chip update timestamp is required");
        }
        if (existing.isEmpty()) {
            return;
        }
        OffsetDateTime previous = existing.get(existing.size() - 1).getRecordedAt();
        if (recordedAt.isBefore(previous)) {
            throw LedgerOperationException.invalidTimestamp(
                    "Chip update for session " + session.getSessionId()
                            + " predates the previous update at " + previous);
        }
    }

    private String normalizeNote(String note) {
        if (note == null || note.isBlank()) {
            return null;
        }
        String trimmed = note.trim();
        int maxLength = ledgerRuntimeProperties.getSession().getMaxNoteLength();
        if (trimmed.length() > maxLength) {
            throw LedgerOperationException.invalidNote(
                    "Chip update note exceeds " + maxLength + " characters");
        }
        return trimmed;
    }

    private BigDecimal scaleMoney(BigDecimal amount) {
        return amount.setScale(ledgerRuntimeProperties.getMoney().getScale(), RoundingMode.HALF_UP);
    }
}
