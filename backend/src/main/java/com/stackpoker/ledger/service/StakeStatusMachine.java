package com.stackpoker.ledger.service;

import com.stackpoker.ledger.model.SettlementSnapshotJsonCodec;
import com.stackpoker.ledger.model.StakeAction;
import com.stackpoker.ledger.model.StakeContract;
import com.stackpoker.ledger.model.StakeStatus;
import com.stackpoker.ledger.model.StakeStatusEvent;
import com.stackpoker.ledger.model.StakerRef;
import com.stackpoker.ledger.repository.StakeStatusEventRepository;
import com.stackpoker.ledger.web.LedgerOperationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Stake status transitions. Every accepted transition writes a {@link StakeStatusEvent}
 * holding the financial snapshot at that moment. SETTLED is only left through
 * {@link #reopen}.
 *
 * <p>Stakes with an app-user staker can also settle in two steps: one party initiates,
 * which parks the stake in AWAITING_CONFIRMATION, and the other party confirms. Moves into
 * or out of AWAITING_CONFIRMATION go through the dedicated methods below, never through
 * {@link #transition}.
 */
@Component
@RequiredArgsConstructor
public class StakeStatusMachine {

    private static final Logger log = LoggerFactory.getLogger(StakeStatusMachine.class);

    private static final Map<StakeStatus, Set<StakeStatus>> ALLOWED_TRANSITIONS = new EnumMap<>(StakeStatus.class);

    static {
        ALLOWED_TRANSITIONS.put(StakeStatus.PROPOSED, EnumSet.of(
                StakeStatus.AWAITING_SETTLEMENT,
                StakeStatus.DECLINED,
                StakeStatus.CANCELLED));
        ALLOWED_TRANSITIONS.put(StakeStatus.AWAITING_SETTLEMENT, EnumSet.of(
                StakeStatus.AWAITING_CONFIRMATION,
                StakeStatus.SETTLED,
                StakeStatus.CANCELLED));
        ALLOWED_TRANSITIONS.put(StakeStatus.AWAITING_CONFIRMATION, EnumSet.of(
                StakeStatus.SETTLED,
                StakeStatus.AWAITING_SETTLEMENT));
        ALLOWED_TRANSITIONS.put(StakeStatus.SETTLED, EnumSet.noneOf(StakeStatus.class));
        ALLOWED_TRANSITIONS.put(StakeStatus.DECLINED, EnumSet.noneOf(StakeStatus.class));
        ALLOWED_TRANSITIONS.put(StakeStatus.CANCELLED, EnumSet.noneOf(StakeStatus.class));
    }

    private final StakeStatusEventRepository stakeStatusEventRepository;

    public static boolean canTransition(StakeStatus from, StakeStatus to) {
        return ALLOWED_TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * Off-app stakers cannot accept in the app, so their stakes skip PROPOSED.
     */
    public StakeStatus initialStatus(StakerRef stakerRef) {
        return stakerRef.offApp() ? StakeStatus.AWAITING_SETTLEMENT : StakeStatus.PROPOSED;
    }

    public void recordCreation(StakeContract stake, OffsetDateTime now) {
        StakeAction action = stake.isOffAppStaker() ? StakeAction.CREATED_OFF_APP : StakeAction.PROPOSED;
        recordEvent(stake, null, stake.getStatus(), action, null, now);
    }

    public void transition(
            StakeContract stake,
            StakeStatus target,
            StakeAction action,
            String reason,
            OffsetDateTime now
    ) {
        StakeStatus current = stake.getStatus();
        if (current == StakeStatus.SETTLED) {
            throw LedgerOperationException.stakeAlreadySettled(
                    "Stake " + stake.getStakeId() + " is settled; reopen it first");
        }
        if (current == StakeStatus.AWAITING_CONFIRMATION) {
            throw LedgerOperationException.invalidTransition(
                    "Stake " + stake.getStakeId() + " is awaiting settlement confirmation; confirm or reject it first");
        }
        if (target == StakeStatus.AWAITING_CONFIRMATION || !canTransition(current, target)) {
            throw LedgerOperationException.invalidTransition(
                    "Stake " + stake.getStakeId() + " cannot move from " + current + " to " + target);
        }

        stake.setStatus(target);
        stake.setLastUpdatedAt(now);
        if (target == StakeStatus.AWAITING_SETTLEMENT) {
            stake.setAcceptedAt(now);
        } else if (target == StakeStatus.SETTLED) {
            stake.setSettledAt(now);
        }
        recordEvent(stake, current, target, action, reason, now);
        log.info("Stake {} moved {} -> {} ({})", stake.getStakeId(), current, target, action);
    }

    /**
     * First half of a two-party settlement. Either the staked player or the app-user staker
     * may mark the stake paid; off-app stakers have no counterparty in the app and settle
     * through {@link #transition} to SETTLED instead.
     */
    public void initiateSettlement(StakeContract stake, String actingUserId, OffsetDateTime now) {
        StakeStatus current = stake.getStatus();
        if (current == StakeStatus.SETTLED) {
            throw LedgerOperationException.stakeAlreadySettled(
                    "Stake " + stake.getStakeId() + " is settled; reopen it first");
        }
        if (stake.isOffAppStaker()) {
            throw LedgerOperationException.invalidTransition(
                    "Stake " + stake.getStakeId() + " has an off-app staker and settles without confirmation");
        }
        requireParty(stake, actingUserId);
        if (current != StakeStatus.AWAITING_SETTLEMENT) {
            throw LedgerOperationException.invalidTransition(
                    "Stake " + stake.getStakeId() + " cannot move from " + current + " to "
                            + StakeStatus.AWAITING_CONFIRMATION);
        }

        stake.setStatus(StakeStatus.AWAITING_CONFIRMATION);
        stake.setSettlementInitiatorUserId(actingUserId);
        stake.setSettlementInitiatedAt(now);
        stake.setLastUpdatedAt(now);
        recordEvent(stake, current, StakeStatus.AWAITING_CONFIRMATION, StakeAction.SETTLEMENT_INITIATED, null, now);
        log.info("Stake {} marked paid by {}; awaiting confirmation", stake.getStakeId(), actingUserId);
    }

    /**
     * Second half of a two-party settlement; the confirming party must not be the one who
     * initiated it.
     */
    public void confirmSettlement(StakeContract stake, String actingUserId, OffsetDateTime now) {
        StakeStatus current = stake.getStatus();
        if (current == StakeStatus.SETTLED) {
            throw LedgerOperationException.stakeAlreadySettled(
                    "Stake " + stake.getStakeId() + " is settled; reopen it first");
        }
        if (current != StakeStatus.AWAITING_CONFIRMATION) {
            throw LedgerOperationException.invalidTransition(
                    "Stake " + stake.getStakeId() + " has no settlement awaiting confirmation, it is " + current);
        }
        requireParty(stake, actingUserId);
        if (actingUserId.equals(stake.getSettlementInitiatorUserId())) {
            throw LedgerOperationException.selfConfirmation(
                    "Settlement of stake " + stake.getStakeId() + " must be confirmed by the other party");
        }

        stake.setStatus(StakeStatus.SETTLED);
        stake.setSettlementConfirmerUserId(actingUserId);
        stake.setSettledAt(now);
        stake.setLastUpdatedAt(now);
        recordEvent(stake, current, StakeStatus.SETTLED, StakeAction.SETTLEMENT_CONFIRMED, null, now);
        log.info("Stake {} settlement confirmed by {}", stake.getStakeId(), actingUserId);
    }

    /**
     * Either party withdraws or disputes a pending settlement.
     */
    public void rejectSettlement(StakeContract stake, String actingUserId, String reason, OffsetDateTime now) {
        if (stake.getStatus() != StakeStatus.AWAITING_CONFIRMATION) {
            throw LedgerOperationException.invalidTransition(
                    "Stake " + stake.getStakeId() + " has no settlement awaiting confirmation, it is "
                            + stake.getStatus());
        }
        requireParty(stake, actingUserId);
        returnToAwaitingSettlement(stake, StakeAction.SETTLEMENT_REJECTED, reason, now);
        log.info("Stake {} pending settlement rejected by {}", stake.getStakeId(), actingUserId);
    }

    /**
     * Drops a pending confirmation after the amount it was initiated for has changed. No-op
     * for any other status.
     */
    public boolean resetPendingConfirmation(StakeContract stake, String reason, OffsetDateTime now) {
        if (stake.getStatus() != StakeStatus.AWAITING_CONFIRMATION) {
            return false;
        }
        returnToAwaitingSettlement(stake, StakeAction.SETTLEMENT_RESET, reason, now);
        log.info("Stake {} pending settlement reset: {}", stake.getStakeId(), reason);
        return true;
    }

    /**
     * Moves a SETTLED stake back to AWAITING_SETTLEMENT. The event snapshot keeps the
     * numbers that had been settled.
     */
    public void reopen(StakeContract stake, String reason, OffsetDateTime now) {
        if (stake.getStatus() != StakeStatus.SETTLED) {
            throw LedgerOperationException.invalidTransition(
                    "Only a settled stake can be reopened, stake " + stake.getStakeId() + " is " + stake.getStatus());
        }

        recordEvent(stake, StakeStatus.SETTLED, StakeStatus.AWAITING_SETTLEMENT, StakeAction.REOPENED, reason, now);
        stake.setStatus(StakeStatus.AWAITING_SETTLEMENT);
        stake.setSettledAt(null);
        clearSettlementParties(stake);
        stake.setReopenedAt(now);
        stake.setReopenCount(stake.getReopenCount() + 1);
        stake.setLastUpdatedAt(now);
        log.warn("Reopened settled stake {} (reopen #{}, settlementAmount was {}): {}",
                stake.getStakeId(), stake.getReopenCount(), stake.getSettlementAmount(), reason);
    }

    private void returnToAwaitingSettlement(
            StakeContract stake,
            StakeAction action,
            String reason,
            OffsetDateTime now
    ) {
        stake.setStatus(StakeStatus.AWAITING_SETTLEMENT);
        clearSettlementParties(stake);
        stake.setLastUpdatedAt(now);
        recordEvent(stake, StakeStatus.AWAITING_CONFIRMATION, StakeStatus.AWAITING_SETTLEMENT, action, reason, now);
    }

    private static void clearSettlementParties(StakeContract stake) {
        stake.setSettlementInitiatorUserId(null);
        stake.setSettlementInitiatedAt(null);
        stake.setSettlementConfirmerUserId(null);
    }

    private static void requireParty(StakeContract stake, String actingUserId) {
        boolean party = StringUtils.hasText(actingUserId)
                && (actingUserId.equals(stake.getStakedPlayerId()) || actingUserId.equals(stake.getStakerUserId()));
        if (!party) {
            throw LedgerOperationException.notStakeParty(
                    "User " + actingUserId + " is neither the staked player nor the staker on stake "
                            + stake.getStakeId());
        }
    }

    private void recordEvent(
            StakeContract stake,
            StakeStatus from,
            StakeStatus to,
            StakeAction action,
            String reason,
            OffsetDateTime now
    ) {
        StakeStatusEvent event = new StakeStatusEvent();
        event.setEventId(UUID.randomUUID());
        event.setStakeId(stake.getStakeId());
        event.setFromStatus(from);
        event.setToStatus(to);
        event.setAction(action);
        event.setReason(reason);
        event.setSettlementSnapshotJson(SettlementSnapshotJsonCodec.toJson(stake));
        event.setOccurredAt(now);
        stakeStatusEventRepository.save(event);
    }
}
