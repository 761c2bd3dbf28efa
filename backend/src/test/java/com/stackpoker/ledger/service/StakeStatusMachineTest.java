package com.stackpoker.ledger.service;

import com.stackpoker.ledger.model.SettlementSnapshotJsonCodec;
import com.stackpoker.ledger.model.StakeAction;
import com.stackpoker.ledger.model.StakeContract;
import com.stackpoker.ledger.model.StakeStatus;
import com.stackpoker.ledger.model.StakeStatusEvent;
import com.stackpoker.ledger.model.StakerRef;
import com.stackpoker.ledger.repository.StakeStatusEventRepository;
import com.stackpoker.ledger.web.LedgerOperationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StakeStatusMachineTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-02T10:00:00Z");

    @Mock
    private StakeStatusEventRepository stakeStatusEventRepository;

    @InjectMocks
    private StakeStatusMachine stakeStatusMachine;

    private StakeContract stake;

    @BeforeEach
    void setUp() {
        stake = new StakeContract();
        stake.setStakeId(UUID.randomUUID());
        stake.setSessionId(UUID.randomUUID());
        stake.setStakerRef(StakerRef.appUser("player-bob"));
        stake.setStakedPlayerId("player-alice");
        stake.setStakePercentage(new BigDecimal("0.5000"));
        stake.setMarkup(new BigDecimal("1.0000"));
        stake.setSessionBuyIn(new BigDecimal("400.00"));
        stake.setSessionCashout(new BigDecimal("600.00"));
        stake.setSettlementAmount(new BigDecimal("-100.00"));
        stake.setStatus(StakeStatus.PROPOSED);
    }

    @Test
    void offAppStakersStartAwaitingSettlement() {
        assertEquals(StakeStatus.PROPOSED, stakeStatusMachine.initialStatus(StakerRef.appUser("player-bob")));
        assertEquals(StakeStatus.AWAITING_SETTLEMENT,
                stakeStatusMachine.initialStatus(StakerRef.manualStaker(UUID.randomUUID(), "Uncle Ray")));
    }

    @Test
    void acceptingRecordsEventAndTimestamp() {
        stakeStatusMachine.transition(stake, StakeStatus.AWAITING_SETTLEMENT, StakeAction.ACCEPTED, null, NOW);

        assertEquals(StakeStatus.AWAITING_SETTLEMENT, stake.getStatus());
        assertEquals(NOW, stake.getAcceptedAt());
        StakeStatusEvent event = capturedEvent();
        assertEquals(StakeStatus.PROPOSED, event.getFromStatus());
        assertEquals(StakeStatus.AWAITING_SETTLEMENT, event.getToStatus());
        assertEquals(StakeAction.ACCEPTED, event.getAction());
    }

    @Test
    void proposedStakeCannotBeSettledDirectly() {
        LedgerOperationException ex = assertThrows(LedgerOperationException.class,
                () -> stakeStatusMachine.transition(stake, StakeStatus.SETTLED, StakeAction.SETTLED, null, NOW));

        assertEquals("invalid_transition", ex.getCode());
        assertEquals(StakeStatus.PROPOSED, stake.getStatus());
        verify(stakeStatusEventRepository, never()).save(any());
    }

    @Test
    void settledStakeOnlyLeavesThroughReopen() {
        stake.setStatus(StakeStatus.SETTLED);

        LedgerOperationException ex = assertThrows(LedgerOperationException.class,
                () -> stakeStatusMachine.transition(stake, StakeStatus.CANCELLED, StakeAction.CANCELLED, null, NOW));

        assertEquals("stake_already_settled", ex.getCode());
    }

    @Test
    void declinedStakeIsTerminal() {
        stakeStatusMachine.transition(stake, StakeStatus.DECLINED, StakeAction.DECLINED, "not this week", NOW);

        LedgerOperationException ex = assertThrows(LedgerOperationException.class,
                () -> stakeStatusMachine.transition(stake, StakeStatus.AWAITING_SETTLEMENT, StakeAction.ACCEPTED, null, NOW));

        assertEquals("invalid_transition", ex.getCode());
        assertFalse(StakeStatusMachine.canTransition(StakeStatus.CANCELLED, StakeStatus.PROPOSED));
        assertTrue(StakeStatusMachine.canTransition(StakeStatus.AWAITING_SETTLEMENT, StakeStatus.CANCELLED));
    }

    @Test
    void reopenKeepsSettledSnapshotAndCountsReopen() {
        stake.setStatus(StakeStatus.SETTLED);
        stake.setSettledAt(NOW.minusDays(1));

        stakeStatusMachine.reopen(stake, "cashout was misreported", NOW);

        assertEquals(StakeStatus.AWAITING_SETTLEMENT, stake.getStatus());
        assertNull(stake.getSettledAt());
        assertEquals(NOW, stake.getReopenedAt());
        assertEquals(1, stake.getReopenCount());

        StakeStatusEvent event = capturedEvent();
        assertEquals(StakeAction.REOPENED, event.getAction());
        assertEquals("cashout was misreported", event.getReason());
        SettlementSnapshotJsonCodec.SettlementSnapshot snapshot =
                SettlementSnapshotJsonCodec.fromJson(event.getSettlementSnapshotJson());
        assertEquals(StakeStatus.SETTLED, snapshot.status());
        assertEquals(new BigDecimal("-100.00"), snapshot.settlementAmount());
    }

    @Test
    void reopenRequiresSettledStake() {
        stake.setStatus(StakeStatus.AWAITING_SETTLEMENT);

        LedgerOperationException ex = assertThrows(LedgerOperationException.class,
                () -> stakeStatusMachine.reopen(stake, "why not", NOW));

        assertEquals("invalid_transition", ex.getCode());
    }

    @Test
    void creationEventDistinguishesOffAppStakers() {
        stake.setStakerRef(StakerRef.manualStaker(UUID.randomUUID(), "Uncle Ray"));
        stake.setStatus(StakeStatus.AWAITING_SETTLEMENT);

        stakeStatusMachine.recordCreation(stake, NOW);

        StakeStatusEvent event = capturedEvent();
        assertNull(event.getFromStatus());
        assertEquals(StakeAction.CREATED_OFF_APP, event.getAction());
    }

    @Test
    void playerInitiatesAndStakerConfirmsSettlement() {
        stake.setStatus(StakeStatus.AWAITING_SETTLEMENT);

        stakeStatusMachine.initiateSettlement(stake, "player-alice", NOW);

        assertEquals(StakeStatus.AWAITING_CONFIRMATION, stake.getStatus());
        assertEquals("player-alice", stake.getSettlementInitiatorUserId());
        assertEquals(NOW, stake.getSettlementInitiatedAt());
        assertNull(stake.getSettledAt());

        stakeStatusMachine.confirmSettlement(stake, "player-bob", NOW.plusHours(1));

        assertEquals(StakeStatus.SETTLED, stake.getStatus());
        assertEquals("player-bob", stake.getSettlementConfirmerUserId());
        assertEquals(NOW.plusHours(1), stake.getSettledAt());

        ArgumentCaptor<StakeStatusEvent> captor = ArgumentCaptor.forClass(StakeStatusEvent.class);
        verify(stakeStatusEventRepository, times(2)).save(captor.capture());
        assertEquals(StakeAction.SETTLEMENT_INITIATED, captor.getAllValues().get(0).getAction());
        assertEquals(StakeStatus.AWAITING_CONFIRMATION, captor.getAllValues().get(0).getToStatus());
        assertEquals(StakeAction.SETTLEMENT_CONFIRMED, captor.getAllValues().get(1).getAction());
        assertEquals(StakeStatus.AWAITING_CONFIRMATION, captor.getAllValues().get(1).getFromStatus());
    }

    @Test
    void initiatorCannotConfirmOwnSettlement() {
        stake.setStatus(StakeStatus.AWAITING_SETTLEMENT);
        stakeStatusMachine.initiateSettlement(stake, "player-bob", NOW);

        LedgerOperationException ex = assertThrows(LedgerOperationException.class,
                () -> stakeStatusMachine.confirmSettlement(stake, "player-bob", NOW));

        assertEquals("self_confirmation", ex.getCode());
        assertEquals(StakeStatus.AWAITING_CONFIRMATION, stake.getStatus());
        assertNull(stake.getSettlementConfirmerUserId());
    }

    @Test
    void outsiderCannotTakePartInSettlement() {
        stake.setStatus(StakeStatus.AWAITING_SETTLEMENT);

        LedgerOperationException initiate = assertThrows(LedgerOperationException.class,
                () -> stakeStatusMachine.initiateSettlement(stake, "player-carol", NOW));
        assertEquals("not_stake_party", initiate.getCode());

        stakeStatusMachine.initiateSettlement(stake, "player-alice", NOW);
        LedgerOperationException confirm = assertThrows(LedgerOperationException.class,
                () -> stakeStatusMachine.confirmSettlement(stake, "player-carol", NOW));
        assertEquals("not_stake_party", confirm.getCode());
        assertEquals(StakeStatus.AWAITING_CONFIRMATION, stake.getStatus());
    }

    @Test
    void offAppStakeCannotStartTwoPartySettlement() {
        stake.setStakerRef(StakerRef.manualStaker(UUID.randomUUID(), "Uncle Ray"));
        stake.setStatus(StakeStatus.AWAITING_SETTLEMENT);

        LedgerOperationException ex = assertThrows(LedgerOperationException.class,
                () -> stakeStatusMachine.initiateSettlement(stake, "player-alice", NOW));

        assertEquals("invalid_transition", ex.getCode());
        verify(stakeStatusEventRepository, never()).save(any());
    }

    @Test
    void proposedStakeCannotStartSettlement() {
        LedgerOperationException ex = assertThrows(LedgerOperationException.class,
                () -> stakeStatusMachine.initiateSettlement(stake, "player-alice", NOW));

        assertEquals("invalid_transition", ex.getCode());
        assertEquals(StakeStatus.PROPOSED, stake.getStatus());
    }

    @Test
    void confirmationWithoutPendingSettlementIsRejected() {
        stake.setStatus(StakeStatus.AWAITING_SETTLEMENT);

        LedgerOperationException ex = assertThrows(LedgerOperationException.class,
                () -> stakeStatusMachine.confirmSettlement(stake, "player-bob", NOW));

        assertEquals("invalid_transition", ex.getCode());
    }

    @Test
    void pendingConfirmationBlocksSingleStepSettleAndCancel() {
        stake.setStatus(StakeStatus.AWAITING_SETTLEMENT);
        stakeStatusMachine.initiateSettlement(stake, "player-alice", NOW);

        LedgerOperationException settle = assertThrows(LedgerOperationException.class,
                () -> stakeStatusMachine.transition(stake, StakeStatus.SETTLED, StakeAction.SETTLED, null, NOW));
        LedgerOperationException cancel = assertThrows(LedgerOperationException.class,
                () -> stakeStatusMachine.transition(stake, StakeStatus.CANCELLED, StakeAction.CANCELLED, null, NOW));

        assertEquals("invalid_transition", settle.getCode());
        assertEquals("invalid_transition", cancel.getCode());
        assertEquals(StakeStatus.AWAITING_CONFIRMATION, stake.getStatus());
    }

    @Test
    void rejectionReturnsStakeToAwaitingSettlement() {
        stake.setStatus(StakeStatus.AWAITING_SETTLEMENT);
        stake.setAcceptedAt(NOW.minusDays(1));
        stakeStatusMachine.initiateSettlement(stake, "player-alice", NOW);

        stakeStatusMachine.rejectSettlement(stake, "player-bob", "transfer never arrived", NOW.plusHours(2));

        assertEquals(StakeStatus.AWAITING_SETTLEMENT, stake.getStatus());
        assertNull(stake.getSettlementInitiatorUserId());
        assertNull(stake.getSettlementInitiatedAt());
        assertEquals(NOW.minusDays(1), stake.getAcceptedAt());

        ArgumentCaptor<StakeStatusEvent> captor = ArgumentCaptor.forClass(StakeStatusEvent.class);
        verify(stakeStatusEventRepository, times(2)).save(captor.capture());
        StakeStatusEvent rejected = captor.getAllValues().get(1);
        assertEquals(StakeAction.SETTLEMENT_REJECTED, rejected.getAction());
        assertEquals("transfer never arrived", rejected.getReason());
    }

    @Test
    void resetOnlyAppliesToPendingConfirmation() {
        stake.setStatus(StakeStatus.AWAITING_SETTLEMENT);

        assertFalse(stakeStatusMachine.resetPendingConfirmation(stake, "amount changed", NOW));
        verify(stakeStatusEventRepository, never()).save(any());

        stakeStatusMachine.initiateSettlement(stake, "player-alice", NOW);
        assertTrue(stakeStatusMachine.resetPendingConfirmation(stake, "amount changed", NOW));
        assertEquals(StakeStatus.AWAITING_SETTLEMENT, stake.getStatus());
        assertNull(stake.getSettlementInitiatorUserId());
    }

    @Test
    void reopenClearsSettlementParties() {
        stake.setStatus(StakeStatus.SETTLED);
        stake.setSettlementInitiatorUserId("player-alice");
        stake.setSettlementConfirmerUserId("player-bob");
        stake.setSettlementInitiatedAt(NOW.minusDays(1));

        stakeStatusMachine.reopen(stake, "cashout was misreported", NOW);

        assertNull(stake.getSettlementInitiatorUserId());
        assertNull(stake.getSettlementConfirmerUserId());
        assertNull(stake.getSettlementInitiatedAt());
    }

    private StakeStatusEvent capturedEvent() {
        ArgumentCaptor<StakeStatusEvent> captor = ArgumentCaptor.forClass(StakeStatusEvent.class);
        verify(stakeStatusEventRepository).save(captor.capture());
        return captor.getValue();
    }
}
