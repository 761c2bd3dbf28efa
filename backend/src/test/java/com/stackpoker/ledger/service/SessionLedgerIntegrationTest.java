package com.stackpoker.ledger.service;

import com.stackpoker.ledger.config.LedgerHealthIndicator;
import com.stackpoker.ledger.dto.ManualStakerRequests;
import com.stackpoker.ledger.dto.ManualStakerResponses;
import com.stackpoker.ledger.dto.SessionRequests;
import com.stackpoker.ledger.dto.SessionResponses;
import com.stackpoker.ledger.dto.StakeRequests;
import com.stackpoker.ledger.dto.StakeResponses;
import com.stackpoker.ledger.model.ChipStackUpdateSource;
import com.stackpoker.ledger.model.GameClassification;
import com.stackpoker.ledger.model.PokerSessionStatus;
import com.stackpoker.ledger.model.StakeAction;
import com.stackpoker.ledger.model.StakeStatus;
import com.stackpoker.ledger.repository.StakeContractRepository;
import com.stackpoker.ledger.web.LedgerOperationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "spring.jpa.hibernate.ddl-auto=validate",
        "spring.flyway.enabled=true",
        "spring.flyway.locations=classpath:db/migration"
})
@Testcontainers(disabledWithoutDocker = true)
class SessionLedgerIntegrationTest {

    private static final OffsetDateTime START = OffsetDateTime.parse("2026-03-01T18:00:00Z");

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("stackpoker")
            .withUsername("stackpoker")
            .withPassword("changeme");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired
    private SessionLifecycleService sessionLifecycleService;

    @Autowired
    private StakingLedgerService stakingLedgerService;

    @Autowired
    private ManualStakerService manualStakerService;

    @Autowired
    private StakeContractRepository stakeContractRepository;

    @Autowired
    private LedgerHealthIndicator ledgerHealthIndicator;

    @Test
    void cashoutCorrectionRecomputesOpenStakesAndFlagsSettledOnes() {
        UUID sessionId = createSession("player-alice");
        sessionLifecycleService.startSession(sessionId, new BigDecimal("300"), START);
        sessionLifecycleService.appendRebuy(sessionId, new SessionRequests.RebuyRequest(new BigDecimal("100")),
                START.plusMinutes(40));
        sessionLifecycleService.finalizeSession(sessionId, new BigDecimal("600"), START.plusHours(3));

        StakeResponses.StakeDetail stakeA = stakingLedgerService.addStake(sessionId,
                new StakeRequests.AddStakeRequest(new BigDecimal("0.5"), new BigDecimal("1.0"), "player-bob", null),
                START.plusHours(4));
        StakeResponses.StakeDetail stakeB = stakingLedgerService.addStake(sessionId,
                new StakeRequests.AddStakeRequest(new BigDecimal("0.2"), new BigDecimal("1.2"), "player-carol", null),
                START.plusHours(4));
        assertEquals(new BigDecimal("-100.00"), stakeA.settlementAmount());
        assertEquals(new BigDecimal("-48.00"), stakeB.settlementAmount());

        stakingLedgerService.acceptStake(stakeA.stakeId(), START.plusHours(5));
        stakingLedgerService.acceptStake(stakeB.stakeId(), START.plusHours(5));
        stakingLedgerService.markSettled(stakeA.stakeId(), START.plusHours(6));

        SessionResponses.FinancialEditResult edit = sessionLifecycleService.editFinancials(sessionId,
                new SessionRequests.EditFinancialsRequest(null, new BigDecimal("500")), START.plusDays(1));

        assertEquals(List.of(stakeB.stakeId()), edit.recomputedStakeIds());
        assertEquals(List.of(stakeA.stakeId()), edit.settledStakeIdsOutOfSync());
        assertEquals(new BigDecimal("100.00"), edit.session().currentProfit());

        StakeResponses.StakeDetail settledA = stakingLedgerService.getStake(stakeA.stakeId());
        assertEquals(new BigDecimal("-100.00"), settledA.settlementAmount());
        assertTrue(settledA.requiresResettlement());
        assertEquals(new BigDecimal("-24.00"), stakingLedgerService.getStake(stakeB.stakeId()).settlementAmount());

        StakeResponses.StakeDetail reopenedA = stakingLedgerService.reopenStake(
                stakeA.stakeId(), "cashout corrected to 500", START.plusDays(2));
        assertEquals(new BigDecimal("-50.00"), reopenedA.settlementAmount());

        StakeResponses.SessionStakes sessionStakes = stakingLedgerService.listStakesForSession(sessionId);
        assertEquals(0, new BigDecimal("0.7").compareTo(sessionStakes.totalPercentageSold()));
        assertEquals(new BigDecimal("-74.00"), sessionStakes.outstandingSettlementTotal());

        List<StakeResponses.StatusEvent> history = stakingLedgerService.getStakeHistory(stakeA.stakeId());
        assertEquals(List.of(StakeAction.PROPOSED, StakeAction.ACCEPTED, StakeAction.SETTLED, StakeAction.REOPENED),
                history.stream().map(StakeResponses.StatusEvent::action).toList());
        StakeResponses.StatusEvent reopened = history.get(history.size() - 1);
        assertNotNull(reopened.snapshot());
        assertEquals(new BigDecimal("-100.00"), reopened.snapshot().settlementAmount());
    }

    @Test
    void liveSessionPersistsChipLogAndFollowsStateMachine() {
        UUID sessionId = createSession("player-dora");
        sessionLifecycleService.startSession(sessionId, new BigDecimal("200"), START);
        sessionLifecycleService.appendChipUpdate(sessionId,
                new SessionRequests.ChipUpdateRequest(new BigDecimal("260"), "won a flip", null),
                START.plusMinutes(20));
        sessionLifecycleService.adjustStack(sessionId,
                new SessionRequests.StackAdjustmentRequest(new BigDecimal("-60"), "lost a pot"),
                START.plusMinutes(30));
        sessionLifecycleService.pauseSession(sessionId, START.plusMinutes(60));

        LedgerOperationException ex = assertThrows(LedgerOperationException.class,
                () -> sessionLifecycleService.pauseSession(sessionId, START.plusMinutes(61)));
        assertEquals("invalid_transition", ex.getCode());

        SessionResponses.SessionDetail paused = sessionLifecycleService.getSession(sessionId, START.plusMinutes(90));
        assertEquals(PokerSessionStatus.PAUSED, paused.status());
        assertEquals(3600L, paused.elapsedActiveSeconds());
        assertEquals(new BigDecimal("200.00"), paused.currentStack());
        assertEquals(List.of(1, 2), paused.chipUpdates().stream().map(SessionResponses.ChipUpdate::sequenceNumber).toList());
        assertEquals(ChipStackUpdateSource.QUICK_ADJUST, paused.chipUpdates().get(1).source());

        List<SessionResponses.SessionSummary> sessions =
                sessionLifecycleService.listSessionsForPlayer("player-dora", START.plusMinutes(90));
        assertEquals(1, sessions.size());
        assertFalse(sessions.get(0).abandoned());
    }

    @Test
    void manualStakerStakeKeepsNameAfterProfileDeletion() {
        UUID sessionId = createSession("player-erin");
        sessionLifecycleService.startSession(sessionId, new BigDecimal("500"), START);
        sessionLifecycleService.finalizeSession(sessionId, new BigDecimal("1000"), START.plusHours(2));
        ManualStakerResponses.ManualStaker profile = manualStakerService.createProfile(
                new ManualStakerRequests.CreateManualStakerRequest("player-erin", "Uncle Ray", null, null),
                START.plusHours(3));

        StakeResponses.StakeDetail stake = stakingLedgerService.addStake(sessionId,
                new StakeRequests.AddStakeRequest(new BigDecimal("0.3"), new BigDecimal("1.1"), null,
                        profile.profileId()),
                START.plusHours(3));
        assertEquals(StakeStatus.AWAITING_SETTLEMENT, stake.status());
        assertEquals(new BigDecimal("-165.00"), stake.settlementAmount());

        LedgerOperationException duplicate = assertThrows(LedgerOperationException.class,
                () -> stakingLedgerService.addStake(sessionId,
                        new StakeRequests.AddStakeRequest(new BigDecimal("0.1"), new BigDecimal("1.0"), null,
                                profile.profileId()),
                        START.plusHours(4)));
        assertEquals("duplicate_stake", duplicate.getCode());

        manualStakerService.deleteProfile(profile.profileId());

        assertEquals("Uncle Ray", stakingLedgerService.getStake(stake.stakeId()).stakerDisplayName());
    }

    @Test
    void renameTouchesOnlyNameOfOpenManualStakes() {
        UUID openSessionId = createSession("player-finn");
        sessionLifecycleService.startSession(openSessionId, new BigDecimal("400"), START);
        sessionLifecycleService.finalizeSession(openSessionId, new BigDecimal("600"), START.plusHours(2));
        UUID settledSessionId = createSession("player-finn");
        sessionLifecycleService.startSession(settledSessionId, new BigDecimal("400"), START);
        sessionLifecycleService.finalizeSession(settledSessionId, new BigDecimal("600"), START.plusHours(2));
        ManualStakerResponses.ManualStaker profile = manualStakerService.createProfile(
                new ManualStakerRequests.CreateManualStakerRequest("player-finn", "Uncle Ray", null, null),
                START.plusHours(3));

        StakeResponses.StakeDetail open = stakingLedgerService.addStake(openSessionId,
                new StakeRequests.AddStakeRequest(new BigDecimal("0.3"), new BigDecimal("1.0"), null,
                        profile.profileId()),
                START.plusHours(3));
        StakeResponses.StakeDetail settled = stakingLedgerService.addStake(settledSessionId,
                new StakeRequests.AddStakeRequest(new BigDecimal("0.5"), new BigDecimal("1.0"), null,
                        profile.profileId()),
                START.plusHours(3));
        stakingLedgerService.markSettled(settled.stakeId(), START.plusHours(4));
        stakingLedgerService.updateStake(open.stakeId(),
                new StakeRequests.UpdateStakeRequest(new BigDecimal("0.25"), new BigDecimal("1.2")),
                START.plusHours(5));

        manualStakerService.updateProfile(profile.profileId(),
                new ManualStakerRequests.UpdateManualStakerRequest("Raymond", null, null), START.plusHours(6));

        StakeResponses.StakeDetail renamedOpen = stakingLedgerService.getStake(open.stakeId());
        assertEquals("Raymond", renamedOpen.stakerDisplayName());
        assertEquals(new BigDecimal("0.2500"), renamedOpen.stakePercentage());
        assertEquals(new BigDecimal("1.2000"), renamedOpen.markup());
        assertEquals(new BigDecimal("-60.00"), renamedOpen.settlementAmount());
        assertEquals(StakeStatus.AWAITING_SETTLEMENT, renamedOpen.status());
        assertEquals("Raymond",
                stakeContractRepository.findById(open.stakeId()).orElseThrow().getStakerDisplayName());
        assertEquals("Uncle Ray",
                stakeContractRepository.findById(settled.stakeId()).orElseThrow().getStakerDisplayName());
    }

    @Test
    void appUserStakeSettlesThroughInitiateAndConfirm() {
        UUID sessionId = createSession("player-gina");
        sessionLifecycleService.startSession(sessionId, new BigDecimal("400"), START);
        sessionLifecycleService.finalizeSession(sessionId, new BigDecimal("200"), START.plusHours(2));
        StakeResponses.StakeDetail stake = stakingLedgerService.addStake(sessionId,
                new StakeRequests.AddStakeRequest(new BigDecimal("0.5"), new BigDecimal("1.0"), "player-hank", null),
                START.plusHours(3));
        stakingLedgerService.acceptStake(stake.stakeId(), START.plusHours(3));

        StakeResponses.StakeDetail pending =
                stakingLedgerService.initiateSettlement(stake.stakeId(), "player-hank", START.plusHours(4));
        assertEquals(StakeStatus.AWAITING_CONFIRMATION, pending.status());
        assertEquals(new BigDecimal("100.00"), pending.settlementAmount());

        LedgerOperationException self = assertThrows(LedgerOperationException.class,
                () -> stakingLedgerService.confirmSettlement(stake.stakeId(), "player-hank", START.plusHours(5)));
        assertEquals("self_confirmation", self.getCode());

        StakeResponses.StakeDetail settled =
                stakingLedgerService.confirmSettlement(stake.stakeId(), "player-gina", START.plusHours(5));
        assertEquals(StakeStatus.SETTLED, settled.status());
        assertEquals("player-hank", settled.settlementInitiatorUserId());
        assertEquals("player-gina", settled.settlementConfirmerUserId());

        assertEquals(List.of(StakeAction.PROPOSED, StakeAction.ACCEPTED, StakeAction.SETTLEMENT_INITIATED,
                        StakeAction.SETTLEMENT_CONFIRMED),
                stakingLedgerService.getStakeHistory(stake.stakeId()).stream()
                        .map(StakeResponses.StatusEvent::action)
                        .toList());
    }

    @Test
    void healthReportsUpAgainstMigratedSchema() {
        assertEquals(Status.UP, ledgerHealthIndicator.health().getStatus());
    }

    private UUID createSession(String playerId) {
        return sessionLifecycleService.createSession(
                new SessionRequests.CreateSessionRequest(
                        playerId, GameClassification.CASH_GAME, "Bellagio 2/5", "2/5", "Las Vegas", null, null),
                START.minusMinutes(10)).sessionId();
    }
}
