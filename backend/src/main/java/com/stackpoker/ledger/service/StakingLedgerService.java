package com.stackpoker.ledger.service;

import com.stackpoker.ledger.config.LedgerRuntimeProperties;
import com.stackpoker.ledger.dto.StakeRequests;
import com.stackpoker.ledger.dto.StakeResponses;
import com.stackpoker.ledger.mapper.LedgerResponseMapper;
import com.stackpoker.ledger.model.ManualStakerProfile;
import com.stackpoker.ledger.model.PokerSession;
import com.stackpoker.ledger.model.StakeAction;
import com.stackpoker.ledger.model.StakeContract;
import com.stackpoker.ledger.model.StakeStatus;
import com.stackpoker.ledger.model.StakerRef;
import com.stackpoker.ledger.repository.ManualStakerProfileRepository;
import com.stackpoker.ledger.repository.PokerSessionRepository;
import com.stackpoker.ledger.repository.StakeContractRepository;
import com.stackpoker.ledger.repository.StakeStatusEventRepository;
import com.stackpoker.ledger.web.LedgerOperationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Stake contracts attached to sessions: creation, term edits, status transitions and the
 * read views. Session-level locks are taken before stake-level locks.
 */
@Service
@RequiredArgsConstructor
public class StakingLedgerService {

    private static final Logger log = LoggerFactory.getLogger(StakingLedgerService.class);

    private static final Set<StakeStatus> UNRESOLVED_STATUSES = StakeStatus.unresolved();
    private static final Set<StakeStatus> COMMITTED_STATUSES = EnumSet.of(
            StakeStatus.PROPOSED, StakeStatus.AWAITING_SETTLEMENT, StakeStatus.AWAITING_CONFIRMATION,
            StakeStatus.SETTLED);

    private final StakeContractRepository stakeContractRepository;
    private final PokerSessionRepository pokerSessionRepository;
    private final ManualStakerProfileRepository manualStakerProfileRepository;
    private final StakeStatusEventRepository stakeStatusEventRepository;
    private final SessionEventLog sessionEventLog;
    private final LiveSessionAccumulator liveSessionAccumulator;
    private final SettlementCalculator settlementCalculator;
    private final StakeStatusMachine stakeStatusMachine;
    private final StakerDirectory stakerDirectory;
    private final LedgerResponseMapper ledgerResponseMapper;
    private final LedgerRuntimeProperties ledgerRuntimeProperties;

    @Transactional
    public StakeResponses.StakeDetail addStake(
            UUID sessionId,
            StakeRequests.AddStakeRequest request,
            OffsetDateTime now
    ) {
        BigDecimal percentage = validatePercentage(request.stakePercentage());
        BigDecimal markup = validateMarkup(request.markup());
        boolean hasAppUser = StringUtils.hasText(request.stakerUserId());
        boolean hasManualStaker = request.manualStakerId() != null;
        if (!hasAppUser && !hasManualStaker) {
            throw LedgerOperationException.missingStaker("A staker user id or manual staker id is required");
        }
        if (hasAppUser && hasManualStaker) {
            throw LedgerOperationException.ambiguousStaker(
                    "Provide either a staker user id or a manual staker id, not both");
        }

        PokerSession session = lockSession(sessionId);
        SettlementCalculator.SessionFacts facts =
                liveSessionAccumulator.settlementFacts(session, sessionEventLog.readUpdates(sessionId));

        StakerRef stakerRef;
        if (hasManualStaker) {
            ManualStakerProfile profile = manualStakerProfileRepository.findById(request.manualStakerId())
                    .orElseThrow(() -> LedgerOperationException.manualStakerNotFound(
                            "Manual staker not found: " + request.manualStakerId()));
            stakerRef = StakerRef.manualStaker(profile.getProfileId(), profile.getDisplayName());
            if (stakeContractRepository.existsBySessionIdAndManualStakerIdAndStatusIn(
                    sessionId, profile.getProfileId(), UNRESOLVED_STATUSES)) {
                throw LedgerOperationException.duplicateStake(
                        "Manual staker " + profile.getProfileId() + " already has an open stake on session " + sessionId);
            }
        } else {
            String stakerUserId = request.stakerUserId().trim();
            stakerRef = StakerRef.appUser(stakerUserId);
            if (stakeContractRepository.existsBySessionIdAndStakerUserIdAndStatusIn(
                    sessionId, stakerUserId, UNRESOLVED_STATUSES)) {
                throw LedgerOperationException.duplicateStake(
                        "Staker " + stakerUserId + " already has an open stake on session " + sessionId);
            }
        }
        requirePercentageAvailable(sessionId, null, percentage);

        StakeContract stake = new StakeContract();
        stake.setStakeId(UUID.randomUUID());
        stake.setSessionId(sessionId);
        stake.setSessionGameName(session.getGameName());
        stake.setSessionStakes(session.getStakes());
        stake.setSessionDate(session.getStartedAt() != null ? session.getStartedAt() : session.getCreatedAt());
        stake.setStakerRef(stakerRef);
        if (stakerRef instanceof StakerRef.AppUser) {
            stake.setStakerDisplayName(stakerDirectory.resolveDisplayName(stakerRef).orElse(null));
        }
        stake.setStakedPlayerId(session.getPlayerId());
        stake.setStakePercentage(percentage);
        stake.setMarkup(markup);
        stake.setTournamentSession(session.isTournament());
        stake.setStatus(stakeStatusMachine.initialStatus(stakerRef));
        stake.setProposedAt(now);
        stake.setLastUpdatedAt(now);
        settlementCalculator.applyTo(stake, facts, now);

        StakeContract saved = stakeContractRepository.save(stake);
        stakeStatusMachine.recordCreation(saved, now);
        log.info("Added stake {} on session {}: {} at markup {} -> settlement {}",
                saved.getStakeId(), sessionId, percentage, markup, saved.getSettlementAmount());
        return toDetail(saved, facts);
    }

    @Transactional
    public StakeResponses.StakeDetail updateStake(
            UUID stakeId,
            StakeRequests.UpdateStakeRequest request,
            OffsetDateTime now
    ) {
        LockedStake locked = lockStakeWithSession(stakeId);
        StakeContract stake = locked.stake();
        if (stake.getStatus() == StakeStatus.SETTLED) {
            throw LedgerOperationException.stakeAlreadySettled(
                    "Stake " + stakeId + " is settled; reopen it before changing its terms");
        }
        if (!stake.getStatus().isUnresolved()) {
            throw LedgerOperationException.invalidTransition(
                    "Stake " + stakeId + " is " + stake.getStatus() + " and can no longer be edited");
        }
        BigDecimal percentage = validatePercentage(request.stakePercentage());
        BigDecimal markup = validateMarkup(request.markup());
        requirePercentageAvailable(stake.getSessionId(), stakeId, percentage);

        SettlementCalculator.SessionFacts facts = currentFacts(locked.session());
        stake.setStakePercentage(percentage);
        stake.setMarkup(markup);
        stake.setLastUpdatedAt(now);
        settlementCalculator.applyTo(stake, facts, now);
        stakeStatusMachine.resetPendingConfirmation(stake, "Stake terms changed", now);
        stakeContractRepository.save(stake);

        log.info("Updated stake {} terms: {} at markup {} -> settlement {}",
                stakeId, percentage, markup, stake.getSettlementAmount());
        return toDetail(stake, facts);
    }

    @Transactional
    public StakeResponses.StakeDetail acceptStake(UUID stakeId, OffsetDateTime now) {
        return transition(stakeId, StakeStatus.AWAITING_SETTLEMENT, StakeAction.ACCEPTED, null, now);
    }

    @Transactional
    public StakeResponses.StakeDetail declineStake(UUID stakeId, String reason, OffsetDateTime now) {
        return transition(stakeId, StakeStatus.DECLINED, StakeAction.DECLINED, reason, now);
    }

    @Transactional
    public StakeResponses.StakeDetail cancelStake(UUID stakeId, String reason, OffsetDateTime now) {
        return transition(stakeId, StakeStatus.CANCELLED, StakeAction.CANCELLED, reason, now);
    }

    @Transactional
    public StakeResponses.StakeDetail markSettled(UUID stakeId, OffsetDateTime now) {
        return transition(stakeId, StakeStatus.SETTLED, StakeAction.SETTLED, null, now);
    }

    @Transactional
    public StakeResponses.StakeDetail initiateSettlement(UUID stakeId, String actingUserId, OffsetDateTime now) {
        LockedStake locked = lockStakeWithSession(stakeId);
        stakeStatusMachine.initiateSettlement(locked.stake(), trimToNull(actingUserId), now);
        stakeContractRepository.save(locked.stake());
        return toDetail(locked.stake(), currentFactsOrNull(locked.session()));
    }

    @Transactional
    public StakeResponses.StakeDetail confirmSettlement(UUID stakeId, String actingUserId, OffsetDateTime now) {
        LockedStake locked = lockStakeWithSession(stakeId);
        stakeStatusMachine.confirmSettlement(locked.stake(), trimToNull(actingUserId), now);
        stakeContractRepository.save(locked.stake());
        return toDetail(locked.stake(), currentFactsOrNull(locked.session()));
    }

    @Transactional
    public StakeResponses.StakeDetail rejectSettlement(
            UUID stakeId,
            String actingUserId,
            String reason,
            OffsetDateTime now
    ) {
        LockedStake locked = lockStakeWithSession(stakeId);
        stakeStatusMachine.rejectSettlement(locked.stake(), trimToNull(actingUserId), trimToNull(reason), now);
        stakeContractRepository.save(locked.stake());
        return toDetail(locked.stake(), currentFactsOrNull(locked.session()));
    }

    /**
     * Reopens a settled stake and recomputes it against the session's current buy-in and
     * cashout.
     */
    @Transactional
    public StakeResponses.StakeDetail reopenStake(UUID stakeId, String reason, OffsetDateTime now) {
        if (!StringUtils.hasText(reason)) {
            throw LedgerOperationException.invalidTransition("A reason is required to reopen a settled stake");
        }
        LockedStake locked = lockStakeWithSession(stakeId);
        StakeContract stake = locked.stake();
        stakeStatusMachine.reopen(stake, reason.trim(), now);

        SettlementCalculator.SessionFacts facts = currentFacts(locked.session());
        settlementCalculator.applyTo(stake, facts, now);
        stakeContractRepository.save(stake);
        return toDetail(stake, facts);
    }

    @Transactional(readOnly = true)
    public StakeResponses.StakeDetail getStake(UUID stakeId) {
        StakeContract stake = stakeContractRepository.findById(stakeId)
                .orElseThrow(() -> LedgerOperationException.stakeNotFound("Stake not found: " + stakeId));
        return toDetail(stake, pokerSessionRepository.findById(stake.getSessionId())
                .map(this::currentFactsOrNull)
                .orElse(null));
    }

    @Transactional(readOnly = true)
    public StakeResponses.SessionStakes listStakesForSession(UUID sessionId) {
        PokerSession session = pokerSessionRepository.findById(sessionId)
                .orElseThrow(() -> LedgerOperationException.sessionNotFound("Session not found: " + sessionId));
        SettlementCalculator.SessionFacts facts = currentFactsOrNull(session);
        List<StakeResponses.StakeDetail> stakes = stakeContractRepository.findBySessionIdOrderByProposedAtAsc(sessionId)
                .stream()
                .map(stake -> toDetail(stake, facts))
                .toList();
        return ledgerResponseMapper.toSessionStakes(sessionId, stakes);
    }

    /**
     * Stakes where the user is either the staked player or the app-user staker.
     */
    @Transactional(readOnly = true)
    public List<StakeResponses.StakeDetail> listStakesForPlayer(String playerId) {
        Map<UUID, Optional<SettlementCalculator.SessionFacts>> factsBySession = new HashMap<>();
        return stakeContractRepository.findByStakedPlayerIdOrStakerUserIdOrderByProposedAtDesc(playerId, playerId)
                .stream()
                .map(stake -> toDetail(stake, factsBySession
                        .computeIfAbsent(stake.getSessionId(), sessionId -> pokerSessionRepository.findById(sessionId)
                                .map(this::currentFactsOrNull))
                        .orElse(null)))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<StakeResponses.StatusEvent> getStakeHistory(UUID stakeId) {
        if (!stakeContractRepository.existsById(stakeId)) {
            throw LedgerOperationException.stakeNotFound("Stake not found: " + stakeId);
        }
        return stakeStatusEventRepository.findByStakeIdOrderByOccurredAtAsc(stakeId).stream()
                .map(ledgerResponseMapper::toStatusEvent)
                .toList();
    }

    private StakeResponses.StakeDetail transition(
            UUID stakeId,
            StakeStatus target,
            StakeAction action,
            String reason,
            OffsetDateTime now
    ) {
        LockedStake locked = lockStakeWithSession(stakeId);
        StakeContract stake = locked.stake();
        stakeStatusMachine.transition(stake, target, action, trimToNull(reason), now);
        stakeContractRepository.save(stake);
        return toDetail(stake, currentFactsOrNull(locked.session()));
    }

    private BigDecimal validatePercentage(BigDecimal percentage) {
        if (percentage == null) {
            throw LedgerOperationException.invalidPercentage("Stake percentage is required");
        }
        if (percentage.signum() <= 0 || percentage.compareTo(BigDecimal.ONE) > 0) {
            throw LedgerOperationException.invalidPercentage(
                    "Stake percentage must be greater than 0 and at most 1, got " + percentage.toPlainString());
        }
        if (exceedsRatioScale(percentage)) {
            throw LedgerOperationException.invalidPercentage(
                    "Stake percentage allows at most " + ratioScale() + " decimal places, got "
                            + percentage.toPlainString());
        }
        return percentage.setScale(ratioScale(), RoundingMode.UNNECESSARY);
    }

    private BigDecimal validateMarkup(BigDecimal markup) {
        BigDecimal minimumMarkup = ledgerRuntimeProperties.getStaking().getMinimumMarkup();
        if (markup == null) {
            throw LedgerOperationException.invalidMarkup("Markup is required");
        }
        if (markup.compareTo(minimumMarkup) < 0) {
            throw LedgerOperationException.invalidMarkup(
                    "Markup must be at least " + minimumMarkup.toPlainString() + ", got " + markup.toPlainString());
        }
        if (exceedsRatioScale(markup)) {
            throw LedgerOperationException.invalidMarkup(
                    "Markup allows at most " + ratioScale() + " decimal places, got " + markup.toPlainString());
        }
        return markup.setScale(ratioScale(), RoundingMode.UNNECESSARY);
    }

    /**
     * Ratios are stored as entered; a value that would need rounding to fit the column is
     * refused instead of silently changed.
     */
    private boolean exceedsRatioScale(BigDecimal ratio) {
        return ratio.stripTrailingZeros().scale() > ratioScale();
    }

    private int ratioScale() {
        return ledgerRuntimeProperties.getStaking().getRatioScale();
    }

    /**
     * Rejects terms that would sell more than the whole of the player's action.
     */
    private void requirePercentageAvailable(UUID sessionId, UUID excludedStakeId, BigDecimal requested) {
        BigDecimal committed = stakeContractRepository.findBySessionIdOrderByProposedAtAsc(sessionId).stream()
                .filter(stake -> COMMITTED_STATUSES.contains(stake.getStatus()))
                .filter(stake -> !stake.getStakeId().equals(excludedStakeId))
                .map(StakeContract::getStakePercentage)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (committed.add(requested).compareTo(BigDecimal.ONE) > 0) {
            throw LedgerOperationException.invalidPercentage(
                    "Session " + sessionId + " has " + committed.toPlainString()
                            + " of its action sold; " + requested.toPlainString() + " more would exceed 100%");
        }
    }

    private SettlementCalculator.SessionFacts currentFacts(PokerSession session) {
        return liveSessionAccumulator.settlementFacts(session, sessionEventLog.readUpdates(session.getSessionId()));
    }

    private SettlementCalculator.SessionFacts currentFactsOrNull(PokerSession session) {
        if (!liveSessionAccumulator.isInitialized(session)) {
            return null;
        }
        return currentFacts(session);
    }

    private StakeResponses.StakeDetail toDetail(StakeContract stake, SettlementCalculator.SessionFacts currentFacts) {
        return ledgerResponseMapper.toStakeDetail(stake, displayNameFor(stake), currentFacts);
    }

    private String displayNameFor(StakeContract stake) {
        if (!stake.isOffAppStaker() && StringUtils.hasText(stake.getStakerDisplayName())) {
            return stakerDirectory.resolveDisplayName(stake.getStakerRef())
                    .orElse(stake.getStakerDisplayName());
        }
        return stakerDirectory.displayName(stake.getStakerRef());
    }

    private PokerSession lockSession(UUID sessionId) {
        return pokerSessionRepository.findBySessionIdForUpdate(sessionId)
                .orElseThrow(() -> LedgerOperationException.sessionNotFound("Session not found: " + sessionId));
    }

    private LockedStake lockStakeWithSession(UUID stakeId) {
        UUID sessionId = stakeContractRepository.findById(stakeId)
                .map(StakeContract::getSessionId)
                .orElseThrow(() -> LedgerOperationException.stakeNotFound("Stake not found: " + stakeId));
        PokerSession session = lockSession(sessionId);
        StakeContract stake = stakeContractRepository.findByStakeIdForUpdate(stakeId)
                .orElseThrow(() -> LedgerOperationException.stakeNotFound("Stake not found: " + stakeId));
        return new LockedStake(session, stake);
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private record LockedStake(PokerSession session, StakeContract stake) {
    }
}
