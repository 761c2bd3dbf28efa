package com.stackpoker.ledger.controller;

import com.stackpoker.ledger.dto.StakeRequests;
import com.stackpoker.ledger.dto.StakeResponses;
import com.stackpoker.ledger.service.StakingLedgerService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
public class StakeController {

    private final StakingLedgerService stakingLedgerService;

    public StakeController(StakingLedgerService stakingLedgerService) {
        this.stakingLedgerService = stakingLedgerService;
    }

    @PostMapping("/sessions/{sessionId}/stakes")
    public ResponseEntity<StakeResponses.StakeDetail> addStake(
            @PathVariable UUID sessionId,
            @Valid @RequestBody StakeRequests.AddStakeRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(stakingLedgerService.addStake(sessionId, request, OffsetDateTime.now()));
    }

    @GetMapping("/sessions/{sessionId}/stakes")
    public ResponseEntity<StakeResponses.SessionStakes> listStakesForSession(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(stakingLedgerService.listStakesForSession(sessionId));
    }

    @GetMapping("/players/{playerId}/stakes")
    public ResponseEntity<List<StakeResponses.StakeDetail>> listStakesForPlayer(@PathVariable String playerId) {
        return ResponseEntity.ok(stakingLedgerService.listStakesForPlayer(playerId));
    }

    @GetMapping("/stakes/{stakeId}")
    public ResponseEntity<StakeResponses.StakeDetail> getStake(@PathVariable UUID stakeId) {
        return ResponseEntity.ok(stakingLedgerService.getStake(stakeId));
    }

    @PatchMapping("/stakes/{stakeId}")
    public ResponseEntity<StakeResponses.StakeDetail> updateStake(
            @PathVariable UUID stakeId,
            @Valid @RequestBody StakeRequests.UpdateStakeRequest request
    ) {
        return ResponseEntity.ok(stakingLedgerService.updateStake(stakeId, request, OffsetDateTime.now()));
    }

    @PostMapping("/stakes/{stakeId}/accept")
    public ResponseEntity<StakeResponses.StakeDetail> acceptStake(@PathVariable UUID stakeId) {
        return ResponseEntity.ok(stakingLedgerService.acceptStake(stakeId, OffsetDateTime.now()));
    }

    @PostMapping("/stakes/{stakeId}/decline")
    public ResponseEntity<StakeResponses.StakeDetail> declineStake(
            @PathVariable UUID stakeId,
            @Valid @RequestBody(required = false) StakeRequests.StakeTransitionRequest request
    ) {
        return ResponseEntity.ok(stakingLedgerService.declineStake(
                stakeId, request != null ? request.reason() : null, OffsetDateTime.now()));
    }

    @PostMapping("/stakes/{stakeId}/cancel")
    public ResponseEntity<StakeResponses.StakeDetail> cancelStake(
            @PathVariable UUID stakeId,
            @Valid @RequestBody(required = false) StakeRequests.StakeTransitionRequest request
    ) {
        return ResponseEntity.ok(stakingLedgerService.cancelStake(
                stakeId, request != null ? request.reason() : null, OffsetDateTime.now()));
    }

    @PostMapping("/stakes/{stakeId}/settle")
    public ResponseEntity<StakeResponses.StakeDetail> markSettled(@PathVariable UUID stakeId) {
        return ResponseEntity.ok(stakingLedgerService.markSettled(stakeId, OffsetDateTime.now()));
    }

    @PostMapping("/stakes/{stakeId}/settlement/initiate")
    public ResponseEntity<StakeResponses.StakeDetail> initiateSettlement(
            @PathVariable UUID stakeId,
            @Valid @RequestBody StakeRequests.SettlementPartyRequest request
    ) {
        return ResponseEntity.ok(stakingLedgerService.initiateSettlement(
                stakeId, request.actingUserId(), OffsetDateTime.now()));
    }

    @PostMapping("/stakes/{stakeId}/settlement/confirm")
    public ResponseEntity<StakeResponses.StakeDetail> confirmSettlement(
            @PathVariable UUID stakeId,
            @Valid @RequestBody StakeRequests.SettlementPartyRequest request
    ) {
        return ResponseEntity.ok(stakingLedgerService.confirmSettlement(
                stakeId, request.actingUserId(), OffsetDateTime.now()));
    }

    @PostMapping("/stakes/{stakeId}/settlement/reject")
    public ResponseEntity<StakeResponses.StakeDetail> rejectSettlement(
            @PathVariable UUID stakeId,
            @Valid @RequestBody StakeRequests.SettlementPartyRequest request
    ) {
        return ResponseEntity.ok(stakingLedgerService.rejectSettlement(
                stakeId, request.actingUserId(), request.reason(), OffsetDateTime.now()));
    }

    @PostMapping("/stakes/{stakeId}/reopen")
    public ResponseEntity<StakeResponses.StakeDetail> reopenStake(
            @PathVariable UUID stakeId,
            @Valid @RequestBody StakeRequests.ReopenStakeRequest request
    ) {
        return ResponseEntity.ok(stakingLedgerService.reopenStake(stakeId, request.reason(), OffsetDateTime.now()));
    }

    @GetMapping("/stakes/{stakeId}/history")
    public ResponseEntity<List<StakeResponses.StatusEvent>> getStakeHistory(@PathVariable UUID stakeId) {
        return ResponseEntity.ok(stakingLedgerService.getStakeHistory(stakeId));
    }
}
