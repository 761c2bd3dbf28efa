package com.stackpoker.ledger.controller;

import com.stackpoker.ledger.dto.SessionRequests;
import com.stackpoker.ledger.dto.SessionResponses;
import com.stackpoker.ledger.service.SessionLifecycleService;
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
public class SessionController {

    private final SessionLifecycleService sessionLifecycleService;

    public SessionController(SessionLifecycleService sessionLifecycleService) {
        this.sessionLifecycleService = sessionLifecycleService;
    }

    @PostMapping("/sessions")
    public ResponseEntity<SessionResponses.SessionDetail> createSession(
            @Valid @RequestBody SessionRequests.CreateSessionRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(sessionLifecycleService.createSession(request, OffsetDateTime.now()));
    }

    @PostMapping("/sessions/completed")
    public ResponseEntity<SessionResponses.SessionDetail> logCompletedSession(
            @Valid @RequestBody SessionRequests.LogCompletedSessionRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(sessionLifecycleService.logCompletedSession(request, OffsetDateTime.now()));
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionResponses.SessionDetail> getSession(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(sessionLifecycleService.getSession(sessionId, OffsetDateTime.now()));
    }

    @GetMapping("/players/{playerId}/sessions")
    public ResponseEntity<List<SessionResponses.SessionSummary>> listSessionsForPlayer(@PathVariable String playerId) {
        return ResponseEntity.ok(sessionLifecycleService.listSessionsForPlayer(playerId, OffsetDateTime.now()));
    }

    @PostMapping("/sessions/{sessionId}/start")
    public ResponseEntity<SessionResponses.SessionDetail> startSession(
            @PathVariable UUID sessionId,
            @RequestBody(required = false) SessionRequests.StartSessionRequest request
    ) {
        return ResponseEntity.ok(sessionLifecycleService.startSession(
                sessionId,
                request != null ? request.buyIn() : null,
                OffsetDateTime.now()));
    }

    @PostMapping("/sessions/{sessionId}/pause")
    public ResponseEntity<SessionResponses.SessionDetail> pauseSession(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(sessionLifecycleService.pauseSession(sessionId, OffsetDateTime.now()));
    }

    @PostMapping("/sessions/{sessionId}/resume")
    public ResponseEntity<SessionResponses.SessionDetail> resumeSession(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(sessionLifecycleService.resumeSession(sessionId, OffsetDateTime.now()));
    }

    @PostMapping("/sessions/{sessionId}/end")
    public ResponseEntity<SessionResponses.SessionDetail> requestEnd(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(sessionLifecycleService.requestEnd(sessionId, OffsetDateTime.now()));
    }

    @PostMapping("/sessions/{sessionId}/cancel-end")
    public ResponseEntity<SessionResponses.SessionDetail> cancelEnding(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(sessionLifecycleService.cancelEnding(sessionId, OffsetDateTime.now()));
    }

    @PostMapping("/sessions/{sessionId}/finalize")
    public ResponseEntity<SessionResponses.SessionDetail> finalizeSession(
            @PathVariable UUID sessionId,
            @Valid @RequestBody SessionRequests.FinalizeSessionRequest request
    ) {
        return ResponseEntity.ok(sessionLifecycleService.finalizeSession(
                sessionId, request.cashout(), OffsetDateTime.now()));
    }

    @PostMapping("/sessions/{sessionId}/chip-updates")
    public ResponseEntity<SessionResponses.SessionDetail> appendChipUpdate(
            @PathVariable UUID sessionId,
            @Valid @RequestBody SessionRequests.ChipUpdateRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(sessionLifecycleService.appendChipUpdate(sessionId, request, OffsetDateTime.now()));
    }

    @PostMapping("/sessions/{sessionId}/adjustments")
    public ResponseEntity<SessionResponses.SessionDetail> adjustStack(
            @PathVariable UUID sessionId,
            @Valid @RequestBody SessionRequests.StackAdjustmentRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(sessionLifecycleService.adjustStack(sessionId, request, OffsetDateTime.now()));
    }

    @PostMapping("/sessions/{sessionId}/rebuys")
    public ResponseEntity<SessionResponses.SessionDetail> appendRebuy(
            @PathVariable UUID sessionId,
            @Valid @RequestBody SessionRequests.RebuyRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(sessionLifecycleService.appendRebuy(sessionId, request, OffsetDateTime.now()));
    }

    @PatchMapping("/sessions/{sessionId}/financials")
    public ResponseEntity<SessionResponses.FinancialEditResult> editFinancials(
            @PathVariable UUID sessionId,
            @Valid @RequestBody SessionRequests.EditFinancialsRequest request
    ) {
        return ResponseEntity.ok(sessionLifecycleService.editFinancials(sessionId, request, OffsetDateTime.now()));
    }
}
