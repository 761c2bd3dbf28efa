package com.stackpoker.ledger.controller;

import com.stackpoker.ledger.dto.ManualStakerRequests;
import com.stackpoker.ledger.dto.ManualStakerResponses;
import com.stackpoker.ledger.service.ManualStakerService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/manual-stakers")
public class ManualStakerController {

    private final ManualStakerService manualStakerService;

    public ManualStakerController(ManualStakerService manualStakerService) {
        this.manualStakerService = manualStakerService;
    }

    @PostMapping
    public ResponseEntity<ManualStakerResponses.ManualStaker> createProfile(
            @Valid @RequestBody ManualStakerRequests.CreateManualStakerRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(manualStakerService.createProfile(request, OffsetDateTime.now()));
    }

    @GetMapping
    public ResponseEntity<List<ManualStakerResponses.ManualStaker>> listProfiles(
            @RequestParam String createdByUserId,
            @RequestParam(required = false) String query
    ) {
        return ResponseEntity.ok(manualStakerService.listProfiles(createdByUserId, query));
    }

    @GetMapping("/{profileId}")
    public ResponseEntity<ManualStakerResponses.ManualStaker> getProfile(@PathVariable UUID profileId) {
        return ResponseEntity.ok(manualStakerService.getProfile(profileId));
    }

    @PutMapping("/{profileId}")
    public ResponseEntity<ManualStakerResponses.ManualStaker> updateProfile(
            @PathVariable UUID profileId,
            @Valid @RequestBody ManualStakerRequests.UpdateManualStakerRequest request
    ) {
        return ResponseEntity.ok(manualStakerService.updateProfile(profileId, request, OffsetDateTime.now()));
    }

    @DeleteMapping("/{profileId}")
    public ResponseEntity<Void> deleteProfile(@PathVariable UUID profileId) {
        manualStakerService.deleteProfile(profileId);
        return ResponseEntity.noContent().build();
    }
}
