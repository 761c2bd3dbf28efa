package com.stackpoker.ledger.service;

import com.stackpoker.ledger.dto.ManualStakerRequests;
import com.stackpoker.ledger.dto.ManualStakerResponses;
import com.stackpoker.ledger.mapper.LedgerResponseMapper;
import com.stackpoker.ledger.model.ManualStakerProfile;
import com.stackpoker.ledger.model.StakeStatus;
import com.stackpoker.ledger.repository.ManualStakerProfileRepository;
import com.stackpoker.ledger.repository.StakeContractRepository;
import com.stackpoker.ledger.web.LedgerOperationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Profiles for stakers who do not use the app. Stakes keep a copy of the profile's name,
 * so deleting a profile leaves existing stakes readable.
 */
@Service
@RequiredArgsConstructor
public class ManualStakerService {

    private static final Logger log = LoggerFactory.getLogger(ManualStakerService.class);

    private final ManualStakerProfileRepository manualStakerProfileRepository;
    private final StakeContractRepository stakeContractRepository;
    private final LedgerResponseMapper ledgerResponseMapper;

    @Transactional
    public ManualStakerResponses.ManualStaker createProfile(
            ManualStakerRequests.CreateManualStakerRequest request,
            OffsetDateTime now
    ) {
        ManualStakerProfile profile = new ManualStakerProfile();
        profile.setProfileId(UUID.randomUUID());
        profile.setCreatedByUserId(request.createdByUserId().trim());
        profile.setDisplayName(request.displayName().trim());
        profile.setContactInfo(trimToNull(request.contactInfo()));
        profile.setNotes(trimToNull(request.notes()));
        profile.setCreatedAt(now);
        profile.setUpdatedAt(now);

        ManualStakerProfile saved = manualStakerProfileRepository.save(profile);
        log.info("Created manual staker {} for user {}", saved.getProfileId(), saved.getCreatedByUserId());
        return ledgerResponseMapper.toManualStaker(saved);
    }

    @Transactional(readOnly = true)
    public List<ManualStakerResponses.ManualStaker> listProfiles(String createdByUserId, String query) {
        List<ManualStakerProfile> profiles = StringUtils.hasText(query)
                ? manualStakerProfileRepository
                        .findByCreatedByUserIdAndDisplayNameContainingIgnoreCaseOrderByDisplayNameAsc(
                                createdByUserId, query.trim())
                : manualStakerProfileRepository.findByCreatedByUserIdOrderByDisplayNameAsc(createdByUserId);
        return profiles.stream()
                .map(ledgerResponseMapper::toManualStaker)
                .toList();
    }

    @Transactional(readOnly = true)
    public ManualStakerResponses.ManualStaker getProfile(UUID profileId) {
        return ledgerResponseMapper.toManualStaker(requireProfile(profileId));
    }

    /**
     * Updates the profile and refreshes the name copied onto its unresolved stakes. Settled
     * stakes keep the name they were settled under.
     */
    @Transactional
    public ManualStakerResponses.ManualStaker updateProfile(
            UUID profileId,
            ManualStakerRequests.UpdateManualStakerRequest request,
            OffsetDateTime now
    ) {
        ManualStakerProfile profile = requireProfile(profileId);
        String displayName = request.displayName().trim();
        boolean renamed = !displayName.equals(profile.getDisplayName());
        profile.setDisplayName(displayName);
        profile.setContactInfo(trimToNull(request.contactInfo()));
        profile.setNotes(trimToNull(request.notes()));
        profile.setUpdatedAt(now);
        manualStakerProfileRepository.save(profile);

        if (renamed) {
            int refreshed = stakeContractRepository.updateStakerDisplayNameForManualStaker(
                    profileId, StakeStatus.unresolved(), displayName);
            log.info("Renamed manual staker {}; refreshed {} open stake(s)", profileId, refreshed);
        }
        return ledgerResponseMapper.toManualStaker(profile);
    }

    @Transactional
    public void deleteProfile(UUID profileId) {
        ManualStakerProfile profile = requireProfile(profileId);
        manualStakerProfileRepository.delete(profile);
        log.info("Deleted manual staker {}", profileId);
    }

    private ManualStakerProfile requireProfile(UUID profileId) {
        return manualStakerProfileRepository.findById(profileId)
                .orElseThrow(() -> LedgerOperationException.manualStakerNotFound(
                        "Manual staker not found: " + profileId));
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
