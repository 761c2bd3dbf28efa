package com.stackpoker.ledger.service;

import com.stackpoker.ledger.config.LedgerRuntimeProperties;
import com.stackpoker.ledger.model.ManualStakerProfile;
import com.stackpoker.ledger.model.StakerRef;
import com.stackpoker.ledger.provider.PlayerProfileClient;
import com.stackpoker.ledger.repository.ManualStakerProfileRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Resolves staker display names. A failed lookup never fails the surrounding operation;
 * the caller gets a placeholder name instead.
 */
@Service
@RequiredArgsConstructor
public class StakerDirectory {

    private static final Logger log = LoggerFactory.getLogger(StakerDirectory.class);

    private final PlayerProfileClient playerProfileClient;
    private final ManualStakerProfileRepository manualStakerProfileRepository;
    private final LedgerRuntimeProperties ledgerRuntimeProperties;

    public Optional<String> resolveDisplayName(StakerRef stakerRef) {
        try {
            if (stakerRef instanceof StakerRef.AppUser appUser) {
                return playerProfileClient.findDisplayName(appUser.userId())
                        .filter(StringUtils::hasText);
            }
            if (stakerRef instanceof StakerRef.ManualStaker manualStaker) {
                return manualStakerProfileRepository.findById(manualStaker.profileId())
                        .map(ManualStakerProfile::getDisplayName)
                        .filter(StringUtils::hasText);
            }
            return Optional.empty();
        } catch (RuntimeException ex) {
            log.warn("Failed to resolve display name for staker {}: {}", stakerRef, ex.getMessage());
            return Optional.empty();
        }
    }

    public String displayName(StakerRef stakerRef) {
        Optional<String> resolved = resolveDisplayName(stakerRef);
        if (resolved.isPresent()) {
            return resolved.get();
        }
        if (stakerRef instanceof StakerRef.ManualStaker manualStaker) {
            if (StringUtils.hasText(manualStaker.displayNameFallback())) {
                return manualStaker.displayNameFallback();
            }
            return ledgerRuntimeProperties.getDisplay().getManualStakerFallbackName();
        }
        log.warn("No display name found for staker {}", stakerRef);
        return ledgerRuntimeProperties.getDisplay().getAppUserFallbackName();
    }
}
