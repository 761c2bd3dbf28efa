package com.stackpoker.ledger.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Staker identity: either an app user or an off-app staker tracked through a
 * {@link ManualStakerProfile}. A stake references exactly one of them.
 */
public sealed interface StakerRef permits StakerRef.AppUser, StakerRef.ManualStaker {

    boolean offApp();

    static StakerRef appUser(String userId) {
        return new AppUser(userId);
    }

    static StakerRef manualStaker(UUID profileId, String displayNameFallback) {
        return new ManualStaker(profileId, displayNameFallback);
    }

    record AppUser(String userId) implements StakerRef {
        public AppUser {
            Objects.requireNonNull(userId, "userId is required");
        }

        @Override
        public boolean offApp() {
            return false;
        }
    }

    record ManualStaker(UUID profileId, String displayNameFallback) implements StakerRef {
        public ManualStaker {
            Objects.requireNonNull(profileId, "profileId is required");
        }

        @Override
        public boolean offApp() {
            return true;
        }
    }
}
