package com.stackpoker.ledger.provider;

import java.util.Optional;

/**
 * Lookup of app user profiles held by the external identity store.
 */
public interface PlayerProfileClient {

    /**
     * @return the user's display name, or empty when the user is unknown
     */
    Optional<String> findDisplayName(String userId);
}
