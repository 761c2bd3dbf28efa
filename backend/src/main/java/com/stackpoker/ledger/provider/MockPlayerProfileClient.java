package com.stackpoker.ledger.provider;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.Optional;

/**
 * Fixed profile store used until a real identity service is wired in. Seeded with a few
 * demo players; unknown ids resolve to empty.
 */
@Component
public class MockPlayerProfileClient implements PlayerProfileClient {

    private static final Map<String, String> DEMO_PROFILES = Map.of(
            "player-alice", "Alice",
            "player-bob", "Bob",
            "player-carol", "Carol"
    );

    @Override
    public Optional<String> findDisplayName(String userId) {
        if (!StringUtils.hasText(userId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(DEMO_PROFILES.get(userId));
    }
}
