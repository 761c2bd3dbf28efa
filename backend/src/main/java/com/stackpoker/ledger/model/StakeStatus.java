package com.stackpoker.ledger.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum StakeStatus {
    PROPOSED,
    AWAITING_SETTLEMENT,
    /** One party has marked the stake paid and the other has not yet confirmed. */
    AWAITING_CONFIRMATION,
    SETTLED,
    DECLINED,
    CANCELLED;

    private static final Set<StakeStatus> UNRESOLVED =
            Collections.unmodifiableSet(EnumSet.of(PROPOSED, AWAITING_SETTLEMENT, AWAITING_CONFIRMATION));

    /**
     * Unresolved stakes still follow the session's financial facts.
     */
    public boolean isUnresolved() {
        return UNRESOLVED.contains(this);
    }

    public static Set<StakeStatus> unresolved() {
        return UNRESOLVED;
    }
}
