package com.stackpoker.ledger.model;

public enum PokerSessionStatus {
    SETUP,
    ACTIVE,
    PAUSED,
    ENDING,
    COMPLETED;

    public boolean isLive() {
        return this == ACTIVE || this == PAUSED || this == ENDING;
    }
}
