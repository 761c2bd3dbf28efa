package com.stackpoker.ledger.model;

public enum StakeAction {
    PROPOSED,
    CREATED_OFF_APP,
    ACCEPTED,
    DECLINED,
    CANCELLED,
    SETTLED,
    SETTLEMENT_INITIATED,
    SETTLEMENT_CONFIRMED,
    SETTLEMENT_REJECTED,
    SETTLEMENT_RESET,
    REOPENED
}
