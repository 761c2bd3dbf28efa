package com.stackpoker.ledger.model;

public enum ChipStackUpdateSource {
    MANUAL,
    QUICK_ADJUST,
    REBUY
}
