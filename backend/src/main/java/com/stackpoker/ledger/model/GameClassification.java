package com.stackpoker.ledger.model;

public enum GameClassification {
    CASH_GAME,
    TOURNAMENT
}
