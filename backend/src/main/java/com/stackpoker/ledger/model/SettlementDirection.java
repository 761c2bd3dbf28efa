package com.stackpoker.ledger.model;

import java.math.BigDecimal;

public enum SettlementDirection {
    PLAYER_OWES_STAKER,
    STAKER_OWES_PLAYER,
    EVEN;

    public static SettlementDirection of(BigDecimal settlementAmount) {
        int sign = settlementAmount == null ? 0 : settlementAmount.signum();
        if (sign < 0) {
            return PLAYER_OWES_STAKER;
        }
        if (sign > 0) {
            return STAKER_OWES_PLAYER;
        }
        return EVEN;
    }
}
