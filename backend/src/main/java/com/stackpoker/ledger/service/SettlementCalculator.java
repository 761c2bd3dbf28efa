package com.stackpoker.ledger.service;

import com.stackpoker.ledger.config.LedgerRuntimeProperties;
import com.stackpoker.ledger.model.StakeContract;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Settlement formula for one stake:
 * <pre>
 * profit             = cashout - buyIn
 * adjustedShare      = profit * percentage * markup
 * settlementAmount   = -adjustedShare
 * </pre>
 * A negative amount means the staked player owes the staker; a positive amount means the
 * staker owes the player their share of the loss. Only the final result is rounded, so the
 * same inputs always produce the same amount.
 */
@Component
public class SettlementCalculator {

    private final LedgerRuntimeProperties ledgerRuntimeProperties;

    public SettlementCalculator(LedgerRuntimeProperties ledgerRuntimeProperties) {
        this.ledgerRuntimeProperties = ledgerRuntimeProperties;
    }

    public BigDecimal settlementAmount(
            SessionFacts facts,
            BigDecimal stakePercentage,
            BigDecimal markup
    ) {
        Objects.requireNonNull(facts, "facts are required");
        Objects.requireNonNull(stakePercentage, "stakePercentage is required");
        Objects.requireNonNull(markup, "markup is required");

        BigDecimal profit = facts.profit();
        BigDecimal stakerGrossShare = profit.multiply(stakePercentage);
        BigDecimal adjustedStakerShare = stakerGrossShare.multiply(markup);
        return adjustedStakerShare.negate()
                .setScale(ledgerRuntimeProperties.getMoney().getScale(), RoundingMode.HALF_UP);
    }

    /**
     * Captures {@code facts} on the stake and refreshes its settlement amount. The stake is
     * left untouched when nothing would change.
     *
     * @return true when any stored financial value changed
     */
    public boolean applyTo(StakeContract stake, SessionFacts facts, OffsetDateTime now) {
        BigDecimal amount = settlementAmount(facts, stake.getStakePercentage(), stake.getMarkup());
        boolean changed = !sameAmount(stake.getSessionBuyIn(), facts.buyIn())
                || !sameAmount(stake.getSessionCashout(), facts.cashout())
                || !sameAmount(stake.getSettlementAmount(), amount);
        if (!changed) {
            return false;
        }

        stake.setSessionBuyIn(facts.buyIn());
        stake.setSessionCashout(facts.cashout());
        stake.setSettlementAmount(amount);
        stake.setLastUpdatedAt(now);
        return true;
    }

    /**
     * True when the stake was computed from facts other than {@code current}.
     */
    public boolean isOutOfSync(StakeContract stake, SessionFacts current) {
        if (current == null) {
            return false;
        }
        return !sameAmount(stake.getSessionBuyIn(), current.buyIn())
                || !sameAmount(stake.getSessionCashout(), current.cashout());
    }

    private static boolean sameAmount(BigDecimal left, BigDecimal right) {
        if (left == null || right == null) {
            return left == right;
        }
        return left.compareTo(right) == 0;
    }

    /**
     * Buy-in and cashout a settlement is computed from. For a live session the cashout is
     * the current chip stack.
     */
    public record SessionFacts(BigDecimal buyIn, BigDecimal cashout) {
        public SessionFacts {
            Objects.requireNonNull(buyIn, "buyIn is required");
            Objects.requireNonNull(cashout, "cashout is required");
        }

        public BigDecimal profit() {
            return cashout.subtract(buyIn);
        }
    }
}
