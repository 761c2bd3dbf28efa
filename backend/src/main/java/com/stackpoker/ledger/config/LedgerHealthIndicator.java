package com.stackpoker.ledger.config;

import com.stackpoker.ledger.model.PokerSessionStatus;
import com.stackpoker.ledger.model.StakeStatus;
import com.stackpoker.ledger.repository.PokerSessionRepository;
import com.stackpoker.ledger.repository.StakeContractRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.EnumSet;

@Component
public class LedgerHealthIndicator implements HealthIndicator {

    private final PokerSessionRepository pokerSessionRepository;
    private final StakeContractRepository stakeContractRepository;

    public LedgerHealthIndicator(
            PokerSessionRepository pokerSessionRepository,
            StakeContractRepository stakeContractRepository
    ) {
        this.pokerSessionRepository = pokerSessionRepository;
        this.stakeContractRepository = stakeContractRepository;
    }

    @Override
    public Health health() {
        try {
            long liveSessions = pokerSessionRepository.countByStatusIn(EnumSet.of(
                    PokerSessionStatus.ACTIVE,
                    PokerSessionStatus.PAUSED,
                    PokerSessionStatus.ENDING));
            long awaitingSettlement = stakeContractRepository.countByStatus(StakeStatus.AWAITING_SETTLEMENT);
            long awaitingConfirmation = stakeContractRepository.countByStatus(StakeStatus.AWAITING_CONFIRMATION);
            return Health.up()
                    .withDetail("liveSessions", liveSessions)
                    .withDetail("stakesAwaitingSettlement", awaitingSettlement)
                    .withDetail("stakesAwaitingConfirmation", awaitingConfirmation)
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withException(e)
                    .build();
        }
    }
}
