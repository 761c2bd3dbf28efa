package com.stackpoker.ledger.service;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Published when a session reaches COMPLETED. Listeners run synchronously inside the
 * finalizing transaction.
 */
public record SessionCompletedEvent(
        UUID sessionId,
        String playerId,
        BigDecimal totalBuyIn,
        BigDecimal cashout,
        OffsetDateTime completedAt
) {
}
