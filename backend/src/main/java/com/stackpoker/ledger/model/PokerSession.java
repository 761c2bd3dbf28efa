package com.stackpoker.ledger.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One playing session. Profit is never stored: it is derived from {@code totalBuyIn}
 * and either the cashout (completed) or the latest chip stack update (live).
 */
@Getter
@Setter
@Entity
@Table(name = "poker_sessions")
public class PokerSession {

    @Id
    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(name = "player_id", nullable = false, updatable = false, length = 128)
    private String playerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "game_classification", nullable = false, length = 32)
    private GameClassification gameClassification = GameClassification.CASH_GAME;

    @Column(name = "game_name", length = 255)
    private String gameName;

    @Column(name = "stakes", length = 64)
    private String stakes;

    @Column(name = "location", length = 255)
    private String location;

    @Column(name = "tournament_type", length = 64)
    private String tournamentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private PokerSessionStatus status = PokerSessionStatus.SETUP;

    @Column(name = "base_buy_in", precision = 18, scale = 2)
    private BigDecimal baseBuyIn;

    @Column(name = "total_buy_in", precision = 18, scale = 2)
    private BigDecimal totalBuyIn;

    @Column(name = "rebuy_count", nullable = false)
    private Integer rebuyCount = 0;

    @Column(name = "cashout", precision = 18, scale = 2)
    private BigDecimal cashout;

    @Column(name = "elapsed_active_seconds", nullable = false)
    private Long elapsedActiveSeconds = 0L;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "last_active_at")
    private OffsetDateTime lastActiveAt;

    @Column(name = "last_paused_at")
    private OffsetDateTime lastPausedAt;

    @Column(name = "ended_at")
    private OffsetDateTime endedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public boolean isTournament() {
        return gameClassification == GameClassification.TOURNAMENT;
    }
}
