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

@Getter
@Setter
@Entity
@Table(name = "stake_contracts")
public class StakeContract {

    @Id
    @Column(name = "stake_id", nullable = false, updatable = false)
    private UUID stakeId;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(name = "session_game_name", length = 255)
    private String sessionGameName;

    @Column(name = "session_stakes", length = 64)
    private String sessionStakes;

    @Column(name = "session_date")
    private OffsetDateTime sessionDate;

    @Column(name = "staker_user_id", length = 128, updatable = false)
    private String stakerUserId;

    @Column(name = "manual_staker_id", updatable = false)
    private UUID manualStakerId;

    @Column(name = "staker_display_name", length = 255)
    private String stakerDisplayName;

    @Column(name = "staked_player_id", nullable = false, updatable = false, length = 128)
    private String stakedPlayerId;

    @Column(name = "stake_percentage", nullable = false, precision = 7, scale = 4)
    private BigDecimal stakePercentage;

    @Column(name = "markup", nullable = false, precision = 9, scale = 4)
    private BigDecimal markup;

    @Column(name = "session_buy_in", nullable = false, precision = 18, scale = 2)
    private BigDecimal sessionBuyIn = BigDecimal.ZERO;

    @Column(name = "session_cashout", nullable = false, precision = 18, scale = 2)
    private BigDecimal sessionCashout = BigDecimal.ZERO;

    @Column(name = "settlement_amount", nullable = false, precision = 18, scale = 2)
    private BigDecimal settlementAmount = BigDecimal.ZERO;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private StakeStatus status = StakeStatus.PROPOSED;

    @Column(name = "tournament_session", nullable = false)
    private boolean tournamentSession;

    @Column(name = "off_app_staker", nullable = false, updatable = false)
    private boolean offAppStaker;

    @Column(name = "reopen_count", nullable = false)
    private Integer reopenCount = 0;

    @Column(name = "proposed_at", nullable = false, updatable = false)
    private OffsetDateTime proposedAt = OffsetDateTime.now();

    @Column(name = "accepted_at")
    private OffsetDateTime acceptedAt;

    @Column(name = "settled_at")
    private OffsetDateTime settledAt;

    @Column(name = "reopened_at")
    private OffsetDateTime reopenedAt;

    @Column(name = "settlement_initiator_user_id", length = 128)
    private String settlementInitiatorUserId;

    @Column(name = "settlement_confirmer_user_id", length = 128)
    private String settlementConfirmerUserId;

    @Column(name = "settlement_initiated_at")
    private OffsetDateTime settlementInitiatedAt;

    @Column(name = "last_updated_at", nullable = false)
    private OffsetDateTime lastUpdatedAt = OffsetDateTime.now();

    public StakerRef getStakerRef() {
        if (manualStakerId != null) {
            return StakerRef.manualStaker(manualStakerId, stakerDisplayName);
        }
        return StakerRef.appUser(stakerUserId);
    }

    public void setStakerRef(StakerRef stakerRef) {
        if (stakerRef instanceof StakerRef.ManualStaker manualStaker) {
            this.manualStakerId = manualStaker.profileId();
            this.stakerUserId = null;
            this.stakerDisplayName = manualStaker.displayNameFallback();
        } else if (stakerRef instanceof StakerRef.AppUser appUser) {
            this.stakerUserId = appUser.userId();
            this.manualStakerId = null;
        }
        this.offAppStaker = stakerRef.offApp();
    }
}
