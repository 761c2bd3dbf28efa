package com.stackpoker.ledger.repository;

import com.stackpoker.ledger.model.StakeContract;
import com.stackpoker.ledger.model.StakeStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StakeContractRepository extends JpaRepository<StakeContract, UUID> {

    List<StakeContract> findBySessionIdOrderByProposedAtAsc(UUID sessionId);

    List<StakeContract> findByStakedPlayerIdOrStakerUserIdOrderByProposedAtDesc(
            String stakedPlayerId,
            String stakerUserId
    );

    boolean existsBySessionIdAndStakerUserIdAndStatusIn(
            UUID sessionId,
            String stakerUserId,
            Collection<StakeStatus> statuses
    );

    boolean existsBySessionIdAndManualStakerIdAndStatusIn(
            UUID sessionId,
            UUID manualStakerId,
            Collection<StakeStatus> statuses
    );

    /**
     * Writes the staker name column only; terms and status on the matched rows are left as
     * they are in the database.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE StakeContract s " +
            "SET s.stakerDisplayName = :displayName " +
            "WHERE s.manualStakerId = :manualStakerId " +
            "AND s.status IN :statuses")
    int updateStakerDisplayNameForManualStaker(@Param("manualStakerId") UUID manualStakerId,
                                               @Param("statuses") Collection<StakeStatus> statuses,
                                               @Param("displayName") String displayName);

    long countByStatus(StakeStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from StakeContract s where s.stakeId = :stakeId")
    Optional<StakeContract> findByStakeIdForUpdate(@Param("stakeId") UUID stakeId);
}
