package com.stackpoker.ledger.repository;

import com.stackpoker.ledger.model.PokerSession;
import com.stackpoker.ledger.model.PokerSessionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PokerSessionRepository extends JpaRepository<PokerSession, UUID> {

    List<PokerSession> findByPlayerIdOrderByCreatedAtDesc(String playerId);

    long countByStatusIn(Collection<PokerSessionStatus> statuses);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from PokerSession s where s.sessionId = :sessionId")
    Optional<PokerSession> findBySessionIdForUpdate(@Param("sessionId") UUID sessionId);
}
