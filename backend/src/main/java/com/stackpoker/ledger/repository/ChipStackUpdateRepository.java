package com.stackpoker.ledger.repository;

import com.stackpoker.ledger.model.ChipStackUpdate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ChipStackUpdateRepository extends JpaRepository<ChipStackUpdate, UUID> {

    List<ChipStackUpdate> findBySessionIdOrderBySequenceNumberAsc(UUID sessionId);
}
