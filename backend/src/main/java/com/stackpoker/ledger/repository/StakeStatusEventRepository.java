package com.stackpoker.ledger.repository;

import com.stackpoker.ledger.model.StakeStatusEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface StakeStatusEventRepository extends JpaRepository<StakeStatusEvent, UUID> {

    List<StakeStatusEvent> findByStakeIdOrderByOccurredAtAsc(UUID stakeId);
}
