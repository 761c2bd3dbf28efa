package com.stackpoker.ledger.repository;

import com.stackpoker.ledger.model.ManualStakerProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ManualStakerProfileRepository extends JpaRepository<ManualStakerProfile, UUID> {

    List<ManualStakerProfile> findByCreatedByUserIdOrderByDisplayNameAsc(String createdByUserId);

    List<ManualStakerProfile> findByCreatedByUserIdAndDisplayNameContainingIgnoreCaseOrderByDisplayNameAsc(
            String createdByUserId,
            String displayNameFragment
    );
}
