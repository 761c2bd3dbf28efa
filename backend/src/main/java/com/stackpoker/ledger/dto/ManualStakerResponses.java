package com.stackpoker.ledger.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public final class ManualStakerResponses {

    private ManualStakerResponses() {
    }

    public record ManualStaker(
            UUID profileId,
            String createdByUserId,
            String displayName,
            String contactInfo,
            String notes,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }
}
