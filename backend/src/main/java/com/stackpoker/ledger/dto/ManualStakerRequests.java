package com.stackpoker.ledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public final class ManualStakerRequests {

    private ManualStakerRequests() {
    }

    public record CreateManualStakerRequest(
            @NotBlank(message = "createdByUserId is required")
            @Size(max = 128, message = "createdByUserId must be at most 128 characters")
            String createdByUserId,

            @NotBlank(message = "displayName is required")
            @Size(max = 255, message = "displayName must be at most 255 characters")
            String displayName,

            @Size(max = 255, message = "contactInfo must be at most 255 characters")
            String contactInfo,

            @Size(max = 2000, message = "notes must be at most 2000 characters")
            String notes
    ) {
    }

    public record UpdateManualStakerRequest(
            @NotBlank(message = "displayName is required")
            @Size(max = 255, message = "displayName must be at most 255 characters")
            String displayName,

            @Size(max = 255, message = "contactInfo must be at most 255 characters")
            String contactInfo,

            @Size(max = 2000, message = "notes must be at most 2000 characters")
            String notes
    ) {
    }
}
