package com.prizeflow.allocation.dto;

import com.prizeflow.allocation.model.AgeCutoffPolicy;
import com.prizeflow.allocation.model.MultiPrizePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public final class AllocationRequests {

    private AllocationRequests() {
    }

    public record DecisionRequest(
            @NotNull(message = "prizeId is required")
            UUID prizeId,

            UUID competitorId,

            List<@Size(max = 64, message = "reason codes must be at most 64 characters") String> reasonCodes,

            boolean manual
    ) {
    }

    public record DecisionSetRequest(
            @NotNull(message = "decisions is required")
            List<@Valid @NotNull(message = "decision entries must not be null") DecisionRequest> decisions
    ) {
    }

    public record PinnedAwardRequest(
            @NotNull(message = "prizeId is required")
            UUID prizeId,

            @NotNull(message = "competitorId is required")
            UUID competitorId
    ) {
    }

    /**
     * Rule switches for one what-if run. Null fields keep the tournament's stored value.
     */
    public record RuleOverrideRequest(
            Boolean strictAge,
            Boolean allowUnratedInRating,
            Boolean allowMissingDobForAge,
            AgeCutoffPolicy ageCutoffPolicy,
            LocalDate ageCutoffDate,
            MultiPrizePolicy multiPrizePolicy,
            List<@NotNull(message = "category ids must not be null") UUID> categoryPriorityOrder,
            Boolean verboseLogs
    ) {
    }

    public record WhatIfPreviewRequest(
            List<@Valid @NotNull(message = "override entries must not be null") PinnedAwardRequest> overrides,

            @Valid
            RuleOverrideRequest rules
    ) {
    }

    public record ResolveConflictRequest(
            @Size(max = 2000, message = "note must be at most 2000 characters")
            String note
    ) {
    }
}
