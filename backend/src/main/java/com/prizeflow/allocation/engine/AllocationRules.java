package com.prizeflow.allocation.engine;

import com.prizeflow.allocation.model.MultiPrizePolicy;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Effective rule switches for one run, already merged from the tournament's rule
 * config and the configured defaults. {@code referenceDate} is the resolved age cutoff.
 */
public record AllocationRules(
        boolean strictAge,
        boolean allowUnratedInRating,
        boolean allowMissingDobForAge,
        LocalDate referenceDate,
        MultiPrizePolicy multiPrizePolicy,
        List<UUID> categoryPriorityOrder,
        boolean verboseLogs
) {

    public AllocationRules {
        Objects.requireNonNull(referenceDate, "referenceDate");
        multiPrizePolicy = multiPrizePolicy == null ? MultiPrizePolicy.SINGLE : multiPrizePolicy;
        categoryPriorityOrder = categoryPriorityOrder == null ? List.of() : List.copyOf(categoryPriorityOrder);
    }

    public static AllocationRules defaults(LocalDate referenceDate) {
        return new AllocationRules(true, false, false, referenceDate, MultiPrizePolicy.SINGLE, List.of(), false);
    }

    public AllocationRules withAllowUnratedInRating(boolean allowUnrated) {
        return new AllocationRules(
                strictAge,
                allowUnrated,
                allowMissingDobForAge,
                referenceDate,
                multiPrizePolicy,
                categoryPriorityOrder,
                verboseLogs
        );
    }

    public AllocationRules withMultiPrizePolicy(MultiPrizePolicy policy) {
        return new AllocationRules(
                strictAge,
                allowUnratedInRating,
                allowMissingDobForAge,
                referenceDate,
                policy,
                categoryPriorityOrder,
                verboseLogs
        );
    }
}
