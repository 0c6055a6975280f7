package com.prizeflow.allocation.engine;

import java.util.List;
import java.util.UUID;

/**
 * Immutable input of one scheduling run.
 */
public record AllocationSnapshot(
        UUID tournamentId,
        List<CompetitorProfile> competitors,
        List<CategorySpec> categories,
        AllocationRules rules
) {

    public AllocationSnapshot {
        competitors = competitors == null ? List.of() : List.copyOf(competitors);
        categories = categories == null ? List.of() : List.copyOf(categories);
    }
}
