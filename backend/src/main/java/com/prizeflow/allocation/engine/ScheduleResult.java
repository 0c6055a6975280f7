package com.prizeflow.allocation.engine;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public record ScheduleResult(List<AllocationDecision> decisions, List<CoverageEntry> coverage) {

    public ScheduleResult {
        decisions = List.copyOf(decisions);
        coverage = List.copyOf(coverage);
    }

    public Optional<UUID> winnerOf(UUID prizeId) {
        return decisions.stream()
                .filter(decision -> decision.prizeId().equals(prizeId))
                .map(AllocationDecision::competitorId)
                .findFirst();
    }

    public int filledCount() {
        return decisions.size();
    }

    public int unfilledCount() {
        return (int) coverage.stream().filter(CoverageEntry::unfilled).count();
    }
}
