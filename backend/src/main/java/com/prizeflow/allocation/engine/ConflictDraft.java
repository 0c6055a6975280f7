package com.prizeflow.allocation.engine;

import com.prizeflow.allocation.model.ConflictType;

import java.util.List;
import java.util.UUID;

/**
 * A conflict detected in a manually edited allocation, before it is persisted.
 */
public record ConflictDraft(
        ConflictType type,
        List<UUID> impactedCompetitors,
        List<UUID> impactedPrizes,
        List<String> reasons,
        UUID suggestedPrizeId,
        UUID suggestedCompetitorId
) {

    public ConflictDraft {
        impactedCompetitors = List.copyOf(impactedCompetitors);
        impactedPrizes = List.copyOf(impactedPrizes);
        reasons = List.copyOf(reasons);
    }

    /**
     * Identity used to recognise the same conflict across reviews.
     */
    public String fingerprint() {
        return fingerprint(type, impactedCompetitors, impactedPrizes);
    }

    public static String fingerprint(ConflictType type, List<UUID> competitors, List<UUID> prizes) {
        return type + "|" + competitors.stream().map(UUID::toString).sorted().toList()
                + "|" + prizes.stream().map(UUID::toString).sorted().toList();
    }
}
