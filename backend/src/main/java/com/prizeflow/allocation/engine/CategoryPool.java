package com.prizeflow.allocation.engine;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Eligibility pool of one category at one point of a run.
 *
 * @param beforeCount       eligible competitors, ignoring exclusivity
 * @param afterCount        eligible competitors still available to this category
 * @param orderedCandidates available eligible candidates in winner order
 * @param failHistogram     fail code counts over ineligible competitors, in code order
 * @param blockedByPrizeIds prizes already holding eligible competitors of this pool
 * @param blockedWithinCategory eligible competitors blocked because they already won an
 *                          earlier place of this same category
 */
public record CategoryPool(
        UUID categoryId,
        int beforeCount,
        int afterCount,
        List<Candidate> orderedCandidates,
        Map<FailCode, Integer> failHistogram,
        List<UUID> blockedByPrizeIds,
        int blockedWithinCategory
) {

    public CategoryPool {
        orderedCandidates = List.copyOf(orderedCandidates);
        blockedByPrizeIds = List.copyOf(blockedByPrizeIds);
    }

    public record Candidate(CompetitorProfile competitor, EligibilityResult eligibility) {
    }
}
