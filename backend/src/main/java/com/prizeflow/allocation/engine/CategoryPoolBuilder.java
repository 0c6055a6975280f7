package com.prizeflow.allocation.engine;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class CategoryPoolBuilder {

    private static final Logger log = LoggerFactory.getLogger(CategoryPoolBuilder.class);

    private final EligibilityEvaluator eligibilityEvaluator;

    public CategoryPool buildPool(
            CategorySpec category,
            List<CompetitorProfile> competitors,
            ExclusivityTracker tracker,
            AllocationRules rules
    ) {
        List<CategoryPool.Candidate> available = new ArrayList<>();
        Map<FailCode, Integer> failHistogram = new EnumMap<>(FailCode.class);
        Set<UUID> blockedBy = new LinkedHashSet<>();
        int beforeCount = 0;
        int blockedWithinCategory = 0;

        // Rank order fixes the order of blockedByPrizeIds.
        List<CompetitorProfile> byRank = competitors.stream().sorted(CandidateOrdering.BY_RANK).toList();
        for (CompetitorProfile competitor : byRank) {
            EligibilityResult eligibility = eligibilityEvaluator.evaluateForCategory(competitor, category, rules);
            if (rules.verboseLogs()) {
                log.info(
                        "[alloc.check] category={} competitor={} rank={} eligible={} fail={} pass={} warn={}",
                        category.categoryId(),
                        competitor.competitorId(),
                        competitor.rank(),
                        eligibility.eligible(),
                        eligibility.failCodeValues(),
                        eligibility.passCodes(),
                        eligibility.warnCodes()
                );
            }

            if (!eligibility.eligible()) {
                eligibility.failCodes().forEach(code -> failHistogram.merge(code, 1, Integer::sum));
                continue;
            }

            beforeCount++;
            if (tracker.isAvailable(competitor.competitorId(), category)) {
                available.add(new CategoryPool.Candidate(competitor, eligibility));
            } else {
                blockedBy.addAll(tracker.claimedBy(competitor.competitorId()));
                if (tracker.holdsPrizeIn(competitor.competitorId(), category.categoryId())) {
                    blockedWithinCategory++;
                }
            }
        }

        available.sort((left, right) -> CandidateOrdering.forCategory(category)
                .compare(left.competitor(), right.competitor()));

        return new CategoryPool(
                category.categoryId(),
                beforeCount,
                available.size(),
                available,
                Collections.unmodifiableMap(failHistogram),
                new ArrayList<>(blockedBy),
                blockedWithinCategory
        );
    }
}
