package com.prizeflow.allocation.engine;

import java.util.Comparator;

/**
 * Total orders used to pick a winner from an eligibility pool. Every comparator ends
 * on the competitor id so ties never depend on input order.
 */
public final class CandidateOrdering {

    public static final Comparator<CompetitorProfile> BY_RANK = Comparator
            .comparingInt(CompetitorProfile::rank)
            .thenComparing(CompetitorProfile::rating, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(CompetitorProfile::name, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(CompetitorProfile::competitorId);

    // Latest birth date first.
    public static final Comparator<CompetitorProfile> YOUNGEST_FIRST = Comparator
            .comparing(CompetitorProfile::dob, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparingInt(CompetitorProfile::rank)
            .thenComparing(CompetitorProfile::competitorId);

    private CandidateOrdering() {
    }

    public static Comparator<CompetitorProfile> forCategory(CategorySpec category) {
        return category.categoryType().isYoungest() ? YOUNGEST_FIRST : BY_RANK;
    }
}
