package com.prizeflow.allocation.engine;

import com.prizeflow.allocation.model.MultiPrizePolicy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Run-scoped record of which competitor holds which prize. A new tracker is created
 * for every scheduling run or review; it is never shared between runs.
 */
public final class ExclusivityTracker {

    private final MultiPrizePolicy policy;
    private final Map<UUID, List<Claim>> claimsByCompetitor = new LinkedHashMap<>();

    public ExclusivityTracker(MultiPrizePolicy policy) {
        this.policy = policy == null ? MultiPrizePolicy.SINGLE : policy;
    }

    public static ExclusivityTracker singlePrize() {
        return new ExclusivityTracker(MultiPrizePolicy.SINGLE);
    }

    public MultiPrizePolicy policy() {
        return policy;
    }

    public boolean isClaimed(UUID competitorId) {
        return claimsByCompetitor.containsKey(competitorId);
    }

    public boolean holdsPrizeIn(UUID competitorId, UUID categoryId) {
        List<Claim> claims = claimsByCompetitor.get(competitorId);
        return claims != null && claims.stream().anyMatch(claim -> claim.categoryId().equals(categoryId));
    }

    public boolean isAvailable(UUID competitorId, CategorySpec category) {
        return isAvailable(competitorId, category.categoryId(), category.main());
    }

    public boolean isAvailable(UUID competitorId, UUID categoryId, boolean mainCategory) {
        List<Claim> claims = claimsByCompetitor.get(competitorId);
        if (claims == null || claims.isEmpty()) {
            return true;
        }
        if (holdsPrizeIn(competitorId, categoryId)) {
            return false;
        }
        return switch (policy) {
            case SINGLE -> false;
            case MAIN_PLUS_ONE_SIDE -> claims.stream().noneMatch(claim -> claim.mainCategory() == mainCategory);
            case UNLIMITED -> true;
        };
    }

    public void claim(UUID competitorId, PrizeSpec prize, CategorySpec category) {
        claim(competitorId, prize.prizeId(), category.categoryId(), category.main());
    }

    public void claim(UUID competitorId, UUID prizeId, UUID categoryId, boolean mainCategory) {
        if (competitorId == null || prizeId == null || categoryId == null) {
            throw new IllegalStateException("Claim requires competitor, prize and category ids");
        }
        if (!isAvailable(competitorId, categoryId, mainCategory)) {
            throw new IllegalStateException(
                    "Competitor " + competitorId + " cannot claim prize " + prizeId
                            + " under policy " + policy + "; already holds " + claimedBy(competitorId)
            );
        }
        claimsByCompetitor
                .computeIfAbsent(competitorId, ignored -> new ArrayList<>())
                .add(new Claim(prizeId, categoryId, mainCategory));
    }

    /**
     * @return prize ids held by the competitor, in claim order
     */
    public List<UUID> claimedBy(UUID competitorId) {
        List<Claim> claims = claimsByCompetitor.get(competitorId);
        if (claims == null) {
            return List.of();
        }
        return claims.stream().map(Claim::prizeId).toList();
    }

    public int claimedCompetitorCount() {
        return claimsByCompetitor.size();
    }

    private record Claim(UUID prizeId, UUID categoryId, boolean mainCategory) {
    }
}
