package com.prizeflow.allocation.engine;

import com.prizeflow.allocation.model.CategoryType;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-prize outcome of a scheduling run, with the diagnostics needed to explain it.
 * Derived on every run and never stored.
 */
public record CoverageEntry(
        UUID categoryId,
        String categoryName,
        CategoryType categoryType,
        boolean mainCategory,
        UUID prizeId,
        int place,
        String prizeLabel,
        BigDecimal cashAmount,
        boolean trophy,
        boolean medal,
        UUID winnerId,
        String winnerName,
        Integer winnerRank,
        Integer winnerRating,
        int candidatesBeforeOnePrize,
        int candidatesAfterOnePrize,
        ReasonCode reasonCode,
        String reasonLabel,
        Map<FailCode, Integer> failHistogram,
        String diagnosisSummary,
        boolean unfilled,
        boolean blockedByOnePrize,
        List<UUID> blockedByPrizeIds
) {

    public CoverageEntry {
        failHistogram = failHistogram == null ? Map.of() : failHistogram;
        blockedByPrizeIds = blockedByPrizeIds == null ? List.of() : List.copyOf(blockedByPrizeIds);
    }

    static CoverageEntry filled(ScheduledPrize scheduled, CompetitorProfile winner, CategoryPool pool) {
        CategorySpec category = scheduled.category();
        PrizeSpec prize = scheduled.prize();
        return new CoverageEntry(
                category.categoryId(),
                category.name(),
                category.categoryType(),
                category.main(),
                prize.prizeId(),
                prize.place(),
                prizeLabel(category, prize),
                prize.cashAmount(),
                prize.trophy(),
                prize.medal(),
                winner.competitorId(),
                winner.name(),
                winner.rank(),
                winner.rating(),
                pool.beforeCount(),
                pool.afterCount(),
                null,
                null,
                pool.failHistogram(),
                null,
                false,
                false,
                List.of()
        );
    }

    static CoverageEntry unfilled(
            ScheduledPrize scheduled,
            CategoryPool pool,
            ReasonCode reasonCode,
            String diagnosisSummary
    ) {
        CategorySpec category = scheduled.category();
        PrizeSpec prize = scheduled.prize();
        boolean blocked = reasonCode == ReasonCode.BLOCKED_BY_ONE_PRIZE_POLICY;
        return new CoverageEntry(
                category.categoryId(),
                category.name(),
                category.categoryType(),
                category.main(),
                prize.prizeId(),
                prize.place(),
                prizeLabel(category, prize),
                prize.cashAmount(),
                prize.trophy(),
                prize.medal(),
                null,
                null,
                null,
                null,
                pool.beforeCount(),
                pool.afterCount(),
                reasonCode,
                reasonCode.label(),
                pool.failHistogram(),
                diagnosisSummary,
                true,
                blocked,
                blocked ? pool.blockedByPrizeIds() : List.of()
        );
    }

    private static String prizeLabel(CategorySpec category, PrizeSpec prize) {
        return category.name() + " #" + prize.place();
    }
}
