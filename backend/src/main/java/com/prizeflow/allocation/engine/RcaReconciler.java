package com.prizeflow.allocation.engine;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lines up preview coverage with the committed allocation. Read-only.
 */
@Component
public class RcaReconciler {

    public List<RcaRow> reconcile(
            List<CoverageEntry> coverage,
            List<CommittedAward> committedAwards,
            Map<UUID, CompetitorProfile> competitorsById
    ) {
        Map<UUID, CommittedAward> awardsByPrize = committedAwards.stream()
                .collect(Collectors.toMap(CommittedAward::prizeId, Function.identity(), (left, right) -> left));

        List<RcaRow> rows = new ArrayList<>(coverage.size());
        for (CoverageEntry entry : coverage) {
            CommittedAward award = awardsByPrize.get(entry.prizeId());
            UUID finalWinnerId = award == null ? null : award.competitorId();
            CompetitorProfile finalWinner = finalWinnerId == null ? null : competitorsById.get(finalWinnerId);

            rows.add(new RcaRow(
                    entry.categoryId(),
                    entry.categoryName(),
                    entry.mainCategory(),
                    entry.prizeId(),
                    entry.place(),
                    entry.prizeLabel(),
                    entry.cashAmount(),
                    entry.winnerId(),
                    entry.winnerName(),
                    entry.winnerRank(),
                    entry.winnerRating(),
                    finalWinnerId,
                    finalWinner == null ? null : finalWinner.name(),
                    finalWinner == null ? null : finalWinner.rank(),
                    finalWinner == null ? null : finalWinner.rating(),
                    classify(entry.winnerId(), finalWinnerId),
                    overrideReason(award),
                    entry.reasonCode(),
                    entry.reasonLabel(),
                    entry.diagnosisSummary(),
                    entry.failHistogram().keySet().stream().map(FailCode::code).toList(),
                    entry.unfilled(),
                    entry.blockedByOnePrize(),
                    entry.candidatesBeforeOnePrize(),
                    entry.candidatesAfterOnePrize()
            ));
        }
        return rows;
    }

    /**
     * Identical winners (both empty included) match; otherwise an empty committed
     * winner means no eligible winner, and any other committed winner is an override.
     */
    public static RcaStatus classify(UUID engineWinnerId, UUID finalWinnerId) {
        if (Objects.equals(engineWinnerId, finalWinnerId)) {
            return RcaStatus.MATCH;
        }
        if (finalWinnerId != null) {
            return RcaStatus.OVERRIDDEN;
        }
        return RcaStatus.NO_ELIGIBLE_WINNER;
    }

    private static String overrideReason(CommittedAward award) {
        if (award == null || !award.manual() || award.reasonCodes().isEmpty()) {
            return null;
        }
        String reason = award.reasonCodes().stream()
                .filter(code -> code.contains("override") || code.contains("manual"))
                .collect(Collectors.joining("; "));
        return reason.isEmpty() ? null : reason;
    }
}
