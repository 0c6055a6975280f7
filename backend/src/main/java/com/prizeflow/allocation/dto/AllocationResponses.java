package com.prizeflow.allocation.dto;

import com.prizeflow.allocation.engine.DiagnosisAxis;
import com.prizeflow.allocation.engine.RcaStatus;
import com.prizeflow.allocation.model.CategoryType;
import com.prizeflow.allocation.model.ConflictStatus;
import com.prizeflow.allocation.model.ConflictType;
import com.prizeflow.allocation.model.Gender;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class AllocationResponses {

    private AllocationResponses() {
    }

    public record PreviewResponse(
            UUID tournamentId,
            PreviewTotals totals,
            List<Decision> decisions,
            List<Coverage> coverage,
            boolean whatIf
    ) {
    }

    public record PreviewTotals(
            int competitors,
            int prizes,
            int filled,
            int unfilled,
            int blockedByOnePrize,
            int pinned
    ) {
    }

    public record Decision(
            UUID prizeId,
            UUID competitorId,
            List<String> reasonCodes,
            boolean manual
    ) {
    }

    public record Coverage(
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
            String reasonCode,
            String reasonLabel,
            Map<String, Integer> failHistogram,
            String diagnosisSummary,
            boolean unfilled,
            boolean blockedByOnePrize,
            List<UUID> blockedByPrizeIds
    ) {
    }

    public record CommitResult(
            int version,
            int count,
            int resolvedConflicts,
            OffsetDateTime committedAt
    ) {
    }

    public record CurrentAllocation(
            UUID tournamentId,
            int version,
            UUID committedBy,
            OffsetDateTime committedAt,
            List<CommittedAllocation> allocations
    ) {
    }

    public record CommittedAllocation(
            UUID allocationId,
            UUID prizeId,
            UUID competitorId,
            List<String> reasonCodes,
            boolean manual,
            UUID decidedBy,
            OffsetDateTime decidedAt
    ) {
    }

    public record VersionSummary(
            int version,
            UUID committedBy,
            OffsetDateTime committedAt,
            int allocationCount
    ) {
    }

    public record Conflict(
            UUID conflictId,
            UUID tournamentId,
            ConflictType type,
            List<UUID> impactedCompetitors,
            List<UUID> impactedPrizes,
            List<String> reasons,
            UUID suggestedPrizeId,
            UUID suggestedCompetitorId,
            ConflictStatus status,
            String resolutionNote,
            UUID openedBy,
            UUID resolvedBy,
            OffsetDateTime createdAt,
            OffsetDateTime resolvedAt
    ) {
    }

    public record ReviewResult(
            List<Conflict> opened,
            int stillOpen,
            int superseded
    ) {
    }

    public record RcaEntry(
            UUID categoryId,
            String categoryName,
            boolean mainCategory,
            UUID prizeId,
            int place,
            String prizeLabel,
            BigDecimal cashAmount,
            UUID engineWinnerId,
            String engineWinnerName,
            Integer engineWinnerRank,
            Integer engineWinnerRating,
            UUID finalWinnerId,
            String finalWinnerName,
            Integer finalWinnerRank,
            Integer finalWinnerRating,
            RcaStatus status,
            String overrideReason,
            String reasonCode,
            String reasonLabel,
            String diagnosisSummary,
            List<String> failCodes,
            boolean unfilled,
            boolean blockedByOnePrize,
            int candidatesBeforeOnePrize,
            int candidatesAfterOnePrize
    ) {
    }

    public record InstitutionPrizesResponse(
            UUID tournamentId,
            int competitorsLoaded,
            int maxRank,
            List<InstitutionGroup> groups
    ) {
    }

    public record InstitutionGroup(
            UUID groupId,
            String name,
            InstitutionGroupConfig config,
            List<InstitutionPrizeResult> prizes,
            int eligibleInstitutions,
            int ineligibleInstitutions,
            List<String> ineligibleReasons
    ) {
    }

    public record InstitutionGroupConfig(
            String groupBy,
            int teamSize,
            int femaleSlots,
            int maleSlots,
            String scoringMode
    ) {
    }

    public record InstitutionPrizeResult(
            UUID prizeId,
            int place,
            BigDecimal cashAmount,
            boolean trophy,
            boolean medal,
            InstitutionWinner winner
    ) {
    }

    public record InstitutionWinner(
            String key,
            String label,
            int totalPoints,
            int rankSum,
            int bestIndividualRank,
            List<TeamMember> players
    ) {
    }

    public record TeamMember(
            UUID competitorId,
            String name,
            int rank,
            int points,
            Gender gender
    ) {
    }

    public record ReasonCodeLabel(
            String code,
            String label
    ) {
    }

    public record FailCodeLabel(
            String code,
            String label,
            DiagnosisAxis axis
    ) {
    }
}
