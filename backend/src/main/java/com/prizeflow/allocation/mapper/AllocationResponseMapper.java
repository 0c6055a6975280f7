package com.prizeflow.allocation.mapper;

import com.prizeflow.allocation.dto.AllocationResponses;
import com.prizeflow.allocation.engine.AllocationDecision;
import com.prizeflow.allocation.engine.CoverageEntry;
import com.prizeflow.allocation.engine.FailCode;
import com.prizeflow.allocation.engine.InstitutionAllocation;
import com.prizeflow.allocation.engine.InstitutionGroupResult;
import com.prizeflow.allocation.engine.InstitutionGroupSpec;
import com.prizeflow.allocation.engine.InstitutionStanding;
import com.prizeflow.allocation.engine.RcaRow;
import com.prizeflow.allocation.engine.ReasonCode;
import com.prizeflow.allocation.engine.ScheduleResult;
import com.prizeflow.allocation.model.Allocation;
import com.prizeflow.allocation.model.AllocationConflict;
import com.prizeflow.allocation.model.AllocationVersion;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Component
public class AllocationResponseMapper {

    public AllocationResponses.PreviewResponse toPreviewResponse(
            UUID tournamentId,
            int competitorCount,
            ScheduleResult result,
            boolean whatIf
    ) {
        int blocked = (int) result.coverage().stream().filter(CoverageEntry::blockedByOnePrize).count();
        int pinned = (int) result.decisions().stream().filter(AllocationDecision::manual).count();
        return new AllocationResponses.PreviewResponse(
                tournamentId,
                new AllocationResponses.PreviewTotals(
                        competitorCount,
                        result.coverage().size(),
                        result.filledCount(),
                        result.unfilledCount(),
                        blocked,
                        pinned
                ),
                result.decisions().stream().map(this::toDecisionResponse).toList(),
                result.coverage().stream().map(this::toCoverageResponse).toList(),
                whatIf
        );
    }

    public AllocationResponses.Decision toDecisionResponse(AllocationDecision decision) {
        return new AllocationResponses.Decision(
                decision.prizeId(),
                decision.competitorId(),
                decision.reasonCodes(),
                decision.manual()
        );
    }

    public AllocationResponses.Coverage toCoverageResponse(CoverageEntry entry) {
        return new AllocationResponses.Coverage(
                entry.categoryId(),
                entry.categoryName(),
                entry.categoryType(),
                entry.mainCategory(),
                entry.prizeId(),
                entry.place(),
                entry.prizeLabel(),
                entry.cashAmount(),
                entry.trophy(),
                entry.medal(),
                entry.winnerId(),
                entry.winnerName(),
                entry.winnerRank(),
                entry.winnerRating(),
                entry.candidatesBeforeOnePrize(),
                entry.candidatesAfterOnePrize(),
                entry.reasonCode() != null ? entry.reasonCode().name() : null,
                entry.reasonLabel(),
                toFailHistogram(entry.failHistogram()),
                entry.diagnosisSummary(),
                entry.unfilled(),
                entry.blockedByOnePrize(),
                entry.blockedByPrizeIds()
        );
    }

    public AllocationResponses.CurrentAllocation toCurrentAllocationResponse(
            AllocationVersion version,
            List<Allocation> allocations
    ) {
        return new AllocationResponses.CurrentAllocation(
                version.getTournamentId(),
                version.getVersion(),
                version.getCommittedBy(),
                version.getCommittedAt(),
                allocations.stream().map(this::toCommittedAllocationResponse).toList()
        );
    }

    public AllocationResponses.CommittedAllocation toCommittedAllocationResponse(Allocation allocation) {
        return new AllocationResponses.CommittedAllocation(
                allocation.getAllocationId(),
                allocation.getPrizeId(),
                allocation.getCompetitorId(),
                allocation.getReasonCodes() == null ? List.of() : List.copyOf(allocation.getReasonCodes()),
                allocation.isManual(),
                allocation.getDecidedBy(),
                allocation.getDecidedAt()
        );
    }

    public AllocationResponses.VersionSummary toVersionSummaryResponse(AllocationVersion version) {
        return new AllocationResponses.VersionSummary(
                version.getVersion(),
                version.getCommittedBy(),
                version.getCommittedAt(),
                version.getAllocationCount()
        );
    }

    public List<AllocationResponses.VersionSummary> toVersionSummaryResponses(Collection<AllocationVersion> versions) {
        return versions.stream().map(this::toVersionSummaryResponse).toList();
    }

    public AllocationResponses.Conflict toConflictResponse(AllocationConflict conflict) {
        return new AllocationResponses.Conflict(
                conflict.getConflictId(),
                conflict.getTournamentId(),
                conflict.getConflictType(),
                List.copyOf(conflict.getImpactedCompetitors()),
                List.copyOf(conflict.getImpactedPrizes()),
                List.copyOf(conflict.getReasons()),
                conflict.getSuggestedPrizeId(),
                conflict.getSuggestedCompetitorId(),
                conflict.getStatus(),
                conflict.getResolutionNote(),
                conflict.getOpenedBy(),
                conflict.getResolvedBy(),
                conflict.getCreatedAt(),
                conflict.getResolvedAt()
        );
    }

    public List<AllocationResponses.Conflict> toConflictResponses(Collection<AllocationConflict> conflicts) {
        return conflicts.stream().map(this::toConflictResponse).toList();
    }

    public AllocationResponses.RcaEntry toRcaResponse(RcaRow row) {
        return new AllocationResponses.RcaEntry(
                row.categoryId(),
                row.categoryName(),
                row.mainCategory(),
                row.prizeId(),
                row.place(),
                row.prizeLabel(),
                row.cashAmount(),
                row.engineWinnerId(),
                row.engineWinnerName(),
                row.engineWinnerRank(),
                row.engineWinnerRating(),
                row.finalWinnerId(),
                row.finalWinnerName(),
                row.finalWinnerRank(),
                row.finalWinnerRating(),
                row.status(),
                row.overrideReason(),
                row.reasonCode() != null ? row.reasonCode().name() : null,
                row.reasonLabel(),
                row.diagnosisSummary(),
                row.failCodes(),
                row.unfilled(),
                row.blockedByOnePrize(),
                row.candidatesBeforeOnePrize(),
                row.candidatesAfterOnePrize()
        );
    }

    public AllocationResponses.InstitutionPrizesResponse toInstitutionPrizesResponse(
            UUID tournamentId,
            InstitutionAllocation allocation
    ) {
        return new AllocationResponses.InstitutionPrizesResponse(
                tournamentId,
                allocation.competitorsLoaded(),
                allocation.maxRank(),
                allocation.groups().stream().map(this::toInstitutionGroupResponse).toList()
        );
    }

    private AllocationResponses.InstitutionGroup toInstitutionGroupResponse(InstitutionGroupResult result) {
        InstitutionGroupSpec group = result.group();
        return new AllocationResponses.InstitutionGroup(
                group.groupId(),
                group.name(),
                new AllocationResponses.InstitutionGroupConfig(
                        group.groupBy(),
                        group.teamSize(),
                        group.femaleSlots(),
                        group.maleSlots(),
                        group.scoringMode()
                ),
                result.placements().stream()
                        .map(placement -> new AllocationResponses.InstitutionPrizeResult(
                                placement.prize().prizeId(),
                                placement.prize().place(),
                                placement.prize().cashAmount(),
                                placement.prize().trophy(),
                                placement.prize().medal(),
                                placement.winner() != null ? toInstitutionWinner(placement.winner()) : null
                        ))
                        .toList(),
                result.eligibleInstitutions(),
                result.ineligibleInstitutions(),
                result.ineligibleReasons()
        );
    }

    private AllocationResponses.InstitutionWinner toInstitutionWinner(InstitutionStanding standing) {
        return new AllocationResponses.InstitutionWinner(
                standing.key(),
                standing.key(),
                standing.totalPoints(),
                standing.rankSum(),
                standing.bestIndividualRank(),
                standing.team().stream()
                        .map(member -> new AllocationResponses.TeamMember(
                                member.competitorId(),
                                member.name(),
                                member.rank(),
                                member.points(),
                                member.gender()
                        ))
                        .toList()
        );
    }

    public AllocationResponses.ReasonCodeLabel toReasonCodeLabel(ReasonCode reasonCode) {
        return new AllocationResponses.ReasonCodeLabel(reasonCode.name(), reasonCode.label());
    }

    public AllocationResponses.FailCodeLabel toFailCodeLabel(FailCode failCode) {
        return new AllocationResponses.FailCodeLabel(failCode.code(), failCode.label(), failCode.axis());
    }

    private static Map<String, Integer> toFailHistogram(Map<FailCode, Integer> histogram) {
        Map<String, Integer> byCode = new LinkedHashMap<>();
        histogram.forEach((code, count) -> byCode.put(code.code(), count));
        return byCode;
    }
}
