package com.prizeflow.allocation.mapper;

import com.prizeflow.allocation.dto.AllocationRequests;
import com.prizeflow.allocation.engine.CategorySpec;
import com.prizeflow.allocation.engine.CommittedAward;
import com.prizeflow.allocation.engine.CompetitorProfile;
import com.prizeflow.allocation.engine.InstitutionGroupSpec;
import com.prizeflow.allocation.engine.InstitutionPrizeSpec;
import com.prizeflow.allocation.engine.PrizeSpec;
import com.prizeflow.allocation.model.Allocation;
import com.prizeflow.allocation.model.Category;
import com.prizeflow.allocation.model.Competitor;
import com.prizeflow.allocation.model.CriteriaSetJsonCodec;
import com.prizeflow.allocation.model.InstitutionPrize;
import com.prizeflow.allocation.model.InstitutionPrizeGroup;
import com.prizeflow.allocation.model.Prize;
import com.prizeflow.allocation.model.RuleConfig;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Converts persisted rows into the engine's read-only value types.
 */
@Component
public class AllocationSnapshotMapper {

    public CompetitorProfile toCompetitorProfile(Competitor competitor) {
        return new CompetitorProfile(
                competitor.getCompetitorId(),
                competitor.getRank() != null ? competitor.getRank() : Integer.MAX_VALUE,
                competitor.getName(),
                competitor.getRating(),
                competitor.getDob(),
                competitor.isDobImputed(),
                competitor.getGender(),
                competitor.getState(),
                competitor.getCity(),
                competitor.getClub(),
                competitor.getDisability(),
                competitor.getGroupLabel(),
                competitor.getTypeLabel()
        );
    }

    public PrizeSpec toPrizeSpec(Prize prize) {
        return new PrizeSpec(
                prize.getPrizeId(),
                prize.getCategoryId(),
                prize.getPlace() != null ? prize.getPlace() : 0,
                prize.getCashAmount(),
                prize.isTrophy(),
                prize.isMedal(),
                prize.isActive()
        );
    }

    public CategorySpec toCategorySpec(Category category, List<Prize> prizes) {
        return new CategorySpec(
                category.getCategoryId(),
                category.getName(),
                category.isMain(),
                category.isActive(),
                category.getOrderIdx() != null ? category.getOrderIdx() : 0,
                category.getCategoryType(),
                CriteriaSetJsonCodec.fromJson(category.getCriteriaJson()),
                prizes.stream().map(this::toPrizeSpec).toList()
        );
    }

    public InstitutionGroupSpec toInstitutionGroupSpec(InstitutionPrizeGroup group, List<InstitutionPrize> prizes) {
        return new InstitutionGroupSpec(
                group.getGroupId(),
                group.getName(),
                group.getGroupBy(),
                group.getTeamSize() != null ? group.getTeamSize() : 0,
                group.getFemaleSlots() != null ? group.getFemaleSlots() : 0,
                group.getMaleSlots() != null ? group.getMaleSlots() : 0,
                group.getScoringMode(),
                prizes.stream()
                        .map(prize -> new InstitutionPrizeSpec(
                                prize.getPrizeId(),
                                prize.getPlace() != null ? prize.getPlace() : 0,
                                prize.getCashAmount(),
                                prize.isTrophy(),
                                prize.isMedal()
                        ))
                        .toList()
        );
    }

    public RuleConfig toRuleOverride(AllocationRequests.RuleOverrideRequest request) {
        if (request == null) {
            return null;
        }
        RuleConfig override = new RuleConfig();
        override.setStrictAge(request.strictAge());
        override.setAllowUnratedInRating(request.allowUnratedInRating());
        override.setAllowMissingDobForAge(request.allowMissingDobForAge());
        override.setAgeCutoffPolicy(request.ageCutoffPolicy());
        override.setAgeCutoffDate(request.ageCutoffDate());
        override.setMultiPrizePolicy(request.multiPrizePolicy());
        override.setCategoryPriorityOrder(request.categoryPriorityOrder());
        override.setVerboseLogs(request.verboseLogs());
        return override;
    }

    public CommittedAward toCommittedAward(Allocation allocation) {
        return new CommittedAward(
                allocation.getPrizeId(),
                allocation.getCompetitorId(),
                allocation.getReasonCodes(),
                allocation.isManual()
        );
    }
}
