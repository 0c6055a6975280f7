package com.prizeflow.allocation.engine;

import com.prizeflow.allocation.model.ConflictType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Finds the conflicts a manually edited allocation introduces: awards the scheduler
 * would never produce on its own.
 */
@Component
@RequiredArgsConstructor
public class ManualEditConflictDetector {

    public static final String REASON_DUPLICATE_AWARD = "duplicate_award";
    public static final String REASON_INELIGIBLE_AWARD = "ineligible_award";

    private final EligibilityEvaluator eligibilityEvaluator;
    private final PrizeScheduler prizeScheduler;

    public List<ConflictDraft> detect(
            AllocationSnapshot snapshot,
            ScheduleResult preview,
            List<AllocationDecision> editedDecisions
    ) {
        AllocationRules rules = snapshot.rules();
        Map<UUID, ScheduledPrize> scheduledByPrize = indexPrizes(snapshot);
        Map<UUID, CompetitorProfile> competitorsById = snapshot.competitors().stream()
                .collect(Collectors.toMap(CompetitorProfile::competitorId, Function.identity(), (left, right) -> left));

        List<AllocationDecision> awarded = editedDecisions.stream()
                .filter(AllocationDecision::awarded)
                .filter(decision -> scheduledByPrize.containsKey(decision.prizeId()))
                .filter(decision -> competitorsById.containsKey(decision.competitorId()))
                .sorted(Comparator.comparingInt(
                        (AllocationDecision decision) -> scheduledByPrize.get(decision.prizeId()).position()))
                .toList();

        Set<UUID> usedCompetitors = new HashSet<>();
        awarded.forEach(decision -> usedCompetitors.add(decision.competitorId()));

        ExclusivityTracker tracker = new ExclusivityTracker(rules.multiPrizePolicy());
        List<ConflictDraft> conflicts = new ArrayList<>();

        for (AllocationDecision decision : awarded) {
            ScheduledPrize scheduled = scheduledByPrize.get(decision.prizeId());
            CategorySpec category = scheduled.category();
            CompetitorProfile competitor = competitorsById.get(decision.competitorId());
            UUID previewWinner = preview.winnerOf(decision.prizeId()).orElse(null);

            EligibilityResult eligibility = eligibilityEvaluator.evaluateForCategory(competitor, category, rules);
            if (!eligibility.eligible()) {
                List<String> reasons = new ArrayList<>();
                reasons.add(REASON_INELIGIBLE_AWARD);
                reasons.addAll(eligibility.failCodeValues());
                boolean suggest = previewWinner != null && !previewWinner.equals(competitor.competitorId());
                conflicts.add(new ConflictDraft(
                        ConflictType.INELIGIBLE_AWARD,
                        List.of(competitor.competitorId()),
                        List.of(decision.prizeId()),
                        reasons,
                        suggest ? decision.prizeId() : null,
                        suggest ? previewWinner : null
                ));
            }

            if (tracker.isAvailable(competitor.competitorId(), category)) {
                tracker.claim(competitor.competitorId(), scheduled.prize(), category);
                continue;
            }

            List<UUID> impactedPrizes = new ArrayList<>(tracker.claimedBy(competitor.competitorId()));
            impactedPrizes.add(decision.prizeId());
            boolean suggest = previewWinner != null && !usedCompetitors.contains(previewWinner);
            conflicts.add(new ConflictDraft(
                    ConflictType.DUPLICATE_AWARD,
                    List.of(competitor.competitorId()),
                    impactedPrizes,
                    List.of(
                            REASON_DUPLICATE_AWARD,
                            "multi_prize_policy_" + rules.multiPrizePolicy().name().toLowerCase(Locale.ROOT)
                    ),
                    suggest ? decision.prizeId() : null,
                    suggest ? previewWinner : null
            ));
        }

        return conflicts;
    }

    // Inactive prizes can still be edited by hand; they sort after every active prize.
    private Map<UUID, ScheduledPrize> indexPrizes(AllocationSnapshot snapshot) {
        Map<UUID, ScheduledPrize> index = new HashMap<>();
        List<ScheduledPrize> queue = prizeScheduler.prizeQueue(snapshot);
        queue.forEach(scheduled -> index.put(scheduled.prize().prizeId(), scheduled));

        int position = queue.size();
        List<CategorySpec> categories = snapshot.categories().stream()
                .sorted(Comparator.comparing(CategorySpec::categoryId))
                .toList();
        for (CategorySpec category : categories) {
            List<PrizeSpec> prizes = category.prizes().stream()
                    .sorted(Comparator.comparing(PrizeSpec::prizeId))
                    .toList();
            for (PrizeSpec prize : prizes) {
                if (!index.containsKey(prize.prizeId())) {
                    index.put(prize.prizeId(), new ScheduledPrize(position++, category, prize));
                }
            }
        }
        return index;
    }
}
