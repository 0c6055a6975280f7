package com.prizeflow.allocation.engine;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Walks categories and prizes in priority order and awards each prize to the first
 * available eligible candidate. Pure over the snapshot; the only state is the run's
 * own {@link ExclusivityTracker}.
 * <p>
 * Pinned awards are organizer choices: they are claimed before the walk starts and
 * kept as given, even when the competitor is ineligible or already pinned elsewhere.
 */
@Component
@RequiredArgsConstructor
public class PrizeScheduler {

    private static final Logger log = LoggerFactory.getLogger(PrizeScheduler.class);

    public static final String REASON_AUTO = "auto";
    public static final String REASON_RANK = "rank";
    public static final String REASON_YOUNGEST_DOB = "youngest_dob";
    public static final String REASON_CATEGORY_ORDER = "category_order";
    public static final String REASON_MANUAL_OVERRIDE = "manual_override";

    private final CategoryPoolBuilder categoryPoolBuilder;
    private final DiagnosisSynthesizer diagnosisSynthesizer;

    public ScheduleResult schedule(AllocationSnapshot snapshot) {
        return schedule(snapshot, List.of());
    }

    /**
     * @param pinnedAwards prize to competitor choices applied before the greedy fill;
     *                     pins for prizes outside the active queue or for unknown
     *                     competitors are dropped with a warning
     */
    public ScheduleResult schedule(AllocationSnapshot snapshot, List<AllocationDecision> pinnedAwards) {
        AllocationRules rules = snapshot.rules();
        ExclusivityTracker tracker = new ExclusivityTracker(rules.multiPrizePolicy());
        List<AllocationDecision> decisions = new ArrayList<>();
        List<CoverageEntry> coverage = new ArrayList<>();
        int totalCompetitors = snapshot.competitors().size();

        List<ScheduledPrize> queue = prizeQueue(snapshot);
        Map<UUID, CompetitorProfile> pins = claimPins(snapshot, queue, pinnedAwards, tracker);

        for (ScheduledPrize scheduled : queue) {
            CategorySpec category = scheduled.category();
            PrizeSpec prize = scheduled.prize();
            CategoryPool pool = categoryPoolBuilder.buildPool(category, snapshot.competitors(), tracker, rules);

            CompetitorProfile pinned = pins.get(prize.prizeId());
            if (pinned != null) {
                decisions.add(new AllocationDecision(
                        prize.prizeId(),
                        pinned.competitorId(),
                        List.of(REASON_MANUAL_OVERRIDE),
                        true
                ));
                coverage.add(CoverageEntry.filled(scheduled, pinned, pool));
                log.info(
                        "[alloc.win] tournament={} category={} place={} competitor={} rank=manual",
                        snapshot.tournamentId(),
                        category.name(),
                        prize.place(),
                        pinned.competitorId()
                );
                continue;
            }

            if (pool.orderedCandidates().isEmpty()) {
                ReasonCode reasonCode = diagnosisSynthesizer.diagnose(
                        pool.beforeCount(),
                        pool.afterCount(),
                        pool.failHistogram()
                );
                String summary = diagnosisSynthesizer.summarize(
                        pool.beforeCount(),
                        pool.afterCount(),
                        pool.failHistogram(),
                        pool.blockedWithinCategory(),
                        totalCompetitors
                );
                coverage.add(CoverageEntry.unfilled(scheduled, pool, reasonCode, summary));
                log.info(
                        "[alloc.unfilled] tournament={} category={} place={} reason={} before={} after={}",
                        snapshot.tournamentId(),
                        category.name(),
                        prize.place(),
                        reasonCode,
                        pool.beforeCount(),
                        pool.afterCount()
                );
                continue;
            }

            CategoryPool.Candidate winner = pool.orderedCandidates().get(0);
            CompetitorProfile competitor = winner.competitor();
            tracker.claim(competitor.competitorId(), prize, category);

            decisions.add(new AllocationDecision(
                    prize.prizeId(),
                    competitor.competitorId(),
                    decisionReasonCodes(category, winner.eligibility()),
                    false
            ));
            coverage.add(CoverageEntry.filled(scheduled, competitor, pool));
            log.info(
                    "[alloc.win] tournament={} category={} place={} competitor={} rank={}",
                    snapshot.tournamentId(),
                    category.name(),
                    prize.place(),
                    competitor.competitorId(),
                    competitor.rank()
            );
        }

        ScheduleResult result = new ScheduleResult(decisions, coverage);
        log.info(
                "[alloc.done] tournament={} prizes={} filled={} unfilled={} pinned={} policy={}",
                snapshot.tournamentId(),
                coverage.size(),
                result.filledCount(),
                result.unfilledCount(),
                pins.size(),
                rules.multiPrizePolicy()
        );
        return result;
    }

    // Claims are made in queue order so a competitor pinned twice keeps the higher-priority claim.
    private Map<UUID, CompetitorProfile> claimPins(
            AllocationSnapshot snapshot,
            List<ScheduledPrize> queue,
            List<AllocationDecision> pinnedAwards,
            ExclusivityTracker tracker
    ) {
        if (pinnedAwards == null || pinnedAwards.isEmpty()) {
            return Map.of();
        }
        Map<UUID, CompetitorProfile> competitorsById = snapshot.competitors().stream()
                .collect(Collectors.toMap(CompetitorProfile::competitorId, Function.identity(), (left, right) -> left));
        Map<UUID, UUID> requested = new LinkedHashMap<>();
        for (AllocationDecision pin : pinnedAwards) {
            if (pin.awarded()) {
                requested.putIfAbsent(pin.prizeId(), pin.competitorId());
            }
        }

        Map<UUID, CompetitorProfile> pins = new LinkedHashMap<>();
        for (ScheduledPrize scheduled : queue) {
            UUID competitorId = requested.remove(scheduled.prize().prizeId());
            if (competitorId == null) {
                continue;
            }
            CompetitorProfile competitor = competitorsById.get(competitorId);
            if (competitor == null) {
                log.warn("[alloc.pin] tournament={} prize={} unknown competitor={}; pin dropped",
                        snapshot.tournamentId(), scheduled.prize().prizeId(), competitorId);
                continue;
            }
            pins.put(scheduled.prize().prizeId(), competitor);
            if (tracker.isAvailable(competitorId, scheduled.category())) {
                tracker.claim(competitorId, scheduled.prize(), scheduled.category());
            } else {
                log.warn("[alloc.pin] tournament={} prize={} competitor={} already holds {} under policy {}",
                        snapshot.tournamentId(), scheduled.prize().prizeId(), competitorId,
                        tracker.claimedBy(competitorId), tracker.policy());
            }
        }
        requested.keySet().forEach(prizeId -> log.warn(
                "[alloc.pin] tournament={} prize={} is not an active prize; pin dropped",
                snapshot.tournamentId(), prizeId));
        return pins;
    }

    /**
     * Active prizes of active categories in scheduling order.
     */
    public List<ScheduledPrize> prizeQueue(AllocationSnapshot snapshot) {
        List<CategorySpec> categories = snapshot.categories().stream()
                .filter(CategorySpec::active)
                .sorted(categoryOrder(snapshot.rules().categoryPriorityOrder()))
                .toList();

        List<ScheduledPrize> queue = new ArrayList<>();
        for (CategorySpec category : categories) {
            List<PrizeSpec> prizes = category.prizes().stream()
                    .filter(PrizeSpec::active)
                    .sorted(Comparator.comparingInt(PrizeSpec::place).thenComparing(PrizeSpec::prizeId))
                    .toList();
            for (PrizeSpec prize : prizes) {
                queue.add(new ScheduledPrize(queue.size(), category, prize));
            }
        }
        return queue;
    }

    static Comparator<CategorySpec> categoryOrder(List<UUID> priorityOrder) {
        Comparator<CategorySpec> mainFirst = Comparator.comparing(category -> !category.main());
        return mainFirst
                .thenComparingInt(category -> priorityIndex(priorityOrder, category.categoryId()))
                .thenComparingInt(CategorySpec::orderIdx)
                .thenComparing(CategorySpec::name, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(CategorySpec::categoryId);
    }

    private static int priorityIndex(List<UUID> priorityOrder, UUID categoryId) {
        int index = priorityOrder.indexOf(categoryId);
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    private static List<String> decisionReasonCodes(CategorySpec category, EligibilityResult eligibility) {
        List<String> reasonCodes = new ArrayList<>();
        reasonCodes.add(REASON_AUTO);
        reasonCodes.add(category.categoryType().isYoungest() ? REASON_YOUNGEST_DOB : REASON_RANK);
        reasonCodes.add(REASON_CATEGORY_ORDER);
        reasonCodes.addAll(eligibility.passCodes());
        return reasonCodes;
    }
}
