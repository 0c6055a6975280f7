package com.prizeflow.allocation.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Explains an unfilled prize from the counts and fail histogram of its pool.
 */
@Component
public class DiagnosisSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(DiagnosisSynthesizer.class);

    private static final int TOP_BLOCKER_LIMIT = 3;

    /**
     * First match wins: exclusivity blocking, then the strictest criteria axis in
     * axis precedence order, then no eligible players. Anything else is a defect.
     */
    public ReasonCode diagnose(int beforeCount, int afterCount, Map<FailCode, Integer> failHistogram) {
        if (beforeCount > 0 && afterCount == 0) {
            return ReasonCode.BLOCKED_BY_ONE_PRIZE_POLICY;
        }
        if (beforeCount == 0) {
            for (DiagnosisAxis axis : DiagnosisAxis.values()) {
                if (axis.reasonCode() != null && hasFailuresOnAxis(failHistogram, axis)) {
                    return axis.reasonCode();
                }
            }
            return ReasonCode.NO_ELIGIBLE_PLAYERS;
        }

        log.error(
                "[alloc.diagnose] prize left unfilled with available candidates before={} after={}",
                beforeCount,
                afterCount
        );
        return ReasonCode.INTERNAL_ERROR;
    }

    /**
     * @param blockedWithinCategory how many of the blocked candidates won an earlier place
     *                              of the same category rather than a prize elsewhere
     */
    public String summarize(
            int beforeCount,
            int afterCount,
            Map<FailCode, Integer> failHistogram,
            int blockedWithinCategory,
            int totalCompetitors
    ) {
        if (beforeCount > 0 && afterCount == 0) {
            String eligible = beforeCount + " of " + totalCompetitors + " competitors eligible; ";
            if (blockedWithinCategory >= beforeCount) {
                return eligible + "all already won an earlier place in this category.";
            }
            if (blockedWithinCategory <= 0) {
                return eligible + "all already hold a higher-priority prize.";
            }
            return eligible + blockedWithinCategory + " already won an earlier place in this category, "
                    + (beforeCount - blockedWithinCategory) + " already hold a higher-priority prize.";
        }
        if (beforeCount == 0) {
            if (totalCompetitors == 0) {
                return "No competitors imported.";
            }
            String summary = "0 of " + totalCompetitors + " competitors eligible.";
            if (failHistogram == null || failHistogram.isEmpty()) {
                return summary;
            }
            return summary + " Top blockers: " + topBlockers(failHistogram);
        }
        return afterCount + " of " + totalCompetitors + " competitors available but no winner was selected.";
    }

    private static boolean hasFailuresOnAxis(Map<FailCode, Integer> failHistogram, DiagnosisAxis axis) {
        if (failHistogram == null) {
            return false;
        }
        return failHistogram.entrySet().stream()
                .anyMatch(entry -> entry.getKey().axis() == axis && entry.getValue() != null && entry.getValue() > 0);
    }

    private static String topBlockers(Map<FailCode, Integer> failHistogram) {
        return failHistogram.entrySet().stream()
                .sorted(Map.Entry.<FailCode, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<FailCode, Integer>comparingByKey()))
                .limit(TOP_BLOCKER_LIMIT)
                .map(entry -> entry.getKey().label() + " (" + entry.getValue() + ")")
                .collect(Collectors.joining(", "));
    }
}
