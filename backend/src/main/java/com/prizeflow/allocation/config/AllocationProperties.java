package com.prizeflow.allocation.config;

import com.prizeflow.allocation.model.AgeCutoffPolicy;
import com.prizeflow.allocation.model.MultiPrizePolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Allocation engine runtime switches and the rule defaults applied to tournaments
 * that have no {@code rule_config} row (or leave a column null).
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "prizeflow.allocation")
public class AllocationProperties {

    /**
     * Log every per-competitor eligibility check, not only winners and unfilled prizes.
     */
    private boolean verboseLogs = false;

    /**
     * Actors allowed to finalize any tournament regardless of ownership.
     */
    private List<UUID> masterActorIds = new ArrayList<>();

    /**
     * Upper bound on decisions accepted by a single review or finalize call.
     */
    private int maxDecisionsPerRequest = 2_000;

    private DefaultRules defaultRules = new DefaultRules();

    @Getter
    @Setter
    public static class DefaultRules {
        private boolean strictAge = true;
        private boolean allowUnratedInRating = false;
        private boolean allowMissingDobForAge = false;
        private AgeCutoffPolicy ageCutoffPolicy = AgeCutoffPolicy.JAN1_TOURNAMENT_YEAR;
        private MultiPrizePolicy multiPrizePolicy = MultiPrizePolicy.SINGLE;
    }
}
