package com.prizeflow.allocation.service;

import com.prizeflow.allocation.config.AllocationProperties;
import com.prizeflow.allocation.engine.AllocationRules;
import com.prizeflow.allocation.engine.AllocationSnapshot;
import com.prizeflow.allocation.engine.CategorySpec;
import com.prizeflow.allocation.engine.CompetitorProfile;
import com.prizeflow.allocation.mapper.AllocationSnapshotMapper;
import com.prizeflow.allocation.model.AgeCutoffPolicy;
import com.prizeflow.allocation.model.Category;
import com.prizeflow.allocation.model.MultiPrizePolicy;
import com.prizeflow.allocation.model.Prize;
import com.prizeflow.allocation.model.RuleConfig;
import com.prizeflow.allocation.model.Tournament;
import com.prizeflow.allocation.repository.CategoryRepository;
import com.prizeflow.allocation.repository.CompetitorRepository;
import com.prizeflow.allocation.repository.PrizeRepository;
import com.prizeflow.allocation.repository.RuleConfigRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Reads everything one scheduling run needs into an immutable {@link AllocationSnapshot}.
 */
@Service
@RequiredArgsConstructor
public class AllocationSnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(AllocationSnapshotLoader.class);

    private final CompetitorRepository competitorRepository;
    private final CategoryRepository categoryRepository;
    private final PrizeRepository prizeRepository;
    private final RuleConfigRepository ruleConfigRepository;
    private final AllocationSnapshotMapper allocationSnapshotMapper;
    private final AllocationProperties allocationProperties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AllocationSnapshot load(Tournament tournament) {
        return load(tournament, null);
    }

    /**
     * @param ruleOverride non-null fields replace the stored rule config for this load
     *                     only; nothing is written back
     */
    @Transactional(readOnly = true)
    public AllocationSnapshot load(Tournament tournament, RuleConfig ruleOverride) {
        UUID tournamentId = tournament.getTournamentId();

        List<CompetitorProfile> competitors = competitorRepository
                .findByTournamentIdOrderByRankAscCompetitorIdAsc(tournamentId)
                .stream()
                .map(allocationSnapshotMapper::toCompetitorProfile)
                .toList();

        List<Category> categories = categoryRepository.findByTournamentIdOrderByOrderIdxAscCategoryIdAsc(tournamentId);
        List<UUID> categoryIds = categories.stream().map(Category::getCategoryId).toList();
        Map<UUID, List<Prize>> prizesByCategory = categoryIds.isEmpty()
                ? Map.of()
                : prizeRepository.findByCategoryIdInOrderByPlaceAscPrizeIdAsc(categoryIds).stream()
                        .collect(Collectors.groupingBy(Prize::getCategoryId));

        List<CategorySpec> categorySpecs = categories.stream()
                .map(category -> allocationSnapshotMapper.toCategorySpec(
                        category,
                        prizesByCategory.getOrDefault(category.getCategoryId(), List.of())
                ))
                .toList();

        RuleConfig ruleConfig = ruleConfigRepository.findById(tournamentId).orElse(null);
        AllocationRules rules = resolveRules(tournament, overlay(ruleConfig, ruleOverride));

        log.debug(
                "[alloc.snapshot] tournament={} competitors={} categories={} referenceDate={} policy={}",
                tournamentId,
                competitors.size(),
                categorySpecs.size(),
                rules.referenceDate(),
                rules.multiPrizePolicy()
        );
        return new AllocationSnapshot(tournamentId, competitors, categorySpecs, rules);
    }

    AllocationRules resolveRules(Tournament tournament, RuleConfig ruleConfig) {
        AllocationProperties.DefaultRules defaults = allocationProperties.getDefaultRules();
        RuleConfig config = ruleConfig != null ? ruleConfig : new RuleConfig();

        AgeCutoffPolicy cutoffPolicy = config.getAgeCutoffPolicy() != null
                ? config.getAgeCutoffPolicy()
                : defaults.getAgeCutoffPolicy();
        MultiPrizePolicy multiPrizePolicy = config.getMultiPrizePolicy() != null
                ? config.getMultiPrizePolicy()
                : defaults.getMultiPrizePolicy();

        return new AllocationRules(
                config.getStrictAge() != null ? config.getStrictAge() : defaults.isStrictAge(),
                config.getAllowUnratedInRating() != null
                        ? config.getAllowUnratedInRating()
                        : defaults.isAllowUnratedInRating(),
                config.getAllowMissingDobForAge() != null
                        ? config.getAllowMissingDobForAge()
                        : defaults.isAllowMissingDobForAge(),
                resolveReferenceDate(cutoffPolicy, tournament.getStartDate(), config.getAgeCutoffDate()),
                multiPrizePolicy,
                config.getCategoryPriorityOrder(),
                config.getVerboseLogs() != null ? config.getVerboseLogs() : allocationProperties.isVerboseLogs()
        );
    }

    static RuleConfig overlay(RuleConfig stored, RuleConfig override) {
        if (override == null) {
            return stored;
        }
        RuleConfig base = stored != null ? stored : new RuleConfig();
        RuleConfig merged = new RuleConfig();
        merged.setTournamentId(base.getTournamentId());
        merged.setStrictAge(firstNonNull(override.getStrictAge(), base.getStrictAge()));
        merged.setAllowUnratedInRating(firstNonNull(override.getAllowUnratedInRating(), base.getAllowUnratedInRating()));
        merged.setAllowMissingDobForAge(
                firstNonNull(override.getAllowMissingDobForAge(), base.getAllowMissingDobForAge()));
        merged.setAgeCutoffPolicy(firstNonNull(override.getAgeCutoffPolicy(), base.getAgeCutoffPolicy()));
        merged.setAgeCutoffDate(firstNonNull(override.getAgeCutoffDate(), base.getAgeCutoffDate()));
        merged.setMultiPrizePolicy(firstNonNull(override.getMultiPrizePolicy(), base.getMultiPrizePolicy()));
        merged.setCategoryPriorityOrder(
                firstNonNull(override.getCategoryPriorityOrder(), base.getCategoryPriorityOrder()));
        merged.setVerboseLogs(firstNonNull(override.getVerboseLogs(), base.getVerboseLogs()));
        return merged;
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    LocalDate resolveReferenceDate(AgeCutoffPolicy policy, LocalDate tournamentStartDate, LocalDate customDate) {
        LocalDate today = LocalDate.now(clock);
        AgeCutoffPolicy effectivePolicy = policy != null ? policy : AgeCutoffPolicy.JAN1_TOURNAMENT_YEAR;
        return switch (effectivePolicy) {
            case JAN1_TOURNAMENT_YEAR -> LocalDate.of(
                    tournamentStartDate != null ? tournamentStartDate.getYear() : today.getYear(),
                    1,
                    1
            );
            case TOURNAMENT_START_DATE -> tournamentStartDate != null ? tournamentStartDate : today;
            case CUSTOM_DATE -> customDate != null ? customDate : today;
        };
    }
}
