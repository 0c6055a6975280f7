package com.prizeflow.allocation.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prizeflow.allocation.config.AllocationProperties;
import com.prizeflow.allocation.engine.AllocationRules;
import com.prizeflow.allocation.engine.AllocationSnapshot;
import com.prizeflow.allocation.engine.CategorySpec;
import com.prizeflow.allocation.engine.PrizeSpec;
import com.prizeflow.allocation.mapper.AllocationSnapshotMapper;
import com.prizeflow.allocation.model.AgeCutoffPolicy;
import com.prizeflow.allocation.model.Category;
import com.prizeflow.allocation.model.Competitor;
import com.prizeflow.allocation.model.MultiPrizePolicy;
import com.prizeflow.allocation.model.Prize;
import com.prizeflow.allocation.model.RuleConfig;
import com.prizeflow.allocation.model.Tournament;
import com.prizeflow.allocation.repository.CategoryRepository;
import com.prizeflow.allocation.repository.CompetitorRepository;
import com.prizeflow.allocation.repository.PrizeRepository;
import com.prizeflow.allocation.repository.RuleConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AllocationSnapshotLoaderTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 5, 20);

    @Mock
    private CompetitorRepository competitorRepository;

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private PrizeRepository prizeRepository;

    @Mock
    private RuleConfigRepository ruleConfigRepository;

    private AllocationProperties allocationProperties;
    private AllocationSnapshotLoader loader;
    private Tournament tournament;

    @BeforeEach
    void setUp() {
        allocationProperties = new AllocationProperties();
        loader = new AllocationSnapshotLoader(
                competitorRepository,
                categoryRepository,
                prizeRepository,
                ruleConfigRepository,
                new AllocationSnapshotMapper(),
                allocationProperties,
                Clock.fixed(Instant.parse("2026-05-20T08:00:00Z"), ZoneOffset.UTC)
        );
        tournament = new Tournament();
        tournament.setTournamentId(UUID.randomUUID());
        tournament.setTitle("Summer Rapid");
        tournament.setOwnerId(UUID.randomUUID());
        tournament.setStartDate(LocalDate.of(2025, 8, 15));
    }

    @Test
    void resolveRules_withoutRuleConfigUsesConfiguredDefaults() {
        AllocationRules rules = loader.resolveRules(tournament, null);

        assertTrue(rules.strictAge());
        assertFalse(rules.allowUnratedInRating());
        assertFalse(rules.allowMissingDobForAge());
        assertEquals(MultiPrizePolicy.SINGLE, rules.multiPrizePolicy());
        assertEquals(LocalDate.of(2025, 1, 1), rules.referenceDate());
        assertTrue(rules.categoryPriorityOrder().isEmpty());
        assertFalse(rules.verboseLogs());
    }

    @Test
    void resolveRules_ruleConfigOverridesOnlyTheColumnsItSets() {
        allocationProperties.getDefaultRules().setAllowMissingDobForAge(true);
        UUID preferred = UUID.randomUUID();
        RuleConfig config = new RuleConfig();
        config.setTournamentId(tournament.getTournamentId());
        config.setAllowUnratedInRating(true);
        config.setMultiPrizePolicy(MultiPrizePolicy.MAIN_PLUS_ONE_SIDE);
        config.setAgeCutoffPolicy(AgeCutoffPolicy.TOURNAMENT_START_DATE);
        config.setCategoryPriorityOrder(List.of(preferred));
        config.setVerboseLogs(true);

        AllocationRules rules = loader.resolveRules(tournament, config);

        assertTrue(rules.strictAge());
        assertTrue(rules.allowUnratedInRating());
        assertTrue(rules.allowMissingDobForAge());
        assertEquals(MultiPrizePolicy.MAIN_PLUS_ONE_SIDE, rules.multiPrizePolicy());
        assertEquals(LocalDate.of(2025, 8, 15), rules.referenceDate());
        assertEquals(List.of(preferred), rules.categoryPriorityOrder());
        assertTrue(rules.verboseLogs());
    }

    @Test
    void resolveReferenceDate_fallsBackToTodayWhenDatesAreMissing() {
        assertEquals(LocalDate.of(2026, 1, 1),
                loader.resolveReferenceDate(AgeCutoffPolicy.JAN1_TOURNAMENT_YEAR, null, null));
        assertEquals(TODAY,
                loader.resolveReferenceDate(AgeCutoffPolicy.TOURNAMENT_START_DATE, null, null));
        assertEquals(TODAY,
                loader.resolveReferenceDate(AgeCutoffPolicy.CUSTOM_DATE, LocalDate.of(2025, 8, 15), null));
        assertEquals(LocalDate.of(2024, 12, 31),
                loader.resolveReferenceDate(AgeCutoffPolicy.CUSTOM_DATE, null, LocalDate.of(2024, 12, 31)));
        assertEquals(LocalDate.of(2025, 1, 1),
                loader.resolveReferenceDate(null, LocalDate.of(2025, 8, 15), null));
    }

    @Test
    void load_ruleOverrideWinsForThisRunWithoutTouchingStoredConfig() {
        UUID tournamentId = tournament.getTournamentId();
        RuleConfig stored = new RuleConfig();
        stored.setTournamentId(tournamentId);
        stored.setAllowUnratedInRating(false);
        stored.setMultiPrizePolicy(MultiPrizePolicy.MAIN_PLUS_ONE_SIDE);
        stored.setAgeCutoffPolicy(AgeCutoffPolicy.TOURNAMENT_START_DATE);
        when(competitorRepository.findByTournamentIdOrderByRankAscCompetitorIdAsc(tournamentId)).thenReturn(List.of());
        when(categoryRepository.findByTournamentIdOrderByOrderIdxAscCategoryIdAsc(tournamentId)).thenReturn(List.of());
        when(ruleConfigRepository.findById(tournamentId)).thenReturn(Optional.of(stored));

        RuleConfig override = new RuleConfig();
        override.setAllowUnratedInRating(true);
        override.setAgeCutoffPolicy(AgeCutoffPolicy.CUSTOM_DATE);
        override.setAgeCutoffDate(LocalDate.of(2025, 6, 30));

        AllocationSnapshot snapshot = loader.load(tournament, override);

        assertTrue(snapshot.rules().allowUnratedInRating());
        assertEquals(MultiPrizePolicy.MAIN_PLUS_ONE_SIDE, snapshot.rules().multiPrizePolicy());
        assertEquals(LocalDate.of(2025, 6, 30), snapshot.rules().referenceDate());
        assertFalse(stored.getAllowUnratedInRating());
        assertEquals(AgeCutoffPolicy.TOURNAMENT_START_DATE, stored.getAgeCutoffPolicy());
    }

    @Test
    void load_groupsPrizesUnderTheirCategoriesAndDecodesCriteria() {
        UUID tournamentId = tournament.getTournamentId();

        Competitor unranked = new Competitor();
        unranked.setCompetitorId(UUID.randomUUID());
        unranked.setTournamentId(tournamentId);
        unranked.setName("Late Entry");

        Category belowRating = new Category();
        belowRating.setCategoryId(UUID.randomUUID());
        belowRating.setTournamentId(tournamentId);
        belowRating.setName("Below 1600");
        belowRating.setOrderIdx(2);
        ObjectNode criteria = JsonNodeFactory.instance.objectNode();
        criteria.put("max_rating", 1599);
        criteria.put("gender", "open");
        belowRating.setCriteriaJson(criteria);

        Prize second = prize(belowRating.getCategoryId(), 2, "500");
        Prize first = prize(belowRating.getCategoryId(), 1, "1000");

        when(competitorRepository.findByTournamentIdOrderByRankAscCompetitorIdAsc(tournamentId))
                .thenReturn(List.of(unranked));
        when(categoryRepository.findByTournamentIdOrderByOrderIdxAscCategoryIdAsc(tournamentId))
                .thenReturn(List.of(belowRating));
        when(prizeRepository.findByCategoryIdInOrderByPlaceAscPrizeIdAsc(List.of(belowRating.getCategoryId())))
                .thenReturn(List.of(first, second));
        when(ruleConfigRepository.findById(tournamentId)).thenReturn(Optional.empty());

        AllocationSnapshot snapshot = loader.load(tournament);

        assertEquals(tournamentId, snapshot.tournamentId());
        assertEquals(Integer.MAX_VALUE, snapshot.competitors().get(0).rank());
        CategorySpec category = snapshot.categories().get(0);
        assertEquals(1599, category.criteria().maxRating());
        assertNull(category.criteria().gender());
        assertEquals(List.of(1, 2), category.prizes().stream().map(PrizeSpec::place).toList());
        assertEquals(LocalDate.of(2025, 1, 1), snapshot.rules().referenceDate());
    }

    private static Prize prize(UUID categoryId, int place, String cash) {
        Prize prize = new Prize();
        prize.setPrizeId(UUID.randomUUID());
        prize.setCategoryId(categoryId);
        prize.setPlace(place);
        prize.setCashAmount(new BigDecimal(cash));
        return prize;
    }
}
