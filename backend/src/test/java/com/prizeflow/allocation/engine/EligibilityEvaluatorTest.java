package com.prizeflow.allocation.engine;

import com.prizeflow.allocation.model.CategoryType;
import com.prizeflow.allocation.model.Gender;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.prizeflow.allocation.engine.AllocationFixtures.competitor;
import static com.prizeflow.allocation.engine.AllocationFixtures.criteria;
import static com.prizeflow.allocation.engine.AllocationFixtures.defaultRules;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EligibilityEvaluatorTest {

    private final EligibilityEvaluator evaluator = new EligibilityEvaluator();

    @Test
    void missingCompetitorDataYieldsOneFailCodePerAxisWithoutThrowing() {
        CompetitorProfile competitor = competitor(1)
                .gender(null)
                .dob(null)
                .rating(null)
                .state(null)
                .build();
        CriteriaSet criteria = criteria()
                .gender(Gender.F)
                .maxAge(18)
                .minRating(1000)
                .allowedStates("MH")
                .build();

        EligibilityResult result = evaluator.evaluate(competitor, criteria, defaultRules());

        assertFalse(result.eligible());
        assertEquals(
                List.of(FailCode.GENDER_MISSING, FailCode.DOB_MISSING, FailCode.UNRATED_EXCLUDED, FailCode.STATE_EXCLUDED),
                result.failCodes()
        );
    }

    @Test
    void ratingCeilingAdmitsLowerRatedAndRejectsHigherRated() {
        CriteriaSet below1800 = criteria().maxRating(1799).build();

        EligibilityResult lower = evaluator.evaluate(competitor(1).rating(1750).build(), below1800, defaultRules());
        EligibilityResult higher = evaluator.evaluate(competitor(2).rating(1850).build(), below1800, defaultRules());
        EligibilityResult unrated = evaluator.evaluate(competitor(3).rating(null).build(), below1800, defaultRules());

        assertTrue(lower.eligible());
        assertTrue(lower.passCodes().contains(EligibilityEvaluator.PASS_RATING_OK));
        assertEquals(List.of(FailCode.RATING_ABOVE_MAX), higher.failCodes());
        assertEquals(List.of(FailCode.UNRATED_EXCLUDED), unrated.failCodes());
    }

    @Test
    void unratedCompetitorPassesRatingBandWhenTournamentAllowsIt() {
        CriteriaSet below1800 = criteria().maxRating(1799).build();

        EligibilityResult result = evaluator.evaluate(
                competitor(1).rating(null).build(),
                below1800,
                defaultRules().withAllowUnratedInRating(true)
        );

        assertTrue(result.eligible());
        assertTrue(result.passCodes().contains(EligibilityEvaluator.PASS_RATING_UNRATED_ALLOWED));
    }

    @Test
    void unratedOnlyOverridesRatingBoundsAndTournamentSwitch() {
        CriteriaSet unratedOnly = criteria().unratedOnly(true).minRating(1200).build();
        AllocationRules rules = defaultRules().withAllowUnratedInRating(true);

        EligibilityResult rated = evaluator.evaluate(competitor(1).rating(1500).build(), unratedOnly, rules);
        EligibilityResult unrated = evaluator.evaluate(competitor(2).rating(null).build(), unratedOnly, rules);

        assertEquals(List.of(FailCode.RATED_EXCLUDED), rated.failCodes());
        assertTrue(unrated.eligible());
        assertEquals(List.of(EligibilityEvaluator.PASS_GENDER_OPEN, EligibilityEvaluator.PASS_UNRATED_ONLY_OK),
                unrated.passCodes());
    }

    @Test
    void ageIsMeasuredInWholeYearsAtReferenceDate() {
        CriteriaSet under15 = criteria().maxAge(14).build();

        // 2011-06-15 is 14 on 2026-01-01; 2011-01-01 is already 15.
        EligibilityResult fourteen = evaluator.evaluate(
                competitor(1).dob(LocalDate.of(2011, 6, 15)).build(), under15, defaultRules());
        EligibilityResult fifteen = evaluator.evaluate(
                competitor(2).dob(LocalDate.of(2011, 1, 1)).build(), under15, defaultRules());

        assertTrue(fourteen.eligible());
        assertTrue(fourteen.passCodes().contains(EligibilityEvaluator.PASS_AGE_OK));
        assertEquals(List.of(FailCode.AGE_ABOVE_MAX), fifteen.failCodes());
    }

    @Test
    void veteranFloorRejectsYoungerCompetitors() {
        CriteriaSet veterans = criteria().minAge(60).build();

        EligibilityResult result = evaluator.evaluate(
                competitor(1).dob(LocalDate.of(1980, 3, 3)).build(), veterans, defaultRules());

        assertEquals(List.of(FailCode.AGE_BELOW_MIN), result.failCodes());
    }

    @Test
    void ageBoundsAreIgnoredWhenStrictAgeIsOff() {
        AllocationRules relaxed = new AllocationRules(
                false, false, false, AllocationFixtures.REFERENCE_DATE, null, List.of(), false);

        EligibilityResult result = evaluator.evaluate(
                competitor(1).dob(null).build(), criteria().maxAge(10).build(), relaxed);

        assertTrue(result.eligible());
        assertFalse(result.passCodes().contains(EligibilityEvaluator.PASS_AGE_OK));
    }

    @Test
    void missingDobCanBeAllowedForAgeCategories() {
        AllocationRules allowMissingDob = new AllocationRules(
                true, false, true, AllocationFixtures.REFERENCE_DATE, null, List.of(), false);

        EligibilityResult result = evaluator.evaluate(
                competitor(1).dob(null).build(), criteria().maxAge(10).build(), allowMissingDob);

        assertTrue(result.eligible());
        assertTrue(result.passCodes().contains(EligibilityEvaluator.PASS_DOB_MISSING_ALLOWED));
    }

    @Test
    void imputedDobPassesWithWarning() {
        EligibilityResult result = evaluator.evaluate(
                competitor(1).dob(LocalDate.of(2015, 1, 1)).dobImputed(true).build(),
                criteria().maxAge(12).build(),
                defaultRules()
        );

        assertTrue(result.eligible());
        assertEquals(List.of(EligibilityEvaluator.WARN_DOB_IMPUTED), result.warnCodes());
    }

    @Test
    void allowListsCompareTrimmedAndCaseInsensitive() {
        CriteriaSet localPlayers = criteria()
                .allowedStates("Maharashtra")
                .allowedClubs("Pune Chess Club")
                .build();

        EligibilityResult matching = evaluator.evaluate(
                competitor(1).state("  maharashtra ").club("PUNE CHESS CLUB").build(), localPlayers, defaultRules());
        EligibilityResult otherClub = evaluator.evaluate(
                competitor(2).state("Maharashtra").club("Mumbai Knights").build(), localPlayers, defaultRules());

        assertTrue(matching.eligible());
        assertEquals(List.of(FailCode.CLUB_EXCLUDED), otherClub.failCodes());
    }

    @Test
    void matchedAllowListsAddPassCodes() {
        CriteriaSet localPlayers = criteria()
                .allowedDisabilities("PH")
                .allowedStates("Maharashtra")
                .allowedCities("Pune")
                .allowedClubs("Pune Chess Club")
                .build();

        EligibilityResult matching = evaluator.evaluate(
                competitor(1).disability("ph").state("Maharashtra").city("Pune").club("Pune Chess Club").build(),
                localPlayers,
                defaultRules()
        );
        EligibilityResult otherCity = evaluator.evaluate(
                competitor(2).disability("PH").state("Maharashtra").city("Mumbai").club("Pune Chess Club").build(),
                localPlayers,
                defaultRules()
        );

        assertEquals(
                List.of(EligibilityEvaluator.PASS_GENDER_OPEN, EligibilityEvaluator.PASS_DISABILITY_OK,
                        EligibilityEvaluator.PASS_STATE_OK, EligibilityEvaluator.PASS_CITY_OK,
                        EligibilityEvaluator.PASS_CLUB_OK),
                matching.passCodes()
        );
        assertEquals(List.of(FailCode.CITY_EXCLUDED), otherCity.failCodes());
        assertFalse(otherCity.passCodes().contains(EligibilityEvaluator.PASS_CITY_OK));
        assertTrue(otherCity.passCodes().contains(EligibilityEvaluator.PASS_CLUB_OK));
    }

    @Test
    void everyAllowListAxisReportsItsOwnCode() {
        CriteriaSet narrow = criteria()
                .allowedDisabilities("PH")
                .allowedCities("Pune")
                .allowedGroups("School")
                .allowedTypes("Junior")
                .build();

        EligibilityResult result = evaluator.evaluate(competitor(1).build(), narrow, defaultRules());

        assertEquals(
                List.of(FailCode.DISABILITY_EXCLUDED, FailCode.CITY_EXCLUDED, FailCode.GROUP_EXCLUDED, FailCode.TYPE_EXCLUDED),
                result.failCodes()
        );
    }

    @Test
    void genderFilterReportsMismatchAndMatch() {
        CriteriaSet women = criteria().gender(Gender.F).build();

        EligibilityResult male = evaluator.evaluate(competitor(1).gender(Gender.M).build(), women, defaultRules());
        EligibilityResult female = evaluator.evaluate(competitor(2).gender(Gender.F).build(), women, defaultRules());

        assertEquals(List.of(FailCode.GENDER_MISMATCH), male.failCodes());
        assertEquals(List.of(EligibilityEvaluator.PASS_GENDER_OK), female.passCodes());
    }

    @Test
    void youngestCategoryRequiresMatchingGenderAndDob() {
        CategorySpec youngestFemale = AllocationFixtures.youngestCategory(7, CategoryType.YOUNGEST_FEMALE, 1, 1);

        EligibilityResult boy = evaluator.evaluateForCategory(
                competitor(1).gender(Gender.M).dob(LocalDate.of(2016, 5, 5)).build(), youngestFemale, defaultRules());
        EligibilityResult girlWithoutDob = evaluator.evaluateForCategory(
                competitor(2).gender(Gender.F).dob(null).build(), youngestFemale, defaultRules());
        EligibilityResult girl = evaluator.evaluateForCategory(
                competitor(3).gender(Gender.F).dob(LocalDate.of(2016, 5, 5)).build(), youngestFemale, defaultRules());

        assertEquals(List.of(FailCode.GENDER_MISMATCH), boy.failCodes());
        assertEquals(List.of(FailCode.DOB_MISSING), girlWithoutDob.failCodes());
        assertTrue(girl.eligible());
    }
}
