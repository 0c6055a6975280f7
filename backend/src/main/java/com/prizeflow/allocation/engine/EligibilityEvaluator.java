package com.prizeflow.allocation.engine;

import com.prizeflow.allocation.model.CategoryType;
import com.prizeflow.allocation.model.Gender;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates one competitor against one criteria set. Every predicate is total:
 * missing competitor data yields a fail code, never an exception.
 */
@Component
public class EligibilityEvaluator {

    public static final String PASS_GENDER_OK = "gender_ok";
    public static final String PASS_GENDER_OPEN = "gender_open";
    public static final String PASS_AGE_OK = "age_ok";
    public static final String PASS_DOB_MISSING_ALLOWED = "dob_missing_allowed";
    public static final String PASS_RATING_OK = "rating_ok";
    public static final String PASS_RATING_UNRATED_ALLOWED = "rating_unrated_allowed";
    public static final String PASS_UNRATED_ONLY_OK = "unrated_only_ok";
    public static final String PASS_DISABILITY_OK = "disability_ok";
    public static final String PASS_STATE_OK = "state_ok";
    public static final String PASS_CITY_OK = "city_ok";
    public static final String PASS_CLUB_OK = "club_ok";
    public static final String PASS_GROUP_OK = "group_ok";
    public static final String PASS_TYPE_OK = "type_ok";
    public static final String WARN_DOB_IMPUTED = "dob_imputed";

    public EligibilityResult evaluate(CompetitorProfile competitor, CriteriaSet criteria, AllocationRules rules) {
        CriteriaSet effectiveCriteria = criteria == null ? CriteriaSet.UNCONSTRAINED : criteria;
        List<FailCode> failCodes = new ArrayList<>();
        List<String> passCodes = new ArrayList<>();
        List<String> warnCodes = new ArrayList<>();

        evaluateGender(competitor, effectiveCriteria, failCodes, passCodes);
        evaluateAge(competitor, effectiveCriteria, rules, failCodes, passCodes, warnCodes);
        evaluateRating(competitor, effectiveCriteria, rules, failCodes, passCodes);

        checkAllowList(competitor.disability(), effectiveCriteria.allowedDisabilities(),
                FailCode.DISABILITY_EXCLUDED, PASS_DISABILITY_OK, failCodes, passCodes);
        checkAllowList(competitor.state(), effectiveCriteria.allowedStates(),
                FailCode.STATE_EXCLUDED, PASS_STATE_OK, failCodes, passCodes);
        checkAllowList(competitor.city(), effectiveCriteria.allowedCities(),
                FailCode.CITY_EXCLUDED, PASS_CITY_OK, failCodes, passCodes);
        checkAllowList(competitor.club(), effectiveCriteria.allowedClubs(),
                FailCode.CLUB_EXCLUDED, PASS_CLUB_OK, failCodes, passCodes);
        checkAllowList(competitor.groupLabel(), effectiveCriteria.allowedGroups(),
                FailCode.GROUP_EXCLUDED, PASS_GROUP_OK, failCodes, passCodes);
        checkAllowList(competitor.typeLabel(), effectiveCriteria.allowedTypes(),
                FailCode.TYPE_EXCLUDED, PASS_TYPE_OK, failCodes, passCodes);

        return new EligibilityResult(failCodes.isEmpty(), failCodes, passCodes, warnCodes);
    }

    /**
     * Evaluates a competitor for a category, applying the implicit gender and
     * date-of-birth requirements of youngest-player categories.
     */
    public EligibilityResult evaluateForCategory(
            CompetitorProfile competitor,
            CategorySpec category,
            AllocationRules rules
    ) {
        CategoryType categoryType = category.categoryType();
        if (!categoryType.isYoungest()) {
            return evaluate(competitor, category.criteria(), rules);
        }

        Gender requiredGender = categoryType == CategoryType.YOUNGEST_FEMALE ? Gender.F : Gender.M;
        EligibilityResult base = evaluate(competitor, category.criteria().withGender(requiredGender), rules);
        if (competitor.dob() != null) {
            return base;
        }

        List<FailCode> failCodes = new ArrayList<>(base.failCodes());
        if (!failCodes.contains(FailCode.DOB_MISSING)) {
            failCodes.add(FailCode.DOB_MISSING);
        }
        List<String> passCodes = base.passCodes().stream()
                .filter(code -> !PASS_DOB_MISSING_ALLOWED.equals(code))
                .toList();
        return new EligibilityResult(false, failCodes, passCodes, base.warnCodes());
    }

    static int ageOn(LocalDate dob, LocalDate referenceDate) {
        return Period.between(dob, referenceDate).getYears();
    }

    private void evaluateGender(
            CompetitorProfile competitor,
            CriteriaSet criteria,
            List<FailCode> failCodes,
            List<String> passCodes
    ) {
        if (criteria.gender() == null) {
            passCodes.add(PASS_GENDER_OPEN);
            return;
        }
        if (competitor.gender() == null) {
            failCodes.add(FailCode.GENDER_MISSING);
        } else if (competitor.gender() != criteria.gender()) {
            failCodes.add(FailCode.GENDER_MISMATCH);
        } else {
            passCodes.add(PASS_GENDER_OK);
        }
    }

    private void evaluateAge(
            CompetitorProfile competitor,
            CriteriaSet criteria,
            AllocationRules rules,
            List<FailCode> failCodes,
            List<String> passCodes,
            List<String> warnCodes
    ) {
        if (!rules.strictAge() || !criteria.hasAgeBounds()) {
            return;
        }
        if (competitor.dob() == null) {
            if (rules.allowMissingDobForAge()) {
                passCodes.add(PASS_DOB_MISSING_ALLOWED);
            } else {
                failCodes.add(FailCode.DOB_MISSING);
            }
            return;
        }

        if (competitor.dobImputed()) {
            warnCodes.add(WARN_DOB_IMPUTED);
        }

        int age = ageOn(competitor.dob(), rules.referenceDate());
        boolean failed = false;
        if (criteria.maxAge() != null && age > criteria.maxAge()) {
            failCodes.add(FailCode.AGE_ABOVE_MAX);
            failed = true;
        }
        if (criteria.minAge() != null && age < criteria.minAge()) {
            failCodes.add(FailCode.AGE_BELOW_MIN);
            failed = true;
        }
        if (!failed) {
            passCodes.add(PASS_AGE_OK);
        }
    }

    private void evaluateRating(
            CompetitorProfile competitor,
            CriteriaSet criteria,
            AllocationRules rules,
            List<FailCode> failCodes,
            List<String> passCodes
    ) {
        if (criteria.unratedOnly()) {
            if (competitor.isRated()) {
                failCodes.add(FailCode.RATED_EXCLUDED);
            } else {
                passCodes.add(PASS_UNRATED_ONLY_OK);
            }
            return;
        }
        if (!criteria.hasRatingBounds()) {
            return;
        }

        if (!competitor.isRated()) {
            if (rules.allowUnratedInRating()) {
                passCodes.add(PASS_RATING_UNRATED_ALLOWED);
            } else {
                failCodes.add(FailCode.UNRATED_EXCLUDED);
            }
            return;
        }

        int rating = competitor.rating();
        if (criteria.minRating() != null && rating < criteria.minRating()) {
            failCodes.add(FailCode.RATING_BELOW_MIN);
        } else if (criteria.maxRating() != null && rating > criteria.maxRating()) {
            failCodes.add(FailCode.RATING_ABOVE_MAX);
        } else {
            passCodes.add(PASS_RATING_OK);
        }
    }

    private void checkAllowList(
            String value,
            List<String> allowed,
            FailCode failCode,
            String passCode,
            List<FailCode> failCodes,
            List<String> passCodes
    ) {
        if (allowed.isEmpty()) {
            return;
        }
        if (value == null || value.isBlank()) {
            failCodes.add(failCode);
            return;
        }
        String normalized = normalize(value);
        boolean matched = allowed.stream().anyMatch(candidate -> normalize(candidate).equals(normalized));
        if (matched) {
            passCodes.add(passCode);
        } else {
            failCodes.add(failCode);
        }
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
