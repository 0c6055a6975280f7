package com.prizeflow.allocation.engine;

import com.prizeflow.allocation.model.Gender;

import java.util.List;

/**
 * Decoded eligibility criteria of one category. Every axis is optional: a null bound
 * or an empty allow-list leaves that axis unconstrained.
 */
public record CriteriaSet(
        Gender gender,
        Integer minAge,
        Integer maxAge,
        Integer minRating,
        Integer maxRating,
        boolean unratedOnly,
        List<String> allowedDisabilities,
        List<String> allowedStates,
        List<String> allowedCities,
        List<String> allowedClubs,
        List<String> allowedGroups,
        List<String> allowedTypes
) {

    public static final CriteriaSet UNCONSTRAINED = new CriteriaSet(
            null, null, null, null, null, false,
            List.of(), List.of(), List.of(), List.of(), List.of(), List.of()
    );

    public CriteriaSet {
        allowedDisabilities = allowedDisabilities == null ? List.of() : List.copyOf(allowedDisabilities);
        allowedStates = allowedStates == null ? List.of() : List.copyOf(allowedStates);
        allowedCities = allowedCities == null ? List.of() : List.copyOf(allowedCities);
        allowedClubs = allowedClubs == null ? List.of() : List.copyOf(allowedClubs);
        allowedGroups = allowedGroups == null ? List.of() : List.copyOf(allowedGroups);
        allowedTypes = allowedTypes == null ? List.of() : List.copyOf(allowedTypes);
    }

    public boolean hasAgeBounds() {
        return minAge != null || maxAge != null;
    }

    public boolean hasRatingBounds() {
        return minRating != null || maxRating != null;
    }

    public CriteriaSet withGender(Gender requiredGender) {
        return new CriteriaSet(
                requiredGender,
                minAge,
                maxAge,
                minRating,
                maxRating,
                unratedOnly,
                allowedDisabilities,
                allowedStates,
                allowedCities,
                allowedClubs,
                allowedGroups,
                allowedTypes
        );
    }
}
