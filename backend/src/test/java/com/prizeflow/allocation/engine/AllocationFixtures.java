package com.prizeflow.allocation.engine;

import com.prizeflow.allocation.model.CategoryType;
import com.prizeflow.allocation.model.Gender;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Builders for engine value types used across the engine tests.
 */
public final class AllocationFixtures {

    public static final LocalDate REFERENCE_DATE = LocalDate.of(2026, 1, 1);
    public static final UUID TOURNAMENT_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");

    private AllocationFixtures() {
    }

    public static UUID id(long n) {
        return UUID.fromString(String.format("00000000-0000-0000-0000-%012d", n));
    }

    public static AllocationRules defaultRules() {
        return AllocationRules.defaults(REFERENCE_DATE);
    }

    public static CompetitorBuilder competitor(int n) {
        return new CompetitorBuilder(n);
    }

    public static CriteriaBuilder criteria() {
        return new CriteriaBuilder();
    }

    public static CategorySpec mainCategory(int n, int prizeCount) {
        return category(n, "Main", true, 0, CategoryType.CRITERIA, CriteriaSet.UNCONSTRAINED, prizeCount);
    }

    public static CategorySpec sideCategory(int n, String name, int orderIdx, CriteriaSet criteria, int prizeCount) {
        return category(n, name, false, orderIdx, CategoryType.CRITERIA, criteria, prizeCount);
    }

    public static CategorySpec youngestCategory(int n, CategoryType type, int orderIdx, int prizeCount) {
        String name = type == CategoryType.YOUNGEST_FEMALE ? "Youngest Female" : "Youngest Male";
        return category(n, name, false, orderIdx, type, CriteriaSet.UNCONSTRAINED, prizeCount);
    }

    public static CategorySpec category(
            int n,
            String name,
            boolean main,
            int orderIdx,
            CategoryType type,
            CriteriaSet criteria,
            int prizeCount
    ) {
        UUID categoryId = id(n);
        List<PrizeSpec> prizes = new ArrayList<>();
        for (int place = 1; place <= prizeCount; place++) {
            prizes.add(new PrizeSpec(
                    prizeId(n, place),
                    categoryId,
                    place,
                    BigDecimal.valueOf(1000L / place),
                    place == 1,
                    false,
                    true
            ));
        }
        return new CategorySpec(categoryId, name, main, true, orderIdx, type, criteria, prizes);
    }

    public static UUID prizeId(int categoryNumber, int place) {
        return id(categoryNumber * 100L + place);
    }

    public static AllocationSnapshot snapshot(
            List<CompetitorProfile> competitors,
            List<CategorySpec> categories,
            AllocationRules rules
    ) {
        return new AllocationSnapshot(TOURNAMENT_ID, competitors, categories, rules);
    }

    public static final class CompetitorBuilder {
        private final UUID competitorId;
        private int rank;
        private String name;
        private Integer rating;
        private LocalDate dob;
        private boolean dobImputed;
        private Gender gender = Gender.M;
        private String state;
        private String city;
        private String club;
        private String disability;
        private String groupLabel;
        private String typeLabel;

        private CompetitorBuilder(int n) {
            this.competitorId = id(n);
            this.rank = n;
            this.name = "Player " + n;
        }

        public CompetitorBuilder rank(int value) {
            this.rank = value;
            return this;
        }

        public CompetitorBuilder name(String value) {
            this.name = value;
            return this;
        }

        public CompetitorBuilder rating(Integer value) {
            this.rating = value;
            return this;
        }

        public CompetitorBuilder dob(LocalDate value) {
            this.dob = value;
            return this;
        }

        public CompetitorBuilder dobImputed(boolean value) {
            this.dobImputed = value;
            return this;
        }

        public CompetitorBuilder gender(Gender value) {
            this.gender = value;
            return this;
        }

        public CompetitorBuilder state(String value) {
            this.state = value;
            return this;
        }

        public CompetitorBuilder city(String value) {
            this.city = value;
            return this;
        }

        public CompetitorBuilder club(String value) {
            this.club = value;
            return this;
        }

        public CompetitorBuilder disability(String value) {
            this.disability = value;
            return this;
        }

        public CompetitorBuilder groupLabel(String value) {
            this.groupLabel = value;
            return this;
        }

        public CompetitorBuilder typeLabel(String value) {
            this.typeLabel = value;
            return this;
        }

        public CompetitorProfile build() {
            return new CompetitorProfile(
                    competitorId, rank, name, rating, dob, dobImputed, gender,
                    state, city, club, disability, groupLabel, typeLabel
            );
        }
    }

    public static final class CriteriaBuilder {
        private Gender gender;
        private Integer minAge;
        private Integer maxAge;
        private Integer minRating;
        private Integer maxRating;
        private boolean unratedOnly;
        private List<String> allowedDisabilities = List.of();
        private List<String> allowedStates = List.of();
        private List<String> allowedCities = List.of();
        private List<String> allowedClubs = List.of();
        private List<String> allowedGroups = List.of();
        private List<String> allowedTypes = List.of();

        private CriteriaBuilder() {
        }

        public CriteriaBuilder gender(Gender value) {
            this.gender = value;
            return this;
        }

        public CriteriaBuilder minAge(Integer value) {
            this.minAge = value;
            return this;
        }

        public CriteriaBuilder maxAge(Integer value) {
            this.maxAge = value;
            return this;
        }

        public CriteriaBuilder minRating(Integer value) {
            this.minRating = value;
            return this;
        }

        public CriteriaBuilder maxRating(Integer value) {
            this.maxRating = value;
            return this;
        }

        public CriteriaBuilder unratedOnly(boolean value) {
            this.unratedOnly = value;
            return this;
        }

        public CriteriaBuilder allowedDisabilities(String... values) {
            this.allowedDisabilities = List.of(values);
            return this;
        }

        public CriteriaBuilder allowedStates(String... values) {
            this.allowedStates = List.of(values);
            return this;
        }

        public CriteriaBuilder allowedCities(String... values) {
            this.allowedCities = List.of(values);
            return this;
        }

        public CriteriaBuilder allowedClubs(String... values) {
            this.allowedClubs = List.of(values);
            return this;
        }

        public CriteriaBuilder allowedGroups(String... values) {
            this.allowedGroups = List.of(values);
            return this;
        }

        public CriteriaBuilder allowedTypes(String... values) {
            this.allowedTypes = List.of(values);
            return this;
        }

        public CriteriaSet build() {
            return new CriteriaSet(
                    gender, minAge, maxAge, minRating, maxRating, unratedOnly,
                    allowedDisabilities, allowedStates, allowedCities, allowedClubs, allowedGroups, allowedTypes
            );
        }
    }
}
