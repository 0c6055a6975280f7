package com.prizeflow.allocation.engine;

/**
 * Typed ineligibility codes produced by {@link EligibilityEvaluator}. Codes and labels
 * are part of the public contract and must stay stable across releases.
 */
public enum FailCode {
    GENDER_MISSING("gender_missing", "Gender missing", DiagnosisAxis.GENDER),
    GENDER_MISMATCH("gender_mismatch", "Gender requirements not met", DiagnosisAxis.GENDER),
    DOB_MISSING("dob_missing", "DOB missing", DiagnosisAxis.AGE),
    AGE_ABOVE_MAX("age_above_max", "Above age limit", DiagnosisAxis.AGE),
    AGE_BELOW_MIN("age_below_min", "Below age limit", DiagnosisAxis.AGE),
    RATED_EXCLUDED("rated_excluded", "Rated players not allowed (unrated only)", DiagnosisAxis.RATING),
    UNRATED_EXCLUDED("unrated_excluded", "Unrated not allowed", DiagnosisAxis.RATING),
    RATING_BELOW_MIN("rating_below_min", "Rating below minimum", DiagnosisAxis.RATING),
    RATING_ABOVE_MAX("rating_above_max", "Rating above maximum", DiagnosisAxis.RATING),
    DISABILITY_EXCLUDED("disability_excluded", "Disability not eligible", DiagnosisAxis.OTHER),
    STATE_EXCLUDED("state_excluded", "State not eligible", DiagnosisAxis.LOCATION),
    CITY_EXCLUDED("city_excluded", "City not eligible", DiagnosisAxis.LOCATION),
    CLUB_EXCLUDED("club_excluded", "Club not eligible", DiagnosisAxis.LOCATION),
    GROUP_EXCLUDED("group_excluded", "Group not eligible", DiagnosisAxis.TYPE_OR_GROUP),
    TYPE_EXCLUDED("type_excluded", "Type not eligible", DiagnosisAxis.TYPE_OR_GROUP);

    private final String code;
    private final String label;
    private final DiagnosisAxis axis;

    FailCode(String code, String label, DiagnosisAxis axis) {
        this.code = code;
        this.label = label;
        this.axis = axis;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public DiagnosisAxis axis() {
        return axis;
    }
}
