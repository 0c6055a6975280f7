package com.prizeflow.allocation.engine;

/**
 * Fixed explanation for an unfilled prize. Labels are constants so organizer-facing
 * text is identical across runs.
 */
public enum ReasonCode {
    NO_ELIGIBLE_PLAYERS("No eligible winner (no players match criteria)"),
    BLOCKED_BY_ONE_PRIZE_POLICY("No eligible winner (blocked by one-prize policy)"),
    TOO_STRICT_CRITERIA_RATING("No eligible winner (rating criteria)"),
    TOO_STRICT_CRITERIA_AGE("No eligible winner (age criteria)"),
    TOO_STRICT_CRITERIA_GENDER("No eligible winner (gender criteria)"),
    TOO_STRICT_CRITERIA_LOCATION("No eligible winner (location criteria)"),
    TOO_STRICT_CRITERIA_TYPE_OR_GROUP("No eligible winner (type/group criteria)"),
    INTERNAL_ERROR("Internal error");

    private final String label;

    ReasonCode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
