package com.prizeflow.allocation.engine;

/**
 * Criteria axis a fail code belongs to. Declaration order is the diagnosis precedence.
 */
public enum DiagnosisAxis {
    RATING(ReasonCode.TOO_STRICT_CRITERIA_RATING),
    AGE(ReasonCode.TOO_STRICT_CRITERIA_AGE),
    GENDER(ReasonCode.TOO_STRICT_CRITERIA_GENDER),
    LOCATION(ReasonCode.TOO_STRICT_CRITERIA_LOCATION),
    TYPE_OR_GROUP(ReasonCode.TOO_STRICT_CRITERIA_TYPE_OR_GROUP),
    OTHER(null);

    private final ReasonCode reasonCode;

    DiagnosisAxis(ReasonCode reasonCode) {
        this.reasonCode = reasonCode;
    }

    /**
     * @return the reason code for this axis, or null when the axis is not diagnosable
     */
    public ReasonCode reasonCode() {
        return reasonCode;
    }
}
