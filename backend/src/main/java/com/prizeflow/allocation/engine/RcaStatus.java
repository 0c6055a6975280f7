package com.prizeflow.allocation.engine;

public enum RcaStatus {
    MATCH,
    OVERRIDDEN,
    NO_ELIGIBLE_WINNER
}
