package com.prizeflow.allocation.model;

public enum AgeCutoffPolicy {
    JAN1_TOURNAMENT_YEAR,
    TOURNAMENT_START_DATE,
    CUSTOM_DATE
}
