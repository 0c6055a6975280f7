package com.prizeflow.allocation.model;

public enum ConflictType {
    DUPLICATE_AWARD,
    INELIGIBLE_AWARD
}
