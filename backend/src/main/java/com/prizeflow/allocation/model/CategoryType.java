package com.prizeflow.allocation.model;

public enum CategoryType {
    CRITERIA,
    YOUNGEST_FEMALE,
    YOUNGEST_MALE;

    public boolean isYoungest() {
        return this == YOUNGEST_FEMALE || this == YOUNGEST_MALE;
    }
}
