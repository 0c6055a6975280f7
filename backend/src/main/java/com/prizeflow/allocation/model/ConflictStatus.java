package com.prizeflow.allocation.model;

public enum ConflictStatus {
    OPEN,
    RESOLVED
}
