package com.prizeflow.allocation.model;

public enum TournamentStatus {
    DRAFT,
    FINALIZED
}
