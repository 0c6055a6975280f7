package com.prizeflow.allocation.engine;

import com.prizeflow.allocation.model.Gender;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Read-only view of a competitor as seen by the engine. Every field except id, rank
 * and name may be null.
 */
public record CompetitorProfile(
        UUID competitorId,
        int rank,
        String name,
        Integer rating,
        LocalDate dob,
        boolean dobImputed,
        Gender gender,
        String state,
        String city,
        String club,
        String disability,
        String groupLabel,
        String typeLabel
) {

    public boolean isRated() {
        return rating != null;
    }
}
