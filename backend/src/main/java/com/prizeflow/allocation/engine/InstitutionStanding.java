package com.prizeflow.allocation.engine;

import com.prizeflow.allocation.model.Gender;

import java.util.List;
import java.util.UUID;

/**
 * A group value that could field a full team, with the team's score.
 */
public record InstitutionStanding(
        String key,
        int totalPoints,
        int rankSum,
        int bestIndividualRank,
        List<TeamMember> team
) {

    public InstitutionStanding {
        team = List.copyOf(team);
    }

    public record TeamMember(
            UUID competitorId,
            String name,
            int rank,
            int points,
            Gender gender
    ) {
    }
}
