package com.prizeflow.allocation.engine;

import java.util.List;

public record InstitutionGroupResult(
        InstitutionGroupSpec group,
        List<Placement> placements,
        int eligibleInstitutions,
        int ineligibleInstitutions,
        List<String> ineligibleReasons
) {

    public InstitutionGroupResult {
        placements = List.copyOf(placements);
        ineligibleReasons = List.copyOf(ineligibleReasons);
    }

    /**
     * @param winner null when fewer institutions qualified than the prize's place
     */
    public record Placement(
            InstitutionPrizeSpec prize,
            InstitutionStanding winner
    ) {
    }
}
