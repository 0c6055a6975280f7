package com.prizeflow.allocation.engine;

import java.util.List;

public record InstitutionAllocation(
        int competitorsLoaded,
        int maxRank,
        List<InstitutionGroupResult> groups
) {

    public InstitutionAllocation {
        groups = List.copyOf(groups);
    }
}
