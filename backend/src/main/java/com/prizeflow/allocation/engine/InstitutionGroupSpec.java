package com.prizeflow.allocation.engine;

import java.util.List;
import java.util.UUID;

/**
 * One team prize table with its active prizes in place order. {@code groupBy} is
 * kept as stored so an unknown field name can be reported rather than rejected.
 */
public record InstitutionGroupSpec(
        UUID groupId,
        String name,
        String groupBy,
        int teamSize,
        int femaleSlots,
        int maleSlots,
        String scoringMode,
        List<InstitutionPrizeSpec> prizes
) {

    public InstitutionGroupSpec {
        prizes = prizes == null ? List.of() : List.copyOf(prizes);
    }
}
