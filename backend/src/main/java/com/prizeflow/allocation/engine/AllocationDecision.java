package com.prizeflow.allocation.engine;

import java.util.List;
import java.util.UUID;

/**
 * One (prize, competitor) decision. A null competitor means the prize stays unawarded.
 */
public record AllocationDecision(
        UUID prizeId,
        UUID competitorId,
        List<String> reasonCodes,
        boolean manual
) {

    public AllocationDecision {
        reasonCodes = reasonCodes == null ? List.of() : List.copyOf(reasonCodes);
    }

    public boolean awarded() {
        return competitorId != null;
    }
}
