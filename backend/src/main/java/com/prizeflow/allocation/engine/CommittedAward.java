package com.prizeflow.allocation.engine;

import java.util.List;
import java.util.UUID;

/**
 * A committed winner as read back from the current allocation version.
 */
public record CommittedAward(UUID prizeId, UUID competitorId, List<String> reasonCodes, boolean manual) {

    public CommittedAward {
        reasonCodes = reasonCodes == null ? List.of() : List.copyOf(reasonCodes);
    }
}
