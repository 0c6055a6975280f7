package com.prizeflow.allocation.engine;

import java.util.List;

public record EligibilityResult(
        boolean eligible,
        List<FailCode> failCodes,
        List<String> passCodes,
        List<String> warnCodes
) {

    public EligibilityResult {
        failCodes = failCodes == null ? List.of() : List.copyOf(failCodes);
        passCodes = passCodes == null ? List.of() : List.copyOf(passCodes);
        warnCodes = warnCodes == null ? List.of() : List.copyOf(warnCodes);
    }

    public List<String> failCodeValues() {
        return failCodes.stream().map(FailCode::code).toList();
    }
}
