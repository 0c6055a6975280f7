package com.prizeflow.allocation.engine;

import java.math.BigDecimal;
import java.util.UUID;

public record InstitutionPrizeSpec(
        UUID prizeId,
        int place,
        BigDecimal cashAmount,
        boolean trophy,
        boolean medal
) {
}
