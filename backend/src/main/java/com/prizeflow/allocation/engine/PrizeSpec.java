package com.prizeflow.allocation.engine;

import java.math.BigDecimal;
import java.util.UUID;

public record PrizeSpec(
        UUID prizeId,
        UUID categoryId,
        int place,
        BigDecimal cashAmount,
        boolean trophy,
        boolean medal,
        boolean active
) {
}
