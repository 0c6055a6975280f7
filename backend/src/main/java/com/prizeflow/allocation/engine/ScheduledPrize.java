package com.prizeflow.allocation.engine;

/**
 * A prize together with its category, at its position in the scheduling order.
 */
public record ScheduledPrize(int position, CategorySpec category, PrizeSpec prize) {
}
