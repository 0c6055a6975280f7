package com.prizeflow.allocation.model;

/**
 * Per-competitor prize cap. {@link #SINGLE} is the default one-prize policy; the other
 * values are explicit relaxations configured per tournament.
 */
public enum MultiPrizePolicy {
    SINGLE,
    MAIN_PLUS_ONE_SIDE,
    UNLIMITED
}
