package com.cecil.assembler.model;

/**
 * What to do when one variable ends up with more than one array after its timed planes are stacked,
 * i.e. untimed planes exist next to timed ones, or several untimed planes exist.
 */
public enum MixedTimePolicy {
    /** Place untimed planes on the time axis at {@link BandTime#SENTINEL_INSTANT}, ahead of timed planes. */
    EXPAND_WITH_SENTINEL,
    /** Fail the variable. */
    REJECT,
    /** Keep only the first array and report how many planes were dropped. */
    KEEP_FIRST
}
