package com.cecil.assembler.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Parsed timestamp of a band, or {@link #NONE} when the band has no usable time.
 * {@code NONE} orders before every real instant.
 */
public final class BandTime implements Comparable<BandTime> {

    /**
     * Time coordinate of the first untimed plane placed on a time axis; further untimed planes follow it
     * one millisecond apart. It is the earliest instant with an epoch-millisecond value
     * ({@code toEpochMilli() == Long.MIN_VALUE}), so it sorts before every parsed time.
     */
    public static final Instant SENTINEL_INSTANT = Instant.ofEpochMilli(Long.MIN_VALUE);

    public static final BandTime NONE = new BandTime(null);

    private final Instant instant;

    private BandTime(Instant instant) {
        this.instant = instant;
    }

    public static BandTime of(Instant instant) {
        return new BandTime(Objects.requireNonNull(instant, "instant"));
    }

    public boolean isPresent() {
        return instant != null;
    }

    /**
     * Returns the parsed instant.
     *
     * @throws IllegalStateException for {@link #NONE}
     */
    public Instant instant() {
        if (instant == null) {
            throw new IllegalStateException("Band has no time");
        }
        return instant;
    }

    @Override
    public int compareTo(BandTime other) {
        if (instant == null || other.instant == null) {
            return Boolean.compare(instant != null, other.instant != null);
        }
        return instant.compareTo(other.instant);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BandTime)) return false;
        return Objects.equals(instant, ((BandTime) o).instant);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(instant);
    }

    @Override
    public String toString() {
        return instant == null ? "NONE" : instant.toString();
    }
}
