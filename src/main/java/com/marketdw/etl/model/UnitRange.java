package com.marketdw.etl.model;

/**
 * Inclusive range of processing units, expressed as yyyyMMdd integers.
 * A single-unit range has {@code first == last}.
 */
public final class UnitRange {
    public final int first;
    public final int last;

    private UnitRange(int first, int last) {
        if (last < first) {
            throw new IllegalArgumentException("invalid unit range: " + first + ".." + last);
        }
        this.first = first;
        this.last = last;
    }

    public static UnitRange single(int unit) {
        return new UnitRange(unit, unit);
    }

    public static UnitRange of(int first, int last) {
        return new UnitRange(first, last);
    }

    public boolean isSingle() {
        return first == last;
    }

    public boolean contains(int unit) {
        return unit >= first && unit <= last;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UnitRange)) {
            return false;
        }
        UnitRange other = (UnitRange) o;
        return first == other.first && last == other.last;
    }

    @Override
    public int hashCode() {
        return 31 * first + last;
    }

    @Override
    public String toString() {
        return isSingle() ? Integer.toString(first) : first + "-" + last;
    }
}
