package com.fuer.measurement.service.kind;

import java.util.Locale;
import java.util.Optional;

/**
 * Inclusive value range. A null bound means unbounded on that side.
 */
public record ValueRange(Double min, Double max) {

    public ValueRange {
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException(
                    "Range minimum " + min + " is greater than maximum " + max);
        }
    }

    public static ValueRange atLeast(double min) {
        return new ValueRange(min, null);
    }

    public static ValueRange between(double min, double max) {
        return new ValueRange(min, max);
    }

    /**
     * Returns the bound the value falls outside of, if any.
     */
    public Optional<Bound> violatedBy(double value) {
        if (min != null && value < min) {
            return Optional.of(new Bound(BoundType.MIN, min));
        }
        if (max != null && value > max) {
            return Optional.of(new Bound(BoundType.MAX, max));
        }
        return Optional.empty();
    }

    /**
     * Replaces the bounds that are set in the override.
     */
    public ValueRange overriddenBy(Double overrideMin, Double overrideMax) {
        return new ValueRange(
                overrideMin != null ? overrideMin : min,
                overrideMax != null ? overrideMax : max);
    }

    public enum BoundType { MIN, MAX }

    public record Bound(BoundType type, double value) {

        @Override
        public String toString() {
            return type.name().toLowerCase(Locale.ROOT) + "=" + value;
        }
    }
}
