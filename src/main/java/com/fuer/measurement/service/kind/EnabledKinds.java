package com.fuer.measurement.service.kind;

import com.fuer.measurement.service.error.UnknownKindException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable set of measurement kinds selected at startup, in the order they were named.
 */
public final class EnabledKinds {

    private final Set<MeasurementKind> kinds;

    private EnabledKinds(Set<MeasurementKind> kinds) {
        this.kinds = Collections.unmodifiableSet(kinds);
    }

    /**
     * Builds the enabled set from startup tokens such as {@code ["power", "flow"]}.
     *
     * @param tokens kind tokens, case-insensitive; duplicates are collapsed
     * @return the enabled kinds
     * @throws UnknownKindException if a token names no supported kind
     * @throws IllegalArgumentException if no token is given
     */
    public static EnabledKinds fromTokens(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException(
                    "At least one measurement kind must be passed as a startup argument");
        }
        var kinds = new LinkedHashSet<MeasurementKind>();
        for (String token : tokens) {
            kinds.add(MeasurementKind.fromToken(token)
                    .orElseThrow(() -> new UnknownKindException(token)));
        }
        return new EnabledKinds(kinds);
    }

    public static EnabledKinds of(MeasurementKind... kinds) {
        return new EnabledKinds(new LinkedHashSet<>(List.of(kinds)));
    }

    public boolean contains(MeasurementKind kind) {
        return kinds.contains(kind);
    }

    public Set<MeasurementKind> asSet() {
        return kinds;
    }

    public int size() {
        return kinds.size();
    }

    @Override
    public String toString() {
        return kinds.toString();
    }
}
