package com.fuer.measurement.service.kind;

import com.fuer.measurement.service.error.KindNotEnabledException;
import com.fuer.measurement.service.error.UnknownKindException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps enabled measurement kinds to their validators.
 *
 * Populated once at startup; only kinds in the {@link EnabledKinds} set can be registered.
 */
@Slf4j
public class MeasurementTypeRegistry {

    private final EnabledKinds enabledKinds;
    private final Map<MeasurementKind, MeasurementValidator> validators = new ConcurrentHashMap<>();

    public MeasurementTypeRegistry(EnabledKinds enabledKinds) {
        this.enabledKinds = enabledKinds;
    }

    /**
     * Associates a kind with its validator.
     *
     * @throws IllegalArgumentException if the kind was not enabled at startup
     */
    public void register(MeasurementKind kind, MeasurementValidator validator) {
        if (!enabledKinds.contains(kind)) {
            throw new IllegalArgumentException("Cannot register validator for disabled kind: " + kind);
        }
        validators.put(kind, validator);
        log.debug("Registered validator for kind '{}'", kind);
    }

    public boolean isEnabled(MeasurementKind kind) {
        return enabledKinds.contains(kind);
    }

    /**
     * Checks a raw kind token. Unsupported and disabled tokens are both reported as not enabled.
     */
    public boolean isEnabled(String token) {
        return MeasurementKind.fromToken(token)
                .map(this::isEnabled)
                .orElse(false);
    }

    /**
     * Resolves a raw kind token to an enabled kind.
     *
     * @throws KindNotEnabledException if the token names an unsupported or disabled kind
     */
    public MeasurementKind requireEnabled(String token) {
        return MeasurementKind.fromToken(token)
                .filter(this::isEnabled)
                .orElseThrow(() -> new KindNotEnabledException(token));
    }

    /**
     * Returns the validator registered for a kind.
     *
     * @throws UnknownKindException if no validator is registered
     */
    public MeasurementValidator resolve(MeasurementKind kind) {
        var validator = validators.get(kind);
        if (validator == null) {
            throw new UnknownKindException(kind.getToken());
        }
        return validator;
    }

    public EnabledKinds getEnabledKinds() {
        return enabledKinds;
    }
}
