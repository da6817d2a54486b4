package io.github.jakubt4.orrery.dynamics.error;

import io.github.jakubt4.orrery.dynamics.force.ForceKind;
import lombok.Getter;

/**
 * An optional force term could not be evaluated and the configuration asked
 * for the evaluation to abort rather than continue without it.
 */
@Getter
public class OptionalModuleFailureException extends DynamicsException {

    private final ForceKind kind;

    public OptionalModuleFailureException(final ForceKind kind, final String reason) {
        super(kind + " skipped: " + reason);
        this.kind = kind;
    }
}
