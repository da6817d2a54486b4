package io.github.jakubt4.orrery.dynamics.error;

/**
 * Raised by the frame utilities when a position or angular-momentum vector is
 * too short to define a direction.
 */
public class DegenerateGeometryException extends DynamicsException {

    public DegenerateGeometryException(final String message) {
        super(message);
    }
}
