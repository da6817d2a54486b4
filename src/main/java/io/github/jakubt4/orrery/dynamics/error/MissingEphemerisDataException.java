package io.github.jakubt4.orrery.dynamics.error;

public class MissingEphemerisDataException extends DynamicsException {

    public MissingEphemerisDataException(final String message) {
        super(message);
    }

    public MissingEphemerisDataException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
