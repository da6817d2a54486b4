package io.github.jakubt4.orrery.dynamics.error;

/**
 * Root of the failures raised while evaluating perturbed orbital dynamics.
 * Every subtype is fatal to the derivative call that raised it unless the
 * {@link io.github.jakubt4.orrery.dynamics.ForceComposer} decides otherwise.
 */
public class DynamicsException extends RuntimeException {

    public DynamicsException(final String message) {
        super(message);
    }

    public DynamicsException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
