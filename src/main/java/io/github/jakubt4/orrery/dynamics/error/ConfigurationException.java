package io.github.jakubt4.orrery.dynamics.error;

/**
 * Invalid state-vector length, or a force enabled without the parameters it needs.
 */
public class ConfigurationException extends DynamicsException {

    public ConfigurationException(final String message) {
        super(message);
    }
}
