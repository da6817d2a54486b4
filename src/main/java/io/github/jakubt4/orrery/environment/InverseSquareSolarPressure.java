package io.github.jakubt4.orrery.environment;

import io.github.jakubt4.orrery.dynamics.error.ConfigurationException;

/**
 * {@code P(d) = P₀·(d₀/d)²}.
 */
public class InverseSquareSolarPressure implements SolarPressureModel {

    /** Solar pressure on an absorbing surface at 1 AU [N/m²]. */
    public static final double PRESSURE_AT_ONE_AU = 4.56e-6;

    private final double referencePressure;
    private final double referenceDistance;

    public InverseSquareSolarPressure(final double referencePressure, final double referenceDistance) {
        if (!(referencePressure >= 0.0) || !(referenceDistance > 0.0)) {
            throw new ConfigurationException("Solar pressure reference must be non-negative at a positive distance");
        }
        this.referencePressure = referencePressure;
        this.referenceDistance = referenceDistance;
    }

    @Override
    public double pressure(final double distance) {
        final var ratio = referenceDistance / distance;
        return referencePressure * ratio * ratio;
    }

    @Override
    public double pressureDerivative(final double distance) {
        return -2.0 * pressure(distance) / distance;
    }
}
