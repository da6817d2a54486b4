package io.github.jakubt4.orrery.environment;

/**
 * Solar radiation pressure as a function of heliocentric distance.
 */
public interface SolarPressureModel {

    /**
     * @param distance distance from the Sun [m]
     * @return pressure [N/m²]
     */
    double pressure(double distance);

    /** {@code dP/dd} [N/m³]. */
    double pressureDerivative(double distance);
}
