package io.github.jakubt4.orrery.environment;

/**
 * Constants an {@link EphemerisProvider} can report for a body.
 */
public enum BodyConstant {
    /** Gravitational parameter [m³/s²]. */
    GM,
    /** Mean equatorial radius [m]. */
    RADIUS
}
