package io.github.jakubt4.orrery.dynamics.force;

/**
 * The perturbations the dynamics model knows about.
 */
public enum ForceKind {
    CENTRAL_GRAVITY,
    J2_OBLATENESS,
    ATMOSPHERIC_DRAG,
    SOLAR_RADIATION_PRESSURE,
    THIRD_BODY_GRAVITY
}
