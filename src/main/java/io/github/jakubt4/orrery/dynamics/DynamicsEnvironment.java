package io.github.jakubt4.orrery.dynamics;

import io.github.jakubt4.orrery.environment.DensityProvider;
import io.github.jakubt4.orrery.environment.EphemerisProvider;
import io.github.jakubt4.orrery.environment.SolarPressureModel;

/**
 * External collaborators shared by every dynamics instance.
 */
public record DynamicsEnvironment(CelestialBodyConstants centralBody,
                                  EphemerisProvider ephemeris,
                                  DensityProvider atmosphere,
                                  SolarPressureModel solarPressure) {
}
