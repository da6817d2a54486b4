package io.github.jakubt4.orrery.dynamics.force;

import io.github.jakubt4.orrery.environment.EphemerisProvider;
import io.github.jakubt4.orrery.environment.SolarPressureModel;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Radiation pressure on a fully illuminated cannonball, pushing away from the Sun:
 * {@code a = P(d)·c_srp·(A/m)·d̂} with {@code d} the Sun-to-object vector.
 *
 * <p>No eclipse is modelled; the object is always in full sunlight.
 */
public class SolarRadiationPressure implements ForceModel {

    public static final String SUN = "SUN";
    public static final double DEFAULT_REFLECTIVITY = 1.0;

    private final EphemerisProvider ephemeris;
    private final SolarPressureModel pressureModel;
    private final double coefficient;

    /**
     * @param area          illuminated cross-section [m²]
     * @param mass          mass [kg]
     * @param reflectivity  c_srp (absorption plus reflection) [-]
     */
    public SolarRadiationPressure(final EphemerisProvider ephemeris,
                                  final SolarPressureModel pressureModel,
                                  final double area,
                                  final double mass,
                                  final double reflectivity) {
        this.ephemeris = ephemeris;
        this.pressureModel = pressureModel;
        this.coefficient = reflectivity * area / mass;
    }

    @Override
    public ForceKind kind() {
        return ForceKind.SOLAR_RADIATION_PRESSURE;
    }

    @Override
    public ForceContribution contribution(final ForceContext context) {
        final var sunToObject = context.position().subtract(ephemeris.positionOf(SUN, context.epoch()));
        return contribution(sunToObject, context.jacobiansRequired());
    }

    /**
     * Acceleration and partials for a given Sun-to-object vector.
     * {@code ∂a/∂r = c·(A/m)·[P'(d)·d̂·d̂ᵀ + P(d)·(I − d̂·d̂ᵀ)/d]}, which is
     * {@code P(d)·c·(A/m)·(I − 3·d̂·d̂ᵀ)/d} for an inverse-square pressure.
     */
    ForceContribution contribution(final Vector3D sunToObject,
                                   final boolean jacobiansRequired) {
        final var distance = sunToObject.getNorm();
        final var unit = sunToObject.scalarMultiply(1.0 / distance);
        final var pressure = pressureModel.pressure(distance);
        final var acceleration = unit.scalarMultiply(pressure * coefficient);
        if (!jacobiansRequired) {
            return ForceContribution.accelerationOnly(acceleration);
        }
        final var radial = Jacobians.outer(unit, unit);
        final var dadr = radial.scalarMultiply(pressureModel.pressureDerivative(distance))
                .add(Jacobians.identity().subtract(radial).scalarMultiply(pressure / distance))
                .scalarMultiply(coefficient);
        return new ForceContribution(acceleration, dadr, Jacobians.zero());
    }
}
