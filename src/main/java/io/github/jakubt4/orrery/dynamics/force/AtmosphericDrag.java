package io.github.jakubt4.orrery.dynamics.force;

import io.github.jakubt4.orrery.dynamics.CelestialBodyConstants;
import io.github.jakubt4.orrery.environment.DensityProvider;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Cannonball drag against an atmosphere co-rotating with the central body:
 * <pre>
 *   v_rel = v − ω × r
 *   a     = −½·ρ·Cd·(A/m)·|v_rel|·v_rel
 * </pre>
 * The position partial includes both the density gradient and the
 * position dependence of {@code v_rel}.
 */
public class AtmosphericDrag implements ForceModel {

    public static final double DEFAULT_DRAG_COEFFICIENT = 2.2;

    private final DensityProvider atmosphere;
    private final Vector3D rotation;
    private final double ballistic;

    /**
     * @param area             cross-sectional area [m²]
     * @param mass             mass [kg]
     * @param dragCoefficient  Cd [-]
     */
    public AtmosphericDrag(final CelestialBodyConstants centralBody,
                           final DensityProvider atmosphere,
                           final double area,
                           final double mass,
                           final double dragCoefficient) {
        this.atmosphere = atmosphere;
        this.rotation = centralBody.angularVelocity();
        this.ballistic = 0.5 * dragCoefficient * area / mass;
    }

    @Override
    public ForceKind kind() {
        return ForceKind.ATMOSPHERIC_DRAG;
    }

    @Override
    public ForceContribution contribution(final ForceContext context) {
        final var r = context.position();
        final var vRel = context.velocity().subtract(Vector3D.crossProduct(rotation, r));
        final var speed = vRel.getNorm();
        final var rho = atmosphere.density(r, context.epoch());
        if (speed == 0.0 || rho == 0.0) {
            return ForceContribution.zero();
        }

        final var acceleration = vRel.scalarMultiply(-ballistic * rho * speed);
        if (!context.jacobiansRequired()) {
            return ForceContribution.accelerationOnly(acceleration);
        }

        final var dadv = Jacobians.identity().scalarMultiply(speed)
                .add(Jacobians.outer(vRel, vRel).scalarMultiply(1.0 / speed))
                .scalarMultiply(-ballistic * rho);

        // ∂v_rel/∂r = −[ω×]
        final var gradient = atmosphere.densityGradient(r, context.epoch());
        final var dadr = Jacobians.outer(vRel, gradient).scalarMultiply(-ballistic * speed)
                .subtract(dadv.multiply(Jacobians.cross(rotation)));

        return new ForceContribution(acceleration, dadr, dadv);
    }
}
