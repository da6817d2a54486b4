package io.github.jakubt4.orrery.dynamics.force;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.linear.RealMatrix;

/**
 * Acceleration of one force together with its partials.
 *
 * <p>Matrices are treated as immutable: {@link #plus} always allocates.
 *
 * @param acceleration inertial acceleration [m/s²]
 * @param dadr         ∂a/∂r [1/s²]
 * @param dadv         ∂a/∂v [1/s]
 */
public record ForceContribution(Vector3D acceleration, RealMatrix dadr, RealMatrix dadv) {

    public static ForceContribution zero() {
        return new ForceContribution(Vector3D.ZERO, Jacobians.zero(), Jacobians.zero());
    }

    public static ForceContribution accelerationOnly(final Vector3D acceleration) {
        return new ForceContribution(acceleration, Jacobians.zero(), Jacobians.zero());
    }

    public ForceContribution plus(final ForceContribution other) {
        return new ForceContribution(
                acceleration.add(other.acceleration),
                dadr.add(other.dadr),
                dadv.add(other.dadv));
    }
}
