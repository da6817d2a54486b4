package io.github.jakubt4.orrery.dynamics.frame;

import io.github.jakubt4.orrery.dynamics.error.DegenerateGeometryException;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Minimum-norm guards used before normalising vectors.
 */
final class Geometry {

    /** Shortest position vector accepted [m]. */
    static final double MIN_POSITION_NORM = 1.0e-3;

    /** |h| below this fraction of |r|·|v| is treated as rectilinear motion. */
    static final double MIN_ANGULAR_MOMENTUM_RATIO = 1.0e-10;

    private Geometry() {
    }

    static Vector3D unitPosition(final Vector3D position) {
        final var norm = position.getNorm();
        if (!(norm >= MIN_POSITION_NORM)) {
            throw new DegenerateGeometryException("Position norm " + norm + " m is below " + MIN_POSITION_NORM + " m");
        }
        return position.scalarMultiply(1.0 / norm);
    }

    static Vector3D unitAngularMomentum(final Vector3D position, final Vector3D velocity) {
        final var h = Vector3D.crossProduct(position, velocity);
        final var norm = h.getNorm();
        final var scale = position.getNorm() * velocity.getNorm();
        if (!(norm > MIN_ANGULAR_MOMENTUM_RATIO * scale) || norm == 0.0) {
            throw new DegenerateGeometryException("Angular momentum norm " + norm + " m²/s is too small to define an orbit plane");
        }
        return h.scalarMultiply(1.0 / norm);
    }
}
