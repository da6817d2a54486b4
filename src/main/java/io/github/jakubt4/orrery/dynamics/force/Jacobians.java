package io.github.jakubt4.orrery.dynamics.force;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.linear.ArrayRealVector;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;

/**
 * 3×3 building blocks shared by the force models' closed-form partials.
 */
public final class Jacobians {

    private Jacobians() {
    }

    public static RealMatrix zero() {
        return MatrixUtils.createRealMatrix(3, 3);
    }

    public static RealMatrix identity() {
        return MatrixUtils.createRealIdentityMatrix(3);
    }

    /** {@code a · bᵀ} */
    public static RealMatrix outer(final Vector3D a, final Vector3D b) {
        return new ArrayRealVector(a.toArray()).outerProduct(new ArrayRealVector(b.toArray()));
    }

    /** Matrix {@code [w×]} such that {@code [w×]·x = w × x}. */
    public static RealMatrix cross(final Vector3D w) {
        return MatrixUtils.createRealMatrix(new double[][]{
                {0.0, -w.getZ(), w.getY()},
                {w.getZ(), 0.0, -w.getX()},
                {-w.getY(), w.getX(), 0.0}
        });
    }

    /**
     * Gradient of a point-mass field {@code -μ·d/|d|³} with respect to {@code d}:
     * {@code μ/|d|⁵ · (3·d·dᵀ − |d|²·I)}.
     */
    public static RealMatrix pointMassGradient(final double mu, final Vector3D d) {
        final var d2 = d.getNormSq();
        final var d5 = d2 * d2 * d.getNorm();
        return outer(d, d).scalarMultiply(3.0)
                .subtract(identity().scalarMultiply(d2))
                .scalarMultiply(mu / d5);
    }
}
