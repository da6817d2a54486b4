package io.github.jakubt4.orrery.dynamics.force;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;

import java.util.function.Function;

/**
 * Centred-difference Jacobians for checking closed-form partials.
 */
public final class FiniteDifferences {

    private static final Vector3D[] AXES = {Vector3D.PLUS_I, Vector3D.PLUS_J, Vector3D.PLUS_K};

    private FiniteDifferences() {
    }

    /** Column k is {@code (f(x + ε·e_k) − f(x − ε·e_k)) / 2ε}. */
    public static RealMatrix jacobian(final Function<Vector3D, Vector3D> f, final Vector3D x, final double epsilon) {
        final var jacobian = MatrixUtils.createRealMatrix(3, 3);
        for (var k = 0; k < 3; k++) {
            final var plus = f.apply(x.add(epsilon, AXES[k]));
            final var minus = f.apply(x.subtract(epsilon, AXES[k]));
            jacobian.setColumn(k, plus.subtract(minus).scalarMultiply(1.0 / (2.0 * epsilon)).toArray());
        }
        return jacobian;
    }

    public static double relativeError(final RealMatrix actual, final RealMatrix expected) {
        return actual.subtract(expected).getFrobeniusNorm() / expected.getFrobeniusNorm();
    }
}
