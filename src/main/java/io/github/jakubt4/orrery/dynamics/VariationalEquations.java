package io.github.jakubt4.orrery.dynamics;

import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;

/**
 * Linearised dynamics {@code Φ̇ = M·Φ} with
 * <pre>
 *   M = | 0₃     I₃    |
 *       | ∂a/∂r  ∂a/∂v |
 * </pre>
 */
public final class VariationalEquations {

    private VariationalEquations() {
    }

    public static RealMatrix systemMatrix(final RealMatrix dadr, final RealMatrix dadv) {
        final var m = MatrixUtils.createRealMatrix(StateTransitionMatrices.SIZE, StateTransitionMatrices.SIZE);
        m.setSubMatrix(MatrixUtils.createRealIdentityMatrix(3).getData(), 0, 3);
        m.setSubMatrix(dadr.getData(), 3, 0);
        m.setSubMatrix(dadv.getData(), 3, 3);
        return m;
    }

    public static RealMatrix stmDerivative(final RealMatrix systemMatrix, final RealMatrix stm) {
        return systemMatrix.multiply(stm);
    }
}
