package io.github.jakubt4.orrery.dynamics;

import io.github.jakubt4.orrery.dynamics.force.ForceContext;
import io.github.jakubt4.orrery.dynamics.force.ForceKind;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.ode.OrdinaryDifferentialEquation;
import org.orekit.time.AbsoluteDate;
import org.orekit.utils.PVCoordinates;

import java.util.Set;

/**
 * Derivative function handed to the integrator.
 *
 * <p>The state is either {@code [r, v]} (6 elements) or {@code [r, v, Φ]} with
 * the column-major STM appended (42 elements). Time {@code t} counts seconds from
 * {@code epoch0}. Each call is independent; the only per-instance state is the
 * ephemeris cache, so one instance must not be shared across threads.
 */
public class VariationalDynamics implements OrdinaryDifferentialEquation {

    private final AbsoluteDate epoch0;
    private final ForceComposer composer;
    private final StateLayout layout;

    public VariationalDynamics(final AbsoluteDate epoch0, final ForceComposer composer, final StateLayout layout) {
        this.epoch0 = epoch0;
        this.composer = composer;
        this.layout = layout;
    }

    public AbsoluteDate getEpoch0() {
        return epoch0;
    }

    public StateLayout getLayout() {
        return layout;
    }

    /** Active forces whose partials are zero-filled in the system matrix. */
    public Set<ForceKind> approximatedJacobians() {
        return composer.approximatedJacobians();
    }

    @Override
    public int getDimension() {
        return layout.dimension();
    }

    @Override
    public double[] computeDerivatives(final double t, final double[] y) {
        return evaluate(t, y).derivative();
    }

    /**
     * @throws io.github.jakubt4.orrery.dynamics.error.ConfigurationException if
     *         {@code y} has neither 6 nor 42 elements; nothing is computed then
     */
    public DerivativeEvaluation evaluate(final double t, final double[] y) {
        final var shape = StateLayout.of(y.length);
        final var state = new PVCoordinates(new Vector3D(y[0], y[1], y[2]), new Vector3D(y[3], y[4], y[5]));
        final var forces = composer.compose(new ForceContext(epoch0.shiftedBy(t), state, shape.hasStm()));
        final var acceleration = forces.total().acceleration();

        final var yDot = new double[y.length];
        yDot[0] = y[3];
        yDot[1] = y[4];
        yDot[2] = y[5];
        yDot[3] = acceleration.getX();
        yDot[4] = acceleration.getY();
        yDot[5] = acceleration.getZ();

        if (shape.hasStm()) {
            final var m = VariationalEquations.systemMatrix(forces.total().dadr(), forces.total().dadv());
            final var stmDot = VariationalEquations.stmDerivative(m, StateTransitionMatrices.unpack(y));
            StateTransitionMatrices.pack(stmDot, yDot);
        }
        return new DerivativeEvaluation(yDot, forces);
    }
}
