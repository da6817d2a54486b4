package io.github.jakubt4.orrery.dynamics;

import io.github.jakubt4.orrery.dynamics.error.ConfigurationException;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;

/**
 * Packing of the 6×6 state transition matrix into the tail of a 42-element
 * state vector.
 *
 * <p>The convention is <b>column-major</b>: entry {@code (i, j)} lives at
 * {@code state[OFFSET + j * SIZE + i]}. {@link #pack} and {@link #unpack} are
 * exact inverses; every caller goes through them.
 */
public final class StateTransitionMatrices {

    public static final int SIZE = 6;
    public static final int OFFSET = 6;

    private StateTransitionMatrices() {
    }

    public static RealMatrix unpack(final double[] state) {
        requireStm(state);
        final var stm = MatrixUtils.createRealMatrix(SIZE, SIZE);
        for (var j = 0; j < SIZE; j++) {
            for (var i = 0; i < SIZE; i++) {
                stm.setEntry(i, j, state[OFFSET + j * SIZE + i]);
            }
        }
        return stm;
    }

    public static void pack(final RealMatrix stm, final double[] state) {
        requireStm(state);
        if (stm.getRowDimension() != SIZE || stm.getColumnDimension() != SIZE) {
            throw new ConfigurationException("STM must be " + SIZE + "×" + SIZE + ", got "
                    + stm.getRowDimension() + "×" + stm.getColumnDimension());
        }
        for (var j = 0; j < SIZE; j++) {
            for (var i = 0; i < SIZE; i++) {
                state[OFFSET + j * SIZE + i] = stm.getEntry(i, j);
            }
        }
    }

    /** 42-element state made of {@code cartesian} followed by the given STM. */
    public static double[] augment(final double[] cartesian, final RealMatrix stm) {
        if (cartesian.length != OFFSET) {
            throw new ConfigurationException("Cartesian state must have " + OFFSET + " elements, got " + cartesian.length);
        }
        final var state = new double[StateLayout.CARTESIAN_WITH_STM.dimension()];
        System.arraycopy(cartesian, 0, state, 0, OFFSET);
        pack(stm, state);
        return state;
    }

    /** 42-element state made of {@code cartesian} followed by an identity STM. */
    public static double[] augmentWithIdentity(final double[] cartesian) {
        return augment(cartesian, MatrixUtils.createRealIdentityMatrix(SIZE));
    }

    private static void requireStm(final double[] state) {
        if (state.length != StateLayout.CARTESIAN_WITH_STM.dimension()) {
            throw new ConfigurationException("STM state must have "
                    + StateLayout.CARTESIAN_WITH_STM.dimension() + " elements, got " + state.length);
        }
    }
}
