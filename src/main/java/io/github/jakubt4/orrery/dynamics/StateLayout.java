package io.github.jakubt4.orrery.dynamics;

import io.github.jakubt4.orrery.dynamics.error.ConfigurationException;

/**
 * Shapes of the state vector the derivative function accepts.
 */
public enum StateLayout {

    /** Position and velocity only. */
    CARTESIAN(6),

    /** Position and velocity followed by the column-major 6×6 STM. */
    CARTESIAN_WITH_STM(6 + StateTransitionMatrices.SIZE * StateTransitionMatrices.SIZE);

    private final int dimension;

    StateLayout(final int dimension) {
        this.dimension = dimension;
    }

    public int dimension() {
        return dimension;
    }

    public boolean hasStm() {
        return this == CARTESIAN_WITH_STM;
    }

    /**
     * @throws ConfigurationException for any length other than 6 or 42
     */
    public static StateLayout of(final int length) {
        for (final var layout : values()) {
            if (layout.dimension == length) {
                return layout;
            }
        }
        throw new ConfigurationException("State vector must have 6 or 42 elements, got " + length);
    }
}
