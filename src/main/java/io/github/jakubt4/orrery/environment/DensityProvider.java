package io.github.jakubt4.orrery.environment;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.orekit.time.AbsoluteDate;

/**
 * Atmospheric mass density around the central body.
 */
public interface DensityProvider {

    /** Finite-difference step used by the default gradient [m]. */
    double GRADIENT_STEP = 1.0;

    /**
     * @param position inertial position relative to the central body [m]
     * @return density [kg/m³]
     */
    double density(Vector3D position, AbsoluteDate epoch);

    /**
     * Gradient of {@link #density} with respect to position [kg/m⁴]. The default is a
     * centred difference; models with a closed form should override it so that drag
     * partials match the density they were built from.
     */
    default Vector3D densityGradient(final Vector3D position, final AbsoluteDate epoch) {
        final var h = GRADIENT_STEP;
        final var axes = new Vector3D[]{Vector3D.PLUS_I, Vector3D.PLUS_J, Vector3D.PLUS_K};
        final var g = new double[3];
        for (var k = 0; k < 3; k++) {
            final var plus = density(position.add(h, axes[k]), epoch);
            final var minus = density(position.subtract(h, axes[k]), epoch);
            g[k] = (plus - minus) / (2.0 * h);
        }
        return new Vector3D(g);
    }
}
