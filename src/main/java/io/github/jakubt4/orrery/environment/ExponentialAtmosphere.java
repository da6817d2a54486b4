package io.github.jakubt4.orrery.environment;

import io.github.jakubt4.orrery.dynamics.error.ConfigurationException;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.orekit.time.AbsoluteDate;

/**
 * Piecewise exponential density over a spherical central body,
 * {@code ρ = ρ₀·exp(−(h − h₀)/H)} on each altitude band (Vallado, table 8-4).
 *
 * <p>Altitudes below the first band use the sea-level row; altitudes above the
 * last one extrapolate it.
 */
public class ExponentialAtmosphere implements DensityProvider {

    // base altitude [km], nominal density [kg/m³], scale height [km]
    private static final double[][] BANDS = {
            {0, 1.225, 7.249},
            {25, 3.899e-2, 6.349},
            {30, 1.774e-2, 6.682},
            {40, 3.972e-3, 7.554},
            {50, 1.057e-3, 8.382},
            {60, 3.206e-4, 7.714},
            {70, 8.770e-5, 6.549},
            {80, 1.905e-5, 5.799},
            {90, 3.396e-6, 5.382},
            {100, 5.297e-7, 5.877},
            {110, 9.661e-8, 7.263},
            {120, 2.438e-8, 9.473},
            {130, 8.484e-9, 12.636},
            {140, 3.845e-9, 16.149},
            {150, 2.070e-9, 22.523},
            {180, 5.464e-10, 29.740},
            {200, 2.789e-10, 37.105},
            {250, 7.248e-11, 45.546},
            {300, 2.418e-11, 53.628},
            {350, 9.518e-12, 53.298},
            {400, 3.725e-12, 58.515},
            {450, 1.585e-12, 60.828},
            {500, 6.967e-13, 63.822},
            {600, 1.454e-13, 71.835},
            {700, 3.614e-14, 88.667},
            {800, 1.170e-14, 124.64},
            {900, 5.245e-15, 181.05},
            {1000, 3.019e-15, 268.00}
    };

    private static final double KM = 1000.0;

    private final double bodyRadius;

    /**
     * @param bodyRadius radius of the sphere altitudes are measured from [m]
     */
    public ExponentialAtmosphere(final double bodyRadius) {
        if (!(bodyRadius > 0.0)) {
            throw new ConfigurationException("Atmosphere body radius must be positive, got " + bodyRadius);
        }
        this.bodyRadius = bodyRadius;
    }

    @Override
    public double density(final Vector3D position, final AbsoluteDate epoch) {
        final var altitude = position.getNorm() - bodyRadius;
        final var band = band(altitude);
        return bandDensity(band, FastMath.max(altitude, 0.0));
    }

    @Override
    public Vector3D densityGradient(final Vector3D position, final AbsoluteDate epoch) {
        final var altitude = position.getNorm() - bodyRadius;
        if (altitude < 0.0) {
            return Vector3D.ZERO;
        }
        final var band = band(altitude);
        final var rho = bandDensity(band, altitude);
        return position.normalize().scalarMultiply(-rho / (BANDS[band][2] * KM));
    }

    private static int band(final double altitude) {
        var index = 0;
        while (index + 1 < BANDS.length && altitude >= BANDS[index + 1][0] * KM) {
            index++;
        }
        return index;
    }

    private static double bandDensity(final int band, final double altitude) {
        final var row = BANDS[band];
        return row[1] * FastMath.exp(-(altitude - row[0] * KM) / (row[2] * KM));
    }
}
