package io.github.jakubt4.orrery.dynamics;

import io.github.jakubt4.orrery.dynamics.error.ConfigurationException;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.orekit.utils.Constants;

/**
 * Physical constants of the central body, resolved once at configuration time
 * and handed to the force models that need them.
 *
 * @param name              body identifier, e.g. {@code EARTH}
 * @param mu                gravitational parameter [m³/s²]
 * @param equatorialRadius  [m]
 * @param j2                second zonal harmonic (unnormalized, {@code -C20})
 * @param rotationRate      sidereal rotation rate about +Z [rad/s]
 */
public record CelestialBodyConstants(String name,
                                     double mu,
                                     double equatorialRadius,
                                     double j2,
                                     double rotationRate) {

    public CelestialBodyConstants {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Central body name is required");
        }
        if (!(mu > 0.0)) {
            throw new ConfigurationException("Central body gravitational parameter must be positive, got " + mu);
        }
        if (!(equatorialRadius > 0.0)) {
            throw new ConfigurationException("Central body radius must be positive, got " + equatorialRadius);
        }
    }

    /** Earth with EIGEN-5C gravity constants and the WGS-84 shape and spin. */
    public static CelestialBodyConstants earth() {
        return new CelestialBodyConstants("EARTH",
                Constants.EIGEN5C_EARTH_MU,
                Constants.WGS84_EARTH_EQUATORIAL_RADIUS,
                -Constants.EIGEN5C_EARTH_C20,
                Constants.WGS84_EARTH_ANGULAR_VELOCITY);
    }

    public Vector3D angularVelocity() {
        return new Vector3D(0.0, 0.0, rotationRate);
    }
}
