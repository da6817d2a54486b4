package io.github.jakubt4.orrery.environment;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.orekit.time.AbsoluteDate;

/**
 * Positions and constants of celestial bodies.
 *
 * <p>Positions are expressed in the inertial frame of the propagation, relative
 * to the central body.
 */
public interface EphemerisProvider {

    /**
     * @throws io.github.jakubt4.orrery.dynamics.error.MissingEphemerisDataException
     *         if the body is unknown or no data covers the epoch
     */
    Vector3D positionOf(String body, AbsoluteDate epoch);

    /**
     * @throws io.github.jakubt4.orrery.dynamics.error.MissingEphemerisDataException
     *         if the body or constant is unknown
     */
    double bodyConstant(String body, BodyConstant constant);
}
