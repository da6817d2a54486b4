package io.github.jakubt4.orrery.dynamics.frame;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;
import org.orekit.utils.PVCoordinates;

/**
 * Classical orbital elements of a Cartesian state.
 *
 * <p>Unlike Orekit's {@code KeplerianOrbit} this conversion accepts parabolic
 * states (semi-major axis reported as infinite) and picks conventional values for
 * the undefined angles: on equatorial orbits the node is taken along +X, on
 * circular orbits the periapsis is taken at the node. The argument of latitude
 * {@code ω + ν} is well defined in every non-degenerate case.
 *
 * @param semiMajorAxis    [m], negative for hyperbolic orbits
 * @param eccentricity     [-]
 * @param inclination      [rad] in [0, π]
 * @param raan             right ascension of the ascending node [rad] in [0, 2π)
 * @param argumentOfPeriapsis [rad] in [0, 2π)
 * @param trueAnomaly      [rad] in [0, 2π)
 */
public record OrbitalElements(double semiMajorAxis,
                              double eccentricity,
                              double inclination,
                              double raan,
                              double argumentOfPeriapsis,
                              double trueAnomaly) {

    private static final double CIRCULAR_ECCENTRICITY = 1.0e-11;
    private static final double EQUATORIAL_NODE_RATIO = 1.0e-11;

    /**
     * @param state inertial position/velocity relative to the attracting body
     * @param mu    gravitational parameter of the attracting body [m³/s²]
     * @throws io.github.jakubt4.orrery.dynamics.error.DegenerateGeometryException when the
     *         position or the angular momentum is near zero
     */
    public static OrbitalElements fromState(final PVCoordinates state, final double mu) {
        final var r = state.getPosition();
        final var v = state.getVelocity();
        final var rUnit = Geometry.unitPosition(r);
        final var hUnit = Geometry.unitAngularMomentum(r, v);

        final var rNorm = r.getNorm();
        final var v2 = v.getNormSq();

        final var energy = 0.5 * v2 - mu / rNorm;
        final var semiMajorAxis = energy == 0.0 ? Double.POSITIVE_INFINITY : -mu / (2.0 * energy);

        final var eVector = new Vector3D((v2 - mu / rNorm) / mu, r, -Vector3D.dotProduct(r, v) / mu, v);
        final var eccentricity = eVector.getNorm();

        final var inclination = FastMath.acos(FastMath.max(-1.0, FastMath.min(1.0, hUnit.getZ())));

        // ascending node k × h, or +X when the orbit lies in the reference plane
        final var node = new Vector3D(-hUnit.getY(), hUnit.getX(), 0.0);
        final var equatorial = node.getNorm() < EQUATORIAL_NODE_RATIO;
        final var nodeUnit = equatorial ? Vector3D.PLUS_I : node.normalize();
        final var raan = equatorial ? 0.0 : positive(FastMath.atan2(nodeUnit.getY(), nodeUnit.getX()));

        final var argumentOfLatitude = angleInPlane(nodeUnit, rUnit, hUnit);
        final double argumentOfPeriapsis;
        final double trueAnomaly;
        if (eccentricity < CIRCULAR_ECCENTRICITY) {
            argumentOfPeriapsis = 0.0;
            trueAnomaly = argumentOfLatitude;
        } else {
            final var eUnit = eVector.scalarMultiply(1.0 / eccentricity);
            argumentOfPeriapsis = angleInPlane(nodeUnit, eUnit, hUnit);
            trueAnomaly = angleInPlane(eUnit, rUnit, hUnit);
        }

        return new OrbitalElements(semiMajorAxis, eccentricity, inclination, raan, argumentOfPeriapsis, trueAnomaly);
    }

    /** {@code ω + ν} in [0, 2π). */
    public double argumentOfLatitude() {
        return positive(argumentOfPeriapsis + trueAnomaly);
    }

    /** Angle from {@code from} to {@code to}, counted positive about {@code axis}. */
    private static double angleInPlane(final Vector3D from, final Vector3D to, final Vector3D axis) {
        final var sin = Vector3D.dotProduct(axis, Vector3D.crossProduct(from, to));
        final var cos = Vector3D.dotProduct(from, to);
        return positive(FastMath.atan2(sin, cos));
    }

    private static double positive(final double angle) {
        return MathUtils.normalizeAngle(angle, FastMath.PI);
    }
}
