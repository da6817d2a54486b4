package io.github.jakubt4.orrery.environment;

import io.github.jakubt4.orrery.dynamics.CelestialBodyConstants;
import io.github.jakubt4.orrery.dynamics.error.MissingEphemerisDataException;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.orekit.time.AbsoluteDate;
import org.orekit.utils.Constants;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Low-precision geocentric Sun and Moon positions from the Astronomical Almanac
 * series (Vallado, algorithms 29 and 31). The series give the mean equator and
 * equinox of date; positions are precessed to the J2000 mean equator and equinox
 * (IAU 1976) so they share axes with the propagated state.
 *
 * <p>Accuracy is about 0.01° for the Sun and 0.3° for the Moon, enough for
 * perturbation modelling without any ephemeris file. Bodies other than the Sun,
 * the Moon and the central body are reported as missing.
 */
@Slf4j
public class AnalyticEphemerisProvider implements EphemerisProvider {

    public static final String SUN = "SUN";
    public static final String MOON = "MOON";

    private static final double MOON_GM = 4.902800066e12;
    /** Earth radius the lunar parallax series is referenced to [m]. */
    private static final double PARALLAX_EARTH_RADIUS = 6378136.3;

    private final CelestialBodyConstants centralBody;
    private final Map<String, double[]> constants;

    public AnalyticEphemerisProvider(final CelestialBodyConstants centralBody) {
        this.centralBody = centralBody;
        this.constants = new HashMap<>();
        constants.put(SUN, new double[]{Constants.JPL_SSD_SUN_GM, Constants.SUN_RADIUS});
        constants.put(MOON, new double[]{MOON_GM, Constants.MOON_EQUATORIAL_RADIUS});
        constants.put(key(centralBody.name()), new double[]{centralBody.mu(), centralBody.equatorialRadius()});
        log.info("Analytic ephemeris initialized — Sun and Moon about {}", centralBody.name());
    }

    @Override
    public Vector3D positionOf(final String body, final AbsoluteDate epoch) {
        final var name = key(body);
        if (name.equals(key(centralBody.name()))) {
            return Vector3D.ZERO;
        }
        final var t = epoch.durationFrom(AbsoluteDate.J2000_EPOCH) / Constants.JULIAN_CENTURY;
        return switch (name) {
            case SUN -> precessToJ2000(sun(t), t);
            case MOON -> precessToJ2000(moon(t), t);
            default -> throw new MissingEphemerisDataException(
                    "No analytic ephemeris for body [" + body + "]; configure orrery.ephemeris.source=orekit");
        };
    }

    @Override
    public double bodyConstant(final String body, final BodyConstant constant) {
        final var values = constants.get(key(body));
        if (values == null) {
            throw new MissingEphemerisDataException("No constants for body [" + body + "]");
        }
        return switch (constant) {
            case GM -> values[0];
            case RADIUS -> values[1];
        };
    }

    private static Vector3D sun(final double t) {
        final var meanLongitude = 280.460 + 36000.771 * t;
        final var meanAnomaly = FastMath.toRadians(357.5291092 + 35999.05034 * t);
        final var longitude = FastMath.toRadians(meanLongitude
                + 1.914666471 * FastMath.sin(meanAnomaly)
                + 0.019994643 * FastMath.sin(2.0 * meanAnomaly));
        final var distance = (1.000140612
                - 0.016708617 * FastMath.cos(meanAnomaly)
                - 0.000139589 * FastMath.cos(2.0 * meanAnomaly)) * Constants.IAU_2012_ASTRONOMICAL_UNIT;
        final var obliquity = obliquity(t);
        return new Vector3D(
                distance * FastMath.cos(longitude),
                distance * FastMath.cos(obliquity) * FastMath.sin(longitude),
                distance * FastMath.sin(obliquity) * FastMath.sin(longitude));
    }

    private static Vector3D moon(final double t) {
        final var longitude = FastMath.toRadians(218.32 + 481267.8813 * t
                + 6.29 * sinDeg(134.9 + 477198.85 * t)
                - 1.27 * sinDeg(259.2 - 413335.38 * t)
                + 0.66 * sinDeg(235.7 + 890534.23 * t)
                + 0.21 * sinDeg(269.9 + 954397.70 * t)
                - 0.19 * sinDeg(357.5 + 35999.05 * t)
                - 0.11 * sinDeg(186.6 + 966404.05 * t));
        final var latitude = FastMath.toRadians(
                5.13 * sinDeg(93.3 + 483202.03 * t)
                + 0.28 * sinDeg(228.2 + 960400.87 * t)
                - 0.28 * sinDeg(318.3 + 6003.18 * t)
                - 0.17 * sinDeg(217.6 - 407332.20 * t));
        final var parallax = FastMath.toRadians(0.9508
                + 0.0518 * cosDeg(134.9 + 477198.85 * t)
                + 0.0095 * cosDeg(259.2 - 413335.38 * t)
                + 0.0078 * cosDeg(235.7 + 890534.23 * t)
                + 0.0028 * cosDeg(269.9 + 954397.70 * t));
        final var distance = PARALLAX_EARTH_RADIUS / FastMath.sin(parallax);
        final var obliquity = obliquity(t);

        final var cosLat = FastMath.cos(latitude);
        final var sinLat = FastMath.sin(latitude);
        final var cosLon = FastMath.cos(longitude);
        final var sinLon = FastMath.sin(longitude);
        final var cosObl = FastMath.cos(obliquity);
        final var sinObl = FastMath.sin(obliquity);
        return new Vector3D(
                distance * cosLat * cosLon,
                distance * (cosObl * cosLat * sinLon - sinObl * sinLat),
                distance * (sinObl * cosLat * sinLon + cosObl * sinLat));
    }

    /**
     * Mean-of-date vector expressed in J2000 axes, {@code R3(ζ)·R2(−θ)·R3(z)}.
     *
     * @param t Julian centuries of TT from J2000
     */
    static Vector3D precessToJ2000(final Vector3D ofDate, final double t) {
        final var zeta = arcsec((2306.2181 + (0.30188 + 0.017998 * t) * t) * t);
        final var theta = arcsec((2004.3109 - (0.42665 + 0.041833 * t) * t) * t);
        final var z = arcsec((2306.2181 + (1.09468 + 0.018203 * t) * t) * t);
        return rotateZ(zeta, rotateY(-theta, rotateZ(z, ofDate)));
    }

    private static Vector3D rotateZ(final double angle, final Vector3D v) {
        final var c = FastMath.cos(angle);
        final var s = FastMath.sin(angle);
        return new Vector3D(c * v.getX() + s * v.getY(), -s * v.getX() + c * v.getY(), v.getZ());
    }

    private static Vector3D rotateY(final double angle, final Vector3D v) {
        final var c = FastMath.cos(angle);
        final var s = FastMath.sin(angle);
        return new Vector3D(c * v.getX() - s * v.getZ(), v.getY(), s * v.getX() + c * v.getZ());
    }

    private static double arcsec(final double value) {
        return FastMath.toRadians(value / 3600.0);
    }

    private static double obliquity(final double t) {
        return FastMath.toRadians(23.439291 - 0.0130042 * t);
    }

    private static double sinDeg(final double degrees) {
        return FastMath.sin(FastMath.toRadians(degrees));
    }

    private static double cosDeg(final double degrees) {
        return FastMath.cos(FastMath.toRadians(degrees));
    }

    private static String key(final String body) {
        if (body == null) {
            throw new MissingEphemerisDataException("Body name is required");
        }
        return body.trim().toUpperCase(Locale.ROOT);
    }
}
