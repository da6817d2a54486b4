package io.github.jakubt4.orrery.environment;

import io.github.jakubt4.orrery.dynamics.CelestialBodyConstants;
import io.github.jakubt4.orrery.dynamics.error.MissingEphemerisDataException;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.orekit.time.AbsoluteDate;
import org.orekit.utils.Constants;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AnalyticEphemerisProviderTest {

    private static final double AU = Constants.IAU_2012_ASTRONOMICAL_UNIT;
    private static final double OBLIQUITY_J2000 = FastMath.toRadians(23.439291);
    private static final CelestialBodyConstants EARTH = CelestialBodyConstants.earth();

    private final AnalyticEphemerisProvider ephemeris = new AnalyticEphemerisProvider(EARTH);

    @Test
    void sunAtJ2000MatchesTheAlmanac() {
        final var sun = ephemeris.positionOf("SUN", AbsoluteDate.J2000_EPOCH);

        assertThat(sun.getX() / AU).isCloseTo(0.1771, within(1e-3));
        assertThat(sun.getY() / AU).isCloseTo(-0.8874, within(1e-3));
        assertThat(sun.getZ() / AU).isCloseTo(-0.3847, within(1e-3));
        // early January: close to perihelion
        assertThat(sun.getNorm() / AU).isCloseTo(0.9833, within(1e-4));
    }

    @Test
    void sunMovesAboutOneDegreePerDay() {
        final var today = ephemeris.positionOf("SUN", AbsoluteDate.J2000_EPOCH);
        final var tomorrow = ephemeris.positionOf("SUN", AbsoluteDate.J2000_EPOCH.shiftedBy(Constants.JULIAN_DAY));

        assertThat(Math.toDegrees(Vector3D.angle(today, tomorrow))).isCloseTo(1.02, within(0.03));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 3.3, 11.0, 17.9, 25.2, 365.25 * 7 + 4.5})
    void moonStaysBetweenPerigeeAndApogee(final double days) {
        final var moon = ephemeris.positionOf("MOON", AbsoluteDate.J2000_EPOCH.shiftedBy(days * Constants.JULIAN_DAY));

        assertThat(moon.getNorm()).isBetween(355_000e3, 410_000e3);
        // the lunar orbit is inclined about 5° to the ecliptic, so at most ~28.6° to the equator
        assertThat(Math.abs(Math.toDegrees(Math.asin(moon.getZ() / moon.getNorm())))).isLessThan(29.0);
    }

    @Test
    void precessionIsIdentityAtJ2000() {
        final var v = new Vector3D(0.3, -0.5, 0.8);

        assertThat(AnalyticEphemerisProvider.precessToJ2000(v, 0.0)).isEqualTo(v);
    }

    @Test
    void equinoxOfDateDriftsWestAlongTheEcliptic() {
        // one century: general precession in longitude ≈ 5029", pole shift θ ≈ 2004"
        final var equinox = AnalyticEphemerisProvider.precessToJ2000(Vector3D.PLUS_I, 1.0);
        final var pole = AnalyticEphemerisProvider.precessToJ2000(Vector3D.PLUS_K, 1.0);

        assertThat(Math.toDegrees(Vector3D.angle(equinox, Vector3D.PLUS_I)) * 3600.0).isCloseTo(5029.0, within(5.0));
        assertThat(equinox.getY()).isNegative();
        assertThat(Math.toDegrees(Vector3D.angle(pole, Vector3D.PLUS_K)) * 3600.0).isCloseTo(2004.2, within(1.0));
        assertThat(equinox.getNorm()).isCloseTo(1.0, within(1e-15));
    }

    @Test
    void sunTwentyFiveYearsOnIsPrecessedToJ2000Axes() {
        final var epoch = AbsoluteDate.J2000_EPOCH.shiftedBy(0.25 * Constants.JULIAN_CENTURY);

        final var sun = ephemeris.positionOf("SUN", epoch);

        // the ecliptic pole is fixed in J2000 axes, so the Sun stays on the J2000 ecliptic
        final var eclipticPole = new Vector3D(0.0, -FastMath.sin(OBLIQUITY_J2000), FastMath.cos(OBLIQUITY_J2000));
        assertThat(Math.toDegrees(FastMath.asin(Vector3D.dotProduct(sun.normalize(), eclipticPole))))
                .isCloseTo(0.0, within(0.01));
    }

    @Test
    void centralBodyIsAtTheOrigin() {
        assertThat(ephemeris.positionOf("earth", AbsoluteDate.J2000_EPOCH)).isEqualTo(Vector3D.ZERO);
    }

    @Test
    void namesAreCaseInsensitive() {
        final var epoch = AbsoluteDate.J2000_EPOCH.shiftedBy(1.0e6);

        assertThat(ephemeris.positionOf(" Sun ", epoch)).isEqualTo(ephemeris.positionOf("SUN", epoch));
        assertThat(ephemeris.bodyConstant("moon", BodyConstant.GM))
                .isEqualTo(ephemeris.bodyConstant("MOON", BodyConstant.GM));
    }

    @Test
    void reportsGravitationalParameters() {
        assertThat(ephemeris.bodyConstant("SUN", BodyConstant.GM)).isEqualTo(Constants.JPL_SSD_SUN_GM);
        assertThat(ephemeris.bodyConstant("MOON", BodyConstant.GM)).isCloseTo(4.9028e12, within(1e8));
        assertThat(ephemeris.bodyConstant("EARTH", BodyConstant.GM)).isEqualTo(EARTH.mu());
        assertThat(ephemeris.bodyConstant("EARTH", BodyConstant.RADIUS)).isEqualTo(EARTH.equatorialRadius());
    }

    @Test
    void unknownBodiesAreMissing() {
        assertThatThrownBy(() -> ephemeris.positionOf("JUPITER", AbsoluteDate.J2000_EPOCH))
                .isInstanceOf(MissingEphemerisDataException.class)
                .hasMessageContaining("JUPITER");
        assertThatThrownBy(() -> ephemeris.bodyConstant("VENUS", BodyConstant.GM))
                .isInstanceOf(MissingEphemerisDataException.class);
        assertThatThrownBy(() -> ephemeris.positionOf(null, AbsoluteDate.J2000_EPOCH))
                .isInstanceOf(MissingEphemerisDataException.class);
    }
}
