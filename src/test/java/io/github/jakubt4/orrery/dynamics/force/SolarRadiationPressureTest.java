package io.github.jakubt4.orrery.dynamics.force;

import io.github.jakubt4.orrery.environment.EphemerisProvider;
import io.github.jakubt4.orrery.environment.InverseSquareSolarPressure;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.orekit.time.AbsoluteDate;
import org.orekit.utils.Constants;
import org.orekit.utils.PVCoordinates;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SolarRadiationPressureTest {

    private static final double AU = Constants.IAU_2012_ASTRONOMICAL_UNIT;
    private static final double AREA = 2.0;
    private static final double MASS = 150.0;

    private EphemerisProvider ephemeris;
    private SolarRadiationPressure srp;

    @BeforeEach
    void setUp() {
        ephemeris = mock(EphemerisProvider.class);
        srp = new SolarRadiationPressure(ephemeris,
                new InverseSquareSolarPressure(InverseSquareSolarPressure.PRESSURE_AT_ONE_AU, AU),
                AREA, MASS, 1.3);
    }

    @Test
    void pushesAlongTheSunToObjectDirection() {
        final var sun = new Vector3D(AU, 0.2 * AU, -0.1 * AU);
        when(ephemeris.positionOf(eq("SUN"), any(AbsoluteDate.class))).thenReturn(sun);
        final var r = new Vector3D(7000e3, 2000e3, 100e3);

        final var a = srp.contribution(context(r, false)).acceleration();

        final var sunToObject = r.subtract(sun);
        assertThat(Vector3D.angle(a, sunToObject)).isCloseTo(0.0, within(1e-12));
        assertThat(a.getNorm()).isCloseTo(
                InverseSquareSolarPressure.PRESSURE_AT_ONE_AU * 1.3 * AREA / MASS * (AU / sunToObject.getNorm()) * (AU / sunToObject.getNorm()),
                within(1e-20));
    }

    @Test
    void magnitudeFallsWithTheSquareOfDistance() {
        when(ephemeris.positionOf(eq("SUN"), any(AbsoluteDate.class))).thenReturn(Vector3D.ZERO);
        final var direction = new Vector3D(0.3, -0.8, 0.52).normalize();

        final var near = srp.contribution(context(direction.scalarMultiply(0.8 * AU), false)).acceleration();
        final var far = srp.contribution(context(direction.scalarMultiply(1.6 * AU), false)).acceleration();

        assertThat(near.getNorm() / far.getNorm()).isCloseTo(4.0, within(1e-12));
        assertThat(Vector3D.angle(near, far)).isCloseTo(0.0, within(1e-12));
        assertThat(Vector3D.dotProduct(near, direction)).isPositive();
    }

    @ParameterizedTest
    @CsvSource({
            "7000e3, 0, 0",
            "-42164e3, 1000e3, 0",
            "3.0e8, -2.0e8, 1.0e8"
    })
    void positionPartialsMatchCentredDifferences(final double x, final double y, final double z) {
        when(ephemeris.positionOf(eq("SUN"), any(AbsoluteDate.class)))
                .thenReturn(new Vector3D(-0.6 * AU, 0.75 * AU, 0.32 * AU));
        final var r = new Vector3D(x, y, z);

        final var analytic = srp.contribution(context(r, true)).dadr();
        final var numeric = FiniteDifferences.jacobian(
                p -> srp.contribution(context(p, false)).acceleration(), r, 1.0e4);

        assertThat(FiniteDifferences.relativeError(numeric, analytic)).isLessThan(1e-6);
    }

    @Test
    void reducesToTheInverseCubeFormForInverseSquarePressure() {
        final var d = new Vector3D(0.9 * AU, -0.3 * AU, 0.1 * AU);
        final var unit = d.normalize();
        final var distance = d.getNorm();
        final var pressure = InverseSquareSolarPressure.PRESSURE_AT_ONE_AU * (AU / distance) * (AU / distance);

        final var dadr = srp.contribution(d, true).dadr();

        final var expected = Jacobians.identity().subtract(Jacobians.outer(unit, unit).scalarMultiply(3.0))
                .scalarMultiply(pressure * 1.3 * AREA / MASS / distance);
        assertThat(FiniteDifferences.relativeError(dadr, expected)).isLessThan(1e-12);
    }

    @Test
    void hasNoVelocityDependence() {
        when(ephemeris.positionOf(eq("SUN"), any(AbsoluteDate.class))).thenReturn(new Vector3D(AU, 0.0, 0.0));

        final var contribution = srp.contribution(context(new Vector3D(7000e3, 0.0, 0.0), true));

        assertThat(contribution.dadv().getFrobeniusNorm()).isZero();
    }

    private static ForceContext context(final Vector3D position, final boolean jacobians) {
        return new ForceContext(AbsoluteDate.J2000_EPOCH, new PVCoordinates(position, new Vector3D(0.0, 7500.0, 0.0)), jacobians);
    }
}
