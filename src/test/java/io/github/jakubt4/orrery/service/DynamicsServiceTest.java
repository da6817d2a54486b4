package io.github.jakubt4.orrery.service;

import io.github.jakubt4.orrery.dynamics.CelestialBodyConstants;
import io.github.jakubt4.orrery.dynamics.DynamicsEnvironment;
import io.github.jakubt4.orrery.dynamics.ForceConfiguration;
import io.github.jakubt4.orrery.dynamics.StateLayout;
import io.github.jakubt4.orrery.dynamics.StateTransitionMatrices;
import io.github.jakubt4.orrery.dynamics.error.ConfigurationException;
import io.github.jakubt4.orrery.dynamics.force.ForceKind;
import io.github.jakubt4.orrery.environment.AnalyticEphemerisProvider;
import io.github.jakubt4.orrery.environment.ExponentialAtmosphere;
import io.github.jakubt4.orrery.environment.InverseSquareSolarPressure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.orekit.time.AbsoluteDate;
import org.orekit.utils.Constants;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DynamicsServiceTest {

    private static final CelestialBodyConstants EARTH = CelestialBodyConstants.earth();
    private static final double[] LEO = {6778e3, 0.0, 0.0, 0.0, 6000.0, 4600.0};

    private OptionalTermMonitor monitor;
    private DynamicsService service;

    @BeforeEach
    void setUp() {
        monitor = new OptionalTermMonitor();
        service = new DynamicsService(new DynamicsEnvironment(EARTH,
                new AnalyticEphemerisProvider(EARTH),
                new ExponentialAtmosphere(EARTH.equatorialRadius()),
                new InverseSquareSolarPressure(InverseSquareSolarPressure.PRESSURE_AT_ONE_AU,
                        Constants.IAU_2012_ASTRONOMICAL_UNIT)), monitor);
    }

    @Test
    void derivativeSelectsTheLayoutFromTheStateLength() {
        final var cartesian = service.derivative(0.0, LEO, AbsoluteDate.J2000_EPOCH, ForceConfiguration.twoBody());
        final var augmented = service.derivative(0.0, StateTransitionMatrices.augmentWithIdentity(LEO),
                AbsoluteDate.J2000_EPOCH, ForceConfiguration.twoBody());

        assertThat(cartesian.derivative()).hasSize(6);
        assertThat(augmented.derivative()).hasSize(42);
    }

    @Test
    void derivativeRejectsMalformedStateBeforeComposingForces() {
        // an invalid configuration would fail too; the state length is checked first
        final var invalid = ForceConfiguration.builder().drag(true).build();

        assertThatThrownBy(() -> service.derivative(0.0, new double[5], AbsoluteDate.J2000_EPOCH, invalid))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("6 or 42");
    }

    @Test
    void derivativeRejectsInvalidConfiguration() {
        final var invalid = ForceConfiguration.builder().srp(true).area(1.0).build();

        assertThatThrownBy(() -> service.derivative(0.0, LEO, AbsoluteDate.J2000_EPOCH, invalid))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("mass");
    }

    @Test
    void skippedTermsReachTheMonitor() {
        final var radial = new double[]{7000e3, 0.0, 0.0, 100.0, 0.0, 0.0};

        final var evaluation = service.derivative(0.0, radial, AbsoluteDate.J2000_EPOCH,
                ForceConfiguration.builder().j2(true).build());

        assertThat(evaluation.forces().skipped()).hasSize(1);
        assertThat(monitor.skippedCount(ForceKind.J2_OBLATENESS)).isEqualTo(1);
    }

    @Test
    void everyCreateReturnsAFreshInstance() {
        final var first = service.create(AbsoluteDate.J2000_EPOCH, ForceConfiguration.twoBody(), StateLayout.CARTESIAN);
        final var second = service.create(AbsoluteDate.J2000_EPOCH, ForceConfiguration.twoBody(), StateLayout.CARTESIAN);

        assertThat(first).isNotSameAs(second);
    }
}
