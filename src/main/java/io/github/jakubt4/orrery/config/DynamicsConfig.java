package io.github.jakubt4.orrery.config;

import io.github.jakubt4.orrery.dynamics.CelestialBodyConstants;
import io.github.jakubt4.orrery.dynamics.DynamicsEnvironment;
import io.github.jakubt4.orrery.environment.AnalyticEphemerisProvider;
import io.github.jakubt4.orrery.environment.DensityProvider;
import io.github.jakubt4.orrery.environment.EphemerisProvider;
import io.github.jakubt4.orrery.environment.ExponentialAtmosphere;
import io.github.jakubt4.orrery.environment.InverseSquareSolarPressure;
import io.github.jakubt4.orrery.environment.OrekitEphemerisProvider;
import io.github.jakubt4.orrery.environment.SolarPressureModel;
import lombok.extern.slf4j.Slf4j;
import org.orekit.data.DataContext;
import org.orekit.frames.FramesFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the central-body constants and the external collaborators of the
 * dynamics model. Constants are resolved once here, never per evaluation.
 */
@Slf4j
@Configuration
public class DynamicsConfig {

    static final String EPHEMERIS_SOURCE = "orrery.ephemeris.source";
    static final String OREKIT_EPHEMERIS = "orekit";

    @Bean
    CelestialBodyConstants centralBody(@Value("${orrery.central-body.name}") final String name,
                                       @Value("${orrery.central-body.mu}") final double mu,
                                       @Value("${orrery.central-body.equatorial-radius}") final double radius,
                                       @Value("${orrery.central-body.j2}") final double j2,
                                       @Value("${orrery.central-body.rotation-rate}") final double rotationRate) {
        final var constants = new CelestialBodyConstants(name, mu, radius, j2, rotationRate);
        log.info("Central body {} — mu={} m^3/s^2, R={} m, J2={}", name, mu, radius, j2);
        return constants;
    }

    @Bean
    @ConditionalOnProperty(name = EPHEMERIS_SOURCE, havingValue = "analytic", matchIfMissing = true)
    EphemerisProvider analyticEphemeris(final CelestialBodyConstants centralBody) {
        return new AnalyticEphemerisProvider(centralBody);
    }

    @Bean
    @ConditionalOnProperty(name = EPHEMERIS_SOURCE, havingValue = OREKIT_EPHEMERIS)
    EphemerisProvider orekitEphemeris(@SuppressWarnings("unused") final OrekitConfig orekitConfig,
                                      final CelestialBodyConstants centralBody) {
        return new OrekitEphemerisProvider(DataContext.getDefault().getCelestialBodies(),
                centralBody, FramesFactory.getGCRF());
    }

    @Bean
    DensityProvider atmosphere(final CelestialBodyConstants centralBody) {
        return new ExponentialAtmosphere(centralBody.equatorialRadius());
    }

    @Bean
    SolarPressureModel solarPressure(
            @Value("${orrery.solar-pressure.reference-pressure:4.56e-6}") final double referencePressure,
            @Value("${orrery.solar-pressure.reference-distance:1.495978707e11}") final double referenceDistance) {
        return new InverseSquareSolarPressure(referencePressure, referenceDistance);
    }

    @Bean
    DynamicsEnvironment dynamicsEnvironment(final CelestialBodyConstants centralBody,
                                            final EphemerisProvider ephemeris,
                                            final DensityProvider atmosphere,
                                            final SolarPressureModel solarPressure) {
        return new DynamicsEnvironment(centralBody, ephemeris, atmosphere, solarPressure);
    }
}
