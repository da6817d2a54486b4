package io.github.jakubt4.orrery.service;

import io.github.jakubt4.orrery.dynamics.DerivativeEvaluation;
import io.github.jakubt4.orrery.dynamics.DynamicsEnvironment;
import io.github.jakubt4.orrery.dynamics.ForceComposer;
import io.github.jakubt4.orrery.dynamics.ForceConfiguration;
import io.github.jakubt4.orrery.dynamics.SkippedTermListener;
import io.github.jakubt4.orrery.dynamics.StateLayout;
import io.github.jakubt4.orrery.dynamics.VariationalDynamics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.orekit.time.AbsoluteDate;
import org.springframework.stereotype.Service;

/**
 * Builds {@link VariationalDynamics} instances against the configured environment.
 *
 * <p>Every call returns a fresh instance: instances own an ephemeris cache and
 * must stay confined to one trajectory.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DynamicsService {

    private final DynamicsEnvironment environment;
    private final OptionalTermMonitor optionalTermMonitor;

    /**
     * @throws io.github.jakubt4.orrery.dynamics.error.ConfigurationException if the
     *         configuration is invalid
     * @throws io.github.jakubt4.orrery.dynamics.error.MissingEphemerisDataException if a
     *         perturbing body is unknown
     */
    public VariationalDynamics create(final AbsoluteDate epoch0,
                                      final ForceConfiguration configuration,
                                      final StateLayout layout) {
        return create(epoch0, configuration, layout, optionalTermMonitor);
    }

    VariationalDynamics create(final AbsoluteDate epoch0,
                               final ForceConfiguration configuration,
                               final StateLayout layout,
                               final SkippedTermListener listener) {
        final var composer = ForceComposer.create(configuration, environment, listener);
        if (layout.hasStm() && !composer.approximatedJacobians().isEmpty()) {
            log.warn("STM propagated with unmodelled partials for {} — sensitivities carry a first-order bias",
                    composer.approximatedJacobians());
        }
        return new VariationalDynamics(epoch0, composer, layout);
    }

    /**
     * One derivative evaluation: {@code derivative(t, state, epoch0, configuration)}.
     *
     * @throws io.github.jakubt4.orrery.dynamics.error.ConfigurationException if the state
     *         has neither 6 nor 42 elements or the configuration is invalid
     */
    public DerivativeEvaluation derivative(final double t,
                                           final double[] state,
                                           final AbsoluteDate epoch0,
                                           final ForceConfiguration configuration) {
        final var layout = StateLayout.of(state.length);
        return create(epoch0, configuration, layout).evaluate(t, state);
    }
}
