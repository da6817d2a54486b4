package io.github.jakubt4.orrery.service;

import io.github.jakubt4.orrery.dynamics.ForceConfiguration;
import org.orekit.time.AbsoluteDate;

/**
 * One trajectory to propagate.
 *
 * @param epoch0        date of the initial state
 * @param initialState  {@code [r, v]} relative to the central body [m, m/s]
 * @param duration      propagation span [s], negative to go backwards
 * @param configuration active forces
 * @param withStm       also propagate the STM from identity
 */
public record PropagationTask(AbsoluteDate epoch0,
                              double[] initialState,
                              double duration,
                              ForceConfiguration configuration,
                              boolean withStm) {
}
