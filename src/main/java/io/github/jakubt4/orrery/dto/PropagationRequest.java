package io.github.jakubt4.orrery.dto;

/**
 * Inbound request for a trajectory propagation.
 *
 * @param epoch    ISO-8601 date of the initial state, TT time scale
 * @param state    initial {@code [r, v]} [m, m/s]
 * @param duration propagation span [s]
 * @param withStm  also propagate the state transition matrix
 * @param forces   force selection and spacecraft parameters
 */
public record PropagationRequest(String epoch, double[] state, double duration, boolean withStm,
                                 ForceParameters forces) {
}
