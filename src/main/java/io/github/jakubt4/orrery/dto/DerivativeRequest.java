package io.github.jakubt4.orrery.dto;

/**
 * Inbound request for a single derivative evaluation.
 *
 * @param epoch  ISO-8601 date of {@code t = 0}, TT time scale (e.g. "2024-03-20T12:00:00")
 * @param t      seconds elapsed since {@code epoch}
 * @param state  6 elements {@code [r, v]} or 42 with a column-major STM appended [m, m/s]
 * @param forces force selection and spacecraft parameters
 */
public record DerivativeRequest(String epoch, double t, double[] state, ForceParameters forces) {
}
