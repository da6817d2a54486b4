package io.github.jakubt4.orrery.dynamics;

/**
 * Output of one derivative call, with the force diagnostics behind it.
 *
 * @param derivative time derivative, same length as the input state
 * @param forces     per-force contributions, skipped terms and approximations
 */
public record DerivativeEvaluation(double[] derivative, ForceBreakdown forces) {
}
