package io.github.jakubt4.orrery.dynamics.force;

/**
 * One pluggable perturbation. Implementations are stateless with respect to the
 * propagated state: all per-call inputs arrive through the {@link ForceContext}.
 */
public interface ForceModel {

    ForceKind kind();

    /**
     * Acceleration and partials at the given context.
     *
     * @throws io.github.jakubt4.orrery.dynamics.error.DynamicsException on any failure
     */
    ForceContribution contribution(ForceContext context);

    /**
     * Wraps {@link #contribution} into an outcome. Models whose failures are
     * recoverable override this to return {@link ForceOutcome.Skipped}.
     */
    default ForceOutcome evaluate(final ForceContext context) {
        return ForceOutcome.applied(kind(), contribution(context));
    }

    /**
     * Whether the partials returned by this model are the true derivatives of its
     * acceleration. Models returning {@code false} bias any STM built from them.
     */
    default boolean modelsJacobian() {
        return true;
    }
}
