package io.github.jakubt4.orrery.dynamics.force;

import io.github.jakubt4.orrery.dynamics.error.DegenerateGeometryException;

/**
 * Two-body point-mass attraction {@code a = −μ·r/|r|³}, always active.
 */
public class CentralGravity implements ForceModel {

    private final double mu;

    public CentralGravity(final double mu) {
        this.mu = mu;
    }

    @Override
    public ForceKind kind() {
        return ForceKind.CENTRAL_GRAVITY;
    }

    @Override
    public ForceContribution contribution(final ForceContext context) {
        final var r = context.position();
        final var rNorm = r.getNorm();
        if (rNorm == 0.0) {
            throw new DegenerateGeometryException("Central gravity is singular at the body centre");
        }
        final var acceleration = r.scalarMultiply(-mu / (rNorm * rNorm * rNorm));
        if (!context.jacobiansRequired()) {
            return ForceContribution.accelerationOnly(acceleration);
        }
        // ∂a/∂r = μ/|r|⁵ · (3·r·rᵀ − |r|²·I)
        return new ForceContribution(acceleration, Jacobians.pointMassGradient(mu, r), Jacobians.zero());
    }
}
