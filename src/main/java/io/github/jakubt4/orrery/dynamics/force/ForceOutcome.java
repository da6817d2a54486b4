package io.github.jakubt4.orrery.dynamics.force;

/**
 * Result of evaluating one force model. Only optional models produce {@link Skipped};
 * mandatory ones throw instead.
 */
public sealed interface ForceOutcome permits ForceOutcome.Applied, ForceOutcome.Skipped {

    ForceKind kind();

    static ForceOutcome applied(final ForceKind kind, final ForceContribution contribution) {
        return new Applied(kind, contribution);
    }

    static ForceOutcome skipped(final ForceKind kind, final String reason) {
        return new Skipped(kind, reason);
    }

    record Applied(ForceKind kind, ForceContribution contribution) implements ForceOutcome {
    }

    record Skipped(ForceKind kind, String reason) implements ForceOutcome {
    }
}
