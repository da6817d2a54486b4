package io.github.jakubt4.orrery.dynamics;

import io.github.jakubt4.orrery.dynamics.force.ForceContribution;
import io.github.jakubt4.orrery.dynamics.force.ForceKind;
import io.github.jakubt4.orrery.dynamics.force.ForceOutcome;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of composing all forces at one evaluation.
 *
 * @param total                  sum over every applied force
 * @param contributions          one entry per {@link ForceKind}; disabled and skipped
 *                               forces map to an exact zero contribution
 * @param skipped                optional terms that were zero-filled
 * @param approximatedJacobians  applied forces whose partials are not modelled
 */
public record ForceBreakdown(ForceContribution total,
                             Map<ForceKind, ForceContribution> contributions,
                             List<ForceOutcome.Skipped> skipped,
                             Set<ForceKind> approximatedJacobians) {

    public ForceContribution contribution(final ForceKind kind) {
        return contributions.get(kind);
    }
}
