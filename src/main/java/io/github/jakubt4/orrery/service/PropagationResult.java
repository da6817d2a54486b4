package io.github.jakubt4.orrery.service;

import io.github.jakubt4.orrery.dynamics.force.ForceKind;
import org.hipparchus.linear.RealMatrix;
import org.orekit.time.AbsoluteDate;

import java.util.Set;

/**
 * @param finalEpoch             date reached
 * @param state                  {@code [r, v]} at {@code finalEpoch}
 * @param stm                    6×6 STM from the initial date, {@code null} when not requested
 * @param skippedTerms           optional-term evaluations zero-filled during the run
 * @param approximatedJacobians  forces whose partials were not modelled in the STM
 */
public record PropagationResult(AbsoluteDate finalEpoch,
                                double[] state,
                                RealMatrix stm,
                                long skippedTerms,
                                Set<ForceKind> approximatedJacobians) {
}
