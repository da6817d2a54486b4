package io.github.jakubt4.orrery.dto;

import java.util.List;

/**
 * @param finalEpoch            date reached, TT
 * @param state                 final {@code [r, v]}
 * @param stm                   final STM rows, {@code null} when not requested
 * @param skippedTerms          optional-term evaluations zero-filled during the run
 * @param approximatedJacobians forces whose partials were not modelled
 * @param status                {@code "OK"} or {@code "REJECTED"}
 * @param message               human-readable detail
 */
public record PropagationResponse(String finalEpoch,
                                  double[] state,
                                  double[][] stm,
                                  long skippedTerms,
                                  List<String> approximatedJacobians,
                                  String status,
                                  String message) {

    public static PropagationResponse rejected(final String message) {
        return new PropagationResponse(null, null, null, 0L, List.of(), "REJECTED", message);
    }
}
