package io.github.jakubt4.orrery.dto;

import java.util.List;

/**
 * @param derivative            state derivative, same length as the request state
 * @param skippedTerms          optional forces zero-filled during this evaluation
 * @param approximatedJacobians forces whose partials are not modelled in the STM derivative
 * @param status                {@code "OK"} or {@code "REJECTED"}
 * @param message               human-readable detail
 */
public record DerivativeResponse(double[] derivative,
                                 List<String> skippedTerms,
                                 List<String> approximatedJacobians,
                                 String status,
                                 String message) {

    public static DerivativeResponse rejected(final String message) {
        return new DerivativeResponse(null, List.of(), List.of(), "REJECTED", message);
    }
}
