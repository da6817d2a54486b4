package io.github.jakubt4.orrery.dto;

/**
 * Optional perturbations to enable. Central gravity is always on.
 */
public record ForceFlags(boolean drag, boolean srp, boolean thirdBody, boolean j2) {

    public static final ForceFlags NONE = new ForceFlags(false, false, false, false);
}
