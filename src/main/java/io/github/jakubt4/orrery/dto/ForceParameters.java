package io.github.jakubt4.orrery.dto;

import io.github.jakubt4.orrery.dynamics.ForceConfiguration;

import java.util.List;

/**
 * Force selection and spacecraft parameters shared by the dynamics requests.
 *
 * @param flags            enabled perturbations, all off when {@code null}
 * @param area             cross-sectional area [m²]
 * @param mass             mass [kg]
 * @param dragCoefficient  Cd, default applied when {@code null}
 * @param reflectivity     c_srp, default applied when {@code null}
 * @param bodies           perturbing bodies, e.g. {@code ["SUN", "MOON"]}
 */
public record ForceParameters(ForceFlags flags,
                              Double area,
                              Double mass,
                              Double dragCoefficient,
                              Double reflectivity,
                              List<String> bodies) {

    public ForceConfiguration toConfiguration() {
        final var f = flags == null ? ForceFlags.NONE : flags;
        return ForceConfiguration.builder()
                .drag(f.drag())
                .srp(f.srp())
                .thirdBody(f.thirdBody())
                .j2(f.j2())
                .area(area)
                .mass(mass)
                .dragCoefficient(dragCoefficient)
                .reflectivity(reflectivity)
                .bodies(bodies)
                .build();
    }
}
