package io.github.jakubt4.orrery.dynamics;

import io.github.jakubt4.orrery.dynamics.error.ConfigurationException;
import io.github.jakubt4.orrery.dynamics.force.AtmosphericDrag;
import io.github.jakubt4.orrery.dynamics.force.SolarRadiationPressure;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Which optional perturbations are active, and the parameters they need.
 * Central gravity is always on and has no flag.
 *
 * @param drag                atmospheric drag
 * @param srp                 solar radiation pressure
 * @param thirdBody           third-body gravity from {@code bodies}
 * @param j2                  central-body oblateness
 * @param area                cross-sectional area [m²], required by drag and SRP
 * @param mass                mass [kg], required by drag and SRP
 * @param dragCoefficient     Cd, defaults to {@value AtmosphericDrag#DEFAULT_DRAG_COEFFICIENT}
 * @param reflectivity        c_srp, defaults to {@value SolarRadiationPressure#DEFAULT_REFLECTIVITY}
 * @param bodies              perturbing bodies for third-body gravity
 * @param abortOnSkippedTerm  fail the evaluation instead of zero-filling a skipped optional term
 */
@Slf4j
@Builder(toBuilder = true)
public record ForceConfiguration(boolean drag,
                                 boolean srp,
                                 boolean thirdBody,
                                 boolean j2,
                                 Double area,
                                 Double mass,
                                 Double dragCoefficient,
                                 Double reflectivity,
                                 List<String> bodies,
                                 boolean abortOnSkippedTerm) {

    public ForceConfiguration {
        bodies = bodies == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(bodies));
        dragCoefficient = dragCoefficient == null ? AtmosphericDrag.DEFAULT_DRAG_COEFFICIENT : dragCoefficient;
        reflectivity = reflectivity == null ? SolarRadiationPressure.DEFAULT_REFLECTIVITY : reflectivity;
    }

    /** Central gravity only. */
    public static ForceConfiguration twoBody() {
        return ForceConfiguration.builder().build();
    }

    /**
     * Checks flags and parameters together and returns the configuration with
     * duplicate bodies removed.
     *
     * @throws ConfigurationException if an enabled force lacks a parameter it needs
     */
    public ForceConfiguration validated(final CelestialBodyConstants centralBody) {
        if (drag || srp) {
            requirePositive("area", area);
            requirePositive("mass", mass);
        } else if (area != null || mass != null) {
            log.warn("Area/mass supplied but neither drag nor SRP is enabled — ignoring them");
        }
        if (drag) {
            requirePositive("dragCoefficient", dragCoefficient);
        }
        if (srp && !(reflectivity >= 0.0)) {
            throw new ConfigurationException("SRP reflectivity coefficient must be non-negative, got " + reflectivity);
        }

        if (!thirdBody) {
            if (!bodies.isEmpty()) {
                log.warn("Perturbing bodies {} supplied but third-body gravity is disabled — ignoring them", bodies);
            }
            return this;
        }
        if (bodies.isEmpty()) {
            throw new ConfigurationException("Third-body gravity is enabled but no perturbing body is listed");
        }
        final var central = centralBody.name().toUpperCase(Locale.ROOT);
        final var unique = new LinkedHashSet<String>();
        for (final var body : bodies) {
            if (body == null || body.isBlank()) {
                throw new ConfigurationException("Perturbing body names must not be blank");
            }
            final var name = body.trim().toUpperCase(Locale.ROOT);
            if (name.equals(central)) {
                throw new ConfigurationException("Central body " + centralBody.name() + " cannot also be a perturbing body");
            }
            if (!unique.add(name)) {
                log.warn("Perturbing body [{}] listed more than once — counting it once", body);
            }
        }
        return toBuilder().bodies(new ArrayList<>(unique)).build();
    }

    private static void requirePositive(final String name, final Double value) {
        if (value == null) {
            throw new ConfigurationException("Parameter '" + name + "' is required by the enabled forces");
        }
        if (!(value > 0.0) || value.isInfinite()) {
            throw new ConfigurationException("Parameter '" + name + "' must be positive and finite, got " + value);
        }
    }
}
