package io.github.jakubt4.orrery.dynamics;

import io.github.jakubt4.orrery.dynamics.error.OptionalModuleFailureException;
import io.github.jakubt4.orrery.dynamics.force.AtmosphericDrag;
import io.github.jakubt4.orrery.dynamics.force.CentralGravity;
import io.github.jakubt4.orrery.dynamics.force.ForceContext;
import io.github.jakubt4.orrery.dynamics.force.ForceContribution;
import io.github.jakubt4.orrery.dynamics.force.ForceKind;
import io.github.jakubt4.orrery.dynamics.force.ForceModel;
import io.github.jakubt4.orrery.dynamics.force.ForceOutcome;
import io.github.jakubt4.orrery.dynamics.force.J2Oblateness;
import io.github.jakubt4.orrery.dynamics.force.SolarRadiationPressure;
import io.github.jakubt4.orrery.dynamics.force.ThirdBodyGravity;
import io.github.jakubt4.orrery.environment.EpochCachedEphemeris;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Evaluates the active force models and sums their accelerations and partials.
 *
 * <p>A model returning {@link ForceOutcome.Skipped} contributes exactly zero; the
 * skip is reported in the {@link ForceBreakdown} and to the
 * {@link SkippedTermListener}, or aborts the evaluation when
 * {@code abortOnSkippedTerm} is set. Any exception thrown by a model propagates.
 */
@Slf4j
public class ForceComposer {

    private final List<ForceModel> models;
    private final boolean abortOnSkippedTerm;
    private final SkippedTermListener listener;

    public ForceComposer(final List<ForceModel> models,
                         final boolean abortOnSkippedTerm,
                         final SkippedTermListener listener) {
        this.models = List.copyOf(models);
        this.abortOnSkippedTerm = abortOnSkippedTerm;
        this.listener = listener;
    }

    /**
     * Builds central gravity plus every model enabled in {@code configuration}.
     * Third-body gravitational parameters are resolved here, once.
     *
     * @throws io.github.jakubt4.orrery.dynamics.error.ConfigurationException if the
     *         configuration is invalid
     */
    public static ForceComposer create(final ForceConfiguration configuration,
                                       final DynamicsEnvironment environment,
                                       final SkippedTermListener listener) {
        final var centralBody = environment.centralBody();
        final var config = configuration.validated(centralBody);
        final var ephemeris = new EpochCachedEphemeris(environment.ephemeris());

        final var models = new ArrayList<ForceModel>();
        models.add(new CentralGravity(centralBody.mu()));
        if (config.drag()) {
            models.add(new AtmosphericDrag(centralBody, environment.atmosphere(),
                    config.area(), config.mass(), config.dragCoefficient()));
        }
        if (config.srp()) {
            models.add(new SolarRadiationPressure(ephemeris, environment.solarPressure(),
                    config.area(), config.mass(), config.reflectivity()));
        }
        if (config.thirdBody()) {
            models.add(new ThirdBodyGravity(ephemeris, config.bodies()));
        }
        if (config.j2()) {
            models.add(new J2Oblateness(centralBody));
        }
        log.debug("Force models composed: {}", models.stream().map(ForceModel::kind).toList());
        return new ForceComposer(models, config.abortOnSkippedTerm(), listener);
    }

    public List<ForceKind> activeKinds() {
        return models.stream().map(ForceModel::kind).toList();
    }

    /** Active models whose partials are not modelled (zero-filled). */
    public Set<ForceKind> approximatedJacobians() {
        final var kinds = EnumSet.noneOf(ForceKind.class);
        models.stream().filter(model -> !model.modelsJacobian()).forEach(model -> kinds.add(model.kind()));
        return Collections.unmodifiableSet(kinds);
    }

    public ForceBreakdown compose(final ForceContext context) {
        final var contributions = new EnumMap<ForceKind, ForceContribution>(ForceKind.class);
        for (final var kind : ForceKind.values()) {
            contributions.put(kind, ForceContribution.zero());
        }
        final var skipped = new ArrayList<ForceOutcome.Skipped>();
        final var approximated = EnumSet.noneOf(ForceKind.class);

        var total = ForceContribution.zero();
        for (final var model : models) {
            final var outcome = model.evaluate(context);
            if (outcome instanceof ForceOutcome.Applied applied) {
                contributions.put(model.kind(), contributions.get(model.kind()).plus(applied.contribution()));
                total = total.plus(applied.contribution());
                if (context.jacobiansRequired() && !model.modelsJacobian()) {
                    approximated.add(model.kind());
                }
            } else if (outcome instanceof ForceOutcome.Skipped skip) {
                if (abortOnSkippedTerm) {
                    throw new OptionalModuleFailureException(skip.kind(), skip.reason());
                }
                log.debug("{} zero-filled at {}: {}", skip.kind(), context.epoch(), skip.reason());
                skipped.add(skip);
                listener.onSkipped(skip, context.epoch());
            }
        }
        return new ForceBreakdown(total,
                Collections.unmodifiableMap(contributions),
                List.copyOf(skipped),
                Collections.unmodifiableSet(approximated));
    }
}
