package io.github.jakubt4.orrery.service;

import io.github.jakubt4.orrery.dynamics.StateLayout;
import io.github.jakubt4.orrery.dynamics.StateTransitionMatrices;
import io.github.jakubt4.orrery.dynamics.error.ConfigurationException;
import io.github.jakubt4.orrery.dynamics.error.DynamicsException;
import io.github.jakubt4.orrery.dynamics.force.ForceKind;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.exception.MathRuntimeException;
import org.hipparchus.ode.ODEState;
import org.hipparchus.ode.ODEStateAndDerivative;
import org.hipparchus.ode.nonstiff.DormandPrince853Integrator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Integrates the variational dynamics with an adaptive Dormand-Prince 8(5,3)
 * integrator.
 *
 * <p>Ensembles run one trajectory per task on a fixed pool; each task builds its
 * own dynamics instance, so nothing is shared inside a derivative evaluation.
 */
@Slf4j
@Service
public class TrajectoryPropagationService {

    private final DynamicsService dynamicsService;
    private final OptionalTermMonitor optionalTermMonitor;
    private final double minStep;
    private final double maxStep;
    private final double absoluteTolerance;
    private final double relativeTolerance;
    private final ExecutorService executor;

    public TrajectoryPropagationService(final DynamicsService dynamicsService,
                                        final OptionalTermMonitor optionalTermMonitor,
                                        @Value("${orrery.propagation.min-step:1.0e-3}") final double minStep,
                                        @Value("${orrery.propagation.max-step:300.0}") final double maxStep,
                                        @Value("${orrery.propagation.absolute-tolerance:1.0e-6}") final double absoluteTolerance,
                                        @Value("${orrery.propagation.relative-tolerance:1.0e-12}") final double relativeTolerance,
                                        @Value("${orrery.propagation.ensemble-threads:4}") final int ensembleThreads) {
        this.dynamicsService = dynamicsService;
        this.optionalTermMonitor = optionalTermMonitor;
        this.minStep = minStep;
        this.maxStep = maxStep;
        this.absoluteTolerance = absoluteTolerance;
        this.relativeTolerance = relativeTolerance;
        this.executor = Executors.newFixedThreadPool(ensembleThreads);
        log.info("Propagator ready — DP853 steps [{}, {}] s, tolerances abs={} rel={}, {} ensemble threads",
                minStep, maxStep, absoluteTolerance, relativeTolerance, ensembleThreads);
    }

    /**
     * @throws ConfigurationException if the initial state is not a 6-vector, the
     *                                duration is zero or not finite, or the forces
     *                                are misconfigured
     * @throws DynamicsException      if the integrator cannot complete the span
     */
    public PropagationResult propagate(final PropagationTask task) {
        if (task.initialState() == null || task.initialState().length != StateLayout.CARTESIAN.dimension()) {
            throw new ConfigurationException("Initial state must have 6 elements");
        }
        if (!Double.isFinite(task.duration()) || task.duration() == 0.0) {
            throw new ConfigurationException("Propagation duration must be finite and non-zero, got " + task.duration());
        }
        final var layout = task.withStm() ? StateLayout.CARTESIAN_WITH_STM : StateLayout.CARTESIAN;
        final var skipped = new AtomicLong();
        final var dynamics = dynamicsService.create(task.epoch0(), task.configuration(), layout,
                (skip, epoch) -> {
                    skipped.incrementAndGet();
                    optionalTermMonitor.onSkipped(skip, epoch);
                });

        final var y0 = dynamics.getLayout().hasStm()
                ? StateTransitionMatrices.augmentWithIdentity(task.initialState())
                : task.initialState().clone();

        final var integrator = new DormandPrince853Integrator(minStep, maxStep, absoluteTolerance, relativeTolerance);
        final ODEStateAndDerivative finalState;
        try {
            finalState = integrator.integrate(dynamics, new ODEState(0.0, y0), task.duration());
        } catch (final MathRuntimeException e) {
            log.warn("Integration from {} over {} s failed: {}", task.epoch0(), task.duration(), e.getMessage());
            throw new DynamicsException("Integration failed: " + e.getMessage(), e);
        }
        final var y = finalState.getPrimaryState();

        final var withStm = dynamics.getLayout().hasStm();
        final Set<ForceKind> approximated = withStm ? dynamics.approximatedJacobians() : Set.of();
        log.debug("Propagated {} s from {} ({} evaluations)", task.duration(), task.epoch0(), integrator.getEvaluations());
        return new PropagationResult(
                dynamics.getEpoch0().shiftedBy(finalState.getTime()),
                Arrays.copyOf(y, StateLayout.CARTESIAN.dimension()),
                withStm ? StateTransitionMatrices.unpack(y) : null,
                skipped.get(),
                approximated);
    }

    /**
     * Propagates independent trajectories in parallel; results keep the task order.
     *
     * @throws DynamicsException the first failure of any trajectory
     */
    public List<PropagationResult> propagateAll(final List<PropagationTask> tasks) {
        final var futures = new ArrayList<Future<PropagationResult>>(tasks.size());
        for (final var task : tasks) {
            futures.add(executor.submit(() -> propagate(task)));
        }
        final var results = new ArrayList<PropagationResult>(tasks.size());
        try {
            for (final var future : futures) {
                results.add(future.get());
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(future -> future.cancel(true));
            throw new DynamicsException("Ensemble propagation interrupted", e);
        } catch (final ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            if (e.getCause() instanceof DynamicsException dynamicsException) {
                throw dynamicsException;
            }
            throw new DynamicsException("Ensemble trajectory failed: " + e.getCause().getMessage(), e.getCause());
        }
        log.info("Ensemble of {} trajectories propagated", results.size());
        return results;
    }

    @PreDestroy
    void stop() {
        executor.shutdownNow();
        log.info("Propagator ensemble pool stopped");
    }
}
