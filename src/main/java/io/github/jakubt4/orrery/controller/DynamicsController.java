package io.github.jakubt4.orrery.controller;

import io.github.jakubt4.orrery.dto.DerivativeRequest;
import io.github.jakubt4.orrery.dto.DerivativeResponse;
import io.github.jakubt4.orrery.dto.ForceParameters;
import io.github.jakubt4.orrery.dto.PropagationRequest;
import io.github.jakubt4.orrery.dto.PropagationResponse;
import io.github.jakubt4.orrery.dynamics.error.DynamicsException;
import io.github.jakubt4.orrery.service.DynamicsService;
import io.github.jakubt4.orrery.service.PropagationTask;
import io.github.jakubt4.orrery.service.TrajectoryPropagationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.orekit.errors.OrekitException;
import org.orekit.time.AbsoluteDate;
import org.orekit.time.TimeScalesFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collection;
import java.util.List;

/**
 * REST endpoints over the dynamics model.
 *
 * <p>{@code POST /api/dynamics/derivative} evaluates the state derivative once;
 * {@code POST /api/dynamics/propagate} integrates a state, optionally with its STM.
 * Both answer {@code 400 Bad Request} with status {@code REJECTED} on invalid input.
 */
@Slf4j
@RestController
@RequestMapping("/api/dynamics")
@RequiredArgsConstructor
public class DynamicsController {

    private static final ForceParameters NO_FORCES = new ForceParameters(null, null, null, null, null, null);

    private final DynamicsService dynamicsService;
    private final TrajectoryPropagationService trajectoryPropagationService;

    @PostMapping("/derivative")
    public ResponseEntity<DerivativeResponse> derivative(@RequestBody final DerivativeRequest request) {
        if (request.epoch() == null || request.epoch().isBlank()) {
            return ResponseEntity.badRequest().body(DerivativeResponse.rejected("Epoch is required"));
        }
        if (request.state() == null) {
            return ResponseEntity.badRequest().body(DerivativeResponse.rejected("State vector is required"));
        }

        try {
            final var forces = request.forces() == null ? NO_FORCES : request.forces();
            final var evaluation = dynamicsService.derivative(
                    request.t(), request.state(), parseEpoch(request.epoch()), forces.toConfiguration());
            return ResponseEntity.ok(new DerivativeResponse(
                    evaluation.derivative(),
                    evaluation.forces().skipped().stream().map(skip -> skip.kind() + ": " + skip.reason()).toList(),
                    names(evaluation.forces().approximatedJacobians()),
                    "OK",
                    "Derivative evaluated"));
        } catch (final DynamicsException | OrekitException | IllegalArgumentException e) {
            log.error("Derivative rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(DerivativeResponse.rejected(e.getMessage()));
        }
    }

    @PostMapping("/propagate")
    public ResponseEntity<PropagationResponse> propagate(@RequestBody final PropagationRequest request) {
        if (request.epoch() == null || request.epoch().isBlank()) {
            return ResponseEntity.badRequest().body(PropagationResponse.rejected("Epoch is required"));
        }
        if (request.state() == null) {
            return ResponseEntity.badRequest().body(PropagationResponse.rejected("Initial state is required"));
        }

        try {
            final var forces = request.forces() == null ? NO_FORCES : request.forces();
            final var result = trajectoryPropagationService.propagate(new PropagationTask(
                    parseEpoch(request.epoch()), request.state(), request.duration(),
                    forces.toConfiguration(), request.withStm()));
            log.info("Propagated {} s from {} — skipped optional terms: {}",
                    request.duration(), request.epoch(), result.skippedTerms());
            return ResponseEntity.ok(new PropagationResponse(
                    result.finalEpoch().toString(TimeScalesFactory.getTT()),
                    result.state(),
                    result.stm() == null ? null : result.stm().getData(),
                    result.skippedTerms(),
                    names(result.approximatedJacobians()),
                    "OK",
                    "Propagation complete"));
        } catch (final DynamicsException | OrekitException | IllegalArgumentException e) {
            log.error("Propagation rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(PropagationResponse.rejected(e.getMessage()));
        }
    }

    private static AbsoluteDate parseEpoch(final String epoch) {
        return new AbsoluteDate(epoch, TimeScalesFactory.getTT());
    }

    private static List<String> names(final Collection<? extends Enum<?>> kinds) {
        return kinds.stream().map(Enum::name).toList();
    }
}
