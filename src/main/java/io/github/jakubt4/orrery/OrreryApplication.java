package io.github.jakubt4.orrery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Orrery: perturbed orbital dynamics with variational propagation.
 *
 * <p>Evaluates the time derivative of a spacecraft or meteoroid state under central
 * gravity, J2, atmospheric drag, solar radiation pressure and third-body gravity,
 * optionally propagating the 6×6 state transition matrix alongside it.
 *
 * @see io.github.jakubt4.orrery.dynamics.VariationalDynamics
 * @see io.github.jakubt4.orrery.service.TrajectoryPropagationService
 */
@SpringBootApplication
public class OrreryApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrreryApplication.class, args);
    }
}
