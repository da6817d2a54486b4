package io.github.jakubt4.orrery.dynamics.force;

import io.github.jakubt4.orrery.dynamics.CelestialBodyConstants;
import io.github.jakubt4.orrery.dynamics.error.DegenerateGeometryException;
import io.github.jakubt4.orrery.dynamics.frame.OrbitalElements;
import io.github.jakubt4.orrery.dynamics.frame.RtnFrame;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

/**
 * Second zonal harmonic of the central body, evaluated in the RTN frame from the
 * inclination {@code i} and argument of latitude {@code u}:
 * <pre>
 *   f = −3·μ·J2·R²/(2·r⁴) · [ 1 − 3·sin²i·sin²u,  sin²i·sin 2u,  sin 2i·sin u ]
 * </pre>
 * then rotated to inertial axes.
 *
 * <p>The partials of this term are not modelled and are returned as zero: an STM
 * propagated with J2 enabled carries a first-order bias from the missing term.
 * Degenerate geometry (rectilinear motion) skips the term instead of failing.
 */
public class J2Oblateness implements ForceModel {

    private final double mu;
    private final double j2;
    private final double radius;

    public J2Oblateness(final CelestialBodyConstants centralBody) {
        this.mu = centralBody.mu();
        this.j2 = centralBody.j2();
        this.radius = centralBody.equatorialRadius();
    }

    @Override
    public ForceKind kind() {
        return ForceKind.J2_OBLATENESS;
    }

    @Override
    public ForceOutcome evaluate(final ForceContext context) {
        try {
            return ForceOutcome.applied(kind(), contribution(context));
        } catch (final DegenerateGeometryException e) {
            return ForceOutcome.skipped(kind(), e.getMessage());
        }
    }

    @Override
    public ForceContribution contribution(final ForceContext context) {
        final var elements = OrbitalElements.fromState(context.state(), mu);
        final var frame = RtnFrame.of(context.state());

        final var i = elements.inclination();
        final var u = elements.argumentOfLatitude();
        final var r = context.position().getNorm();
        final var sinI = FastMath.sin(i);
        final var sinU = FastMath.sin(u);

        final var scale = -3.0 * mu * j2 * radius * radius / (2.0 * r * r * r * r);
        final var rtn = new Vector3D(
                scale * (1.0 - 3.0 * sinI * sinI * sinU * sinU),
                scale * sinI * sinI * FastMath.sin(2.0 * u),
                scale * FastMath.sin(2.0 * i) * sinU);

        return ForceContribution.accelerationOnly(frame.toInertial(rtn));
    }

    @Override
    public boolean modelsJacobian() {
        return false;
    }
}
