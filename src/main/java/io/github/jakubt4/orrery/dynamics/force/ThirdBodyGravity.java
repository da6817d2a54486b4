package io.github.jakubt4.orrery.dynamics.force;

import io.github.jakubt4.orrery.environment.BodyConstant;
import io.github.jakubt4.orrery.environment.EphemerisProvider;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Differential attraction of perturbing bodies on an object orbiting the central body:
 * <pre>
 *   a = Σ μ_b · ( (s_b − r)/|s_b − r|³ − s_b/|s_b|³ )
 * </pre>
 * with {@code s_b} the body position relative to the central body.
 */
public class ThirdBodyGravity implements ForceModel {

    private final EphemerisProvider ephemeris;
    private final Map<String, Double> gravitationalParameters;

    /**
     * Resolves every body's gravitational parameter up front.
     *
     * @throws io.github.jakubt4.orrery.dynamics.error.MissingEphemerisDataException if a
     *         body has no known gravitational parameter
     */
    public ThirdBodyGravity(final EphemerisProvider ephemeris, final List<String> bodies) {
        this.ephemeris = ephemeris;
        this.gravitationalParameters = new LinkedHashMap<>();
        for (final var body : bodies) {
            gravitationalParameters.put(body, ephemeris.bodyConstant(body, BodyConstant.GM));
        }
    }

    @Override
    public ForceKind kind() {
        return ForceKind.THIRD_BODY_GRAVITY;
    }

    @Override
    public ForceContribution contribution(final ForceContext context) {
        final var r = context.position();
        var total = ForceContribution.zero();
        for (final var entry : gravitationalParameters.entrySet()) {
            final var mu = entry.getValue();
            final var s = ephemeris.positionOf(entry.getKey(), context.epoch());
            final var d = s.subtract(r);
            final var dNorm = d.getNorm();
            final var sNorm = s.getNorm();
            final var acceleration = new Vector3D(mu / (dNorm * dNorm * dNorm), d, -mu / (sNorm * sNorm * sNorm), s);
            total = total.plus(context.jacobiansRequired()
                    ? new ForceContribution(acceleration, Jacobians.pointMassGradient(mu, d), Jacobians.zero())
                    : ForceContribution.accelerationOnly(acceleration));
        }
        return total;
    }
}
