package io.github.jakubt4.orrery.environment;

import io.github.jakubt4.orrery.dynamics.CelestialBodyConstants;
import io.github.jakubt4.orrery.dynamics.error.MissingEphemerisDataException;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.orekit.bodies.CelestialBodies;
import org.orekit.bodies.CelestialBody;
import org.orekit.bodies.CelestialBodyFactory;
import org.orekit.errors.OrekitException;
import org.orekit.frames.Frame;
import org.orekit.time.AbsoluteDate;

import java.util.Locale;
import java.util.Map;

/**
 * JPL ephemerides loaded by Orekit from {@code orekit-data}.
 *
 * <p>Body names are matched case-insensitively against Orekit's
 * {@link CelestialBodyFactory} names; positions are differenced against the
 * central body so they stay relative to it whatever the frame origin.
 */
@Slf4j
public class OrekitEphemerisProvider implements EphemerisProvider {

    private static final Map<String, String> OREKIT_NAMES = Map.ofEntries(
            Map.entry("SUN", CelestialBodyFactory.SUN),
            Map.entry("MOON", CelestialBodyFactory.MOON),
            Map.entry("EARTH", CelestialBodyFactory.EARTH),
            Map.entry("MERCURY", CelestialBodyFactory.MERCURY),
            Map.entry("VENUS", CelestialBodyFactory.VENUS),
            Map.entry("MARS", CelestialBodyFactory.MARS),
            Map.entry("JUPITER", CelestialBodyFactory.JUPITER),
            Map.entry("SATURN", CelestialBodyFactory.SATURN),
            Map.entry("URANUS", CelestialBodyFactory.URANUS),
            Map.entry("NEPTUNE", CelestialBodyFactory.NEPTUNE),
            Map.entry("PLUTO", CelestialBodyFactory.PLUTO));

    private final CelestialBodies celestialBodies;
    private final CelestialBodyConstants centralBody;
    private final Frame inertialFrame;

    public OrekitEphemerisProvider(final CelestialBodies celestialBodies,
                                   final CelestialBodyConstants centralBody,
                                   final Frame inertialFrame) {
        this.celestialBodies = celestialBodies;
        this.centralBody = centralBody;
        this.inertialFrame = inertialFrame;
        log.info("Orekit ephemeris initialized — positions about {} in {}", centralBody.name(), inertialFrame.getName());
    }

    @Override
    public Vector3D positionOf(final String body, final AbsoluteDate epoch) {
        try {
            final var target = lookup(body).getPVCoordinates(epoch, inertialFrame).getPosition();
            final var centre = lookup(centralBody.name()).getPVCoordinates(epoch, inertialFrame).getPosition();
            return target.subtract(centre);
        } catch (final OrekitException e) {
            throw new MissingEphemerisDataException(
                    "Ephemeris lookup failed for [" + body + "] at " + epoch + ": " + e.getMessage(), e);
        }
    }

    @Override
    public double bodyConstant(final String body, final BodyConstant constant) {
        if (orekitName(body).equals(orekitName(centralBody.name()))) {
            return switch (constant) {
                case GM -> centralBody.mu();
                case RADIUS -> centralBody.equatorialRadius();
            };
        }
        if (constant != BodyConstant.GM) {
            throw new MissingEphemerisDataException("Orekit ephemerides carry no " + constant + " for [" + body + "]");
        }
        try {
            return lookup(body).getGM();
        } catch (final OrekitException e) {
            throw new MissingEphemerisDataException("No gravitational parameter for [" + body + "]: " + e.getMessage(), e);
        }
    }

    private CelestialBody lookup(final String body) {
        return celestialBodies.getBody(orekitName(body));
    }

    private static String orekitName(final String body) {
        if (body == null) {
            throw new MissingEphemerisDataException("Body name is required");
        }
        final var trimmed = body.trim();
        return OREKIT_NAMES.getOrDefault(trimmed.toUpperCase(Locale.ROOT), trimmed);
    }
}
