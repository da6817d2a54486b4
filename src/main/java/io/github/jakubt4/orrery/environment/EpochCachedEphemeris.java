package io.github.jakubt4.orrery.environment;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.orekit.time.AbsoluteDate;

import java.util.HashMap;
import java.util.Map;

/**
 * Remembers the positions looked up at the most recent epoch.
 *
 * <p>Integrators evaluate the dynamics several times at the same date (stage
 * retries, SRP and third-body both asking for the Sun). Not thread-safe: each
 * dynamics instance owns its own cache.
 */
public class EpochCachedEphemeris implements EphemerisProvider {

    private final EphemerisProvider delegate;
    private final Map<String, Vector3D> positions = new HashMap<>();
    private AbsoluteDate cachedEpoch;

    public EpochCachedEphemeris(final EphemerisProvider delegate) {
        this.delegate = delegate;
    }

    @Override
    public Vector3D positionOf(final String body, final AbsoluteDate epoch) {
        if (cachedEpoch == null || !cachedEpoch.equals(epoch)) {
            positions.clear();
            cachedEpoch = epoch;
        }
        final var cached = positions.get(body);
        if (cached != null) {
            return cached;
        }
        final var position = delegate.positionOf(body, epoch);
        positions.put(body, position);
        return position;
    }

    @Override
    public double bodyConstant(final String body, final BodyConstant constant) {
        return delegate.bodyConstant(body, constant);
    }
}
