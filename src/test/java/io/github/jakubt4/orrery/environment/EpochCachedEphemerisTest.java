package io.github.jakubt4.orrery.environment;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.orekit.time.AbsoluteDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EpochCachedEphemerisTest {

    private static final AbsoluteDate EPOCH = AbsoluteDate.J2000_EPOCH.shiftedBy(500.0);

    private EphemerisProvider delegate;
    private EpochCachedEphemeris cache;

    @BeforeEach
    void setUp() {
        delegate = mock(EphemerisProvider.class);
        when(delegate.positionOf(anyString(), any(AbsoluteDate.class))).thenReturn(new Vector3D(1.0, 2.0, 3.0));
        cache = new EpochCachedEphemeris(delegate);
    }

    @Test
    void repeatedLookupsAtOneEpochHitTheDelegateOnce() {
        final var first = cache.positionOf("SUN", EPOCH);
        final var second = cache.positionOf("SUN", EPOCH.shiftedBy(0.0));

        assertThat(second).isEqualTo(first);
        verify(delegate, times(1)).positionOf("SUN", EPOCH);
    }

    @Test
    void bodiesAreCachedSeparately() {
        cache.positionOf("SUN", EPOCH);
        cache.positionOf("MOON", EPOCH);
        cache.positionOf("MOON", EPOCH);

        verify(delegate).positionOf("SUN", EPOCH);
        verify(delegate).positionOf("MOON", EPOCH);
    }

    @Test
    void newEpochInvalidatesTheCache() {
        final var later = EPOCH.shiftedBy(10.0);

        cache.positionOf("SUN", EPOCH);
        cache.positionOf("SUN", later);
        cache.positionOf("SUN", EPOCH);

        verify(delegate, times(2)).positionOf("SUN", EPOCH);
        verify(delegate).positionOf("SUN", later);
    }

    @Test
    void constantsAreDelegated() {
        when(delegate.bodyConstant("SUN", BodyConstant.GM)).thenReturn(1.327e20);

        assertThat(cache.bodyConstant("SUN", BodyConstant.GM)).isEqualTo(1.327e20);
    }
}
