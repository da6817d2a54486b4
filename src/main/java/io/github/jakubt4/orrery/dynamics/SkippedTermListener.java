package io.github.jakubt4.orrery.dynamics;

import io.github.jakubt4.orrery.dynamics.force.ForceOutcome;
import org.orekit.time.AbsoluteDate;

/**
 * Notified whenever an optional force term is zero-filled.
 */
@FunctionalInterface
public interface SkippedTermListener {

    SkippedTermListener NONE = (skipped, epoch) -> {
    };

    void onSkipped(ForceOutcome.Skipped skipped, AbsoluteDate epoch);
}
