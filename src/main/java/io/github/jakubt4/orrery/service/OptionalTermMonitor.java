package io.github.jakubt4.orrery.service;

import io.github.jakubt4.orrery.dynamics.SkippedTermListener;
import io.github.jakubt4.orrery.dynamics.force.ForceKind;
import io.github.jakubt4.orrery.dynamics.force.ForceOutcome;
import lombok.extern.slf4j.Slf4j;
import org.orekit.time.AbsoluteDate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide count of optional force terms that were zero-filled.
 *
 * <p>Logs the first skip of each force and every {@value #LOG_EVERY}th after it,
 * so a long propagation losing a term stays visible without flooding the log.
 */
@Slf4j
@Component
public class OptionalTermMonitor implements SkippedTermListener {

    static final long LOG_EVERY = 1000;

    private final Map<ForceKind, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public void onSkipped(final ForceOutcome.Skipped skipped, final AbsoluteDate epoch) {
        final var count = counters.computeIfAbsent(skipped.kind(), kind -> new AtomicLong()).incrementAndGet();
        if (count == 1 || count % LOG_EVERY == 0) {
            log.warn("OPTIONAL TERM SKIPPED — {} zero-filled at {} (occurrence #{}): {}",
                    skipped.kind(), epoch, count, skipped.reason());
        }
    }

    public long skippedCount(final ForceKind kind) {
        final var counter = counters.get(kind);
        return counter == null ? 0L : counter.get();
    }

    public long totalSkipped() {
        return counters.values().stream().mapToLong(AtomicLong::get).sum();
    }
}
