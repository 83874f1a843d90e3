package com.ryuqq.milestone.testkit;

import com.ryuqq.milestone.core.time.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that advances a {@link ManualClock} instead of blocking.
 *
 * <p>Every requested sleep is recorded. An interrupted caller gets
 * {@link InterruptedException} just like {@link Thread#sleep(long)}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ClockAdvancingSleeper implements Sleeper {

    private final ManualClock clock;
    private final List<Duration> sleeps = new ArrayList<>();

    public ClockAdvancingSleeper(ManualClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException("interrupted before sleep");
        }
        if (duration.isNegative() || duration.isZero()) {
            return;
        }
        synchronized (sleeps) {
            sleeps.add(duration);
        }
        clock.advance(duration);
    }

    public List<Duration> sleeps() {
        synchronized (sleeps) {
            return List.copyOf(sleeps);
        }
    }

    public Duration totalSlept() {
        synchronized (sleeps) {
            return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
        }
    }

    public void reset() {
        synchronized (sleeps) {
            sleeps.clear();
        }
    }
}
