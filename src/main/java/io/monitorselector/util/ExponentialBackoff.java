package io.monitorselector.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff between idle polling passes.
 * <p>
 * Each call to {@link #nextDelay()} grows the interval by {@code multiplier} up to {@code max}
 * and applies a random spread of {@code +/- randomizationFactor}. {@link #reset()} returns to
 * the initial interval.
 */
public class ExponentialBackoff {

    public static final double DEFAULT_MULTIPLIER = 1.5;
    public static final double DEFAULT_RANDOMIZATION_FACTOR = 0.5;

    private final Duration initial;
    private final Duration max;
    private final double multiplier;
    private final double randomizationFactor;

    private long currentMillis;

    public ExponentialBackoff(Duration initial, Duration max) {
        this(initial, max, DEFAULT_MULTIPLIER, DEFAULT_RANDOMIZATION_FACTOR);
    }

    public ExponentialBackoff(Duration initial, Duration max, double multiplier, double randomizationFactor) {
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("Initial backoff must be positive: " + initial);
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("Maximum backoff " + max + " is below initial " + initial);
        }
        this.initial = initial;
        this.max = max;
        this.multiplier = multiplier;
        this.randomizationFactor = randomizationFactor;
        this.currentMillis = initial.toMillis();
    }

    public synchronized Duration nextDelay() {
        long base = currentMillis;
        currentMillis = Math.min((long) (currentMillis * multiplier), max.toMillis());

        if (randomizationFactor <= 0) {
            return Duration.ofMillis(base);
        }
        long delta = (long) (base * randomizationFactor);
        long jittered = ThreadLocalRandom.current().nextLong(base - delta, base + delta + 1);
        return Duration.ofMillis(Math.max(0, jittered));
    }

    public synchronized void reset() {
        currentMillis = initial.toMillis();
    }

    /**
     * Interval the next call to {@link #nextDelay()} is centered on.
     */
    public synchronized Duration currentInterval() {
        return Duration.ofMillis(currentMillis);
    }
}
