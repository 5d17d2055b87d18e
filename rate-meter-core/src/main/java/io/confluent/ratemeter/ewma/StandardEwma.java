package io.confluent.ratemeter.ewma;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.ratemeter.internal.ThreadSafe;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static io.confluent.ratemeter.ewma.DecayMath.DEFAULT_TICK_INTERVAL;

/**
 * Tracks the number of uncounted events with an atomic, and folds them into the rate on each tick.
 * <p>
 * {@link #update} never takes the lock, so it's safe to call from any number of producer threads.
 */
@ThreadSafe
@ToString(onlyExplicitlyIncluded = true)
public class StandardEwma implements Ewma {

    private final AtomicLong uncounted = new AtomicLong();

    @Getter
    @ToString.Include
    private final double alpha;

    @Getter
    @ToString.Include
    private final Duration tickInterval;

    /**
     * Events per nanosecond. Guarded by this.
     */
    private double rate;

    private boolean initialized;

    public StandardEwma(double alpha) {
        this(alpha, DEFAULT_TICK_INTERVAL);
    }

    public StandardEwma(double alpha, Duration tickInterval) {
        this.alpha = DecayMath.checkAlpha(alpha);
        this.tickInterval = DecayMath.checkTickInterval(tickInterval);
    }

    @Override
    public synchronized double getRate() {
        return DecayMath.toPerSecond(rate);
    }

    @Override
    public EwmaSnapshot snapshot() {
        return new EwmaSnapshot(getRate());
    }

    /**
     * Assumes it is called every {@link #getTickInterval() tick interval}.
     */
    @Override
    public void tick() {
        double instantRate = DecayMath.instantRate(uncounted.getAndSet(0), tickInterval);
        fold(instantRate);
    }

    private synchronized void fold(double instantRate) {
        if (initialized) {
            rate = DecayMath.nextRate(rate, alpha, instantRate);
        } else {
            // first sample seeds the average, no decay
            initialized = true;
            rate = instantRate;
        }
    }

    @Override
    public void update(long n) {
        uncounted.addAndGet(n);
    }
}
