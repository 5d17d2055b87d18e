package io.confluent.ratemeter.ewma;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.ratemeter.internal.ThreadSafe;
import lombok.Getter;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Standard {@link MultiEwma}. Events are accumulated once, in a single atomic, rather than once per window.
 * <p>
 * All windows are initialised on the same tick - there is never a state where some windows are seeded and others
 * aren't.
 */
@ThreadSafe
public class StandardMultiEwma implements MultiEwma {

    private final AtomicLong uncounted = new AtomicLong();

    private final double[] alphas;

    @Getter
    private final Duration tickInterval;

    /**
     * Events per nanosecond, per window. Guarded by this.
     */
    private final double[] rates;

    private boolean initialized;

    /**
     * One, five and fifteen minute windows, for the default tick interval.
     */
    public StandardMultiEwma() {
        this(DecayMath.DEFAULT_TICK_INTERVAL, DecayMath.ONE_MINUTE_ALPHA, DecayMath.FIVE_MINUTE_ALPHA, DecayMath.FIFTEEN_MINUTE_ALPHA);
    }

    /**
     * @param tickInterval the interval {@link #tick()} will be called at - must be the one the alphas were derived
     *                     for
     * @param alphas       one decay constant per window
     */
    public StandardMultiEwma(Duration tickInterval, double... alphas) {
        if (alphas == null || alphas.length == 0) {
            throw new IllegalArgumentException("At least one alpha is required");
        }
        this.tickInterval = DecayMath.checkTickInterval(tickInterval);
        this.alphas = alphas.clone();
        for (double alpha : this.alphas) {
            DecayMath.checkAlpha(alpha);
        }
        this.rates = new double[this.alphas.length];
    }

    @Override
    public synchronized double getRate(int window) {
        Objects.checkIndex(window, rates.length);
        return DecayMath.toPerSecond(rates[window]);
    }

    @Override
    public int getWindowCount() {
        return rates.length;
    }

    public double[] getAlphas() {
        return alphas.clone();
    }

    @Override
    public synchronized MultiEwmaSnapshot snapshot() {
        double[] perSecond = new double[rates.length];
        for (int i = 0; i < rates.length; i++) {
            perSecond[i] = DecayMath.toPerSecond(rates[i]);
        }
        return MultiEwmaSnapshot.of(perSecond);
    }

    /**
     * Assumes it is called every {@link #getTickInterval() tick interval}, on a single thread.
     */
    @Override
    public void tick() {
        double instantRate = DecayMath.instantRate(uncounted.getAndSet(0), tickInterval);
        fold(instantRate);
    }

    private synchronized void fold(double instantRate) {
        if (initialized) {
            for (int i = 0; i < rates.length; i++) {
                rates[i] = DecayMath.nextRate(rates[i], alphas[i], instantRate);
            }
        } else {
            initialized = true;
            Arrays.fill(rates, instantRate);
        }
    }

    @Override
    public void update(long n) {
        uncounted.addAndGet(n);
    }

    @Override
    public String toString() {
        return "StandardMultiEwma(alphas=" + Arrays.toString(alphas) + ", tickInterval=" + tickInterval + ")";
    }
}
