package io.confluent.ratemeter.ewma;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

/**
 * An exponentially-weighted moving average of an event rate, driven by an outside source of clock ticks.
 *
 * @see StandardEwma
 * @see Ewmas
 */
public interface Ewma {

    /**
     * @return the moving average rate of events per second, zero before the first tick
     */
    double getRate();

    /**
     * @return a read-only copy of the current state
     */
    Ewma snapshot();

    /**
     * Fold the events recorded since the last tick into the average. Must be called once per tick interval, by a
     * single scheduling path.
     */
    void tick();

    /**
     * Record {@code n} events, to be counted on the next tick.
     */
    void update(long n);
}
