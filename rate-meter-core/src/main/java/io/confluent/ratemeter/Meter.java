package io.confluent.ratemeter;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

/**
 * Counts events to produce exponentially-weighted moving average rates at one, five and fifteen minutes, and a mean
 * rate since creation.
 *
 * @see StandardMeter
 * @see RateMeters#newMeter()
 */
public interface Meter {

    /**
     * @return the number of events recorded
     */
    long getCount();

    /**
     * Record one event.
     */
    default void mark() {
        mark(1);
    }

    /**
     * Record {@code n} events. Never blocks on rate computation.
     */
    void mark(long n);

    /**
     * @return the one minute moving average rate, in events per second
     */
    double getOneMinuteRate();

    /**
     * @return the five minute moving average rate, in events per second
     */
    double getFiveMinuteRate();

    /**
     * @return the fifteen minute moving average rate, in events per second
     */
    double getFifteenMinuteRate();

    /**
     * @return events per second since the meter was created
     */
    double getMeanRate();

    /**
     * @return a read-only copy of the meter
     */
    Meter snapshot();
}
