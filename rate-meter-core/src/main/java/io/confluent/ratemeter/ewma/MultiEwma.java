package io.confluent.ratemeter.ewma;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

/**
 * Several exponentially-weighted moving averages of the same event stream, sharing one accumulator and ticked
 * together. By default the windows are one, five and fifteen minutes.
 *
 * @see StandardMultiEwma
 * @see Ewmas#newMultiEwma()
 */
public interface MultiEwma {

    int ONE_MINUTE_WINDOW = 0;

    int FIVE_MINUTE_WINDOW = 1;

    int FIFTEEN_MINUTE_WINDOW = 2;

    /**
     * @param window index of the window, in the order the alphas were given
     * @return the moving average rate of events per second for that window
     * @throws IndexOutOfBoundsException if there's no such window
     */
    double getRate(int window);

    int getWindowCount();

    /**
     * The first window - one minute for a default average.
     */
    default double getOneMinuteRate() {
        return getRate(ONE_MINUTE_WINDOW);
    }

    /**
     * The second window - five minutes for a default average.
     */
    default double getFiveMinuteRate() {
        return getRate(FIVE_MINUTE_WINDOW);
    }

    /**
     * The third window - fifteen minutes for a default average.
     */
    default double getFifteenMinuteRate() {
        return getRate(FIFTEEN_MINUTE_WINDOW);
    }

    /**
     * @return a read-only copy of every window's rate, captured atomically
     */
    MultiEwma snapshot();

    /**
     * Fold the events recorded since the last tick into every window. Must be called once per tick interval, by a
     * single scheduling path.
     */
    void tick();

    /**
     * Record {@code n} events, to be counted on the next tick.
     */
    void update(long n);
}
