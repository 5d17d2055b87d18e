package io.confluent.ratemeter.ewma;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import lombok.experimental.UtilityClass;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static io.confluent.csid.utils.StringUtils.msg;

/**
 * The decay engine shared by every moving average - pure functions, no state.
 * <p>
 * Rates are held internally as events per nanosecond, and only converted to events per second when read, so the
 * values produced match the classic 1/5/15 minute load average tables to floating point precision.
 */
@UtilityClass
public class DecayMath {

    /**
     * The cadence the precomputed alphas are derived for. Every average assumes its {@code tick} is called at the
     * interval its alpha was derived with.
     */
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(5);

    private static final double SECONDS_PER_MINUTE = 60.0;

    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    public static final double ONE_MINUTE_ALPHA = alphaFor(1, DEFAULT_TICK_INTERVAL);

    public static final double FIVE_MINUTE_ALPHA = alphaFor(5, DEFAULT_TICK_INTERVAL);

    public static final double FIFTEEN_MINUTE_ALPHA = alphaFor(15, DEFAULT_TICK_INTERVAL);

    /**
     * {@code 1 - e^(-tickSeconds / 60 / windowMinutes)}
     *
     * @param windowMinutes the window the average should represent
     * @param tickInterval  the interval between ticks
     * @return the decay constant to blend each new instant rate with
     */
    public static double alphaFor(int windowMinutes, Duration tickInterval) {
        double tickSeconds = tickInterval.toNanos() / NANOS_PER_SECOND;
        return 1 - Math.exp(-tickSeconds / SECONDS_PER_MINUTE / windowMinutes);
    }

    /**
     * Standard single pole EWMA update.
     */
    public static double nextRate(double currentRate, double alpha, double instantRate) {
        return currentRate + alpha * (instantRate - currentRate);
    }

    /**
     * @return events per nanosecond observed over one tick interval
     */
    public static double instantRate(long count, Duration tickInterval) {
        return (double) count / (double) tickInterval.toNanos();
    }

    public static double toPerSecond(double perNanoRate) {
        return perNanoRate * NANOS_PER_SECOND;
    }

    /**
     * @throws IllegalArgumentException if the alpha can't be used as a blend weight
     */
    public static double checkAlpha(double alpha) {
        if (!(alpha > 0 && alpha <= 1)) {
            throw new IllegalArgumentException(msg("Alpha must be in (0, 1], was {}", alpha));
        }
        return alpha;
    }

    /**
     * @throws IllegalArgumentException if the interval is zero or negative
     */
    public static Duration checkTickInterval(Duration tickInterval) {
        if (tickInterval == null || tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException(msg("Tick interval must be positive, was {}", tickInterval));
        }
        return tickInterval;
    }
}
