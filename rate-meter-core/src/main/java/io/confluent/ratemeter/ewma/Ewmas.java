package io.confluent.ratemeter.ewma;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.ratemeter.RateMeters;
import lombok.experimental.UtilityClass;

import java.time.Duration;

import static io.confluent.ratemeter.ewma.DecayMath.DEFAULT_TICK_INTERVAL;

/**
 * Factories for moving averages. All of them hand out the no-op variants while
 * {@link RateMeters#isUseNoopMeters() no-op meters} are switched on.
 */
@UtilityClass
public class Ewmas {

    public static Ewma newEwma(double alpha) {
        return newEwma(alpha, DEFAULT_TICK_INTERVAL);
    }

    public static Ewma newEwma(double alpha, Duration tickInterval) {
        if (RateMeters.isUseNoopMeters()) {
            return NoopEwma.INSTANCE;
        }
        return new StandardEwma(alpha, tickInterval);
    }

    public static Ewma newEwma(DecayWindow window, Duration tickInterval) {
        return newEwma(window.alpha(tickInterval), tickInterval);
    }

    public static Ewma newOneMinuteEwma() {
        return newEwma(DecayMath.ONE_MINUTE_ALPHA);
    }

    public static Ewma newFiveMinuteEwma() {
        return newEwma(DecayMath.FIVE_MINUTE_ALPHA);
    }

    public static Ewma newFifteenMinuteEwma() {
        return newEwma(DecayMath.FIFTEEN_MINUTE_ALPHA);
    }

    /**
     * One, five and fifteen minute windows, for the default tick interval.
     */
    public static MultiEwma newMultiEwma() {
        return newMultiEwma(DEFAULT_TICK_INTERVAL, DecayWindow.values());
    }

    /**
     * Custom decay constants, one window per alpha, for the default tick interval.
     */
    public static MultiEwma newMultiEwma(double... alphas) {
        return newMultiEwmaWithAlphas(DEFAULT_TICK_INTERVAL, alphas);
    }

    public static MultiEwma newMultiEwma(Duration tickInterval, DecayWindow... windows) {
        return newMultiEwmaWithAlphas(tickInterval, DecayWindow.alphas(tickInterval, windows));
    }

    public static MultiEwma newMultiEwmaWithAlphas(Duration tickInterval, double... alphas) {
        if (RateMeters.isUseNoopMeters()) {
            return NoopMultiEwma.INSTANCE;
        }
        return new StandardMultiEwma(tickInterval, alphas);
    }
}
