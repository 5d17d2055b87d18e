package io.confluent.ratemeter.ewma;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import lombok.Getter;

import java.time.Duration;

/**
 * The standard moving average windows, in the order a default {@link MultiEwma} holds them.
 */
public enum DecayWindow {
    ONE_MINUTE(1, "m1"),
    FIVE_MINUTES(5, "m5"),
    FIFTEEN_MINUTES(15, "m15");

    @Getter
    private final int minutes;

    /**
     * Short label, used for metric tags
     */
    @Getter
    private final String label;

    DecayWindow(int minutes, String label) {
        this.minutes = minutes;
        this.label = label;
    }

    public double alpha(Duration tickInterval) {
        return DecayMath.alphaFor(minutes, tickInterval);
    }

    public static double[] alphas(Duration tickInterval, DecayWindow... windows) {
        double[] alphas = new double[windows.length];
        for (int i = 0; i < windows.length; i++) {
            alphas[i] = windows[i].alpha(tickInterval);
        }
        return alphas;
    }
}
