package io.confluent.ratemeter.ewma;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

/**
 * Ignores everything, always reports zero rates for the three standard windows.
 */
public enum NoopMultiEwma implements MultiEwma {
    INSTANCE;

    @Override
    public double getRate(int window) {
        return 0.0;
    }

    @Override
    public int getWindowCount() {
        return DecayWindow.values().length;
    }

    @Override
    public NoopMultiEwma snapshot() {
        return this;
    }

    @Override
    public void tick() {
    }

    @Override
    public void update(long n) {
    }
}
