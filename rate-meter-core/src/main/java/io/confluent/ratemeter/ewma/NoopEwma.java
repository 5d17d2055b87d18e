package io.confluent.ratemeter.ewma;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

/**
 * Ignores everything, always reports a zero rate.
 *
 * @see io.confluent.ratemeter.RateMeters#setUseNoopMeters(boolean)
 */
public enum NoopEwma implements Ewma {
    INSTANCE;

    @Override
    public double getRate() {
        return 0.0;
    }

    @Override
    public NoopEwma snapshot() {
        return this;
    }

    @Override
    public void tick() {
    }

    @Override
    public void update(long n) {
    }
}
