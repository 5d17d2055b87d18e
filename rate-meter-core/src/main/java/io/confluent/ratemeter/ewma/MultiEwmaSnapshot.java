package io.confluent.ratemeter.ewma;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.ratemeter.ImmutableSnapshotException;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Objects;

/**
 * A read-only copy of a {@link MultiEwma}.
 */
@ToString
@EqualsAndHashCode
public final class MultiEwmaSnapshot implements MultiEwma {

    /**
     * Events per second, per window
     */
    private final double[] rates;

    private MultiEwmaSnapshot(double[] rates) {
        this.rates = rates;
    }

    public static MultiEwmaSnapshot of(double... ratesPerSecond) {
        return new MultiEwmaSnapshot(ratesPerSecond.clone());
    }

    /**
     * Snapshots the source, reusing its own snapshot when it already is one of these.
     */
    public static MultiEwmaSnapshot copyOf(MultiEwma source) {
        MultiEwma snapshot = source.snapshot();
        if (snapshot instanceof MultiEwmaSnapshot) {
            return (MultiEwmaSnapshot) snapshot;
        }
        double[] rates = new double[snapshot.getWindowCount()];
        for (int i = 0; i < rates.length; i++) {
            rates[i] = snapshot.getRate(i);
        }
        return new MultiEwmaSnapshot(rates);
    }

    @Override
    public double getRate(int window) {
        Objects.checkIndex(window, rates.length);
        return rates[window];
    }

    @Override
    public int getWindowCount() {
        return rates.length;
    }

    public double[] getRates() {
        return rates.clone();
    }

    @Override
    public MultiEwmaSnapshot snapshot() {
        return this;
    }

    /**
     * @throws ImmutableSnapshotException always
     */
    @Override
    public void tick() {
        throw ImmutableSnapshotException.of("tick", MultiEwmaSnapshot.class);
    }

    /**
     * @throws ImmutableSnapshotException always
     */
    @Override
    public void update(long n) {
        throw ImmutableSnapshotException.of("update", MultiEwmaSnapshot.class);
    }
}
