package io.confluent.ratemeter;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.ratemeter.ewma.MultiEwma;
import io.confluent.ratemeter.ewma.MultiEwmaSnapshot;
import lombok.Value;

/**
 * A read-only copy of a {@link Meter}. The count and the rates always come from the same refresh.
 */
@Value
public class MeterSnapshot implements Meter {

    long count;

    /**
     * Per window rates, in events per second
     */
    MultiEwmaSnapshot rates;

    double meanRate;

    static MeterSnapshot empty(int windowCount) {
        return new MeterSnapshot(0, MultiEwmaSnapshot.of(new double[windowCount]), 0.0);
    }

    /**
     * @throws ImmutableSnapshotException always
     */
    @Override
    public void mark(long n) {
        throw ImmutableSnapshotException.of("mark", MeterSnapshot.class);
    }

    public double getRate(int window) {
        return rates.getRate(window);
    }

    @Override
    public double getOneMinuteRate() {
        return getRate(MultiEwma.ONE_MINUTE_WINDOW);
    }

    @Override
    public double getFiveMinuteRate() {
        return getRate(MultiEwma.FIVE_MINUTE_WINDOW);
    }

    @Override
    public double getFifteenMinuteRate() {
        return getRate(MultiEwma.FIFTEEN_MINUTE_WINDOW);
    }

    @Override
    public MeterSnapshot snapshot() {
        return this;
    }
}
