package io.confluent.ratemeter;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

/**
 * A meter for deployments that want metrics switched off - ignores marks, always reports zero.
 *
 * @see RateMeters#setUseNoopMeters(boolean)
 * @see RateMeterOptions#isNoopMeters()
 */
public enum NoopMeter implements Meter {
    INSTANCE;

    @Override
    public long getCount() {
        return 0;
    }

    @Override
    public void mark(long n) {
    }

    @Override
    public double getOneMinuteRate() {
        return 0.0;
    }

    @Override
    public double getFiveMinuteRate() {
        return 0.0;
    }

    @Override
    public double getFifteenMinuteRate() {
        return 0.0;
    }

    @Override
    public double getMeanRate() {
        return 0.0;
    }

    @Override
    public NoopMeter snapshot() {
        return this;
    }
}
