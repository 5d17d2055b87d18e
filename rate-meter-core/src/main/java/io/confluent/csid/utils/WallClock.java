package io.confluent.csid.utils;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import java.time.Instant;

/**
 * Time source, swappable in tests.
 * <p>
 * {@link #nanoTime()} is the monotonic source used for elapsed time, {@link #getNow()} is only for display.
 */
public class WallClock {

    public Instant getNow() {
        return Instant.now();
    }

    public long nanoTime() {
        return System.nanoTime();
    }

}
