package io.confluent.ratemeter.ewma;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.ratemeter.ImmutableSnapshotException;
import lombok.Value;

/**
 * A read-only copy of an {@link Ewma}.
 */
@Value
public class EwmaSnapshot implements Ewma {

    /**
     * Events per second at the time the snapshot was taken
     */
    double rate;

    @Override
    public EwmaSnapshot snapshot() {
        return this;
    }

    /**
     * @throws ImmutableSnapshotException always
     */
    @Override
    public void tick() {
        throw ImmutableSnapshotException.of("tick", EwmaSnapshot.class);
    }

    /**
     * @throws ImmutableSnapshotException always
     */
    @Override
    public void update(long n) {
        throw ImmutableSnapshotException.of("update", EwmaSnapshot.class);
    }
}
