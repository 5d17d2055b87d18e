package io.confluent.ratemeter.internal;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import lombok.Getter;

/**
 * The run state of a {@link io.confluent.ratemeter.MeterArbiter}.
 */
public enum State {
    /**
     * Constructed, driver not started yet. Meters can already be registered and ticked by hand.
     */
    UNUSED(0),
    RUNNING(1),
    /**
     * Driver stopped and meters released. Terminal.
     */
    CLOSED(2);

    // Enum value used for metrics - deterministic as opposed to ordinal to prevent change on adding / removing enum constants
    @Getter
    private final int value;

    State(int value) {
        this.value = value;
    }
}
