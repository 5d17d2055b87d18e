package io.confluent.ratemeter.metrics;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.ratemeter.internal.State;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import lombok.Getter;

import java.util.Arrays;
import java.util.stream.Collectors;

import static io.confluent.ratemeter.metrics.RateMeterMetricsDef.MeterType.*;

/**
 * This enum defines the metrics that are published about the rate meters and the arbiter ticking them.
 */
public enum RateMeterMetricsDef {

    ARBITER_TICK_TIME("arbiter.tick.time", "Time taken to tick every registered meter once", RateMeterMetricsSubsystem.ARBITER, TIMER),
    ARBITER_TICK_FAILURES("arbiter.tick.failures", "Number of meter ticks that threw, and were skipped", RateMeterMetricsSubsystem.ARBITER, COUNTER),
    ARBITER_METERS("arbiter.meters", "Number of meters registered with the arbiter", RateMeterMetricsSubsystem.ARBITER, GAUGE),
    ARBITER_STATUS("arbiter.status", "Arbiter status, reported as number with following mapping - " + getStateToValueListing(), RateMeterMetricsSubsystem.ARBITER, GAUGE),

    METER_RATE("rate", "Rate of a registered meter in events per second, per window (m1, m5, m15) or since creation (mean)", RateMeterMetricsSubsystem.METER, GAUGE),
    METER_COUNT("count", "Total events recorded by a registered meter", RateMeterMetricsSubsystem.METER, FUNCTION_COUNTER);

    public static final String NAME_TAG = "name";

    public static final String WINDOW_TAG = "window";

    public static final String MEAN_WINDOW = "mean";

    private static final String SUBSYSTEM_TAG_KEY = "subsystem";

    private static final String METER_PREFIX = "ratemeter.";

    private static String getStateToValueListing() {
        return Arrays.stream(State.values()).map(state -> state.getValue() + ":" + state).collect(Collectors.joining(", "));
    }

    @Getter
    private final String name;

    @Getter
    private final String description;

    @Getter
    private final MeterType type;

    @Getter
    private final Tag subsystem;

    /**
     * @param name:        the name of the metric, without the common prefix
     * @param description: A quick summary of the metric
     * @param subsystem:   subsystem tag for meter grouping
     * @param type:        Meter type - Counter, Timer etc
     */
    RateMeterMetricsDef(String name, String description, RateMeterMetricsSubsystem subsystem, MeterType type) {
        this.name = METER_PREFIX + name;
        this.description = description;
        this.subsystem = Tag.of(SUBSYSTEM_TAG_KEY, subsystem.subsystemTag);
        this.type = type;
    }

    public Tags getSubsystemAsTags() {
        return Tags.of(subsystem);
    }

    /**
     * Metrics are divided into subsystems for better representation and fine-grained filtering.
     */
    public enum RateMeterMetricsSubsystem {
        ARBITER("arbiter"),
        METER("meter");

        private final String subsystemTag;

        RateMeterMetricsSubsystem(String subsystemTag) {
            this.subsystemTag = subsystemTag;
        }
    }

    public enum MeterType {
        COUNTER,
        FUNCTION_COUNTER,
        TIMER,
        GAUGE
    }
}
