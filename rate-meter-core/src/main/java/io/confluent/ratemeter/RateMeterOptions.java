package io.confluent.ratemeter;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.csid.utils.WallClock;
import io.confluent.ratemeter.ewma.DecayMath;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Collections;

import static io.confluent.csid.utils.StringUtils.isBlank;
import static io.confluent.csid.utils.StringUtils.msg;

/**
 * The options for a {@link MeterArbiter}.
 * <p>
 * The important option is the {@link #tickInterval} - it's both the cadence the arbiter ticks its meters at, and the
 * interval every decay constant of those meters is derived for. All options have sensible defaults.
 *
 * @see #builder()
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class RateMeterOptions {

    public static final String DEFAULT_THREAD_NAME = "rate-meter-arbiter";

    /**
     * How often registered meters are ticked.
     * <p>
     * Changing this doesn't change what the rates mean - they're always events per second over one, five and fifteen
     * minutes - only how often they move.
     */
    @Builder.Default
    private final Duration tickInterval = DecayMath.DEFAULT_TICK_INTERVAL;

    /**
     * Start the background driver on the first registration, rather than requiring an explicit
     * {@link MeterArbiter#start()}.
     */
    @Builder.Default
    private final boolean startLazily = true;

    /**
     * Hand out {@link NoopMeter}s instead of real ones, to compile out metrics overhead.
     *
     * @see RateMeters#setUseNoopMeters(boolean)
     */
    @Builder.Default
    private final boolean noopMeters = false;

    /**
     * Name of the thread ticking the meters
     */
    @Builder.Default
    private final String threadName = DEFAULT_THREAD_NAME;

    /**
     * How long {@link MeterArbiter#close()} waits for an in-flight tick pass to finish
     */
    @Builder.Default
    private final Duration shutdownTimeout = Duration.ofSeconds(10);

    /**
     * Meter registry for the arbiter's own metrics (tick time, failures, registered meters). Optional - without one
     * the metrics are recorded to a no-op registry.
     */
    private final MeterRegistry meterRegistry;

    /**
     * Tags added to all of the arbiter's own metrics
     */
    @Builder.Default
    private final Iterable<Tag> commonTags = Collections.emptyList();

    /**
     * Time source for mean rates and tick timing
     */
    @ToString.Exclude
    @Builder.Default
    private final WallClock clock = new WallClock();

    public void validate() {
        try {
            DecayMath.checkTickInterval(tickInterval);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(msg("Invalid {}: {}", "tickInterval", e.getMessage()), e);
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException(msg("shutdownTimeout must not be negative, was {}", shutdownTimeout));
        }
        if (isBlank(threadName)) {
            throw new IllegalArgumentException("threadName must not be blank");
        }
        if (commonTags == null) {
            throw new IllegalArgumentException("commonTags must not be null, use an empty collection instead");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
    }
}
