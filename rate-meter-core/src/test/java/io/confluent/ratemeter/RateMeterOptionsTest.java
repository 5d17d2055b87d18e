package io.confluent.ratemeter;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.ratemeter.ewma.DecayMath;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Check the defaults and validation of {@link RateMeterOptions}.
 *
 * @see RateMeterOptions
 */
class RateMeterOptionsTest {

    @Test
    void defaults() {
        var options = RateMeterOptions.builder().build();
        options.validate();

        assertThat(options.getTickInterval()).isEqualTo(DecayMath.DEFAULT_TICK_INTERVAL);
        assertThat(options.isStartLazily()).isTrue();
        assertThat(options.isNoopMeters()).isFalse();
        assertThat(options.getThreadName()).isEqualTo(RateMeterOptions.DEFAULT_THREAD_NAME);
        assertThat(options.getShutdownTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(options.getMeterRegistry()).isNull();
        assertThat(options.getCommonTags()).isEmpty();
        assertThat(options.getClock()).isNotNull();
    }

    @Test
    void toBuilderKeepsOtherOptions() {
        var options = RateMeterOptions.builder()
                .threadName("custom")
                .build();
        var faster = options.toBuilder().tickInterval(Duration.ofSeconds(1)).build();

        assertThat(faster.getThreadName()).isEqualTo("custom");
        assertThat(faster.getTickInterval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(options.getTickInterval()).isEqualTo(DecayMath.DEFAULT_TICK_INTERVAL);
    }

    @Test
    void tickIntervalMustBePositive() {
        var zero = RateMeterOptions.builder().tickInterval(Duration.ZERO).build();
        var e = assertThrows(IllegalArgumentException.class, zero::validate);
        assertThat(e).hasMessageThat().contains("Invalid tickInterval");

        var negative = RateMeterOptions.builder().tickInterval(Duration.ofMillis(-5)).build();
        assertThrows(IllegalArgumentException.class, negative::validate);
    }

    @Test
    void otherValidation() {
        assertThrows(IllegalArgumentException.class, () ->
                RateMeterOptions.builder()
                        .shutdownTimeout(Duration.ofSeconds(-1))
                        .build()
                        .validate());

        assertThrows(IllegalArgumentException.class, () ->
                RateMeterOptions.builder()
                        .threadName(" ")
                        .build()
                        .validate());

        assertThrows(IllegalArgumentException.class, () ->
                RateMeterOptions.builder()
                        .commonTags(null)
                        .build()
                        .validate());

        assertThrows(IllegalArgumentException.class, () ->
                RateMeterOptions.builder()
                        .clock(null)
                        .build()
                        .validate());

        // no wait at all is allowed
        RateMeterOptions.builder().shutdownTimeout(Duration.ZERO).build().validate();
    }
}
