package io.confluent.ratemeter.metrics;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.csid.utils.ManualClock;
import io.confluent.ratemeter.*;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static io.confluent.ratemeter.ewma.DecayTables.PRECISION;
import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

/**
 * @see RateMeterMetricsTracker
 */
@Slf4j
class RateMeterMetricsTrackerTest {

    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    ConcurrentRateRegistry rates = new ConcurrentRateRegistry();

    ManualClock clock = new ManualClock();

    MeterArbiter arbiter = new MeterArbiter(RateMeterOptions.builder().startLazily(false).clock(clock).build());

    RateMeterMetricsTracker tracker = new RateMeterMetricsTracker(rates, List.of(Tag.of("app", "test")), Duration.ofHours(1));

    @AfterEach
    void close() {
        tracker.close();
        arbiter.close();
    }

    @Test
    void publishesRegisteredMeters() {
        Meter requests = arbiter.newMeter();
        rates.register("requests", requests);
        rates.register("not-a-meter", "ignored");
        tracker.bindTo(meterRegistry);

        clock.advance(Duration.ofSeconds(10));
        requests.mark(3);
        arbiter.tickMeters();

        assertThat(rate("requests", "m1")).isCloseTo(0.6, within(PRECISION));
        assertThat(rate("requests", "m5")).isCloseTo(0.6, within(PRECISION));
        assertThat(rate("requests", "m15")).isCloseTo(0.6, within(PRECISION));
        assertThat(rate("requests", "mean")).isCloseTo(0.3, within(PRECISION));
        assertThat(meterRegistry.get("ratemeter.count")
                .tag("name", "requests")
                .tag("app", "test")
                .functionCounter().count()).isEqualTo(3.0);
        assertThat(meterRegistry.find("ratemeter.rate").tag("name", "not-a-meter").gauges()).isEmpty();
    }

    @Test
    void refreshFollowsRegistry() {
        tracker.bindTo(meterRegistry);
        assertThat(meterRegistry.find("ratemeter.rate").gauges()).isEmpty();

        rates.register("late", arbiter.newMeter());
        tracker.refreshBindings();
        assertThat(meterRegistry.find("ratemeter.rate").tag("name", "late").gauges()).hasSize(4);

        rates.unregister("late");
        tracker.refreshBindings();
        assertThat(meterRegistry.find("ratemeter.rate").tag("name", "late").gauges()).isEmpty();
        assertThat(meterRegistry.find("ratemeter.count").tag("name", "late").functionCounter()).isNull();
    }

    @Test
    void replacedMeterIsRebound() {
        Meter original = arbiter.newMeter();
        rates.register("swap", original);
        tracker.bindTo(meterRegistry);

        rates.unregister("swap");
        Meter replacement = arbiter.newMeter();
        replacement.mark(9);
        rates.register("swap", replacement);
        tracker.refreshBindings();

        assertThat(meterRegistry.get("ratemeter.count").tag("name", "swap").functionCounter().count()).isEqualTo(9.0);
    }

    @Test
    void scheduledRefresh() {
        try (var fast = new RateMeterMetricsTracker(rates, List.of(), Duration.ofMillis(20))) {
            fast.bindTo(meterRegistry);
            rates.register("scheduled", arbiter.newMeter());
            await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                    assertThat(meterRegistry.find("ratemeter.rate").tag("name", "scheduled").gauges()).hasSize(4));
        }
    }

    @Test
    void refreshBeforeBindFails() {
        assertThatThrownBy(tracker::refreshBindings).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void closeRemovesGauges() {
        rates.register("requests", arbiter.newMeter());
        tracker.bindTo(meterRegistry);

        tracker.close();

        assertThat(meterRegistry.find("ratemeter.rate").gauges()).isEmpty();
    }

    private double rate(String name, String window) {
        return meterRegistry.get("ratemeter.rate")
                .tag("name", name)
                .tag("window", window)
                .tag("subsystem", "meter")
                .gauge().value();
    }
}
