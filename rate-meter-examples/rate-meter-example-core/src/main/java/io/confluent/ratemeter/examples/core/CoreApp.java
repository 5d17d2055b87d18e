package io.confluent.ratemeter.examples.core;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.ratemeter.*;
import io.confluent.ratemeter.metrics.RateMeterMetricsTracker;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.RandomUtils;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Basic core examples
 */
@Slf4j
@NoArgsConstructor
public class CoreApp {

    public static final String REQUESTS = "requests";

    public static final String ERRORS = "errors";

    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    final RateRegistry rateRegistry = new ConcurrentRateRegistry();

    private final Map<String, String> envVars = System.getenv();

    private final ScheduledExecutorService producers = Executors.newScheduledThreadPool(2);

    MeterArbiter arbiter;

    RateMeterMetricsTracker tracker;

    Duration getTickInterval() {
        return Duration.ofSeconds(Long.parseLong(envVars.getOrDefault("TICK_INTERVAL_SECONDS", "5")));
    }

    Duration getReportInterval() {
        return Duration.ofSeconds(10);
    }

    void run() {
        this.arbiter = setupArbiter();
        Meter requests = rateRegistry.getOrRegister(REQUESTS, Meter.class, arbiter::newMeter);
        Meter errors = rateRegistry.getOrRegister(ERRORS, Meter.class, arbiter::newMeter);

        postSetup();

        // simulated traffic, in bursts of varying size
        producers.scheduleAtFixedRate(() -> {
            int burst = RandomUtils.nextInt(1, 100);
            requests.mark(burst);
            if (burst > 90) {
                errors.mark();
            }
        }, 0, 50, TimeUnit.MILLISECONDS);

        long report = getReportInterval().toMillis();
        producers.scheduleAtFixedRate(this::report, report, report, TimeUnit.MILLISECONDS);
    }

    @SuppressWarnings("FeatureEnvy")
    MeterArbiter setupArbiter() {
        var options = RateMeterOptions.builder()
                .tickInterval(getTickInterval())                  //<1>
                .meterRegistry(meterRegistry)                     //<2>
                .commonTags(List.of(Tag.of("instance", "rm1")))   //<3>
                .build();
        return new MeterArbiter(options);
    }

    protected void postSetup() {
        this.tracker = new RateMeterMetricsTracker(rateRegistry);  //<4>
        this.tracker.bindTo(meterRegistry);
    }

    void report() {
        rateRegistry.getMetrics().forEach((name, metric) -> {
            if (metric instanceof Meter) {
                Meter snapshot = ((Meter) metric).snapshot();
                log.info("{}: count={} m1={} m5={} m15={} mean={}", name, snapshot.getCount(),
                        snapshot.getOneMinuteRate(), snapshot.getFiveMinuteRate(), snapshot.getFifteenMinuteRate(),
                        snapshot.getMeanRate());
            }
        });
        log.debug("Published metrics:\n{}", meterRegistry.getMetersAsString());
    }

    void close() {
        this.producers.shutdownNow();
        this.tracker.close();
        this.arbiter.close();
    }

    public static void main(String[] args) {
        var app = new CoreApp();
        Runtime.getRuntime().addShutdownHook(new Thread(app::close));
        app.run();
    }
}
