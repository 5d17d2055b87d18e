package io.confluent.ratemeter.metrics;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.ratemeter.RateRegistry;
import io.confluent.ratemeter.ewma.DecayWindow;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleFunction;

import static io.confluent.ratemeter.metrics.RateMeterMetricsDef.*;

/**
 * Metrics binder publishing every {@link io.confluent.ratemeter.Meter} held in a {@link RateRegistry} to Micrometer.
 * <p>
 * Each meter becomes a {@code ratemeter.rate} gauge per window (tagged {@code window=m1|m5|m15|mean}) and a
 * {@code ratemeter.count} function counter, all tagged with the meter's registry name. The registry is rescanned on a
 * fixed interval, so meters registered or removed after binding are picked up.
 *
 * @see RateMeterMetricsDef#METER_RATE
 * @see RateMeterMetricsDef#METER_COUNT
 */
@Slf4j
public class RateMeterMetricsTracker implements MeterBinder, AutoCloseable {

    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofSeconds(30);

    private final ScheduledExecutorService scheduler = Executors
            .newSingleThreadScheduledExecutor(new NamedThreadFactory("micrometer-rate-meters"));

    private final RateRegistry rateRegistry;

    private final Iterable<Tag> commonTags;

    private final Duration refreshInterval;

    /**
     * Micrometer meters bound per registry name. Guarded by this.
     */
    private final Map<String, BoundMeter> bound = new HashMap<>();

    private RateMeterMetrics metrics;

    public RateMeterMetricsTracker(RateRegistry rateRegistry) {
        this(rateRegistry, Collections.emptyList(), DEFAULT_REFRESH_INTERVAL);
    }

    public RateMeterMetricsTracker(RateRegistry rateRegistry, Iterable<Tag> tags, Duration refreshInterval) {
        this.rateRegistry = rateRegistry;
        this.commonTags = tags;
        this.refreshInterval = refreshInterval;
    }

    @Override
    public void bindTo(MeterRegistry meterRegistry) {
        synchronized (this) {
            this.metrics = new RateMeterMetrics(meterRegistry, commonTags);
        }
        refreshBindings();
        long period = refreshInterval.toMillis();
        this.scheduler.scheduleAtFixedRate(this::refreshBindingsQuietly, period, period, TimeUnit.MILLISECONDS);
    }

    /**
     * Binds meters registered since the last refresh, and removes the ones no longer registered.
     */
    public synchronized void refreshBindings() {
        if (metrics == null) {
            throw new IllegalStateException("Not bound to a meter registry yet");
        }
        Map<String, io.confluent.ratemeter.Meter> current = new HashMap<>();
        rateRegistry.getMetrics().forEach((name, metric) -> {
            if (metric instanceof io.confluent.ratemeter.Meter) {
                current.put(name, (io.confluent.ratemeter.Meter) metric);
            }
        });

        Iterator<Map.Entry<String, BoundMeter>> it = bound.entrySet().iterator();
        while (it.hasNext()) {
            var entry = it.next();
            if (current.get(entry.getKey()) != entry.getValue().getSource()) {
                log.debug("Meter {} no longer registered, removing its gauges", entry.getKey());
                entry.getValue().getRegistered().forEach(metrics::removeMeter);
                it.remove();
            }
        }

        current.forEach((name, meter) -> {
            if (!bound.containsKey(name)) {
                bound.put(name, bind(name, meter));
            }
        });
    }

    private void refreshBindingsQuietly() {
        try {
            refreshBindings();
        } catch (RuntimeException e) {
            // keep the schedule alive, next refresh may succeed
            log.error("Error refreshing rate meter bindings", e);
        }
    }

    private BoundMeter bind(String name, io.confluent.ratemeter.Meter meter) {
        log.debug("Binding meter {}", name);
        Tag nameTag = Tag.of(NAME_TAG, name);
        List<Meter> registered = new ArrayList<>();
        registered.add(bindRate(meter, io.confluent.ratemeter.Meter::getOneMinuteRate, nameTag, DecayWindow.ONE_MINUTE.getLabel()));
        registered.add(bindRate(meter, io.confluent.ratemeter.Meter::getFiveMinuteRate, nameTag, DecayWindow.FIVE_MINUTES.getLabel()));
        registered.add(bindRate(meter, io.confluent.ratemeter.Meter::getFifteenMinuteRate, nameTag, DecayWindow.FIFTEEN_MINUTES.getLabel()));
        registered.add(bindRate(meter, io.confluent.ratemeter.Meter::getMeanRate, nameTag, MEAN_WINDOW));
        registered.add(metrics.functionCounterFromMetricDef(METER_COUNT, meter, io.confluent.ratemeter.Meter::getCount, nameTag));
        return new BoundMeter(meter, registered);
    }

    private Meter bindRate(io.confluent.ratemeter.Meter meter,
                           ToDoubleFunction<io.confluent.ratemeter.Meter> rate,
                           Tag nameTag,
                           String window) {
        return metrics.gaugeFromMetricDef(METER_RATE, meter, rate, nameTag, Tag.of(WINDOW_TAG, window));
    }

    @Override
    public synchronized void close() {
        this.scheduler.shutdownNow();
        if (metrics != null) {
            metrics.close();
        }
        bound.clear();
    }

    @Value
    private static class BoundMeter {
        io.confluent.ratemeter.Meter source;
        List<Meter> registered;
    }
}
