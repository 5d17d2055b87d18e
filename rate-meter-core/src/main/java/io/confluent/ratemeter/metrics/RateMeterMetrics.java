package io.confluent.ratemeter.metrics;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.ToDoubleFunction;

/**
 * Registers Micrometer meters from {@link RateMeterMetricsDef}s, and keeps track of them so they can all be removed
 * again on close.
 */
@Slf4j
public class RateMeterMetrics implements AutoCloseable {

    /**
     * Meter registry used for metrics - a no-op composite registry if none was given.
     */
    @Getter
    private final MeterRegistry meterRegistry;

    /**
     * Tracking of registered meters for removal from registry on shutdown.
     */
    private final List<Meter.Id> registeredMeters = new ArrayList<>();

    /**
     * Common metrics tags added to all meters
     */
    @Getter
    private final Iterable<Tag> commonTags;

    private final AtomicBoolean isClosed = new AtomicBoolean(true);

    private final boolean isNoop;

    /**
     * @param meterRegistry: meterRegistry to use for meter registration, or null for none
     * @param commonTags:    set of tags to add to all meters
     */
    public RateMeterMetrics(MeterRegistry meterRegistry, Iterable<Tag> commonTags) {
        if (meterRegistry == null) {
            this.isNoop = true;
            this.meterRegistry = new CompositeMeterRegistry();
        } else {
            this.isNoop = false;
            this.meterRegistry = meterRegistry;
        }
        this.commonTags = unique(commonTags);
        this.isClosed.set(false);
    }

    /**
     * Drops tags repeating an earlier tag's key.
     *
     * @return tag collection with unique tag keys
     */
    private Iterable<Tag> unique(Iterable<Tag> commonTags) {
        Set<String> tagKeys = new HashSet<>();
        List<Tag> tags = new LinkedList<>();
        commonTags.forEach(tag -> {
            if (tagKeys.add(tag.getKey())) {
                tags.add(tag);
            } else {
                log.warn("Duplicate metrics tag specified : {}", tag.getKey());
            }
        });
        return tags;
    }

    /**
     * Returns a counter from the metric definition. The counter will be registered with the meter registry.
     *
     * @param metricDef:      the metric definition to use.
     * @param additionalTags: additional tags to add to the counter.
     */
    public synchronized Counter getCounterFromMetricDef(RateMeterMetricsDef metricDef, Tag... additionalTags) {
        Counter counter = Counter.builder(metricDef.getName())
                .description(metricDef.getDescription())
                .tags(commonTags)
                .tags(metricDef.getSubsystemAsTags())
                .tags(Arrays.asList(additionalTags))
                .register(this.meterRegistry);
        registeredMeters.add(counter.getId());
        return counter;
    }

    /**
     * Returns a timer from the metric definition. The timer will be registered with the meter registry.
     *
     * @param metricDef:      the metric definition to use.
     * @param additionalTags: additional tags to add to the timer.
     */
    public synchronized Timer getTimerFromMetricDef(RateMeterMetricsDef metricDef, Tag... additionalTags) {
        Timer timer = Timer.builder(metricDef.getName())
                .publishPercentiles(0.5, 0.95, 0.99)
                .description(metricDef.getDescription())
                .tags(commonTags)
                .tags(metricDef.getSubsystemAsTags())
                .tags(Arrays.asList(additionalTags))
                .register(this.meterRegistry);
        registeredMeters.add(timer.getId());
        return timer;
    }

    /**
     * Returns a gauge from the metric definition. The gauge holds a strong reference to the state object, so it's
     * kept alive for as long as the gauge is registered.
     *
     * @param metricDef:      the metric definition to use.
     * @param stateObject:    object to collect metrics from
     * @param valueFunction:  function of the stateObject that is invoked on gauge observation to return the value
     * @param additionalTags: additional tags to add to the gauge.
     * @return the Gauge instance.
     */
    public synchronized <T> Gauge gaugeFromMetricDef(
            RateMeterMetricsDef metricDef,
            T stateObject,
            ToDoubleFunction<T> valueFunction,
            Tag... additionalTags) {
        Gauge gauge = Gauge.builder(metricDef.getName(), stateObject, valueFunction)
                .description(metricDef.getDescription())
                .tags(commonTags)
                .tags(metricDef.getSubsystemAsTags())
                .tags(Arrays.asList(additionalTags))
                .strongReference(true)
                .register(this.meterRegistry);
        registeredMeters.add(gauge.getId());
        return gauge;
    }

    /**
     * Returns a function counter from the metric definition, for values that are counted elsewhere and only
     * observed.
     */
    public synchronized <T> FunctionCounter functionCounterFromMetricDef(
            RateMeterMetricsDef metricDef,
            T stateObject,
            ToDoubleFunction<T> countFunction,
            Tag... additionalTags) {
        FunctionCounter counter = FunctionCounter.builder(metricDef.getName(), stateObject, countFunction)
                .description(metricDef.getDescription())
                .tags(commonTags)
                .tags(metricDef.getSubsystemAsTags())
                .tags(Arrays.asList(additionalTags))
                .register(this.meterRegistry);
        registeredMeters.add(counter.getId());
        return counter;
    }

    /**
     * Removes the meter from the registry.
     * <p>
     * Synchronized with close method to avoid concurrent modification race on shutdown.
     *
     * @param meter to remove.
     */
    public synchronized void removeMeter(Meter meter) {
        if (meter == null) {
            return;
        }
        if (this.isClosed.get()) {
            //Already closed metrics subsystem - ignore
            log.debug("Trying to remove meter when metrics subsystem is already closed. Meter Id {}", meter.getId());
            return;
        }
        log.debug("Removing meter: {}", meter.getId());
        this.meterRegistry.remove(meter.getId());
        this.registeredMeters.remove(meter.getId());
    }

    /**
     * Cleans up all meters from registry - should be recreated before using it again.
     */
    @Override
    public synchronized void close() {
        if (this.isClosed.getAndSet(true)) {
            //Instance already closed - warn and ignore.
            log.warn("Trying to close RateMeterMetrics instance that is already closed.");
            return;
        }
        log.debug("Closing RateMeterMetrics, removing {} meters", registeredMeters.size());
        this.registeredMeters.forEach(this.meterRegistry::remove);
        this.registeredMeters.clear();
        if (isNoop) {
            this.meterRegistry.close();
        }
    }
}
