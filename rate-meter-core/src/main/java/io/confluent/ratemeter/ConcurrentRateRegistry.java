package io.confluent.ratemeter;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.ratemeter.internal.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import static io.confluent.csid.utils.StringUtils.msg;

/**
 * {@link RateRegistry} backed by a {@link ConcurrentHashMap}.
 */
@Slf4j
@ThreadSafe
public class ConcurrentRateRegistry implements RateRegistry {

    private final Map<String, Object> metrics = new ConcurrentHashMap<>();

    @Override
    public <T> T getOrRegister(String name, Class<T> type, Supplier<? extends T> factory) {
        Object metric = metrics.computeIfAbsent(name, ignore -> {
            log.debug("Registering new {} under {}", type.getSimpleName(), name);
            return factory.get();
        });
        if (!type.isInstance(metric)) {
            throw new IllegalArgumentException(msg("Metric {} is a {}, not a {}", name, metric.getClass().getSimpleName(), type.getSimpleName()));
        }
        return type.cast(metric);
    }

    @Override
    public void register(String name, Object metric) {
        Object existing = metrics.putIfAbsent(name, metric);
        if (existing != null) {
            throw DuplicateMetricException.msg("Metric already registered under {}: {}", name, existing);
        }
        log.debug("Registered {} under {}", metric, name);
    }

    @Override
    public Optional<Object> get(String name) {
        return Optional.ofNullable(metrics.get(name));
    }

    @Override
    public boolean unregister(String name) {
        Object removed = metrics.remove(name);
        if (removed instanceof StandardMeter) {
            ((StandardMeter) removed).stop();
        }
        if (removed != null) {
            log.debug("Unregistered {}", name);
        }
        return removed != null;
    }

    @Override
    public Set<String> getNames() {
        return Collections.unmodifiableSet(metrics.keySet());
    }

    @Override
    public Map<String, Object> getMetrics() {
        return Collections.unmodifiableMap(metrics);
    }
}
