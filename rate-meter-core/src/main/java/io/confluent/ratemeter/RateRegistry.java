package io.confluent.ratemeter;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Name indexed metrics, the contract meters are looked up through.
 *
 * @see ConcurrentRateRegistry
 */
public interface RateRegistry {

    /**
     * Gets the metric registered under the name, or creates and registers one.
     *
     * @param type    the type the metric must have
     * @param factory only called if nothing is registered under the name
     * @throws IllegalArgumentException if the registered metric isn't of the given type
     */
    <T> T getOrRegister(String name, Class<T> type, Supplier<? extends T> factory);

    /**
     * @throws DuplicateMetricException if something is already registered under the name
     */
    void register(String name, Object metric);

    Optional<Object> get(String name);

    /**
     * Removes the metric. A removed {@link StandardMeter} is also {@link StandardMeter#stop() stopped}.
     *
     * @return true if anything was registered under the name
     */
    boolean unregister(String name);

    Set<String> getNames();

    /**
     * @return an unmodifiable view of all metrics by name
     */
    Map<String, Object> getMetrics();
}
