package io.confluent.ratemeter;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.UtilityClass;

/**
 * Entry point for meters ticked by the process wide {@link #defaultArbiter() default arbiter}.
 * <p>
 * Applications that want control over the tick interval or the arbiter's lifecycle should construct their own
 * {@link MeterArbiter} instead.
 */
@UtilityClass
public class RateMeters {

    /**
     * While set, every factory hands out no-op meters and averages - for deployments that want to switch metrics
     * overhead off. Only affects meters created afterwards.
     */
    @Getter
    @Setter
    private static volatile boolean useNoopMeters = false;

    private static class DefaultArbiterHolder {
        private static final MeterArbiter INSTANCE = new MeterArbiter();
    }

    private static class DefaultRegistryHolder {
        private static final ConcurrentRateRegistry INSTANCE = new ConcurrentRateRegistry();
    }

    /**
     * The process wide arbiter, with default options. Created on first use, started on its first meter.
     */
    public static MeterArbiter defaultArbiter() {
        return DefaultArbiterHolder.INSTANCE;
    }

    public static RateRegistry defaultRegistry() {
        return DefaultRegistryHolder.INSTANCE;
    }

    /**
     * A new meter with one, five and fifteen minute windows, ticked by the default arbiter.
     */
    public static Meter newMeter() {
        if (useNoopMeters) {
            return NoopMeter.INSTANCE;
        }
        return defaultArbiter().newMeter();
    }

    /**
     * A new meter with custom decay constants, ticked by the default arbiter.
     *
     * @see MeterArbiter#newMeter(double...)
     */
    public static Meter newMeter(double... alphas) {
        if (useNoopMeters) {
            return NoopMeter.INSTANCE;
        }
        return defaultArbiter().newMeter(alphas);
    }

    /**
     * The meter registered under the name, or a new one registered in its place.
     *
     * @param registry the registry to use, or null for the {@link #defaultRegistry() default registry}
     */
    public static Meter getOrRegisterMeter(String name, RateRegistry registry) {
        return orDefault(registry).getOrRegister(name, Meter.class, RateMeters::newMeter);
    }

    /**
     * A new meter, registered under the name.
     *
     * @param registry the registry to use, or null for the {@link #defaultRegistry() default registry}
     * @throws DuplicateMetricException if the name is taken
     */
    public static Meter newRegisteredMeter(String name, RateRegistry registry) {
        Meter meter = newMeter();
        try {
            orDefault(registry).register(name, meter);
        } catch (DuplicateMetricException e) {
            if (meter instanceof StandardMeter) {
                ((StandardMeter) meter).stop();
            }
            throw e;
        }
        return meter;
    }

    private static RateRegistry orDefault(RateRegistry registry) {
        return registry == null ? defaultRegistry() : registry;
    }
}
