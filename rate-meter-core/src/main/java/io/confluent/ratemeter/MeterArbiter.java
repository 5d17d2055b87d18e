package io.confluent.ratemeter;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.csid.utils.WallClock;
import io.confluent.ratemeter.ewma.DecayWindow;
import io.confluent.ratemeter.ewma.StandardMultiEwma;
import io.confluent.ratemeter.internal.State;
import io.confluent.ratemeter.internal.ThreadSafe;
import io.confluent.ratemeter.metrics.RateMeterMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static io.confluent.csid.utils.StringUtils.msg;
import static io.confluent.ratemeter.internal.State.*;
import static io.confluent.ratemeter.metrics.RateMeterMetricsDef.*;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Ticks every registered {@link StandardMeter} on a fixed interval, from a single background thread.
 * <p>
 * The driver is started at most once - either explicitly through {@link #start()}, or on the first registration when
 * {@link RateMeterOptions#isStartLazily()} is set. Closing stops the driver and releases every meter.
 * <p>
 * A meter whose tick throws is logged and skipped, the rest of the pass carries on.
 *
 * @see RateMeters#defaultArbiter()
 */
@Slf4j
@ThreadSafe
public class MeterArbiter implements AutoCloseable {

    @Getter
    private final RateMeterOptions options;

    private final WallClock clock;

    /**
     * Registration takes the write lock, a tick pass shares the read lock
     */
    private final ReadWriteLock metersLock = new ReentrantReadWriteLock();

    /**
     * Guarded by {@link #metersLock}
     */
    private final Set<StandardMeter> meters = new LinkedHashSet<>();

    private final AtomicReference<State> state = new AtomicReference<>(UNUSED);

    /**
     * Only set once started, guarded by this
     */
    private ScheduledExecutorService scheduler;

    private final RateMeterMetrics metrics;

    private final Timer tickTimer;

    private final Counter tickFailures;

    public MeterArbiter() {
        this(RateMeterOptions.builder().build());
    }

    public MeterArbiter(RateMeterOptions options) {
        options.validate();
        this.options = options;
        this.clock = options.getClock();
        this.metrics = new RateMeterMetrics(options.getMeterRegistry(), options.getCommonTags());
        this.tickTimer = metrics.getTimerFromMetricDef(ARBITER_TICK_TIME);
        this.tickFailures = metrics.getCounterFromMetricDef(ARBITER_TICK_FAILURES);
        metrics.gaugeFromMetricDef(ARBITER_METERS, this, MeterArbiter::getMeterCount);
        metrics.gaugeFromMetricDef(ARBITER_STATUS, this, arbiter -> arbiter.getState().getValue());
    }

    public Duration getTickInterval() {
        return options.getTickInterval();
    }

    public State getState() {
        return state.get();
    }

    /**
     * A new meter with the standard one, five and fifteen minute windows, registered with this arbiter.
     */
    public Meter newMeter() {
        return newMeter(DecayWindow.alphas(getTickInterval(), DecayWindow.values()));
    }

    /**
     * A new meter with custom decay constants, registered with this arbiter.
     *
     * @param alphas one decay constant per window, derived for this arbiter's {@link #getTickInterval() tick
     *               interval}. The first three windows are the ones reported as the one, five and fifteen minute
     *               rates.
     * @throws IllegalArgumentException if fewer than three alphas are given, or any is out of range
     */
    public Meter newMeter(double... alphas) {
        int required = DecayWindow.values().length;
        if (alphas.length < required) {
            throw new IllegalArgumentException(msg("A meter needs at least {} windows, got {}", required, alphas.length));
        }
        if (isNoop()) {
            return NoopMeter.INSTANCE;
        }
        var meter = new StandardMeter(new StandardMultiEwma(getTickInterval(), alphas), clock);
        register(meter);
        return meter;
    }

    private boolean isNoop() {
        return options.isNoopMeters() || RateMeters.isUseNoopMeters();
    }

    /**
     * Start ticking the meter. Registering a meter twice has no effect. A meter is only ticked by one arbiter at a
     * time - registering it here moves it from any other.
     *
     * @throws IllegalArgumentException if the meter's windows were derived for a different tick interval
     * @throws IllegalStateException    if this arbiter has been closed
     */
    public void register(StandardMeter meter) {
        var meterInterval = meter.getTickInterval();
        if (meterInterval.isPresent() && !meterInterval.get().equals(getTickInterval())) {
            throw new IllegalArgumentException(msg("Can't register {}, its decay is derived for a {} tick interval but this arbiter ticks every {}",
                    meter, meterInterval.get(), getTickInterval()));
        }

        var previous = meter.getArbiter();
        if (previous.isPresent() && previous.get() != this) {
            previous.get().unregister(meter);
        }

        Lock writeLock = metersLock.writeLock();
        writeLock.lock();
        try {
            if (state.get() == CLOSED) {
                throw new IllegalStateException(msg("Can't register {}, arbiter is closed", meter));
            }
            if (meters.add(meter)) {
                meter.setArbiter(this);
                log.debug("Registered meter {}, now ticking {} meters", meter, meters.size());
            }
        } finally {
            writeLock.unlock();
        }

        if (options.isStartLazily() && state.get() == UNUSED) {
            startIfUnused();
        }
    }

    /**
     * Stop ticking the meter. It keeps counting, but its rates won't move any more.
     *
     * @return true if the meter was registered
     */
    public boolean unregister(StandardMeter meter) {
        Lock writeLock = metersLock.writeLock();
        writeLock.lock();
        try {
            boolean removed = meters.remove(meter);
            if (removed) {
                meter.setArbiter(null);
                log.debug("Unregistered meter {}, now ticking {} meters", meter, meters.size());
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    public int getMeterCount() {
        Lock readLock = metersLock.readLock();
        readLock.lock();
        try {
            return meters.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Starts the background driver, if it isn't already running.
     *
     * @throws IllegalStateException if this arbiter has been closed
     */
    public synchronized void start() {
        if (state.get() == CLOSED) {
            throw new IllegalStateException("Can't start a closed arbiter");
        }
        startIfUnused();
    }

    private synchronized void startIfUnused() {
        if (!state.compareAndSet(UNUSED, RUNNING)) {
            log.trace("Arbiter not started, already {}", state.get());
            return;
        }
        long periodNanos = getTickInterval().toNanos();
        scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory(options.getThreadName()));
        scheduler.scheduleAtFixedRate(this::tickMeters, periodNanos, periodNanos, NANOSECONDS);
        log.debug("Arbiter started at {}, ticking every {} on thread {}", clock.getNow(), getTickInterval(), options.getThreadName());
    }

    /**
     * One pass over every registered meter, ticking each in turn. Called by the driver once per tick interval.
     * <p>
     * Only call this directly when the driver isn't running - meters assume they are ticked once per interval.
     */
    public void tickMeters() {
        long start = clock.nanoTime();
        int ticked = 0;
        Lock readLock = metersLock.readLock();
        readLock.lock();
        try {
            for (StandardMeter meter : meters) {
                if (tickIsolated(meter)) {
                    ticked++;
                }
            }
        } finally {
            readLock.unlock();
        }
        long elapsed = clock.nanoTime() - start;
        tickTimer.record(elapsed, NANOSECONDS);
        log.trace("Ticked {} meters in {}", ticked, Duration.ofNanos(elapsed));
    }

    /**
     * @return false if the meter's tick threw
     */
    private boolean tickIsolated(StandardMeter meter) {
        try {
            meter.tick();
            return true;
        } catch (RuntimeException e) {
            tickFailures.increment();
            log.error("Error ticking meter {}, skipping it for this interval", meter, e);
            return false;
        }
    }

    /**
     * Stops the driver, waiting up to {@link RateMeterOptions#getShutdownTimeout()} for an in-flight tick pass, and
     * releases all meters. Terminal - a closed arbiter can't be restarted.
     */
    @Override
    public synchronized void close() {
        State previous = state.getAndSet(CLOSED);
        if (previous == CLOSED) {
            log.warn("Trying to close an arbiter that is already closed");
            return;
        }
        log.debug("Closing arbiter (was {})", previous);
        if (scheduler != null) {
            stopScheduler();
        }

        Lock writeLock = metersLock.writeLock();
        writeLock.lock();
        try {
            meters.forEach(meter -> meter.setArbiter(null));
            meters.clear();
        } finally {
            writeLock.unlock();
        }
        metrics.close();
        log.debug("Arbiter closed");
    }

    private void stopScheduler() {
        scheduler.shutdown();
        Duration timeout = options.getShutdownTimeout();
        try {
            if (!scheduler.awaitTermination(timeout.toNanos(), NANOSECONDS)) {
                log.warn("Tick pass didn't finish within {}, interrupting", timeout);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted waiting for the tick pass to finish", e);
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return msg("MeterArbiter(state={}, tickInterval={})", state.get(), getTickInterval());
    }
}
