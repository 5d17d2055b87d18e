package io.confluent.ratemeter;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.csid.utils.WallClock;
import io.confluent.ratemeter.ewma.MultiEwma;
import io.confluent.ratemeter.ewma.MultiEwmaSnapshot;
import io.confluent.ratemeter.ewma.StandardMultiEwma;
import io.confluent.ratemeter.internal.ThreadSafe;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Standard {@link Meter}, ticked by a {@link MeterArbiter}.
 * <p>
 * Marks go straight to atomics and never touch the lock. Reads are served from a cached {@link MeterSnapshot}, which
 * is only rebuilt when the count has moved since it was taken, or when the arbiter ticks the meter. Readers share the
 * read lock in the common case, and only take the write lock to refresh a stale snapshot.
 *
 * @see MeterArbiter#newMeter()
 */
@Slf4j
@ThreadSafe
public class StandardMeter implements Meter {

    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final AtomicLong count = new AtomicLong();

    @Getter(AccessLevel.PACKAGE)
    private final MultiEwma average;

    private final WallClock clock;

    private final long startNanos;

    /**
     * Applies to the snapshot only
     */
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Guarded by {@link #lock}. Replaced on refresh, never mutated.
     */
    private MeterSnapshot snapshot;

    /**
     * The arbiter currently ticking this meter, if any
     */
    private volatile MeterArbiter arbiter;

    /**
     * A stand alone meter with the default windows and tick interval - nothing ticks it until it's
     * {@link MeterArbiter#register registered}.
     */
    public StandardMeter() {
        this(new StandardMultiEwma(), new WallClock());
    }

    public StandardMeter(MultiEwma average, WallClock clock) {
        this.average = average;
        this.clock = clock;
        this.startNanos = clock.nanoTime();
        this.snapshot = MeterSnapshot.empty(average.getWindowCount());
    }

    @Override
    public long getCount() {
        return count.get();
    }

    @Override
    public void mark(long n) {
        count.addAndGet(n);
        average.update(n);
    }

    @Override
    public double getOneMinuteRate() {
        return freshSnapshot().getOneMinuteRate();
    }

    @Override
    public double getFiveMinuteRate() {
        return freshSnapshot().getFiveMinuteRate();
    }

    @Override
    public double getFifteenMinuteRate() {
        return freshSnapshot().getFifteenMinuteRate();
    }

    /**
     * Undefined until some time has elapsed since creation.
     */
    @Override
    public double getMeanRate() {
        return freshSnapshot().getMeanRate();
    }

    public double getRate(int window) {
        return freshSnapshot().getRate(window);
    }

    @Override
    public MeterSnapshot snapshot() {
        return freshSnapshot();
    }

    /**
     * Stop this meter from receiving ticks. Rates freeze at their current values, the count keeps counting.
     *
     * @return true if the meter was registered with an arbiter
     */
    public boolean stop() {
        MeterArbiter current = this.arbiter;
        return current != null && current.unregister(this);
    }

    /**
     * The interval the meter's windows were derived for, when known
     */
    Optional<Duration> getTickInterval() {
        if (average instanceof StandardMultiEwma) {
            return Optional.of(((StandardMultiEwma) average).getTickInterval());
        }
        return Optional.empty();
    }

    Optional<MeterArbiter> getArbiter() {
        return Optional.ofNullable(arbiter);
    }

    void setArbiter(MeterArbiter arbiter) {
        this.arbiter = arbiter;
    }

    /**
     * Serves the cached snapshot if it's up to date with the count, otherwise refreshes it first.
     */
    private MeterSnapshot freshSnapshot() {
        // avoid exclusive access if possible
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            if (snapshot.getCount() == count.get()) {
                return snapshot;
            }
        } finally {
            readLock.unlock();
        }

        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            // another reader may have refreshed while we waited
            if (snapshot.getCount() != count.get()) {
                updateSnapshot();
            }
            return snapshot;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Only called by the arbiter, once per tick interval.
     */
    void tick() {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            average.tick();
            updateSnapshot();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Must run with the write lock held.
     */
    private void updateSnapshot() {
        long currentCount = count.get();
        double elapsedSeconds = (clock.nanoTime() - startNanos) / NANOS_PER_SECOND;
        snapshot = new MeterSnapshot(currentCount, MultiEwmaSnapshot.copyOf(average), currentCount / elapsedSeconds);
        log.trace("Refreshed snapshot {}", snapshot);
    }

    @Override
    public String toString() {
        return "StandardMeter(count=" + count.get() + ", average=" + average + ")";
    }
}
