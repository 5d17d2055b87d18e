package io.confluent.ratemeter.ewma;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.ratemeter.ImmutableSnapshotException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static io.confluent.ratemeter.ewma.DecayTables.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * @see StandardEwma
 */
class StandardEwmaTest {

    @Test
    void oneMinuteDecay() {
        assertDecays(new StandardEwma(DecayMath.ONE_MINUTE_ALPHA), ONE_MINUTE);
    }

    @Test
    void fiveMinuteDecay() {
        assertDecays(new StandardEwma(DecayMath.FIVE_MINUTE_ALPHA), FIVE_MINUTES);
    }

    @Test
    void fifteenMinuteDecay() {
        assertDecays(new StandardEwma(DecayMath.FIFTEEN_MINUTE_ALPHA), FIFTEEN_MINUTES);
    }

    private void assertDecays(Ewma ewma, double[] expected) {
        ewma.update(3);
        ewma.tick();
        for (int minute = 0; minute < expected.length; minute++) {
            assertThat(ewma.getRate())
                    .as("rate after %s minutes", minute)
                    .isCloseTo(expected[minute], within(PRECISION));
            elapseMinute(ewma);
        }
    }

    @Test
    void zeroBeforeFirstTick() {
        var ewma = new StandardEwma(DecayMath.ONE_MINUTE_ALPHA);
        ewma.update(100);
        assertThat(ewma.getRate()).isZero();
    }

    @Test
    void firstTickSeedsWithoutDecay() {
        var ewma = new StandardEwma(DecayMath.FIFTEEN_MINUTE_ALPHA);
        ewma.update(50);
        ewma.tick();
        assertThat(ewma.getRate()).isCloseTo(10.0, within(PRECISION));
    }

    @Test
    void quietTicksOnlyDecay() {
        var ewma = new StandardEwma(DecayMath.ONE_MINUTE_ALPHA);
        ewma.update(10);
        ewma.tick();
        double previous = ewma.getRate();
        for (int i = 0; i < 50; i++) {
            ewma.tick();
            double current = ewma.getRate();
            assertThat(current).isLessThan(previous).isPositive();
            previous = current;
        }
    }

    @Test
    void steadyRateConverges() {
        var ewma = new StandardEwma(DecayMath.ONE_MINUTE_ALPHA);
        ewma.update(5);
        ewma.tick();
        for (int i = 0; i < 12 * 10; i++) {
            ewma.update(20);
            ewma.tick();
        }
        assertThat(ewma.getRate()).isCloseTo(4.0, within(0.001));
    }

    @Test
    void customTickInterval() {
        var tick = Duration.ofSeconds(1);
        var ewma = new StandardEwma(DecayWindow.ONE_MINUTE.alpha(tick), tick);
        ewma.update(3);
        ewma.tick();
        assertThat(ewma.getRate()).isCloseTo(3.0, within(PRECISION));
        for (int i = 0; i < 60; i++) {
            ewma.tick();
        }
        // a minute at any cadence decays by e^-1
        assertThat(ewma.getRate()).isCloseTo(3.0 * Math.exp(-1), within(PRECISION));
    }

    @Test
    void snapshotIsDetached() {
        var ewma = new StandardEwma(DecayMath.ONE_MINUTE_ALPHA);
        ewma.update(3);
        ewma.tick();
        EwmaSnapshot snapshot = ewma.snapshot();

        ewma.update(300);
        ewma.tick();

        assertThat(snapshot.getRate()).isCloseTo(0.6, within(PRECISION));
        assertThat(snapshot.snapshot()).isSameAs(snapshot);
    }

    @Test
    void snapshotRejectsMutation() {
        EwmaSnapshot snapshot = new StandardEwma(DecayMath.ONE_MINUTE_ALPHA).snapshot();
        assertThatThrownBy(snapshot::tick)
                .isInstanceOf(ImmutableSnapshotException.class)
                .hasMessageContaining("tick");
        assertThatThrownBy(() -> snapshot.update(1))
                .isInstanceOf(ImmutableSnapshotException.class)
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsBadConfig() {
        assertThatThrownBy(() -> new StandardEwma(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StandardEwma(0.5, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentUpdatesAllCounted() throws Exception {
        var ewma = new StandardEwma(DecayMath.ONE_MINUTE_ALPHA);
        int threads = 8;
        int perThread = 10_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        ewma.update(1);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }
        ewma.tick();
        assertThat(ewma.getRate()).isCloseTo(threads * perThread / 5.0, within(PRECISION));
    }
}
