package io.confluent.ratemeter.examples.core;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.ratemeter.Meter;
import io.confluent.ratemeter.internal.State;
import lombok.extern.slf4j.Slf4j;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.google.common.truth.Truth.assertThat;

@Slf4j
class CoreAppTest {

    @Test
    void test() {
        log.info("Test start");
        CoreAppUnderTest coreApp = new CoreAppUnderTest();

        coreApp.run();

        Meter requests = (Meter) coreApp.rateRegistry.get(CoreApp.REQUESTS).orElseThrow();
        assertThat(coreApp.arbiter.getState()).isEqualTo(State.RUNNING);

        Awaitility.await().atMost(Duration.ofSeconds(30)).untilAsserted(() -> {
            assertThat(requests.getCount()).isGreaterThan(0L);
            assertThat(requests.getOneMinuteRate()).isGreaterThan(0.0);
            assertThat(coreApp.meterRegistry.get("ratemeter.rate")
                    .tag("name", CoreApp.REQUESTS)
                    .tag("window", "m1")
                    .gauge().value()).isGreaterThan(0.0);
        });

        coreApp.report();
        coreApp.close();
        assertThat(coreApp.arbiter.getState()).isEqualTo(State.CLOSED);
    }

    static class CoreAppUnderTest extends CoreApp {

        @Override
        Duration getTickInterval() {
            return Duration.ofMillis(100);
        }

        @Override
        Duration getReportInterval() {
            return Duration.ofMillis(500);
        }
    }
}
