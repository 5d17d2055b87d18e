package io.confluent.csid.utils;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;
import static io.confluent.csid.utils.StringUtils.isBlank;
import static io.confluent.csid.utils.StringUtils.msg;

class StringUtilsTest {

    @Test
    void formatsPlaceholders() {
        assertThat(msg("{} meters ticked in {}", 3, "5ms")).isEqualTo("3 meters ticked in 5ms");
        assertThat(msg("no placeholders")).isEqualTo("no placeholders");
    }

    @Test
    void blank() {
        assertThat(isBlank(null)).isTrue();
        assertThat(isBlank("  ")).isTrue();
        assertThat(isBlank("arbiter")).isFalse();
    }
}
