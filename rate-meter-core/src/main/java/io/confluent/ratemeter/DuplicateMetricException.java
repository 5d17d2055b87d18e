package io.confluent.ratemeter;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.csid.utils.StringUtils;
import lombok.experimental.StandardException;

/**
 * A metric is already registered under the requested name.
 *
 * @see RateRegistry#register(String, Object)
 */
@StandardException
public class DuplicateMetricException extends IllegalArgumentException {

    /**
     * @see StringUtils#msg(String, Object...)
     */
    public static DuplicateMetricException msg(String message, Object... vars) {
        return new DuplicateMetricException(StringUtils.msg(message, vars));
    }

}
