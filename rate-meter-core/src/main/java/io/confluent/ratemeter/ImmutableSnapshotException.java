package io.confluent.ratemeter;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

import io.confluent.csid.utils.StringUtils;
import lombok.experimental.StandardException;

/**
 * Thrown when a mutating operation ({@code tick}, {@code update}, {@code mark}) is called on a snapshot.
 * <p>
 * Snapshots are read only copies - calling code that hits this has mistaken a snapshot for the live instance, so it is
 * never caught internally.
 *
 * @see io.confluent.ratemeter.ewma.EwmaSnapshot
 * @see io.confluent.ratemeter.ewma.MultiEwmaSnapshot
 * @see MeterSnapshot
 */
@StandardException
public class ImmutableSnapshotException extends UnsupportedOperationException {

    /**
     * @see StringUtils#msg(String, Object...)
     */
    public static ImmutableSnapshotException msg(String message, Object... vars) {
        return new ImmutableSnapshotException(StringUtils.msg(message, vars));
    }

    public static ImmutableSnapshotException of(String operation, Class<?> snapshotType) {
        return msg("{} called on a {}", operation, snapshotType.getSimpleName());
    }

}
