package io.confluent.ratemeter.internal;

/*-
 * Copyright (C) 2020-2023 Confluent, Inc.
 */

/**
 * Convention only indicator that something is ThreadSafe
 *
 * @author Antony Stubbs
 */
// annotation is inherited by subclasses
@java.lang.annotation.Inherited
public @interface ThreadSafe {

}
