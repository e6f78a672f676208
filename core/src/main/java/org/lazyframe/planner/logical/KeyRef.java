/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.logical;

import java.util.function.Function;

/**
 * A group-by or join key as the caller names it: a column, optionally with a function applied to
 * the value before grouping or matching (for example bucketing a number).
 */
public record KeyRef(String column, Function<Object, Object> collation) {

  public static KeyRef of(String column) {
    return new KeyRef(column, Function.identity());
  }

  public static KeyRef of(Function<Object, Object> collation, String column) {
    return new KeyRef(column, collation);
  }
}
