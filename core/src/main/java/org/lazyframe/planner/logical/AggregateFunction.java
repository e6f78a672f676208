/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.logical;

import java.util.List;

/** Reduces the values one group holds for a column to a single value. */
@FunctionalInterface
public interface AggregateFunction {

  Object aggregate(List<Object> values);

  /** Name used to derive default output column names, as in {@code avg(Salary)}. */
  default String name() {
    return "aggregate";
  }

  static AggregateFunction named(String name, AggregateFunction function) {
    return new AggregateFunction() {
      @Override
      public Object aggregate(List<Object> values) {
        return function.aggregate(values);
      }

      @Override
      public String name() {
        return name;
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }
}
