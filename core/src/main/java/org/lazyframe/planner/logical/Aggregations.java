/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.logical;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.lazyframe.exception.OperationException;

/** Built-in aggregate functions. Nulls are skipped except by count, first and last. */
public final class Aggregations {

  public static final AggregateFunction MIN = AggregateFunction.named("min", v -> extreme(v, -1));

  public static final AggregateFunction MAX = AggregateFunction.named("max", v -> extreme(v, 1));

  public static final AggregateFunction SUM = AggregateFunction.named("sum", Aggregations::sum);

  public static final AggregateFunction AVG = AggregateFunction.named("avg", Aggregations::avg);

  public static final AggregateFunction COUNT =
      AggregateFunction.named("count", v -> (long) v.size());

  public static final AggregateFunction FIRST =
      AggregateFunction.named("first", v -> v.isEmpty() ? null : v.get(0));

  public static final AggregateFunction LAST =
      AggregateFunction.named("last", v -> v.isEmpty() ? null : v.get(v.size() - 1));

  private Aggregations() {}

  @SuppressWarnings("unchecked")
  private static Object extreme(List<Object> values, int sign) {
    Comparable<Object> best = null;
    for (Object value : values) {
      if (value == null) {
        continue;
      }
      if (!(value instanceof Comparable)) {
        throw new OperationException("Value is not comparable: " + value);
      }
      Comparable<Object> candidate = (Comparable<Object>) value;
      if (best == null || Integer.signum(candidate.compareTo(best)) == sign) {
        best = candidate;
      }
    }
    return best;
  }

  private static Object sum(List<Object> values) {
    List<Number> numbers = numbers(values);
    boolean integral =
        numbers.stream().allMatch(n -> n instanceof Integer || n instanceof Long);
    if (integral) {
      return numbers.stream().mapToLong(Number::longValue).sum();
    }
    return numbers.stream().mapToDouble(Number::doubleValue).sum();
  }

  private static Object avg(List<Object> values) {
    List<Number> numbers = numbers(values);
    if (numbers.isEmpty()) {
      return null;
    }
    return numbers.stream().mapToDouble(Number::doubleValue).average().getAsDouble();
  }

  private static List<Number> numbers(List<Object> values) {
    return values.stream()
        .filter(Objects::nonNull)
        .map(
            value -> {
              if (!(value instanceof Number)) {
                throw new OperationException(
                    "Value is not numeric: " + value + ". Set a numeric type on the column first.");
              }
              return (Number) value;
            })
        .collect(Collectors.toList());
  }
}
