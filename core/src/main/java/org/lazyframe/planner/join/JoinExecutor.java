/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.join;

import java.time.temporal.ChronoUnit;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.exception.OperationException;
import org.lazyframe.planner.sort.RowComparator;

/**
 * Hash join and as-of join over rows already projected onto a {@link JoinPlan}'s carried
 * layouts. Emits rows in output-column order with formatters applied. All methods are static.
 * NULL keys never match.
 */
@Log4j2
public final class JoinExecutor {

  private JoinExecutor() {}

  public static List<Object[]> join(
      JoinPlan plan, List<Object[]> leftRows, List<Object[]> rightRows) {
    List<Object[]> joined =
        plan.type().isAsOf()
            ? performAsOfJoin(plan, leftRows, rightRows)
            : performHashJoin(plan, leftRows, rightRows);
    List<Object[]> output = new ArrayList<>(joined.size());
    for (Object[] row : joined) {
      output.add(emit(plan, row));
    }
    log.debug(
        "{} join of {} x {} rows produced {} rows",
        plan.type(),
        leftRows.size(),
        rightRows.size(),
        output.size());
    return output;
  }

  /**
   * Equality join. Inner joins hash whichever side the plan designates as build side; left joins
   * always hash the right side and null-pad left rows without a match.
   */
  static List<Object[]> performHashJoin(
      JoinPlan plan, List<Object[]> leftRows, List<Object[]> rightRows) {
    List<Object[]> result = new ArrayList<>();
    if (plan.buildLeft()) {
      Map<Object, List<Object[]>> hashTable = buildHashTable(leftRows, plan::leftKey);
      for (Object[] rightRow : rightRows) {
        Object key = plan.rightKey(rightRow);
        List<Object[]> matches = key == null ? null : hashTable.get(key);
        if (matches != null) {
          for (Object[] leftRow : matches) {
            result.add(combineRows(leftRow, rightRow));
          }
        }
      }
      return result;
    }

    Map<Object, List<Object[]>> hashTable = buildHashTable(rightRows, plan::rightKey);
    int rightWidth = plan.rightCarried().size();
    boolean keepUnmatched = plan.type().keepsUnmatchedLeft();
    for (Object[] leftRow : leftRows) {
      Object key = plan.leftKey(leftRow);
      List<Object[]> matches = key == null ? null : hashTable.get(key);
      if (matches != null && !matches.isEmpty()) {
        for (Object[] rightRow : matches) {
          result.add(combineRows(leftRow, rightRow));
        }
      } else if (keepUnmatched) {
        result.add(combineRows(leftRow, new Object[rightWidth]));
      }
    }
    return result;
  }

  /**
   * Matches every left row to the nearest right row with equal keys in roll order: forward takes
   * the smallest roll at or above the left roll, backward the largest at or below. A candidate
   * further than the plan's limit is not a match.
   */
  static List<Object[]> performAsOfJoin(
      JoinPlan plan, List<Object[]> leftRows, List<Object[]> rightRows) {
    int rightRoll = plan.rightRoll();
    Comparator<Object[]> byRoll =
        (r1, r2) -> RowComparator.compareValues(r1[rightRoll], r2[rightRoll]);
    Map<Object, List<Object[]>> hashTable = new HashMap<>();
    for (Object[] row : rightRows) {
      Object key = plan.rightKey(row);
      if (key != null && row[rightRoll] != null) {
        hashTable.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
      }
    }
    hashTable.values().forEach(candidates -> candidates.sort(byRoll));

    boolean forward = plan.type() == JoinType.ASOF_FORWARD;
    int rightWidth = plan.rightCarried().size();
    List<Object[]> result = new ArrayList<>();
    for (Object[] leftRow : leftRows) {
      Object key = plan.leftKey(leftRow);
      Object roll = leftRow[plan.leftRoll()];
      Object[] match = null;
      if (key != null && roll != null) {
        List<Object[]> candidates = hashTable.get(key);
        if (candidates != null) {
          match = nearest(candidates, rightRoll, roll, forward);
        }
        if (match != null && plan.limit() != null) {
          double distance = Math.abs(distance(roll, match[rightRoll]));
          if (distance > plan.limit().doubleValue()) {
            match = null;
          }
        }
      }
      if (match != null) {
        result.add(combineRows(leftRow, match));
      } else if (plan.keepUnmatched()) {
        result.add(combineRows(leftRow, new Object[rightWidth]));
      }
    }
    return result;
  }

  /** Binary search over candidates sorted by roll value. */
  static Object[] nearest(List<Object[]> candidates, int rollIndex, Object roll, boolean forward) {
    int low = 0;
    int high = candidates.size() - 1;
    Object[] best = null;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      Object[] candidate = candidates.get(mid);
      int cmp = RowComparator.compareValues(candidate[rollIndex], roll);
      if (forward) {
        if (cmp >= 0) {
          best = candidate;
          high = mid - 1;
        } else {
          low = mid + 1;
        }
      } else {
        if (cmp <= 0) {
          best = candidate;
          low = mid + 1;
        } else {
          high = mid - 1;
        }
      }
    }
    return best;
  }

  /**
   * Signed distance {@code to - from}: a numeric difference for numbers, whole days for dates.
   *
   * @throws OperationException if the values are not measurable
   */
  static double distance(Object from, Object to) {
    if (from instanceof Number && to instanceof Number) {
      return ((Number) to).doubleValue() - ((Number) from).doubleValue();
    }
    if (from instanceof Temporal && to instanceof Temporal) {
      return ChronoUnit.DAYS.between((Temporal) from, (Temporal) to);
    }
    throw new OperationException(
        "A rolling join limit needs numeric or date roll values, got "
            + from.getClass().getSimpleName()
            + " and "
            + to.getClass().getSimpleName());
  }

  static Map<Object, List<Object[]>> buildHashTable(
      List<Object[]> rows, Function<Object[], Object> keyOf) {
    Map<Object, List<Object[]>> hashTable = new HashMap<>();
    for (Object[] row : rows) {
      Object key = keyOf.apply(row);
      if (key != null) {
        hashTable.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
      }
    }
    return hashTable;
  }

  /**
   * Extracts the join key from a row: each key value with its function applied. Composite keys
   * become a List of normalized values. Returns null if any key value is null before or after its
   * function. As-of joins without keys share one empty key.
   */
  public static Object extractJoinKey(
      Object[] row, List<Integer> keyIndices, List<Function<Object, Object>> keyFunctions) {
    if (keyIndices.size() == 1) {
      return keyValue(row, keyIndices.get(0), keyFunctions.get(0));
    }
    List<Object> compositeKey = new ArrayList<>(keyIndices.size());
    for (int i = 0; i < keyIndices.size(); i++) {
      Object val = keyValue(row, keyIndices.get(i), keyFunctions.get(i));
      if (val == null) {
        return null;
      }
      compositeKey.add(val);
    }
    return compositeKey;
  }

  private static Object keyValue(Object[] row, int index, Function<Object, Object> keyFunction) {
    Object raw = row[index];
    return raw == null ? null : normalizeJoinKeyValue(keyFunction.apply(raw));
  }

  /** Converts integer numeric types to Long and Float to Double so equal numbers hash alike. */
  static Object normalizeJoinKeyValue(Object val) {
    if (val == null) {
      return null;
    }
    if (val instanceof Integer || val instanceof Short || val instanceof Byte) {
      return ((Number) val).longValue();
    }
    if (val instanceof Float) {
      return ((Float) val).doubleValue();
    }
    return val;
  }

  static Object[] combineRows(Object[] leftRow, Object[] rightRow) {
    Object[] combined = new Object[leftRow.length + rightRow.length];
    System.arraycopy(leftRow, 0, combined, 0, leftRow.length);
    System.arraycopy(rightRow, 0, combined, leftRow.length, rightRow.length);
    return combined;
  }

  private static Object[] emit(JoinPlan plan, Object[] joined) {
    int leftWidth = plan.leftCarried().size();
    plan.leftFormatters().forEach((position, formatter) -> format(joined, position, formatter));
    plan.rightFormatters()
        .forEach((position, formatter) -> format(joined, leftWidth + position, formatter));
    Object[] out = new Object[plan.writeIndex().size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = joined[plan.writeIndex().get(i)];
    }
    return out;
  }

  private static void format(Object[] row, int position, Function<Object, Object> formatter) {
    if (row[position] != null) {
      row[position] = formatter.apply(row[position]);
    }
  }
}
