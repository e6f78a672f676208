/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.join;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.function.Function;

/**
 * Index mapping of one join evaluation. Each side carries only {@code leftCarried} / {@code
 * rightCarried} slots; keys, roll columns and formatters are positions in that carried layout. A
 * joined row is the left carried values followed by the right ones, and {@code writeIndex} maps
 * every output column onto it.
 *
 * @param type join kind
 * @param leftCarried sorted slots the left side carries
 * @param rightCarried sorted slots the right side carries
 * @param leftKeys key positions in the left carried layout
 * @param rightKeys key positions in the right carried layout
 * @param leftKeyFunctions function applied to each left key value before matching
 * @param rightKeyFunctions function applied to each right key value before matching
 * @param leftRoll roll position in the left carried layout, -1 for equi-joins
 * @param rightRoll roll position in the right carried layout, -1 for equi-joins
 * @param leftFormatters formatters keyed by left carried position
 * @param rightFormatters formatters keyed by right carried position
 * @param outputNames output names in output order
 * @param writeIndex joined-row position of every output column
 * @param buildLeft true if the left side is hashed (inner joins over a smaller left file)
 * @param limit maximum as-of distance, or null
 * @param keepUnmatched whether unmatched as-of rows are kept
 */
public record JoinPlan(
    JoinType type,
    ImmutableList<Integer> leftCarried,
    ImmutableList<Integer> rightCarried,
    ImmutableList<Integer> leftKeys,
    ImmutableList<Integer> rightKeys,
    ImmutableList<Function<Object, Object>> leftKeyFunctions,
    ImmutableList<Function<Object, Object>> rightKeyFunctions,
    int leftRoll,
    int rightRoll,
    ImmutableMap<Integer, Function<Object, Object>> leftFormatters,
    ImmutableMap<Integer, Function<Object, Object>> rightFormatters,
    ImmutableList<String> outputNames,
    ImmutableList<Integer> writeIndex,
    boolean buildLeft,
    Number limit,
    boolean keepUnmatched) {

  /** The same plan emitting raw values. */
  public JoinPlan withoutFormatters() {
    return new JoinPlan(
        type,
        leftCarried,
        rightCarried,
        leftKeys,
        rightKeys,
        leftKeyFunctions,
        rightKeyFunctions,
        leftRoll,
        rightRoll,
        ImmutableMap.of(),
        ImmutableMap.of(),
        outputNames,
        writeIndex,
        buildLeft,
        limit,
        keepUnmatched);
  }

  /** Match key of a left carried row, null if it never matches. */
  public Object leftKey(Object[] carried) {
    return JoinExecutor.extractJoinKey(carried, leftKeys, leftKeyFunctions);
  }

  /** Match key of a right carried row, null if it never matches. */
  public Object rightKey(Object[] carried) {
    return JoinExecutor.extractJoinKey(carried, rightKeys, rightKeyFunctions);
  }

  public Object[] carryLeft(Object[] row) {
    return carry(row, leftCarried);
  }

  public Object[] carryRight(Object[] row) {
    return carry(row, rightCarried);
  }

  private static Object[] carry(Object[] row, ImmutableList<Integer> slots) {
    Object[] carried = new Object[slots.size()];
    for (int i = 0; i < carried.length; i++) {
      carried[i] = row[slots.get(i)];
    }
    return carried;
  }
}
