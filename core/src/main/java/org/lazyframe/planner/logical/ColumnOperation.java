/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.function.Function;

/**
 * One entry of an {@link OperationPipeline}: reads {@code inputSlots} of the evaluated row and
 * writes the result to {@code outputSlot}.
 *
 * @param function the user function
 * @param inputSlots slots passed to the function, in argument order
 * @param outputSlot slot receiving the result
 * @param newColumn true if {@code outputSlot} was created by this entry
 */
public record ColumnOperation(
    ColumnFunction function, ImmutableList<Integer> inputSlots, int outputSlot, boolean newColumn) {

  public static ColumnOperation inPlace(ColumnFunction function, int slot) {
    return new ColumnOperation(function, ImmutableList.of(slot), slot, false);
  }

  /** Wraps a single-value formatter as an in-place entry. */
  public static ColumnOperation formatter(int slot, Function<Object, Object> formatter) {
    return inPlace(args -> formatter.apply(args[0]), slot);
  }

  public void apply(Object[] row) {
    Object[] args = new Object[inputSlots.size()];
    for (int i = 0; i < args.length; i++) {
      args[i] = row[inputSlots.get(i)];
    }
    row[outputSlot] = function.apply(args);
  }
}
