/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Ordered column operations of one table. Formatters are not stored here: they are supplied at
 * {@link #finalizeWith(Map)} time and always run after every operation.
 */
public class OperationPipeline {

  private final List<ColumnOperation> operations = new ArrayList<>();

  public void append(ColumnOperation operation) {
    operations.add(operation);
  }

  public List<ColumnOperation> getOperations() {
    return ImmutableList.copyOf(operations);
  }

  public int size() {
    return operations.size();
  }

  /**
   * Builds the frozen operator list: every operation in append order, then one entry per
   * formatter in slot order. The pipeline itself is left untouched.
   *
   * @param formatters formatter per slot
   * @return the finalized operator list
   */
  public FinalizedPipeline finalizeWith(Map<Integer, Function<Object, Object>> formatters) {
    ImmutableList.Builder<ColumnOperation> builder = ImmutableList.builder();
    builder.addAll(operations);
    new TreeMap<>(formatters)
        .forEach((slot, formatter) -> builder.add(ColumnOperation.formatter(slot, formatter)));
    return new FinalizedPipeline(builder.build(), operations.size());
  }
}
