/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor.operator;

import java.util.Arrays;
import java.util.List;
import org.lazyframe.input.SequencedRow;
import org.lazyframe.planner.distributed.operator.OperatorContext;
import org.lazyframe.planner.distributed.operator.SourceOperator;
import org.lazyframe.planner.distributed.page.Page;
import org.lazyframe.planner.distributed.page.PageBuilder;

/**
 * Emits raw records in pages of the context's page size. Records are padded or cut to {@code
 * width} so every page row has the file's column count.
 */
public class ListSourceOperator implements SourceOperator {

  private final List<SequencedRow> records;
  private final int width;
  private final OperatorContext context;
  private int position;

  public ListSourceOperator(List<SequencedRow> records, int width, OperatorContext context) {
    this.records = records;
    this.width = width;
    this.context = context;
  }

  @Override
  public Page getOutput() {
    if (isFinished()) {
      return null;
    }
    PageBuilder builder = new PageBuilder(width);
    int end = Math.min(records.size(), position + context.getPageSize());
    for (; position < end; position++) {
      SequencedRow record = records.get(position);
      builder.appendRow(record.id(), Arrays.copyOf(record.values(), width, Object[].class));
    }
    return builder.build();
  }

  @Override
  public boolean isFinished() {
    return position >= records.size() || context.isCancelled();
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }
}
