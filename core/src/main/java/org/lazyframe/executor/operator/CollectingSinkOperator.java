/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor.operator;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import org.lazyframe.planner.distributed.operator.OperatorContext;
import org.lazyframe.planner.distributed.operator.SinkOperator;
import org.lazyframe.planner.distributed.page.Page;

/** Keeps every received row in memory, in arrival order. */
public class CollectingSinkOperator implements SinkOperator {

  @Getter private final OperatorContext context;
  @Getter private final List<Object[]> rows = new ArrayList<>();
  private boolean done;

  public CollectingSinkOperator(OperatorContext context) {
    this.context = context;
  }

  @Override
  public boolean needsInput() {
    return !done;
  }

  @Override
  public void addInput(Page page) {
    for (int row = 0; row < page.getRowCount(); row++) {
      rows.add(page.getRow(row));
    }
  }

  @Override
  public boolean isFinished() {
    return done;
  }

  @Override
  public void finish() {
    done = true;
  }
}
