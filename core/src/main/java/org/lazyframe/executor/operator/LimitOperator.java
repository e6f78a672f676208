/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor.operator;

import org.lazyframe.planner.distributed.operator.OperatorContext;
import org.lazyframe.planner.distributed.page.Page;

/** Lets the first {@code limit} rows through; the page crossing the limit is cut. */
public class LimitOperator extends BufferedOperator {

  private final int limit;
  private int passed;

  public LimitOperator(int limit, OperatorContext context) {
    super(context);
    this.limit = limit;
  }

  @Override
  protected Page process(Page page) {
    int take = Math.min(page.getRowCount(), limit - passed);
    passed += take;
    return take == page.getRowCount() ? page : page.slice(0, take);
  }

  @Override
  protected boolean saturated() {
    return passed >= limit;
  }
}
