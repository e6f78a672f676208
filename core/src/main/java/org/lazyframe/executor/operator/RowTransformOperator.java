/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor.operator;

import java.util.Arrays;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.executor.RowTransform;
import org.lazyframe.planner.distributed.operator.OperatorContext;
import org.lazyframe.planner.distributed.page.Page;
import org.lazyframe.planner.distributed.page.PageBuilder;

/** Turns raw records into slot-indexed rows. Rows rejected by a filter are left out. */
@Log4j2
public class RowTransformOperator extends BufferedOperator {

  private final RowTransform transform;

  public RowTransformOperator(RowTransform transform, OperatorContext context) {
    super(context);
    this.transform = transform;
  }

  @Override
  protected Page process(Page page) {
    PageBuilder builder = new PageBuilder(transform.getSlotCount());
    for (int row = 0; row < page.getRowCount(); row++) {
      Object[] raw = page.getRow(row);
      Object[] evaluated = transform.apply(Arrays.copyOf(raw, raw.length, String[].class));
      if (evaluated != null) {
        builder.appendRow(page.getRowId(row), evaluated);
      }
    }
    log.debug(
        "{}: {} of {} record(s) kept",
        getContext().getOperatorId(),
        builder.getRowCount(),
        page.getRowCount());
    return builder.build();
  }
}
