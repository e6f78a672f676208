/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor.operator;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.planner.distributed.operator.OperatorContext;
import org.lazyframe.planner.distributed.page.Page;
import org.lazyframe.planner.distributed.page.PageBuilder;

/** Rebuilds every row from the listed channels, in list order. A channel may be listed twice. */
@Log4j2
public class ProjectionOperator extends BufferedOperator {

  private final ImmutableList<Integer> channels;

  public ProjectionOperator(List<Integer> channels, OperatorContext context) {
    super(context);
    this.channels = ImmutableList.copyOf(channels);
    log.debug("{} keeps channels {}", context.getOperatorId(), channels);
  }

  @Override
  protected Page process(Page page) {
    PageBuilder builder = new PageBuilder(channels.size());
    for (int row = 0; row < page.getRowCount(); row++) {
      Object[] kept = new Object[channels.size()];
      int i = 0;
      for (int channel : channels) {
        kept[i++] = page.getValue(row, channel);
      }
      builder.appendRow(page.getRowId(row), kept);
    }
    return builder.build();
  }
}
