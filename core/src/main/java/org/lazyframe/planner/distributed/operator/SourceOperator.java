/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.operator;

import org.lazyframe.planner.distributed.page.Page;

/** Head of a pipeline: reads records from its own input and is never fed pages. */
public interface SourceOperator extends Operator {

  @Override
  default boolean needsInput() {
    return false;
  }

  @Override
  default void addInput(Page page) {
    throw new UnsupportedOperationException(
        getContext().getOperatorId() + " reads its own input and takes no pages");
  }

  @Override
  default void finish() {}
}
