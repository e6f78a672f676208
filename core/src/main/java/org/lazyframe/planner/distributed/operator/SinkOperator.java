/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.operator;

import org.lazyframe.planner.distributed.page.Page;

/** Tail of a pipeline. Keeps or writes what it receives; nothing flows out of it. */
public interface SinkOperator extends Operator {

  @Override
  default Page getOutput() {
    return null;
  }
}
