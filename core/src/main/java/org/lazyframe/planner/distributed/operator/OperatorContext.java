/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.operator;

import java.util.concurrent.atomic.AtomicBoolean;
import lombok.AccessLevel;
import lombok.Getter;

/** Names an operator within its stage, bounds its page size and carries a cancellation flag. */
@Getter
public class OperatorContext {

  /** Rows per page when an operator runs outside a planned stage. */
  public static final int DEFAULT_PAGE_SIZE = 300;

  private final String operatorId;
  private final String stageId;
  private final int pageSize;

  @Getter(AccessLevel.NONE)
  private final AtomicBoolean cancelled = new AtomicBoolean();

  public OperatorContext(String operatorId, String stageId, int pageSize) {
    this.operatorId = operatorId;
    this.stageId = stageId;
    this.pageSize = pageSize;
  }

  /** Context for an operator run on its own, as previews do. */
  public static OperatorContext standalone(String operatorId) {
    return new OperatorContext(operatorId, "preview", DEFAULT_PAGE_SIZE);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public void cancel() {
    cancelled.set(true);
  }
}
