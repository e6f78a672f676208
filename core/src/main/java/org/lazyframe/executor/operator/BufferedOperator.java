/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor.operator;

import com.google.common.base.Preconditions;
import lombok.Getter;
import org.lazyframe.planner.distributed.operator.Operator;
import org.lazyframe.planner.distributed.operator.OperatorContext;
import org.lazyframe.planner.distributed.page.Page;

/**
 * Operator that holds at most one produced page until the next operator takes it. Subclasses map
 * an input page in {@link #process(Page)} and may emit a last page from {@link #flush()} when
 * their input ends.
 */
public abstract class BufferedOperator implements Operator {

  @Getter private final OperatorContext context;
  private Page ready;
  private boolean inputDone;

  protected BufferedOperator(OperatorContext context) {
    this.context = context;
  }

  /** Returns the page to hand downstream for {@code page}, or null if nothing comes out. */
  protected abstract Page process(Page page);

  /** Returns a page to emit once input has ended, or null. */
  protected Page flush() {
    return null;
  }

  /** True once the operator wants no further rows, whatever upstream still has. */
  protected boolean saturated() {
    return false;
  }

  @Override
  public boolean needsInput() {
    return ready == null && !inputDone && !saturated() && !context.isCancelled();
  }

  @Override
  public void addInput(Page page) {
    Preconditions.checkState(
        ready == null, "%s still holds an unread page", context.getOperatorId());
    if (!context.isCancelled() && !saturated()) {
      ready = process(page);
    }
  }

  @Override
  public Page getOutput() {
    Page out = ready;
    ready = null;
    return out;
  }

  @Override
  public boolean isFinished() {
    return ready == null && (inputDone || saturated());
  }

  @Override
  public void finish() {
    if (!inputDone) {
      inputDone = true;
      if (ready == null) {
        ready = flush();
      }
    }
  }
}
