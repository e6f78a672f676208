/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.operator;

import org.lazyframe.planner.distributed.page.Page;

/**
 * One step of a row pipeline, driven by a {@link
 * org.lazyframe.planner.distributed.pipeline.PipelineDriver}. The driver hands a page in while
 * {@link #needsInput()} holds, takes pages out with {@link #getOutput()}, calls {@link #finish()}
 * once upstream is exhausted and keeps draining until {@link #isFinished()}. Operators that
 * buffer, such as grouping, emit on {@code finish}.
 */
public interface Operator extends AutoCloseable {

  boolean needsInput();

  /** Accepts one page. Only called while {@link #needsInput()} is true. */
  void addInput(Page page);

  /** Next page ready for downstream, or null when nothing is ready right now. */
  Page getOutput();

  boolean isFinished();

  /** Upstream has no more pages; buffered rows should now be released. */
  void finish();

  OperatorContext getContext();

  @Override
  default void close() {}
}
