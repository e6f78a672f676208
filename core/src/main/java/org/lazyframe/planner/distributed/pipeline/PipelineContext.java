/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.pipeline;

import lombok.Getter;

/** Progress of one {@link PipelineDriver} run. Cancellation may come from any thread. */
@Getter
public class PipelineContext {

  public enum Status {
    CREATED,
    RUNNING,
    FINISHED,
    FAILED,
    CANCELLED
  }

  private volatile Status status = Status.CREATED;
  private volatile boolean cancelRequested;
  private volatile String failureMessage;
  /** Pages handed from one operator to the next. */
  private volatile long pagesMoved;

  /** Asks the driver to stop after the current round. */
  public void cancel() {
    cancelRequested = true;
  }

  void start() {
    status = Status.RUNNING;
  }

  void complete() {
    status = cancelRequested ? Status.CANCELLED : Status.FINISHED;
  }

  void fail(String message) {
    status = Status.FAILED;
    failureMessage = message;
  }

  void pageMoved() {
    pagesMoved++;
  }
}
