/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.frame;

import java.util.UUID;
import org.lazyframe.exception.LazyFrameException;
import org.lazyframe.exception.OperationException;
import org.lazyframe.executor.ExecutionBackend;
import org.lazyframe.executor.ExecutionPlan;
import org.lazyframe.executor.ExecutionResult;

final class FrameSupport {

  private FrameSupport() {}

  static String newPlanId() {
    return "plan-" + UUID.randomUUID();
  }

  /** Runs a plan, surfacing unexpected backend failures with their original message. */
  static ExecutionResult execute(ExecutionBackend backend, ExecutionPlan plan) {
    try {
      return backend.execute(plan);
    } catch (LazyFrameException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new OperationException(
          String.format("Error in computing (original error: %s)", e.getMessage()), e);
    }
  }
}
