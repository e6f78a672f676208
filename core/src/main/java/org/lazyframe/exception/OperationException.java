/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.exception;

/**
 * Raised when an operator cannot be appended to the pipeline, or when a preview or a full
 * evaluation fails at runtime. The originating exception is kept as the cause.
 */
public class OperationException extends LazyFrameException {

  public OperationException(String message) {
    super(message);
  }

  public OperationException(String message, Throwable cause) {
    super(message, cause);
  }
}
