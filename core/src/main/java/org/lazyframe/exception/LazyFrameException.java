/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.exception;

/** Base class of every error raised by the engine. */
public class LazyFrameException extends RuntimeException {

  public LazyFrameException(String message) {
    super(message);
  }

  public LazyFrameException(String message, Throwable cause) {
    super(message, cause);
  }
}
