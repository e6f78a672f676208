/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.exception;

/**
 * Raised synchronously while a plan is being built: unknown column names, type or argument
 * mismatches, malformed sort specifications, illegal worker counts and conflicting options.
 */
public class SchemaException extends LazyFrameException {

  public SchemaException(String message) {
    super(message);
  }
}
