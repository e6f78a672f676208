/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.catalog;

import java.util.Arrays;
import java.util.Optional;

/** Declared type of a column. {@link #RAW} marks a column parsed by a user-supplied function. */
public enum ColumnType {
  INT("int"),
  DOUBLE("double"),
  STRING("string"),
  DATE("date"),
  RAW("raw");

  private final String tag;

  ColumnType(String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }

  public static Optional<ColumnType> fromTag(String tag) {
    return Arrays.stream(values()).filter(t -> t.tag.equals(tag)).findFirst();
  }

  public boolean isNumeric() {
    return this == INT || this == DOUBLE;
  }

  /**
   * Returns true if values of the two types can be ordered against each other. Raw columns are
   * not checked, their parser decides.
   */
  public boolean isComparableWith(ColumnType other) {
    if (this == RAW || other == RAW) {
      return true;
    }
    if (isNumeric()) {
      return other.isNumeric();
    }
    return this == other;
  }
}
