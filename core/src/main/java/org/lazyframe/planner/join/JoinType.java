/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.join;

/** Supported join kinds. */
public enum JoinType {
  INNER,
  LEFT,
  /** Planned as a left join with the two sides and their prefixes swapped. */
  RIGHT,
  /** Nearest right row whose roll value is greater than or equal to the left one. */
  ASOF_FORWARD,
  /** Nearest right row whose roll value is less than or equal to the left one. */
  ASOF_BACKWARD;

  public boolean isAsOf() {
    return this == ASOF_FORWARD || this == ASOF_BACKWARD;
  }

  /** True if unmatched rows of the probe (left) side are kept null-padded. */
  public boolean keepsUnmatchedLeft() {
    return this == LEFT || this == RIGHT;
  }
}
