/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor;

/** Shape of an execution plan. */
public enum PlanKind {
  /** Row-by-row transform of one table. */
  ROW,
  /** Aggregates over the whole table, one output row. */
  AGGREGATE,
  /** Group-by keys with aggregates. */
  GROUP_AGGREGATE,
  /** Join of two tables. */
  JOIN
}
