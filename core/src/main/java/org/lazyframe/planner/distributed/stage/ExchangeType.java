/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.stage;

/** How rows leave a compute stage. */
public enum ExchangeType {
  /** All rows flow to the single output writer. */
  GATHER,

  /** Rows are split into partitions by the hash of some carried columns. */
  HASH_REPARTITION,

  /** No exchange: the next stage consumes the output in place. */
  NONE
}
