/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.local.executor;

import java.util.List;
import org.lazyframe.input.SequencedRow;

/**
 * Consecutive records of one input handed to a worker.
 *
 * @param partitionId stable id such as {@code scan-0/batch-3}
 * @param rows records in file order
 */
record Batch(String partitionId, List<SequencedRow> rows) {

  long firstRowId() {
    return rows.isEmpty() ? -1 : rows.get(0).id();
  }

  long lastRowId() {
    return rows.isEmpty() ? -1 : rows.get(rows.size() - 1).id();
  }
}
