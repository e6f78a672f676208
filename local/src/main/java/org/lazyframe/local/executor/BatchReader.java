/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.local.executor;

import java.util.ArrayList;
import java.util.List;
import org.lazyframe.executor.TableSource;
import org.lazyframe.input.CsvRowSource;
import org.lazyframe.input.RowReader;
import org.lazyframe.input.SequencedRow;

/** Splits one input into batches of at most {@code batchSize} records, read lazily. */
class BatchReader implements AutoCloseable {

  private final String stageId;
  private final int batchSize;
  private final RowReader reader;
  private int batchCount;

  BatchReader(TableSource source, String stageId) {
    this.stageId = stageId;
    this.batchSize = Math.max(1, source.batchSize());
    this.reader = new CsvRowSource(source.path(), source.haveHeader()).open(0, false);
  }

  /** Next batch, or null once the input is exhausted. */
  Batch next() {
    List<SequencedRow> rows = new ArrayList<>(batchSize);
    SequencedRow row;
    while (rows.size() < batchSize && (row = reader.poll()) != null) {
      rows.add(row);
    }
    if (rows.isEmpty()) {
      return null;
    }
    return new Batch(stageId + "/batch-" + batchCount++, rows);
  }

  int getBatchCount() {
    return batchCount;
  }

  @Override
  public void close() {
    reader.close();
  }
}
