/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.local.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lazyframe.exception.OperationException;
import org.lazyframe.executor.FailedPartition;
import org.lazyframe.input.SequencedRow;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class FailureCollectorTest {

  @Test
  void failures_are_collected_in_row_order() {
    FailureCollector collector = new FailureCollector(false);

    assertNull(collector.guard(batch("scan-0/batch-12", 120, 129), this::broken));
    assertNull(collector.guard(batch("scan-0/batch-2", 20, 29), this::broken));
    assertEquals("ok", collector.guard(batch("scan-0/batch-3", 30, 39), () -> "ok"));

    List<FailedPartition> failures = collector.getFailures();
    assertEquals(2, failures.size());
    assertEquals(new FailedPartition("scan-0/batch-2", 20, 29, "broken"), failures.get(0));
    assertEquals("scan-0/batch-12", failures.get(1).partitionId());
  }

  @Test
  void failure_is_raised_with_its_partition() {
    FailureCollector collector = new FailureCollector(true);

    Batch batch = batch("scan-1/batch-0", 0, 0);

    OperationException e =
        assertThrows(OperationException.class, () -> collector.guard(batch, this::broken));
    assertEquals("Error in partition scan-1/batch-0 (original error: broken)", e.getMessage());
  }

  private String broken() {
    throw new IllegalArgumentException("broken");
  }

  private static Batch batch(String id, long first, long last) {
    return new Batch(
        id,
        List.of(new SequencedRow(first, new String[0]), new SequencedRow(last, new String[0])));
  }
}
