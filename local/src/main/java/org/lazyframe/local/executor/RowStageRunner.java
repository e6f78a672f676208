/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.local.executor;

import java.util.ArrayList;
import java.util.List;
import org.lazyframe.executor.ExecutionPlan;
import org.lazyframe.executor.RowTransform;
import org.lazyframe.executor.TableSource;
import org.lazyframe.input.SequencedRow;
import org.lazyframe.planner.distributed.stage.ComputeStage;

/** Scan and write: each batch is evaluated independently and projected onto the output slots. */
class RowStageRunner implements StageRunner {

  private final ParallelScanner scanner;

  RowStageRunner(ParallelScanner scanner) {
    this.scanner = scanner;
  }

  @Override
  public void run(ExecutionPlan plan, CsvOutputWriter writer) {
    ComputeStage scan = plan.getStages().getLeafStages().get(0);
    TableSource source = plan.getSources().get(scan.getTableIndex());
    List<Integer> slots = plan.getOutputSlots();
    scanner.scan(
        source,
        scan.getStageId(),
        batch -> evaluate(source.transform(), slots, batch),
        writer::writeAll,
        plan.getOptions().isPreserveOrder());
  }

  static List<Object[]> evaluate(RowTransform transform, List<Integer> slots, Batch batch) {
    List<Object[]> out = new ArrayList<>(batch.rows().size());
    for (SequencedRow record : batch.rows()) {
      Object[] row = transform.apply(record.values());
      if (row != null) {
        Object[] projected = new Object[slots.size()];
        for (int i = 0; i < projected.length; i++) {
          projected[i] = row[slots.get(i)];
        }
        out.add(projected);
      }
    }
    return out;
  }
}
