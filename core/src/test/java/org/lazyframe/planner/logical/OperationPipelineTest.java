/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.logical;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.google.common.collect.ImmutableList;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class OperationPipelineTest {

  @Test
  void finalized_pipeline_runs_operations_before_formatters() {
    OperationPipeline pipeline = new OperationPipeline();
    pipeline.append(ColumnOperation.inPlace(args -> (Integer) args[0] + 1, 0));
    pipeline.append(
        new ColumnOperation(
            args -> (Integer) args[0] * 10, ImmutableList.of(0), 1, true));
    Function<Object, Object> label = v -> "#" + v;

    FinalizedPipeline finalized = pipeline.finalizeWith(Map.of(1, label, 0, label));

    assertEquals(2, finalized.operations().size());
    assertEquals(2, finalized.formatters().size());
    assertEquals(0, finalized.formatters().get(0).outputSlot());

    Object[] row = {1, null};
    finalized.operators().forEach(op -> op.apply(row));
    assertArrayEquals(new Object[] {"#2", "#20"}, row);
  }

  @Test
  void finalizing_does_not_change_the_pipeline() {
    OperationPipeline pipeline = new OperationPipeline();
    pipeline.append(ColumnOperation.inPlace(args -> args[0], 0));

    pipeline.finalizeWith(Map.of(0, v -> v));
    pipeline.finalizeWith(Map.of(0, v -> v));

    assertEquals(1, pipeline.size());
    assertEquals(1, pipeline.finalizeWith(Map.of()).operators().size());
  }

  @Test
  void operation_reads_inputs_in_argument_order() {
    ColumnOperation concat =
        new ColumnOperation(
            args -> args[0] + "-" + args[1],
            ImmutableList.of(2, 0),
            3,
            true);
    Object[] row = {"a", "b", "c", null};

    concat.apply(row);

    assertEquals("c-a", row[3]);
  }
}
