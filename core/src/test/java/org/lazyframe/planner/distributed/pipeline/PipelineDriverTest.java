/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lazyframe.executor.operator.BufferedOperator;
import org.lazyframe.executor.operator.CollectingSinkOperator;
import org.lazyframe.executor.operator.LimitOperator;
import org.lazyframe.executor.operator.ListSourceOperator;
import org.lazyframe.input.SequencedRow;
import org.lazyframe.planner.distributed.operator.OperatorContext;
import org.lazyframe.planner.distributed.page.Page;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PipelineDriverTest {

  // ===== HAPPY PATH =====

  @Test
  void records_reach_the_sink_in_source_pages() {
    // Given: five records read two at a time
    TrackingSink sink = new TrackingSink();
    PipelineDriver driver = new PipelineDriver(source(5, 2), List.of(), sink);

    // When
    driver.run();

    // Then
    assertTrue(driver.isFinished());
    assertEquals(PipelineContext.Status.FINISHED, driver.getContext().getStatus());
    assertEquals(3, driver.getContext().getPagesMoved());
    assertEquals(5, sink.getRows().size());
    assertArrayEquals(new Object[] {"k4", "v4"}, sink.getRows().get(4));
  }

  @Test
  void every_operator_in_the_chain_sees_each_page() {
    CountingOperator first = new CountingOperator("first");
    CountingOperator second = new CountingOperator("second");
    PipelineDriver driver =
        new PipelineDriver(source(3, 3), List.of(first, second), new TrackingSink());

    driver.run();

    assertEquals(1, first.pages);
    assertEquals(1, second.pages);
    assertEquals(3, driver.getContext().getPagesMoved());
  }

  @Test
  void one_page_buffer_loses_nothing() {
    TrackingSink sink = new TrackingSink();

    new PipelineDriver(source(10, 1), List.of(new CountingOperator("buffer")), sink).run();

    assertEquals(10, sink.getRows().size());
  }

  @Test
  void limit_ends_the_run_before_the_source_is_drained() {
    ListSourceOperator source = source(10, 2);
    TrackingSink sink = new TrackingSink();

    new PipelineDriver(
            source, List.of(new LimitOperator(3, OperatorContext.standalone("limit"))), sink)
        .run();

    assertEquals(3, sink.getRows().size());
    assertTrue(sink.isFinished());
  }

  // ===== FAILURE AND CANCELLATION =====

  @Test
  void operator_failure_is_rethrown_after_closing_the_chain() {
    IllegalStateException failure = new IllegalStateException("boom");
    CountingOperator failing =
        new CountingOperator("failing") {
          @Override
          protected Page process(Page page) {
            throw failure;
          }
        };
    TrackingSink sink = new TrackingSink();
    PipelineDriver driver = new PipelineDriver(source(1, 1), List.of(failing), sink);

    IllegalStateException thrown = assertThrows(IllegalStateException.class, driver::run);

    assertSame(failure, thrown);
    assertEquals(PipelineContext.Status.FAILED, driver.getContext().getStatus());
    assertEquals("boom", driver.getContext().getFailureMessage());
    assertTrue(sink.closed);
  }

  @Test
  void cancelled_driver_moves_no_pages() {
    TrackingSink sink = new TrackingSink();
    PipelineDriver driver = new PipelineDriver(source(4, 1), List.of(), sink);
    driver.getContext().cancel();

    driver.run();

    assertEquals(PipelineContext.Status.CANCELLED, driver.getContext().getStatus());
    assertEquals(0, driver.getContext().getPagesMoved());
    assertTrue(sink.getRows().isEmpty());
  }

  private static ListSourceOperator source(int records, int pageSize) {
    List<SequencedRow> rows = new ArrayList<>();
    for (int i = 0; i < records; i++) {
      rows.add(new SequencedRow(i, new String[] {"k" + i, "v" + i}));
    }
    return new ListSourceOperator(rows, 2, new OperatorContext("source", "test", pageSize));
  }

  static class CountingOperator extends BufferedOperator {
    int pages;

    CountingOperator(String id) {
      super(OperatorContext.standalone(id));
    }

    @Override
    protected Page process(Page page) {
      pages++;
      return page;
    }
  }

  static class TrackingSink extends CollectingSinkOperator {
    boolean closed;

    TrackingSink() {
      super(OperatorContext.standalone("sink"));
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
