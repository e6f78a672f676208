/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.pipeline;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.planner.distributed.operator.Operator;
import org.lazyframe.planner.distributed.operator.SinkOperator;
import org.lazyframe.planner.distributed.operator.SourceOperator;
import org.lazyframe.planner.distributed.page.Page;

/**
 * Runs a chain of source, operators and sink on the calling thread. Each round walks the chain
 * once and moves at most one page over every link, and only into an operator that asks for input,
 * so nothing is dropped. The run ends when the sink is finished. An operator failure is rethrown
 * as is, after every operator has been closed.
 */
@Log4j2
public class PipelineDriver {

  private final List<Operator> chain;
  @Getter private final PipelineContext context = new PipelineContext();

  public PipelineDriver(SourceOperator source, List<Operator> operators, SinkOperator sink) {
    this.chain =
        ImmutableList.<Operator>builder().add(source).addAll(operators).add(sink).build();
  }

  public void run() {
    context.start();
    try {
      while (!isFinished() && !context.isCancelRequested()) {
        if (!round() && !isFinished()) {
          Thread.yield();
        }
      }
      context.complete();
    } catch (RuntimeException e) {
      context.fail(e.getMessage());
      throw e;
    } finally {
      closeAll();
    }
  }

  /** One pass over the chain. Returns whether any page moved or any operator was finished. */
  boolean round() {
    boolean progressed = false;
    for (int i = 1; i < chain.size(); i++) {
      Operator upstream = chain.get(i - 1);
      Operator downstream = chain.get(i);
      if (downstream.needsInput()) {
        Page page = upstream.getOutput();
        if (page != null && page.getRowCount() > 0) {
          downstream.addInput(page);
          context.pageMoved();
          progressed = true;
        }
      }
      if (upstream.isFinished() && !downstream.isFinished()) {
        downstream.finish();
        progressed = true;
      }
    }
    return progressed;
  }

  public boolean isFinished() {
    return chain.get(chain.size() - 1).isFinished();
  }

  private void closeAll() {
    for (Operator operator : chain) {
      try {
        operator.close();
      } catch (Exception e) {
        log.warn("Failed to close operator {}", operator.getContext().getOperatorId(), e);
      }
    }
  }
}
