/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Immutable operator list produced by {@link OperationPipeline#finalizeWith}. The first {@code
 * operationCount} entries are user operations, the rest are formatters.
 */
public record FinalizedPipeline(ImmutableList<ColumnOperation> operators, int operationCount) {

  public List<ColumnOperation> operations() {
    return operators.subList(0, operationCount);
  }

  public List<ColumnOperation> formatters() {
    return operators.subList(operationCount, operators.size());
  }
}
