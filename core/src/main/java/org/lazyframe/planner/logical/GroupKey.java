/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.logical;

import java.util.function.Function;

/** A group-by key resolved to a slot. */
public record GroupKey(Function<Object, Object> collation, int slot) {

  public Object extract(Object[] row) {
    return collation.apply(row[slot]);
  }

  public GroupKey withSlot(int newSlot) {
    return new GroupKey(collation, newSlot);
  }
}
