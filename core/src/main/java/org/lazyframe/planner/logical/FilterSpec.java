/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.logical;

import com.google.common.collect.ImmutableList;

/** A predicate bound to the slots it reads. */
public record FilterSpec(ImmutableList<Integer> slots, RowPredicate predicate) {

  public boolean test(Object[] row) {
    Object[] values = new Object[slots.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = row[slots.get(i)];
    }
    return predicate.test(values);
  }
}
