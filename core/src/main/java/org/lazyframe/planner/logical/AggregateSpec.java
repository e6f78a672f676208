/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.logical;

/** One aggregate output: {@code function} over the values of {@code sourceSlot}. */
public record AggregateSpec(AggregateFunction function, int sourceSlot, String newName) {

  public AggregateSpec withSourceSlot(int slot) {
    return new AggregateSpec(function, slot, newName);
  }
}
