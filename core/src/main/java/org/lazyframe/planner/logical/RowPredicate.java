/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.logical;

/** A filter condition over the values of one or more columns. */
@FunctionalInterface
public interface RowPredicate {

  boolean test(Object... values);
}
