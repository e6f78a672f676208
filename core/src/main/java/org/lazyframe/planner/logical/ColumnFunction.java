/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.logical;

/** A user function over the values of one or more columns of a row. */
@FunctionalInterface
public interface ColumnFunction {

  Object apply(Object... args);
}
