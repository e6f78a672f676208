/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.sort;

/** Represents a sort key with column name, record position, direction, and null ordering. */
public record SortKey(String fieldName, int fieldIndex, boolean descending, boolean nullsLast) {}
