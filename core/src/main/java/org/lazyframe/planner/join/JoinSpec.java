/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.join;

import com.google.common.collect.ImmutableList;
import org.lazyframe.catalog.ColumnCatalog;
import org.lazyframe.planner.logical.KeyRef;

/**
 * Validated description of a join, sides already in output order. For {@link JoinType#RIGHT} the
 * caller's right table is {@code left} here.
 *
 * @param type join kind
 * @param left catalog of the left side
 * @param right catalog of the right side
 * @param leftSize byte size of the left file
 * @param rightSize byte size of the right file
 * @param leftKeys key columns of the left side, each with the function applied before matching
 * @param rightKeys key columns of the right side, pairwise with {@code leftKeys}
 * @param leftRoll roll column of the left side, as-of joins only
 * @param rightRoll roll column of the right side, as-of joins only
 * @param limit maximum roll distance of an as-of match, or null
 * @param keepUnmatched whether unmatched as-of rows are kept null-padded
 * @param prefixes output name prefix of each side
 */
public record JoinSpec(
    JoinType type,
    ColumnCatalog left,
    ColumnCatalog right,
    long leftSize,
    long rightSize,
    ImmutableList<KeyRef> leftKeys,
    ImmutableList<KeyRef> rightKeys,
    String leftRoll,
    String rightRoll,
    Number limit,
    boolean keepUnmatched,
    ImmutableList<String> prefixes) {}
