/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.sort;

import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Compares raw records key by key on their typed values. The first non-zero comparison decides;
 * nulls sort first unless the key says otherwise.
 */
public class RowComparator implements Comparator<String[]> {

  private final List<SortKey> keys;
  private final List<Function<String, Object>> parsers;

  /**
   * @param spec the sort keys
   * @param parsers parser per record position, null entries keep the text
   */
  public RowComparator(SortSpec spec, List<Function<String, Object>> parsers) {
    this.keys = spec.keys();
    this.parsers = parsers;
  }

  @Override
  public int compare(String[] row1, String[] row2) {
    for (SortKey key : keys) {
      Object v1 = typed(row1, key.fieldIndex());
      Object v2 = typed(row2, key.fieldIndex());

      if (v1 == null && v2 == null) {
        continue;
      }
      if (v1 == null) {
        return key.nullsLast() ? 1 : -1;
      }
      if (v2 == null) {
        return key.nullsLast() ? -1 : 1;
      }

      int cmp = compareValues(v1, v2);
      if (cmp != 0) {
        return key.descending() ? -cmp : cmp;
      }
    }
    return 0;
  }

  /**
   * Orders two non-null values. Numbers compare numerically across boxed types; values that are
   * not mutually comparable fall back to their text.
   */
  @SuppressWarnings("unchecked")
  public static int compareValues(Object v1, Object v2) {
    if (v1 instanceof Number && v2 instanceof Number && v1.getClass() != v2.getClass()) {
      return Double.compare(((Number) v1).doubleValue(), ((Number) v2).doubleValue());
    }
    if (v1 instanceof Comparable && v2 instanceof Comparable) {
      try {
        return ((Comparable<Object>) v1).compareTo(v2);
      } catch (ClassCastException e) {
        return v1.toString().compareTo(v2.toString());
      }
    }
    return v1.toString().compareTo(v2.toString());
  }

  private Object typed(String[] row, int index) {
    if (index >= row.length) {
      return null;
    }
    Function<String, Object> parser = index < parsers.size() ? parsers.get(index) : null;
    return parser == null ? row[index] : parser.apply(row[index]);
  }
}
