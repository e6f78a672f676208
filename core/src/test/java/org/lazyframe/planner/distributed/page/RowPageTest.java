/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.page;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class RowPageTest {

  @Test
  void should_create_page_with_rows_and_columns() {
    Object[][] data = {
      {"X", 100, 1000.0},
      {"Y", 50, 2000.0}
    };
    RowPage page = new RowPage(data, new long[] {0, 1}, 3);

    assertEquals(2, page.getRowCount());
    assertEquals(3, page.getWidth());
  }

  @Test
  void should_access_values_and_row_ids_by_position() {
    Object[][] data = {
      {"X", 100},
      {"Y", 50}
    };
    RowPage page = new RowPage(data, new long[] {7, 9}, 2);

    assertEquals("X", page.getValue(0, 0));
    assertEquals(50, page.getValue(1, 1));
    assertEquals(9L, page.getRowId(1));
    assertArrayEquals(new Object[] {"Y", 50}, page.getRow(1));
  }

  @Test
  void should_handle_null_values() {
    Object[][] data = {{null, 30, null}};
    RowPage page = new RowPage(data, new long[] {0}, 3);

    assertNull(page.getValue(0, 0));
    assertEquals(30, page.getValue(0, 1));
    assertNull(page.getValue(0, 2));
  }

  @Test
  void should_keep_row_ids_in_sub_region() {
    Object[][] data = {{"a"}, {"b"}, {"c"}, {"d"}};
    RowPage page = new RowPage(data, new long[] {10, 11, 12, 13}, 1);

    Page region = page.slice(1, 2);
    assertEquals(2, region.getRowCount());
    assertEquals("b", region.getValue(0, 0));
    assertEquals(12L, region.getRowId(1));
  }

  @Test
  void should_create_empty_page() {
    Page empty = Page.empty(3);
    assertEquals(0, empty.getRowCount());
    assertEquals(3, empty.getWidth());
  }

  @Test
  void should_reject_mismatched_row_ids() {
    Object[][] data = {{"a"}, {"b"}};
    assertThrows(IllegalArgumentException.class, () -> new RowPage(data, new long[] {0}, 1));
  }

  @Test
  void should_throw_on_invalid_position_or_channel() {
    RowPage page = new RowPage(new Object[][] {{"a", 1}}, new long[] {0}, 2);

    assertThrows(IndexOutOfBoundsException.class, () -> page.getValue(1, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> page.getValue(0, 2));
    assertThrows(IndexOutOfBoundsException.class, () -> page.getRowId(-1));
    assertThrows(IndexOutOfBoundsException.class, () -> page.slice(0, 2));
  }
}
