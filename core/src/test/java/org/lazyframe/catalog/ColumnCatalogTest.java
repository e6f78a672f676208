/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lazyframe.exception.OperationException;
import org.lazyframe.exception.SchemaException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ColumnCatalogTest {

  private ColumnCatalog catalog;

  @BeforeEach
  void setUp() {
    catalog = ColumnCatalog.of(List.of("Employee", "Department", "Salary"));
  }

  // ===== CONSTRUCTION =====

  @Test
  void new_catalog_exposes_header_in_file_order() {
    assertEquals(List.of("Employee", "Department", "Salary"), catalog.getColNames());
    assertEquals(List.of(0, 1, 2), catalog.getColIndex());
    assertEquals(3, catalog.getSourceWidth());
    assertEquals(ColumnType.STRING, catalog.typeOf(2));
  }

  @Test
  void duplicate_header_names_are_rejected() {
    assertThrows(SchemaException.class, () -> ColumnCatalog.of(List.of("a", "b", "a")));
  }

  @Test
  void headerless_catalog_names_columns_from_one() {
    ColumnCatalog generated = ColumnCatalog.generated(3, ColumnCatalog.DEFAULT_DATE_PATTERN);
    assertEquals(List.of("Col_1", "Col_2", "Col_3"), generated.getColNames());
  }

  @Test
  void unknown_names_are_reported_together() {
    SchemaException e =
        assertThrows(SchemaException.class, () -> catalog.resolveAll(List.of("Salary", "x", "y")));
    assertTrue(e.getMessage().startsWith("Input includes non-existent column name(s)"));
    assertTrue(e.getMessage().contains("x"));
    assertTrue(e.getMessage().contains("y"));
  }

  // ===== DERIVED COLUMNS =====

  @Test
  void new_column_takes_the_next_slot_and_joins_the_live_columns() {
    int slot = catalog.operate(args -> args[0], List.of("Salary"), "Bonus");

    assertEquals(3, slot);
    assertEquals(List.of("Employee", "Department", "Salary", "Bonus"), catalog.getColNames());
    assertEquals(4, catalog.getSlotCount());
    assertFalse(catalog.isFileBacked(slot));
    assertEquals(1, catalog.getOperations().size());
  }

  @Test
  void new_column_is_placed_before_tombstones() {
    catalog.delCol(List.of("Department"));
    catalog.operate(args -> args[0], List.of("Salary"), "Bonus");

    assertEquals(List.of("Employee", "Salary", "Bonus"), catalog.getColNames());
    assertEquals(List.of(0, 2, 3), catalog.getColIndex());
  }

  @Test
  void new_column_must_not_reuse_a_live_name() {
    assertThrows(
        SchemaException.class,
        () -> catalog.operate(args -> args[0], List.of("Salary"), "Employee"));
  }

  @Test
  void operating_on_a_deleted_column_fails() {
    catalog.delCol(List.of("Salary"));
    assertThrows(OperationException.class, () -> catalog.operate(args -> args[0], "Salary"));
  }

  // ===== DELETE / REORDER / RENAME =====

  @Test
  void deleted_columns_keep_their_slots() {
    catalog.delCol(List.of("Employee"));

    assertEquals(List.of("Department", "Salary"), catalog.getColNames());
    assertEquals(List.of(1, 2), catalog.getColIndex());
    assertTrue(catalog.isDeleted(0));
    assertEquals(3, catalog.getSlotCount());
    assertFalse(catalog.contains("Employee"));
  }

  @Test
  void reorder_requires_exactly_the_live_names() {
    catalog.reorderCol(List.of("Salary", "Employee", "Department"));
    assertEquals(List.of(2, 0, 1), catalog.getColIndex());

    assertThrows(SchemaException.class, () -> catalog.reorderCol(List.of("Salary", "Employee")));
    assertThrows(
        SchemaException.class,
        () -> catalog.reorderCol(List.of("Salary", "Salary", "Employee", "Department")));
  }

  @Test
  void rename_is_positional_over_live_columns() {
    catalog.delCol(List.of("Department"));
    catalog.renameCol(List.of("Name", "Pay"));

    assertEquals(List.of("Name", "Pay"), catalog.getColNames());
    assertEquals(2, catalog.resolve("Pay"));
    assertThrows(SchemaException.class, () -> catalog.renameCol(List.of("a")));
    assertThrows(SchemaException.class, () -> catalog.renameCol(List.of("a", "a")));
  }

  // ===== TYPES =====

  @Test
  void set_type_on_file_column_installs_parser() {
    catalog.setType("int", "Salary");

    assertEquals(ColumnType.INT, catalog.typeOf(2));
    assertEquals(100, catalog.parserOf(2).apply("100"));
    assertNull(catalog.parserOf(2).apply(" "));
  }

  @Test
  void set_type_on_derived_column_appends_a_conversion() {
    catalog.operate(args -> args[0], List.of("Salary"), "Copy");
    catalog.setType("double", "Copy");

    assertEquals(2, catalog.getOperations().size());
    assertEquals(ColumnType.DOUBLE, catalog.typeOf(3));
  }

  @Test
  void set_parser_marks_column_raw() {
    catalog.setParser(String::length, "Employee");

    assertEquals(ColumnType.RAW, catalog.typeOf(0));
    assertEquals(3, catalog.parserOf(0).apply("abc"));
  }

  @Test
  void formatters_of_deleted_columns_are_dropped() {
    catalog.setType("date", "Employee");
    catalog.setFormatter(v -> v, "Salary");
    catalog.delCol(List.of("Employee"));

    assertEquals(List.of(2), new ArrayList<>(catalog.getFormatters().keySet()));
  }

  // ===== RANDOMIZED =====

  @Test
  void col_index_stays_dense_and_consistent_under_random_mutations() {
    Random random = new Random(42);
    List<String> header = new ArrayList<>();
    for (int i = 0; i < 12; i++) {
      header.add("c" + i);
    }
    ColumnCatalog random12 = ColumnCatalog.of(header);
    int created = 0;
    for (int step = 0; step < 200; step++) {
      List<String> live = new ArrayList<>(random12.getColNames());
      switch (random.nextInt(4)) {
        case 0:
          random12.operate(args -> args[0], List.of(live.get(0)), "n" + created++);
          break;
        case 1:
          if (live.size() > 2) {
            random12.delCol(List.of(live.get(random.nextInt(live.size()))));
          }
          break;
        case 2:
          Collections.shuffle(live, random);
          random12.reorderCol(live);
          break;
        default:
          random12.renameCol(
              live.stream()
                  .map(n -> n.endsWith("'") ? n.replace("'", "") : n + "'")
                  .collect(Collectors.toList()));
          break;
      }

      List<Integer> index = random12.getColIndex();
      List<String> names = random12.getColNames();
      assertEquals(index.size(), new HashSet<>(index).size());
      assertEquals(names.size(), new HashSet<>(names).size());
      for (int i = 0; i < index.size(); i++) {
        assertFalse(random12.isDeleted(index.get(i)));
        assertEquals(index.get(i).intValue(), random12.resolve(names.get(i)));
      }
      long liveSlots =
          IntStream.range(0, random12.getSlotCount())
              .filter(s -> !random12.isDeleted(s))
              .count();
      assertEquals(liveSlots, index.size());
    }
  }
}
