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

import java.time.LocalDate;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lazyframe.exception.SchemaException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ColumnTypesTest {

  @Test
  void int_and_double_parse_trimmed_text() {
    assertEquals(42, ColumnTypes.resolve("int", "yyyy-MM-dd").parser().apply(" 42 "));
    assertEquals(2.5, ColumnTypes.resolve("double", "yyyy-MM-dd").parser().apply("2.5"));
  }

  @Test
  void blank_text_parses_to_null() {
    assertNull(ColumnTypes.resolve("int", "yyyy-MM-dd").parser().apply(""));
    assertNull(ColumnTypes.resolve("date", "yyyy-MM-dd").parser().apply("  "));
  }

  @Test
  void date_uses_default_pattern_unless_one_is_given() {
    TypeBinding byDefault = ColumnTypes.resolve("date", "yyyy-MM-dd");
    TypeBinding custom = ColumnTypes.resolve("date:dd/MM/yyyy", "yyyy-MM-dd");

    assertEquals(LocalDate.of(2021, 3, 4), byDefault.parser().apply("2021-03-04"));
    assertEquals(LocalDate.of(2021, 3, 4), custom.parser().apply("04/03/2021"));
    assertEquals("04/03/2021", custom.formatter().apply(LocalDate.of(2021, 3, 4)));
  }

  @Test
  void malformed_number_fails_when_parsed() {
    TypeBinding binding = ColumnTypes.resolve("int", "yyyy-MM-dd");
    assertThrows(NumberFormatException.class, () -> binding.parser().apply("abc"));
  }

  @Test
  void unknown_tag_suggests_a_parser() {
    SchemaException e =
        assertThrows(SchemaException.class, () -> ColumnTypes.resolve("decimal", "yyyy-MM-dd"));
    assertTrue(e.getMessage().contains("setParser"));
  }

  @Test
  void raw_has_no_built_in_parser() {
    assertThrows(SchemaException.class, () -> ColumnTypes.resolve("raw", "yyyy-MM-dd"));
  }

  @Test
  void numeric_types_are_mutually_comparable() {
    assertTrue(ColumnType.INT.isComparableWith(ColumnType.DOUBLE));
    assertTrue(ColumnType.RAW.isComparableWith(ColumnType.DATE));
    assertFalse(ColumnType.DATE.isComparableWith(ColumnType.INT));
  }
}
