/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lazyframe.exception.SchemaException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ComputeOptionsTest {

  private static final List<String> SCHEMA = List.of("a", "b", "c");

  @Test
  void defaults_are_one_worker_in_order_without_raising() {
    ComputeOptions options = ComputeOptions.builder().outputPath(Paths.get("out.csv")).build();

    assertEquals(1, options.getNumWorkers());
    assertTrue(options.isPreserveOrder());
    assertFalse(options.isRaiseOnError());
    assertDoesNotThrow(() -> options.validate(8));
  }

  @Test
  void too_many_workers_are_rejected() {
    ComputeOptions options =
        ComputeOptions.builder().numWorkers(9).outputPath(Paths.get("out.csv")).build();

    SchemaException e = assertThrows(SchemaException.class, () -> options.validate(8));
    assertEquals("Max number of worker nodes is 8.", e.getMessage());
  }

  @Test
  void configured_maximum_cannot_lift_the_worker_limit() {
    ComputeOptions options =
        ComputeOptions.builder().numWorkers(12).outputPath(Paths.get("out.csv")).build();

    SchemaException e = assertThrows(SchemaException.class, () -> options.validate(16));
    assertEquals("Max number of worker nodes is 8.", e.getMessage());
  }

  @Test
  void configured_maximum_can_lower_the_worker_limit() {
    ComputeOptions options =
        ComputeOptions.builder().numWorkers(3).outputPath(Paths.get("out.csv")).build();

    SchemaException e = assertThrows(SchemaException.class, () -> options.validate(2));
    assertEquals("Max number of worker nodes is 2.", e.getMessage());
  }

  @Test
  void non_positive_workers_are_rejected() {
    ComputeOptions options =
        ComputeOptions.builder().numWorkers(0).outputPath(Paths.get("out.csv")).build();

    assertThrows(SchemaException.class, () -> options.validate(8));
  }

  @Test
  void missing_output_is_rejected() {
    SchemaException e =
        assertThrows(SchemaException.class, () -> ComputeOptions.builder().build().validate(8));
    assertEquals("Output path should be set.", e.getMessage());
  }

  @Test
  void select_and_exclude_are_exclusive() {
    ComputeOptions options =
        ComputeOptions.builder()
            .outputPath(Paths.get("out.csv"))
            .select(List.of("a"))
            .exclude(List.of("b"))
            .build();

    SchemaException e = assertThrows(SchemaException.class, () -> options.validate(8));
    assertEquals("Can only specify either select or exclude.", e.getMessage());
  }

  // ===== SELECTION =====

  @Test
  void selection_keeps_the_given_order() {
    ComputeOptions options = ComputeOptions.builder().select(List.of("c", "a")).build();

    assertEquals(List.of("c", "a"), options.resolveSelection(SCHEMA));
  }

  @Test
  void exclusion_keeps_schema_order() {
    ComputeOptions options = ComputeOptions.builder().exclude(List.of("b")).build();

    assertEquals(List.of("a", "c"), options.resolveSelection(SCHEMA));
  }

  @Test
  void empty_selection_is_rejected() {
    ComputeOptions options = ComputeOptions.builder().exclude(SCHEMA).build();

    SchemaException e =
        assertThrows(SchemaException.class, () -> options.resolveSelection(SCHEMA));
    assertEquals("Must select at least 1 column.", e.getMessage());
  }
}
