/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.join;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lazyframe.catalog.ColumnCatalog;
import org.lazyframe.exception.SchemaException;
import org.lazyframe.planner.logical.KeyRef;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class JoinPlannerTest {

  private ColumnCatalog employees;
  private ColumnCatalog departments;

  @BeforeEach
  void setUp() {
    employees = ColumnCatalog.of(List.of("Employee", "Department", "Salary"));
    departments = ColumnCatalog.of(List.of("Department", "Manager"));
  }

  // ===== VALIDATION =====

  @Test
  void output_schema_prefixes_both_sides() {
    JoinSpec spec = innerJoin(null);

    assertEquals(
        List.of("1_Employee", "1_Department", "1_Salary", "2_Department", "2_Manager"),
        JoinPlanner.outputSchema(spec));
  }

  @Test
  void custom_prefixes_must_come_in_pairs() {
    SchemaException e = assertThrows(SchemaException.class, () -> innerJoin(List.of("a")));
    assertEquals("The length of col-prefix should be equal to 2.", e.getMessage());
    assertEquals("e_Employee", JoinPlanner.outputSchema(innerJoin(List.of("e", "d"))).get(0));
  }

  @Test
  void key_lists_must_have_equal_length_and_exist() {
    assertThrows(
        SchemaException.class,
        () ->
            JoinPlanner.equiJoin(
                JoinType.INNER,
                employees,
                departments,
                1,
                1,
                on("Department", "Salary"),
                on("Department"),
                null));
    assertThrows(
        SchemaException.class,
        () ->
            JoinPlanner.equiJoin(
                JoinType.INNER,
                employees,
                departments,
                1,
                1,
                on("Dept"),
                on("Department"),
                null));
  }

  @Test
  void missing_frame_is_reported() {
    SchemaException e =
        assertThrows(
            SchemaException.class,
            () ->
                JoinPlanner.equiJoin(
                    JoinType.LEFT, null, departments, 0, 1, List.of(), List.of(), null));
    assertEquals("First two arguments should be dataframes.", e.getMessage());
  }

  @Test
  void right_join_swaps_sides_and_prefixes() {
    JoinSpec spec =
        JoinPlanner.equiJoin(
            JoinType.RIGHT,
            employees,
            departments,
            10,
            20,
            on("Department"),
            on("Department"),
            null);

    assertSame(departments, spec.left());
    assertEquals(List.of("2", "1"), spec.prefixes());
    assertEquals("2_Department", JoinPlanner.outputSchema(spec).get(0));
  }

  @Test
  void as_of_join_checks_roll_columns() {
    ColumnCatalog prices = ColumnCatalog.of(List.of("Ticker", "Day", "Price"));
    ColumnCatalog trades = ColumnCatalog.of(List.of("Ticker", "Day", "Qty"));
    prices.setType("date", "Day");
    trades.setType("int", "Day");

    assertThrows(SchemaException.class, () -> asOf(trades, prices, "Day", "Missing", null));
    assertThrows(SchemaException.class, () -> asOf(trades, prices, "Day", "Day", null));
    trades.setType("date", "Day");
    assertThrows(SchemaException.class, () -> asOf(trades, prices, "Day", "Day", -1));
    assertTrue(asOf(trades, prices, "Day", "Day", 3).keepUnmatched());
  }

  // ===== PLANNING =====

  @Test
  void plan_carries_keys_and_selected_columns_only() {
    JoinPlan plan = JoinPlanner.plan(innerJoin(null), List.of("2_Manager", "1_Employee"));

    assertEquals(List.of(0, 1), plan.leftCarried());
    assertEquals(List.of(0, 1), plan.rightCarried());
    assertEquals(List.of(1), plan.leftKeys());
    assertEquals(List.of(3, 0), plan.writeIndex());
    assertEquals(List.of("2_Manager", "1_Employee"), plan.outputNames());
  }

  @Test
  void inner_join_builds_the_smaller_side() {
    JoinSpec smallLeft =
        JoinPlanner.equiJoin(
            JoinType.INNER, employees, departments, 5, 50, keys(), keys(), null);
    JoinSpec largeLeft =
        JoinPlanner.equiJoin(
            JoinType.INNER, employees, departments, 50, 5, keys(), keys(), null);
    JoinSpec left =
        JoinPlanner.equiJoin(JoinType.LEFT, employees, departments, 5, 50, keys(), keys(), null);

    assertTrue(JoinPlanner.plan(smallLeft, null).buildLeft());
    assertFalse(JoinPlanner.plan(largeLeft, null).buildLeft());
    assertFalse(JoinPlanner.plan(left, null).buildLeft());
  }

  @Test
  void plan_rejects_names_outside_the_combined_schema() {
    assertThrows(
        SchemaException.class, () -> JoinPlanner.plan(innerJoin(null), List.of("Employee")));
  }

  @Test
  void deleting_a_key_after_declaring_the_join_fails_planning() {
    JoinSpec spec = innerJoin(null);
    employees.delCol(List.of("Department"));

    assertThrows(SchemaException.class, () -> JoinPlanner.plan(spec, null));
  }

  private JoinSpec innerJoin(List<String> prefixes) {
    return JoinPlanner.equiJoin(
        JoinType.INNER, employees, departments, 10, 20, keys(), keys(), prefixes);
  }

  private JoinSpec asOf(
      ColumnCatalog a, ColumnCatalog b, String aRoll, String bRoll, Number limit) {
    return JoinPlanner.asOfJoin(
        JoinType.ASOF_BACKWARD,
        a,
        b,
        1,
        1,
        on("Ticker"),
        on("Ticker"),
        aRoll,
        bRoll,
        limit,
        true,
        null);
  }

  private static List<KeyRef> keys() {
    return on("Department");
  }

  private static List<KeyRef> on(String... columns) {
    List<KeyRef> keys = new ArrayList<>();
    for (String column : columns) {
      keys.add(KeyRef.of(column));
    }
    return keys;
  }
}
