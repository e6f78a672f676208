/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.sort;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lazyframe.catalog.ColumnCatalog;
import org.lazyframe.exception.OperationException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExternalSorterTest {

  @TempDir Path tempDir;

  @Test
  void sorted_output_matches_an_in_memory_sort() throws IOException {
    Random random = new Random(3);
    List<String> records = new ArrayList<>();
    for (int i = 0; i < 250; i++) {
      records.add("e" + i + "," + random.nextInt(50));
    }
    Path input = write("salaries.csv", "Employee,Salary", records);
    Path output = tempDir.resolve("sorted.csv");
    ColumnCatalog catalog = ColumnCatalog.of(List.of("Employee", "Salary"));
    catalog.setType("int", "Salary");
    RowComparator comparator =
        new RowComparator(SortSpec.parse(List.of("+", "Salary"), catalog), catalog.getParsers());

    ExternalSorter sorter = new ExternalSorter(comparator, 17, tempDir.resolve("spill"));
    long written = sorter.sort(input, true, output);

    List<String> lines = Files.readAllLines(output);
    assertEquals(250L, written);
    assertEquals("Employee,Salary", lines.get(0));
    List<Integer> sortedSalaries =
        lines.subList(1, lines.size()).stream()
            .map(line -> Integer.parseInt(line.split(",")[1]))
            .collect(Collectors.toList());
    List<Integer> expected =
        records.stream()
            .map(line -> Integer.parseInt(line.split(",")[1]))
            .sorted(Comparator.naturalOrder())
            .collect(Collectors.toList());
    assertEquals(expected, sortedSalaries);
    assertEquals(
        records.stream().sorted().collect(Collectors.toList()),
        lines.subList(1, lines.size()).stream().sorted().collect(Collectors.toList()));
  }

  @Test
  void headerless_files_sort_every_record() throws IOException {
    Path input = write("plain.csv", null, List.of("b,2", "a,1", "c,3"));
    Path output = tempDir.resolve("plain-sorted.csv");
    ColumnCatalog catalog = ColumnCatalog.generated(2, ColumnCatalog.DEFAULT_DATE_PATTERN);
    RowComparator comparator =
        new RowComparator(SortSpec.parse(List.of("-", "Col_1"), catalog), catalog.getParsers());

    new ExternalSorter(comparator, 2, tempDir).sort(input, false, output);

    assertEquals(List.of("c,3", "b,2", "a,1"), Files.readAllLines(output));
  }

  @Test
  void tab_separated_files_are_sorted_on_their_fields() throws IOException {
    Path input = write("levels.tsv", "a\tb", List.of("x\t3", "y\t1", "z\t2"));
    Path output = tempDir.resolve("levels-sorted.tsv");
    ColumnCatalog catalog = ColumnCatalog.of(List.of("a", "b"));
    catalog.setType("int", "b");
    RowComparator comparator =
        new RowComparator(SortSpec.parse(List.of("+", "b"), catalog), catalog.getParsers());

    new ExternalSorter(comparator, 2, tempDir.resolve("spill"), '\t').sort(input, true, output);

    assertEquals(List.of("a\tb", "y\t1", "z\t2", "x\t3"), Files.readAllLines(output));
  }

  @Test
  void blank_lines_are_not_sorted_as_records() throws IOException {
    Path input = write("gaps.csv", "k,v", List.of("b,2", "", "a,1", "", "c,3"));
    Path output = tempDir.resolve("gaps-sorted.csv");
    ColumnCatalog catalog = ColumnCatalog.of(List.of("k", "v"));
    RowComparator comparator =
        new RowComparator(SortSpec.parse(List.of("+", "k"), catalog), catalog.getParsers());

    long written = new ExternalSorter(comparator, 10, tempDir).sort(input, true, output);

    assertEquals(3L, written);
    assertEquals(List.of("k,v", "a,1", "b,2", "c,3"), Files.readAllLines(output));
  }

  @Test
  void unparsable_key_value_fails_as_an_operation_error() throws IOException {
    List<String> records = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      records.add("r" + i + "," + i);
    }
    records.add("bad,oops");
    Path input = write("broken.csv", "a,b", records);
    Path spill = tempDir.resolve("broken-spill");
    ColumnCatalog catalog = ColumnCatalog.of(List.of("a", "b"));
    catalog.setType("int", "b");
    RowComparator comparator =
        new RowComparator(SortSpec.parse(List.of("-", "b"), catalog), catalog.getParsers());

    OperationException e =
        assertThrows(
            OperationException.class,
            () -> new ExternalSorter(comparator, 8, spill).sort(input, true, tempDir.resolve("o")));

    assertTrue(e.getMessage().startsWith("Error in sorting " + input + " (original error:"));
    assertInstanceOf(NumberFormatException.class, e.getCause());
    try (Stream<Path> runs = Files.list(spill)) {
      assertFalse(runs.findAny().isPresent());
    }
  }

  private Path write(String name, String header, List<String> records) throws IOException {
    List<String> lines = new ArrayList<>();
    if (header != null) {
      lines.add(header);
    }
    lines.addAll(records);
    return Files.write(tempDir.resolve(name), lines);
  }
}
