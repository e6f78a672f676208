/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.input;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lazyframe.exception.OperationException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class CsvRowSourceTest {

  @TempDir Path tempDir;

  @Test
  void header_and_records_are_read_separately() throws IOException {
    CsvRowSource source =
        new CsvRowSource(write("a.csv", "Employee,Salary", "X,100", "Y,50"), true);

    assertEquals(List.of("Employee", "Salary"), source.readHeader());
    List<SequencedRow> sample = source.sample(10);
    assertEquals(2, sample.size());
    assertEquals(0L, sample.get(0).id());
    assertArrayEquals(new String[] {"Y", "50"}, sample.get(1).values());
  }

  @Test
  void headerless_file_gets_generated_names() throws IOException {
    CsvRowSource source = new CsvRowSource(write("b.csv", "X,100,HR", "Y,50,IT"), false);

    assertEquals(List.of("Col_1", "Col_2", "Col_3"), source.readHeader());
    assertEquals("X", source.sample(1).get(0).values()[0]);
  }

  @Test
  void tsv_files_are_tab_separated() throws IOException {
    CsvRowSource source = new CsvRowSource(write("c.tsv", "a\tb", "1,5\t2"), true);

    assertArrayEquals(new String[] {"1,5", "2"}, source.sample(1).get(0).values());
  }

  @Test
  void blank_lines_are_skipped() throws IOException {
    CsvRowSource source = new CsvRowSource(write("d.csv", "a", "1", "", "2"), true);

    assertEquals(2, source.sample(10).size());
  }

  @Test
  void reader_recovers_from_a_checkpoint() throws IOException {
    List<String> lines = new ArrayList<>();
    lines.add("n");
    for (int i = 0; i < 20; i++) {
      lines.add(String.valueOf(i));
    }
    CsvRowSource source = new CsvRowSource(write("e.csv", lines.toArray(new String[0])), true);

    try (RowReader reader = source.open(0)) {
      for (int i = 0; i < 7; i++) {
        reader.poll();
      }
      long checkpoint = reader.checkpoint();
      String expected = reader.poll().values()[0];

      reader.recover(checkpoint);

      assertEquals(7L, checkpoint);
      assertEquals(expected, reader.poll().values()[0]);
    }
    try (RowReader reader = source.open(18)) {
      assertEquals("18", reader.poll().values()[0]);
      assertEquals("19", reader.poll().values()[0]);
      assertNull(reader.poll());
      assertTrue(reader.completed());
    }
  }

  @Test
  void checkpointing_can_be_disabled() throws IOException {
    CsvRowSource source = new CsvRowSource(write("f.csv", "a", "1"), true);

    try (RowReader reader = source.open(0, false)) {
      assertNull(reader.checkpoint());
    }
  }

  @Test
  void missing_file_is_reported() {
    CsvRowSource source = new CsvRowSource(tempDir.resolve("missing.csv"), true);

    OperationException e = assertThrows(OperationException.class, source::sizeBytes);
    assertTrue(e.getMessage().startsWith("No such file or directory"));
  }

  private Path write(String name, String... lines) throws IOException {
    return Files.write(tempDir.resolve(name), List.of(lines));
  }
}
