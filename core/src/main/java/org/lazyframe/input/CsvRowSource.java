/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.input;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.Getter;
import org.lazyframe.catalog.ColumnCatalog;
import org.lazyframe.exception.OperationException;

/**
 * A delimited file read as a sequence of records. Files ending in {@code .tsv} are tab
 * separated, everything else comma separated.
 */
public class CsvRowSource {

  @Getter private final Path path;
  @Getter private final boolean haveHeader;

  public CsvRowSource(Path path, boolean haveHeader) {
    this.path = path;
    this.haveHeader = haveHeader;
  }

  /**
   * Column names of the file: the header record, or {@code Col_1..Col_n} sized on the first record
   * when the file has no header.
   */
  public List<String> readHeader() {
    try (CSVReader reader = openReader()) {
      String[] first = reader.readNext();
      if (first == null) {
        return List.of();
      }
      return haveHeader ? Arrays.asList(first) : ColumnCatalog.generatedNames(first.length);
    } catch (IOException | CsvValidationException e) {
      throw new OperationException("Failed to read header of " + path, e);
    }
  }

  /** The first {@code n} data records. */
  public List<SequencedRow> sample(int n) {
    List<SequencedRow> rows = new ArrayList<>(n);
    try (RowReader reader = open(0)) {
      SequencedRow row;
      while (rows.size() < n && (row = reader.poll()) != null) {
        rows.add(row);
      }
    }
    return rows;
  }

  /** Reader positioned after the first {@code offset} data records, checkpointing enabled. */
  public RowReader open(long offset) {
    return open(offset, true);
  }

  public RowReader open(long offset, boolean checkpointing) {
    RowReader reader = new RowReader(this, checkpointing);
    reader.recover(offset);
    return reader;
  }

  public long sizeBytes() {
    try {
      return Files.size(path);
    } catch (IOException e) {
      throw new OperationException("No such file or directory: " + path, e);
    }
  }

  /** Field separator of the file: tab for {@code .tsv}, comma otherwise. */
  public char getSeparator() {
    return path.toString().endsWith(".tsv") ? '\t' : ',';
  }

  CSVReader openReader() throws IOException {
    return new CSVReaderBuilder(Files.newBufferedReader(path, StandardCharsets.UTF_8))
        .withCSVParser(new CSVParserBuilder().withSeparator(getSeparator()).build())
        .build();
  }
}
