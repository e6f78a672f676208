/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.local.executor;

import com.opencsv.CSVWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Writes the header and then evaluated rows as CSV. Null values are written as empty fields. */
class CsvOutputWriter implements Closeable {

  private final CSVWriter writer;
  private final int width;
  private long rowsWritten;

  CsvOutputWriter(Path output, List<String> header) {
    try {
      Path parent = output.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      this.writer = new CSVWriter(Files.newBufferedWriter(output, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot open output " + output, e);
    }
    this.width = header.size();
    writer.writeNext(header.toArray(new String[0]), false);
  }

  void write(Object[] row) {
    String[] record = new String[width];
    for (int i = 0; i < width; i++) {
      record[i] = row[i] == null ? "" : String.valueOf(row[i]);
    }
    writer.writeNext(record, false);
    rowsWritten++;
  }

  void writeAll(List<Object[]> rows) {
    rows.forEach(this::write);
  }

  long getRowsWritten() {
    return rowsWritten;
  }

  @Override
  public void close() throws IOException {
    writer.close();
  }
}
