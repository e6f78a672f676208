/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.input;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import java.io.IOException;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.exception.OperationException;

/**
 * Sequential, resumable reader over the data records of a {@link CsvRowSource}. The checkpoint is
 * the number of records consumed so far; recovering from it reopens the file and skips that many
 * records, so the remaining sequence is the same as if reading had never stopped.
 */
@Log4j2
public class RowReader implements AutoCloseable {

  private final CsvRowSource source;
  private final boolean checkpointing;
  private CSVReader reader;
  private long offset;
  private boolean completed;

  RowReader(CsvRowSource source, boolean checkpointing) {
    this.source = source;
    this.checkpointing = checkpointing;
  }

  /** Next record, or null once the file is exhausted. */
  public SequencedRow poll() {
    if (completed) {
      return null;
    }
    String[] values = readNext();
    if (values == null) {
      completed = true;
      return null;
    }
    return new SequencedRow(offset++, values);
  }

  /** Records consumed so far, or null when checkpointing is disabled. */
  public Long checkpoint() {
    return checkpointing ? offset : null;
  }

  /** Restarts the sequence and skips {@code checkpoint} data records. */
  public void recover(long checkpoint) {
    close();
    try {
      reader = source.openReader();
      if (source.isHaveHeader()) {
        reader.readNext();
      }
    } catch (IOException | CsvValidationException e) {
      throw new OperationException("No such file or directory: " + source.getPath(), e);
    }
    offset = 0;
    completed = false;
    while (offset < checkpoint && poll() != null) {
      // skip
    }
    log.debug("Recovered {} at offset {}", source.getPath(), offset);
  }

  public boolean completed() {
    return completed;
  }

  @Override
  public void close() {
    if (reader != null) {
      try {
        reader.close();
      } catch (IOException e) {
        log.warn("Failed to close reader of {}", source.getPath(), e);
      }
      reader = null;
    }
  }

  private String[] readNext() {
    try {
      String[] values = reader.readNext();
      while (values != null && values.length == 1 && values[0].isEmpty()) {
        values = reader.readNext();
      }
      return values;
    } catch (IOException | CsvValidationException e) {
      throw new OperationException(
          "Failed to read record " + offset + " of " + source.getPath(), e);
    }
  }
}
