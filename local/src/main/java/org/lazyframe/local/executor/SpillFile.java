/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.local.executor;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.NotSerializableException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.exception.OperationException;

/**
 * Temporary file holding rows of one hash partition. Rows are appended while scanning and read
 * back once the scan is complete. Values must be serializable.
 */
@Log4j2
class SpillFile implements Closeable {

  private static final int RESET_INTERVAL = 1024;

  private final Path path;
  private ObjectOutputStream out;
  private long rowCount;

  SpillFile(Path directory, String prefix) {
    try {
      Files.createDirectories(directory);
      this.path = Files.createTempFile(directory, prefix, ".spill");
      this.out = new ObjectOutputStream(new BufferedOutputStream(Files.newOutputStream(path)));
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create spill file in " + directory, e);
    }
  }

  void append(Object[] row) {
    try {
      out.writeObject(row);
      if (++rowCount % RESET_INTERVAL == 0) {
        out.reset();
      }
    } catch (NotSerializableException e) {
      throw new OperationException(
          "Value cannot be spilled to disk: " + e.getMessage() + " is not serializable", e);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write spill file " + path, e);
    }
  }

  long getRowCount() {
    return rowCount;
  }

  /** Finishes writing and reads every row back in append order. */
  List<Object[]> readAll() {
    finishWriting();
    List<Object[]> rows = new ArrayList<>((int) Math.min(rowCount, Integer.MAX_VALUE));
    if (rowCount == 0) {
      return rows;
    }
    try (ObjectInputStream in =
        new ObjectInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
      for (long i = 0; i < rowCount; i++) {
        rows.add((Object[]) in.readObject());
      }
    } catch (EOFException e) {
      throw new OperationException("Spill file " + path + " is truncated", e);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read spill file " + path, e);
    } catch (ClassNotFoundException e) {
      throw new OperationException("Cannot read spill file " + path, e);
    }
    return rows;
  }

  @Override
  public void close() {
    finishWriting();
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Failed to delete spill file {}", path, e);
    }
  }

  private void finishWriting() {
    if (out != null) {
      try {
        out.close();
      } catch (IOException e) {
        throw new UncheckedIOException("Cannot flush spill file " + path, e);
      } finally {
        out = null;
      }
    }
  }
}
