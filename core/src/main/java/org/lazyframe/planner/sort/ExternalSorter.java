/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.sort;

import com.google.common.base.Preconditions;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.exception.LazyFrameException;
import org.lazyframe.exception.OperationException;

/**
 * Bounded-memory sort of a delimited file. Records are read in chunks of {@code chunkRows}, each
 * chunk is sorted in memory and spilled as a run, and the runs are k-way merged into the output.
 * Equal records may come out in any order. Runs and output use the input's field separator; blank
 * lines are not records.
 */
@Log4j2
public class ExternalSorter {

  private final Comparator<String[]> comparator;
  private final int chunkRows;
  private final Path spillDirectory;
  private final char separator;

  public ExternalSorter(Comparator<String[]> comparator, int chunkRows, Path spillDirectory) {
    this(comparator, chunkRows, spillDirectory, ICSVWriter.DEFAULT_SEPARATOR);
  }

  public ExternalSorter(
      Comparator<String[]> comparator, int chunkRows, Path spillDirectory, char separator) {
    Preconditions.checkArgument(chunkRows > 0, "chunkRows must be positive: %s", chunkRows);
    this.comparator = comparator;
    this.chunkRows = chunkRows;
    this.spillDirectory = spillDirectory;
    this.separator = separator;
  }

  /**
   * Sorts {@code input} into {@code output}. The header record, when present, is written first.
   *
   * @return number of data records written
   * @throws OperationException if a record cannot be read or a key value cannot be parsed
   */
  public long sort(Path input, boolean hasHeader, Path output) {
    List<Path> runs = new ArrayList<>();
    try (CSVReader reader = reader(input)) {
      String[] header = hasHeader ? nextRecord(reader) : null;
      List<String[]> chunk = new ArrayList<>();
      String[] record;
      while ((record = nextRecord(reader)) != null) {
        chunk.add(record);
        if (chunk.size() >= chunkRows) {
          runs.add(spill(chunk));
          chunk.clear();
        }
      }
      if (!chunk.isEmpty()) {
        runs.add(spill(chunk));
      }
      log.info("Sorting {} into {} run(s)", input, runs.size());
      return merge(runs, header, output);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to sort " + input, e);
    } catch (CsvValidationException e) {
      throw new OperationException("Malformed record in " + input, e);
    } catch (LazyFrameException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new OperationException(
          String.format("Error in sorting %s (original error: %s)", input, e.getMessage()), e);
    } finally {
      runs.forEach(ExternalSorter::deleteQuietly);
    }
  }

  private Path spill(List<String[]> chunk) throws IOException {
    chunk.sort(comparator);
    Files.createDirectories(spillDirectory);
    Path run = Files.createTempFile(spillDirectory, "sort-run-", ".csv");
    try (ICSVWriter writer = writer(run)) {
      for (String[] record : chunk) {
        writer.writeNext(record, false);
      }
    }
    log.debug("Spilled run {} with {} records", run, chunk.size());
    return run;
  }

  private long merge(List<Path> runs, String[] header, Path output)
      throws IOException, CsvValidationException {
    List<CSVReader> readers = new ArrayList<>(runs.size());
    PriorityQueue<RunHead> heads =
        new PriorityQueue<>((a, b) -> comparator.compare(a.record, b.record));
    long written = 0;
    try (ICSVWriter writer = writer(output)) {
      if (header != null) {
        writer.writeNext(header, false);
      }
      for (Path run : runs) {
        CSVReader reader = reader(run);
        readers.add(reader);
        String[] first = reader.readNext();
        if (first != null) {
          heads.add(new RunHead(first, reader));
        }
      }
      while (!heads.isEmpty()) {
        RunHead head = heads.poll();
        writer.writeNext(head.record, false);
        written++;
        String[] next = head.reader.readNext();
        if (next != null) {
          heads.add(new RunHead(next, head.reader));
        }
      }
    } finally {
      for (CSVReader reader : readers) {
        reader.close();
      }
    }
    return written;
  }

  private CSVReader reader(Path file) throws IOException {
    return new CSVReaderBuilder(Files.newBufferedReader(file, StandardCharsets.UTF_8))
        .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
        .build();
  }

  private ICSVWriter writer(Path file) throws IOException {
    return new CSVWriter(
        Files.newBufferedWriter(file, StandardCharsets.UTF_8),
        separator,
        ICSVWriter.DEFAULT_QUOTE_CHARACTER,
        ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
        ICSVWriter.DEFAULT_LINE_END);
  }

  /** Next record of {@code reader}, skipping blank lines. */
  private static String[] nextRecord(CSVReader reader) throws IOException, CsvValidationException {
    String[] record = reader.readNext();
    while (record != null && record.length == 1 && record[0].isEmpty()) {
      record = reader.readNext();
    }
    return record;
  }

  private static void deleteQuietly(Path run) {
    try {
      Files.deleteIfExists(run);
    } catch (IOException e) {
      log.warn("Failed to delete sort run {}", run, e);
    }
  }

  private static final class RunHead {
    private final String[] record;
    private final CSVReader reader;

    private RunHead(String[] record, CSVReader reader) {
      this.record = record;
      this.reader = reader;
    }
  }
}
