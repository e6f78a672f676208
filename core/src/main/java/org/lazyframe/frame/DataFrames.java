/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.frame;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.catalog.ColumnCatalog;
import org.lazyframe.common.setting.LazyFrameSettings;
import org.lazyframe.common.setting.Settings;
import org.lazyframe.common.setting.SettingsLoader;
import org.lazyframe.exception.SchemaException;
import org.lazyframe.executor.preview.PreviewDryRun;
import org.lazyframe.input.CsvRowSource;
import org.lazyframe.planner.join.JoinPlanner;
import org.lazyframe.planner.join.JoinSpec;
import org.lazyframe.planner.join.JoinType;
import org.lazyframe.planner.logical.KeyRef;

/** Entry points: open a file as a {@link DataFrame}, and join two of them. */
@Log4j2
public final class DataFrames {

  private DataFrames() {}

  public static DataFrame dataframe(Path path) {
    return dataframe(path, true);
  }

  public static DataFrame dataframe(Path path, boolean haveHeader) {
    return dataframe(path, haveHeader, new SettingsLoader().loadDefault());
  }

  /**
   * Opens a delimited file. Only the first record is read; nothing else is touched until the frame
   * is previewed or evaluated.
   *
   * @param haveHeader whether the first record holds the column names; otherwise columns are
   *     named {@code Col_1..Col_n}
   * @throws org.lazyframe.exception.OperationException if the file cannot be read
   * @throws SchemaException if the header repeats a column name
   */
  public static DataFrame dataframe(Path path, boolean haveHeader, Settings settings) {
    CsvRowSource source = new CsvRowSource(path, haveHeader);
    source.sizeBytes();
    ColumnCatalog catalog =
        ColumnCatalog.of(source.readHeader(), settings.get(LazyFrameSettings.DATE_PATTERN));
    DataFrame frame = new DataFrame(source, catalog, settings);
    log.debug("Opened {} with columns {}", path, catalog.getColNames());
    frame.errorPredetect("invalid arguments passed to dataframe function");
    return frame;
  }

  public static JoinedDataFrame innerJoin(
      LazyFrame a, LazyFrame b, List<String> aKeys, List<String> bKeys) {
    return innerJoin(a, b, aKeys, bKeys, null);
  }

  /** Rows of {@code a} and {@code b} with equal keys. Null keys never match. */
  public static JoinedDataFrame innerJoin(
      LazyFrame a, LazyFrame b, List<String> aKeys, List<String> bKeys, List<String> prefixes) {
    return innerJoinOn(a, b, refs(aKeys), refs(bKeys), prefixes);
  }

  /**
   * Inner join on keys that may transform their column value before matching. Both sides are
   * matched and partitioned on the transformed values.
   */
  public static JoinedDataFrame innerJoinOn(
      LazyFrame a, LazyFrame b, List<KeyRef> aKeys, List<KeyRef> bKeys, List<String> prefixes) {
    return equiJoin(JoinType.INNER, a, b, aKeys, bKeys, prefixes);
  }

  public static JoinedDataFrame leftJoin(
      LazyFrame a, LazyFrame b, List<String> aKeys, List<String> bKeys) {
    return leftJoin(a, b, aKeys, bKeys, null);
  }

  /** Inner join plus every unmatched row of {@code a}, padded with nulls. */
  public static JoinedDataFrame leftJoin(
      LazyFrame a, LazyFrame b, List<String> aKeys, List<String> bKeys, List<String> prefixes) {
    return leftJoinOn(a, b, refs(aKeys), refs(bKeys), prefixes);
  }

  public static JoinedDataFrame leftJoinOn(
      LazyFrame a, LazyFrame b, List<KeyRef> aKeys, List<KeyRef> bKeys, List<String> prefixes) {
    return equiJoin(JoinType.LEFT, a, b, aKeys, bKeys, prefixes);
  }

  public static JoinedDataFrame rightJoin(
      LazyFrame a, LazyFrame b, List<String> aKeys, List<String> bKeys) {
    return rightJoin(a, b, aKeys, bKeys, null);
  }

  /** Left join of {@code b} with {@code a}: the columns of {@code b} come first. */
  public static JoinedDataFrame rightJoin(
      LazyFrame a, LazyFrame b, List<String> aKeys, List<String> bKeys, List<String> prefixes) {
    return rightJoinOn(a, b, refs(aKeys), refs(bKeys), prefixes);
  }

  public static JoinedDataFrame rightJoinOn(
      LazyFrame a, LazyFrame b, List<KeyRef> aKeys, List<KeyRef> bKeys, List<String> prefixes) {
    return equiJoin(JoinType.RIGHT, a, b, aKeys, bKeys, prefixes);
  }

  public static JoinedDataFrame rollingJoinForward(
      LazyFrame a,
      LazyFrame b,
      List<String> aKeys,
      List<String> bKeys,
      String aRoll,
      String bRoll) {
    return rollingJoinForward(a, b, aKeys, bKeys, aRoll, bRoll, null, true, null);
  }

  /**
   * Matches every row of {@code a} to the row of {@code b} with equal keys whose roll value is the
   * smallest one at or above its own.
   *
   * @param limit maximum roll distance of a match, or null for no limit
   * @param keepUnmatched whether rows of {@code a} without a match are kept null-padded
   */
  public static JoinedDataFrame rollingJoinForward(
      LazyFrame a,
      LazyFrame b,
      List<String> aKeys,
      List<String> bKeys,
      String aRoll,
      String bRoll,
      Number limit,
      boolean keepUnmatched,
      List<String> prefixes) {
    return rollingJoinForwardOn(
        a, b, refs(aKeys), refs(bKeys), aRoll, bRoll, limit, keepUnmatched, prefixes);
  }

  public static JoinedDataFrame rollingJoinForwardOn(
      LazyFrame a,
      LazyFrame b,
      List<KeyRef> aKeys,
      List<KeyRef> bKeys,
      String aRoll,
      String bRoll,
      Number limit,
      boolean keepUnmatched,
      List<String> prefixes) {
    return asOfJoin(
        JoinType.ASOF_FORWARD, a, b, aKeys, bKeys, aRoll, bRoll, limit, keepUnmatched, prefixes);
  }

  public static JoinedDataFrame rollingJoinBackward(
      LazyFrame a,
      LazyFrame b,
      List<String> aKeys,
      List<String> bKeys,
      String aRoll,
      String bRoll) {
    return rollingJoinBackward(a, b, aKeys, bKeys, aRoll, bRoll, null, true, null);
  }

  /** Like {@link #rollingJoinForward} but takes the largest roll value at or below. */
  public static JoinedDataFrame rollingJoinBackward(
      LazyFrame a,
      LazyFrame b,
      List<String> aKeys,
      List<String> bKeys,
      String aRoll,
      String bRoll,
      Number limit,
      boolean keepUnmatched,
      List<String> prefixes) {
    return rollingJoinBackwardOn(
        a, b, refs(aKeys), refs(bKeys), aRoll, bRoll, limit, keepUnmatched, prefixes);
  }

  public static JoinedDataFrame rollingJoinBackwardOn(
      LazyFrame a,
      LazyFrame b,
      List<KeyRef> aKeys,
      List<KeyRef> bKeys,
      String aRoll,
      String bRoll,
      Number limit,
      boolean keepUnmatched,
      List<String> prefixes) {
    return asOfJoin(
        JoinType.ASOF_BACKWARD, a, b, aKeys, bKeys, aRoll, bRoll, limit, keepUnmatched, prefixes);
  }

  private static JoinedDataFrame equiJoin(
      JoinType type,
      LazyFrame a,
      LazyFrame b,
      List<KeyRef> aKeys,
      List<KeyRef> bKeys,
      List<String> prefixes) {
    DataFrame left = joinable(a);
    DataFrame right = joinable(b);
    JoinSpec spec =
        JoinPlanner.equiJoin(
            type,
            catalogOf(left),
            catalogOf(right),
            sizeOf(left),
            sizeOf(right),
            aKeys,
            bKeys,
            prefixes);
    return checked(
        type == JoinType.RIGHT
            ? new JoinedDataFrame(spec, right, left)
            : new JoinedDataFrame(spec, left, right));
  }

  private static JoinedDataFrame asOfJoin(
      JoinType type,
      LazyFrame a,
      LazyFrame b,
      List<KeyRef> aKeys,
      List<KeyRef> bKeys,
      String aRoll,
      String bRoll,
      Number limit,
      boolean keepUnmatched,
      List<String> prefixes) {
    DataFrame left = joinable(a);
    DataFrame right = joinable(b);
    JoinSpec spec =
        JoinPlanner.asOfJoin(
            type,
            catalogOf(left),
            catalogOf(right),
            sizeOf(left),
            sizeOf(right),
            aKeys,
            bKeys,
            aRoll,
            bRoll,
            limit,
            keepUnmatched,
            prefixes);
    return checked(new JoinedDataFrame(spec, left, right));
  }

  /** Plain column keys; null passes through so the planner reports it. */
  private static List<KeyRef> refs(List<String> columns) {
    return columns == null ? null : columns.stream().map(KeyRef::of).collect(Collectors.toList());
  }

  /** Null passes through so the planner reports the missing frame. */
  private static DataFrame joinable(LazyFrame frame) {
    if (frame == null) {
      return null;
    }
    if (!(frame instanceof DataFrame)) {
      throw new SchemaException("First two arguments should be dataframes.");
    }
    DataFrame dataFrame = (DataFrame) frame;
    if (dataFrame.getDescriptor().hasAggregation()) {
      throw new SchemaException("Cannot join a dataframe with group-by or aggregation.");
    }
    return dataFrame;
  }

  private static ColumnCatalog catalogOf(DataFrame frame) {
    return frame == null ? null : frame.getCatalog();
  }

  private static long sizeOf(DataFrame frame) {
    return frame == null ? 0L : frame.getSource().sizeBytes();
  }

  private static JoinedDataFrame checked(JoinedDataFrame joined) {
    PreviewDryRun.errorPredetect("invalid arguments passed to join function", joined::preview);
    return joined;
  }
}
