/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.common.setting;

import java.nio.file.Paths;

/** Setting keys understood by the engine, with their defaults. */
public final class LazyFrameSettings {

  private LazyFrameSettings() {}

  /** Rows per batch handed to a worker. */
  public static final Setting<Integer> BATCH_SIZE = Setting.intSetting("lazyframe.batch_size", 300);

  /** Upper bound on the worker count of one evaluation. Values above 8 count as 8. */
  public static final Setting<Integer> MAX_WORKERS =
      Setting.intSetting("lazyframe.max_workers", 8);

  public static final Setting<Integer> PREVIEW_SAMPLE_SIZE =
      Setting.intSetting("lazyframe.preview.sample_size", 10);

  public static final Setting<Integer> PREVIEW_RETURN_SIZE =
      Setting.intSetting("lazyframe.preview.return_size", 10);

  /** Rows held in memory per sorted run of the external sort. */
  public static final Setting<Integer> SORT_CHUNK_ROWS =
      Setting.intSetting("lazyframe.sort.chunk_rows", 100_000);

  /** Directory for sort runs and partition spill files. */
  public static final Setting<String> SPILL_DIRECTORY =
      Setting.stringSetting(
          "lazyframe.spill.dir",
          Paths.get(System.getProperty("java.io.tmpdir"), "lazyframe").toString());

  /** Hash partitions of grouped aggregates and joins; each must fit in memory. */
  public static final Setting<Integer> SPILL_PARTITIONS =
      Setting.intSetting("lazyframe.spill.partitions", 16);

  public static final Setting<String> DATE_PATTERN =
      Setting.stringSetting("lazyframe.date.pattern", "yyyy-MM-dd");
}
