/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.local.executor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Routes rows to {@code count} spill files by the hash of a key. Rows with equal keys always land
 * in the same partition. A null key goes to partition 0.
 */
class HashPartitions implements AutoCloseable {

  private final List<SpillFile> files;
  private final Function<Object[], Object> keyOf;

  HashPartitions(Path directory, String prefix, int count, Function<Object[], Object> keyOf) {
    this.keyOf = keyOf;
    this.files = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      files.add(new SpillFile(directory, prefix + "-" + i + "-"));
    }
  }

  void add(Object[] row) {
    files.get(partitionOf(keyOf.apply(row), files.size())).append(row);
  }

  void addAll(List<Object[]> rows) {
    rows.forEach(this::add);
  }

  int size() {
    return files.size();
  }

  SpillFile get(int partition) {
    return files.get(partition);
  }

  static int partitionOf(Object key, int count) {
    return key == null ? 0 : Math.floorMod(Objects.hashCode(key), count);
  }

  @Override
  public void close() {
    files.forEach(SpillFile::close);
  }
}
