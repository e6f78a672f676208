/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.lazyframe.exception.SchemaException;

/** Per-evaluation options. */
@Getter
@Builder
@ToString
public class ComputeOptions {

  /** Hard worker limit; a configured maximum can only lower it. */
  public static final int WORKER_LIMIT = 8;

  @Builder.Default private final int numWorkers = 1;
  private final Path outputPath;
  /** Abort on the first failure instead of reporting failed partitions. */
  @Builder.Default private final boolean raiseOnError = false;
  /** Write rows in input order. */
  @Builder.Default private final boolean preserveOrder = true;
  /** Output columns, null for all. Exclusive with {@link #exclude}. */
  private final List<String> select;
  /** Columns left out of the output. Exclusive with {@link #select}. */
  private final List<String> exclude;

  /**
   * Checks the options against the engine limits. The worker count may not exceed {@code
   * maxWorkers} or {@link #WORKER_LIMIT}, whichever is lower.
   *
   * @throws SchemaException on an invalid worker count, a missing output path, or both select and
   *     exclude being set
   */
  public void validate(int maxWorkers) {
    int limit = Math.min(WORKER_LIMIT, maxWorkers);
    if (numWorkers < 1) {
      throw new SchemaException("Number of workers should be a positive integer.");
    }
    if (numWorkers > limit) {
      throw new SchemaException("Max number of worker nodes is " + limit + ".");
    }
    if (outputPath == null) {
      throw new SchemaException("Output path should be set.");
    }
    if (select != null && exclude != null) {
      throw new SchemaException("Can only specify either select or exclude.");
    }
  }

  /**
   * Resolves the output columns against a schema: the selection as given, the schema minus the
   * excluded names, or the whole schema.
   *
   * @throws SchemaException if no column remains
   */
  public ImmutableList<String> resolveSelection(List<String> schema) {
    ImmutableList<String> resolved;
    if (select != null) {
      resolved = ImmutableList.copyOf(select);
    } else if (exclude != null) {
      resolved =
          schema.stream()
              .filter(n -> !exclude.contains(n))
              .collect(ImmutableList.toImmutableList());
    } else {
      resolved = ImmutableList.copyOf(schema);
    }
    if (resolved.isEmpty()) {
      throw new SchemaException("Must select at least 1 column.");
    }
    return resolved;
  }
}
