/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.distributed.stage;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Where the rows a stage produces go next. Only hash exchanges carry key channels. */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PartitioningScheme {

  private static final PartitioningScheme GATHER =
      new PartitioningScheme(ExchangeType.GATHER, ImmutableList.of());
  private static final PartitioningScheme NONE =
      new PartitioningScheme(ExchangeType.NONE, ImmutableList.of());

  private final ExchangeType exchangeType;
  private final ImmutableList<Integer> hashChannels;

  public static PartitioningScheme gather() {
    return GATHER;
  }

  public static PartitioningScheme none() {
    return NONE;
  }

  /** Rows with equal values at {@code keyChannels} land in the same partition. */
  public static PartitioningScheme hashRepartition(List<Integer> keyChannels) {
    return new PartitioningScheme(
        ExchangeType.HASH_REPARTITION, ImmutableList.copyOf(keyChannels));
  }

  @Override
  public String toString() {
    return hashChannels.isEmpty() ? exchangeType.name() : exchangeType.name() + hashChannels;
  }
}
