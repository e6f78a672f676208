/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor;

/**
 * A batch or partition the backend could not process.
 *
 * @param partitionId batch or partition identifier
 * @param firstRowId sequence id of the first input row it held, -1 if unknown
 * @param lastRowId sequence id of the last input row it held, -1 if unknown
 * @param message failure message
 */
public record FailedPartition(
    String partitionId, long firstRowId, long lastRowId, String message) {}
