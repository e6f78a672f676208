/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.executor;

import java.nio.file.Path;

/**
 * A file-backed table as the backend reads it.
 *
 * @param path the delimited file
 * @param haveHeader whether the first record is a header
 * @param batchSize records per batch handed to a worker
 * @param transform the frozen row evaluation
 */
public record TableSource(Path path, boolean haveHeader, int batchSize, RowTransform transform) {}
