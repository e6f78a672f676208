/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.input;

/**
 * A raw record with its position among the data records of the file.
 *
 * @param id zero-based sequence id, increasing in read order
 * @param values the record's fields
 */
public record SequencedRow(long id, String[] values) {}
