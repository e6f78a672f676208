/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.catalog;

import java.util.function.Function;

/** A type tag bound to the parser that reads it and the formatter that renders it. */
public record TypeBinding(
    ColumnType type, Function<String, Object> parser, Function<Object, Object> formatter) {}
