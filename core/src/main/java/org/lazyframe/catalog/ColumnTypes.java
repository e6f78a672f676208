/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.catalog;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.function.Function;
import org.lazyframe.exception.SchemaException;

/**
 * Registry from type specs to {@link TypeBinding}s. A spec is a tag, optionally followed by a
 * pattern: {@code "date:dd/MM/yyyy"}. Blank text parses to {@code null} for every built-in type.
 */
public final class ColumnTypes {

  private ColumnTypes() {}

  public static TypeBinding resolve(String spec, String defaultDatePattern) {
    if (spec == null || spec.isBlank()) {
      throw new SchemaException("Type should be a non-empty string.");
    }
    int colon = spec.indexOf(':');
    String tag = colon < 0 ? spec : spec.substring(0, colon);
    String pattern = colon < 0 ? null : spec.substring(colon + 1);
    ColumnType type =
        ColumnType.fromTag(tag)
            .orElseThrow(
                () ->
                    new SchemaException(
                        "No such type: "
                            + tag
                            + ". You could instead supply your own parsing function with"
                            + " setParser."));
    switch (type) {
      case INT:
        return new TypeBinding(type, blankToNull(text -> Integer.parseInt(text.trim())), v -> v);
      case DOUBLE:
        return new TypeBinding(
            type, blankToNull(text -> Double.parseDouble(text.trim())), v -> v);
      case STRING:
        return new TypeBinding(type, text -> text, v -> v);
      case DATE:
        DateTimeFormatter formatter =
            DateTimeFormatter.ofPattern(pattern == null ? defaultDatePattern : pattern);
        return new TypeBinding(
            type,
            blankToNull(text -> LocalDate.parse(text.trim(), formatter)),
            v -> v instanceof TemporalAccessor ? formatter.format((TemporalAccessor) v) : v);
      case RAW:
      default:
        throw new SchemaException(
            "Type " + tag + " has no built-in parser. Use setParser to supply one.");
    }
  }

  private static Function<String, Object> blankToNull(Function<String, Object> parser) {
    return text -> text == null || text.isBlank() ? null : parser.apply(text);
  }
}
