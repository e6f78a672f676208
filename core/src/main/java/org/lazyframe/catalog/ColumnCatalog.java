/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.catalog;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.exception.OperationException;
import org.lazyframe.exception.SchemaException;
import org.lazyframe.planner.logical.ColumnFunction;
import org.lazyframe.planner.logical.ColumnOperation;
import org.lazyframe.planner.logical.OperationPipeline;

/**
 * Column registry of one table.
 *
 * <p>Every column owns a slot, its position in the evaluated row array. Slots {@code
 * 0..sourceWidth-1} are the columns of the file, later slots are created by {@link
 * #operate(ColumnFunction, List, String)}. Slots never move: deleting a column only marks it, and
 * reordering or renaming only changes the logical order and the names. {@link #getColIndex()} is
 * the view every planner consumes.
 */
@Log4j2
public class ColumnCatalog {

  public static final String DEFAULT_DATE_PATTERN = "yyyy-MM-dd";

  private static final class Column {
    private String name;
    private ColumnType type;
    private Function<String, Object> parser;
    private Function<Object, Object> formatter;
    private boolean deleted;

    private Column(String name, ColumnType type) {
      this.name = name;
      this.type = type;
    }
  }

  private final List<Column> slots = new ArrayList<>();
  private final List<Integer> order = new ArrayList<>();
  private final int sourceWidth;
  private final String datePattern;
  private final OperationPipeline operations = new OperationPipeline();

  private ImmutableList<Integer> colIndex;

  private ColumnCatalog(List<String> names, String datePattern) {
    Set<String> seen = new HashSet<>();
    for (String name : names) {
      if (!seen.add(name)) {
        throw new SchemaException("Duplicate column name in header: " + name);
      }
      order.add(slots.size());
      slots.add(new Column(name, ColumnType.STRING));
    }
    this.sourceWidth = names.size();
    this.datePattern = datePattern;
  }

  public static ColumnCatalog of(List<String> names) {
    return of(names, DEFAULT_DATE_PATTERN);
  }

  public static ColumnCatalog of(List<String> names, String datePattern) {
    return new ColumnCatalog(names, datePattern);
  }

  /** Catalog of a headerless file: {@code Col_1..Col_n}. */
  public static ColumnCatalog generated(int width, String datePattern) {
    return of(generatedNames(width), datePattern);
  }

  public static List<String> generatedNames(int width) {
    return IntStream.rangeClosed(1, width).mapToObj(i -> "Col_" + i).collect(Collectors.toList());
  }

  /** Number of columns read from the file. */
  public int getSourceWidth() {
    return sourceWidth;
  }

  /** Length of an evaluated row, tombstoned slots included. */
  public int getSlotCount() {
    return slots.size();
  }

  public String getDatePattern() {
    return datePattern;
  }

  public boolean contains(String name) {
    return findLive(name) >= 0;
  }

  public boolean isFileBacked(int slot) {
    return slot < sourceWidth;
  }

  /**
   * Resolves a live column name to its slot.
   *
   * @throws SchemaException if no live column has that name
   */
  public int resolve(String name) {
    int slot = findLive(name);
    if (slot < 0) {
      throw new SchemaException("Input includes non-existent column name(s): " + name);
    }
    return slot;
  }

  public ImmutableList<Integer> resolveAll(List<String> names) {
    List<String> missing =
        names.stream().filter(n -> findLive(n) < 0).collect(Collectors.toList());
    if (!missing.isEmpty()) {
      throw new SchemaException("Input includes non-existent column name(s): " + missing);
    }
    return names.stream().map(this::findLive).collect(ImmutableList.toImmutableList());
  }

  /** Slots of the live columns in logical order. */
  public ImmutableList<Integer> getColIndex() {
    if (colIndex == null) {
      colIndex =
          order.stream()
              .filter(s -> !slots.get(s).deleted)
              .collect(ImmutableList.toImmutableList());
    }
    return colIndex;
  }

  /** Names of the live columns in logical order. */
  public ImmutableList<String> getColNames() {
    return getColIndex().stream().map(this::nameOf).collect(ImmutableList.toImmutableList());
  }

  public String nameOf(int slot) {
    return slots.get(slot).name;
  }

  public boolean isDeleted(int slot) {
    return slots.get(slot).deleted;
  }

  public ColumnType typeOf(int slot) {
    return slots.get(slot).type;
  }

  /** Parser of a file-backed slot, or null when its text is kept as is. */
  public Function<String, Object> parserOf(int slot) {
    return slots.get(slot).parser;
  }

  /** Parsers of the file-backed slots, indexed by slot. */
  public List<Function<String, Object>> getParsers() {
    List<Function<String, Object>> parsers = new ArrayList<>(sourceWidth);
    for (int slot = 0; slot < sourceWidth; slot++) {
      parsers.add(slots.get(slot).parser);
    }
    return parsers;
  }

  /**
   * Declares the type of a column. File-backed columns are parsed on read; a derived column gets
   * an in-place conversion appended to the operations. The type's formatter is registered as the
   * column's deferred formatter.
   *
   * @param typeSpec tag with an optional pattern, such as {@code "date:dd/MM/yyyy"}
   * @param name the column
   */
  public void setType(String typeSpec, String name) {
    int slot = resolve(name);
    TypeBinding binding = ColumnTypes.resolve(typeSpec, datePattern);
    Column column = slots.get(slot);
    column.type = binding.type();
    column.formatter = binding.formatter();
    if (isFileBacked(slot)) {
      column.parser = binding.parser();
    } else {
      Function<String, Object> parser = binding.parser();
      operations.append(
          ColumnOperation.inPlace(
              args -> args[0] == null ? null : parser.apply(String.valueOf(args[0])), slot));
    }
    invalidate();
  }

  /** Installs a user parser; the column's type becomes {@link ColumnType#RAW}. */
  public void setParser(Function<String, Object> parser, String name) {
    int slot = resolve(name);
    Column column = slots.get(slot);
    column.type = ColumnType.RAW;
    if (isFileBacked(slot)) {
      column.parser = parser;
    } else {
      operations.append(
          ColumnOperation.inPlace(
              args -> args[0] == null ? null : parser.apply(String.valueOf(args[0])), slot));
    }
  }

  public void setFormatter(Function<Object, Object> formatter, String name) {
    slots.get(resolve(name)).formatter = formatter;
  }

  /** Appends an in-place operation on {@code name}. */
  public void operate(ColumnFunction function, String name) {
    int slot = resolveForOperation(name);
    operations.append(ColumnOperation.inPlace(function, slot));
  }

  /**
   * Appends an operation reading {@code inputs} and writing the new column {@code newName}.
   *
   * @return the slot of the new column
   */
  public int operate(ColumnFunction function, List<String> inputs, String newName) {
    ImmutableList<Integer> inputSlots =
        inputs.stream().map(this::resolveForOperation).collect(ImmutableList.toImmutableList());
    if (contains(newName)) {
      throw new SchemaException("New column should not be an existing column name: " + newName);
    }
    int slot = slots.size();
    slots.add(new Column(newName, ColumnType.RAW));
    order.add(liveCount(), slot);
    operations.append(new ColumnOperation(function, inputSlots, slot, true));
    invalidate();
    return slot;
  }

  /** Tombstones the given columns. Slots are kept and nothing is renumbered. */
  public void delCol(List<String> names) {
    ImmutableList<Integer> targets = resolveAll(names);
    targets.forEach(slot -> slots.get(slot).deleted = true);
    // tombstones trail the live columns
    List<Integer> live = new ArrayList<>();
    List<Integer> dead = new ArrayList<>();
    order.forEach(s -> (slots.get(s).deleted ? dead : live).add(s));
    order.clear();
    order.addAll(live);
    order.addAll(dead);
    invalidate();
    log.debug("Deleted columns {}", names);
  }

  /**
   * Sets a new logical order.
   *
   * @param names exactly the live column names, each once
   */
  public void reorderCol(List<String> names) {
    Set<String> requested = new HashSet<>(names);
    if (requested.size() != names.size() || !requested.equals(new HashSet<>(getColNames()))) {
      throw new SchemaException(
          "Set of input in reorder-col contains column(s) that do not exist in dataframe.");
    }
    List<Integer> tombstones =
        order.stream().filter(s -> slots.get(s).deleted).collect(Collectors.toList());
    order.clear();
    names.forEach(n -> order.add(findLive(n)));
    order.addAll(tombstones);
    invalidate();
  }

  /** Renames the live columns positionally. */
  public void renameCol(List<String> names) {
    ImmutableList<Integer> live = getColIndex();
    if (live.size() != names.size()) {
      throw new SchemaException(
          "Number of new column names not equal to number of existing columns.");
    }
    if (new HashSet<>(names).size() != names.size()) {
      throw new SchemaException("New column names must be distinct: " + names);
    }
    for (int i = 0; i < live.size(); i++) {
      slots.get(live.get(i)).name = names.get(i);
    }
    invalidate();
  }

  public OperationPipeline getOperations() {
    return operations;
  }

  /** Registered formatters keyed by slot, live columns only. */
  public ImmutableMap<Integer, Function<Object, Object>> getFormatters() {
    Map<Integer, Function<Object, Object>> formatters = new TreeMap<>();
    for (int slot : getColIndex()) {
      Function<Object, Object> formatter = slots.get(slot).formatter;
      if (formatter != null) {
        formatters.put(slot, formatter);
      }
    }
    return ImmutableMap.copyOf(formatters);
  }

  private int resolveForOperation(String name) {
    if (findLive(name) < 0 && findDeleted(name)) {
      throw new OperationException(
          "Column " + name + " was deleted and cannot be used by a later operation.");
    }
    return resolve(name);
  }

  private int findLive(String name) {
    for (int slot : getColIndex()) {
      if (slots.get(slot).name.equals(name)) {
        return slot;
      }
    }
    return -1;
  }

  private boolean findDeleted(String name) {
    return slots.stream().anyMatch(c -> c.deleted && c.name.equals(name));
  }

  private int liveCount() {
    return getColIndex().size();
  }

  private void invalidate() {
    colIndex = null;
  }
}
