/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.planner.join;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.catalog.ColumnCatalog;
import org.lazyframe.catalog.ColumnType;
import org.lazyframe.exception.SchemaException;
import org.lazyframe.planner.logical.KeyRef;

/**
 * Validates joins and computes their combined schema and per-side index remapping. Output columns
 * are named {@code prefix_name}, left side first.
 */
@Log4j2
public final class JoinPlanner {

  public static final ImmutableList<String> DEFAULT_PREFIXES = ImmutableList.of("1", "2");

  private JoinPlanner() {}

  /**
   * Validates an inner, left or right join. A right join is returned as a left join with sides,
   * keys and prefixes swapped.
   */
  public static JoinSpec equiJoin(
      JoinType type,
      ColumnCatalog a,
      ColumnCatalog b,
      long aSize,
      long bSize,
      List<KeyRef> aKeys,
      List<KeyRef> bKeys,
      List<String> prefixes) {
    if (type.isAsOf()) {
      throw new IllegalArgumentException("Use asOfJoin for " + type);
    }
    validateKeys(a, b, aKeys, bKeys);
    if (aKeys.isEmpty()) {
      throw new SchemaException("At least one join key is required.");
    }
    List<String> resolvedPrefixes = validatePrefixes(prefixes);
    if (type == JoinType.RIGHT) {
      return new JoinSpec(
          type,
          b,
          a,
          bSize,
          aSize,
          ImmutableList.copyOf(bKeys),
          ImmutableList.copyOf(aKeys),
          null,
          null,
          null,
          true,
          ImmutableList.of(resolvedPrefixes.get(1), resolvedPrefixes.get(0)));
    }
    return new JoinSpec(
        type,
        a,
        b,
        aSize,
        bSize,
        ImmutableList.copyOf(aKeys),
        ImmutableList.copyOf(bKeys),
        null,
        null,
        null,
        true,
        ImmutableList.copyOf(resolvedPrefixes));
  }

  /**
   * Validates an as-of join. Both roll columns must exist and hold mutually comparable types.
   *
   * @param limit maximum roll distance of a match, or null for unbounded
   * @param keepUnmatched keep left rows without a match, null-padded
   */
  public static JoinSpec asOfJoin(
      JoinType type,
      ColumnCatalog a,
      ColumnCatalog b,
      long aSize,
      long bSize,
      List<KeyRef> aKeys,
      List<KeyRef> bKeys,
      String aRoll,
      String bRoll,
      Number limit,
      boolean keepUnmatched,
      List<String> prefixes) {
    if (!type.isAsOf()) {
      throw new IllegalArgumentException("Not an as-of join: " + type);
    }
    validateKeys(a, b, aKeys, bKeys);
    if (aRoll == null || bRoll == null) {
      throw new SchemaException("Rolling keys should be strings");
    }
    if (!a.contains(aRoll) || !b.contains(bRoll)) {
      throw new SchemaException("Rolling keys include non-existent column name(s).");
    }
    ColumnType aType = a.typeOf(a.resolve(aRoll));
    ColumnType bType = b.typeOf(b.resolve(bRoll));
    if (!aType.isComparableWith(bType)) {
      throw new SchemaException(
          "Rolling keys are not comparable: " + aRoll + " is " + aType + ", " + bRoll + " is "
              + bType);
    }
    if (limit != null && limit.doubleValue() < 0) {
      throw new SchemaException("Rolling join limit must not be negative: " + limit);
    }
    return new JoinSpec(
        type,
        a,
        b,
        aSize,
        bSize,
        ImmutableList.copyOf(aKeys),
        ImmutableList.copyOf(bKeys),
        aRoll,
        bRoll,
        limit,
        keepUnmatched,
        ImmutableList.copyOf(validatePrefixes(prefixes)));
  }

  /** Combined schema of the join: every live left column, then every live right column. */
  public static ImmutableList<String> outputSchema(JoinSpec spec) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    spec.left().getColNames().forEach(n -> names.add(spec.prefixes().get(0) + "_" + n));
    spec.right().getColNames().forEach(n -> names.add(spec.prefixes().get(1) + "_" + n));
    return names.build();
  }

  /**
   * Plans the join for the given output selection.
   *
   * @param select output names, or null/empty for the whole combined schema
   * @throws SchemaException if a selected name is not in the combined schema, or a key column
   *     was deleted since the join was declared
   */
  public static JoinPlan plan(JoinSpec spec, List<String> select) {
    ColumnCatalog left = spec.left();
    ColumnCatalog right = spec.right();
    ImmutableList<String> schema = outputSchema(spec);
    List<Integer> schemaSlots = new ArrayList<>(left.getColIndex());
    schemaSlots.addAll(right.getColIndex());
    int leftWidth = left.getColIndex().size();

    List<String> output = select == null || select.isEmpty() ? schema : select;
    List<String> missing = new ArrayList<>();
    output.stream().filter(n -> !schema.contains(n)).forEach(missing::add);
    if (!missing.isEmpty()) {
      throw new SchemaException("Input includes non-existent column name(s): " + missing);
    }

    ImmutableList<Integer> leftKeySlots = left.resolveAll(columns(spec.leftKeys()));
    ImmutableList<Integer> rightKeySlots = right.resolveAll(columns(spec.rightKeys()));
    int leftRollSlot = spec.leftRoll() == null ? -1 : left.resolve(spec.leftRoll());
    int rightRollSlot = spec.rightRoll() == null ? -1 : right.resolve(spec.rightRoll());

    TreeSet<Integer> leftSet = new TreeSet<>(leftKeySlots);
    TreeSet<Integer> rightSet = new TreeSet<>(rightKeySlots);
    if (leftRollSlot >= 0) {
      leftSet.add(leftRollSlot);
      rightSet.add(rightRollSlot);
    }
    for (String name : output) {
      int position = schema.indexOf(name);
      (position < leftWidth ? leftSet : rightSet).add(schemaSlots.get(position));
    }
    ImmutableList<Integer> leftCarried = ImmutableList.copyOf(leftSet);
    ImmutableList<Integer> rightCarried = ImmutableList.copyOf(rightSet);

    ImmutableList<Integer> writeIndex =
        output.stream()
            .map(
                name -> {
                  int position = schema.indexOf(name);
                  int slot = schemaSlots.get(position);
                  return position < leftWidth
                      ? leftCarried.indexOf(slot)
                      : leftCarried.size() + rightCarried.indexOf(slot);
                })
            .collect(ImmutableList.toImmutableList());

    boolean buildLeft = spec.type() == JoinType.INNER && spec.leftSize() < spec.rightSize();
    JoinPlan plan =
        new JoinPlan(
            spec.type(),
            leftCarried,
            rightCarried,
            positions(leftKeySlots, leftCarried),
            positions(rightKeySlots, rightCarried),
            functions(spec.leftKeys()),
            functions(spec.rightKeys()),
            leftRollSlot < 0 ? -1 : leftCarried.indexOf(leftRollSlot),
            rightRollSlot < 0 ? -1 : rightCarried.indexOf(rightRollSlot),
            rekey(left.getFormatters(), leftCarried),
            rekey(right.getFormatters(), rightCarried),
            ImmutableList.copyOf(output),
            writeIndex,
            buildLeft,
            spec.limit(),
            spec.keepUnmatched());
    log.info(
        "Planned {} join: leftCarried={}, rightCarried={}, buildLeft={}",
        spec.type(),
        leftCarried,
        rightCarried,
        buildLeft);
    return plan;
  }

  private static void validateKeys(
      ColumnCatalog a, ColumnCatalog b, List<KeyRef> aKeys, List<KeyRef> bKeys) {
    if (a == null || b == null) {
      throw new SchemaException("First two arguments should be dataframes.");
    }
    if (aKeys.size() != bKeys.size()) {
      throw new SchemaException("The length of left keys and right keys should be equal.");
    }
    a.resolveAll(columns(aKeys));
    b.resolveAll(columns(bKeys));
  }

  private static List<String> columns(List<KeyRef> keys) {
    return keys.stream().map(KeyRef::column).collect(Collectors.toList());
  }

  private static ImmutableList<Function<Object, Object>> functions(List<KeyRef> keys) {
    return keys.stream().map(KeyRef::collation).collect(ImmutableList.toImmutableList());
  }

  private static List<String> validatePrefixes(List<String> prefixes) {
    List<String> resolved = prefixes == null ? DEFAULT_PREFIXES : prefixes;
    if (resolved.size() != 2) {
      throw new SchemaException("The length of col-prefix should be equal to 2.");
    }
    return resolved;
  }

  private static ImmutableList<Integer> positions(
      List<Integer> slots, ImmutableList<Integer> carried) {
    return slots.stream().map(carried::indexOf).collect(ImmutableList.toImmutableList());
  }

  private static ImmutableMap<Integer, Function<Object, Object>> rekey(
      Map<Integer, Function<Object, Object>> formatters, ImmutableList<Integer> carried) {
    ImmutableMap.Builder<Integer, Function<Object, Object>> rekeyed = ImmutableMap.builder();
    formatters.forEach(
        (slot, formatter) -> {
          int position = carried.indexOf(slot);
          if (position >= 0) {
            rekeyed.put(position, formatter);
          }
        });
    return rekeyed.build();
  }
}
