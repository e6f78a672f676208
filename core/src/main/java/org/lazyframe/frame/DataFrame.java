/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.frame;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.catalog.ColumnCatalog;
import org.lazyframe.catalog.ColumnType;
import org.lazyframe.common.setting.LazyFrameSettings;
import org.lazyframe.common.setting.Settings;
import org.lazyframe.exception.OperationException;
import org.lazyframe.exception.SchemaException;
import org.lazyframe.executor.ComputeOptions;
import org.lazyframe.executor.ExecutionBackend;
import org.lazyframe.executor.ExecutionPlan;
import org.lazyframe.executor.ExecutionResult;
import org.lazyframe.executor.PlanKind;
import org.lazyframe.executor.RowTransform;
import org.lazyframe.executor.TableSource;
import org.lazyframe.executor.preview.PreviewDryRun;
import org.lazyframe.input.CsvRowSource;
import org.lazyframe.planner.aggregate.GroupAggregateIndexer;
import org.lazyframe.planner.aggregate.GroupAggregatePlan;
import org.lazyframe.planner.distributed.stage.StagePlanner;
import org.lazyframe.planner.logical.AggregateFunction;
import org.lazyframe.planner.logical.AggregateSpec;
import org.lazyframe.planner.logical.ColumnFunction;
import org.lazyframe.planner.logical.FilterSpec;
import org.lazyframe.planner.logical.GroupKey;
import org.lazyframe.planner.logical.KeyRef;
import org.lazyframe.planner.logical.RowPipelineDescriptor;
import org.lazyframe.planner.logical.RowPredicate;
import org.lazyframe.planner.sort.ExternalSorter;
import org.lazyframe.planner.sort.RowComparator;
import org.lazyframe.planner.sort.SortSpec;

/**
 * A lazily evaluated table backed by one delimited file.
 *
 * <p>Builder calls mutate the table in place and return it. Every mutating call is followed by a
 * preview over a small sample, so a mistake fails at the call that introduced it. A failed preview
 * does not undo the call.
 */
@Log4j2
public class DataFrame implements LazyFrame {

  @Getter private final CsvRowSource source;
  @Getter private final ColumnCatalog catalog;
  @Getter private final RowPipelineDescriptor descriptor;
  @Getter private final Settings settings;

  DataFrame(CsvRowSource source, ColumnCatalog catalog, Settings settings) {
    this.source = source;
    this.catalog = catalog;
    this.descriptor = new RowPipelineDescriptor();
    this.settings = settings;
  }

  public Path getPath() {
    return source.getPath();
  }

  public int getBatchSize() {
    return settings.get(LazyFrameSettings.BATCH_SIZE);
  }

  public DataFrame filter(String column, RowPredicate predicate) {
    return filter(List.of(column), predicate);
  }

  /** Keeps rows for which {@code predicate} holds over the values of {@code columns}. */
  public DataFrame filter(List<String> columns, RowPredicate predicate) {
    descriptor.addFilter(new FilterSpec(catalog.resolveAll(columns), predicate));
    errorPredetect("invalid arguments passed to filter function");
    return this;
  }

  /** Replaces the values of {@code column} by {@code function} of them. */
  public DataFrame operate(ColumnFunction function, String column) {
    catalog.operate(function, column);
    errorPredetect("this function cannot be appended into the current pipeline");
    return this;
  }

  /** Adds column {@code newColumn} computed from the values of {@code columns}. */
  public DataFrame operate(ColumnFunction function, List<String> columns, String newColumn) {
    if (newColumn == null || newColumn.isEmpty()) {
      throw new SchemaException("New column should be a non-empty string.");
    }
    catalog.operate(function, columns, newColumn);
    errorPredetect("this function cannot be appended into the current pipeline");
    return this;
  }

  public DataFrame groupBy(String... columns) {
    List<KeyRef> keys = new ArrayList<>();
    for (String column : columns) {
      keys.add(KeyRef.of(column));
    }
    return groupBy(keys);
  }

  /** Sets the group-by keys, replacing any previous ones. */
  public DataFrame groupBy(List<KeyRef> keys) {
    if (keys == null || keys.isEmpty()) {
      throw new SchemaException("The group-by keys format is not correct.");
    }
    List<String> columns = keys.stream().map(KeyRef::column).collect(Collectors.toList());
    ImmutableList<Integer> slots = catalog.resolveAll(columns);
    List<GroupKey> groupKeys = new ArrayList<>();
    for (int i = 0; i < keys.size(); i++) {
      groupKeys.add(new GroupKey(keys.get(i).collation(), slots.get(i)));
    }
    descriptor.setGroupKeys(groupKeys);
    errorPredetect("invalid arguments passed to groupby function");
    return this;
  }

  public DataFrame aggregate(AggregateFunction function, String column) {
    return aggregate(function, List.of(column), null);
  }

  public DataFrame aggregate(AggregateFunction function, String column, String newName) {
    return aggregate(function, List.of(column), List.of(newName));
  }

  /**
   * Adds one aggregate per source column.
   *
   * @param newNames output names, or null for {@code name(column)}
   */
  public DataFrame aggregate(
      AggregateFunction function, List<String> columns, List<String> newNames) {
    List<String> names =
        newNames != null
            ? newNames
            : columns.stream()
                .map(c -> function.name() + "(" + c + ")")
                .collect(Collectors.toList());
    if (names.size() != columns.size()) {
      throw new SchemaException("Number of new column names not equal to number of columns.");
    }
    ImmutableList<Integer> slots = catalog.resolveAll(columns);
    Set<String> taken = new HashSet<>(catalog.getColNames());
    descriptor.getAggregates().forEach(a -> taken.add(a.newName()));
    for (String name : names) {
      if (!taken.add(name)) {
        throw new SchemaException("New keys should not be existing column names: " + name);
      }
    }
    for (int i = 0; i < slots.size(); i++) {
      descriptor.addAggregate(new AggregateSpec(function, slots.get(i), names.get(i)));
    }
    errorPredetect("invalid arguments passed to aggregate function");
    return this;
  }

  /**
   * Declares a column type such as {@code int}, {@code double}, {@code string} or {@code
   * date:dd/MM/yyyy}.
   */
  public DataFrame setType(String column, String type) {
    catalog.setType(type, column);
    errorPredetect("invalid arguments passed to set-type function");
    return this;
  }

  public DataFrame setParser(String column, Function<String, Object> parser) {
    catalog.setParser(parser, column);
    errorPredetect("invalid arguments passed to set-parser function");
    return this;
  }

  /** Registers a formatter applied to the column's values when rows are written. */
  public DataFrame setFormatter(String column, Function<Object, Object> formatter) {
    catalog.setFormatter(formatter, column);
    errorPredetect("invalid arguments passed to set-formatter function");
    return this;
  }

  public DataFrame deleteCol(List<String> columns) {
    catalog.delCol(columns);
    errorPredetect("invalid arguments passed to delete-col function");
    return this;
  }

  /** Deletes every column not in {@code columns}. */
  public DataFrame selectCol(List<String> columns) {
    catalog.resolveAll(columns);
    List<String> toDelete =
        catalog.getColNames().stream()
            .filter(n -> !columns.contains(n))
            .collect(Collectors.toList());
    return deleteCol(toDelete);
  }

  public DataFrame reorderCol(List<String> columns) {
    catalog.reorderCol(columns);
    errorPredetect("invalid arguments passed to reorder-col function");
    return this;
  }

  public DataFrame renameCol(List<String> columns) {
    catalog.renameCol(columns);
    errorPredetect("invalid arguments passed to rename-col function");
    return this;
  }

  @Override
  public List<String> getColNames() {
    if (descriptor.hasAggregation()) {
      return GroupAggregateIndexer.virtualSchema(catalog, descriptor);
    }
    return catalog.getColNames();
  }

  /** Declared type per live column, in column order. */
  public Map<String, ColumnType> getColTypes() {
    Map<String, ColumnType> types = new LinkedHashMap<>();
    catalog.getColIndex().forEach(slot -> types.put(catalog.nameOf(slot), catalog.typeOf(slot)));
    return types;
  }

  /** The first {@code n} records of the file as read, header included. */
  public List<List<String>> head(int n) {
    if (n < 0) {
      throw new SchemaException("Argument passed to head should be a non-negative integer.");
    }
    List<List<String>> records = new ArrayList<>();
    if (source.isHaveHeader() && n > 0) {
      records.add(source.readHeader());
    }
    source.sample(n - records.size()).forEach(r -> records.add(List.of(r.values())));
    return records;
  }

  @Override
  public List<Map<String, Object>> preview(int sampleSize, int returnSize, boolean format) {
    if (sampleSize < 0 || returnSize < 0) {
      throw new SchemaException("Arguments passed to preview must be non-negative integers.");
    }
    if (descriptor.hasAggregation()) {
      GroupAggregatePlan plan = GroupAggregateIndexer.plan(catalog, descriptor, null);
      return PreviewDryRun.aggregate(
          source.sample(sampleSize),
          catalog.getSourceWidth(),
          RowTransform.freeze(catalog, descriptor, false),
          format ? plan : plan.withoutFormatters(),
          returnSize);
    }
    return PreviewDryRun.rows(
        source.sample(sampleSize),
        catalog.getSourceWidth(),
        RowTransform.freeze(catalog, descriptor, format),
        catalog.getColNames(),
        catalog.getColIndex(),
        returnSize);
  }

  /** Preview with the configured sample and return sizes, formatters off. */
  public List<Map<String, Object>> preview() {
    return preview(
        settings.get(LazyFrameSettings.PREVIEW_SAMPLE_SIZE),
        settings.get(LazyFrameSettings.PREVIEW_RETURN_SIZE),
        false);
  }

  /**
   * Sorts the file by {@code order}, an alternating list of {@code +}/{@code -} and column names,
   * and writes the sorted records to {@code output}.
   *
   * @return number of data records written
   */
  public long sort(List<String> order, Path output) {
    SortSpec spec = SortSpec.parse(order, catalog);
    ExternalSorter sorter =
        new ExternalSorter(
            new RowComparator(spec, catalog.getParsers()),
            settings.get(LazyFrameSettings.SORT_CHUNK_ROWS),
            Paths.get(settings.get(LazyFrameSettings.SPILL_DIRECTORY)),
            source.getSeparator());
    return sorter.sort(source.getPath(), source.isHaveHeader(), output);
  }

  @Override
  public ExecutionPlan plan(ComputeOptions options) {
    options.validate(settings.get(LazyFrameSettings.MAX_WORKERS));
    ImmutableList<String> select = options.resolveSelection(getColNames());
    String planId = FrameSupport.newPlanId();
    ExecutionPlan.ExecutionPlanBuilder builder =
        ExecutionPlan.builder().planId(planId).options(options);

    if (descriptor.hasAggregation()) {
      GroupAggregatePlan groupPlan = GroupAggregateIndexer.plan(catalog, descriptor, select);
      PlanKind kind = descriptor.isGrouped() ? PlanKind.GROUP_AGGREGATE : PlanKind.AGGREGATE;
      builder
          .kind(kind)
          .source(tableSource(false))
          .outputNames(groupPlan.outputNames())
          .groupAggregate(groupPlan)
          .stages(StagePlanner.aggregateStages(planId, groupPlan));
    } else {
      builder
          .kind(PlanKind.ROW)
          .source(tableSource(true))
          .outputNames(select)
          .outputSlots(catalog.resolveAll(select))
          .stages(StagePlanner.rowStages(planId));
    }
    ExecutionPlan plan = builder.build();
    log.info("Created {} plan {} over {}", plan.getKind(), planId, source.getPath());
    return plan;
  }

  @Override
  public ExecutionResult compute(ComputeOptions options, ExecutionBackend backend) {
    return FrameSupport.execute(backend, plan(options));
  }

  /** Frozen source of this table. Formatters run only when rows are written as evaluated. */
  TableSource tableSource(boolean formatted) {
    return new TableSource(
        source.getPath(),
        source.isHaveHeader(),
        getBatchSize(),
        RowTransform.freeze(catalog, descriptor, formatted));
  }

  /**
   * Runs the default preview and rethrows any failure as an {@link OperationException} starting
   * with {@code message}.
   */
  void errorPredetect(String message) {
    PreviewDryRun.errorPredetect(message, this::preview);
  }

  @Override
  public String toString() {
    return "DataFrame{path=" + source.getPath() + ", columns=" + getColNames() + '}';
  }
}
