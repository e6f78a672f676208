/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.local.executor;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.common.setting.LazyFrameSettings;
import org.lazyframe.common.setting.Settings;
import org.lazyframe.common.setting.SettingsLoader;
import org.lazyframe.exception.OperationException;
import org.lazyframe.executor.ComputeOptions;
import org.lazyframe.executor.ExecutionBackend;
import org.lazyframe.executor.ExecutionPlan;
import org.lazyframe.executor.ExecutionResult;

/**
 * Runs plans on a fixed pool of {@code numWorkers} threads of this process. Inputs are streamed in
 * batches; grouped aggregates and joins spill hash partitions under the configured spill
 * directory, so only one partition per worker needs to fit in memory.
 *
 * <p><strong>Execution Flow:</strong>
 *
 * <pre>
 * 1. Validate the stage graph of the plan
 * 2. Open the output file and write the header
 * 3. Run the stages of the plan kind on the worker pool
 * 4. Report written rows and failed partitions
 * </pre>
 */
@Log4j2
public class LocalExecutionBackend implements ExecutionBackend {

  private final Settings settings;

  public LocalExecutionBackend() {
    this(new SettingsLoader().loadDefault());
  }

  public LocalExecutionBackend(Settings settings) {
    this.settings = settings;
  }

  @Override
  public ExecutionResult execute(ExecutionPlan plan) {
    log.info("Starting execution of plan: {}", plan.getPlanId());
    List<String> validationErrors = plan.getStages().validate();
    if (!validationErrors.isEmpty()) {
      String errorMessage = "Plan validation failed: " + String.join(", ", validationErrors);
      log.error(errorMessage);
      throw new OperationException(errorMessage);
    }

    ComputeOptions options = plan.getOptions();
    int workers = options.getNumWorkers();
    ExecutorService pool =
        Executors.newFixedThreadPool(
            workers,
            new ThreadFactoryBuilder()
                .setNameFormat("lazyframe-" + plan.getPlanId() + "-worker-%d")
                .setDaemon(true)
                .build());
    FailureCollector failures = new FailureCollector(options.isRaiseOnError());
    Path output = options.getOutputPath();
    Path spillDirectory =
        Paths.get(settings.get(LazyFrameSettings.SPILL_DIRECTORY)).resolve(plan.getPlanId());
    long rowsWritten;
    try (CsvOutputWriter writer = new CsvOutputWriter(output, plan.getOutputNames())) {
      runnerFor(plan, pool, failures, spillDirectory).run(plan, writer);
      rowsWritten = writer.getRowsWritten();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to finish output " + output, e);
    } catch (RuntimeException e) {
      log.error("Failed execution of plan: {}", plan.getPlanId(), e);
      throw e;
    } finally {
      pool.shutdownNow();
      removeSpillDirectory(spillDirectory);
    }

    ExecutionResult result =
        new ExecutionResult(plan.getPlanId(), output, rowsWritten, failures.getFailures());
    log.info(
        "Finished plan {}: {} row(s) written to {}, {} failed partition(s)",
        plan.getPlanId(),
        rowsWritten,
        output,
        result.getFailures().size());
    return result;
  }

  private StageRunner runnerFor(
      ExecutionPlan plan, ExecutorService pool, FailureCollector failures, Path spillDirectory) {
    ParallelScanner scanner =
        new ParallelScanner(pool, plan.getOptions().getNumWorkers() * 2, failures);
    int partitions = Math.max(1, settings.get(LazyFrameSettings.SPILL_PARTITIONS));
    switch (plan.getKind()) {
      case ROW:
        return new RowStageRunner(scanner);
      case AGGREGATE:
      case GROUP_AGGREGATE:
        return new AggregateStageRunner(scanner, pool, failures, spillDirectory, partitions);
      case JOIN:
        return new JoinStageRunner(scanner, pool, failures, spillDirectory, partitions);
      default:
        throw new IllegalStateException("Unsupported plan kind: " + plan.getKind());
    }
  }

  private static void removeSpillDirectory(Path spillDirectory) {
    try {
      Files.deleteIfExists(spillDirectory);
    } catch (IOException e) {
      log.warn("Failed to remove spill directory {}", spillDirectory, e);
    }
  }
}
